/*
 * Copyright contributors to tql.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License is distributed on
 * an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package org.tql.numbertheory.datatypes;

import com.google.common.collect.Range;
import com.google.common.primitives.UnsignedLongs;

/**
 * Fixed-width integer kinds.
 *
 * <p>Values of every kind are carried in a Java {@code long}. For {@link #UNSIGNED_LONG} the long
 * is read as an unsigned 64-bit bit pattern; for the narrower kinds it holds the value itself.
 */
public enum IntegerType {
  /** Signed 8-bit integer. */
  BYTE(Byte.SIZE, true),
  /** Signed 16-bit integer. */
  SHORT(Short.SIZE, true),
  /** Signed 32-bit integer. */
  INT(Integer.SIZE, true),
  /** Signed 64-bit integer. */
  LONG(Long.SIZE, true),
  /** Unsigned 8-bit integer. */
  UNSIGNED_BYTE(Byte.SIZE, false),
  /** Unsigned 16-bit integer. */
  UNSIGNED_SHORT(Short.SIZE, false),
  /** Unsigned 32-bit integer. */
  UNSIGNED_INT(Integer.SIZE, false),
  /** Unsigned 64-bit integer. */
  UNSIGNED_LONG(Long.SIZE, false);

  private final int bitSize;
  private final boolean signed;
  private final Range<Long> range;

  IntegerType(final int bitSize, final boolean signed) {
    this.bitSize = bitSize;
    this.signed = signed;
    if (signed) {
      long max = bitSize == Long.SIZE ? Long.MAX_VALUE : (1L << (bitSize - 1)) - 1;
      this.range = Range.closed(-max - 1, max);
    } else if (bitSize == Long.SIZE) {
      // Only the non-negative half is reachable through a signed long argument.
      this.range = Range.atLeast(0L);
    } else {
      this.range = Range.closed(0L, (1L << bitSize) - 1);
    }
  }

  /**
   * Width in bits.
   *
   * @return the number of bits of the representation.
   */
  public int bitSize() {
    return bitSize;
  }

  /**
   * Signedness.
   *
   * @return true if the kind is two's complement signed.
   */
  public boolean isSigned() {
    return signed;
  }

  /**
   * Number of value bits, excluding the sign bit.
   *
   * @return {@code bitSize - 1} for signed kinds, {@code bitSize} otherwise.
   */
  public int digits() {
    return signed ? bitSize - 1 : bitSize;
  }

  /**
   * Range of signed long values representable by this kind.
   *
   * @return the closed range of representable values.
   */
  public Range<Long> range() {
    return range;
  }

  /**
   * Tests whether a signed long value is representable.
   *
   * @param value the value to test
   * @return true if {@code value} fits in this kind.
   */
  public boolean contains(final long value) {
    return range.contains(value);
  }

  /**
   * Checked numeric cast.
   *
   * @param value the value to convert
   * @return {@code value}, unchanged.
   * @throws NumericCastException if {@code value} is not representable by this kind.
   */
  public long checkedCast(final long value) {
    if (!contains(value)) {
      throw new NumericCastException(value + " is out of range for " + this);
    }
    return value;
  }

  /**
   * Compares two values of this kind.
   *
   * @param a left value
   * @param b right value
   * @return 0 if a == b, negative if a &lt; b and positive if a &gt; b.
   */
  public int compare(final long a, final long b) {
    return this == UNSIGNED_LONG ? UnsignedLongs.compare(a, b) : Long.compare(a, b);
  }

  /**
   * Parses the decimal text of a value of this kind.
   *
   * @param text decimal digits, optionally preceded by a sign
   * @return the parsed value.
   * @throws NumberFormatException if {@code text} is not a decimal integer.
   * @throws NumericCastException if the value is not representable by this kind.
   */
  public long parse(final String text) {
    if (this == UNSIGNED_LONG) {
      return UnsignedLongs.parseUnsignedLong(text.startsWith("+") ? text.substring(1) : text);
    }
    return checkedCast(Long.parseLong(text));
  }

  /**
   * Formats a value of this kind as decimal text.
   *
   * @param value the value to format
   * @return its decimal representation.
   */
  public String toString(final long value) {
    return this == UNSIGNED_LONG ? UnsignedLongs.toString(value) : Long.toString(value);
  }
}
