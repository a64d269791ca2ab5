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
package org.tql.numbertheory.numeric;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.tql.numbertheory.datatypes.Integers;
import org.tql.numbertheory.datatypes.IntegerType;
import org.tql.numbertheory.datatypes.ModularOverflowException;

import com.google.common.primitives.UnsignedLongs;

/**
 * Ring of integers modulo a fixed modulus, over a fixed-width integer type.
 *
 * <p>A ring is created once and hands out its {@link Modular} elements. Elements of different rings
 * are never combined. Creating a ring fails when its modulus is too wide for the integer type to
 * hold the sum of two residues. A ring too wide to hold their product can still be created, but
 * multiplying its elements fails.
 */
public final class ModularRing {
  private final IntegerType type;
  private final long modulus;
  private final boolean multiplicationSafe;
  private final Modular zero;
  private final Modular one;

  private ModularRing(final IntegerType type, final long modulus) {
    this.type = type;
    this.modulus = modulus;
    this.multiplicationSafe = Integers.unsignedBitLength(modulus) * 2 <= type.digits();
    this.zero = new Modular(this, 0);
    this.one = new Modular(this, modulus == 1 ? 0 : 1);
  }

  /**
   * Ring of integers modulo {@code modulus}, over {@link IntegerType#LONG}.
   *
   * @param modulus a positive modulus
   * @return the ring Z/modulus.
   * @throws ModularOverflowException if the sum of two residues could overflow.
   */
  public static ModularRing of(final long modulus) {
    return of(IntegerType.LONG, modulus);
  }

  /**
   * Ring of integers modulo {@code modulus}, over the given integer type.
   *
   * <p>For {@link IntegerType#UNSIGNED_LONG} the modulus is read as an unsigned bit pattern.
   *
   * @param type the backing integer type
   * @param modulus a positive modulus, representable in {@code type}
   * @return the ring Z/modulus.
   * @throws org.tql.numbertheory.datatypes.NumericCastException if {@code type} cannot hold the
   *     modulus.
   * @throws IllegalArgumentException if the modulus is not positive.
   * @throws ModularOverflowException if addition of residues could overflow.
   */
  public static ModularRing of(final IntegerType type, final long modulus) {
    checkNotNull(type, "type");
    if (type != IntegerType.UNSIGNED_LONG) {
      type.checkedCast(modulus);
      checkArgument(modulus > 0, "Modulus must be positive, got %s", modulus);
    } else {
      checkArgument(modulus != 0, "Modulus must be positive, got 0");
    }
    int modulusWidth = Integers.unsignedBitLength(modulus);
    if (modulusWidth + 1 > type.digits()) {
      throw new ModularOverflowException(
          "Modular addition may overflow for modulus "
              + type.toString(modulus)
              + " over "
              + type
              + ". Please use larger integer types.");
    }
    return new ModularRing(type, modulus);
  }

  /**
   * The modulus.
   *
   * @return the modulus of this ring.
   */
  public long modulus() {
    return modulus;
  }

  /**
   * The backing integer type.
   *
   * @return the type residues and inputs are expressed in.
   */
  public IntegerType type() {
    return type;
  }

  /**
   * Whether the product of two residues fits the integer type.
   *
   * @return false if multiplying elements of this ring fails.
   */
  public boolean isMultiplicationSafe() {
    return multiplicationSafe;
  }

  public Modular zero() {
    return zero;
  }

  public Modular one() {
    return one;
  }

  /**
   * Element of this ring equivalent to {@code value}.
   *
   * @param value a value of this ring's integer type
   * @return the residue class of {@code value}.
   * @throws org.tql.numbertheory.datatypes.NumericCastException if {@code value} is not
   *     representable in this ring's integer type.
   */
  public Modular valueOf(final long value) {
    return new Modular(this, normalize(value));
  }

  /**
   * Parses the decimal text of a value of this ring's integer type.
   *
   * @param text decimal digits, optionally signed
   * @return the residue class of the parsed value.
   * @throws NumberFormatException if {@code text} is not a decimal integer.
   */
  public Modular parse(final String text) {
    checkNotNull(text, "text");
    return valueOf(type.parse(text.trim()));
  }

  void checkMultiplicationOverflow() {
    if (!multiplicationSafe) {
      throw new ModularOverflowException(
          "Modular multiplication may overflow for modulus "
              + type.toString(modulus)
              + " over "
              + type
              + ". Please use larger integer types.");
    }
  }

  // Canonical representative in [0, modulus) of a value of the ring's type.
  long normalize(final long value) {
    if (type == IntegerType.UNSIGNED_LONG) {
      return UnsignedLongs.compare(value, modulus) < 0
          ? value
          : UnsignedLongs.remainder(value, modulus);
    }
    return residue(type.checkedCast(value));
  }

  // Canonical representative of any signed long, bypassing the type check.
  // The remainder is always smaller than the modulus, so one correction suffices.
  long residue(final long value) {
    long y = value;
    if (y < 0 || y >= modulus) {
      y %= modulus;
      if (y < 0) y += modulus;
    }
    return y;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof ModularRing)) return false;
    ModularRing other = (ModularRing) obj;
    return type == other.type && modulus == other.modulus;
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + Long.hashCode(modulus);
  }

  @Override
  public String toString() {
    return "Z/" + type.toString(modulus) + " (" + type + ")";
  }
}
