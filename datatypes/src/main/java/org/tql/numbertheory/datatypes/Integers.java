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

import java.util.function.BiConsumer;

/** Static helpers over long integers shared by the numeric algorithms. */
public final class Integers {

  private Integers() {}

  /**
   * Sign of a value.
   *
   * @param value the value
   * @return -1, 0 or 1.
   */
  public static int sign(final long value) {
    return Long.signum(value);
  }

  /**
   * Magnitude of a value as an unsigned 64-bit integer.
   *
   * <p>{@code unsignedAbs(Long.MIN_VALUE)} is the bit pattern of 2^63, which is exact when read as
   * unsigned.
   *
   * @param value the value
   * @return |value| as an unsigned long.
   */
  public static long unsignedAbs(final long value) {
    return value < 0 ? -value : value;
  }

  /**
   * Number of bits of the magnitude of a value.
   *
   * @param value the value
   * @return the bit width of |value|, 0 for 0.
   */
  public static int bitLength(final long value) {
    return unsignedBitLength(unsignedAbs(value));
  }

  /**
   * Number of bits of an unsigned 64-bit value.
   *
   * @param value the unsigned value
   * @return the position of the highest set bit plus one, 0 for 0.
   */
  public static int unsignedBitLength(final long value) {
    return Long.SIZE - Long.numberOfLeadingZeros(value);
  }

  /**
   * Accumulates state over the bits of {@code binary}.
   *
   * <p>The bits are read as an unsigned 64-bit value, from the lowest to the highest set bit. For
   * each of them {@code operation} receives the bit and the state. Counting the set bits in {@code
   * operation} gives a popcount.
   *
   * @param binary the bits to visit
   * @param initialValue the state, mutated in place by {@code operation}
   * @param operation the step applied for every bit
   * @param <S> type of the state
   * @return {@code initialValue} once every bit has been visited.
   */
  public static <S> S binaryAccumulate(
      final long binary, final S initialValue, final BiConsumer<Boolean, S> operation) {
    long current = binary;
    while (current != 0) {
      operation.accept((current & 1L) != 0, initialValue);
      current >>>= 1;
    }
    return initialValue;
  }
}
