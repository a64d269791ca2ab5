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

import com.google.common.base.MoreObjects;
import com.google.common.primitives.UnsignedLongs;

/**
 * Bezout coefficients {@code (x, y)} of a pair {@code (a, b)}, with {@code x*a + y*b == gcd}.
 *
 * <p>The gcd is held as an unsigned 64-bit value: {@code gcd(Long.MIN_VALUE, 0)} is 2^63.
 */
public final class ExtendedGcd {
  private final long x;
  private final long y;
  private final long gcd;

  ExtendedGcd(final long x, final long y, final long gcd) {
    this.x = x;
    this.y = y;
    this.gcd = gcd;
  }

  /**
   * Coefficient of {@code a}.
   *
   * @return x
   */
  public long x() {
    return x;
  }

  /**
   * Coefficient of {@code b}.
   *
   * @return y
   */
  public long y() {
    return y;
  }

  /**
   * Greatest common divisor of {@code |a|} and {@code |b|}, as an unsigned long.
   *
   * @return gcd(|a|, |b|)
   */
  public long gcd() {
    return gcd;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof ExtendedGcd)) return false;
    ExtendedGcd other = (ExtendedGcd) obj;
    return x == other.x && y == other.y && gcd == other.gcd;
  }

  @Override
  public int hashCode() {
    int h = Long.hashCode(x);
    h = 31 * h + Long.hashCode(y);
    return 31 * h + Long.hashCode(gcd);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("x", x)
        .add("y", y)
        .add("gcd", UnsignedLongs.toString(gcd))
        .toString();
  }
}
