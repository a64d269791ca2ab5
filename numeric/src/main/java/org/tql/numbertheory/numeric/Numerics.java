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

import static org.tql.numbertheory.datatypes.Integers.binaryAccumulate;
import static org.tql.numbertheory.datatypes.Integers.unsignedAbs;

import org.tql.numbertheory.datatypes.DomainException;
import org.tql.numbertheory.datatypes.RingElement;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.primitives.UnsignedLongs;

/** Extended Euclid, binary exponentiation and integer roots over 64-bit integers. */
public final class Numerics {
  // region Internals
  // --------------------------------------------------------------------------

  // ROOT_BOUNDS[n] is the largest y with y^n <= 2^64 - 1, read as unsigned.
  // Entry 1 is 2^64 - 1 itself, entry 64 clamps every larger exponent to 1.
  @VisibleForTesting
  static final long[] ROOT_BOUNDS = {
    0, -1L, 4294967295L, 2642245, 65535, 7131, 1625, 565,
    255, 138, 84, 56, 40, 30, 23, 19,
    15, 13, 11, 10, 9, 8, 7, 6,
    6, 5, 5, 5, 4, 4, 4, 4,
    3, 3, 3, 3, 3, 3, 3, 3,
    3, 2, 2, 2, 2, 2, 2, 2,
    2, 2, 2, 2, 2, 2, 2, 2,
    2, 2, 2, 2, 2, 2, 2, 2,
    1,
  };

  private Numerics() {}

  // --------------------------------------------------------------------------
  // endregion

  // region Extended Euclid
  // --------------------------------------------------------------------------

  /**
   * Extended Euclidean algorithm.
   *
   * <p>Returns {@code (x, y)} with {@code x*a + y*b == gcd(|a|, |b|)}. When both arguments are
   * non-zero the coefficients are bounded: {@code |x| <= |b|} and {@code |y| <= |a|}. {@code
   * exgcd(0, 0)} is {@code (1, 0)}.
   *
   * @param a first integer
   * @param b second integer
   * @return the Bezout coefficients of a and b, with their gcd.
   */
  public static ExtendedGcd exgcd(final long a, final long b) {
    // Magnitudes are unsigned so that Long.MIN_VALUE is handled.
    // xa * |a| + ya * |b| == ta
    // xb * |a| + yb * |b| == tb
    long ta = unsignedAbs(a);
    long tb = unsignedAbs(b);
    long xa = 1;
    long ya = 0;
    long xb = 0;
    long yb = 1;

    while (tb != 0) {
      long q = UnsignedLongs.divide(ta, tb);

      // xc * |a| + yc * |b| == tc
      long tc = ta - q * tb;
      long xc = xa - q * xb;
      long yc = ya - q * yb;

      xa = xb;
      xb = xc;
      ya = yb;
      yb = yc;
      ta = tb;
      tb = tc;
    }

    return new ExtendedGcd(a < 0 ? -xa : xa, b < 0 ? -ya : ya, ta);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Exponentiation
  // --------------------------------------------------------------------------

  /**
   * Integer power by binary exponentiation.
   *
   * <p>Multiplication wraps around on overflow, like Java's {@code *}. A negative exponent returns
   * {@code 1 / base^|exponent|} in integer division, which is exact only for the results 1 and -1.
   *
   * @param base the base
   * @param exponent the exponent, of any sign
   * @return base raised to exponent.
   * @throws ArithmeticException if the exponent is negative and the base is 0.
   */
  public static long pow(final long base, final long exponent) {
    // At the n-th bit, state[1] is base^(2^n) and state[0] the power for the lower n bits.
    long[] state =
        binaryAccumulate(
            unsignedAbs(exponent),
            new long[] {1, base},
            (bit, s) -> {
              if (bit) s[0] *= s[1];
              s[1] *= s[1];
            });
    long result = state[0];
    return exponent < 0 ? 1 / result : result;
  }

  /**
   * Ring element power by binary exponentiation.
   *
   * @param base the base
   * @param exponent the exponent, of any sign
   * @param <E> the ring element type
   * @return base raised to exponent; the inverse of base^|exponent| for negative exponents.
   * @throws DomainException if the exponent is negative and the power is not invertible.
   */
  public static <E extends RingElement<E>> E pow(final E base, final long exponent) {
    PowerState<E> state =
        binaryAccumulate(
            unsignedAbs(exponent), new PowerState<E>(base.one(), base), (bit, s) -> s.update(bit));
    return exponent < 0 ? state.result.inverse() : state.result;
  }

  /**
   * Real power, identical to {@link Math#pow(double, double)}.
   *
   * @param base the base
   * @param exponent the exponent
   * @return base raised to exponent.
   */
  public static double pow(final double base, final double exponent) {
    return Math.pow(base, exponent);
  }

  private static final class PowerState<E extends RingElement<E>> {
    private E result;
    private E power;

    PowerState(final E result, final E power) {
      this.result = result;
      this.power = power;
    }

    void update(final boolean bit) {
      if (bit) result = result.multiply(power);
      power = power.multiply(power);
    }
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Roots
  // --------------------------------------------------------------------------

  /**
   * Integer n-th root.
   *
   * <p>Returns the largest y with {@code y^n <= |x|}, with the sign of x. Odd roots of negative
   * numbers are negative.
   *
   * @param x the radicand
   * @param n the root degree
   * @return the n-th root of x truncated towards zero.
   * @throws DomainException if {@code n <= 0}, or if x is negative and n even.
   */
  public static long iroot(final long x, final int n) {
    if (n <= 0) {
      throw new DomainException("Root degree must be positive, got " + n);
    }
    if (x < 0 && n % 2 == 0) {
      throw new DomainException("Even root of negative number " + x);
    }
    if (n == 1) return x;

    long magnitude = unsignedAbs(x);
    // lo^n <= magnitude < hi^n; only values below hi are ever raised to the n-th power.
    long lo = 0;
    long hi = ROOT_BOUNDS[Math.min(n, ROOT_BOUNDS.length - 1)] + 1;
    while (hi - lo > 1) {
      long mid = lo + (hi - lo) / 2;
      if (UnsignedLongs.compare(pow(mid, n), magnitude) <= 0) {
        lo = mid;
      } else {
        hi = mid;
      }
    }
    return x < 0 ? -lo : lo;
  }

  // --------------------------------------------------------------------------
  // endregion
}
