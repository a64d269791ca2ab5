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

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;

import com.google.common.primitives.UnsignedLongs;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/** Property-based tests for Numerics public API */
public class NumericsPropertyTest {

  // region Test Data Providers

  @Provide
  Arbitrary<Long> nonNegative() {
    return Arbitraries.longs().between(0, Long.MAX_VALUE);
  }

  @Provide
  Arbitrary<Long> smallBase() {
    return Arbitraries.longs().between(-1000, 1000);
  }

  @Provide
  Arbitrary<Integer> smallExponent() {
    return Arbitraries.integers().between(0, 40);
  }

  @Provide
  Arbitrary<Integer> degree() {
    return Arbitraries.integers().between(1, 80);
  }

  @Provide
  Arbitrary<Integer> oddDegree() {
    return Arbitraries.integers().between(0, 40).map(k -> 2 * k + 1);
  }

  // endregion

  // region Extended Euclid

  @Property
  void property_exgcd_bezoutIdentity(@ForAll final long a, @ForAll final long b) {
    // Act
    ExtendedGcd result = Numerics.exgcd(a, b);

    // Assert - exact identity over the integers
    BigInteger bigA = BigInteger.valueOf(a);
    BigInteger bigB = BigInteger.valueOf(b);
    BigInteger gcd = bigA.gcd(bigB);
    BigInteger combination =
        BigInteger.valueOf(result.x())
            .multiply(bigA)
            .add(BigInteger.valueOf(result.y()).multiply(bigB));
    assertThat(combination).isEqualTo(gcd);
    assertThat(UnsignedLongs.toString(result.gcd())).isEqualTo(gcd.toString());
  }

  @Property
  void property_exgcd_boundedCoefficients(@ForAll final long a, @ForAll final long b) {
    if (a == 0 || b == 0) return;

    // Act
    ExtendedGcd result = Numerics.exgcd(a, b);

    // Assert - |x| <= |b| and |y| <= |a|
    assertThat(BigInteger.valueOf(result.x()).abs())
        .isLessThanOrEqualTo(BigInteger.valueOf(b).abs());
    assertThat(BigInteger.valueOf(result.y()).abs())
        .isLessThanOrEqualTo(BigInteger.valueOf(a).abs());
  }

  // endregion

  // region Exponentiation

  @Property
  void property_pow_matchesRepeatedMultiplication(
      @ForAll("smallBase") final long base, @ForAll("smallExponent") final int exponent) {
    // Arrange - wrapping product, as pow wraps too
    long expected = 1;
    for (int i = 0; i < exponent; i++) {
      expected *= base;
    }

    // Act & Assert
    assertThat(Numerics.pow(base, exponent)).isEqualTo(expected);
  }

  @Property
  void property_pow_matchesBigIntegerModulo2to64(
      @ForAll final long base, @ForAll("smallExponent") final int exponent) {
    long expected = BigInteger.valueOf(base).pow(exponent).longValue();
    assertThat(Numerics.pow(base, exponent)).isEqualTo(expected);
  }

  // endregion

  // region Roots

  @Property
  void property_iroot_isFloorOfRoot(
      @ForAll("nonNegative") final long x, @ForAll("degree") final int n) {
    // Act
    long root = Numerics.iroot(x, n);

    // Assert - root^n <= x < (root + 1)^n
    BigInteger bigX = BigInteger.valueOf(x);
    BigInteger bigRoot = BigInteger.valueOf(root);
    assertThat(bigRoot.pow(n)).isLessThanOrEqualTo(bigX);
    assertThat(bigRoot.add(BigInteger.ONE).pow(n)).isGreaterThan(bigX);
  }

  @Property
  void property_iroot_oddDegreeIsSymmetric(
      @ForAll("nonNegative") final long x, @ForAll("oddDegree") final int n) {
    assertThat(Numerics.iroot(-x, n)).isEqualTo(-Numerics.iroot(x, n));
  }

  @Property
  void property_iroot_exactPowers(
      @ForAll("smallExponent") final int value, @ForAll("degree") final int n) {
    // Arrange - a root whose n-th power fits a signed long
    long candidate = Math.min(Numerics.iroot(Long.MAX_VALUE, n), value);

    // Act & Assert
    assertThat(Numerics.iroot(Numerics.pow(candidate, n), n)).isEqualTo(candidate);
  }

  // endregion
}
