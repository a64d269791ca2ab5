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

import org.tql.numbertheory.datatypes.IntegerType;

import java.math.BigInteger;

import com.google.common.primitives.UnsignedLongs;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/** Property-based tests for Modular and ModularRing */
public class ModularPropertyTest {

  // region Test Data Providers

  @Provide
  Arbitrary<Long> modulus() {
    return Arbitraries.longs().between(1, Integer.MAX_VALUE);
  }

  @Provide
  Arbitrary<Long> unsignedModulus() {
    return Arbitraries.longs().between(1, 0xFFFFFFFFL);
  }

  @Provide
  Arbitrary<Long> exponent() {
    return Arbitraries.longs().between(0, 1_000_000);
  }

  // endregion

  // region Normalization

  @Property
  void property_valueOf_matchesFloorMod(
      @ForAll("modulus") final long modulus, @ForAll final long value) {
    // Arrange
    ModularRing ring = ModularRing.of(modulus);

    // Act
    Modular result = ring.valueOf(value);

    // Assert
    assertThat(result.get()).isEqualTo(Math.floorMod(value, modulus));
  }

  @Property
  void property_unsignedValueOf_matchesRemainder(
      @ForAll("unsignedModulus") final long modulus, @ForAll final long value) {
    // Arrange
    ModularRing ring = ModularRing.of(IntegerType.UNSIGNED_LONG, modulus);

    // Act
    Modular result = ring.valueOf(value);

    // Assert
    assertThat(result.get()).isEqualTo(UnsignedLongs.remainder(value, modulus));
  }

  // endregion

  // region Ring Laws

  @Property
  void property_additiveInverse(@ForAll("modulus") final long modulus, @ForAll final long value) {
    ModularRing ring = ModularRing.of(modulus);
    Modular a = ring.valueOf(value);

    assertThat(a.add(a.negate())).isEqualTo(ring.zero());
    assertThat(a.subtract(a)).isEqualTo(ring.zero());
  }

  @Property
  void property_distributive(
      @ForAll("modulus") final long modulus,
      @ForAll final long x,
      @ForAll final long y,
      @ForAll final long z) {
    ModularRing ring = ModularRing.of(modulus);
    Modular a = ring.valueOf(x);
    Modular b = ring.valueOf(y);
    Modular c = ring.valueOf(z);

    assertThat(a.multiply(b.add(c))).isEqualTo(a.multiply(b).add(a.multiply(c)));
    assertThat(a.add(b)).isEqualTo(b.add(a));
    assertThat(a.multiply(b)).isEqualTo(b.multiply(a));
  }

  @Property
  void property_multiplicationAssociative(
      @ForAll("modulus") final long modulus,
      @ForAll final long x,
      @ForAll final long y,
      @ForAll final long z) {
    assertMultiplicationAssociative(ModularRing.of(modulus), x, y, z);
  }

  @Property
  void property_unsignedMultiplicationAssociative(
      @ForAll("unsignedModulus") final long modulus,
      @ForAll final long x,
      @ForAll final long y,
      @ForAll final long z) {
    assertMultiplicationAssociative(ModularRing.of(IntegerType.UNSIGNED_LONG, modulus), x, y, z);
  }

  @Property
  void property_subtractIsAddNegate(
      @ForAll("modulus") final long modulus, @ForAll final long x, @ForAll final long y) {
    assertSubtractIsAddNegate(ModularRing.of(modulus), x, y);
  }

  @Property
  void property_unsignedSubtractIsAddNegate(
      @ForAll("unsignedModulus") final long modulus, @ForAll final long x, @ForAll final long y) {
    assertSubtractIsAddNegate(ModularRing.of(IntegerType.UNSIGNED_LONG, modulus), x, y);
  }

  private static void assertMultiplicationAssociative(
      final ModularRing ring, final long x, final long y, final long z) {
    // Arrange
    Modular a = ring.valueOf(x);
    Modular b = ring.valueOf(y);
    Modular c = ring.valueOf(z);

    // Act
    Modular left = a.multiply(b.multiply(c));
    Modular right = a.multiply(b).multiply(c);

    // Assert
    assertThat(left).isEqualTo(right);
  }

  private static void assertSubtractIsAddNegate(
      final ModularRing ring, final long x, final long y) {
    // Arrange
    Modular a = ring.valueOf(x);
    Modular b = ring.valueOf(y);

    // Act
    Modular difference = a.subtract(b);

    // Assert
    assertThat(difference).isEqualTo(a.add(b.negate()));
    assertThat(difference.add(b)).isEqualTo(a);
  }

  @Property
  void property_multiply_matchesBigInteger(
      @ForAll("unsignedModulus") final long modulus,
      @ForAll final long x,
      @ForAll final long y) {
    // Arrange
    ModularRing ring = ModularRing.of(IntegerType.UNSIGNED_LONG, modulus);
    BigInteger bigModulus = BigInteger.valueOf(modulus);

    // Act
    Modular product = ring.valueOf(x).multiply(ring.valueOf(y));

    // Assert
    BigInteger expected =
        new BigInteger(UnsignedLongs.toString(x))
            .multiply(new BigInteger(UnsignedLongs.toString(y)))
            .mod(bigModulus);
    assertThat(product.get()).isEqualTo(expected.longValueExact());
  }

  // endregion

  // region Inverse and Power

  @Property
  void property_inverse_whenCoprime(
      @ForAll("modulus") final long modulus, @ForAll final long value) {
    // Arrange
    ModularRing ring = ModularRing.of(modulus);
    Modular a = ring.valueOf(value);
    BigInteger gcd = BigInteger.valueOf(a.get()).gcd(BigInteger.valueOf(modulus));

    // Act & Assert
    if (gcd.equals(BigInteger.ONE)) {
      assertThat(a.multiply(a.inverse())).isEqualTo(ring.one());
    }
  }

  @Property
  void property_pow_matchesModPow(
      @ForAll("modulus") final long modulus,
      @ForAll final long value,
      @ForAll("exponent") final long exponent) {
    // Arrange
    ModularRing ring = ModularRing.of(modulus);
    Modular a = ring.valueOf(value);

    // Act
    Modular result = a.pow(exponent);

    // Assert
    BigInteger expected =
        BigInteger.valueOf(a.get())
            .modPow(BigInteger.valueOf(exponent), BigInteger.valueOf(modulus));
    assertThat(result.get()).isEqualTo(expected.longValueExact());
  }

  // endregion
}
