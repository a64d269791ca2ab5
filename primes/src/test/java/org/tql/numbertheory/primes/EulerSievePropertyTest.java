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
package org.tql.numbertheory.primes;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/** Property-based tests for EulerSieve public API */
public class EulerSievePropertyTest {

  private static final int LIMIT = 100_000;
  private static final EulerSieve SIEVE = new EulerSieve(LIMIT);

  @Provide
  Arbitrary<Long> inRange() {
    return Arbitraries.longs().between(2, LIMIT).flatMap(n -> Arbitraries.of(n, -n));
  }

  @Property
  void property_factorize_productIsMagnitude(@ForAll("inRange") final long number) {
    // Act
    int[] factors = SIEVE.factorize(number).toArray();

    // Assert
    long product = 1;
    for (int i = 0; i < factors.length; i++) {
      product *= factors[i];
      if (i > 0) assertThat(factors[i]).isGreaterThanOrEqualTo(factors[i - 1]);
      assertThat(BigInteger.valueOf(factors[i]).isProbablePrime(30)).isTrue();
    }
    assertThat(product).isEqualTo(Math.abs(number));
  }

  @Property
  void property_minPrimeFactor_isFirstFactor(@ForAll("inRange") final long number) {
    assertThat(SIEVE.minPrimeFactor(number)).isEqualTo(SIEVE.factorize(number).get(0));
  }

  @Property
  void property_primality_agreesWithTrialDivision(@ForAll("inRange") final long number) {
    boolean sievePrime = SIEVE.minPrimeFactor(number) == Math.abs(number);
    assertThat(sievePrime).isEqualTo(Primes.isPrime(Math.abs(number)));
  }
}
