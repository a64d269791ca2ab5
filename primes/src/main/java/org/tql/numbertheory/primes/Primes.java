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

/** Primality by trial division. */
public final class Primes {

  private Primes() {}

  /**
   * Tests whether {@code number} is prime, by trial division up to its square root.
   *
   * @param number the number to test
   * @return true if {@code number} is prime; numbers below 2 are not.
   */
  public static boolean isPrime(final long number) {
    if (number < 2) return false;
    // i <= number / i avoids overflowing i * i near Long.MAX_VALUE.
    for (long i = 2; i <= number / i; i++) {
      if (number % i == 0) return false;
    }
    return true;
  }
}
