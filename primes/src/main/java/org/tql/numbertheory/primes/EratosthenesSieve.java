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

import static com.google.common.base.Preconditions.checkArgument;

import org.tql.numbertheory.datatypes.OutOfRangeException;

import java.util.BitSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Sieve of Eratosthenes: a primality table for every number up to an inclusive limit. */
public final class EratosthenesSieve {
  private static final Logger LOG = LogManager.getLogger(EratosthenesSieve.class);

  private final int limit;
  private final BitSet composite;

  /**
   * Builds the primality table of {@code [0, limit]}.
   *
   * @param limit the largest number covered, inclusive
   * @throws IllegalArgumentException if the limit is negative or above {@link
   *     EulerSieve#MAX_LIMIT}.
   */
  public EratosthenesSieve(final int limit) {
    checkArgument(limit >= 0, "Sieve limit must not be negative, got %s", limit);
    checkArgument(
        limit <= EulerSieve.MAX_LIMIT, "Sieve limit %s exceeds %s", limit, EulerSieve.MAX_LIMIT);
    this.limit = limit;
    this.composite = new BitSet(limit + 1);
    composite.set(0, Math.min(2, limit + 1));
    for (long i = 2; i * i <= limit; i++) {
      if (composite.get((int) i)) continue;
      for (long j = i * i; j <= limit; j += i) {
        composite.set((int) j);
      }
    }
    LOG.debug("Eratosthenes sieve up to {} built", limit);
  }

  /**
   * The largest number covered, inclusive.
   *
   * @return the limit given at construction.
   */
  public int limit() {
    return limit;
  }

  /**
   * Primality lookup.
   *
   * @param number the number to test
   * @return true if {@code number} is prime; negative numbers are never prime.
   * @throws OutOfRangeException if {@code number} exceeds the limit.
   */
  public boolean isPrime(final long number) {
    if (number > limit) {
      throw new OutOfRangeException(
          "The number " + number + " exceeds the limit " + limit + " of the sieve");
    }
    return number >= 2 && !composite.get((int) number);
  }
}
