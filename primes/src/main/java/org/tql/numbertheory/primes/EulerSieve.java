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
import static com.google.common.base.Preconditions.checkNotNull;

import org.tql.numbertheory.datatypes.DomainException;
import org.tql.numbertheory.datatypes.IntegerType;
import org.tql.numbertheory.datatypes.Integers;
import org.tql.numbertheory.datatypes.OutOfRangeException;
import org.tql.numbertheory.datatypes.OverflowException;

import java.util.Arrays;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.primitives.ImmutableIntArray;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Sieve of Euler.
 *
 * <p>Finds every prime up to an inclusive limit in linear time, and records the minimum prime
 * factor of every number in range, from which any of them can be factorized.
 *
 * <p>The products {@code prime * num} are computed as {@code long}. An accumulator type, {@link
 * IntegerType#UNSIGNED_LONG} by default, sets the overflow limit: construction fails if it is too
 * narrow to hold {@code limit * limit}.
 */
public final class EulerSieve {
  private static final Logger LOG = LogManager.getLogger(EulerSieve.class);

  /** Largest supported limit; the factor table has {@code limit + 1} entries. */
  public static final int MAX_LIMIT = Integer.MAX_VALUE - 16;

  private final int limit;
  // minPrimeFactor[n] for 2 <= n <= limit, 0 for 0 and 1.
  private final int[] minPrimeFactor;
  private final ImmutableIntArray primes;

  /**
   * Builds the sieve of every number in {@code [0, limit]}, with the overflow limit of 64-bit
   * unsigned arithmetic.
   *
   * @param limit the largest number covered, inclusive
   */
  public EulerSieve(final int limit) {
    this(limit, IntegerType.UNSIGNED_LONG);
  }

  /**
   * Builds the sieve of every number in {@code [0, limit]}.
   *
   * @param limit the largest number covered, inclusive
   * @param accumulator integer type that must be able to hold {@code prime * num}
   * @throws IllegalArgumentException if the limit is negative or above {@link #MAX_LIMIT}.
   * @throws OverflowException if {@code accumulator} cannot hold {@code limit * limit}.
   */
  public EulerSieve(final int limit, final IntegerType accumulator) {
    checkNotNull(accumulator, "accumulator");
    checkArgument(limit >= 0, "Sieve limit must not be negative, got %s", limit);
    checkArgument(limit <= MAX_LIMIT, "Sieve limit %s exceeds %s", limit, MAX_LIMIT);
    int limitWidth = Integers.bitLength(limit);
    if (limitWidth * 2 > accumulator.digits()) {
      throw new OverflowException(
          "Multiplication will overflow "
              + accumulator
              + " when sieving up to "
              + limit
              + ". Please use larger integer types.");
    }

    this.limit = limit;
    this.minPrimeFactor = new int[limit + 1];
    this.primes = sieve(limit, minPrimeFactor);
    LOG.debug("Euler sieve up to {} found {} primes", limit, primes.length());
  }

  private static ImmutableIntArray sieve(final int limit, final int[] minPrimeFactor) {
    int[] primes = new int[16];
    int count = 0;
    for (int num = 2; num <= limit; num++) {
      if (minPrimeFactor[num] == 0) {
        if (count == primes.length) primes = Arrays.copyOf(primes, count * 2);
        primes[count++] = num;
        minPrimeFactor[num] = num;
      }
      // Each composite is marked once, by its smallest prime factor.
      for (int i = 0; i < count; i++) {
        int prime = primes[i];
        if (prime > minPrimeFactor[num]) break;
        long product = (long) prime * num;
        if (product > limit) break;
        minPrimeFactor[(int) product] = prime;
      }
    }
    return ImmutableIntArray.copyOf(Arrays.copyOf(primes, count));
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
   * Every prime up to the limit.
   *
   * @return the primes in ascending order.
   */
  public ImmutableIntArray primes() {
    return primes;
  }

  /**
   * Smallest prime factor of {@code |number|}.
   *
   * @param number the number, of any sign
   * @return the smallest prime dividing {@code number}.
   * @throws DomainException if {@code |number| <= 1}.
   * @throws OutOfRangeException if {@code |number|} exceeds the limit.
   */
  public int minPrimeFactor(final long number) {
    return minPrimeFactor[checkedIndex(number)];
  }

  /**
   * Prime factorization of {@code |number|}.
   *
   * @param number the number, of any sign
   * @return the prime factors with multiplicity, in non-decreasing order.
   * @throws DomainException if {@code |number| <= 1}.
   * @throws OutOfRangeException if {@code |number|} exceeds the limit.
   */
  public ImmutableIntArray factorize(final long number) {
    int rest = checkedIndex(number);
    ImmutableIntArray.Builder factors = ImmutableIntArray.builder();
    while (rest > 1) {
      int factor = minPrimeFactor[rest];
      factors.add(factor);
      rest /= factor;
    }
    return factors.build();
  }

  private int checkedIndex(final long number) {
    long magnitude = Integers.unsignedAbs(number);
    // Long.MIN_VALUE has a negative magnitude when read as signed: it is out of range.
    if (magnitude >= 0 && magnitude <= 1) {
      throw new DomainException("Minimum prime factor does not exist for " + number);
    }
    if (magnitude < 0 || magnitude > limit) {
      throw new OutOfRangeException(
          "The number " + number + " exceeds the limit " + limit + " of the sieve");
    }
    return (int) magnitude;
  }

  @VisibleForTesting
  int[] minPrimeFactorTable() {
    return minPrimeFactor;
  }
}
