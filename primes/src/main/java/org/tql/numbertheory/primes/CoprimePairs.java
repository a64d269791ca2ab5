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

import java.util.ArrayDeque;
import java.util.Deque;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Enumeration of coprime pairs.
 *
 * <p>Every pair {@code (x, y)} with {@code x > y > 0} and {@code gcd(x, y) == 1} appears exactly
 * once in the ternary tree rooted at (2, 1) and (3, 1), where the children of {@code (x, y)} are
 * {@code (2x - y, x)}, {@code (2x + y, x)} and {@code (x + 2y, y)}. Children always have a larger
 * first component, so a subtree can be cut as soon as it exceeds the bound.
 */
public final class CoprimePairs {
  private static final Logger LOG = LogManager.getLogger(CoprimePairs.class);

  /** Largest supported bound; children of a pair within it stay below {@code 3 * MAX_BOUND}. */
  public static final long MAX_BOUND = Long.MAX_VALUE / 3;

  private CoprimePairs() {}

  /**
   * Every coprime pair {@code (x, y)} with {@code 0 <= y <= x <= n}.
   *
   * <p>This includes (1, 0) and (1, 1). The order of the pairs is unspecified.
   *
   * @param n the bound of the first component, inclusive
   * @return the coprime pairs, empty if {@code n < 1}.
   * @throws IllegalArgumentException if {@code n} exceeds {@link #MAX_BOUND}.
   */
  public static ImmutableList<CoprimePair> upTo(final long n) {
    checkArgument(n <= MAX_BOUND, "Bound %s exceeds %s", n, MAX_BOUND);
    ImmutableList.Builder<CoprimePair> pairs = ImmutableList.builder();
    if (n < 1) return pairs.build();
    pairs.add(new CoprimePair(1, 0), new CoprimePair(1, 1));

    Deque<CoprimePair> pending = new ArrayDeque<>();
    push(pending, 2, 1, n);
    push(pending, 3, 1, n);
    int count = 2;
    while (!pending.isEmpty()) {
      CoprimePair pair = pending.pop();
      pairs.add(pair);
      count++;
      long x = pair.x();
      long y = pair.y();
      push(pending, 2 * x - y, x, n);
      push(pending, 2 * x + y, x, n);
      push(pending, x + 2 * y, y, n);
    }
    LOG.trace("Enumerated {} coprime pairs up to {}", count, n);
    return pairs.build();
  }

  private static void push(
      final Deque<CoprimePair> pending, final long x, final long y, final long n) {
    if (x <= n) pending.push(new CoprimePair(x, y));
  }
}
