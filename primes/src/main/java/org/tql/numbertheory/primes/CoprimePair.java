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

/** A pair {@code (x, y)} of coprime integers with {@code 0 <= y <= x}. */
public final class CoprimePair {
  private final long x;
  private final long y;

  CoprimePair(final long x, final long y) {
    this.x = x;
    this.y = y;
  }

  public long x() {
    return x;
  }

  public long y() {
    return y;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof CoprimePair)) return false;
    CoprimePair other = (CoprimePair) obj;
    return x == other.x && y == other.y;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(x) + Long.hashCode(y);
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}
