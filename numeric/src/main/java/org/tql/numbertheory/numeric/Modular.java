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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.tql.numbertheory.datatypes.DomainException;
import org.tql.numbertheory.datatypes.RingElement;

import com.google.common.primitives.UnsignedLongs;

/**
 * Element of a {@link ModularRing}.
 *
 * <p>Immutable; every operation returns a new element. The value is always the canonical
 * representative, in {@code [0, modulus)}.
 */
public final class Modular implements RingElement<Modular> {
  private final ModularRing ring;
  private final long value;

  Modular(final ModularRing ring, final long value) {
    // Unchecked: value is already in [0, modulus)
    this.ring = ring;
    this.value = value;
  }

  // region Conversions
  // --------------------------------------------------------------------------

  /**
   * The ring this element belongs to.
   *
   * @return the owning ring.
   */
  public ModularRing ring() {
    return ring;
  }

  /**
   * The canonical representative.
   *
   * @return the value, in [0, modulus).
   */
  public long get() {
    return value;
  }

  /**
   * Converts to the backing integer type. Same as {@link #get()}.
   *
   * @return the value, in [0, modulus).
   */
  public long toLong() {
    return value;
  }

  /**
   * Element of the same ring holding {@code newValue}.
   *
   * @param newValue a value of the ring's integer type
   * @return the residue class of {@code newValue}.
   */
  public Modular withValue(final long newValue) {
    return ring.valueOf(newValue);
  }

  @Override
  public Modular lift(final long newValue) {
    return ring.valueOf(newValue);
  }

  @Override
  public Modular one() {
    return ring.one();
  }

  @Override
  public String toString() {
    return ring.type().toString(value);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Ring Operations
  // --------------------------------------------------------------------------

  @Override
  public Modular add(final Modular rhs) {
    checkSameRing(rhs);
    // Unsigned: over UNSIGNED_LONG the sum may reach 2^63.
    long sum = value + rhs.value;
    if (UnsignedLongs.compare(sum, ring.modulus()) >= 0) sum -= ring.modulus();
    return new Modular(ring, sum);
  }

  @Override
  public Modular negate() {
    if (value == 0) return this;
    return new Modular(ring, ring.modulus() - value);
  }

  /**
   * Ring multiplication.
   *
   * @param rhs the element to multiply by
   * @return this * rhs
   * @throws org.tql.numbertheory.datatypes.ModularOverflowException if the ring's integer type
   *     cannot hold the product of two residues.
   */
  @Override
  public Modular multiply(final Modular rhs) {
    checkSameRing(rhs);
    ring.checkMultiplicationOverflow();
    // Both residues have at most half the type's digits, so the product fits 64 unsigned bits.
    return new Modular(ring, UnsignedLongs.remainder(value * rhs.value, ring.modulus()));
  }

  /**
   * Multiplicative inverse, from the Bezout coefficient of the value against the modulus.
   *
   * @return the element x with this * x == 1
   * @throws DomainException if the value and the modulus are not coprime.
   */
  @Override
  public Modular inverse() {
    ExtendedGcd bezout = Numerics.exgcd(value, ring.modulus());
    if (bezout.gcd() != 1) {
      throw new DomainException(
          "No inverse of " + this + " modulo " + ring.type().toString(ring.modulus()));
    }
    return new Modular(ring, ring.residue(bezout.x()));
  }

  /**
   * Raises this element to an integer power.
   *
   * @param exponent the exponent, of any sign
   * @return this^exponent
   * @throws DomainException if the exponent is negative and this element is not invertible.
   */
  public Modular pow(final long exponent) {
    return Numerics.pow(this, exponent);
  }

  @Override
  public boolean equal(final Modular rhs) {
    checkSameRing(rhs);
    return value == rhs.value;
  }

  private void checkSameRing(final Modular rhs) {
    checkNotNull(rhs, "rhs");
    checkArgument(
        ring.equals(rhs.ring), "Cannot combine elements of %s and %s", ring, rhs.ring);
  }

  // --------------------------------------------------------------------------
  // endregion

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof Modular)) return false;
    Modular other = (Modular) obj;
    return value == other.value && ring.equals(other.ring);
  }

  @Override
  public int hashCode() {
    return 31 * ring.hashCode() + Long.hashCode(value);
  }
}
