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
package org.tql.numbertheory.datatypes;

/**
 * Element of a commutative ring with identity.
 *
 * <p>Implementations provide the primitive operations; the derived operators, including the forms
 * taking a plain integer operand, are defined here once in terms of them.
 *
 * @param <E> the implementing element type
 */
public interface RingElement<E extends RingElement<E>> {

  /**
   * Ring addition.
   *
   * @param rhs the element to add
   * @return this + rhs
   */
  E add(E rhs);

  /**
   * Additive inverse.
   *
   * @return -this
   */
  E negate();

  /**
   * Ring multiplication.
   *
   * @param rhs the element to multiply by
   * @return this * rhs
   */
  E multiply(E rhs);

  /**
   * Multiplicative inverse.
   *
   * @return the element x with this * x == 1
   * @throws DomainException if this element is not invertible.
   */
  E inverse();

  /**
   * Equality of elements.
   *
   * @param rhs the element to compare with
   * @return true if both elements are the same ring element.
   */
  boolean equal(E rhs);

  /**
   * Maps an integer into the ring of this element.
   *
   * @param value the integer
   * @return the image of {@code value}.
   */
  E lift(long value);

  /**
   * Multiplicative identity of the ring of this element.
   *
   * @return 1
   */
  default E one() {
    return lift(1);
  }

  default E subtract(final E rhs) {
    return add(rhs.negate());
  }

  default E divide(final E rhs) {
    return multiply(rhs.inverse());
  }

  default E increment() {
    return add(one());
  }

  default E decrement() {
    return subtract(one());
  }

  default boolean notEqual(final E rhs) {
    return !equal(rhs);
  }

  default E add(final long rhs) {
    return add(lift(rhs));
  }

  default E subtract(final long rhs) {
    return subtract(lift(rhs));
  }

  default E multiply(final long rhs) {
    return multiply(lift(rhs));
  }

  default E divide(final long rhs) {
    return divide(lift(rhs));
  }

  default boolean equal(final long rhs) {
    return equal(lift(rhs));
  }
}
