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
 * Thrown when an operation has no mathematically defined result for its input: a prime factor of 0
 * or 1, an even root of a negative number, the inverse of a non-invertible residue.
 */
public class DomainException extends ArithmeticException {

  /**
   * Instantiates a new DomainException.
   *
   * @param message the detail message
   */
  public DomainException(final String message) {
    super(message);
  }
}
