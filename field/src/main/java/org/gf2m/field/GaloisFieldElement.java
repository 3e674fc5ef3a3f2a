/*
 * Copyright contributors to gf2m.
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
package org.gf2m.field;

import java.util.Optional;

/**
 * An immutable element of a {@link GaloisField}.
 *
 * <p>Addition and subtraction coincide (XOR). Elements are not ordered. Operands are assumed to
 * belong to the same field; this is not checked.
 *
 * @param <E> the element type.
 */
public interface GaloisFieldElement<E extends GaloisFieldElement<E>> {

  /**
   * Field this element belongs to.
   *
   * @return the field.
   */
  GaloisField<E> field();

  /**
   * Raw storage value.
   *
   * @return the value, read as unsigned.
   */
  long value();

  /**
   * Field addition.
   *
   * @param other right operand.
   * @return {@code this + other}.
   */
  E add(E other);

  /**
   * Field subtraction, identical to addition in characteristic 2.
   *
   * @param other right operand.
   * @return {@code this - other}.
   */
  E sub(E other);

  /**
   * Field multiplication.
   *
   * @param other right operand.
   * @return {@code this * other}.
   */
  E mul(E other);

  /**
   * Field division.
   *
   * @param other divisor.
   * @return {@code this / other}.
   * @throws DivideByZeroException if {@code other} is zero.
   */
  E div(E other);

  /**
   * Multiplicative inverse.
   *
   * @return {@code 1 / this}.
   * @throws DivideByZeroException if this is zero.
   */
  E inverse();

  /**
   * Is the value outside [0, 2^M) ?
   *
   * @return true if the element is out of range.
   */
  boolean isOutOfRange();

  /**
   * Is this the additive identity ?
   *
   * @return true for value 0.
   */
  default boolean isZero() {
    return value() == 0;
  }

  /**
   * Field division reporting a zero divisor as an empty result.
   *
   * @param other divisor.
   * @return {@code this / other}, or empty if {@code other} is zero.
   */
  default Optional<E> tryDiv(final E other) {
    if (other.isZero()) return Optional.empty();
    return Optional.of(div(other));
  }

  /**
   * Multiplicative inverse reporting zero as an empty result.
   *
   * @return {@code 1 / this}, or empty if this is zero.
   */
  default Optional<E> tryInverse() {
    if (isZero()) return Optional.empty();
    return Optional.of(inverse());
  }
}
