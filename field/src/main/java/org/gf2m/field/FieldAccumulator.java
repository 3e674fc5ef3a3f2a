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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Mutable holder giving field elements in-place operators.
 *
 * <p>Not thread safe. Each operator replaces the held element with a new immutable one.
 *
 * @param <E> the element type.
 */
public final class FieldAccumulator<E extends GaloisFieldElement<E>> {
  private E current;

  /**
   * Instantiates an accumulator.
   *
   * @param initial starting element.
   */
  public FieldAccumulator(final E initial) {
    this.current = checkNotNull(initial, "initial");
  }

  /**
   * Accumulator starting at the additive identity of a field.
   *
   * @param field the field.
   * @param <E> the element type.
   * @return a new accumulator holding zero.
   */
  public static <E extends GaloisFieldElement<E>> FieldAccumulator<E> zero(
      final GaloisField<E> field) {
    return new FieldAccumulator<>(field.zero());
  }

  /**
   * Accumulator starting at the multiplicative identity of a field.
   *
   * @param field the field.
   * @param <E> the element type.
   * @return a new accumulator holding one.
   */
  public static <E extends GaloisFieldElement<E>> FieldAccumulator<E> one(
      final GaloisField<E> field) {
    return new FieldAccumulator<>(field.one());
  }

  public FieldAccumulator<E> addAssign(final E other) {
    current = current.add(other);
    return this;
  }

  public FieldAccumulator<E> subAssign(final E other) {
    current = current.sub(other);
    return this;
  }

  public FieldAccumulator<E> mulAssign(final E other) {
    current = current.mul(other);
    return this;
  }

  /**
   * Divides the held element in place.
   *
   * @param other divisor.
   * @return this accumulator.
   * @throws DivideByZeroException if {@code other} is zero; the held element is left unchanged.
   */
  public FieldAccumulator<E> divAssign(final E other) {
    current = current.div(other);
    return this;
  }

  /**
   * Current value.
   *
   * @return the held element.
   */
  public E get() {
    return current;
  }

  @Override
  public String toString() {
    return "FieldAccumulator{" + current + "}";
  }
}
