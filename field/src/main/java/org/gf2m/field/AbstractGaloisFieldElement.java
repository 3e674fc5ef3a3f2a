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

/**
 * Storage and the backend independent operations shared by the element implementations.
 *
 * @param <E> the concrete element type.
 */
abstract class AbstractGaloisFieldElement<E extends AbstractGaloisFieldElement<E>>
    implements GaloisFieldElement<E> {

  // Truncated to the storage width, but not to the field size.
  protected final long value;

  AbstractGaloisFieldElement(final long value) {
    this.value = value;
  }

  @Override
  public long value() {
    return value;
  }

  @Override
  public E add(final E other) {
    return field().newElement(value ^ other.value);
  }

  @Override
  public E sub(final E other) {
    return field().newElement(value ^ other.value);
  }

  @Override
  public boolean isOutOfRange() {
    final int degree = field().degree();
    return degree < Long.SIZE && (value >>> degree) != 0;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (obj == null || obj.getClass() != getClass()) return false;
    AbstractGaloisFieldElement<?> other = (AbstractGaloisFieldElement<?>) obj;
    return value == other.value && field().equals(other.field());
  }

  @Override
  public int hashCode() {
    return 31 * field().hashCode() + Long.hashCode(value);
  }

  /** Hexadecimal value, zero padded to one digit per 4 bits of the field degree. */
  @Override
  public String toString() {
    final int digits = (field().degree() + 3) / 4;
    return String.format("0x%0" + digits + "X", value);
  }
}
