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

import java.math.BigInteger;

import org.gf2m.datatypes.StorageWidth;
import org.gf2m.datatypes.UInt128;

/**
 * A finite field GF(2^M) defined by an irreducible binary polynomial of degree M.
 *
 * <p>A field is one (storage width, polynomial, backend) instantiation. Elements of the field are
 * created through {@link #newElement(long)}; both backends satisfy the same element contract so
 * call sites do not change when the backend does.
 *
 * @param <E> the element type.
 */
public interface GaloisField<E extends GaloisFieldElement<E>> {

  /**
   * Storage width of the elements.
   *
   * @return the width W.
   */
  StorageWidth width();

  /**
   * Defining polynomial, bit i being the coefficient of x^i, leading term included.
   *
   * @return the field polynomial.
   */
  UInt128 polynomial();

  /**
   * Arithmetic backend.
   *
   * @return the backend used by this field.
   */
  Backend backend();

  /**
   * Degree of the field polynomial.
   *
   * @return M.
   */
  int degree();

  /**
   * Number of elements of the field.
   *
   * @return 2^M.
   */
  default BigInteger numElements() {
    return BigInteger.ONE.shiftLeft(degree());
  }

  /**
   * Additive identity.
   *
   * @return the element of value 0.
   */
  E zero();

  /**
   * Multiplicative identity.
   *
   * @return the element of value 1.
   */
  E one();

  /**
   * Wraps a raw value. No range check is performed, see {@link GaloisFieldElement#isOutOfRange()}.
   *
   * @param value raw value, truncated to the storage width.
   * @return the element.
   */
  E newElement(long value);
}
