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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

import org.gf2m.datatypes.StorageWidth;
import org.gf2m.datatypes.UInt128;

/**
 * GF(2^M) computed bit by bit.
 *
 * <p>Multiplication is a carry-less multiplication followed by a reduction modulo the field
 * polynomial; inversion runs the extended Euclidean algorithm over GF(2)[x]. Any irreducible
 * polynomial of degree 1 to W is accepted. Irreducibility is not checked: a reducible polynomial
 * yields a ring with zero divisors instead of a field.
 */
public final class ComputedGaloisField implements GaloisField<ComputedElement> {

  private final StorageWidth width;
  private final UInt128 polynomial;
  // Low limb of the polynomial, exact whenever the degree is below 64.
  private final long narrowPolynomial;
  private final int degree;

  private final ComputedElement zero;
  private final ComputedElement one;

  private ComputedGaloisField(final StorageWidth width, final UInt128 polynomial) {
    this.width = width;
    this.polynomial = polynomial;
    this.narrowPolynomial = polynomial.lower();
    this.degree = PolyDiv.degree(polynomial);
    this.zero = new ComputedElement(this, 0L);
    this.one = new ComputedElement(this, 1L);
  }

  /**
   * Creates the field defined by a polynomial of degree up to 63.
   *
   * @param width storage width of the elements.
   * @param polynomial field polynomial, leading term included.
   * @return the field.
   */
  public static ComputedGaloisField of(final StorageWidth width, final long polynomial) {
    return of(width, UInt128.fromLong(polynomial));
  }

  /**
   * Creates the field defined by a polynomial.
   *
   * @param width storage width of the elements.
   * @param polynomial field polynomial, leading term included; its degree must be in [1, W].
   * @return the field.
   */
  public static ComputedGaloisField of(final StorageWidth width, final UInt128 polynomial) {
    checkNotNull(width, "width");
    checkNotNull(polynomial, "polynomial");
    final int degree = PolyDiv.degree(polynomial);
    checkArgument(
        degree >= 1 && degree <= width.bits(),
        "Polynomial %s has degree %s, expected 1 to %s",
        polynomial,
        degree,
        width.bits());
    return new ComputedGaloisField(width, polynomial);
  }

  // region GaloisField
  // --------------------------------------------------------------------------

  @Override
  public StorageWidth width() {
    return width;
  }

  @Override
  public UInt128 polynomial() {
    return polynomial;
  }

  @Override
  public Backend backend() {
    return Backend.COMPUTATION;
  }

  @Override
  public int degree() {
    return degree;
  }

  @Override
  public ComputedElement zero() {
    return zero;
  }

  @Override
  public ComputedElement one() {
    return one;
  }

  @Override
  public ComputedElement newElement(final long value) {
    return new ComputedElement(this, width.truncate(value));
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Arithmetic
  // --------------------------------------------------------------------------

  long multiply(final long a, final long b) {
    if (!width.isWidest()) {
      long product = CarrylessMultiply.clmul(a, b, width);
      return PolyDiv.divide(product, narrowPolynomial).remainder();
    }
    UInt128 product = CarrylessMultiply.clmulWide(a, b);
    return PolyDiv.divide(product, polynomial).remainder().lower();
  }

  long invert(final long a) {
    if (a == 0) throw new DivideByZeroException("Cannot invert zero in " + this);
    if (a == 1) return 1;

    // The field polynomial may not fit the storage width, so the first step divides wide.
    PolyDiv.WideResult first = PolyDiv.divide(polynomial, UInt128.fromLong(a));
    long remainderPrev = a;
    long remainderCur = first.remainder().lower();
    long tPrev = 1;
    long tCur = first.quotient().lower();

    while (remainderCur != 0) {
      PolyDiv.Result step = PolyDiv.divide(remainderPrev, remainderCur);
      remainderPrev = remainderCur;
      remainderCur = step.remainder();
      long tNext = tPrev ^ multiply(step.quotient(), tCur);
      tPrev = tCur;
      tCur = tNext;
    }
    return tPrev;
  }

  // --------------------------------------------------------------------------
  // endregion

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof ComputedGaloisField)) return false;
    ComputedGaloisField other = (ComputedGaloisField) obj;
    return width == other.width && polynomial.equals(other.polynomial);
  }

  @Override
  public int hashCode() {
    return Objects.hash(width, polynomial);
  }

  @Override
  public String toString() {
    return String.format(
        "GF(2^%d)<0x%s, %s, %s>",
        degree, polynomial.toBigInteger().toString(16).toUpperCase(), width, backend());
  }
}
