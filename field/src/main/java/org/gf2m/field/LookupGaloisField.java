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
 * GF(2^M) through discrete logarithms.
 *
 * <p>Multiplication, division and inversion become additions and subtractions of exponents modulo
 * 2^M - 1, read back through exponent and logarithm tables. The field polynomial must be
 * primitive and the storage width at most 16 bits, since the tables span the whole width.
 */
public final class LookupGaloisField implements GaloisField<LookupElement> {

  private final StorageWidth width;
  private final int polynomial;
  private final int degree;
  // Order of the multiplicative group, 2^M - 1.
  private final int order;
  private final LookupTables tables;

  private final LookupElement zero;
  private final LookupElement one;
  private final LookupElement alpha;

  private LookupGaloisField(
      final StorageWidth width, final int polynomial, final LookupTables tables) {
    this.width = width;
    this.polynomial = polynomial;
    this.degree = PolyDiv.degree(polynomial);
    this.order = (1 << degree) - 1;
    this.tables = tables;
    this.zero = new LookupElement(this, 0L);
    this.one = new LookupElement(this, 1L);
    this.alpha = new LookupElement(this, 2L);
  }

  /**
   * Creates the field defined by a primitive polynomial, building its tables on first use.
   *
   * @param width storage width of the elements, {@link StorageWidth#U8} or {@link
   *     StorageWidth#U16}.
   * @param polynomial primitive polynomial, leading term included.
   * @return the field.
   * @throws InvalidPolynomialException if the polynomial is not primitive.
   */
  public static LookupGaloisField of(final StorageWidth width, final long polynomial) {
    checkNotNull(width, "width");
    checkArgument(
        width.bits() <= PolynomialValidator.MAX_TABLE_BITS,
        "Lookup tables are limited to %s bits, got %s",
        PolynomialValidator.MAX_TABLE_BITS,
        width);
    PolynomialValidator.validatePrimitive(width, polynomial);
    final int poly = (int) polynomial;
    return new LookupGaloisField(width, poly, LookupTables.forPolynomial(width, poly));
  }

  // region GaloisField
  // --------------------------------------------------------------------------

  @Override
  public StorageWidth width() {
    return width;
  }

  @Override
  public UInt128 polynomial() {
    return UInt128.fromLong(polynomial);
  }

  @Override
  public Backend backend() {
    return Backend.LOOKUP_TABLE;
  }

  @Override
  public int degree() {
    return degree;
  }

  @Override
  public LookupElement zero() {
    return zero;
  }

  @Override
  public LookupElement one() {
    return one;
  }

  @Override
  public LookupElement newElement(final long value) {
    return new LookupElement(this, width.truncate(value));
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Discrete Logarithm
  // --------------------------------------------------------------------------

  /**
   * The primitive element α, stored as the value 2.
   *
   * @return α.
   */
  public LookupElement alpha() {
    return alpha;
  }

  /**
   * Power of the primitive element.
   *
   * @param power any exponent, negative ones included.
   * @return α^power.
   */
  public LookupElement alphaPow(final long power) {
    return new LookupElement(this, alphaPowValue(power));
  }

  int logAlpha(final long value) {
    return tables.log((int) value);
  }

  private long alphaPowValue(final long power) {
    long pow = power % order;
    pow += order;
    pow %= order;
    return tables.exp((int) pow);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Arithmetic
  // --------------------------------------------------------------------------

  long multiply(final long a, final long b) {
    if (a == 0 || b == 0) return 0;
    return alphaPowValue((long) logAlpha(a) + logAlpha(b));
  }

  long divide(final long a, final long b) {
    if (b == 0) throw new DivideByZeroException("Division by zero in " + this);
    if (a == 0) return 0;
    return alphaPowValue((long) logAlpha(a) - logAlpha(b));
  }

  long invert(final long a) {
    if (a == 0) throw new DivideByZeroException("Cannot invert zero in " + this);
    return alphaPowValue((long) order - logAlpha(a));
  }

  // --------------------------------------------------------------------------
  // endregion

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof LookupGaloisField)) return false;
    LookupGaloisField other = (LookupGaloisField) obj;
    return width == other.width && polynomial == other.polynomial;
  }

  @Override
  public int hashCode() {
    return Objects.hash(width, polynomial);
  }

  @Override
  public String toString() {
    return String.format(
        "GF(2^%d)<0x%X, %s, %s>", degree, polynomial, width, backend());
  }
}
