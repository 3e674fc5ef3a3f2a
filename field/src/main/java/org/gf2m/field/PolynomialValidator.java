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

import org.gf2m.datatypes.StorageWidth;
import org.gf2m.field.InvalidPolynomialException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that a polynomial is primitive, which the lookup table backend requires.
 *
 * <p>Checks run in order: degree fits the storage width, 0 is not a root (the polynomial is odd),
 * 1 is not a root (odd number of terms; skipped for degree 1 where x + 1 defines GF(2)), and the
 * powers of α = x only return to 1 after visiting all 2^M - 1 non-zero elements.
 */
public final class PolynomialValidator {
  private static final Logger LOG = LoggerFactory.getLogger(PolynomialValidator.class);

  /** Widest storage for which lookup tables are built. */
  static final int MAX_TABLE_BITS = 16;

  private PolynomialValidator() {}

  /**
   * Finds the first reason a polynomial cannot be used by the lookup table backend.
   *
   * @param width storage width of the elements.
   * @param polynomial candidate polynomial, leading term included.
   * @return the violated condition, or empty if the polynomial is primitive.
   */
  public static Optional<Reason> findViolation(final StorageWidth width, final long polynomial) {
    final int degree = PolyDiv.degree(polynomial);
    if (degree < 1 || degree > width.bits() || degree > MAX_TABLE_BITS) {
      return Optional.of(Reason.DEGREE_OUT_OF_RANGE);
    }
    if ((polynomial & 1L) == 0) {
      return Optional.of(Reason.ZERO_IS_ROOT);
    }
    if (degree > 1 && Long.bitCount(polynomial) % 2 == 0) {
      return Optional.of(Reason.ONE_IS_ROOT);
    }
    if (!generatesFullCycle((int) polynomial, degree)) {
      return Optional.of(Reason.NOT_PRIMITIVE);
    }
    return Optional.empty();
  }

  /**
   * Is the polynomial usable by the lookup table backend ?
   *
   * @param width storage width of the elements.
   * @param polynomial candidate polynomial, leading term included.
   * @return true if the polynomial is primitive and fits the width.
   */
  public static boolean isPrimitive(final StorageWidth width, final long polynomial) {
    return findViolation(width, polynomial).isEmpty();
  }

  /**
   * Rejects a polynomial the lookup table backend cannot use.
   *
   * @param width storage width of the elements.
   * @param polynomial candidate polynomial, leading term included.
   * @throws InvalidPolynomialException naming the violated condition.
   */
  public static void validatePrimitive(final StorageWidth width, final long polynomial) {
    Optional<Reason> violation = findViolation(width, polynomial);
    if (violation.isPresent()) {
      LOG.debug("Rejected polynomial 0x{} for {}: {}",
          Long.toHexString(polynomial).toUpperCase(), width, violation.get());
      throw new InvalidPolynomialException(polynomial, violation.get());
    }
  }

  private static boolean generatesFullCycle(final int polynomial, final int degree) {
    final int order = (1 << degree) - 1;
    int value = 1;
    for (int i = 1; i < order; i++) {
      value = LookupTables.advance(value, polynomial, degree);
      if (value == 1) return false;
    }
    return LookupTables.advance(value, polynomial, degree) == 1;
  }
}
