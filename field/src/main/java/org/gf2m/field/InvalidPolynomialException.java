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
 * Thrown when a polynomial cannot drive the lookup table backend.
 *
 * <p>This is a configuration error, detected once when a {@link LookupGaloisField} is created.
 */
public class InvalidPolynomialException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  /** Why a polynomial was rejected. */
  public enum Reason {
    /** Degree is below 1 or does not fit the storage width. */
    DEGREE_OUT_OF_RANGE("degree out of range"),
    /** Polynomial is even, so x divides it. */
    ZERO_IS_ROOT("0 is a root"),
    /** Polynomial has an even number of terms, so x + 1 divides it. */
    ONE_IS_ROOT("1 is a root"),
    /** Powers of x return to 1 before visiting every non-zero element. */
    NOT_PRIMITIVE("not primitive");

    private final String description;

    Reason(final String description) {
      this.description = description;
    }

    @Override
    public String toString() {
      return description;
    }
  }

  private final long polynomial;
  private final Reason reason;

  /**
   * Instantiates a new InvalidPolynomialException.
   *
   * @param polynomial the rejected polynomial.
   * @param reason why it was rejected.
   */
  public InvalidPolynomialException(final long polynomial, final Reason reason) {
    super(String.format("Invalid polynomial 0x%X: %s", polynomial, reason));
    this.polynomial = polynomial;
    this.reason = reason;
  }

  /**
   * The rejected polynomial.
   *
   * @return polynomial bits.
   */
  public long polynomial() {
    return polynomial;
  }

  /**
   * Why the polynomial was rejected.
   *
   * @return the reason.
   */
  public Reason reason() {
    return reason;
  }
}
