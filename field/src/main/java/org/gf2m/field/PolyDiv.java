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

import java.util.Objects;

import org.gf2m.datatypes.UInt128;

/**
 * Euclidean division of binary polynomials.
 *
 * <p>A polynomial is encoded as an unsigned integer whose bit i is the coefficient of x^i. The
 * division is classic binary long division simulated with a shift register: the dividend is
 * consumed one bit at a time from its most significant set bit down to bit 0, and every time the
 * register overflows the divisor's degree the divisor (minus its leading term) is XORed back in.
 */
public final class PolyDiv {

  private PolyDiv() {}

  // region Degree
  // --------------------------------------------------------------------------

  /**
   * Degree of a polynomial held in a long.
   *
   * @param x polynomial, read as unsigned.
   * @return index of the highest set bit, -1 for 0.
   */
  public static int degree(final long x) {
    return Long.SIZE - 1 - Long.numberOfLeadingZeros(x);
  }

  /**
   * Degree of a polynomial held in a UInt128.
   *
   * @param x polynomial.
   * @return index of the highest set bit, -1 for 0.
   */
  public static int degree(final UInt128 x) {
    return UInt128.BITSIZE - 1 - x.numberOfLeadingZeros();
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Division
  // --------------------------------------------------------------------------

  /**
   * Divides two polynomials of up to 64 coefficients.
   *
   * @param dividend the dividend.
   * @param divisor the divisor, must not be 0.
   * @return quotient and remainder with {@code dividend = quotient * divisor + remainder}.
   * @throws ArithmeticException if the divisor is 0.
   */
  public static Result divide(final long dividend, final long divisor) {
    if (divisor == 0) throw new ArithmeticException("Polynomial division by zero");
    if (divisor == 1) return new Result(dividend, 0L);

    final int divisorDegree = degree(divisor);
    final int feedbackBit = divisorDegree - 1;
    final long feedback = divisor ^ (1L << divisorDegree);

    long quotient = 0;
    long remainder = 0;
    for (int i = degree(dividend); i >= 0; i--) {
      boolean overflow = ((remainder >>> feedbackBit) & 1L) != 0;
      remainder = (remainder << 1) | ((dividend >>> i) & 1L);
      if (overflow) {
        remainder ^= feedback;
        quotient |= 1L << i;
      }
    }
    // Bits above the divisor degree are stale register overflow.
    return new Result(quotient, remainder & ((1L << divisorDegree) - 1));
  }

  /**
   * Divides two polynomials of up to 128 coefficients.
   *
   * @param dividend the dividend.
   * @param divisor the divisor, must not be 0.
   * @return quotient and remainder with {@code dividend = quotient * divisor + remainder}.
   * @throws ArithmeticException if the divisor is 0.
   */
  public static WideResult divide(final UInt128 dividend, final UInt128 divisor) {
    if (divisor.isZero()) throw new ArithmeticException("Polynomial division by zero");
    if (divisor.equals(UInt128.ONE)) return new WideResult(dividend, UInt128.ZERO);

    final int divisorDegree = degree(divisor);
    final int feedbackBit = divisorDegree - 1;
    final UInt128 feedback = divisor.xor(UInt128.ONE.shiftLeft(divisorDegree));

    UInt128 quotient = UInt128.ZERO;
    UInt128 remainder = UInt128.ZERO;
    for (int i = degree(dividend); i >= 0; i--) {
      boolean overflow = remainder.testBit(feedbackBit);
      remainder = remainder.shiftLeft(1);
      if (dividend.testBit(i)) remainder = remainder.xor(UInt128.ONE);
      if (overflow) {
        remainder = remainder.xor(feedback);
        quotient = quotient.or(UInt128.ONE.shiftLeft(i));
      }
    }
    return new WideResult(quotient, remainder.and(UInt128.lowMask(divisorDegree)));
  }

  // --------------------------------------------------------------------------
  // endregion

  /** Quotient and remainder of a division of long polynomials. */
  public static final class Result {
    private final long quotient;
    private final long remainder;

    Result(final long quotient, final long remainder) {
      this.quotient = quotient;
      this.remainder = remainder;
    }

    /**
     * Quotient of the division.
     *
     * @return the quotient polynomial.
     */
    public long quotient() {
      return quotient;
    }

    /**
     * Remainder of the division.
     *
     * @return the remainder polynomial, of degree lower than the divisor's.
     */
    public long remainder() {
      return remainder;
    }

    @Override
    public boolean equals(final Object obj) {
      if (this == obj) return true;
      if (!(obj instanceof Result)) return false;
      Result other = (Result) obj;
      return quotient == other.quotient && remainder == other.remainder;
    }

    @Override
    public int hashCode() {
      return 31 * Long.hashCode(quotient) + Long.hashCode(remainder);
    }

    @Override
    public String toString() {
      return String.format("Result{quotient=0x%x, remainder=0x%x}", quotient, remainder);
    }
  }

  /** Quotient and remainder of a division of UInt128 polynomials. */
  public static final class WideResult {
    private final UInt128 quotient;
    private final UInt128 remainder;

    WideResult(final UInt128 quotient, final UInt128 remainder) {
      this.quotient = quotient;
      this.remainder = remainder;
    }

    /**
     * Quotient of the division.
     *
     * @return the quotient polynomial.
     */
    public UInt128 quotient() {
      return quotient;
    }

    /**
     * Remainder of the division.
     *
     * @return the remainder polynomial, of degree lower than the divisor's.
     */
    public UInt128 remainder() {
      return remainder;
    }

    @Override
    public boolean equals(final Object obj) {
      if (this == obj) return true;
      if (!(obj instanceof WideResult)) return false;
      WideResult other = (WideResult) obj;
      return quotient.equals(other.quotient) && remainder.equals(other.remainder);
    }

    @Override
    public int hashCode() {
      return Objects.hash(quotient, remainder);
    }

    @Override
    public String toString() {
      return "WideResult{quotient=" + quotient + ", remainder=" + remainder + "}";
    }
  }
}
