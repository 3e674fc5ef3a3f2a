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
package org.gf2m.datatypes;

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;

/**
 * 128-bits wide unsigned integer class.
 *
 * <p>Double-width companion of a 64-bit {@code long}: it holds carry-less products of two 64-bit
 * values and polynomials of degree up to 127. Only the bitwise operations needed for GF(2)
 * polynomial arithmetic are provided.
 */
public final class UInt128 {
  // region Internals
  // --------------------------------------------------------------------------
  // Represented as two 64-bit limbs in little-endian order: lower holds bits 0..63,
  // upper holds bits 64..127. Limbs are read as unsigned.

  /** Fixed size in bits. */
  public static final int BITSIZE = 128;

  /** Fixed size in bytes. */
  public static final int BYTESIZE = 16;

  // Fixed number of bits per limb.
  private static final int N_BITS_PER_LIMB = 64;

  // Internal state
  private final long lower;
  private final long upper;

  // --------------------------------------------------------------------------
  // endregion

  /** The constant 0. */
  public static final UInt128 ZERO = new UInt128(0L, 0L);

  /** The constant 1. */
  public static final UInt128 ONE = new UInt128(1L, 0L);

  // region Constructors
  // --------------------------------------------------------------------------

  UInt128(final long lower, final long upper) {
    this.lower = lower;
    this.upper = upper;
  }

  /**
   * Instantiates a new UInt128 from its two limbs.
   *
   * @param lower bits 0..63.
   * @param upper bits 64..127.
   * @return The UInt128 made of both limbs.
   */
  public static UInt128 fromLimbs(final long lower, final long upper) {
    if (lower == 0 && upper == 0) return ZERO;
    return new UInt128(lower, upper);
  }

  /**
   * Instantiates a new UInt128 from a long read as unsigned.
   *
   * @param value long value to convert to UInt128.
   * @return The UInt128 equivalent of value.
   */
  public static UInt128 fromLong(final long value) {
    if (value == 0) return ZERO;
    if (value == 1) return ONE;
    return new UInt128(value, 0L);
  }

  /**
   * Places a 64-bit value in a 128-bit field and shifts it left.
   *
   * <p>Bits shifted past bit 127 are dropped, so any shift of 128 or more yields 0.
   *
   * @param value 64-bit value, read as unsigned.
   * @param shift left shift amount.
   * @return {@code value << shift} on 128 bits.
   */
  public static UInt128 widen(final long value, final int shift) {
    return fromLong(value).shiftLeft(shift);
  }

  /**
   * Instantiates a new UInt128 from a BigInteger, keeping its low 128 bits.
   *
   * @param value non-negative BigInteger.
   * @return The UInt128 equivalent of {@code value mod 2^128}.
   */
  public static UInt128 fromBigInteger(final BigInteger value) {
    checkArgument(value.signum() >= 0, "Expected non-negative value, got %s", value);
    return fromLimbs(value.longValue(), value.shiftRight(N_BITS_PER_LIMB).longValue());
  }

  /**
   * Mask made of the {@code nBits} least significant bits.
   *
   * @param nBits number of set bits, saturated to [0, 128].
   * @return {@code 2^nBits - 1}.
   */
  public static UInt128 lowMask(final int nBits) {
    if (nBits <= 0) return ZERO;
    if (nBits >= BITSIZE) return new UInt128(-1L, -1L);
    if (nBits >= N_BITS_PER_LIMB) {
      return fromLimbs(-1L, (1L << (nBits - N_BITS_PER_LIMB)) - 1);
    }
    return fromLimbs((1L << nBits) - 1, 0L);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Conversions
  // --------------------------------------------------------------------------

  /**
   * Lower limb.
   *
   * @return bits 0..63.
   */
  public long lower() {
    return lower;
  }

  /**
   * Upper limb.
   *
   * @return bits 64..127.
   */
  public long upper() {
    return upper;
  }

  /**
   * Convert to BigInteger.
   *
   * @return BigInteger representing the integer.
   */
  public BigInteger toBigInteger() {
    return toUnsignedBigInteger(upper).shiftLeft(N_BITS_PER_LIMB).or(toUnsignedBigInteger(lower));
  }

  private static BigInteger toUnsignedBigInteger(final long limb) {
    BigInteger big = BigInteger.valueOf(limb >>> 1).shiftLeft(1);
    return (limb & 1L) == 0 ? big : big.setBit(0);
  }

  @Override
  public String toString() {
    return String.format("0x%016x%016x", upper, lower);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Comparisons
  // --------------------------------------------------------------------------

  /**
   * Is the value 0 ?
   *
   * @return true if this UInt128 value is 0.
   */
  public boolean isZero() {
    return (lower | upper) == 0;
  }

  /**
   * Is bit {@code index} set ?
   *
   * @param index bit position in [0, 128).
   * @return true if the bit is set, false for any index outside the range.
   */
  public boolean testBit(final int index) {
    if (index < 0 || index >= BITSIZE) return false;
    if (index < N_BITS_PER_LIMB) return ((lower >>> index) & 1L) != 0;
    return ((upper >>> (index - N_BITS_PER_LIMB)) & 1L) != 0;
  }

  /**
   * Number of leading zero bits.
   *
   * @return leading zeroes, 128 for 0.
   */
  public int numberOfLeadingZeros() {
    if (upper != 0) return Long.numberOfLeadingZeros(upper);
    return N_BITS_PER_LIMB + Long.numberOfLeadingZeros(lower);
  }

  /**
   * Compares two UInt128 as unsigned integers.
   *
   * @param a left UInt128
   * @param b right UInt128
   * @return 0 if a == b, negative if a &lt; b and positive if a &gt; b.
   */
  public static int compare(final UInt128 a, final UInt128 b) {
    int comp = Long.compareUnsigned(a.upper, b.upper);
    if (comp != 0) return comp;
    return Long.compareUnsigned(a.lower, b.lower);
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof UInt128)) return false;
    UInt128 other = (UInt128) obj;
    return ((this.lower ^ other.lower) | (this.upper ^ other.upper)) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(upper) + Long.hashCode(lower);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Bitwise Operations
  // --------------------------------------------------------------------------

  /**
   * Bitwise exclusive or.
   *
   * @param other right operand.
   * @return {@code this ^ other}.
   */
  public UInt128 xor(final UInt128 other) {
    return fromLimbs(lower ^ other.lower, upper ^ other.upper);
  }

  /**
   * Bitwise and.
   *
   * @param other right operand.
   * @return {@code this & other}.
   */
  public UInt128 and(final UInt128 other) {
    return fromLimbs(lower & other.lower, upper & other.upper);
  }

  /**
   * Bitwise or.
   *
   * @param other right operand.
   * @return {@code this | other}.
   */
  public UInt128 or(final UInt128 other) {
    return fromLimbs(lower | other.lower, upper | other.upper);
  }

  /**
   * Bitwise complement.
   *
   * @return {@code ~this}.
   */
  public UInt128 not() {
    return fromLimbs(~lower, ~upper);
  }

  /**
   * Logical shift left.
   *
   * @param shift shift amount, must not be negative.
   * @return {@code this << shift} truncated to 128 bits.
   */
  public UInt128 shiftLeft(final int shift) {
    checkArgument(shift >= 0, "Negative shift: %s", shift);
    if (shift == 0) return this;
    if (shift >= BITSIZE) return ZERO;
    if (shift >= N_BITS_PER_LIMB) {
      // Lower limb moves entirely into the upper one.
      return fromLimbs(0L, lower << (shift - N_BITS_PER_LIMB));
    }
    long spill = lower >>> (N_BITS_PER_LIMB - shift);
    return fromLimbs(lower << shift, (upper << shift) | spill);
  }

  /**
   * Logical shift right.
   *
   * @param shift shift amount, must not be negative.
   * @return {@code this >>> shift}.
   */
  public UInt128 shiftRight(final int shift) {
    checkArgument(shift >= 0, "Negative shift: %s", shift);
    if (shift == 0) return this;
    if (shift >= BITSIZE) return ZERO;
    if (shift >= N_BITS_PER_LIMB) {
      return fromLimbs(upper >>> (shift - N_BITS_PER_LIMB), 0L);
    }
    long spill = upper << (N_BITS_PER_LIMB - shift);
    return fromLimbs((lower >>> shift) | spill, upper >>> shift);
  }

  // --------------------------------------------------------------------------
  // endregion
}
