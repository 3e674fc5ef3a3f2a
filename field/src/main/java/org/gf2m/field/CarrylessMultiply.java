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

import org.gf2m.datatypes.StorageWidth;
import org.gf2m.datatypes.UInt128;

/**
 * Carry-less (XOR convolution) multiplication of two W-bit operands.
 *
 * <p>The 2W-bit product is produced either in two W-bit halves ({@link #clmulLow} and {@link
 * #clmulHigh}), in a single {@code long} for W up to 32 bits, or as a {@link UInt128} for any
 * width.
 */
public final class CarrylessMultiply {

  private CarrylessMultiply() {}

  /**
   * Low half of the carry-less product: bits 0..W-1.
   *
   * @param a left operand.
   * @param b right operand.
   * @param width storage width W.
   * @return XOR over set bits i of b of {@code a << i}, truncated to W bits.
   */
  public static long clmulLow(final long a, final long b, final StorageWidth width) {
    final int nBits = width.bits();
    long output = 0;
    for (int i = 0; i < nBits; i++) {
      if (((b >>> i) & 1L) != 0) {
        output ^= width.shiftLeft(a, i);
      }
    }
    return output;
  }

  /**
   * High half of the carry-less product: bits W..2W-1.
   *
   * @param a left operand.
   * @param b right operand.
   * @param width storage width W.
   * @return XOR over set bits i (i &ge; 1) of b of {@code a >>> (W - i)}.
   */
  public static long clmulHigh(final long a, final long b, final StorageWidth width) {
    final int nBits = width.bits();
    long output = 0;
    for (int i = 1; i < nBits; i++) {
      if (((b >>> i) & 1L) != 0) {
        output ^= width.shiftRight(a, nBits - i);
      }
    }
    return output;
  }

  /**
   * Carry-less product packed in a single long.
   *
   * @param a left operand.
   * @param b right operand.
   * @param width storage width W, at most 32 bits so that 2W bits fit in a long.
   * @return {@code clmulLow | clmulHigh << W}.
   */
  public static long clmul(final long a, final long b, final StorageWidth width) {
    checkArgument(
        width.bits() <= Integer.SIZE, "Product of %s operands does not fit in a long", width);
    return clmulLow(a, b, width) | (clmulHigh(a, b, width) << width.bits());
  }

  /**
   * Carry-less product as a 128-bit integer.
   *
   * @param a left operand.
   * @param b right operand.
   * @param width storage width W.
   * @return the full 2W-bit product.
   */
  public static UInt128 clmulWide(final long a, final long b, final StorageWidth width) {
    UInt128 high = UInt128.widen(clmulHigh(a, b, width), width.bits());
    return high.xor(UInt128.fromLong(clmulLow(a, b, width)));
  }

  /**
   * Carry-less product of two 64-bit operands.
   *
   * @param a left operand, read as unsigned.
   * @param b right operand, read as unsigned.
   * @return the full 128-bit product.
   */
  public static UInt128 clmulWide(final long a, final long b) {
    return UInt128.fromLimbs(
        clmulLow(a, b, StorageWidth.U64), clmulHigh(a, b, StorageWidth.U64));
  }
}
