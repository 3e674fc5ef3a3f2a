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

/**
 * Unsigned storage widths available for field elements.
 *
 * <p>Every width is held in a Java {@code long}; this enum supplies the width specific behaviour
 * (masking, truncating shifts, bit length) so that a single element implementation serves all of
 * them.
 */
public enum StorageWidth {
  /** 8-bit storage. */
  U8(8),
  /** 16-bit storage. */
  U16(16),
  /** 32-bit storage. */
  U32(32),
  /** 64-bit storage, the widest native integer. */
  U64(64);

  private final int bits;
  private final long mask;

  StorageWidth(final int bits) {
    this.bits = bits;
    this.mask = bits == Long.SIZE ? -1L : (1L << bits) - 1;
  }

  /**
   * Number of bits in this width.
   *
   * @return the bit length W.
   */
  public int bits() {
    return bits;
  }

  /**
   * Mask selecting the low {@link #bits()} bits of a long.
   *
   * @return the width mask.
   */
  public long mask() {
    return mask;
  }

  /**
   * Is this the widest native width, whose double-width products need {@link UInt128}?
   *
   * @return true for {@link #U64}.
   */
  public boolean isWidest() {
    return bits == Long.SIZE;
  }

  /**
   * Truncates a value to this width.
   *
   * @param value raw value.
   * @return value with bits at or above {@link #bits()} cleared.
   */
  public long truncate(final long value) {
    return value & mask;
  }

  /**
   * Logical shift left, truncated to this width.
   *
   * @param value value to shift.
   * @param shift shift amount, zero or positive.
   * @return {@code value << shift} truncated, 0 when {@code shift >= bits()}.
   */
  public long shiftLeft(final long value, final int shift) {
    if (shift >= bits) return 0;
    return (value << shift) & mask;
  }

  /**
   * Logical shift right of the truncated value.
   *
   * @param value value to shift.
   * @param shift shift amount, zero or positive.
   * @return {@code value >>> shift}, 0 when {@code shift >= bits()}.
   */
  public long shiftRight(final long value, final int shift) {
    if (shift >= bits) return 0;
    return (value & mask) >>> shift;
  }

  /**
   * Number of leading zero bits, counted within this width.
   *
   * @param value value to inspect.
   * @return leading zeroes, {@link #bits()} for 0.
   */
  public int numberOfLeadingZeros(final long value) {
    return Long.numberOfLeadingZeros(value & mask) - (Long.SIZE - bits);
  }

  /**
   * Looks up the width with the given number of bits.
   *
   * @param bits 8, 16, 32 or 64.
   * @return the matching width.
   * @throws IllegalArgumentException for any other bit count.
   */
  public static StorageWidth ofBits(final int bits) {
    for (StorageWidth width : values()) {
      if (width.bits == bits) return width;
    }
    throw new IllegalArgumentException("Unsupported storage width: " + bits + " bits");
  }
}
