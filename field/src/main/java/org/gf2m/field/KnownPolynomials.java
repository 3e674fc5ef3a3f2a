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

import org.gf2m.datatypes.UInt128;

/** Commonly used field polynomials, leading term included. */
public final class KnownPolynomials {

  private KnownPolynomials() {}

  /** x^2 + x + 1. */
  public static final long GF4 = 0x7;
  /** x^3 + x + 1. */
  public static final long GF8 = 0xB;
  /** x^4 + x + 1. */
  public static final long GF16 = 0x13;
  /** x^5 + x^2 + 1. */
  public static final long GF32 = 0x25;
  /** x^6 + x + 1. */
  public static final long GF64 = 0x43;
  /** x^7 + x + 1. */
  public static final long GF128 = 0x83;

  /** x^8 + x^4 + x^3 + x^2 + 1, the usual Reed-Solomon GF(2^8) polynomial. Primitive. */
  public static final long REED_SOLOMON_GF256 = 0x11D;

  /** x^8 + x^4 + x^3 + x + 1, the AES polynomial. Irreducible but not primitive. */
  public static final long AES_GF256 = 0x11B;

  /** x^16 + x^12 + x^3 + x + 1. Primitive. */
  public static final long GF65536 = 0x1100B;

  /** x^32 + x^22 + x^2 + x + 1. Primitive. */
  public static final long GF2_32 = 0x1_0040_0007L;

  /** x^64 + x^4 + x^3 + x + 1. Irreducible. */
  public static final UInt128 GF2_64 = UInt128.fromLimbs(0x1BL, 1L);

  /** Primitive polynomials indexed by degree, for degrees 2 to 8. */
  static final long[] PRIMITIVE_BY_DEGREE = {
    0, 0, GF4, GF8, GF16, GF32, GF64, GF128, REED_SOLOMON_GF256,
  };

  /**
   * A primitive polynomial of the given degree.
   *
   * @param degree degree M, from 2 to 8.
   * @return the primitive polynomial.
   */
  public static long primitive(final int degree) {
    if (degree < 2 || degree >= PRIMITIVE_BY_DEGREE.length) {
      throw new IllegalArgumentException("No primitive polynomial recorded for degree " + degree);
    }
    return PRIMITIVE_BY_DEGREE[degree];
  }
}
