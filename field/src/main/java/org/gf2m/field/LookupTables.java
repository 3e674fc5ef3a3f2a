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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.google.common.annotations.VisibleForTesting;
import org.gf2m.datatypes.StorageWidth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponent and logarithm tables of a field, indexed over the full storage width.
 *
 * <p>Tables are generated once per (width, polynomial) and shared process wide. They are never
 * written after publication.
 */
final class LookupTables {
  private static final Logger LOG = LoggerFactory.getLogger(LookupTables.class);

  private static final ConcurrentMap<Key, LookupTables> CACHE = new ConcurrentHashMap<>();

  // exp[i] = α^i for i in [0, 2^M - 1)
  private final int[] exp;
  // log[v] = i such that exp[i] == v, log[0] = -1
  private final int[] log;

  private LookupTables(final int[] exp, final int[] log) {
    this.exp = exp;
    this.log = log;
  }

  /**
   * Tables of a polynomial, generated on first use.
   *
   * <p>The polynomial must already have passed {@link PolynomialValidator#validatePrimitive}.
   */
  static LookupTables forPolynomial(final StorageWidth width, final int polynomial) {
    return CACHE.computeIfAbsent(new Key(width, polynomial), k -> generate(width, polynomial));
  }

  @VisibleForTesting
  static LookupTables generate(final StorageWidth width, final int polynomial) {
    final int degree = PolyDiv.degree(polynomial);
    final int order = (1 << degree) - 1;
    final int[] exp = new int[1 << width.bits()];
    final int[] log = new int[1 << width.bits()];

    // Linear feedback shift register seeded with α^0 = 1.
    log[0] = -1;
    int value = 1;
    int i = 0;
    do {
      exp[i] = value;
      log[value] = i;
      value = advance(value, polynomial, degree);
      i++;
    } while (value != 1 && i < order);

    LOG.debug("Generated lookup tables for polynomial 0x{} ({} elements)",
        Integer.toHexString(polynomial).toUpperCase(), order + 1);
    return new LookupTables(exp, log);
  }

  /** Multiplies an element by α: shift left, reduce when the degree overflows. */
  static int advance(final int value, final int polynomial, final int degree) {
    int next = value << 1;
    if ((next & (1 << degree)) != 0) {
      next ^= polynomial;
    }
    return next;
  }

  int exp(final int index) {
    return exp[index];
  }

  int log(final int value) {
    return log[value];
  }

  @VisibleForTesting
  static void clearCache() {
    CACHE.clear();
  }

  private static final class Key {
    private final StorageWidth width;
    private final int polynomial;

    Key(final StorageWidth width, final int polynomial) {
      this.width = width;
      this.polynomial = polynomial;
    }

    @Override
    public boolean equals(final Object obj) {
      if (this == obj) return true;
      if (!(obj instanceof Key)) return false;
      Key other = (Key) obj;
      return width == other.width && polynomial == other.polynomial;
    }

    @Override
    public int hashCode() {
      return Objects.hash(width, polynomial);
    }
  }
}
