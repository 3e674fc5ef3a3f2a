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
import static com.google.common.base.Preconditions.checkState;

import java.util.Objects;

import org.gf2m.datatypes.StorageWidth;
import org.gf2m.datatypes.UInt128;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration of a field instantiation: storage width, polynomial and backend.
 *
 * <pre>{@code
 * GaloisField<?> field =
 *     FieldDescriptor.builder()
 *         .width(StorageWidth.U8)
 *         .polynomial(KnownPolynomials.REED_SOLOMON_GF256)
 *         .backend(Backend.LOOKUP_TABLE)
 *         .build()
 *         .open();
 * }</pre>
 */
public final class FieldDescriptor {
  private static final Logger LOG = LoggerFactory.getLogger(FieldDescriptor.class);

  private final StorageWidth width;
  private final UInt128 polynomial;
  private final Backend backend;

  private FieldDescriptor(
      final StorageWidth width, final UInt128 polynomial, final Backend backend) {
    this.width = width;
    this.polynomial = polynomial;
    this.backend = backend;
  }

  /**
   * Starts a new descriptor.
   *
   * @return an empty builder.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Storage width.
   *
   * @return the width W.
   */
  public StorageWidth width() {
    return width;
  }

  /**
   * Field polynomial.
   *
   * @return the polynomial, leading term included.
   */
  public UInt128 polynomial() {
    return polynomial;
  }

  /**
   * Arithmetic backend.
   *
   * @return the backend.
   */
  public Backend backend() {
    return backend;
  }

  /**
   * Instantiates the described field.
   *
   * @return the field.
   * @throws InvalidPolynomialException if the lookup table backend is asked for a polynomial that
   *     is not primitive.
   */
  public GaloisField<?> open() {
    LOG.debug("Opening {}", this);
    switch (backend) {
      case COMPUTATION:
        return ComputedGaloisField.of(width, polynomial);
      case LOOKUP_TABLE:
        return LookupGaloisField.of(width, polynomial.lower());
      default:
        throw new IllegalStateException("Unknown backend " + backend);
    }
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof FieldDescriptor)) return false;
    FieldDescriptor other = (FieldDescriptor) obj;
    return width == other.width
        && backend == other.backend
        && polynomial.equals(other.polynomial);
  }

  @Override
  public int hashCode() {
    return Objects.hash(width, polynomial, backend);
  }

  @Override
  public String toString() {
    return "FieldDescriptor{width="
        + width
        + ", polynomial=0x"
        + polynomial.toBigInteger().toString(16).toUpperCase()
        + ", backend="
        + backend
        + "}";
  }

  /** Builder of {@link FieldDescriptor}. */
  public static final class Builder {
    private StorageWidth width;
    private UInt128 polynomial;
    private Backend backend = Backend.COMPUTATION;

    private Builder() {}

    /**
     * Sets the storage width.
     *
     * @param width storage width.
     * @return this builder.
     */
    public Builder width(final StorageWidth width) {
      this.width = checkNotNull(width, "width");
      return this;
    }

    /**
     * Sets a polynomial of degree up to 63.
     *
     * @param polynomial polynomial, leading term included.
     * @return this builder.
     */
    public Builder polynomial(final long polynomial) {
      this.polynomial = UInt128.fromLong(polynomial);
      return this;
    }

    /**
     * Sets a polynomial of degree up to 127.
     *
     * @param polynomial polynomial, leading term included.
     * @return this builder.
     */
    public Builder polynomial(final UInt128 polynomial) {
      this.polynomial = checkNotNull(polynomial, "polynomial");
      return this;
    }

    /**
     * Sets the backend, {@link Backend#COMPUTATION} unless set.
     *
     * @param backend arithmetic backend.
     * @return this builder.
     */
    public Builder backend(final Backend backend) {
      this.backend = checkNotNull(backend, "backend");
      return this;
    }

    /**
     * Validates and builds the descriptor.
     *
     * @return the descriptor.
     */
    public FieldDescriptor build() {
      checkState(width != null, "Storage width is required");
      checkState(polynomial != null, "Polynomial is required");
      final int degree = PolyDiv.degree(polynomial);
      checkArgument(
          degree >= 1 && degree <= width.bits(),
          "Polynomial of degree %s does not fit %s",
          degree,
          width);
      if (backend == Backend.LOOKUP_TABLE) {
        checkArgument(
            width.bits() <= PolynomialValidator.MAX_TABLE_BITS,
            "Lookup tables are limited to %s bits, got %s",
            PolynomialValidator.MAX_TABLE_BITS,
            width);
      }
      return new FieldDescriptor(width, polynomial, backend);
    }
  }
}
