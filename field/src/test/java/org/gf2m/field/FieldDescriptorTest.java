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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.gf2m.datatypes.StorageWidth;
import org.junit.jupiter.api.Test;

public class FieldDescriptorTest {

  private static <E extends GaloisFieldElement<E>> long cube(
      final GaloisField<E> field, final long value) {
    E x = field.newElement(value);
    return x.mul(x).mul(x).value();
  }

  @Test
  public void open_computationBackendByDefault() {
    FieldDescriptor descriptor =
        FieldDescriptor.builder()
            .width(StorageWidth.U8)
            .polynomial(KnownPolynomials.AES_GF256)
            .build();

    GaloisField<?> field = descriptor.open();

    assertThat(descriptor.backend()).isEqualTo(Backend.COMPUTATION);
    assertThat(field).isInstanceOf(ComputedGaloisField.class);
    assertThat(field)
        .isEqualTo(ComputedGaloisField.of(StorageWidth.U8, KnownPolynomials.AES_GF256));
  }

  @Test
  public void open_lookupBackend() {
    GaloisField<?> field =
        FieldDescriptor.builder()
            .width(StorageWidth.U8)
            .polynomial(KnownPolynomials.REED_SOLOMON_GF256)
            .backend(Backend.LOOKUP_TABLE)
            .build()
            .open();

    assertThat(field).isInstanceOf(LookupGaloisField.class);
    assertThat(field.backend()).isEqualTo(Backend.LOOKUP_TABLE);
    assertThat(field.degree()).isEqualTo(8);
  }

  @Test
  public void open_backendsComputeTheSameValues() {
    FieldDescriptor.Builder builder =
        FieldDescriptor.builder().width(StorageWidth.U16).polynomial(KnownPolynomials.GF65536);
    GaloisField<?> computed = builder.backend(Backend.COMPUTATION).build().open();
    GaloisField<?> lookup = builder.backend(Backend.LOOKUP_TABLE).build().open();

    for (long v = 0; v < 1 << 16; v += 97) {
      assertThat(cube(lookup, v)).isEqualTo(cube(computed, v));
    }
  }

  @Test
  public void open_wideComputedField() {
    GaloisField<?> field =
        FieldDescriptor.builder()
            .width(StorageWidth.U64)
            .polynomial(KnownPolynomials.GF2_64)
            .build()
            .open();

    assertThat(field.degree()).isEqualTo(64);
    assertThat(cube(field, 2)).isEqualTo(8L);
  }

  @Test
  public void open_lookupRejectsNonPrimitivePolynomial() {
    FieldDescriptor descriptor =
        FieldDescriptor.builder()
            .width(StorageWidth.U8)
            .polynomial(KnownPolynomials.AES_GF256)
            .backend(Backend.LOOKUP_TABLE)
            .build();

    assertThatThrownBy(descriptor::open)
        .isInstanceOfSatisfying(
            InvalidPolynomialException.class,
            e -> assertThat(e.reason()).isEqualTo(InvalidPolynomialException.Reason.NOT_PRIMITIVE));
  }

  @Test
  public void build_requiresWidthAndPolynomial() {
    assertThatThrownBy(() -> FieldDescriptor.builder().polynomial(0x11D).build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Storage width is required");
    assertThatThrownBy(() -> FieldDescriptor.builder().width(StorageWidth.U8).build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Polynomial is required");
  }

  @Test
  public void build_rejectsPolynomialWiderThanStorage() {
    assertThatThrownBy(
            () -> FieldDescriptor.builder().width(StorageWidth.U8).polynomial(0x1100B).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Polynomial of degree 16 does not fit U8");
    assertThatThrownBy(() -> FieldDescriptor.builder().width(StorageWidth.U8).polynomial(1).build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void build_rejectsLookupTablesOnWideStorage() {
    assertThatThrownBy(
            () ->
                FieldDescriptor.builder()
                    .width(StorageWidth.U32)
                    .polynomial(KnownPolynomials.GF2_32)
                    .backend(Backend.LOOKUP_TABLE)
                    .build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("limited to 16 bits");
  }

  @Test
  public void builder_rejectsNulls() {
    assertThatThrownBy(() -> FieldDescriptor.builder().width(null))
        .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> FieldDescriptor.builder().backend(null))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  public void equalsAndToString() {
    FieldDescriptor a =
        FieldDescriptor.builder().width(StorageWidth.U8).polynomial(0x11D).build();
    FieldDescriptor b =
        FieldDescriptor.builder()
            .width(StorageWidth.U8)
            .polynomial(KnownPolynomials.REED_SOLOMON_GF256)
            .backend(Backend.COMPUTATION)
            .build();

    assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    assertThat(a.toString())
        .isEqualTo("FieldDescriptor{width=U8, polynomial=0x11D, backend=COMPUTATION}");
  }
}
