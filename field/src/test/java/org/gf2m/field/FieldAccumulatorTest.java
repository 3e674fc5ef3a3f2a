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

public class FieldAccumulatorTest {

  private static final ComputedGaloisField AES =
      ComputedGaloisField.of(StorageWidth.U8, KnownPolynomials.AES_GF256);

  @Test
  public void assignOperators_matchBinaryOperators() {
    ComputedElement a = AES.newElement(0x57);
    ComputedElement b = AES.newElement(0x83);

    FieldAccumulator<ComputedElement> acc = new FieldAccumulator<>(a);
    acc.mulAssign(b);
    assertThat(acc.get().value()).isEqualTo(0xC1L);

    acc.addAssign(b);
    assertThat(acc.get()).isEqualTo(a.mul(b).add(b));

    acc.subAssign(b);
    assertThat(acc.get()).isEqualTo(a.mul(b));

    acc.divAssign(b);
    assertThat(acc.get()).isEqualTo(a);
  }

  @Test
  public void operatorsChain() {
    LookupGaloisField field =
        LookupGaloisField.of(StorageWidth.U8, KnownPolynomials.REED_SOLOMON_GF256);

    LookupElement result =
        FieldAccumulator.one(field).mulAssign(field.alpha()).mulAssign(field.alphaPow(7)).get();

    assertThat(result.value()).isEqualTo(0x1DL);
  }

  @Test
  public void sumOfAllElements_isZero() {
    FieldAccumulator<ComputedElement> acc = FieldAccumulator.zero(AES);
    for (int v = 0; v < 256; v++) {
      acc.addAssign(AES.newElement(v));
    }
    assertThat(acc.get().isZero()).isTrue();
  }

  @Test
  public void divAssignByZero_keepsValue() {
    FieldAccumulator<ComputedElement> acc = new FieldAccumulator<>(AES.newElement(0x42));

    assertThatThrownBy(() -> acc.divAssign(AES.zero())).isInstanceOf(DivideByZeroException.class);
    assertThat(acc.get().value()).isEqualTo(0x42L);
  }

  @Test
  public void toString_showsHeldElement() {
    assertThat(FieldAccumulator.one(AES).toString()).isEqualTo("FieldAccumulator{0x01}");
  }
}
