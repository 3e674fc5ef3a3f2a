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
import org.gf2m.datatypes.UInt128;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class CarrylessMultiplyTest {

  @Test
  public void clmul_8bit() {
    assertThat(CarrylessMultiply.clmul(0xF, 0x81, StorageWidth.U8)).isEqualTo(0x078FL);
  }

  @Test
  public void clmul_16bit() {
    assertThat(CarrylessMultiply.clmul(0xF, 0x8001, StorageWidth.U16)).isEqualTo(0x7800FL);
  }

  @Test
  public void clmul_32bit() {
    assertThat(CarrylessMultiply.clmul(0xF, 0x8000_0001L, StorageWidth.U32))
        .isEqualTo(0x7_8000_000FL);
  }

  @Test
  public void clmulWide_64bit() {
    UInt128 product = CarrylessMultiply.clmulWide(0xF, 0x8000_0000_0000_0001L);
    assertThat(product.lower()).isEqualTo(0x8000_0000_0000_000FL);
    assertThat(product.upper()).isEqualTo(0x7L);
  }

  @Test
  public void clmul_splitHalves() {
    assertThat(CarrylessMultiply.clmulLow(0xF, 0x81, StorageWidth.U8)).isEqualTo(0x8FL);
    assertThat(CarrylessMultiply.clmulHigh(0xF, 0x81, StorageWidth.U8)).isEqualTo(0x07L);
  }

  @Test
  public void clmul_noCarryBetweenBits() {
    // (x + 1)^2 = x^2 + 1 over GF(2), while 3 * 3 = 9 with carries.
    assertThat(CarrylessMultiply.clmul(3, 3, StorageWidth.U8)).isEqualTo(5L);
  }

  @Test
  public void clmul_rejects64BitOperands() {
    assertThatThrownBy(() -> CarrylessMultiply.clmul(1, 1, StorageWidth.U64))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @ParameterizedTest
  @EnumSource(StorageWidth.class)
  public void clmulWide_allOnesSquared(final StorageWidth width) {
    // (sum x^i)^2 = sum x^(2i) in characteristic 2.
    long allOnes = width.mask();
    UInt128 expected = UInt128.ZERO;
    for (int i = 0; i < width.bits(); i++) {
      expected = expected.xor(UInt128.widen(1L, 2 * i));
    }
    assertThat(CarrylessMultiply.clmulWide(allOnes, allOnes, width)).isEqualTo(expected);
  }

  @ParameterizedTest
  @EnumSource(
      value = StorageWidth.class,
      names = {"U8", "U16", "U32"})
  public void clmul_agreesWithWide(final StorageWidth width) {
    long a = 0xDEAD_BEEFL & width.mask();
    long b = 0x1234_5678L & width.mask();
    UInt128 wide = CarrylessMultiply.clmulWide(a, b, width);
    assertThat(wide.upper()).isZero();
    assertThat(CarrylessMultiply.clmul(a, b, width)).isEqualTo(wide.lower());
  }
}
