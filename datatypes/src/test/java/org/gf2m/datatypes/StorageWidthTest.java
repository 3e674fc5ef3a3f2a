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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class StorageWidthTest {

  @Test
  public void masks() {
    assertThat(StorageWidth.U8.mask()).isEqualTo(0xFFL);
    assertThat(StorageWidth.U16.mask()).isEqualTo(0xFFFFL);
    assertThat(StorageWidth.U32.mask()).isEqualTo(0xFFFF_FFFFL);
    assertThat(StorageWidth.U64.mask()).isEqualTo(-1L);
  }

  @Test
  public void onlyU64IsWidest() {
    assertThat(StorageWidth.U64.isWidest()).isTrue();
    assertThat(StorageWidth.U32.isWidest()).isFalse();
  }

  @Test
  public void shiftLeft_truncatesToWidth() {
    assertThat(StorageWidth.U8.shiftLeft(0xFL, 7)).isEqualTo(0x80L);
    assertThat(StorageWidth.U16.shiftLeft(0xFL, 15)).isEqualTo(0x8000L);
    assertThat(StorageWidth.U64.shiftLeft(0xFL, 63)).isEqualTo(Long.MIN_VALUE);
  }

  @Test
  public void shiftRight_masksBeforeShifting() {
    assertThat(StorageWidth.U8.shiftRight(0x1F0L, 4)).isEqualTo(0xFL);
    assertThat(StorageWidth.U64.shiftRight(-1L, 60)).isEqualTo(0xFL);
  }

  @ParameterizedTest
  @EnumSource(StorageWidth.class)
  public void shifts_saturateAtWidth(final StorageWidth width) {
    assertThat(width.shiftLeft(1L, width.bits())).isZero();
    assertThat(width.shiftRight(-1L, width.bits())).isZero();
  }

  @ParameterizedTest
  @EnumSource(StorageWidth.class)
  public void numberOfLeadingZeros_relativeToWidth(final StorageWidth width) {
    assertThat(width.numberOfLeadingZeros(0L)).isEqualTo(width.bits());
    assertThat(width.numberOfLeadingZeros(1L)).isEqualTo(width.bits() - 1);
    assertThat(width.numberOfLeadingZeros(width.mask())).isZero();
  }

  @ParameterizedTest
  @EnumSource(StorageWidth.class)
  public void ofBits_findsWidth(final StorageWidth width) {
    assertThat(StorageWidth.ofBits(width.bits())).isSameAs(width);
  }

  @Test
  public void ofBits_rejectsUnknownWidth() {
    assertThatThrownBy(() -> StorageWidth.ofBits(128)).isInstanceOf(IllegalArgumentException.class);
  }
}
