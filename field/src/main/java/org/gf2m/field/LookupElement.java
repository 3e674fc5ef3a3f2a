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

/** Element of a {@link LookupGaloisField}. */
public final class LookupElement extends AbstractGaloisFieldElement<LookupElement> {

  private final LookupGaloisField field;

  LookupElement(final LookupGaloisField field, final long value) {
    super(value);
    this.field = field;
  }

  @Override
  public LookupGaloisField field() {
    return field;
  }

  @Override
  public LookupElement mul(final LookupElement other) {
    return new LookupElement(field, field.multiply(value, other.value));
  }

  @Override
  public LookupElement div(final LookupElement other) {
    return new LookupElement(field, field.divide(value, other.value));
  }

  @Override
  public LookupElement inverse() {
    return new LookupElement(field, field.invert(value));
  }

  /**
   * Discrete logarithm of this element in base α.
   *
   * @return i such that α^i equals this element, -1 for zero.
   */
  public int logAlpha() {
    return field.logAlpha(value);
  }
}
