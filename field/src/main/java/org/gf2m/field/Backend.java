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

/** Arithmetic backend of a {@link GaloisField}. */
public enum Backend {
  /** Carry-less multiplication, polynomial reduction and extended Euclidean inversion. */
  COMPUTATION,
  /** Exponent and logarithm tables built from a primitive polynomial. */
  LOOKUP_TABLE
}
