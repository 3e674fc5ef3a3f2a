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

/** Thrown when dividing by, or inverting, the additive identity of a field. */
public class DivideByZeroException extends ArithmeticException {

  private static final long serialVersionUID = 1L;

  /**
   * Instantiates a new DivideByZeroException.
   *
   * @param message the detail message.
   */
  public DivideByZeroException(final String message) {
    super(message);
  }
}
