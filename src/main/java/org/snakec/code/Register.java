/*
 * Copyright 2025 The Snakec Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.snakec.code;

/**
 * A Register is a virtual register holding the result of one instruction. Registers are created
 * by {@link Cfg#newRegister}, which numbers them sequentially from zero; indices are never reused
 * within a Cfg. Architecture-specific code generation is responsible for mapping them to machine
 * registers or stack slots.
 */
public final class Register extends Operand {
  public final int index;

  Register(int index) {
    this.index = index;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Register r && index == r.index;
  }

  @Override
  public int hashCode() {
    return index;
  }

  @Override
  public String toString() {
    return "%" + index;
  }
}
