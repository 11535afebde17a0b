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

/** The arithmetic and bitwise operations that a {@link BinaryInst} can perform. */
public enum ArithOp {
  ADD("add"),
  SUB("sub"),
  MUL("mul"),
  MAT_MUL("matmul"),
  DIV("div"),
  MOD("mod"),
  POW("pow"),
  SHL("shl"),
  SHR("shr"),
  OR("or"),
  XOR("xor"),
  AND("and"),
  FLOOR_DIV("floordiv");

  /** The name used for this operation when printing instructions. */
  public final String mnemonic;

  ArithOp(String mnemonic) {
    this.mnemonic = mnemonic;
  }
}
