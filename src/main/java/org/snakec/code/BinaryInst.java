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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** Sets {@link #result} to {@code left op right}. */
public final class BinaryInst extends Instruction {
  public final Register result;
  public final ArithOp op;
  public final Operand left;
  public final Operand right;

  public BinaryInst(Register result, ArithOp op, Operand left, Operand right) {
    this.result = Preconditions.checkNotNull(result);
    this.op = Preconditions.checkNotNull(op);
    this.left = Preconditions.checkNotNull(left);
    this.right = Preconditions.checkNotNull(right);
  }

  @Override
  public boolean isControlTransfer() {
    return false;
  }

  @Override
  public ImmutableList<Operand> inputs() {
    return ImmutableList.of(left, right);
  }

  @Override
  public String toString() {
    return String.format("%s = %s %s, %s", result, op.mnemonic, left, right);
  }
}
