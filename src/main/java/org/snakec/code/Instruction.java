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

import com.google.common.collect.ImmutableList;

/**
 * An Instruction is one step of a {@link BasicBlock}. Instructions are immutable and belong to
 * exactly one block once added with {@link Cfg#addInst}.
 *
 * <p>Instructions that transfer control ({@link BranchInst} and {@link ReturnInst}) may only appear
 * as the last instruction of a block.
 */
public abstract class Instruction {

  /** Returns true if execution does not continue with the next instruction in the same block. */
  public abstract boolean isControlTransfer();

  /** Returns the operands read by this instruction, in evaluation order. */
  public abstract ImmutableList<Operand> inputs();
}
