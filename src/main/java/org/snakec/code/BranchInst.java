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
import org.jspecify.annotations.Nullable;

/**
 * Transfers control to another block. An unconditional branch has no condition and no alternate
 * target; a conditional branch goes to {@link #target} if {@link #condition} is true and to
 * {@link #altTarget} otherwise.
 */
public final class BranchInst extends Instruction {
  public final @Nullable Operand condition;
  public final BasicBlock target;
  public final @Nullable BasicBlock altTarget;

  public BranchInst(
      @Nullable Operand condition, BasicBlock target, @Nullable BasicBlock altTarget) {
    Preconditions.checkArgument(
        (condition == null) == (altTarget == null),
        "A branch needs both a condition and an alternate target, or neither");
    this.condition = condition;
    this.target = Preconditions.checkNotNull(target);
    this.altTarget = altTarget;
  }

  /** Returns an unconditional branch to {@code target}. */
  public static BranchInst to(BasicBlock target) {
    return new BranchInst(null, target, null);
  }

  public boolean isConditional() {
    return condition != null;
  }

  @Override
  public boolean isControlTransfer() {
    return true;
  }

  @Override
  public ImmutableList<Operand> inputs() {
    return (condition == null) ? ImmutableList.of() : ImmutableList.of(condition);
  }

  @Override
  public String toString() {
    if (condition == null) {
      return "br " + target.label;
    } else {
      return String.format("br %s, %s, %s", condition, target.label, altTarget.label);
    }
  }
}
