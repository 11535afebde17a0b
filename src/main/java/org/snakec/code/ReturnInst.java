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
 * Returns from the current function. If {@link #value} is null, {@link #returnType} must be void;
 * otherwise it is the type the value is returned as.
 */
public final class ReturnInst extends Instruction {
  public final Type returnType;
  public final @Nullable Operand value;

  public ReturnInst(Type returnType, @Nullable Operand value) {
    Preconditions.checkArgument(
        (value == null) == returnType.isVoid(), "Return value doesn't match %s", returnType);
    this.returnType = returnType;
    this.value = value;
  }

  /** Returns a ReturnInst for a function that returns no value. */
  public static ReturnInst ofVoid() {
    return new ReturnInst(Type.VOID, null);
  }

  @Override
  public boolean isControlTransfer() {
    return true;
  }

  @Override
  public ImmutableList<Operand> inputs() {
    return (value == null) ? ImmutableList.of() : ImmutableList.of(value);
  }

  @Override
  public String toString() {
    return (value == null) ? "ret void" : String.format("ret %s %s", returnType, value);
  }
}
