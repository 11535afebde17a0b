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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A BasicBlock is a straight-line sequence of instructions with explicit successor edges. Blocks
 * are created and owned by a {@link Cfg}; all changes to a block (adding instructions or edges) go
 * through its Cfg so that the Cfg can keep predecessor and successor sets consistent.
 */
public final class BasicBlock {
  /** The Cfg that created this block. */
  final Cfg owner;

  /** Unique within {@link #owner}. */
  public final String label;

  private final List<Instruction> instructions = new ArrayList<>();

  // Both sets iterate in the order the edges were added, so that printed graphs are stable.
  final Set<BasicBlock> successors = new LinkedHashSet<>();
  final Set<BasicBlock> predecessors = new LinkedHashSet<>();

  BasicBlock(Cfg owner, String label) {
    this.owner = owner;
    this.label = label;
  }

  /** Appends {@code inst}; callers should use {@link Cfg#addInst}. */
  void append(Instruction inst) {
    instructions.add(inst);
  }

  /** The instructions in this block, in execution order. */
  public List<Instruction> instructions() {
    return Collections.unmodifiableList(instructions);
  }

  /** Returns the last instruction in this block, or null if it is empty. */
  public @Nullable Instruction lastInstruction() {
    return instructions.isEmpty() ? null : instructions.get(instructions.size() - 1);
  }

  /** Returns true if this block ends with a branch or return. */
  public boolean isTerminated() {
    Instruction last = lastInstruction();
    return last != null && last.isControlTransfer();
  }

  /** The blocks that control may pass to when this block completes. */
  public Set<BasicBlock> successors() {
    return Collections.unmodifiableSet(successors);
  }

  /** The blocks that may pass control to this block. */
  public Set<BasicBlock> predecessors() {
    return Collections.unmodifiableSet(predecessors);
  }

  @Override
  public String toString() {
    return label;
  }
}
