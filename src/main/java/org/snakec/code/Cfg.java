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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A Cfg is the control-flow graph of one function: a set of {@link BasicBlock}s connected by
 * directed edges, with a distinguished entry block (where execution starts) and exit block (which
 * returns from the function). Both are created by the constructor and are never removed, so even
 * an empty function's Cfg has two blocks.
 *
 * <p>A Cfg is built incrementally by a single lowering pass; once it has been wrapped in a {@link
 * Function} it should no longer be modified.
 */
public final class Cfg {
  public static final String ENTRY_LABEL = "entry";
  public static final String EXIT_LABEL = "exit";

  /** All blocks, keyed by label, in the order they were created. */
  private final Map<String, BasicBlock> blocks = new LinkedHashMap<>();

  private final BasicBlock entryBlock;
  private final BasicBlock exitBlock;

  /** Used to generate labels for blocks created by {@link #newBlock}. */
  private int nextBlockId;

  private int numRegisters;

  public Cfg() {
    entryBlock = addBlock(ENTRY_LABEL);
    exitBlock = addBlock(EXIT_LABEL);
  }

  public BasicBlock entryBlock() {
    return entryBlock;
  }

  public BasicBlock exitBlock() {
    return exitBlock;
  }

  /** Adds a new, empty block with a label of the form {@code bb<n>}. */
  public BasicBlock newBlock() {
    String label;
    do {
      label = "bb" + nextBlockId++;
    } while (blocks.containsKey(label));
    return addBlock(label);
  }

  /** Adds a new, empty block with the given label, which must not already be in use. */
  @CanIgnoreReturnValue
  public BasicBlock addBlock(String label) {
    Preconditions.checkArgument(!blocks.containsKey(label), "Duplicate block label '%s'", label);
    BasicBlock block = new BasicBlock(this, label);
    blocks.put(label, block);
    return block;
  }

  /** Returns the block with the given label, or null if there is none. */
  public @Nullable BasicBlock block(String label) {
    return blocks.get(label);
  }

  /** All blocks in this graph, in the order they were created (entry and exit first). */
  public Collection<BasicBlock> blocks() {
    return Collections.unmodifiableCollection(blocks.values());
  }

  public int numBlocks() {
    return blocks.size();
  }

  /** Appends an instruction to {@code block}, which must belong to this graph. */
  public void addInst(BasicBlock block, Instruction inst) {
    checkOwned(block);
    Preconditions.checkState(
        !block.isTerminated(), "Block %s already ends with '%s'", block, block.lastInstruction());
    if (inst instanceof BranchInst branch) {
      checkOwned(branch.target);
      if (branch.altTarget != null) {
        checkOwned(branch.altTarget);
      }
    }
    block.append(inst);
  }

  /** Adds an edge from {@code from} to {@code to}; adding an existing edge has no effect. */
  public void connectBlocks(BasicBlock from, BasicBlock to) {
    checkOwned(from);
    checkOwned(to);
    Preconditions.checkArgument(from != exitBlock, "The exit block has no successors");
    from.successors.add(to);
    to.predecessors.add(from);
  }

  /** Returns a new virtual register, distinct from all others in this graph. */
  public Register newRegister() {
    return new Register(numRegisters++);
  }

  /** The number of registers created by {@link #newRegister}. */
  public int numRegisters() {
    return numRegisters;
  }

  private void checkOwned(BasicBlock block) {
    Preconditions.checkArgument(block.owner == this, "Block %s is not in this graph", block);
  }

  /**
   * Checks that this graph is complete, i.e. ready to be handed to code generation:
   *
   * <ul>
   *   <li>every block reachable from the entry ends with a branch or return;
   *   <li>each branch's targets are exactly the block's successors; and
   *   <li>the exit block ends with a return.
   * </ul>
   *
   * Throws an IllegalStateException describing the first problem found.
   */
  public void verify() {
    Preconditions.checkState(blocks.get(ENTRY_LABEL) == entryBlock, "Missing entry block");
    Preconditions.checkState(blocks.get(EXIT_LABEL) == exitBlock, "Missing exit block");
    for (BasicBlock block : blocks.values()) {
      if (block != entryBlock && block != exitBlock && block.predecessors.isEmpty()) {
        // Unreachable blocks are never executed, so we don't care what they contain.
        continue;
      }
      Instruction last = block.lastInstruction();
      Preconditions.checkState(
          last != null && last.isControlTransfer(), "Block %s is not terminated", block);
      if (block == exitBlock) {
        Preconditions.checkState(
            last instanceof ReturnInst, "Exit block ends with '%s', not a return", last);
      } else if (last instanceof BranchInst branch) {
        Preconditions.checkState(
            block.successors.contains(branch.target)
                && (branch.altTarget == null || block.successors.contains(branch.altTarget)),
            "Block %s branches to a block that isn't a successor",
            block);
      }
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (BasicBlock block : blocks.values()) {
      sb.append(block.label).append(':');
      if (!block.successors.isEmpty()) {
        sb.append("  → ").append(block.successors);
      }
      sb.append('\n');
      for (Instruction inst : block.instructions()) {
        sb.append("  ").append(inst).append('\n');
      }
    }
    return sb.toString();
  }
}
