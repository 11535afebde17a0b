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

package org.snakec.ast;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The base class of all AST nodes. Nodes are produced by the parser and are never modified after
 * construction, with the single exception of {@link #at}, which the parser may call once to record
 * where the node started in the source.
 */
public abstract class Node {
  /** The 1-based source line of this node, or 0 if unknown. */
  private int lineNo;

  /** The 0-based column of this node within {@link #lineNo}. */
  private int colOffset;

  /** Returns the 1-based source line of this node, or 0 if it was not recorded. */
  public int lineNo() {
    return lineNo;
  }

  /** Returns the column of this node within its line. */
  public int colOffset() {
    return colOffset;
  }

  /** Records the source position of this node; returns this. */
  @CanIgnoreReturnValue
  @SuppressWarnings("unchecked")
  public <T extends Node> T at(int lineNo, int colOffset) {
    this.lineNo = lineNo;
    this.colOffset = colOffset;
    return (T) this;
  }

  /** The name used for this kind of node in diagnostics, e.g. "FunctionDef" or "BinOp". */
  public String kind() {
    return getClass().getSimpleName();
  }
}
