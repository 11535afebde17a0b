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

package org.snakec.compiler;

import org.snakec.ast.Node;

/**
 * Thrown when a pass reaches an AST node that it does not (yet) know how to handle, e.g. a list
 * used as an assignment target or any statement other than an expression statement in lowering.
 */
public class UnsupportedConstructError extends CompileError {
  /** The {@link Node#kind} of the offending node. */
  public final String construct;

  public UnsupportedConstructError(Node node, String context) {
    super(
        String.format("%s is not supported %s", node.kind(), context),
        node.lineNo(),
        node.colOffset());
    this.construct = node.kind();
  }
}
