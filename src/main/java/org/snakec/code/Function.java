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

/** A named function with its return type and completed control-flow graph. */
public final class Function {
  public final String name;
  public final Type returnType;
  public final Cfg graph;

  public Function(String name, Type returnType, Cfg graph) {
    this.name = Preconditions.checkNotNull(name);
    this.returnType = Preconditions.checkNotNull(returnType);
    this.graph = Preconditions.checkNotNull(graph);
  }

  @Override
  public String toString() {
    return String.format("function %s() -> %s {\n%s}\n", name, returnType, graph);
  }
}
