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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** The root of the AST for one source file. */
public final class Module extends Node {
  public final ImmutableList<Statement> body;

  public Module(List<Statement> body) {
    this.body = ImmutableList.copyOf(body);
  }

  @Override
  public String toString() {
    return "Module" + body;
  }
}
