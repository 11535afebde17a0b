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
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * The result of compiling one module: an ordered list of functions. The first function is always
 * the synthetic top-level function, named {@link #MAIN}, that runs the module's statements.
 */
public final class Program {
  public static final String MAIN = "main";

  public final ImmutableList<Function> funcs;

  public Program(List<Function> funcs) {
    Preconditions.checkArgument(
        !funcs.isEmpty() && funcs.get(0).name.equals(MAIN), "Program must start with main");
    this.funcs = ImmutableList.copyOf(funcs);
  }

  /** Returns the top-level function. */
  public Function main() {
    return funcs.get(0);
  }

  /** Returns the function with the given name, or null if there is none. */
  public @Nullable Function function(String name) {
    return funcs.stream().filter(f -> f.name.equals(name)).findFirst().orElse(null);
  }

  @Override
  public String toString() {
    return funcs.stream().map(Function::toString).collect(Collectors.joining("\n"));
  }
}
