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

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/** One {@code name [as asname]} clause of an import statement. */
public final class Alias extends Node {
  /** The (possibly dotted) name being imported. */
  public final String name;

  public final @Nullable String asname;

  public Alias(String name, @Nullable String asname) {
    this.name = Preconditions.checkNotNull(name);
    this.asname = asname;
  }

  /** The name that this clause binds in the importing scope. */
  public String boundName() {
    return (asname != null) ? asname : name;
  }

  @Override
  public String toString() {
    return (asname == null) ? name : name + " as " + asname;
  }
}
