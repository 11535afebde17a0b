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

/** Thrown when an identifier is not bound in any scope of the active scope stack. */
public class NameError extends CompileError {
  public final String identifier;

  public NameError(String identifier) {
    super(String.format("name '%s' is not defined", identifier));
    this.identifier = identifier;
  }
}
