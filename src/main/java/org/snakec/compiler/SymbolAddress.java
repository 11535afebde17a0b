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

/**
 * Where a resolved identifier lives: {@code depth} is the index of its scope in the scope stack
 * (0 is outermost), and {@code offset} is its slot within that scope.
 */
public record SymbolAddress(int depth, int offset) {
  @Override
  public String toString() {
    return String.format("(%s, %s)", depth, offset);
  }
}
