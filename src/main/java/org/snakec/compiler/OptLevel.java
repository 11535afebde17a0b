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

import org.jspecify.annotations.Nullable;

/**
 * The optimization level requested for a compilation. No optimizations are implemented yet, so
 * every level currently produces the same Program.
 */
public enum OptLevel {
  NONE,
  O1,
  O2,
  O3;

  /**
   * Parses the value of an optimization flag: "1", "2" or "3"; null (no flag given) is {@link
   * #NONE}.
   */
  public static OptLevel parse(@Nullable String flag) {
    if (flag == null) {
      return NONE;
    }
    switch (flag) {
      case "1":
        return O1;
      case "2":
        return O2;
      case "3":
        return O3;
      default:
        throw new IllegalArgumentException("Unknown optimization level '" + flag + "'");
    }
  }
}
