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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Static helpers for mapping source file paths to module names. */
public final class SourceFiles {

  // Static methods only
  private SourceFiles() {}

  /** The directory that contains a source file, and the module name the file defines. */
  public record FilePrefix(String sourceRoot, String moduleName) {}

  /** Holds the filename pattern, which is compiled the first time it is needed. */
  private static class FilenamePattern {
    static final Pattern PATTERN = Pattern.compile("(.*/)?(.+)\\.py$");
  }

  /**
   * Splits a source file path into the directory that contains it (including the trailing "/", or
   * "./" if the path has no directory) and the file name without its ".py" extension.
   *
   * @throws SourcePathError if {@code file} is not a ".py" file
   */
  public static FilePrefix getFilePrefix(String file) {
    Matcher matcher = FilenamePattern.PATTERN.matcher(file);
    if (!matcher.matches()) {
      throw new SourcePathError("unsupported filetype for file: " + file, file);
    }
    String sourceRoot = matcher.group(1);
    String moduleName = matcher.group(2);
    if (moduleName == null) {
      throw new SourcePathError(String.format("'%s' not found", file), file);
    }
    return new FilePrefix((sourceRoot == null) ? "./" : sourceRoot, moduleName);
  }
}
