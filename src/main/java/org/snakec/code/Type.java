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

/**
 * An opaque reference to a type in the static type system. The lowering passes never look inside
 * a Type; they only pass it through to the instructions and functions that need one.
 */
public final class Type {
  /** The type of a function or return that produces no value. */
  public static final Type VOID = new Type("void");

  public final String name;

  private Type(String name) {
    this.name = name;
  }

  /** Returns a Type with the given name; {@code "void"} always returns {@link #VOID}. */
  public static Type named(String name) {
    Preconditions.checkArgument(!name.isEmpty());
    return name.equals(VOID.name) ? VOID : new Type(name);
  }

  public boolean isVoid() {
    return this == VOID;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Type t && name.equals(t.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
