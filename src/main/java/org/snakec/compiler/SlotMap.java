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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import org.jspecify.annotations.Nullable;

/**
 * A SlotMap assigns each identifier bound at one lexical level to a slot index. The indices are
 * exactly the contiguous range {@code [start, start + size)}, assigned in the order the identifiers
 * were first discovered.
 *
 * <p>SlotMaps are immutable; they are built once per nesting level by {@link ScopeResolver} and
 * then only read.
 */
public final class SlotMap {
  private final int start;
  private final ImmutableMap<String, Integer> slots;

  private SlotMap(int start, ImmutableMap<String, Integer> slots) {
    this.start = start;
    this.slots = slots;
  }

  /**
   * Returns a SlotMap that assigns the given names, which must be distinct, to consecutive slots
   * beginning at {@code start}.
   */
  public static SlotMap assign(Collection<String> names, int start) {
    Preconditions.checkArgument(start >= 0);
    ImmutableMap.Builder<String, Integer> builder =
        ImmutableMap.builderWithExpectedSize(names.size());
    int next = start;
    for (String name : names) {
      builder.put(name, next++);
    }
    // buildOrThrow() rejects duplicate names, which would leave a gap in the range.
    return new SlotMap(start, builder.buildOrThrow());
  }

  /** The first slot index of this map. */
  public int start() {
    return start;
  }

  /** One more than the last slot index of this map; equal to {@link #start} if it is empty. */
  public int end() {
    return start + slots.size();
  }

  public int size() {
    return slots.size();
  }

  public boolean isEmpty() {
    return slots.isEmpty();
  }

  public boolean contains(String name) {
    return slots.containsKey(name);
  }

  /** Returns the slot assigned to {@code name}, or null if it is not bound at this level. */
  public @Nullable Integer slot(String name) {
    return slots.get(name);
  }

  /** The bound names, in slot order. */
  public ImmutableSet<String> names() {
    return slots.keySet();
  }

  public ImmutableMap<String, Integer> asMap() {
    return slots;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof SlotMap m && start == m.start && slots.equals(m.slots);
  }

  @Override
  public int hashCode() {
    return 31 * start + slots.hashCode();
  }

  @Override
  public String toString() {
    return slots.toString();
  }
}
