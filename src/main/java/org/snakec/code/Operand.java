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
 * An Operand is an input to an instruction. There are two subclasses:
 *
 * <ul>
 *   <li>{@link Immediate}: a literal value, encoded directly in the instruction
 *   <li>{@link Register}: a value computed by an earlier instruction
 * </ul>
 *
 * <p>Operands are immutable.
 */
public abstract class Operand {

  // Only Immediate and Register may extend Operand.
  Operand() {}

  /** Returns an Immediate with the given value. */
  public static Immediate of(Number value) {
    return new Immediate(value);
  }

  /** A literal numeric value. */
  public static final class Immediate extends Operand {
    public final Number value;

    private Immediate(Number value) {
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Immediate i && value.equals(i.value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }
}
