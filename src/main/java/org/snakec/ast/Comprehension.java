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
import com.google.common.collect.ImmutableList;
import java.util.List;

/** One {@code for target in iter if ifs...} clause of a comprehension. */
public final class Comprehension extends Node {
  public final Expression target;
  public final Expression iter;
  public final ImmutableList<Expression> ifs;

  public Comprehension(Expression target, Expression iter, List<Expression> ifs) {
    this.target = Preconditions.checkNotNull(target);
    this.iter = Preconditions.checkNotNull(iter);
    this.ifs = ImmutableList.copyOf(ifs);
  }
}
