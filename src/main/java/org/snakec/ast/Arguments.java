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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The parameter list of a function definition.
 *
 * <p>{@code defaults} holds the default values of the last {@code defaults.size()} elements of
 * {@code args}; {@code kwDefaults} is parallel to {@code kwonlyargs}, with null entries for
 * keyword-only parameters that have no default.
 */
public final class Arguments extends Node {
  public final ImmutableList<Arg> args;
  public final @Nullable Arg vararg;
  public final ImmutableList<Arg> kwonlyargs;
  public final List<@Nullable Expression> kwDefaults;
  public final @Nullable Arg kwarg;
  public final ImmutableList<Expression> defaults;

  /** The parameter list of a function with no parameters. */
  public static final Arguments EMPTY = positional();

  public Arguments(
      List<Arg> args,
      @Nullable Arg vararg,
      List<Arg> kwonlyargs,
      List<@Nullable Expression> kwDefaults,
      @Nullable Arg kwarg,
      List<Expression> defaults) {
    this.args = ImmutableList.copyOf(args);
    this.vararg = vararg;
    this.kwonlyargs = ImmutableList.copyOf(kwonlyargs);
    // ImmutableList can't hold nulls
    this.kwDefaults = Collections.unmodifiableList(new ArrayList<>(kwDefaults));
    this.kwarg = kwarg;
    this.defaults = ImmutableList.copyOf(defaults);
  }

  /** Returns an Arguments with only the given positional parameters. */
  public static Arguments positional(String... names) {
    ImmutableList.Builder<Arg> builder = ImmutableList.builder();
    for (String name : names) {
      builder.add(new Arg(name));
    }
    return new Arguments(
        builder.build(), null, ImmutableList.of(), ImmutableList.of(), null, ImmutableList.of());
  }
}
