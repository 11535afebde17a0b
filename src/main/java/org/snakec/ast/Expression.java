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
import java.util.stream.Collectors;

/**
 * An Expression is one of the fixed set of nested subclasses declared here; as with {@link
 * Statement}, passes should dispatch through {@link Visitor}.
 */
public abstract class Expression extends Node {

  // Only the nested subclasses may extend Expression.
  private Expression() {}

  /** Calls the {@code visitor} method corresponding to this expression's class. */
  public abstract <T> T accept(Visitor<T> visitor);

  /** A pass over expressions. */
  public interface Visitor<T> {
    T visitBinOp(BinOp expr);

    T visitNum(Num expr);

    T visitStr(Str expr);

    T visitName(Name expr);

    T visitAttribute(Attribute expr);

    T visitCall(Call expr);

    T visitList(List expr);

    T visitTuple(Tuple expr);
  }

  /** {@code left op right} */
  public static final class BinOp extends Expression {
    public final Expression left;
    public final Operator op;
    public final Expression right;

    public BinOp(Expression left, Operator op, Expression right) {
      this.left = Preconditions.checkNotNull(left);
      this.op = Preconditions.checkNotNull(op);
      this.right = Preconditions.checkNotNull(right);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBinOp(this);
    }

    @Override
    public String toString() {
      return String.format("(%s %s %s)", left, op.symbol, right);
    }
  }

  /**
   * A numeric literal. {@code n} is an Integer, Long, BigInteger or Double, depending on what the
   * parser needed to represent the literal exactly.
   */
  public static final class Num extends Expression {
    public final Number n;

    public Num(Number n) {
      this.n = Preconditions.checkNotNull(n);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitNum(this);
    }

    @Override
    public String toString() {
      return String.valueOf(n);
    }
  }

  public static final class Str extends Expression {
    public final String s;

    public Str(String s) {
      this.s = Preconditions.checkNotNull(s);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitStr(this);
    }

    @Override
    public String toString() {
      return "'" + s + "'";
    }
  }

  public static final class Name extends Expression {
    public final String id;

    public Name(String id) {
      this.id = Preconditions.checkNotNull(id);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitName(this);
    }

    @Override
    public String toString() {
      return id;
    }
  }

  /** {@code value.attr} */
  public static final class Attribute extends Expression {
    public final Expression value;
    public final String attr;

    public Attribute(Expression value, String attr) {
      this.value = Preconditions.checkNotNull(value);
      this.attr = Preconditions.checkNotNull(attr);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAttribute(this);
    }

    @Override
    public String toString() {
      return value + "." + attr;
    }
  }

  /** {@code func(args)}; only positional arguments are represented. */
  public static final class Call extends Expression {
    public final Expression func;
    public final ImmutableList<Expression> args;

    public Call(Expression func, java.util.List<Expression> args) {
      this.func = Preconditions.checkNotNull(func);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCall(this);
    }

    @Override
    public String toString() {
      return func + join(args, "(", ")");
    }
  }

  /** {@code [e1, e2, ...]} */
  public static final class List extends Expression {
    public final ImmutableList<Expression> elts;

    public List(java.util.List<Expression> elts) {
      this.elts = ImmutableList.copyOf(elts);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitList(this);
    }

    @Override
    public String toString() {
      return join(elts, "[", "]");
    }
  }

  /** {@code (e1, e2, ...)} */
  public static final class Tuple extends Expression {
    public final ImmutableList<Expression> elts;

    public Tuple(java.util.List<Expression> elts) {
      this.elts = ImmutableList.copyOf(elts);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitTuple(this);
    }

    @Override
    public String toString() {
      return join(elts, "(", ")");
    }
  }

  private static String join(ImmutableList<Expression> elements, String prefix, String suffix) {
    return elements.stream().map(String::valueOf).collect(Collectors.joining(", ", prefix, suffix));
  }
}
