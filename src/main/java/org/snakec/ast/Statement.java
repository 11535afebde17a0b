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
import org.jspecify.annotations.Nullable;

/**
 * A Statement is one of the fixed set of nested subclasses declared here. Passes over statements
 * should implement {@link Visitor}, which has one method per subclass, rather than testing for
 * each subclass; that way adding a statement kind forces every pass to decide what to do with it.
 */
public abstract class Statement extends Node {

  // Only the nested subclasses may extend Statement.
  private Statement() {}

  /** Calls the {@code visitor} method corresponding to this statement's class. */
  public abstract <T> T accept(Visitor<T> visitor);

  /** A pass over statements. */
  public interface Visitor<T> {
    T visitFunctionDef(FunctionDef stmt);

    T visitClassDef(ClassDef stmt);

    T visitReturn(Return stmt);

    T visitAssign(Assign stmt);

    T visitAugAssign(AugAssign stmt);

    T visitFor(For stmt);

    T visitWhile(While stmt);

    T visitIf(If stmt);

    T visitImport(Import stmt);

    T visitImportFrom(ImportFrom stmt);

    T visitExpr(Expr stmt);

    T visitPass(Pass stmt);

    T visitBreak(Break stmt);

    T visitContinue(Continue stmt);
  }

  /** {@code def name(args): body} */
  public static final class FunctionDef extends Statement {
    public final String name;
    public final Arguments args;
    public final ImmutableList<Statement> body;

    public FunctionDef(String name, Arguments args, List<Statement> body) {
      this.name = Preconditions.checkNotNull(name);
      this.args = Preconditions.checkNotNull(args);
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFunctionDef(this);
    }
  }

  /** {@code class name(bases): body} */
  public static final class ClassDef extends Statement {
    public final String name;
    public final ImmutableList<Expression> bases;
    public final ImmutableList<Statement> body;

    public ClassDef(String name, List<Expression> bases, List<Statement> body) {
      this.name = Preconditions.checkNotNull(name);
      this.bases = ImmutableList.copyOf(bases);
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitClassDef(this);
    }
  }

  /** {@code return value}; {@code value} is null for a bare {@code return}. */
  public static final class Return extends Statement {
    public final @Nullable Expression value;

    public Return(@Nullable Expression value) {
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitReturn(this);
    }
  }

  /** {@code t1 = t2 = ... = value}; there is at least one target. */
  public static final class Assign extends Statement {
    public final ImmutableList<Expression> targets;
    public final Expression value;

    public Assign(List<Expression> targets, Expression value) {
      Preconditions.checkArgument(!targets.isEmpty());
      this.targets = ImmutableList.copyOf(targets);
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAssign(this);
    }
  }

  /** {@code target op= value} */
  public static final class AugAssign extends Statement {
    public final Expression target;
    public final Operator op;
    public final Expression value;

    public AugAssign(Expression target, Operator op, Expression value) {
      this.target = Preconditions.checkNotNull(target);
      this.op = Preconditions.checkNotNull(op);
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAugAssign(this);
    }
  }

  /** {@code for target in iter: body else: orelse} */
  public static final class For extends Statement {
    public final Expression target;
    public final Expression iter;
    public final ImmutableList<Statement> body;
    public final ImmutableList<Statement> orelse;

    public For(Expression target, Expression iter, List<Statement> body, List<Statement> orelse) {
      this.target = Preconditions.checkNotNull(target);
      this.iter = Preconditions.checkNotNull(iter);
      this.body = ImmutableList.copyOf(body);
      this.orelse = ImmutableList.copyOf(orelse);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFor(this);
    }
  }

  /** {@code while test: body else: orelse} */
  public static final class While extends Statement {
    public final Expression test;
    public final ImmutableList<Statement> body;
    public final ImmutableList<Statement> orelse;

    public While(Expression test, List<Statement> body, List<Statement> orelse) {
      this.test = Preconditions.checkNotNull(test);
      this.body = ImmutableList.copyOf(body);
      this.orelse = ImmutableList.copyOf(orelse);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitWhile(this);
    }
  }

  /** {@code if test: body else: orelse}; an {@code elif} is a nested If in {@code orelse}. */
  public static final class If extends Statement {
    public final Expression test;
    public final ImmutableList<Statement> body;
    public final ImmutableList<Statement> orelse;

    public If(Expression test, List<Statement> body, List<Statement> orelse) {
      this.test = Preconditions.checkNotNull(test);
      this.body = ImmutableList.copyOf(body);
      this.orelse = ImmutableList.copyOf(orelse);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }
  }

  /** {@code import a, b as c} */
  public static final class Import extends Statement {
    public final ImmutableList<Alias> names;

    public Import(List<Alias> names) {
      this.names = ImmutableList.copyOf(names);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitImport(this);
    }
  }

  /**
   * {@code from module import names}. {@code level} counts the leading dots of a relative import;
   * {@code module} is null for {@code from . import x}.
   */
  public static final class ImportFrom extends Statement {
    public final @Nullable String module;
    public final ImmutableList<Alias> names;
    public final int level;

    public ImportFrom(@Nullable String module, List<Alias> names, int level) {
      Preconditions.checkArgument(level >= 0);
      this.module = module;
      this.names = ImmutableList.copyOf(names);
      this.level = level;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitImportFrom(this);
    }
  }

  /** An expression evaluated for its side effects. */
  public static final class Expr extends Statement {
    public final Expression value;

    public Expr(Expression value) {
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitExpr(this);
    }
  }

  public static final class Pass extends Statement {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitPass(this);
    }
  }

  public static final class Break extends Statement {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBreak(this);
    }
  }

  public static final class Continue extends Statement {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitContinue(this);
    }
  }
}
