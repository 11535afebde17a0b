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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.snakec.ast.Alias;
import org.snakec.ast.Arg;
import org.snakec.ast.Arguments;
import org.snakec.ast.Comprehension;
import org.snakec.ast.Expression;
import org.snakec.ast.Statement;

/**
 * Determines which identifiers are bound at each lexical level, and assigns each one a slot so that
 * lowering can address it as a (depth, offset) pair.
 *
 * <p>Each {@code gather} method handles one kind of level (a module or function body, a class body,
 * a parameter list, or the targets of a comprehension) and returns a {@link SlotMap} over a
 * caller-chosen range of slots. The caller composes these into a scope stack, outermost first, and
 * resolves identifiers with {@link #lookupValue}.
 *
 * <p>Names are collected in the order they are first bound, so slot assignment is reproducible.
 */
public final class ScopeResolver {

  /** The method whose {@code self.<attr>} assignments define a class's instance attributes. */
  public static final String INIT = "__init__";

  // Static methods only
  private ScopeResolver() {}

  /**
   * Returns a SlotMap for the identifiers that {@code stmts} bind in their own scope, starting at
   * slot {@code startIndex}. Nested function and class bodies are not scanned (they are separate
   * levels), but if {@code isClass} is true the {@code self.<attr>} targets of an {@code __init__}
   * method are gathered into this scope as well.
   *
   * @throws UnsupportedConstructError if a binding can't be resolved locally, e.g. a list
   *     assignment target or a {@code from ... import}
   */
  public static SlotMap gatherScope(List<Statement> stmts, int startIndex, boolean isClass) {
    Set<String> names = new LinkedHashSet<>();
    new BindingCollector(names, isClass).visitAll(stmts);
    return SlotMap.assign(names, startIndex);
  }

  /**
   * Returns a SlotMap for a function's positional parameters. Other kinds of parameters (varargs,
   * keyword-only, keyword varargs) are not yet bound.
   */
  public static SlotMap gatherFuncParams(Arguments params, int startIndex) {
    Set<String> names = new LinkedHashSet<>();
    for (Arg arg : params.args) {
      names.add(arg.arg);
    }
    return SlotMap.assign(names, startIndex);
  }

  /** Returns a SlotMap for the targets of a comprehension's {@code for} clauses. */
  public static SlotMap gatherCompTargets(List<Comprehension> generators, int startIndex) {
    Set<String> names = new LinkedHashSet<>();
    for (Comprehension generator : generators) {
      unpackAssignTargets(names, generator.target);
    }
    return SlotMap.assign(names, startIndex);
  }

  /**
   * Adds to {@code scope} each attribute assigned through the first parameter of an {@code
   * __init__} method (e.g. {@code a} for {@code self.a = y}). Assignments to anything else are
   * local to the method and are ignored. If the method has no parameters nothing is added, since
   * it is not being used as an initializer in the usual way.
   */
  static void gatherClassInit(Statement.FunctionDef init, Set<String> scope) {
    Preconditions.checkArgument(
        init.name.equals(INIT), "gatherClassInit called on '%s'", init.name);
    if (init.args.args.isEmpty()) {
      return;
    }
    String selfAlias = init.args.args.get(0).arg;
    new AttributeCollector(scope, selfAlias).visitAll(init.body);
  }

  /**
   * Searches {@code scopeStack} from the innermost (last) scope outwards, and returns the address
   * of the first binding found for {@code id}.
   *
   * @throws NameError if no scope binds {@code id}
   */
  public static SymbolAddress lookupValue(List<SlotMap> scopeStack, String id) {
    for (int depth = scopeStack.size() - 1; depth >= 0; depth--) {
      Integer offset = scopeStack.get(depth).slot(id);
      if (offset != null) {
        return new SymbolAddress(depth, offset);
      }
    }
    throw new NameError(id);
  }

  /**
   * Adds the names bound by assigning to {@code target}: a name binds itself, and a tuple binds
   * each of its elements. Other targets (attributes, subscripts) don't bind anything in this scope.
   */
  private static void unpackAssignTargets(Set<String> scope, Expression target) {
    if (target instanceof Expression.Name name) {
      scope.add(name.id);
    } else if (target instanceof Expression.Tuple tuple) {
      for (Expression elt : tuple.elts) {
        unpackAssignTargets(scope, elt);
      }
    } else if (target instanceof Expression.List) {
      throw new UnsupportedConstructError(target, "as an assignment target");
    }
  }

  /**
   * Like {@link #unpackAssignTargets}, but adds only the attribute names of targets of the form
   * {@code alias.attr}.
   */
  private static void unpackAssignAlias(Set<String> scope, Expression target, String alias) {
    if (target instanceof Expression.Attribute attribute) {
      if (attribute.value instanceof Expression.Name base && base.id.equals(alias)) {
        scope.add(attribute.attr);
      }
    } else if (target instanceof Expression.Tuple tuple) {
      for (Expression elt : tuple.elts) {
        unpackAssignAlias(scope, elt, alias);
      }
    } else if (target instanceof Expression.List) {
      throw new UnsupportedConstructError(target, "as an assignment target");
    }
  }

  /** Base class for the two statement walks; every statement kind binds nothing by default. */
  private abstract static class StatementWalker implements Statement.Visitor<Void> {

    final void visitAll(List<Statement> stmts) {
      for (Statement stmt : stmts) {
        var unused = stmt.accept(this);
      }
    }

    @Override
    public Void visitFunctionDef(Statement.FunctionDef stmt) {
      return null;
    }

    @Override
    public Void visitClassDef(Statement.ClassDef stmt) {
      return null;
    }

    @Override
    public Void visitReturn(Statement.Return stmt) {
      return null;
    }

    @Override
    public Void visitAssign(Statement.Assign stmt) {
      return null;
    }

    // An augmented assignment needs an existing binding, so it never introduces one.
    @Override
    public Void visitAugAssign(Statement.AugAssign stmt) {
      return null;
    }

    @Override
    public Void visitFor(Statement.For stmt) {
      visitAll(stmt.body);
      visitAll(stmt.orelse);
      return null;
    }

    @Override
    public Void visitWhile(Statement.While stmt) {
      visitAll(stmt.body);
      visitAll(stmt.orelse);
      return null;
    }

    @Override
    public Void visitIf(Statement.If stmt) {
      visitAll(stmt.body);
      visitAll(stmt.orelse);
      return null;
    }

    @Override
    public Void visitImport(Statement.Import stmt) {
      return null;
    }

    @Override
    public Void visitImportFrom(Statement.ImportFrom stmt) {
      return null;
    }

    @Override
    public Void visitExpr(Statement.Expr stmt) {
      return null;
    }

    @Override
    public Void visitPass(Statement.Pass stmt) {
      return null;
    }

    @Override
    public Void visitBreak(Statement.Break stmt) {
      return null;
    }

    @Override
    public Void visitContinue(Statement.Continue stmt) {
      return null;
    }
  }

  /** Collects the names bound at one level by {@link #gatherScope}. */
  private static class BindingCollector extends StatementWalker {
    final Set<String> scope;
    final boolean isClass;

    BindingCollector(Set<String> scope, boolean isClass) {
      this.scope = scope;
      this.isClass = isClass;
    }

    @Override
    public Void visitFunctionDef(Statement.FunctionDef stmt) {
      scope.add(stmt.name);
      if (isClass && stmt.name.equals(INIT)) {
        gatherClassInit(stmt, scope);
      }
      return null;
    }

    @Override
    public Void visitClassDef(Statement.ClassDef stmt) {
      scope.add(stmt.name);
      return null;
    }

    @Override
    public Void visitAssign(Statement.Assign stmt) {
      for (Expression target : stmt.targets) {
        unpackAssignTargets(scope, target);
      }
      return null;
    }

    @Override
    public Void visitFor(Statement.For stmt) {
      unpackAssignTargets(scope, stmt.target);
      return super.visitFor(stmt);
    }

    @Override
    public Void visitImport(Statement.Import stmt) {
      for (Alias alias : stmt.names) {
        scope.add(alias.boundName());
      }
      return null;
    }

    @Override
    public Void visitImportFrom(Statement.ImportFrom stmt) {
      // A wildcard import binds names we can only know by resolving the whole imported module.
      throw new UnsupportedConstructError(stmt, "when gathering a scope");
    }
  }

  /** Collects the {@code <alias>.<attr>} assignment targets of an {@code __init__} body. */
  private static class AttributeCollector extends StatementWalker {
    final Set<String> scope;
    final String selfAlias;

    AttributeCollector(Set<String> scope, String selfAlias) {
      this.scope = scope;
      this.selfAlias = selfAlias;
    }

    @Override
    public Void visitAssign(Statement.Assign stmt) {
      for (Expression target : stmt.targets) {
        unpackAssignAlias(scope, target, selfAlias);
      }
      return null;
    }
  }
}
