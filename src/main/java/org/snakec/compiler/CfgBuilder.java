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
import java.util.List;
import org.snakec.ast.Expression;
import org.snakec.ast.Operator;
import org.snakec.ast.Statement;
import org.snakec.code.ArithOp;
import org.snakec.code.BasicBlock;
import org.snakec.code.BinaryInst;
import org.snakec.code.Cfg;
import org.snakec.code.Operand;
import org.snakec.code.Register;

/**
 * Lowers statements and expressions into the blocks of a single {@link Cfg}.
 *
 * <p>Lowering threads a "current block" through the statements of a function: each statement is
 * lowered into the block it is given, may create new blocks and edges, and returns the block that
 * should receive the next statement. The cursor is only meaningful during a call to one of the
 * {@code lower} methods; a CfgBuilder is used for one function and then discarded.
 *
 * <p>Only expression statements, numeric literals, and binary operations are currently lowered.
 * Everything else throws an {@link UnsupportedConstructError}; supporting another statement or
 * expression kind means replacing its visitor method below.
 */
public class CfgBuilder {
  final Cfg cfg;

  /** The block that instructions are currently being appended to. */
  private BasicBlock current;

  private final StatementLowerer statementLowerer = new StatementLowerer();
  private final ExpressionLowerer expressionLowerer = new ExpressionLowerer();

  public CfgBuilder(Cfg cfg) {
    this.cfg = cfg;
    this.current = cfg.entryBlock();
  }

  /** Lowers each of {@code stmts} in turn, starting in {@code block}; returns the final block. */
  public BasicBlock lowerStatements(BasicBlock block, List<Statement> stmts) {
    for (Statement stmt : stmts) {
      block = lowerStatement(block, stmt);
    }
    return block;
  }

  /**
   * Lowers {@code stmt} with {@code block} as the current block, and returns the block that should
   * be current for the following statement.
   */
  public BasicBlock lowerStatement(BasicBlock block, Statement stmt) {
    current = block;
    return stmt.accept(statementLowerer);
  }

  /**
   * Emits the instructions (if any) needed to compute {@code expr} into {@code block}, and returns
   * an Operand for its value.
   */
  public Operand lowerExpression(BasicBlock block, Expression expr) {
    current = block;
    return expr.accept(expressionLowerer);
  }

  /** Returns the instruction-level operation for an AST operator. */
  static ArithOp arithOp(Operator op) {
    return switch (op) {
      case ADD -> ArithOp.ADD;
      case SUB -> ArithOp.SUB;
      case MULT -> ArithOp.MUL;
      case MAT_MULT -> ArithOp.MAT_MUL;
      case DIV -> ArithOp.DIV;
      case MOD -> ArithOp.MOD;
      case POW -> ArithOp.POW;
      case L_SHIFT -> ArithOp.SHL;
      case R_SHIFT -> ArithOp.SHR;
      case BIT_OR -> ArithOp.OR;
      case BIT_XOR -> ArithOp.XOR;
      case BIT_AND -> ArithOp.AND;
      case FLOOR_DIV -> ArithOp.FLOOR_DIV;
    };
  }

  private static UnsupportedConstructError unsupported(Statement stmt) {
    return new UnsupportedConstructError(stmt, "by lowering yet");
  }

  private static UnsupportedConstructError unsupported(Expression expr) {
    return new UnsupportedConstructError(expr, "by lowering yet");
  }

  /** Each method lowers one kind of statement into {@link #current} and returns the next block. */
  private class StatementLowerer implements Statement.Visitor<BasicBlock> {

    @Override
    public BasicBlock visitExpr(Statement.Expr stmt) {
      // The value is only computed for its side effects.
      var unused = lowerExpression(current, stmt.value);
      return current;
    }

    @Override
    public BasicBlock visitFunctionDef(Statement.FunctionDef stmt) {
      throw unsupported(stmt);
    }

    @Override
    public BasicBlock visitClassDef(Statement.ClassDef stmt) {
      throw unsupported(stmt);
    }

    @Override
    public BasicBlock visitReturn(Statement.Return stmt) {
      throw unsupported(stmt);
    }

    @Override
    public BasicBlock visitAssign(Statement.Assign stmt) {
      throw unsupported(stmt);
    }

    @Override
    public BasicBlock visitAugAssign(Statement.AugAssign stmt) {
      throw unsupported(stmt);
    }

    @Override
    public BasicBlock visitFor(Statement.For stmt) {
      throw unsupported(stmt);
    }

    @Override
    public BasicBlock visitWhile(Statement.While stmt) {
      throw unsupported(stmt);
    }

    @Override
    public BasicBlock visitIf(Statement.If stmt) {
      throw unsupported(stmt);
    }

    @Override
    public BasicBlock visitImport(Statement.Import stmt) {
      throw unsupported(stmt);
    }

    @Override
    public BasicBlock visitImportFrom(Statement.ImportFrom stmt) {
      throw unsupported(stmt);
    }

    @Override
    public BasicBlock visitPass(Statement.Pass stmt) {
      throw unsupported(stmt);
    }

    @Override
    public BasicBlock visitBreak(Statement.Break stmt) {
      throw unsupported(stmt);
    }

    @Override
    public BasicBlock visitContinue(Statement.Continue stmt) {
      throw unsupported(stmt);
    }
  }

  /** Each method emits one kind of expression into {@link #current} and returns its value. */
  private class ExpressionLowerer implements Expression.Visitor<Operand> {

    @Override
    public Operand visitNum(Expression.Num expr) {
      return Operand.of(expr.n);
    }

    @Override
    public Operand visitBinOp(Expression.BinOp expr) {
      BasicBlock block = current;
      // Python evaluates the left operand completely before the right.
      Operand left = lowerExpression(block, expr.left);
      Operand right = lowerExpression(block, expr.right);
      // Neither operand may move the cursor until expressions can contain control flow.
      Preconditions.checkState(current == block);
      Register result = cfg.newRegister();
      cfg.addInst(block, new BinaryInst(result, arithOp(expr.op), left, right));
      return result;
    }

    @Override
    public Operand visitStr(Expression.Str expr) {
      throw unsupported(expr);
    }

    @Override
    public Operand visitName(Expression.Name expr) {
      throw unsupported(expr);
    }

    @Override
    public Operand visitAttribute(Expression.Attribute expr) {
      throw unsupported(expr);
    }

    @Override
    public Operand visitCall(Expression.Call expr) {
      throw unsupported(expr);
    }

    @Override
    public Operand visitList(Expression.List expr) {
      throw unsupported(expr);
    }

    @Override
    public Operand visitTuple(Expression.Tuple expr) {
      throw unsupported(expr);
    }
  }
}
