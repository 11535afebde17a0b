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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.snakec.testing.Ast.add;
import static org.snakec.testing.Ast.assign;
import static org.snakec.testing.Ast.binOp;
import static org.snakec.testing.Ast.body;
import static org.snakec.testing.Ast.call;
import static org.snakec.testing.Ast.expr;
import static org.snakec.testing.Ast.mul;
import static org.snakec.testing.Ast.name;
import static org.snakec.testing.Ast.num;
import static org.snakec.testing.Ast.pass;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.snakec.ast.Expression;
import org.snakec.ast.Operator;
import org.snakec.ast.Statement;
import org.snakec.code.ArithOp;
import org.snakec.code.BasicBlock;
import org.snakec.code.BinaryInst;
import org.snakec.code.Cfg;
import org.snakec.code.Operand;
import org.snakec.code.Register;

@RunWith(TestParameterInjector.class)
public class CfgBuilderTest {

  private Cfg cfg;
  private CfgBuilder builder;

  @Before
  public void setup() {
    cfg = new Cfg();
    builder = new CfgBuilder(cfg);
  }

  @Test
  public void numberIsImmediate() {
    Operand result = builder.lowerExpression(cfg.entryBlock(), num(42));
    assertThat(result).isEqualTo(Operand.of(42));
    assertThat(cfg.entryBlock().instructions()).isEmpty();
    assertThat(cfg.numRegisters()).isEqualTo(0);
  }

  @Test
  public void binOpEmitsOneInstruction() {
    Operand result = builder.lowerExpression(cfg.entryBlock(), add(num(1), num(2.5)));
    assertThat(result).isInstanceOf(Register.class);
    assertThat(cfg.entryBlock().instructions()).hasSize(1);
    BinaryInst inst = (BinaryInst) cfg.entryBlock().instructions().get(0);
    assertThat(inst.result).isEqualTo(result);
    assertThat(inst.op).isEqualTo(ArithOp.ADD);
    assertThat(inst.left).isEqualTo(Operand.of(1));
    assertThat(inst.right).isEqualTo(Operand.of(2.5));
    assertThat(inst.toString()).isEqualTo("%0 = add 1, 2.5");
  }

  /** {@code (1 * 2) + (3 * 4)} must compute {@code 1 * 2} first. */
  @Test
  public void leftOperandIsLoweredFirst() {
    Expression expr = add(mul(num(1), num(2)), mul(num(3), num(4)));
    Operand result = builder.lowerExpression(cfg.entryBlock(), expr);
    assertThat(printed(cfg.entryBlock()))
        .containsExactly("%0 = mul 1, 2", "%1 = mul 3, 4", "%2 = add %0, %1")
        .inOrder();
    assertThat(result.toString()).isEqualTo("%2");
  }

  @Test
  public void nestedLeftOperands() {
    // ((1 - 2) - 3) - 4
    Expression expr =
        binOp(
            binOp(binOp(num(1), Operator.SUB, num(2)), Operator.SUB, num(3)),
            Operator.SUB,
            num(4));
    var unused = builder.lowerExpression(cfg.entryBlock(), expr);
    assertThat(printed(cfg.entryBlock()))
        .containsExactly("%0 = sub 1, 2", "%1 = sub %0, 3", "%2 = sub %1, 4")
        .inOrder();
  }

  @Test
  public void everyOperatorIsMapped(@TestParameter Operator op) {
    Operand result = builder.lowerExpression(cfg.entryBlock(), binOp(num(6), op, num(3)));
    BinaryInst inst = (BinaryInst) cfg.entryBlock().instructions().get(0);
    assertThat(inst.result).isEqualTo(result);
    assertThat(inst.op).isEqualTo(expectedArithOp(op));
  }

  /** Returns the printed form of each instruction in {@code block}. */
  private static List<String> printed(BasicBlock block) {
    return block.instructions().stream().map(Object::toString).collect(Collectors.toList());
  }

  private static ArithOp expectedArithOp(Operator op) {
    switch (op) {
      case MULT:
        return ArithOp.MUL;
      case MAT_MULT:
        return ArithOp.MAT_MUL;
      case L_SHIFT:
        return ArithOp.SHL;
      case R_SHIFT:
        return ArithOp.SHR;
      case BIT_OR:
        return ArithOp.OR;
      case BIT_XOR:
        return ArithOp.XOR;
      case BIT_AND:
        return ArithOp.AND;
      default:
        return ArithOp.valueOf(op.name());
    }
  }

  @Test
  public void expressionStatementKeepsBlock() {
    BasicBlock next = builder.lowerStatement(cfg.entryBlock(), expr(add(num(1), num(2))));
    assertThat(next).isSameInstanceAs(cfg.entryBlock());
    assertThat(cfg.entryBlock().instructions()).hasSize(1);
    assertThat(cfg.entryBlock().successors()).isEmpty();
  }

  @Test
  public void statementsAreFolded() {
    BasicBlock block = cfg.newBlock();
    BasicBlock last =
        builder.lowerStatements(
            block, body(expr(num(1)), expr(add(num(1), num(2))), expr(mul(num(3), num(4)))));
    assertThat(last).isSameInstanceAs(block);
    assertThat(printed(block))
        .containsExactly("%0 = add 1, 2", "%1 = mul 3, 4")
        .inOrder();
    assertThat(cfg.entryBlock().instructions()).isEmpty();
  }

  @Test
  public void unsupportedStatement() {
    Statement stmt = assign(name("x"), num(1)).at(3, 4);
    UnsupportedConstructError e =
        assertThrows(
            UnsupportedConstructError.class, () -> builder.lowerStatement(cfg.entryBlock(), stmt));
    assertThat(e.construct).isEqualTo("Assign");
    assertThat(e).hasMessageThat().isEqualTo("Assign is not supported by lowering yet (3:4)");
  }

  @Test
  public void unsupportedStatementInFold() {
    assertThrows(
        UnsupportedConstructError.class,
        () -> builder.lowerStatements(cfg.entryBlock(), body(expr(num(1)), pass())));
  }

  @Test
  public void unsupportedExpression() {
    UnsupportedConstructError e =
        assertThrows(
            UnsupportedConstructError.class,
            () -> builder.lowerExpression(cfg.entryBlock(), add(num(1), name("x"))));
    assertThat(e.construct).isEqualTo("Name");
    // Position is unknown, so the message has no suffix.
    assertThat(e).hasMessageThat().isEqualTo("Name is not supported by lowering yet");
  }

  @Test
  public void unsupportedExpressionStatement() {
    UnsupportedConstructError e =
        assertThrows(
            UnsupportedConstructError.class,
            () -> builder.lowerStatement(cfg.entryBlock(), expr(call(name("print")))));
    assertThat(e.construct).isEqualTo("Call");
  }
}
