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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CfgTest {

  @Test
  public void newGraphHasEntryAndExit() {
    Cfg cfg = new Cfg();
    assertThat(cfg.numBlocks()).isEqualTo(2);
    assertThat(cfg.entryBlock().label).isEqualTo("entry");
    assertThat(cfg.exitBlock().label).isEqualTo("exit");
    assertThat(cfg.block("entry")).isSameInstanceAs(cfg.entryBlock());
    assertThat(cfg.block("bb0")).isNull();
    assertThat(cfg.blocks()).containsExactly(cfg.entryBlock(), cfg.exitBlock()).inOrder();
  }

  @Test
  public void newBlockLabels() {
    Cfg cfg = new Cfg();
    BasicBlock b0 = cfg.newBlock();
    cfg.addBlock("bb1");
    BasicBlock b2 = cfg.newBlock();
    assertThat(b0.label).isEqualTo("bb0");
    // bb1 was taken, so newBlock skips it
    assertThat(b2.label).isEqualTo("bb2");
    assertThat(cfg.numBlocks()).isEqualTo(5);
    assertThrows(IllegalArgumentException.class, () -> cfg.addBlock("exit"));
  }

  @Test
  public void connectBlocksIsIdempotent() {
    Cfg cfg = new Cfg();
    BasicBlock body = cfg.newBlock();
    cfg.connectBlocks(cfg.entryBlock(), body);
    cfg.connectBlocks(cfg.entryBlock(), body);
    cfg.connectBlocks(body, cfg.exitBlock());
    assertThat(cfg.entryBlock().successors()).containsExactly(body);
    assertThat(body.predecessors()).containsExactly(cfg.entryBlock());
    assertThat(body.successors()).containsExactly(cfg.exitBlock());
    assertThat(cfg.exitBlock().predecessors()).containsExactly(body);
  }

  @Test
  public void exitHasNoSuccessors() {
    Cfg cfg = new Cfg();
    assertThrows(
        IllegalArgumentException.class,
        () -> cfg.connectBlocks(cfg.exitBlock(), cfg.entryBlock()));
  }

  @Test
  public void blocksFromAnotherGraphAreRejected() {
    Cfg cfg = new Cfg();
    Cfg other = new Cfg();
    assertThrows(
        IllegalArgumentException.class,
        () -> cfg.addInst(other.entryBlock(), ReturnInst.ofVoid()));
    assertThrows(
        IllegalArgumentException.class,
        () -> cfg.addInst(cfg.entryBlock(), BranchInst.to(other.exitBlock())));
    assertThrows(
        IllegalArgumentException.class,
        () -> cfg.connectBlocks(cfg.entryBlock(), other.exitBlock()));
  }

  @Test
  public void nothingFollowsATerminator() {
    Cfg cfg = new Cfg();
    BasicBlock entry = cfg.entryBlock();
    Register sum = cfg.newRegister();
    cfg.addInst(entry, new BinaryInst(sum, ArithOp.ADD, Operand.of(1), Operand.of(2)));
    assertThat(entry.isTerminated()).isFalse();
    cfg.addInst(entry, BranchInst.to(cfg.exitBlock()));
    assertThat(entry.isTerminated()).isTrue();
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> cfg.addInst(entry, ReturnInst.ofVoid()));
    assertThat(e).hasMessageThat().isEqualTo("Block entry already ends with 'br exit'");
  }

  @Test
  public void registersAreNumberedSequentially() {
    Cfg cfg = new Cfg();
    assertThat(cfg.newRegister().index).isEqualTo(0);
    assertThat(cfg.newRegister().index).isEqualTo(1);
    assertThat(cfg.newRegister().toString()).isEqualTo("%2");
    assertThat(cfg.numRegisters()).isEqualTo(3);
    assertThat(new Cfg().newRegister()).isEqualTo(new Register(0));
  }

  /** Returns a graph with entry -> exit that passes {@link Cfg#verify}. */
  private static Cfg minimalGraph() {
    Cfg cfg = new Cfg();
    cfg.connectBlocks(cfg.entryBlock(), cfg.exitBlock());
    cfg.addInst(cfg.entryBlock(), BranchInst.to(cfg.exitBlock()));
    cfg.addInst(cfg.exitBlock(), ReturnInst.ofVoid());
    return cfg;
  }

  @Test
  public void verifyAcceptsCompleteGraph() {
    Cfg cfg = minimalGraph();
    // Unreachable blocks may be left empty.
    cfg.newBlock();
    cfg.verify();
  }

  @Test
  public void verifyRejectsUnterminatedBlock() {
    Cfg cfg = new Cfg();
    cfg.addInst(cfg.exitBlock(), ReturnInst.ofVoid());
    IllegalStateException e = assertThrows(IllegalStateException.class, cfg::verify);
    assertThat(e).hasMessageThat().isEqualTo("Block entry is not terminated");
  }

  @Test
  public void verifyRejectsUnterminatedReachableBlock() {
    Cfg cfg = minimalGraph();
    BasicBlock dangling = cfg.newBlock();
    cfg.connectBlocks(cfg.entryBlock(), dangling);
    IllegalStateException e = assertThrows(IllegalStateException.class, cfg::verify);
    assertThat(e).hasMessageThat().isEqualTo("Block bb0 is not terminated");
  }

  @Test
  public void verifyRejectsExitWithoutReturn() {
    Cfg cfg = new Cfg();
    cfg.connectBlocks(cfg.entryBlock(), cfg.exitBlock());
    cfg.addInst(cfg.entryBlock(), BranchInst.to(cfg.exitBlock()));
    cfg.addInst(cfg.exitBlock(), BranchInst.to(cfg.entryBlock()));
    IllegalStateException e = assertThrows(IllegalStateException.class, cfg::verify);
    assertThat(e).hasMessageThat().isEqualTo("Exit block ends with 'br entry', not a return");
  }

  @Test
  public void verifyRejectsBranchToNonSuccessor() {
    Cfg cfg = new Cfg();
    cfg.addInst(cfg.entryBlock(), BranchInst.to(cfg.exitBlock()));
    cfg.addInst(cfg.exitBlock(), ReturnInst.ofVoid());
    IllegalStateException e = assertThrows(IllegalStateException.class, cfg::verify);
    assertThat(e).hasMessageThat().contains("isn't a successor");
  }

  @Test
  public void conditionalBranch() {
    Cfg cfg = new Cfg();
    BasicBlock yes = cfg.newBlock();
    BasicBlock no = cfg.newBlock();
    Register c = cfg.newRegister();
    BranchInst br = new BranchInst(c, yes, no);
    assertThat(br.isConditional()).isTrue();
    assertThat(br.inputs()).containsExactly(c);
    assertThat(br.toString()).isEqualTo("br %0, bb0, bb1");
    assertThat(BranchInst.to(yes).isConditional()).isFalse();
    assertThat(BranchInst.to(yes).inputs()).isEmpty();
    assertThrows(IllegalArgumentException.class, () -> new BranchInst(c, yes, null));
    assertThrows(IllegalArgumentException.class, () -> new BranchInst(null, yes, no));
  }

  @Test
  public void returnValueMatchesType() {
    Type i64 = Type.named("i64");
    ReturnInst ret = new ReturnInst(i64, Operand.of(3));
    assertThat(ret.toString()).isEqualTo("ret i64 3");
    assertThat(ret.inputs()).containsExactly(Operand.of(3));
    assertThat(ReturnInst.ofVoid().toString()).isEqualTo("ret void");
    assertThat(Type.named("void")).isSameInstanceAs(Type.VOID);
    assertThrows(IllegalArgumentException.class, () -> new ReturnInst(Type.VOID, Operand.of(3)));
    assertThrows(IllegalArgumentException.class, () -> new ReturnInst(i64, null));
  }

  @Test
  public void printedGraph() {
    Cfg cfg = new Cfg();
    BasicBlock body = cfg.newBlock();
    cfg.connectBlocks(cfg.entryBlock(), body);
    cfg.addInst(cfg.entryBlock(), BranchInst.to(body));
    Register r = cfg.newRegister();
    cfg.addInst(body, new BinaryInst(r, ArithOp.FLOOR_DIV, Operand.of(7), Operand.of(2)));
    cfg.connectBlocks(body, cfg.exitBlock());
    cfg.addInst(body, BranchInst.to(cfg.exitBlock()));
    cfg.addInst(cfg.exitBlock(), ReturnInst.ofVoid());
    cfg.verify();
    assertThat(new Function("main", Type.VOID, cfg).toString())
        .isEqualTo(
            """
            function main() -> void {
            entry:  → [bb0]
              br bb0
            exit:
              ret void
            bb0:  → [exit]
              %0 = floordiv 7, 2
              br exit
            }
            """);
  }

  @Test
  public void programStartsWithMain() {
    Function main = new Function(Program.MAIN, Type.VOID, minimalGraph());
    Function helper = new Function("helper", Type.VOID, minimalGraph());
    Program program = new Program(ImmutableList.of(main, helper));
    assertThat(program.main()).isSameInstanceAs(main);
    assertThat(program.function("helper")).isSameInstanceAs(helper);
    assertThat(program.function("missing")).isNull();
    assertThrows(
        IllegalArgumentException.class, () -> new Program(ImmutableList.of(helper, main)));
    assertThrows(IllegalArgumentException.class, () -> new Program(ImmutableList.of()));
  }
}
