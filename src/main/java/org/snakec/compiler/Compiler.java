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

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snakec.ast.Module;
import org.snakec.ast.Statement;
import org.snakec.code.BasicBlock;
import org.snakec.code.BranchInst;
import org.snakec.code.Cfg;
import org.snakec.code.Function;
import org.snakec.code.Program;
import org.snakec.code.ReturnInst;
import org.snakec.code.Type;

/** Lowers a parsed module to a {@link Program}. */
public final class Compiler {
  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  // Static methods only
  private Compiler() {}

  /** Equivalent to {@code compile(module, OptLevel.NONE)}. */
  public static Program compile(Module module) {
    return compile(module, OptLevel.NONE);
  }

  /**
   * Compiles a module into a Program whose first function is the synthetic {@code main} function
   * containing the module's top-level statements.
   *
   * @param module the parsed source
   * @param optLevel the requested optimization level; currently ignored
   * @throws CompileError if the module uses a construct that can't be lowered
   */
  public static Program compile(Module module, OptLevel optLevel) {
    logger.debug("Compiling module with {} statements at {}", module.body.size(), optLevel);
    List<Function> funcs = gatherFuncs(module);
    funcs.add(0, gatherMain(module));
    return new Program(funcs);
  }

  /**
   * Returns a Function for each function defined at the top level of {@code module}. Function
   * bodies are not lowered yet, so any definition is reported as unsupported.
   */
  static List<Function> gatherFuncs(Module module) {
    List<Function> functions = new ArrayList<>();
    for (Statement stmt : module.body) {
      if (stmt instanceof Statement.FunctionDef) {
        throw new UnsupportedConstructError(stmt, "at the top level yet");
      }
    }
    return functions;
  }

  /**
   * Returns the synthetic top-level function, which executes every statement of {@code module}
   * other than function and class definitions, and then returns void.
   */
  static Function gatherMain(Module module) {
    Cfg cfg = new Cfg();
    CfgBuilder builder = new CfgBuilder(cfg);
    BasicBlock curBlock = cfg.entryBlock();
    for (Statement stmt : module.body) {
      if (!(stmt instanceof Statement.FunctionDef || stmt instanceof Statement.ClassDef)) {
        curBlock = builder.lowerStatement(curBlock, stmt);
      }
    }
    BasicBlock exitBlock = cfg.exitBlock();
    if (curBlock != exitBlock) {
      cfg.connectBlocks(curBlock, exitBlock);
      cfg.addInst(curBlock, BranchInst.to(exitBlock));
    }
    // Top-level code never returns a value.
    cfg.addInst(exitBlock, ReturnInst.ofVoid());
    cfg.verify();
    logger.debug("Lowered {} with {} blocks", Program.MAIN, cfg.numBlocks());
    return new Function(Program.MAIN, Type.VOID, cfg);
  }
}
