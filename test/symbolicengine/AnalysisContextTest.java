/*
 * Copyright 2026 The binary-symbolic-engine Authors
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

package symbolicengine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import junit.framework.TestCase;

import java.math.BigInteger;

/**
 * Tests the context as a whole: initialisation, instruction processing with
 * a small lifter, and backup and restore.
 */
public class AnalysisContextTest extends TestCase {
  /** Lifts {@code add dst, src}; anything else is left unsupported. */
  private static class AddSemantics implements SemanticsBuilder {
    @Override
    public boolean buildSemantics(Instruction instruction,
        AnalysisContext context) {
      if (!instruction.getDisassembly().startsWith("add")) {
        return false;
      }
      Operand dst = instruction.getOperand(0);
      Operand src = instruction.getOperand(1);
      AstContext ast = context.getAstContext();
      AstNode node = ast.bvadd(context.getOperandAst(dst),
          context.getOperandAst(src));
      SymbolicExpression expression = context.createSymbolicExpression(
          instruction, node, dst, instruction.getDisassembly());
      context.setTaint(expression, context.taintUnion(dst, src));
      context.setConcreteRegisterValue(dst.getRegister(), node.evaluate());
      return true;
    }
  }

  private AnalysisContext context;
  private Register rax;
  private Register rbx;

  @Override
  protected void setUp() {
    context = new AnalysisContext();
    context.setArchitecture(GenericCpu.x86_64());
    context.setSemanticsBuilder(new AddSemantics());
    rax = context.getRegister("rax");
    rbx = context.getRegister("rbx");
  }

  private Instruction addImmediate(Register register, long value) {
    return new Instruction(0x400000, 4, "add " + register.getName() + ", "
        + value, Operand.of(register), Operand.of(new Immediate(value, 8)));
  }

  /** Binds {@code register} to a fresh variable under expression id 3. */
  private SymbolicExpression bindToVariable(Register register) {
    AstContext ast = context.getAstContext();
    for (int i = 0; i < 3; i++) {
      context.newSymbolicExpression(ast.bv(i, 8), "filler");
    }
    SymbolicVariable v0 = context.newSymbolicVariable(64, "v0");
    SymbolicExpression e3 =
        context.newSymbolicExpression(ast.variable(v0), "input");
    context.assignSymbolicExpressionToRegister(e3, register);
    return e3;
  }

  public void testUseBeforeArchitectureIsAConfigurationError() {
    AnalysisContext fresh = new AnalysisContext();
    assertFalse(fresh.isArchitectureValid());
    try {
      fresh.getSymbolicEngine();
      fail("Should have thrown EngineNotInitializedException");
    } catch (EngineNotInitializedException expected) {
    }
    try {
      fresh.getRegister("rax");
      fail("Should have thrown EngineNotInitializedException");
    } catch (EngineNotInitializedException expected) {
    }
    try {
      fresh.taintRegister(rax);
      fail("Should have thrown EngineNotInitializedException");
    } catch (EngineNotInitializedException expected) {
    }
    try {
      fresh.getAllocatedAstNodes();
      fail("Should have thrown EngineNotInitializedException");
    } catch (EngineNotInitializedException expected) {
    }
  }

  public void testProcessingNeedsASemanticsBuilder() {
    context.setSemanticsBuilder(null);
    try {
      context.processing(addImmediate(rax, 1));
      fail("Should have thrown EngineNotInitializedException");
    } catch (EngineNotInitializedException expected) {
    }
  }

  public void testAddImmediateToTaintedSymbolicRegister() {
    SymbolicExpression e3 = bindToVariable(rax);
    assertEquals(3, e3.getId());
    context.taintRegister(rax);

    Instruction instruction = addImmediate(rax, 5);
    assertTrue(context.processing(instruction));

    SymbolicExpression e4 = context.getSymbolicRegister(rax);
    assertEquals(4, e4.getId());
    assertEquals(1, instruction.getSymbolicExpressions().size());
    AstContext ast = context.getAstContext();
    SymbolicVariable v0 = context.getSymbolicVariableFromName("SymVar_0");
    assertTrue(context.getFullAstFromId(4).equalTo(
        ast.bvadd(ast.variable(v0), ast.bv(5, 64))));
    assertTrue(context.isRegisterTainted(rax));
    assertTrue(context.getTaintedSymbolicExpressions().contains(e4));
    assertSame(e3, context.getSymbolicExpressionFromId(3));
  }

  public void testRestoreUndoesTheInstruction() {
    bindToVariable(rax);
    context.taintRegister(rax);
    context.backup();

    context.processing(addImmediate(rax, 5));
    assertEquals(4, context.getSymbolicRegister(rax).getId());

    context.restore();
    assertEquals(3, context.getSymbolicRegister(rax).getId());
    assertTrue(context.isRegisterTainted(rax));
    assertFalse(context.getSymbolicEngine().isSymbolicExpressionIdExists(4));
    assertTrue(context.getTaintedSymbolicExpressions().isEmpty());
  }

  public void testRestoreRevertsTaint() {
    bindToVariable(rax);
    context.taintRegister(rbx);
    context.backup();
    Instruction instruction = new Instruction(0x400000, 3, "add rax, rbx",
        Operand.of(rax), Operand.of(rbx));
    context.processing(instruction);
    assertTrue(context.isRegisterTainted(rax));
    context.restore();
    assertFalse(context.isRegisterTainted(rax));
    assertTrue(context.isRegisterTainted(rbx));
  }

  public void testRestoreIsWholesale() {
    AstContext ast = context.getAstContext();
    SymbolicExpression kept = context.newSymbolicExpression(ast.bv(1, 64),
        null);
    context.assignSymbolicExpressionToRegister(kept, rax);
    context.backup();

    SymbolicVariable later = context.newSymbolicVariable(32, null);
    context.setConcreteVariableValue(later, BigInteger.valueOf(5));
    SymbolicExpression stored = context.newSymbolicExpression(
        ast.variable(later), null);
    context.assignSymbolicExpressionToMemory(stored,
        new MemoryAccess(0x100, 4));
    context.concretizeRegister(rax);
    context.addPathConstraint(new Instruction(0x10, 2, "jmp"),
        context.newSymbolicExpression(ast.bv(0x12, 64), "pc"));
    context.enableSymbolicOptimization(SymbolicOptimization.AST_DICTIONARIES,
        false);

    context.restore();

    assertEquals(kept.getId(), context.getSymbolicRegister(rax).getId());
    assertTrue(context.getSymbolicMemory().isEmpty());
    assertTrue(context.getPathConstraints().isEmpty());
    assertEquals(1, context.getSymbolicExpressions().size());
    assertTrue(context.getSymbolicVariables().isEmpty());
    assertTrue(context.getAstGarbageCollector().isDictionariesEnabled());
    try {
      context.getSymbolicVariableFromName(later.getName());
      fail("Should have thrown NotFoundException");
    } catch (NotFoundException expected) {
    }
    SymbolicExpression next = context.newSymbolicExpression(ast.bv(2, 64),
        null);
    assertEquals(stored.getId(), next.getId());
    SymbolicVariable again = context.newSymbolicVariable(8, null);
    assertEquals(later.getId(), again.getId());
    assertEquals(BigInteger.ZERO, ast.getVariableValue(again));
  }

  public void testRestoreRewindsTheIdCounters() {
    AstContext ast = context.getAstContext();
    context.newSymbolicExpression(ast.bv(0, 8), null);
    context.backup();
    assertEquals(1, context.newSymbolicExpression(ast.bv(1, 8), null).getId());
    context.restore();
    assertEquals(1, context.newSymbolicExpression(ast.bv(1, 8), null).getId());
    assertEquals(2, context.newSymbolicExpression(ast.bv(2, 8), null).getId());
  }

  public void testRestoreKeepsExpressionIdentityAndOrigins() {
    AstContext ast = context.getAstContext();
    SymbolicExpression e = context.newSymbolicExpression(ast.bv(9, 64), null);
    context.assignSymbolicExpressionToRegister(e, rax);
    context.backup();

    context.assignSymbolicExpressionToRegister(e, rbx);
    assertEquals(rbx, e.getOriginRegister());
    context.restore();

    assertSame(e, context.getSymbolicExpressionFromId(e.getId()));
    assertSame(e, context.getSymbolicRegister(rax));
    assertEquals(rax, e.getOriginRegister());
    assertNull(context.getSymbolicRegister(rbx));
  }

  public void testBackupSlotCanBeRestoredTwiceAndIsOverwritten() {
    AstContext ast = context.getAstContext();
    context.backup();
    context.newSymbolicExpression(ast.bv(1, 8), null);
    context.restore();
    context.newSymbolicExpression(ast.bv(2, 8), null);
    context.restore();
    assertTrue(context.getSymbolicExpressions().isEmpty());

    context.newSymbolicExpression(ast.bv(3, 8), null);
    context.backup();
    context.newSymbolicExpression(ast.bv(4, 8), null);
    context.restore();
    assertEquals(1, context.getSymbolicExpressions().size());
  }

  public void testRestoreWithoutBackup() {
    try {
      context.restore();
      fail("Should have thrown IllegalStateException");
    } catch (IllegalStateException expected) {
    }
  }

  public void testDisabledEngineRecordsNothing() {
    context.enableSymbolicEngine(false);
    context.setConcreteRegisterValue(rax, BigInteger.valueOf(10));
    Instruction instruction = addImmediate(rax, 5);
    context.processing(instruction);
    assertTrue(instruction.getSymbolicExpressions().isEmpty());
    assertNull(context.getSymbolicRegister(rax));
    assertEquals(BigInteger.valueOf(15),
        context.getConcreteRegisterValue(rax));
  }

  public void testOnlyOnSymbolizedDropsConcreteResults() {
    context.enableSymbolicOptimization(
        SymbolicOptimization.ONLY_ON_SYMBOLIZED, true);
    Instruction concrete = addImmediate(rbx, 1);
    context.processing(concrete);
    assertTrue(concrete.getSymbolicExpressions().isEmpty());
    assertNull(context.getSymbolicRegister(rbx));

    bindToVariable(rax);
    Instruction symbolic = addImmediate(rax, 1);
    context.processing(symbolic);
    assertEquals(1, symbolic.getSymbolicExpressions().size());
  }

  public void testOnlyOnTaintedDropsUntaintedResults() {
    context.enableSymbolicOptimization(SymbolicOptimization.ONLY_ON_TAINTED,
        true);
    bindToVariable(rax);
    Instruction untainted = addImmediate(rax, 1);
    context.processing(untainted);
    assertTrue(untainted.getSymbolicExpressions().isEmpty());
    assertNull(context.getSymbolicRegister(rax));

    context.taintRegister(rbx);
    Instruction tainted = addImmediate(rbx, 1);
    context.processing(tainted);
    assertEquals(1, tainted.getSymbolicExpressions().size());
    assertNotNull(context.getSymbolicRegister(rbx));
  }

  public void testUnsupportedInstruction() {
    assertFalse(context.processing(new Instruction(0, 1, "nop")));
  }

  public void testResetEnginesStartsOver() {
    bindToVariable(rax);
    context.taintRegister(rax);
    context.resetEngines();
    assertTrue(context.getSymbolicExpressions().isEmpty());
    assertFalse(context.isRegisterTainted(rax));
    assertTrue(context.getAllocatedAstNodes().isEmpty());
    assertEquals(0, context.newSymbolicVariable(8, null).getId());
  }

  public void testSolverCanBeReplaced() {
    final AstNode[] seen = new AstNode[1];
    context.setSolverEngine(new SolverEngine() {
      @Override
      public ImmutableMap<Long, SolverModel> getModel(AstNode constraint) {
        seen[0] = constraint;
        return ImmutableMap.of();
      }

      @Override
      public ImmutableList<ImmutableMap<Long, SolverModel>> getModels(
          AstNode constraint, int limit) {
        return ImmutableList.of();
      }

      @Override
      public BigInteger evaluate(AstNode node) {
        return node.evaluate();
      }

      @Override
      public AstNode simplify(AstNode node) {
        return node;
      }
    });
    AstNode path = context.getPathConstraintsAst();
    assertTrue(context.getModel(path).isEmpty());
    assertSame(path, seen[0]);
    assertEquals(BigInteger.valueOf(3), context.evaluateAstViaSolver(
        context.getAstContext().bv(3, 8)));
  }
}
