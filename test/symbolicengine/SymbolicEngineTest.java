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

import com.google.common.collect.Lists;

import junit.framework.TestCase;

import java.math.BigInteger;
import java.util.Deque;

/**
 * Tests the expression and variable registries and the register and memory
 * maps of {@link SymbolicEngine}.
 */
public class SymbolicEngineTest extends TestCase {
  private AnalysisContext context;
  private SymbolicEngine engine;
  private AstContext ast;
  private Register rax;
  private Register eax;
  private Register ah;
  private Register al;
  private Instruction instruction;

  @Override
  protected void setUp() {
    context = new AnalysisContext();
    context.setArchitecture(GenericCpu.x86_64());
    engine = context.getSymbolicEngine();
    ast = context.getAstContext();
    rax = context.getRegister("rax");
    eax = context.getRegister("eax");
    ah = context.getRegister("ah");
    al = context.getRegister("al");
    instruction = new Instruction(0x1000, 3, "test");
  }

  public void testIdsAreSequentialEvenWhenSimplified() {
    context.addCallback(new SymbolicSimplificationCallback() {
      @Override
      public AstNode simplify(AnalysisContext ctx, AstNode node) {
        // x + 0 -> x
        if (node.getKind() == AstKind.BVADD
            && node.getChildren().get(1).getKind() == AstKind.BV
            && node.getChildren().get(1).getConstant().signum() == 0) {
          return node.getChildren().get(0);
        }
        return node;
      }
    });
    SymbolicVariable v = engine.newSymbolicVariable(8, null);
    AstNode x = ast.variable(v);
    long previous = -1;
    for (int i = 0; i < 10; i++) {
      SymbolicExpression e = engine.newSymbolicExpression(
          ast.bvadd(x, ast.bv(i % 2, 8)), "step " + i);
      assertEquals(previous + 1, e.getId());
      previous = e.getId();
      if (i % 2 == 0) {
        assertSame(x, e.getAst());
      } else {
        assertEquals(AstKind.BVADD, e.getAst().getKind());
      }
    }
    assertEquals(10, engine.getSymbolicExpressions().size());
  }

  public void testVariablesAreRegisteredByIdAndName() {
    SymbolicVariable v0 = engine.newSymbolicVariable(32, "first");
    SymbolicVariable v1 = engine.newSymbolicVariable(8, "second");
    assertEquals(0, v0.getId());
    assertEquals(1, v1.getId());
    assertEquals("SymVar_1", v1.getName());
    assertSame(v1, engine.getSymbolicVariableFromId(1));
    assertSame(v0, engine.getSymbolicVariableFromName("SymVar_0"));
    assertSame(v0,
        context.getAstVariableNode("SymVar_0").getVariable());
    try {
      engine.getSymbolicVariableFromId(2);
      fail("Should have thrown NotFoundException");
    } catch (NotFoundException expected) {
    }
    try {
      engine.getSymbolicVariableFromName("SymVar_9");
      fail("Should have thrown NotFoundException");
    } catch (NotFoundException expected) {
    }
  }

  public void testUnknownExpressionIsNotFound() {
    try {
      engine.getSymbolicExpressionFromId(42);
      fail("Should have thrown NotFoundException");
    } catch (NotFoundException expected) {
    }
    try {
      engine.removeSymbolicExpression(42);
      fail("Should have thrown NotFoundException");
    } catch (NotFoundException expected) {
    }
  }

  public void testUnsetRegisterReadsTheConcreteValue() {
    context.setConcreteRegisterValue(rax, BigInteger.valueOf(0x1234));
    AstNode node = engine.getRegisterAst(eax);
    assertEquals(AstKind.BV, node.getKind());
    assertEquals(32, node.getBitvectorSize());
    assertEquals(BigInteger.valueOf(0x1234), node.evaluate());
    assertNull(engine.getSymbolicRegister(rax));
  }

  public void testSubRegisterWriteIsSplicedIntoTheParent() {
    context.setConcreteRegisterValue(rax,
        new BigInteger("1111111122222222", 16));
    SymbolicExpression e = engine.createSymbolicRegisterExpression(
        instruction, ast.bv(0xdeadbeefL, 32), eax, "mov eax");
    assertEquals(64, e.getAst().getBitvectorSize());
    assertSame(e, engine.getSymbolicRegister(rax));
    assertSame(e, engine.getSymbolicRegister(ah));
    assertEquals(new BigInteger("11111111deadbeef", 16),
        engine.getSymbolicRegisterValue(rax));
    assertEquals(BigInteger.valueOf(0xdeadbeefL),
        engine.getSymbolicRegisterValue(eax));
    assertEquals(BigInteger.valueOf(0xbe),
        engine.getSymbolicRegisterValue(ah));
    assertEquals(1, instruction.getSymbolicExpressions().size());
  }

  public void testAssignSubRegisterKeepsTheExpression() {
    SymbolicExpression e = engine.newSymbolicExpression(ast.bv(0x41, 8), null);
    SymbolicExpression parent =
        engine.assignSymbolicExpressionToRegister(e, ah);
    assertSame(e, engine.getSymbolicExpressionFromId(e.getId()));
    assertEquals(8, e.getAst().getBitvectorSize());
    assertEquals(ah, e.getOriginRegister());
    assertSame(parent, engine.getSymbolicRegister(rax));
    assertTrue(parent.getId() > e.getId());
    assertEquals(rax, parent.getOriginRegister());
    assertEquals(64, parent.getAst().getBitvectorSize());
    assertEquals(BigInteger.valueOf(0x4100),
        engine.getSymbolicRegisterValue(rax));
    assertEquals(BigInteger.valueOf(0x41),
        engine.getSymbolicRegisterValue(ah));
    try {
      engine.assignSymbolicExpressionToRegister(
          engine.newSymbolicExpression(ast.bv(1, 16), null), eax);
      fail("Should have rejected a size mismatch");
    } catch (IllegalArgumentException expected) {
    }
  }

  public void testAssignParentRegisterBindsTheSameInstance() {
    SymbolicExpression e = engine.newSymbolicExpression(ast.bv(7, 64), null);
    assertSame(e, engine.assignSymbolicExpressionToRegister(e, rax));
    assertSame(e, engine.getSymbolicRegister(rax));
    assertSame(e, engine.getSymbolicExpressionFromId(e.getId()));
    assertEquals(rax, e.getOriginRegister());
  }

  public void testReferencesSurviveASubRegisterAssignment() {
    SymbolicVariable v = engine.newSymbolicVariable(8, "v");
    context.setConcreteVariableValue(v, BigInteger.valueOf(3));
    SymbolicExpression e = engine.newSymbolicExpression(
        ast.variable(v), null);
    AstNode earlier = ast.reference(e);
    engine.assignSymbolicExpressionToRegister(e, al);

    AstNode sum = ast.bvadd(ast.zx(56, earlier), engine.getRegisterAst(rax));
    AstNode full = engine.getFullAst(sum);
    assertEquals(64, full.getBitvectorSize());
    assertFalse(containsReference(full));
    assertEquals(BigInteger.valueOf(6), full.evaluate());
    assertEquals(sum.evaluate(), full.evaluate());
  }

  private static boolean containsReference(AstNode root) {
    Deque<AstNode> pending = Lists.newLinkedList();
    pending.push(root);
    while (!pending.isEmpty()) {
      AstNode node = pending.pop();
      if (node.getKind() == AstKind.REFERENCE) {
        return true;
      }
      for (AstNode child : node.getChildren()) {
        pending.push(child);
      }
    }
    return false;
  }

  public void testMemoryWritesAreSplitIntoBytes() {
    MemoryAccess dword = new MemoryAccess(0x2000, 4);
    SymbolicExpression e = engine.createSymbolicMemoryExpression(instruction,
        ast.bv(0x11223344, 32), dword, "store");
    assertEquals(4, engine.getSymbolicMemory().size());
    assertEquals(5, instruction.getSymbolicExpressions().size());
    assertEquals(0x44, engine.getSymbolicMemoryValue(0x2000));
    assertEquals(0x11, engine.getSymbolicMemoryValue(0x2003));
    assertEquals(BigInteger.valueOf(0x11223344),
        engine.getSymbolicMemoryValue(dword));
    assertEquals(BigInteger.valueOf(0x2233),
        engine.getSymbolicMemoryValue(new MemoryAccess(0x2001, 2)));
    assertNotSame(e, engine.getSymbolicMemory(0x2000));
  }

  public void testMixedMemoryReadsCombineSymbolicAndConcreteBytes() {
    context.setConcreteMemoryValue(0x3001, 0xaa);
    SymbolicExpression e = engine.newSymbolicExpression(ast.bv(0x55, 8), null);
    engine.assignSymbolicExpressionToMemory(e, new MemoryAccess(0x3000, 1));
    assertSame(e, engine.getSymbolicMemory(0x3000));
    AstNode word = engine.getMemoryAst(new MemoryAccess(0x3000, 2));
    assertEquals(AstKind.CONCAT, word.getKind());
    assertEquals(BigInteger.valueOf(0xaa55), word.evaluate());
  }

  public void testRemovingAnExpressionConcretizesItsLocations() {
    SymbolicExpression e = engine.createSymbolicRegisterExpression(
        instruction, ast.bv(1, 64), rax, null);
    engine.removeSymbolicExpression(e.getId());
    assertNull(engine.getSymbolicRegister(rax));
    assertFalse(engine.isSymbolicExpressionIdExists(e.getId()));
  }

  public void testConcretize() {
    engine.createSymbolicRegisterExpression(instruction, ast.bv(1, 64), rax,
        null);
    engine.createSymbolicMemoryExpression(instruction, ast.bv(1, 16),
        new MemoryAccess(0x10, 2), null);
    engine.concretizeRegister(eax);
    assertNull(engine.getSymbolicRegister(rax));
    engine.concretizeMemory(0x10);
    assertNull(engine.getSymbolicMemory(0x10));
    assertNotNull(engine.getSymbolicMemory(0x11));
    engine.concretizeAllMemory();
    assertTrue(engine.getSymbolicMemory().isEmpty());
  }

  public void testConvertRegisterToVariable() {
    context.setConcreteRegisterValue(rax, BigInteger.valueOf(0x77));
    SymbolicExpression old = engine.createSymbolicRegisterExpression(
        instruction, ast.bv(0x77, 64), rax, null);
    SymbolicVariable v = engine.convertRegisterToSymbolicVariable(rax, "input");
    SymbolicExpression current = engine.getSymbolicRegister(rax);
    assertTrue(current.getId() > old.getId());
    assertSame(v, current.getAst().getVariable());
    assertEquals(BigInteger.valueOf(0x77),
        context.getConcreteVariableValue(v));
    assertSame(old, engine.getSymbolicExpressionFromId(old.getId()));
  }

  public void testConvertMemoryToVariable() {
    context.setConcreteMemoryValue(new MemoryAccess(0x40, 2),
        BigInteger.valueOf(0xbeef));
    SymbolicVariable v = engine.convertMemoryToSymbolicVariable(
        new MemoryAccess(0x40, 2), "buffer");
    assertEquals(16, v.getBitSize());
    assertEquals(BigInteger.valueOf(0xbeef),
        engine.getSymbolicMemoryValue(new MemoryAccess(0x40, 2)));
    assertTrue(engine.getMemoryAst(new MemoryAccess(0x40, 2)).isSymbolized());
  }

  public void testConvertExpressionToVariableRebindsLocations() {
    SymbolicExpression old = engine.createSymbolicRegisterExpression(
        instruction, ast.bv(9, 64), rax, null);
    SymbolicVariable v =
        engine.convertExpressionToSymbolicVariable(old.getId(), "cut");
    SymbolicExpression current = engine.getSymbolicRegister(rax);
    assertFalse(current.getId() == old.getId());
    assertSame(v, current.getAst().getVariable());
    assertEquals(BigInteger.valueOf(9), engine.getSymbolicRegisterValue(rax));
    assertEquals(BigInteger.valueOf(9),
        engine.getAstFromId(old.getId()).evaluate());
  }

  public void testFullAstInlinesReferences() {
    SymbolicVariable v = engine.newSymbolicVariable(8, null);
    SymbolicExpression a = engine.newSymbolicExpression(
        ast.bvadd(ast.variable(v), ast.bv(1, 8)), null);
    SymbolicExpression b = engine.newSymbolicExpression(
        ast.bvmul(ast.reference(a), ast.reference(a)), null);
    AstNode full = engine.getFullAstFromId(b.getId());
    AstNode sum = ast.bvadd(ast.variable(v), ast.bv(1, 8));
    assertTrue(full.equalTo(ast.bvmul(sum, sum)));
    assertFalse(full.toString().contains("ref!"));
    context.setConcreteVariableValue(v, BigInteger.valueOf(2));
    assertEquals(BigInteger.valueOf(9), full.evaluate());
    assertEquals(engine.getAstFromId(b.getId()).evaluate(), full.evaluate());
  }

  public void testFullAstOfLongReferenceChains() {
    SymbolicVariable v = engine.newSymbolicVariable(32, null);
    SymbolicExpression e = engine.newSymbolicExpression(ast.variable(v), null);
    for (int i = 0; i < 20000; i++) {
      e = engine.newSymbolicExpression(
          ast.bvadd(ast.reference(e), ast.bv(1, 32)), null);
    }
    AstNode full = engine.getFullAstFromId(e.getId());
    assertEquals(BigInteger.valueOf(20000), full.evaluate());
  }

  public void testSimplificationCallbacksRunInOrder() {
    final StringBuilder calls = new StringBuilder();
    context.addCallback(new SymbolicSimplificationCallback() {
      @Override
      public AstNode simplify(AnalysisContext ctx, AstNode node) {
        calls.append('a');
        return ctx.getAstContext().bvnot(node);
      }
    });
    context.addCallback(new SymbolicSimplificationCallback() {
      @Override
      public AstNode simplify(AnalysisContext ctx, AstNode node) {
        calls.append('b');
        assertEquals(AstKind.BVNOT, node.getKind());
        return node.getChildren().get(0);
      }
    });
    AstNode input = ast.bv(3, 8);
    assertSame(input, engine.processSimplification(input, false));
    assertEquals("ab", calls.toString());
  }

  public void testVariablesDeclaration() {
    engine.newSymbolicVariable(8, null);
    engine.newSymbolicVariable(64, null);
    assertEquals("(declare-fun SymVar_0 () (_ BitVec 8))\n"
        + "(declare-fun SymVar_1 () (_ BitVec 64))\n",
        engine.getVariablesDeclaration());
  }

  public void testTaintedExpressions() {
    SymbolicExpression a = engine.newSymbolicExpression(ast.bv(1, 8), null);
    SymbolicExpression b = engine.newSymbolicExpression(ast.bv(2, 8), null);
    engine.setTaint(b, true);
    assertFalse(engine.isTainted(a));
    assertEquals(1, engine.getTaintedSymbolicExpressions().size());
    assertSame(b, engine.getTaintedSymbolicExpressions().get(0));
  }

  public void testDictionaryOptimizationReachesTheCollector() {
    assertTrue(engine.isOptimizationEnabled(
        SymbolicOptimization.AST_DICTIONARIES));
    engine.enableOptimization(SymbolicOptimization.AST_DICTIONARIES, false);
    assertFalse(context.getAstGarbageCollector().isDictionariesEnabled());
    assertNotSame(ast.bv(1, 8), ast.bv(1, 8));
  }
}
