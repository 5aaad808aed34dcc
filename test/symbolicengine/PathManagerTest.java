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

import junit.framework.TestCase;

import java.math.BigInteger;

public class PathManagerTest extends TestCase {
  private AstContext ast;
  private PathManager paths;
  private SymbolicVariable flag;
  private long nextId;

  @Override
  protected void setUp() {
    ast = new AstContext(new AstGarbageCollector(true));
    paths = new PathManager(ast);
    flag = SymbolicVariable.create(0, 1, "zf");
  }

  private SymbolicExpression expression(AstNode node) {
    return new SymbolicExpression(nextId++, node, ExpressionKind.REGISTER,
        null, null, null);
  }

  /** {@code pc = zf == 1 ? taken : fallthrough} */
  private SymbolicExpression conditionalJump(long taken, long fallthrough) {
    return expression(ast.ite(ast.equal(ast.variable(flag), ast.bvtrue()),
        ast.bv(taken, 64), ast.bv(fallthrough, 64)));
  }

  private Instruction jump(long address, long next) {
    Instruction instruction = new Instruction(address, 2, "jz");
    instruction.setNextAddress(next);
    return instruction;
  }

  public void testConditionalJumpRecordsBothBranches() {
    ast.setVariableValue(flag, BigInteger.ONE);
    paths.addPathConstraint(jump(0x100, 0x200), conditionalJump(0x200, 0x102));
    PathConstraint constraint = paths.getPathConstraints().get(0);
    assertEquals(0x100, constraint.getSourceAddress());
    assertTrue(constraint.isMultipleBranches());
    assertEquals(2, constraint.getBranches().size());
    assertEquals(0x200, constraint.getTakenAddress());
    PathConstraint.Branch notTaken = constraint.getBranches().get(1);
    assertFalse(notTaken.isTaken());
    assertEquals(0x102, notTaken.getDestinationAddress());
    assertEquals(AstKind.EQUAL, constraint.getTakenPredicate().getKind());
  }

  public void testTakenPredicateHoldsOnTheObservedPath() {
    ast.setVariableValue(flag, BigInteger.ONE);
    paths.addPathConstraint(jump(0x100, 0x200), conditionalJump(0x200, 0x102));
    assertEquals(BigInteger.ONE,
        paths.getPathConstraints().get(0).getTakenPredicate().evaluate());
  }

  public void testTakenBranchComesFromTheProgramCounterValue() {
    ast.setVariableValue(flag, BigInteger.ONE);
    paths.addPathConstraint(new Instruction(0x100, 2, "jz"),
        conditionalJump(0x200, 0x102));
    assertEquals(0x200, paths.getPathConstraints().get(0).getTakenAddress());

    ast.setVariableValue(flag, BigInteger.ZERO);
    paths.addPathConstraint(new Instruction(0x100, 2, "jz"),
        conditionalJump(0x200, 0x102));
    assertEquals(0x102, paths.getPathConstraints().get(1).getTakenAddress());
  }

  public void testComputedArmsAreEvaluated() {
    SymbolicVariable base = SymbolicVariable.create(1, 64, "base");
    ast.setVariableValue(base, BigInteger.valueOf(0x1000));
    ast.setVariableValue(flag, BigInteger.ZERO);
    AstNode pc = ast.ite(ast.equal(ast.variable(flag), ast.bvtrue()),
        ast.bvadd(ast.variable(base), ast.bv(0x20, 64)), ast.bv(0x102, 64));
    paths.addPathConstraint(new Instruction(0x100, 2, "jz"), expression(pc));

    PathConstraint constraint = paths.getPathConstraints().get(0);
    assertEquals(2, constraint.getBranches().size());
    PathConstraint.Branch jump = constraint.getBranches().get(0);
    assertFalse(jump.isTaken());
    assertEquals(0x1020, jump.getDestinationAddress());
    assertEquals(0x102, constraint.getTakenAddress());
    assertEquals(BigInteger.ONE, constraint.getTakenPredicate().evaluate());
    assertEquals(BigInteger.ZERO, jump.getPredicate().evaluate());
  }

  public void testUnconditionalTransferHasOneBranch() {
    paths.addPathConstraint(jump(0x10, 0x50), expression(ast.bv(0x50, 64)));
    PathConstraint constraint = paths.getPathConstraints().get(0);
    assertFalse(constraint.isMultipleBranches());
    assertEquals(0x50, constraint.getTakenAddress());
  }

  public void testOrderIsPreservedAndConjoined() {
    SymbolicExpression b1 = conditionalJump(0x200, 0x102);
    SymbolicExpression b2 = conditionalJump(0x300, 0x202);
    SymbolicExpression b3 = conditionalJump(0x400, 0x302);
    paths.addPathConstraint(jump(0x100, 0x200), b1);
    paths.addPathConstraint(jump(0x200, 0x202), b2);
    paths.addPathConstraint(jump(0x300, 0x400), b3);

    ImmutableList<PathConstraint> constraints = paths.getPathConstraints();
    assertEquals(3, constraints.size());
    assertEquals(0x100, constraints.get(0).getSourceAddress());
    assertEquals(0x200, constraints.get(1).getSourceAddress());
    assertEquals(0x300, constraints.get(2).getSourceAddress());

    AstNode conjunction = paths.getPathConstraintsAst();
    assertEquals(AstKind.LAND, conjunction.getKind());
    assertEquals(ImmutableList.of(constraints.get(0).getTakenPredicate(),
        constraints.get(1).getTakenPredicate(),
        constraints.get(2).getTakenPredicate()),
        conjunction.getChildren());
  }

  public void testEmptyTraceIsTrue() {
    AstNode conjunction = paths.getPathConstraintsAst();
    assertEquals(AstKind.BOOL, conjunction.getKind());
    assertEquals(BigInteger.ONE, conjunction.evaluate());
  }

  public void testClear() {
    paths.addPathConstraint(jump(0x10, 0x12), expression(ast.bv(0x12, 64)));
    paths.clearPathConstraints();
    assertTrue(paths.getPathConstraints().isEmpty());
  }

  public void testReturnedListIsACopy() {
    ImmutableList<PathConstraint> before = paths.getPathConstraints();
    paths.addPathConstraint(jump(0x10, 0x12), expression(ast.bv(0x12, 64)));
    assertTrue(before.isEmpty());
  }
}
