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
import com.google.common.collect.Lists;

import java.math.BigInteger;
import java.util.List;

/**
 * The path condition of the current trace: one {@link PathConstraint} per
 * control-flow instruction, in execution order. Entries are never reordered
 * or merged.
 */
class PathManager {
  private final AstContext astContext;
  private final List<PathConstraint> pathConstraints;

  PathManager(AstContext astContext) {
    this(astContext, ImmutableList.<PathConstraint>of());
  }

  PathManager(AstContext astContext, List<PathConstraint> pathConstraints) {
    this.astContext = astContext;
    this.pathConstraints = Lists.newArrayList(pathConstraints);
  }

  /**
   * Records the branch taken by {@code instruction}, whose program counter
   * after execution is defined by {@code pcExpression}. The taken destination
   * is the current value of that formula.
   * <p>
   * When the formula is an if-then-else, both arms become branches, each
   * guarded by {@code pc == value of the arm}; the taken one is the arm whose
   * value is the destination. Any other formula gives a single, taken
   * branch.
   */
  void addPathConstraint(Instruction instruction,
      SymbolicExpression pcExpression) {
    AstNode pc = pcExpression.getAst();
    long source = instruction.getAddress();
    BigInteger destination = pc.evaluate();
    ImmutableList.Builder<PathConstraint.Branch> branches =
        ImmutableList.builder();

    if (pc.getKind() == AstKind.ITE) {
      for (int arm = 1; arm <= 2; arm++) {
        BigInteger target = pc.getChildren().get(arm).evaluate();
        branches.add(branch(target.equals(destination), source, pc, target));
      }
    } else {
      branches.add(branch(true, source, pc, destination));
    }
    pathConstraints.add(new PathConstraint(source, branches.build()));
  }

  private PathConstraint.Branch branch(boolean taken, long source, AstNode pc,
      BigInteger target) {
    return new PathConstraint.Branch(taken, source, target.longValue(),
        astContext.equal(pc, astContext.bv(target, pc.getBitvectorSize())));
  }

  ImmutableList<PathConstraint> getPathConstraints() {
    return ImmutableList.copyOf(pathConstraints);
  }

  /**
   * The conjunction of every taken predicate, in recorded order, built
   * afresh on each call; {@code true} when nothing is recorded.
   */
  AstNode getPathConstraintsAst() {
    if (pathConstraints.isEmpty()) {
      return astContext.bool(true);
    }
    List<AstNode> predicates = Lists.newArrayList();
    for (PathConstraint constraint : pathConstraints) {
      predicates.add(constraint.getTakenPredicate());
    }
    return astContext.land(predicates);
  }

  void clearPathConstraints() {
    pathConstraints.clear();
  }
}
