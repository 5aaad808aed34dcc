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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link SolverEngine} backed by Z3. Every query runs in its own Z3
 * context, which is closed before the query returns.
 * @see Z3Translator
 */
public class Z3SolverEngine implements SolverEngine {
  private static final Logger logger =
      Logger.getLogger(Z3SolverEngine.class.getName());

  private final AstContext astContext;

  public Z3SolverEngine(AstContext astContext) {
    this.astContext = astContext;
  }

  @Override
  public ImmutableMap<Long, SolverModel> getModel(AstNode constraint) {
    ImmutableList<ImmutableMap<Long, SolverModel>> models =
        getModels(constraint, 1);
    return models.isEmpty()
        ? ImmutableMap.<Long, SolverModel>of() : models.get(0);
  }

  /**
   * Enumerates models by adding, after each one, a clause that excludes the
   * exact assignment just found.
   */
  @Override
  public ImmutableList<ImmutableMap<Long, SolverModel>> getModels(
      AstNode constraint, int limit) {
    Preconditions.checkArgument(constraint.isLogical(),
        "A constraint must be logical: %s", constraint);
    Preconditions.checkArgument(limit >= 0, "Negative limit: %s", limit);
    ImmutableList.Builder<ImmutableMap<Long, SolverModel>> models =
        ImmutableList.builder();
    Context z3 = new Context();
    try {
      Z3Translator translator = new Z3Translator(z3, astContext, false);
      Solver solver = z3.mkSolver();
      solver.add((BoolExpr) translator.translate(constraint));
      Map<SymbolicVariable, BitVecExpr> variables = translator.getVariables();
      for (int found = 0; found < limit; found++) {
        Status status = solver.check();
        if (status == Status.UNSATISFIABLE) {
          break;
        }
        if (status != Status.SATISFIABLE) {
          logger.log(Level.WARNING, "Z3 returned {0}: {1}",
              new Object[] {status, solver.getReasonUnknown()});
          throw new EngineException("Z3 returned " + status + ": "
              + solver.getReasonUnknown());
        }
        Model model = solver.getModel();
        ImmutableMap.Builder<Long, SolverModel> values =
            ImmutableMap.builder();
        List<BoolExpr> blocking = Lists.newArrayList();
        for (Map.Entry<SymbolicVariable, BitVecExpr> entry :
            variables.entrySet()) {
          BitVecNum value = (BitVecNum) model.eval(entry.getValue(), true);
          values.put(entry.getKey().getId(),
              new SolverModel(entry.getKey(), value.getBigInteger()));
          blocking.add(z3.mkNot(z3.mkEq(entry.getValue(), value)));
        }
        models.add(values.build());
        if (blocking.isEmpty()) {
          break;
        }
        solver.add(z3.mkOr(blocking.toArray(new BoolExpr[blocking.size()])));
      }
    } finally {
      z3.close();
    }
    ImmutableList<ImmutableMap<Long, SolverModel>> result = models.build();
    logger.log(Level.FINE, "{0} model(s) found", result.size());
    return result;
  }

  @Override
  public BigInteger evaluate(AstNode node) {
    Context z3 = new Context();
    try {
      Expr<?> value =
          new Z3Translator(z3, astContext, true).translate(node).simplify();
      if (value.isTrue()) {
        return BigInteger.ONE;
      }
      if (value.isFalse()) {
        return BigInteger.ZERO;
      }
      if (value instanceof BitVecNum) {
        return ((BitVecNum) value).getBigInteger();
      }
      throw new EngineException("Z3 could not reduce " + node
          + " to a constant");
    } finally {
      z3.close();
    }
  }

  @Override
  public AstNode simplify(AstNode node) {
    Context z3 = new Context();
    try {
      Z3Translator translator = new Z3Translator(z3, astContext, false);
      return translator.translateBack(translator.translate(node).simplify());
    } finally {
      z3.close();
    }
  }
}
