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
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Converts formulas between the engine and one Z3 context. References are
 * inlined on the way in; nodes coming back are built through the
 * {@link AstContext}, so they are deduplicated like any other node.
 */
class Z3Translator {
  private final Context z3;
  private final AstContext astContext;
  private final boolean concreteVariables;
  private final Map<AstNode, Expr<?>> translated = Maps.newIdentityHashMap();
  private final Map<SymbolicVariable, BitVecExpr> variables =
      Maps.newLinkedHashMap();

  /**
   * @param concreteVariables if true, variables are translated to their
   *        current concrete value instead of Z3 constants
   */
  Z3Translator(Context z3, AstContext astContext, boolean concreteVariables) {
    this.z3 = z3;
    this.astContext = astContext;
    this.concreteVariables = concreteVariables;
  }

  /** The Z3 constant of every variable translated so far. */
  ImmutableMap<SymbolicVariable, BitVecExpr> getVariables() {
    return ImmutableMap.copyOf(variables);
  }

  Expr<?> translate(AstNode root) {
    Deque<AstNode> pending = Lists.newLinkedList();
    pending.push(root);
    while (!pending.isEmpty()) {
      AstNode node = pending.peek();
      if (translated.containsKey(node)) {
        pending.pop();
        continue;
      }
      boolean ready = true;
      for (AstNode operand : AstContext.operands(node)) {
        if (!translated.containsKey(operand)) {
          pending.push(operand);
          ready = false;
        }
      }
      if (ready) {
        pending.pop();
        translated.put(node, convert(node));
      }
    }
    return translated.get(root);
  }

  private BitVecExpr bv(AstNode node, int index) {
    return (BitVecExpr) translated.get(node.getChildren().get(index));
  }

  private BoolExpr bool(AstNode node, int index) {
    return (BoolExpr) translated.get(node.getChildren().get(index));
  }

  private BoolExpr[] bools(AstNode node) {
    BoolExpr[] result = new BoolExpr[node.getChildren().size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = bool(node, i);
    }
    return result;
  }

  private int parameter(AstNode node, int index) {
    return node.getParameters().get(index);
  }

  private Expr<?> convert(AstNode node) {
    switch (node.getKind()) {
      case BOOL:
        return z3.mkBool(node.getConstant().signum() != 0);
      case BV:
        return z3.mkBV(node.getConstant().toString(), node.getBitvectorSize());
      case VARIABLE: {
        SymbolicVariable variable = node.getVariable();
        if (concreteVariables) {
          return z3.mkBV(astContext.getVariableValue(variable).toString(),
              variable.getBitSize());
        }
        BitVecExpr constant =
            z3.mkBVConst(variable.getName(), variable.getBitSize());
        variables.put(variable, constant);
        return constant;
      }
      case REFERENCE:
        return translated.get(node.getSymbolicExpression().getAst());
      case EXTRACT:
        return z3.mkExtract(parameter(node, 0), parameter(node, 1),
            bv(node, 0));
      case CONCAT: {
        BitVecExpr result = bv(node, 0);
        for (int i = 1; i < node.getChildren().size(); i++) {
          result = z3.mkConcat(result, bv(node, i));
        }
        return result;
      }
      case ZX:
        return z3.mkZeroExt(parameter(node, 0), bv(node, 0));
      case SX:
        return z3.mkSignExt(parameter(node, 0), bv(node, 0));
      case BVADD:
        return z3.mkBVAdd(bv(node, 0), bv(node, 1));
      case BVSUB:
        return z3.mkBVSub(bv(node, 0), bv(node, 1));
      case BVMUL:
        return z3.mkBVMul(bv(node, 0), bv(node, 1));
      case BVUDIV:
        return z3.mkBVUDiv(bv(node, 0), bv(node, 1));
      case BVSDIV:
        return z3.mkBVSDiv(bv(node, 0), bv(node, 1));
      case BVUREM:
        return z3.mkBVURem(bv(node, 0), bv(node, 1));
      case BVSREM:
        return z3.mkBVSRem(bv(node, 0), bv(node, 1));
      case BVSMOD:
        return z3.mkBVSMod(bv(node, 0), bv(node, 1));
      case BVAND:
        return z3.mkBVAND(bv(node, 0), bv(node, 1));
      case BVOR:
        return z3.mkBVOR(bv(node, 0), bv(node, 1));
      case BVXOR:
        return z3.mkBVXOR(bv(node, 0), bv(node, 1));
      case BVNAND:
        return z3.mkBVNAND(bv(node, 0), bv(node, 1));
      case BVNOR:
        return z3.mkBVNOR(bv(node, 0), bv(node, 1));
      case BVXNOR:
        return z3.mkBVXNOR(bv(node, 0), bv(node, 1));
      case BVSHL:
        return z3.mkBVSHL(bv(node, 0), bv(node, 1));
      case BVLSHR:
        return z3.mkBVLSHR(bv(node, 0), bv(node, 1));
      case BVASHR:
        return z3.mkBVASHR(bv(node, 0), bv(node, 1));
      case BVNOT:
        return z3.mkBVNot(bv(node, 0));
      case BVNEG:
        return z3.mkBVNeg(bv(node, 0));
      case BVROL:
        return z3.mkBVRotateLeft(parameter(node, 0), bv(node, 0));
      case BVROR:
        return z3.mkBVRotateRight(parameter(node, 0), bv(node, 0));
      case EQUAL:
        return equality(node);
      case DISTINCT:
        return z3.mkNot(equality(node));
      case BVULT:
        return z3.mkBVULT(bv(node, 0), bv(node, 1));
      case BVULE:
        return z3.mkBVULE(bv(node, 0), bv(node, 1));
      case BVUGT:
        return z3.mkBVUGT(bv(node, 0), bv(node, 1));
      case BVUGE:
        return z3.mkBVUGE(bv(node, 0), bv(node, 1));
      case BVSLT:
        return z3.mkBVSLT(bv(node, 0), bv(node, 1));
      case BVSLE:
        return z3.mkBVSLE(bv(node, 0), bv(node, 1));
      case BVSGT:
        return z3.mkBVSGT(bv(node, 0), bv(node, 1));
      case BVSGE:
        return z3.mkBVSGE(bv(node, 0), bv(node, 1));
      case LAND:
        return z3.mkAnd(bools(node));
      case LOR:
        return z3.mkOr(bools(node));
      case LNOT:
        return z3.mkNot(bool(node, 0));
      case ITE:
        return z3.mkITE(bool(node, 0), bv(node, 1), bv(node, 2));
      default:
        throw new EngineException("Cannot translate " + node.getKind());
    }
  }

  private BoolExpr equality(AstNode node) {
    if (node.getChildren().get(0).isLogical()) {
      return z3.mkEq(bool(node, 0), bool(node, 1));
    }
    return z3.mkEq(bv(node, 0), bv(node, 1));
  }

  /* Back translation --------------------------------------------------- */

  /**
   * Rebuilds a Z3 expression as engine nodes. Z3 constants named after a
   * variable map back to that variable's leaf; any other constant is
   * rejected.
   *
   * @throws EngineException if the expression uses an operator the engine
   *         does not model
   */
  AstNode translateBack(Expr<?> root) {
    Map<Expr<?>, AstNode> done = Maps.newHashMap();
    Deque<Expr<?>> pending = Lists.newLinkedList();
    pending.push(root);
    while (!pending.isEmpty()) {
      Expr<?> expr = pending.peek();
      if (done.containsKey(expr)) {
        pending.pop();
        continue;
      }
      boolean ready = true;
      for (Expr<?> arg : expr.getArgs()) {
        if (!done.containsKey(arg)) {
          pending.push(arg);
          ready = false;
        }
      }
      if (ready) {
        pending.pop();
        List<AstNode> args = Lists.newArrayList();
        for (Expr<?> arg : expr.getArgs()) {
          args.add(done.get(arg));
        }
        done.put(expr, convertBack(expr, args));
      }
    }
    return done.get(root);
  }

  private int intParameter(Expr<?> expr, int index) {
    return expr.getFuncDecl().getParameters()[index].getInt();
  }

  private AstNode fold(AstKind kind, List<AstNode> args) {
    AstNode result = args.get(0);
    for (int i = 1; i < args.size(); i++) {
      result = astContext.node(kind, Lists.newArrayList(result, args.get(i)),
          ImmutableList.<Integer>of());
    }
    return result;
  }

  private AstNode convertBack(Expr<?> expr, List<AstNode> args) {
    if (expr.isTrue()) {
      return astContext.bool(true);
    }
    if (expr.isFalse()) {
      return astContext.bool(false);
    }
    if (expr instanceof BitVecNum) {
      BitVecNum number = (BitVecNum) expr;
      return astContext.bv(number.getBigInteger(), number.getSortSize());
    }
    if (expr.isConst()) {
      String name = expr.getFuncDecl().getName().toString();
      return astContext.getCollector().getAstVariableNode(name);
    }
    Z3_decl_kind kind = expr.getFuncDecl().getDeclKind();
    switch (kind) {
      case Z3_OP_EQ:
        return astContext.equal(args.get(0), args.get(1));
      case Z3_OP_DISTINCT: {
        List<AstNode> pairs = Lists.newArrayList();
        for (int i = 0; i < args.size(); i++) {
          for (int j = i + 1; j < args.size(); j++) {
            pairs.add(astContext.distinct(args.get(i), args.get(j)));
          }
        }
        return pairs.size() == 1 ? pairs.get(0) : astContext.land(pairs);
      }
      case Z3_OP_ITE:
        return astContext.ite(args.get(0), args.get(1), args.get(2));
      case Z3_OP_AND:
        return astContext.land(args);
      case Z3_OP_OR:
        return astContext.lor(args);
      case Z3_OP_NOT:
        return astContext.lnot(args.get(0));
      case Z3_OP_XOR:
        return astContext.distinct(args.get(0), args.get(1));
      case Z3_OP_IMPLIES:
        return astContext.lor(astContext.lnot(args.get(0)), args.get(1));
      case Z3_OP_BADD:
        return fold(AstKind.BVADD, args);
      case Z3_OP_BSUB:
        return fold(AstKind.BVSUB, args);
      case Z3_OP_BMUL:
        return fold(AstKind.BVMUL, args);
      case Z3_OP_BAND:
        return fold(AstKind.BVAND, args);
      case Z3_OP_BOR:
        return fold(AstKind.BVOR, args);
      case Z3_OP_BXOR:
        return fold(AstKind.BVXOR, args);
      case Z3_OP_BNAND:
        return astContext.bvnand(args.get(0), args.get(1));
      case Z3_OP_BNOR:
        return astContext.bvnor(args.get(0), args.get(1));
      case Z3_OP_BXNOR:
        return astContext.bvxnor(args.get(0), args.get(1));
      case Z3_OP_BUDIV:
      case Z3_OP_BUDIV_I:
        return astContext.bvudiv(args.get(0), args.get(1));
      case Z3_OP_BSDIV:
      case Z3_OP_BSDIV_I:
        return astContext.bvsdiv(args.get(0), args.get(1));
      case Z3_OP_BUREM:
      case Z3_OP_BUREM_I:
        return astContext.bvurem(args.get(0), args.get(1));
      case Z3_OP_BSREM:
      case Z3_OP_BSREM_I:
        return astContext.bvsrem(args.get(0), args.get(1));
      case Z3_OP_BSMOD:
      case Z3_OP_BSMOD_I:
        return astContext.bvsmod(args.get(0), args.get(1));
      case Z3_OP_BSHL:
        return astContext.bvshl(args.get(0), args.get(1));
      case Z3_OP_BLSHR:
        return astContext.bvlshr(args.get(0), args.get(1));
      case Z3_OP_BASHR:
        return astContext.bvashr(args.get(0), args.get(1));
      case Z3_OP_BNOT:
        return astContext.bvnot(args.get(0));
      case Z3_OP_BNEG:
        return astContext.bvneg(args.get(0));
      case Z3_OP_ULEQ:
        return astContext.bvule(args.get(0), args.get(1));
      case Z3_OP_ULT:
        return astContext.bvult(args.get(0), args.get(1));
      case Z3_OP_UGEQ:
        return astContext.bvuge(args.get(0), args.get(1));
      case Z3_OP_UGT:
        return astContext.bvugt(args.get(0), args.get(1));
      case Z3_OP_SLEQ:
        return astContext.bvsle(args.get(0), args.get(1));
      case Z3_OP_SLT:
        return astContext.bvslt(args.get(0), args.get(1));
      case Z3_OP_SGEQ:
        return astContext.bvsge(args.get(0), args.get(1));
      case Z3_OP_SGT:
        return astContext.bvsgt(args.get(0), args.get(1));
      case Z3_OP_CONCAT:
        return astContext.concat(args);
      case Z3_OP_EXTRACT:
        return astContext.extract(intParameter(expr, 0),
            intParameter(expr, 1), args.get(0));
      case Z3_OP_ZERO_EXT:
        return astContext.zx(intParameter(expr, 0), args.get(0));
      case Z3_OP_SIGN_EXT:
        return astContext.sx(intParameter(expr, 0), args.get(0));
      case Z3_OP_ROTATE_LEFT:
        return astContext.bvrol(args.get(0), intParameter(expr, 0));
      case Z3_OP_ROTATE_RIGHT:
        return astContext.bvror(args.get(0), intParameter(expr, 0));
      default:
        throw new EngineException("Unsupported Z3 operator " + kind
            + " in " + expr);
    }
  }
}
