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
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link AstNode}s. Every node leaves the context through
 * {@link AstGarbageCollector#recordAstNode(AstNode)}, so that with AST
 * dictionaries enabled two constructions of the same formula give the same
 * node. Widths are checked here; a malformed construction throws
 * {@link IllegalArgumentException} and records nothing.
 * <p>
 * The context also keeps the concrete value of every symbolic variable, which
 * {@link #evaluate(AstNode)} uses for variable leaves.
 */
public class AstContext {
  /** Widest bitvector the engine builds. */
  public static final int MAX_BITS_SUPPORTED = 512;

  private static final ImmutableList<AstNode> NO_CHILDREN = ImmutableList.of();
  private static final ImmutableList<Integer> NO_PARAMETERS =
      ImmutableList.of();

  private final AstGarbageCollector collector;

  /** Concrete value of each symbolic variable, by variable id. */
  private final Map<Long, BigInteger> variableValues = Maps.newHashMap();

  public AstContext(AstGarbageCollector collector) {
    this.collector = collector;
  }

  public AstGarbageCollector getCollector() {
    return collector;
  }

  private AstNode record(AstKind kind, int bitSize, List<AstNode> children,
      List<Integer> parameters, BigInteger constant, SymbolicVariable variable,
      SymbolicExpression expression) {
    return collector.recordAstNode(new AstNode(this, kind, bitSize,
        ImmutableList.copyOf(children), ImmutableList.copyOf(parameters),
        constant, variable, expression));
  }

  private AstNode operator(AstKind kind, int bitSize, AstNode... children) {
    return record(kind, bitSize, Arrays.asList(children), NO_PARAMETERS, null,
        null, null);
  }

  private static void checkBitvector(AstNode node) {
    Preconditions.checkArgument(!node.isLogical(),
        "Expected a bitvector node, got a logical node: %s", node);
  }

  private static void checkLogical(AstNode node) {
    Preconditions.checkArgument(node.isLogical(),
        "Expected a logical node, got a bitvector node: %s", node);
  }

  private static void checkSameSize(AstNode a, AstNode b) {
    Preconditions.checkArgument(
        a.getBitvectorSize() == b.getBitvectorSize(),
        "Operand sizes differ: %s bits and %s bits",
        a.getBitvectorSize(), b.getBitvectorSize());
  }

  private static void checkSize(int bitSize) {
    Preconditions.checkArgument(bitSize > 0 && bitSize <= MAX_BITS_SUPPORTED,
        "Invalid bitvector size: %s", bitSize);
  }

  /* Leaves ------------------------------------------------------------- */

  /** A boolean constant. */
  public AstNode bool(boolean value) {
    return record(AstKind.BOOL, 1, NO_CHILDREN, NO_PARAMETERS,
        value ? BigInteger.ONE : BigInteger.ZERO, null, null);
  }

  /** A bitvector constant; the value is truncated to {@code bitSize} bits. */
  public AstNode bv(BigInteger value, int bitSize) {
    checkSize(bitSize);
    BigInteger mask = BigInteger.ONE.shiftLeft(bitSize)
        .subtract(BigInteger.ONE);
    return record(AstKind.BV, bitSize, NO_CHILDREN, NO_PARAMETERS,
        value.and(mask), null, null);
  }

  public AstNode bv(long value, int bitSize) {
    return bv(BigInteger.valueOf(value), bitSize);
  }

  /** The 1-bit constant 1. */
  public AstNode bvtrue() {
    return bv(BigInteger.ONE, 1);
  }

  /** The 1-bit constant 0. */
  public AstNode bvfalse() {
    return bv(BigInteger.ZERO, 1);
  }

  /** The leaf standing for a free symbolic variable. */
  public AstNode variable(SymbolicVariable variable) {
    return record(AstKind.VARIABLE, variable.getBitSize(), NO_CHILDREN,
        NO_PARAMETERS, null, variable, null);
  }

  /**
   * A leaf pointing at a registered expression. The referenced formula is
   * only inlined by {@link SymbolicEngine#getFullAst(AstNode)}.
   */
  public AstNode reference(SymbolicExpression expression) {
    return record(AstKind.REFERENCE, expression.getAst().getBitvectorSize(),
        NO_CHILDREN, NO_PARAMETERS, null, null, expression);
  }

  /* Width changes ------------------------------------------------------ */

  public AstNode extract(int high, int low, AstNode node) {
    checkBitvector(node);
    Preconditions.checkArgument(low >= 0 && high >= low
        && high < node.getBitvectorSize(),
        "Invalid extract range [%s:%s] on %s bits", high, low,
        node.getBitvectorSize());
    if (low == 0 && high == node.getBitvectorSize() - 1) {
      return node;
    }
    return record(AstKind.EXTRACT, high - low + 1, ImmutableList.of(node),
        ImmutableList.of(high, low), null, null, null);
  }

  /** Concatenation; the first node holds the most significant bits. */
  public AstNode concat(List<AstNode> nodes) {
    Preconditions.checkArgument(nodes.size() >= 2,
        "concat needs at least two operands");
    int size = 0;
    for (AstNode node : nodes) {
      checkBitvector(node);
      size += node.getBitvectorSize();
    }
    checkSize(size);
    return record(AstKind.CONCAT, size, nodes, NO_PARAMETERS, null, null,
        null);
  }

  public AstNode concat(AstNode high, AstNode low) {
    return concat(ImmutableList.of(high, low));
  }

  public AstNode zx(int extension, AstNode node) {
    return extend(AstKind.ZX, extension, node);
  }

  public AstNode sx(int extension, AstNode node) {
    return extend(AstKind.SX, extension, node);
  }

  private AstNode extend(AstKind kind, int extension, AstNode node) {
    checkBitvector(node);
    Preconditions.checkArgument(extension >= 0, "Negative extension");
    checkSize(node.getBitvectorSize() + extension);
    return record(kind, node.getBitvectorSize() + extension,
        ImmutableList.of(node), ImmutableList.of(extension), null, null, null);
  }

  /* Bitvector arithmetic ----------------------------------------------- */

  private AstNode binary(AstKind kind, AstNode a, AstNode b) {
    checkBitvector(a);
    checkBitvector(b);
    checkSameSize(a, b);
    return operator(kind, a.getBitvectorSize(), a, b);
  }

  public AstNode bvadd(AstNode a, AstNode b) {
    return binary(AstKind.BVADD, a, b);
  }

  public AstNode bvsub(AstNode a, AstNode b) {
    return binary(AstKind.BVSUB, a, b);
  }

  public AstNode bvmul(AstNode a, AstNode b) {
    return binary(AstKind.BVMUL, a, b);
  }

  public AstNode bvudiv(AstNode a, AstNode b) {
    return binary(AstKind.BVUDIV, a, b);
  }

  public AstNode bvsdiv(AstNode a, AstNode b) {
    return binary(AstKind.BVSDIV, a, b);
  }

  public AstNode bvurem(AstNode a, AstNode b) {
    return binary(AstKind.BVUREM, a, b);
  }

  public AstNode bvsrem(AstNode a, AstNode b) {
    return binary(AstKind.BVSREM, a, b);
  }

  public AstNode bvsmod(AstNode a, AstNode b) {
    return binary(AstKind.BVSMOD, a, b);
  }

  public AstNode bvand(AstNode a, AstNode b) {
    return binary(AstKind.BVAND, a, b);
  }

  public AstNode bvor(AstNode a, AstNode b) {
    return binary(AstKind.BVOR, a, b);
  }

  public AstNode bvxor(AstNode a, AstNode b) {
    return binary(AstKind.BVXOR, a, b);
  }

  public AstNode bvnand(AstNode a, AstNode b) {
    return binary(AstKind.BVNAND, a, b);
  }

  public AstNode bvnor(AstNode a, AstNode b) {
    return binary(AstKind.BVNOR, a, b);
  }

  public AstNode bvxnor(AstNode a, AstNode b) {
    return binary(AstKind.BVXNOR, a, b);
  }

  public AstNode bvshl(AstNode a, AstNode b) {
    return binary(AstKind.BVSHL, a, b);
  }

  public AstNode bvlshr(AstNode a, AstNode b) {
    return binary(AstKind.BVLSHR, a, b);
  }

  public AstNode bvashr(AstNode a, AstNode b) {
    return binary(AstKind.BVASHR, a, b);
  }

  public AstNode bvnot(AstNode node) {
    checkBitvector(node);
    return operator(AstKind.BVNOT, node.getBitvectorSize(), node);
  }

  public AstNode bvneg(AstNode node) {
    checkBitvector(node);
    return operator(AstKind.BVNEG, node.getBitvectorSize(), node);
  }

  public AstNode bvrol(AstNode node, int rotation) {
    return rotate(AstKind.BVROL, node, rotation);
  }

  public AstNode bvror(AstNode node, int rotation) {
    return rotate(AstKind.BVROR, node, rotation);
  }

  private AstNode rotate(AstKind kind, AstNode node, int rotation) {
    checkBitvector(node);
    Preconditions.checkArgument(rotation >= 0, "Negative rotation");
    return record(kind, node.getBitvectorSize(), ImmutableList.of(node),
        ImmutableList.of(rotation), null, null, null);
  }

  /* Predicates --------------------------------------------------------- */

  private AstNode comparison(AstKind kind, AstNode a, AstNode b) {
    checkBitvector(a);
    checkBitvector(b);
    checkSameSize(a, b);
    return operator(kind, 1, a, b);
  }

  /** Equality of two bitvectors, or of two logical nodes. */
  public AstNode equal(AstNode a, AstNode b) {
    return equality(AstKind.EQUAL, a, b);
  }

  public AstNode distinct(AstNode a, AstNode b) {
    return equality(AstKind.DISTINCT, a, b);
  }

  private AstNode equality(AstKind kind, AstNode a, AstNode b) {
    if (a.isLogical() || b.isLogical()) {
      checkLogical(a);
      checkLogical(b);
      return operator(kind, 1, a, b);
    }
    return comparison(kind, a, b);
  }

  public AstNode bvult(AstNode a, AstNode b) {
    return comparison(AstKind.BVULT, a, b);
  }

  public AstNode bvule(AstNode a, AstNode b) {
    return comparison(AstKind.BVULE, a, b);
  }

  public AstNode bvugt(AstNode a, AstNode b) {
    return comparison(AstKind.BVUGT, a, b);
  }

  public AstNode bvuge(AstNode a, AstNode b) {
    return comparison(AstKind.BVUGE, a, b);
  }

  public AstNode bvslt(AstNode a, AstNode b) {
    return comparison(AstKind.BVSLT, a, b);
  }

  public AstNode bvsle(AstNode a, AstNode b) {
    return comparison(AstKind.BVSLE, a, b);
  }

  public AstNode bvsgt(AstNode a, AstNode b) {
    return comparison(AstKind.BVSGT, a, b);
  }

  public AstNode bvsge(AstNode a, AstNode b) {
    return comparison(AstKind.BVSGE, a, b);
  }

  public AstNode land(List<AstNode> nodes) {
    return junction(AstKind.LAND, nodes);
  }

  public AstNode land(AstNode a, AstNode b) {
    return land(ImmutableList.of(a, b));
  }

  public AstNode lor(List<AstNode> nodes) {
    return junction(AstKind.LOR, nodes);
  }

  public AstNode lor(AstNode a, AstNode b) {
    return lor(ImmutableList.of(a, b));
  }

  private AstNode junction(AstKind kind, List<AstNode> nodes) {
    Preconditions.checkArgument(!nodes.isEmpty(), "%s needs an operand",
        kind.getSmtName());
    for (AstNode node : nodes) {
      checkLogical(node);
    }
    return record(kind, 1, nodes, NO_PARAMETERS, null, null, null);
  }

  public AstNode lnot(AstNode node) {
    checkLogical(node);
    return operator(AstKind.LNOT, 1, node);
  }

  /** If-then-else over two bitvectors of the same width. */
  public AstNode ite(AstNode condition, AstNode then, AstNode otherwise) {
    checkLogical(condition);
    checkBitvector(then);
    checkBitvector(otherwise);
    checkSameSize(then, otherwise);
    return operator(AstKind.ITE, then.getBitvectorSize(), condition, then,
        otherwise);
  }

  /* Generic construction ----------------------------------------------- */

  /**
   * Builds an operator node of the given kind from children and attributes,
   * with the same checks as the dedicated factory. Leaves are not built here.
   */
  public AstNode node(AstKind kind, List<AstNode> children,
      List<Integer> parameters) {
    switch (kind) {
      case EXTRACT:
        return extract(parameters.get(0), parameters.get(1), children.get(0));
      case CONCAT:
        return concat(children);
      case ZX:
        return zx(parameters.get(0), children.get(0));
      case SX:
        return sx(parameters.get(0), children.get(0));
      case BVROL:
        return bvrol(children.get(0), parameters.get(0));
      case BVROR:
        return bvror(children.get(0), parameters.get(0));
      case BVNOT:
        return bvnot(children.get(0));
      case BVNEG:
        return bvneg(children.get(0));
      case EQUAL:
      case DISTINCT:
        return equality(kind, children.get(0), children.get(1));
      case LAND:
      case LOR:
        return junction(kind, children);
      case LNOT:
        return lnot(children.get(0));
      case ITE:
        return ite(children.get(0), children.get(1), children.get(2));
      case BOOL:
      case BV:
      case VARIABLE:
      case REFERENCE:
        throw new IllegalArgumentException("Not an operator: " + kind);
      default:
        if (kind.isBinaryBitvectorOperator()) {
          return binary(kind, children.get(0), children.get(1));
        }
        return comparison(kind, children.get(0), children.get(1));
    }
  }

  /**
   * Returns {@code node} with its children replaced, or {@code node} itself
   * if every child is unchanged.
   */
  public AstNode rebuild(AstNode node, List<AstNode> children) {
    List<AstNode> old = node.getChildren();
    boolean changed = false;
    for (int i = 0; i < old.size(); i++) {
      if (old.get(i) != children.get(i)) {
        changed = true;
        break;
      }
    }
    if (!changed) {
      return node;
    }
    return node(node.getKind(), children, node.getParameters());
  }

  /* Variable values ---------------------------------------------------- */

  /** Sets the concrete value used when evaluating the variable. */
  public void setVariableValue(SymbolicVariable variable, BigInteger value) {
    BigInteger mask = BigInteger.ONE.shiftLeft(variable.getBitSize())
        .subtract(BigInteger.ONE);
    variableValues.put(variable.getId(), value.and(mask));
  }

  /** The concrete value of the variable; zero until one has been set. */
  public BigInteger getVariableValue(SymbolicVariable variable) {
    BigInteger value = variableValues.get(variable.getId());
    return value == null ? BigInteger.ZERO : value;
  }

  /* Evaluation --------------------------------------------------------- */

  /**
   * Computes the concrete value of a formula. Shared subformulas are
   * evaluated once; the traversal is iterative so deep reference chains do
   * not exhaust the stack.
   */
  public BigInteger evaluate(AstNode root) {
    Map<AstNode, BigInteger> values = Maps.newIdentityHashMap();
    Deque<AstNode> pending = Lists.newLinkedList();
    pending.push(root);
    while (!pending.isEmpty()) {
      AstNode node = pending.peek();
      if (values.containsKey(node)) {
        pending.pop();
        continue;
      }
      boolean ready = true;
      for (AstNode operand : operands(node)) {
        if (!values.containsKey(operand)) {
          pending.push(operand);
          ready = false;
        }
      }
      if (ready) {
        pending.pop();
        values.put(node, BitvectorSemantics.apply(node, values, this));
      }
    }
    return values.get(root);
  }

  /** The nodes a node's value is computed from. */
  static List<AstNode> operands(AstNode node) {
    if (node.getKind() == AstKind.REFERENCE) {
      return ImmutableList.of(node.getSymbolicExpression().getAst());
    }
    return node.getChildren();
  }
}
