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

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.math.BigInteger;
import java.util.Deque;

/**
 * A node of the expression graph: a formula constructor applied to an ordered
 * list of children. Nodes are immutable once built and may be shared by many
 * parents, so the graph is a DAG.
 * <p>
 * Node identity ({@code ==}) is what the AST dictionaries canonicalize; use
 * {@link #equalTo(AstNode)} to compare two nodes structurally whatever their
 * identity. Nodes are only created through an {@link AstContext}.
 */
public final class AstNode {
  private final AstContext context;
  private final AstKind kind;
  private final int bitSize;
  private final ImmutableList<AstNode> children;
  private final ImmutableList<Integer> parameters;
  private final BigInteger constant;
  private final SymbolicVariable variable;
  private final SymbolicExpression expression;
  private final boolean symbolized;
  private final int hash;

  AstNode(AstContext context, AstKind kind, int bitSize,
      ImmutableList<AstNode> children, ImmutableList<Integer> parameters,
      BigInteger constant, SymbolicVariable variable,
      SymbolicExpression expression) {
    this.context = context;
    this.kind = kind;
    this.bitSize = bitSize;
    this.children = children;
    this.parameters = parameters;
    this.constant = constant;
    this.variable = variable;
    this.expression = expression;
    this.symbolized = computeSymbolized();
    this.hash = computeHash();
  }

  private boolean computeSymbolized() {
    if (variable != null) {
      return true;
    }
    if (expression != null) {
      return expression.getAst().isSymbolized();
    }
    for (AstNode child : children) {
      if (child.symbolized) {
        return true;
      }
    }
    return false;
  }

  private int computeHash() {
    int result = Objects.hashCode(kind, bitSize, parameters, constant,
        variable == null ? null : variable.getId(),
        expression == null ? null : expression.getId());
    for (AstNode child : children) {
      result = 31 * result + child.hash;
    }
    return result;
  }

  /** The context this node was built in. */
  public AstContext getContext() {
    return context;
  }

  public AstKind getKind() {
    return kind;
  }

  /** The width of the node in bits; logical nodes have a width of 1. */
  public int getBitvectorSize() {
    return bitSize;
  }

  /** {@code 2^size - 1} */
  public BigInteger getBitvectorMask() {
    return BigInteger.ONE.shiftLeft(bitSize).subtract(BigInteger.ONE);
  }

  public boolean isLogical() {
    if (expression != null) {
      return expression.getAst().isLogical();
    }
    return kind.isLogical();
  }

  public ImmutableList<AstNode> getChildren() {
    return children;
  }

  /**
   * Integer attributes of the constructor: {@code [high, low]} for
   * {@link AstKind#EXTRACT}, the extension size for {@link AstKind#ZX} and
   * {@link AstKind#SX}, the rotation for {@link AstKind#BVROL} and
   * {@link AstKind#BVROR}; empty otherwise.
   */
  public ImmutableList<Integer> getParameters() {
    return parameters;
  }

  /** The value of a {@link AstKind#BV} or {@link AstKind#BOOL} node. */
  public BigInteger getConstant() {
    return constant;
  }

  /** The variable of a {@link AstKind#VARIABLE} node, null otherwise. */
  public SymbolicVariable getVariable() {
    return variable;
  }

  /** The expression of a {@link AstKind#REFERENCE} node, null otherwise. */
  public SymbolicExpression getSymbolicExpression() {
    return expression;
  }

  /** True if the formula depends on at least one symbolic variable. */
  public boolean isSymbolized() {
    return symbolized;
  }

  /**
   * Computes the concrete value of the formula, using the current concrete
   * value of every symbolic variable it depends on.
   */
  public BigInteger evaluate() {
    return context.evaluate(this);
  }

  /** A hash of the structure of the formula, independent of node identity. */
  public int structuralHash() {
    return hash;
  }

  /**
   * Deep structural comparison: same constructors, attributes and leaves, in
   * the same shape. Expressions and variables compare by id.
   */
  public boolean equalTo(AstNode other) {
    Deque<AstNode[]> pending = Lists.newLinkedList();
    pending.push(new AstNode[] {this, other});
    while (!pending.isEmpty()) {
      AstNode[] pair = pending.pop();
      AstNode left = pair[0];
      AstNode right = pair[1];
      if (left == right) {
        continue;
      }
      if (left.hash != right.hash || !left.shallowEquals(right)) {
        return false;
      }
      for (int i = 0; i < left.children.size(); i++) {
        pending.push(new AstNode[] {left.children.get(i),
            right.children.get(i)});
      }
    }
    return true;
  }

  private boolean shallowEquals(AstNode other) {
    return kind == other.kind
        && bitSize == other.bitSize
        && children.size() == other.children.size()
        && parameters.equals(other.parameters)
        && Objects.equal(constant, other.constant)
        && sameId(variable, other.variable)
        && sameId(expression, other.expression);
  }

  private static boolean sameId(SymbolicVariable a, SymbolicVariable b) {
    return a == null ? b == null : b != null && a.getId() == b.getId();
  }

  private static boolean sameId(SymbolicExpression a, SymbolicExpression b) {
    return a == null ? b == null : b != null && a.getId() == b.getId();
  }

  /** The dictionary key of this node: children compare by identity. */
  AstKey key() {
    return new AstKey(this);
  }

  @Override
  public String toString() {
    return SmtRepresentation.print(this);
  }
}
