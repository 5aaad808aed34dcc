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

/**
 * A registered formula: the root node of a symbolic value together with the
 * id other formulas use to refer to it.
 * <p>
 * There is one instance per id. The root node never changes once the
 * expression is registered, so every reference node built on it keeps its
 * width; only the origin locations are updated as the expression is bound
 * to registers and memory.
 */
public final class SymbolicExpression {
  private final long id;
  private final AstNode ast;
  private final ExpressionKind kind;
  private final String comment;
  private Register originRegister;
  private MemoryAccess originMemory;

  SymbolicExpression(long id, AstNode ast, ExpressionKind kind, String comment,
      Register originRegister, MemoryAccess originMemory) {
    this.id = id;
    this.ast = ast;
    this.kind = kind;
    this.comment = comment == null ? "" : comment;
    this.originRegister = originRegister;
    this.originMemory = originMemory;
  }

  /** A detached copy, used to capture the origins in a snapshot. */
  SymbolicExpression copy() {
    return new SymbolicExpression(id, ast, kind, comment, originRegister,
        originMemory);
  }

  /** Puts back the origins captured by {@link #copy}. */
  void restoreOrigins(SymbolicExpression saved) {
    this.originRegister = saved.originRegister;
    this.originMemory = saved.originMemory;
  }

  void setOriginRegister(Register register) {
    this.originRegister = register;
  }

  void setOriginMemory(MemoryAccess memory) {
    this.originMemory = memory;
  }

  public long getId() {
    return id;
  }

  public AstNode getAst() {
    return ast;
  }

  public ExpressionKind getKind() {
    return kind;
  }

  public String getComment() {
    return comment;
  }

  /** The register this expression was built for, or null. */
  public Register getOriginRegister() {
    return originRegister;
  }

  /** The memory this expression was built for, or null. */
  public MemoryAccess getOriginMemory() {
    return originMemory;
  }

  public boolean isRegister() {
    return kind == ExpressionKind.REGISTER || kind == ExpressionKind.FLAG;
  }

  public boolean isMemory() {
    return kind == ExpressionKind.MEMORY;
  }

  /** {@code ref!<id>}, the name references to this expression print as. */
  public String getReferenceName() {
    return SmtRepresentation.REFERENCE_PREFIX + id;
  }

  /** The SMT-LIB2 definition of this expression, comment included. */
  public String getFormula() {
    String formula = String.format("(define-fun %s () %s %s)",
        getReferenceName(), SmtRepresentation.sort(ast), ast);
    return comment.isEmpty() ? formula : formula + " ; " + comment;
  }

  @Override
  public String toString() {
    return getFormula();
  }
}
