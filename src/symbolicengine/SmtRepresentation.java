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

import java.util.Collection;

/**
 * Prints nodes in SMT-LIB2 syntax. References print as {@code ref!<id>} and
 * are not expanded; expand them first with
 * {@link SymbolicEngine#getFullAst(AstNode)} to get a closed formula.
 */
public final class SmtRepresentation {
  /** Prefix of the name a reference prints as. */
  public static final String REFERENCE_PREFIX = "ref!";

  private SmtRepresentation() {}

  public static String print(AstNode node) {
    StringBuilder out = new StringBuilder();
    print(node, out);
    return out.toString();
  }

  /** {@code Bool} or {@code (_ BitVec n)}. */
  public static String sort(AstNode node) {
    return node.isLogical()
        ? "Bool" : "(_ BitVec " + node.getBitvectorSize() + ")";
  }

  /** One {@code declare-fun} line per variable, in iteration order. */
  public static String variablesDeclaration(
      Collection<SymbolicVariable> variables) {
    StringBuilder out = new StringBuilder();
    for (SymbolicVariable variable : variables) {
      out.append(String.format("(declare-fun %s () (_ BitVec %d))\n",
          variable.getName(), variable.getBitSize()));
    }
    return out.toString();
  }

  private static void print(AstNode node, StringBuilder out) {
    AstKind kind = node.getKind();
    switch (kind) {
      case BOOL:
        out.append(node.getConstant().signum() != 0 ? "true" : "false");
        return;
      case BV:
        out.append("(_ bv").append(node.getConstant()).append(' ')
            .append(node.getBitvectorSize()).append(')');
        return;
      case VARIABLE:
        out.append(node.getVariable().getName());
        return;
      case REFERENCE:
        out.append(REFERENCE_PREFIX)
            .append(node.getSymbolicExpression().getId());
        return;
      case EXTRACT:
      case ZX:
      case SX:
      case BVROL:
      case BVROR:
        out.append("((").append(kind.getSmtName());
        for (Integer parameter : node.getParameters()) {
          out.append(' ').append(parameter);
        }
        out.append(')');
        break;
      default:
        out.append('(').append(kind.getSmtName());
        break;
    }
    for (AstNode child : node.getChildren()) {
      out.append(' ');
      print(child, out);
    }
    out.append(')');
  }
}
