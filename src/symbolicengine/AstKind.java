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
 * The constructors an {@link AstNode} can be built with. The SMT-LIB name of
 * each kind is used by {@link SmtRepresentation}.
 */
public enum AstKind {
  BOOL("bool", true),
  BV("_ bv", false),
  VARIABLE("variable", false),
  REFERENCE("reference", false),

  EXTRACT("_ extract", false),
  CONCAT("concat", false),
  ZX("_ zero_extend", false),
  SX("_ sign_extend", false),

  BVADD("bvadd", false),
  BVSUB("bvsub", false),
  BVMUL("bvmul", false),
  BVUDIV("bvudiv", false),
  BVSDIV("bvsdiv", false),
  BVUREM("bvurem", false),
  BVSREM("bvsrem", false),
  BVSMOD("bvsmod", false),
  BVAND("bvand", false),
  BVOR("bvor", false),
  BVXOR("bvxor", false),
  BVNAND("bvnand", false),
  BVNOR("bvnor", false),
  BVXNOR("bvxnor", false),
  BVNOT("bvnot", false),
  BVNEG("bvneg", false),
  BVSHL("bvshl", false),
  BVLSHR("bvlshr", false),
  BVASHR("bvashr", false),
  BVROL("_ rotate_left", false),
  BVROR("_ rotate_right", false),

  EQUAL("=", true),
  DISTINCT("distinct", true),
  BVULT("bvult", true),
  BVULE("bvule", true),
  BVUGT("bvugt", true),
  BVUGE("bvuge", true),
  BVSLT("bvslt", true),
  BVSLE("bvsle", true),
  BVSGT("bvsgt", true),
  BVSGE("bvsge", true),

  LAND("and", true),
  LOR("or", true),
  LNOT("not", true),

  ITE("ite", false);

  private final String smtName;
  private final boolean logical;

  private AstKind(String smtName, boolean logical) {
    this.smtName = smtName;
    this.logical = logical;
  }

  /** The operator name used in SMT-LIB2 output. */
  public String getSmtName() {
    return smtName;
  }

  /** True if nodes of this kind are boolean rather than bitvector valued. */
  public boolean isLogical() {
    return logical;
  }

  /** True if the kind is a two-operand bitvector operator of equal widths. */
  boolean isBinaryBitvectorOperator() {
    switch (this) {
      case BVADD:
      case BVSUB:
      case BVMUL:
      case BVUDIV:
      case BVSDIV:
      case BVUREM:
      case BVSREM:
      case BVSMOD:
      case BVAND:
      case BVOR:
      case BVXOR:
      case BVNAND:
      case BVNOR:
      case BVXNOR:
      case BVSHL:
      case BVLSHR:
      case BVASHR:
        return true;
      default:
        return false;
    }
  }

  /** True if the kind compares two bitvectors of equal widths. */
  boolean isComparison() {
    switch (this) {
      case EQUAL:
      case DISTINCT:
      case BVULT:
      case BVULE:
      case BVUGT:
      case BVUGE:
      case BVSLT:
      case BVSLE:
      case BVSGT:
      case BVSGE:
        return true;
      default:
        return false;
    }
  }
}
