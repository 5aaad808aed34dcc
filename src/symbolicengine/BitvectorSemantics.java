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

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Concrete semantics of each node kind, following SMT-LIB: division by zero
 * yields all ones (unsigned) or the sign-dependent constant (signed),
 * remainder by zero yields the dividend, and shifts of at least the width
 * saturate.
 */
final class BitvectorSemantics {
  private BitvectorSemantics() {}

  static BigInteger mask(int bitSize) {
    return BigInteger.ONE.shiftLeft(bitSize).subtract(BigInteger.ONE);
  }

  /** Interprets the low {@code bitSize} bits of value as two's complement. */
  static BigInteger toSigned(BigInteger value, int bitSize) {
    if (value.testBit(bitSize - 1)) {
      return value.subtract(BigInteger.ONE.shiftLeft(bitSize));
    }
    return value;
  }

  private static BigInteger bool(boolean value) {
    return value ? BigInteger.ONE : BigInteger.ZERO;
  }

  private static boolean isTrue(BigInteger value) {
    return value.signum() != 0;
  }

  /**
   * Computes the value of {@code node} from the already computed values of
   * its operands.
   */
  static BigInteger apply(AstNode node, Map<AstNode, BigInteger> values,
      AstContext context) {
    int size = node.getBitvectorSize();
    BigInteger mask = mask(size);
    List<AstNode> children = node.getChildren();
    BigInteger a = children.size() > 0 ? values.get(children.get(0)) : null;
    BigInteger b = children.size() > 1 ? values.get(children.get(1)) : null;
    int operandSize = children.isEmpty()
        ? size : children.get(0).getBitvectorSize();

    switch (node.getKind()) {
      case BOOL:
      case BV:
        return node.getConstant();
      case VARIABLE:
        return context.getVariableValue(node.getVariable());
      case REFERENCE:
        return values.get(node.getSymbolicExpression().getAst());

      case EXTRACT:
        return a.shiftRight(node.getParameters().get(1)).and(mask);
      case CONCAT: {
        BigInteger result = BigInteger.ZERO;
        for (AstNode child : children) {
          result = result.shiftLeft(child.getBitvectorSize())
              .or(values.get(child));
        }
        return result;
      }
      case ZX:
        return a;
      case SX:
        return toSigned(a, operandSize).and(mask);

      case BVADD:
        return a.add(b).and(mask);
      case BVSUB:
        return a.subtract(b).and(mask);
      case BVMUL:
        return a.multiply(b).and(mask);
      case BVUDIV:
        return b.signum() == 0 ? mask : a.divide(b);
      case BVSDIV: {
        BigInteger sa = toSigned(a, size);
        BigInteger sb = toSigned(b, size);
        if (sb.signum() == 0) {
          return sa.signum() < 0 ? BigInteger.ONE : mask;
        }
        return sa.divide(sb).and(mask);
      }
      case BVUREM:
        return b.signum() == 0 ? a : a.mod(b);
      case BVSREM: {
        if (b.signum() == 0) {
          return a;
        }
        return toSigned(a, size).remainder(toSigned(b, size)).and(mask);
      }
      case BVSMOD: {
        if (b.signum() == 0) {
          return a;
        }
        BigInteger sb = toSigned(b, size);
        BigInteger r = toSigned(a, size).remainder(sb);
        if (r.signum() != 0 && r.signum() != sb.signum()) {
          r = r.add(sb);
        }
        return r.and(mask);
      }
      case BVAND:
        return a.and(b);
      case BVOR:
        return a.or(b);
      case BVXOR:
        return a.xor(b);
      case BVNAND:
        return a.and(b).xor(mask);
      case BVNOR:
        return a.or(b).xor(mask);
      case BVXNOR:
        return a.xor(b).xor(mask);
      case BVNOT:
        return a.xor(mask);
      case BVNEG:
        return a.negate().and(mask);
      case BVSHL:
        return b.compareTo(BigInteger.valueOf(size)) >= 0
            ? BigInteger.ZERO : a.shiftLeft(b.intValue()).and(mask);
      case BVLSHR:
        return b.compareTo(BigInteger.valueOf(size)) >= 0
            ? BigInteger.ZERO : a.shiftRight(b.intValue());
      case BVASHR: {
        int shift = b.min(BigInteger.valueOf(size)).intValue();
        return toSigned(a, size).shiftRight(shift).and(mask);
      }
      case BVROL: {
        int r = node.getParameters().get(0) % size;
        return a.shiftLeft(r).or(a.shiftRight(size - r)).and(mask);
      }
      case BVROR: {
        int r = node.getParameters().get(0) % size;
        return a.shiftRight(r).or(a.shiftLeft(size - r)).and(mask);
      }

      case EQUAL:
        return bool(a.equals(b));
      case DISTINCT:
        return bool(!a.equals(b));
      case BVULT:
        return bool(a.compareTo(b) < 0);
      case BVULE:
        return bool(a.compareTo(b) <= 0);
      case BVUGT:
        return bool(a.compareTo(b) > 0);
      case BVUGE:
        return bool(a.compareTo(b) >= 0);
      case BVSLT:
        return bool(signedCompare(a, b, operandSize) < 0);
      case BVSLE:
        return bool(signedCompare(a, b, operandSize) <= 0);
      case BVSGT:
        return bool(signedCompare(a, b, operandSize) > 0);
      case BVSGE:
        return bool(signedCompare(a, b, operandSize) >= 0);

      case LAND:
        for (AstNode child : children) {
          if (!isTrue(values.get(child))) {
            return BigInteger.ZERO;
          }
        }
        return BigInteger.ONE;
      case LOR:
        for (AstNode child : children) {
          if (isTrue(values.get(child))) {
            return BigInteger.ONE;
          }
        }
        return BigInteger.ZERO;
      case LNOT:
        return bool(!isTrue(a));
      case ITE:
        return isTrue(a) ? b : values.get(children.get(2));
      default:
        throw new EngineException("No semantics for " + node.getKind());
    }
  }

  private static int signedCompare(BigInteger a, BigInteger b, int size) {
    return toSigned(a, size).compareTo(toSigned(b, size));
  }
}
