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

/**
 * The key of the AST dictionaries. Two nodes have equal keys when they use
 * the same constructor, the same attributes and the very same child nodes, so
 * a key lookup canonicalizes a node whose children are already canonical.
 */
final class AstKey {
  private final AstNode node;

  AstKey(AstNode node) {
    this.node = node;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof AstKey)) {
      return false;
    }
    AstNode other = ((AstKey) obj).node;
    if (node.getKind() != other.getKind()
        || node.getBitvectorSize() != other.getBitvectorSize()
        || node.getVariable() != other.getVariable()
        || node.getSymbolicExpression() != other.getSymbolicExpression()
        || !node.getParameters().equals(other.getParameters())
        || !Objects.equal(node.getConstant(), other.getConstant())
        || node.getChildren().size() != other.getChildren().size()) {
      return false;
    }
    for (int i = 0; i < node.getChildren().size(); i++) {
      if (node.getChildren().get(i) != other.getChildren().get(i)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = Objects.hashCode(node.getKind(), node.getBitvectorSize(),
        node.getParameters(), node.getConstant(),
        System.identityHashCode(node.getVariable()),
        System.identityHashCode(node.getSymbolicExpression()));
    for (AstNode child : node.getChildren()) {
      result = 31 * result + System.identityHashCode(child);
    }
    return result;
  }
}
