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
 * A simplification pass. It receives the node produced by the previous pass
 * and returns the node to hand to the next one; returning the argument
 * unchanged is how a pass declines. Passes must not modify nodes.
 */
public interface SymbolicSimplificationCallback {
  AstNode simplify(AnalysisContext context, AstNode node);
}
