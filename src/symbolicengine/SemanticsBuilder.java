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
 * Lifts one instruction into engine operations. An implementation builds
 * each semantic effect through the {@link AnalysisContext} (new expressions,
 * assignments, taint propagation, path constraints) and updates the concrete
 * state with the evaluated results.
 */
public interface SemanticsBuilder {
  /**
   * @return true if the instruction is supported and its semantics were
   *         built, false if it was left untouched
   */
  boolean buildSemantics(Instruction instruction, AnalysisContext context);
}
