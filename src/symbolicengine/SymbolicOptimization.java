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
 * Optional behaviours of the symbolic engine.
 */
public enum SymbolicOptimization {
  /** Deduplicate structurally equal nodes through the AST dictionaries. */
  AST_DICTIONARIES,
  /**
   * After each instruction, drop the expressions it built that depend on no
   * symbolic variable, leaving their locations concrete.
   */
  ONLY_ON_SYMBOLIZED,
  /**
   * After each instruction, drop the expressions it built that are not
   * tainted, leaving their locations concrete.
   */
  ONLY_ON_TAINTED
}
