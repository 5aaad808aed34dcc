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
 * The three extension points of the engine.
 */
public enum CallbackKind {
  /** Runs before a concrete memory value is read. */
  GET_CONCRETE_MEMORY_VALUE,
  /** Runs before a concrete register value is read. */
  GET_CONCRETE_REGISTER_VALUE,
  /** Rewrites every node a new symbolic expression is built from. */
  SYMBOLIC_SIMPLIFICATION
}
