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
 * What a symbolic expression defines.
 */
public enum ExpressionKind {
  /** The value of a (parent) register. */
  REGISTER,
  /** The value of one or more memory bytes. */
  MEMORY,
  /** The value of a flag register. */
  FLAG,
  /** An intermediate result bound to no location. */
  VOLATILE
}
