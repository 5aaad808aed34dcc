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
 * Called before the engine reads a concrete memory value, so that the
 * registrant can supply the value first (for example by mapping memory on
 * demand through {@link AnalysisContext#setConcreteMemoryValue}).
 */
public interface GetConcreteMemoryValueCallback {
  void onConcreteMemoryRead(AnalysisContext context, MemoryAccess memory);
}
