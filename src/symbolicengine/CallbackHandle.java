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
 * Identifies one registration with {@link Callbacks}. Handles compare by
 * identity, so registering the same callback twice gives two handles that are
 * removed independently.
 */
public final class CallbackHandle {
  private final CallbackKind kind;
  private final long sequence;

  CallbackHandle(CallbackKind kind, long sequence) {
    this.kind = kind;
    this.sequence = sequence;
  }

  public CallbackKind getKind() {
    return kind;
  }

  @Override
  public String toString() {
    return kind + "#" + sequence;
  }
}
