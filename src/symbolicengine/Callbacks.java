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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import java.util.Map;

/**
 * Ordered lists of callbacks, one list per {@link CallbackKind}. Callbacks
 * run in registration order; nothing is deduplicated or prioritised.
 * Registration returns a {@link CallbackHandle}, and removal takes that
 * handle rather than the callback itself.
 */
public class Callbacks {
  private final Map<CallbackHandle, GetConcreteMemoryValueCallback>
      memoryCallbacks = Maps.newLinkedHashMap();
  private final Map<CallbackHandle, GetConcreteRegisterValueCallback>
      registerCallbacks = Maps.newLinkedHashMap();
  private final Map<CallbackHandle, SymbolicSimplificationCallback>
      simplificationCallbacks = Maps.newLinkedHashMap();
  private long sequence;

  private CallbackHandle newHandle(CallbackKind kind) {
    return new CallbackHandle(kind, sequence++);
  }

  public CallbackHandle addCallback(GetConcreteMemoryValueCallback callback) {
    CallbackHandle handle = newHandle(CallbackKind.GET_CONCRETE_MEMORY_VALUE);
    memoryCallbacks.put(handle, callback);
    return handle;
  }

  public CallbackHandle addCallback(
      GetConcreteRegisterValueCallback callback) {
    CallbackHandle handle =
        newHandle(CallbackKind.GET_CONCRETE_REGISTER_VALUE);
    registerCallbacks.put(handle, callback);
    return handle;
  }

  public CallbackHandle addCallback(SymbolicSimplificationCallback callback) {
    CallbackHandle handle = newHandle(CallbackKind.SYMBOLIC_SIMPLIFICATION);
    simplificationCallbacks.put(handle, callback);
    return handle;
  }

  /**
   * Unregisters the callback added under {@code handle}.
   *
   * @return false if the handle was already removed or never issued here
   */
  public boolean removeCallback(CallbackHandle handle) {
    switch (handle.getKind()) {
      case GET_CONCRETE_MEMORY_VALUE:
        return memoryCallbacks.remove(handle) != null;
      case GET_CONCRETE_REGISTER_VALUE:
        return registerCallbacks.remove(handle) != null;
      default:
        return simplificationCallbacks.remove(handle) != null;
    }
  }

  public void removeAllCallbacks() {
    memoryCallbacks.clear();
    registerCallbacks.clear();
    simplificationCallbacks.clear();
  }

  /** True if at least one callback of the kind is registered. */
  public boolean isDefined(CallbackKind kind) {
    return count(kind) > 0;
  }

  public int count(CallbackKind kind) {
    switch (kind) {
      case GET_CONCRETE_MEMORY_VALUE:
        return memoryCallbacks.size();
      case GET_CONCRETE_REGISTER_VALUE:
        return registerCallbacks.size();
      default:
        return simplificationCallbacks.size();
    }
  }

  /**
   * Runs the memory read callbacks. The list is copied first, so a callback
   * may register or remove callbacks without disturbing this run.
   */
  void processCallbacks(AnalysisContext context, MemoryAccess memory) {
    for (GetConcreteMemoryValueCallback callback :
        ImmutableList.copyOf(memoryCallbacks.values())) {
      callback.onConcreteMemoryRead(context, memory);
    }
  }

  void processCallbacks(AnalysisContext context, Register register) {
    for (GetConcreteRegisterValueCallback callback :
        ImmutableList.copyOf(registerCallbacks.values())) {
      callback.onConcreteRegisterRead(context, register);
    }
  }

  /** Threads {@code node} through every simplification pass in order. */
  AstNode processCallbacks(AnalysisContext context, AstNode node) {
    for (SymbolicSimplificationCallback callback :
        ImmutableList.copyOf(simplificationCallbacks.values())) {
      node = callback.simplify(context, node);
      if (node == null) {
        throw new EngineException(
            "A simplification callback returned no node");
      }
    }
    return node;
  }
}
