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

import com.google.common.base.Preconditions;

/**
 * An instruction operand: exactly one of a register, a memory access or an
 * immediate, as told by {@link #getKind()}.
 */
public final class Operand {
  /** The three kinds of operand. */
  public enum Kind {
    REGISTER,
    MEMORY,
    IMMEDIATE
  }

  private final Kind kind;
  private final Register register;
  private final MemoryAccess memory;
  private final Immediate immediate;

  private Operand(Kind kind, Register register, MemoryAccess memory,
      Immediate immediate) {
    this.kind = kind;
    this.register = register;
    this.memory = memory;
    this.immediate = immediate;
  }

  public static Operand of(Register register) {
    return new Operand(Kind.REGISTER, Preconditions.checkNotNull(register),
        null, null);
  }

  public static Operand of(MemoryAccess memory) {
    return new Operand(Kind.MEMORY, null, Preconditions.checkNotNull(memory),
        null);
  }

  public static Operand of(Immediate immediate) {
    return new Operand(Kind.IMMEDIATE, null, null,
        Preconditions.checkNotNull(immediate));
  }

  public Kind getKind() {
    return kind;
  }

  public Register getRegister() {
    Preconditions.checkState(kind == Kind.REGISTER, "Not a register: %s", this);
    return register;
  }

  public MemoryAccess getMemory() {
    Preconditions.checkState(kind == Kind.MEMORY, "Not a memory: %s", this);
    return memory;
  }

  public Immediate getImmediate() {
    Preconditions.checkState(kind == Kind.IMMEDIATE, "Not an immediate: %s",
        this);
    return immediate;
  }

  public int getBitSize() {
    switch (kind) {
      case REGISTER:
        return register.getBitSize();
      case MEMORY:
        return memory.getBitSize();
      default:
        return immediate.getBitSize();
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Operand)) {
      return false;
    }
    Operand other = (Operand) obj;
    return kind == other.kind && toString().equals(other.toString());
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public String toString() {
    switch (kind) {
      case REGISTER:
        return register.toString();
      case MEMORY:
        return memory.toString();
      default:
        return immediate.toString();
    }
  }
}
