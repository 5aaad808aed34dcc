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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks which registers and memory bytes carry tainted data. Registers are
 * tainted as a whole parent register; memory byte by byte.
 * <p>
 * Propagation follows two rules. A union leaves the destination tainted if
 * either side was. An assignment makes the destination exactly as tainted as
 * the source; an immediate source untaints it. For multi-byte memory, a
 * source counts as tainted if any of its bytes is, and the destination
 * bytes are set or cleared together.
 * <p>
 * While disabled, every mutator leaves the state unchanged and returns
 * false.
 */
public class TaintEngine {
  private static final Logger logger =
      Logger.getLogger(TaintEngine.class.getName());

  private final CpuInterface cpu;
  private Set<Register> taintedRegisters = Sets.newHashSet();
  private Set<Long> taintedMemory = Sets.newHashSet();
  private boolean enabled = true;

  TaintEngine(CpuInterface cpu) {
    this.cpu = cpu;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void enable(boolean flag) {
    this.enabled = flag;
  }

  /* Queries ------------------------------------------------------------ */

  public boolean isTainted(Operand operand) {
    switch (operand.getKind()) {
      case REGISTER:
        return isRegisterTainted(operand.getRegister());
      case MEMORY:
        return isMemoryTainted(operand.getMemory());
      default:
        return false;
    }
  }

  public boolean isMemoryTainted(long address) {
    return taintedMemory.contains(address);
  }

  /** True if any byte of {@code [address, address + size)} is tainted. */
  public boolean isMemoryTainted(long address, int size) {
    for (int i = 0; i < size; i++) {
      if (taintedMemory.contains(address + i)) {
        return true;
      }
    }
    return false;
  }

  public boolean isMemoryTainted(MemoryAccess memory) {
    return isMemoryTainted(memory.getAddress(), memory.getSize());
  }

  public boolean isRegisterTainted(Register register) {
    return taintedRegisters.contains(cpu.getParentRegister(register));
  }

  public ImmutableSortedSet<Long> getTaintedMemory() {
    return ImmutableSortedSet.copyOf(taintedMemory);
  }

  public ImmutableSortedSet<Register> getTaintedRegisters() {
    return ImmutableSortedSet.copyOf(taintedRegisters);
  }

  /* Direct updates ----------------------------------------------------- */

  /** Sets the taint of an operand; immediates cannot be tainted. */
  public boolean setTaint(Operand operand, boolean flag) {
    switch (operand.getKind()) {
      case REGISTER:
        return setTaintRegister(operand.getRegister(), flag);
      case MEMORY:
        return setTaintMemory(operand.getMemory(), flag);
      default:
        throw new IllegalArgumentException(
            "An immediate cannot be tainted: " + operand);
    }
  }

  /** @return the new taint of the memory, false while disabled */
  public boolean setTaintMemory(MemoryAccess memory, boolean flag) {
    if (!enabled) {
      return false;
    }
    for (int i = 0; i < memory.getSize(); i++) {
      if (flag) {
        taintedMemory.add(memory.getAddress() + i);
      } else {
        taintedMemory.remove(memory.getAddress() + i);
      }
    }
    return flag;
  }

  /** @return the new taint of the register, false while disabled */
  public boolean setTaintRegister(Register register, boolean flag) {
    if (!enabled) {
      return false;
    }
    if (flag) {
      taintedRegisters.add(cpu.getParentRegister(register));
    } else {
      taintedRegisters.remove(cpu.getParentRegister(register));
    }
    return flag;
  }

  public boolean taintMemory(long address) {
    return setTaintMemory(new MemoryAccess(address, 1), true);
  }

  public boolean taintMemory(MemoryAccess memory) {
    return setTaintMemory(memory, true);
  }

  public boolean taintRegister(Register register) {
    return setTaintRegister(register, true);
  }

  public boolean untaintMemory(long address) {
    return setTaintMemory(new MemoryAccess(address, 1), false);
  }

  public boolean untaintMemory(MemoryAccess memory) {
    return setTaintMemory(memory, false);
  }

  public boolean untaintRegister(Register register) {
    return setTaintRegister(register, false);
  }

  /* Propagation -------------------------------------------------------- */

  /**
   * {@code dst = dst | src}.
   *
   * @return the destination's taint afterwards, false while disabled
   */
  public boolean taintUnion(Operand dst, Operand src) {
    switch (dst.getKind()) {
      case REGISTER:
        switch (src.getKind()) {
          case REGISTER:
            return taintUnionRegisterRegister(dst.getRegister(),
                src.getRegister());
          case MEMORY:
            return taintUnionRegisterMemory(dst.getRegister(),
                src.getMemory());
          default:
            return taintUnionRegisterImmediate(dst.getRegister());
        }
      case MEMORY:
        switch (src.getKind()) {
          case REGISTER:
            return taintUnionMemoryRegister(dst.getMemory(),
                src.getRegister());
          case MEMORY:
            return taintUnionMemoryMemory(dst.getMemory(), src.getMemory());
          default:
            return taintUnionMemoryImmediate(dst.getMemory());
        }
      default:
        throw new IllegalArgumentException(
            "An immediate cannot be a destination: " + dst);
    }
  }

  /**
   * {@code dst = src}.
   *
   * @return the destination's taint afterwards, false while disabled
   */
  public boolean taintAssignment(Operand dst, Operand src) {
    switch (dst.getKind()) {
      case REGISTER:
        switch (src.getKind()) {
          case REGISTER:
            return taintAssignmentRegisterRegister(dst.getRegister(),
                src.getRegister());
          case MEMORY:
            return taintAssignmentRegisterMemory(dst.getRegister(),
                src.getMemory());
          default:
            return taintAssignmentRegisterImmediate(dst.getRegister());
        }
      case MEMORY:
        switch (src.getKind()) {
          case REGISTER:
            return taintAssignmentMemoryRegister(dst.getMemory(),
                src.getRegister());
          case MEMORY:
            return taintAssignmentMemoryMemory(dst.getMemory(),
                src.getMemory());
          default:
            return taintAssignmentMemoryImmediate(dst.getMemory());
        }
      default:
        throw new IllegalArgumentException(
            "An immediate cannot be a destination: " + dst);
    }
  }

  public boolean taintUnionMemoryImmediate(MemoryAccess dst) {
    return enabled && isMemoryTainted(dst);
  }

  public boolean taintUnionMemoryMemory(MemoryAccess dst, MemoryAccess src) {
    if (!enabled) {
      return false;
    }
    return setTaintMemory(dst, isMemoryTainted(dst) || isMemoryTainted(src));
  }

  public boolean taintUnionMemoryRegister(MemoryAccess dst, Register src) {
    if (!enabled) {
      return false;
    }
    return setTaintMemory(dst,
        isMemoryTainted(dst) || isRegisterTainted(src));
  }

  public boolean taintUnionRegisterImmediate(Register dst) {
    return enabled && isRegisterTainted(dst);
  }

  public boolean taintUnionRegisterMemory(Register dst, MemoryAccess src) {
    if (!enabled) {
      return false;
    }
    return setTaintRegister(dst,
        isRegisterTainted(dst) || isMemoryTainted(src));
  }

  public boolean taintUnionRegisterRegister(Register dst, Register src) {
    if (!enabled) {
      return false;
    }
    return setTaintRegister(dst,
        isRegisterTainted(dst) || isRegisterTainted(src));
  }

  public boolean taintAssignmentMemoryImmediate(MemoryAccess dst) {
    return setTaintMemory(dst, false);
  }

  public boolean taintAssignmentMemoryMemory(MemoryAccess dst,
      MemoryAccess src) {
    return setTaintMemory(dst, isMemoryTainted(src));
  }

  public boolean taintAssignmentMemoryRegister(MemoryAccess dst,
      Register src) {
    return setTaintMemory(dst, isRegisterTainted(src));
  }

  public boolean taintAssignmentRegisterImmediate(Register dst) {
    return setTaintRegister(dst, false);
  }

  public boolean taintAssignmentRegisterMemory(Register dst,
      MemoryAccess src) {
    return setTaintRegister(dst, isMemoryTainted(src));
  }

  public boolean taintAssignmentRegisterRegister(Register dst, Register src) {
    return setTaintRegister(dst, isRegisterTainted(src));
  }

  /* Backup ------------------------------------------------------------- */

  Snapshot snapshot() {
    return new Snapshot(taintedRegisters, taintedMemory, enabled);
  }

  void restore(Snapshot snapshot) {
    taintedRegisters = Sets.newHashSet(snapshot.registers);
    taintedMemory = Sets.newHashSet(snapshot.memory);
    enabled = snapshot.enabled;
    logger.log(Level.FINE, "Restored {0} tainted registers, {1} bytes",
        new Object[] {taintedRegisters.size(), taintedMemory.size()});
  }

  /** Frozen copy of the taint state. */
  static final class Snapshot {
    final ImmutableSet<Register> registers;
    final ImmutableSet<Long> memory;
    final boolean enabled;

    Snapshot(Set<Register> registers, Set<Long> memory, boolean enabled) {
      this.registers = ImmutableSet.copyOf(registers);
      this.memory = ImmutableSet.copyOf(memory);
      this.enabled = enabled;
    }
  }
}
