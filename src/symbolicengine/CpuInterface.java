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

import java.math.BigInteger;

/**
 * The concrete side of an architecture: register metadata and the concrete
 * register and memory store. The engine reads concrete values through
 * {@link AnalysisContext}, which runs the read callbacks first.
 */
public interface CpuInterface {
  /** Every register, parents and sub-registers. */
  ImmutableList<Register> getAllRegisters();

  /** Only the parent registers. */
  ImmutableList<Register> getParentRegisters();

  /**
   * @throws NotFoundException if the architecture has no such register
   */
  Register getRegister(String name);

  /** The parent of {@code register}; a parent is its own parent. */
  Register getParentRegister(Register register);

  boolean isRegister(String name);

  /** The program counter register. */
  Register getProgramCounter();

  /** Width of a general purpose register, in bits. */
  int getGprBitSize();

  BigInteger getConcreteRegisterValue(Register register);

  void setConcreteRegisterValue(Register register, BigInteger value);

  /** The byte at {@code address}, 0 if unmapped. */
  int getConcreteMemoryValue(long address);

  /** The little-endian value of {@code memory}. */
  BigInteger getConcreteMemoryValue(MemoryAccess memory);

  byte[] getConcreteMemoryAreaValue(long address, int size);

  void setConcreteMemoryValue(long address, int value);

  void setConcreteMemoryValue(MemoryAccess memory, BigInteger value);

  void setConcreteMemoryAreaValue(long address, byte[] values);

  /** True if every byte of {@code [address, address + size)} is mapped. */
  boolean isMemoryMapped(long address, int size);

  void unmapMemory(long address, int size);

  /** Resets every register to zero and unmaps all memory. */
  void clear();
}
