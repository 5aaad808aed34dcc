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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * An in-memory concrete store for any register table. Memory is sparse: a
 * byte is mapped once written. {@link #x86_64()} builds the usual x86-64
 * general purpose registers and flags.
 */
public class GenericCpu implements CpuInterface {
  private final ImmutableList<Register> registers;
  private final ImmutableList<Register> parents;
  private final Map<String, Register> registersByName = Maps.newHashMap();
  private final Register programCounter;
  private final int gprBitSize;

  /** Value of each parent register, by name. */
  private final Map<String, BigInteger> registerValues = Maps.newHashMap();
  private final Map<Long, Integer> memory = Maps.newHashMap();

  /**
   * @param registers the register table; every sub-register's parent must be
   *        in it
   * @param programCounter the name of the program counter register
   * @param gprBitSize the width of a general purpose register
   */
  public GenericCpu(List<Register> registers, String programCounter,
      int gprBitSize) {
    this.registers = ImmutableList.copyOf(registers);
    ImmutableList.Builder<Register> parentsBuilder = ImmutableList.builder();
    for (Register register : registers) {
      registersByName.put(register.getName(), register);
      if (register.isParent()) {
        parentsBuilder.add(register);
      }
    }
    for (Register register : registers) {
      Preconditions.checkArgument(
          registersByName.containsKey(register.getParentName()),
          "Unknown parent of %s", register);
    }
    this.parents = parentsBuilder.build();
    this.programCounter = getRegister(programCounter);
    this.gprBitSize = gprBitSize;
  }

  /** General purpose registers, rip and the status flags of x86-64. */
  public static GenericCpu x86_64() {
    ImmutableList.Builder<Register> table = ImmutableList.builder();
    for (String r : new String[] {"a", "b", "c", "d"}) {
      String parent = "r" + r + "x";
      table.add(Register.parent(parent, 64));
      table.add(Register.sub("e" + r + "x", parent, 31, 0));
      table.add(Register.sub(r + "x", parent, 15, 0));
      table.add(Register.sub(r + "h", parent, 15, 8));
      table.add(Register.sub(r + "l", parent, 7, 0));
    }
    for (String r : new String[] {"si", "di", "bp", "sp"}) {
      String parent = "r" + r;
      table.add(Register.parent(parent, 64));
      table.add(Register.sub("e" + r, parent, 31, 0));
      table.add(Register.sub(r, parent, 15, 0));
      table.add(Register.sub(r + "l", parent, 7, 0));
    }
    for (int i = 8; i <= 15; i++) {
      String parent = "r" + i;
      table.add(Register.parent(parent, 64));
      table.add(Register.sub(parent + "d", parent, 31, 0));
      table.add(Register.sub(parent + "w", parent, 15, 0));
      table.add(Register.sub(parent + "b", parent, 7, 0));
    }
    table.add(Register.parent("rip", 64));
    table.add(Register.sub("eip", "rip", 31, 0));
    for (String flag : new String[] {"cf", "pf", "af", "zf", "sf", "df",
        "of"}) {
      table.add(Register.flag(flag));
    }
    return new GenericCpu(table.build(), "rip", 64);
  }

  @Override
  public ImmutableList<Register> getAllRegisters() {
    return registers;
  }

  @Override
  public ImmutableList<Register> getParentRegisters() {
    return parents;
  }

  @Override
  public Register getRegister(String name) {
    Register register = registersByName.get(name);
    if (register == null) {
      throw new NotFoundException("No register named " + name);
    }
    return register;
  }

  @Override
  public Register getParentRegister(Register register) {
    return getRegister(register.getParentName());
  }

  @Override
  public boolean isRegister(String name) {
    return registersByName.containsKey(name);
  }

  @Override
  public Register getProgramCounter() {
    return programCounter;
  }

  @Override
  public int getGprBitSize() {
    return gprBitSize;
  }

  @Override
  public BigInteger getConcreteRegisterValue(Register register) {
    Register parent = getParentRegister(register);
    BigInteger value = registerValues.get(parent.getName());
    if (value == null) {
      return BigInteger.ZERO;
    }
    return value.shiftRight(register.getLow() - parent.getLow())
        .and(BitvectorSemantics.mask(register.getBitSize()));
  }

  @Override
  public void setConcreteRegisterValue(Register register, BigInteger value) {
    Register parent = getParentRegister(register);
    int shift = register.getLow() - parent.getLow();
    BigInteger mask = BitvectorSemantics.mask(register.getBitSize());
    BigInteger old = registerValues.get(parent.getName());
    if (old == null) {
      old = BigInteger.ZERO;
    }
    BigInteger cleared = old.andNot(mask.shiftLeft(shift));
    registerValues.put(parent.getName(),
        cleared.or(value.and(mask).shiftLeft(shift)));
  }

  @Override
  public int getConcreteMemoryValue(long address) {
    Integer value = memory.get(address);
    return value == null ? 0 : value;
  }

  @Override
  public BigInteger getConcreteMemoryValue(MemoryAccess access) {
    BigInteger value = BigInteger.ZERO;
    for (int i = access.getSize() - 1; i >= 0; i--) {
      value = value.shiftLeft(8).or(BigInteger.valueOf(
          getConcreteMemoryValue(access.getAddress() + i)));
    }
    return value;
  }

  @Override
  public byte[] getConcreteMemoryAreaValue(long address, int size) {
    byte[] area = new byte[size];
    for (int i = 0; i < size; i++) {
      area[i] = (byte) getConcreteMemoryValue(address + i);
    }
    return area;
  }

  @Override
  public void setConcreteMemoryValue(long address, int value) {
    memory.put(address, value & 0xff);
  }

  @Override
  public void setConcreteMemoryValue(MemoryAccess access, BigInteger value) {
    for (int i = 0; i < access.getSize(); i++) {
      setConcreteMemoryValue(access.getAddress() + i,
          value.shiftRight(8 * i).intValue());
    }
  }

  @Override
  public void setConcreteMemoryAreaValue(long address, byte[] values) {
    for (int i = 0; i < values.length; i++) {
      setConcreteMemoryValue(address + i, values[i]);
    }
  }

  @Override
  public boolean isMemoryMapped(long address, int size) {
    for (int i = 0; i < size; i++) {
      if (!memory.containsKey(address + i)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public void unmapMemory(long address, int size) {
    for (int i = 0; i < size; i++) {
      memory.remove(address + i);
    }
  }

  @Override
  public void clear() {
    registerValues.clear();
    memory.clear();
  }
}
