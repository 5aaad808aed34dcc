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
import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A decoded instruction as handed over by the architecture: its address, its
 * operands and, once executed, the address control went to next. The
 * symbolic expressions built for its semantics are linked to it.
 */
public class Instruction {
  private final long address;
  private final int size;
  private final String disassembly;
  private final ImmutableList<Operand> operands;
  private final List<SymbolicExpression> symbolicExpressions =
      Lists.newArrayList();
  private long nextAddress;

  /**
   * @param address the address of the instruction
   * @param size the encoded length in bytes; the default next address is
   *        {@code address + size}
   * @param disassembly human readable form, used in comments and logs
   * @param operands the decoded operands, destination first
   */
  public Instruction(long address, int size, String disassembly,
      Operand... operands) {
    this.address = address;
    this.size = size;
    this.disassembly = disassembly;
    this.operands = ImmutableList.copyOf(Arrays.asList(operands));
    this.nextAddress = address + size;
  }

  public long getAddress() {
    return address;
  }

  public int getSize() {
    return size;
  }

  public String getDisassembly() {
    return disassembly;
  }

  public ImmutableList<Operand> getOperands() {
    return operands;
  }

  public Operand getOperand(int index) {
    return operands.get(index);
  }

  /** Where execution went after this instruction. */
  public long getNextAddress() {
    return nextAddress;
  }

  /** Set by the semantics when the instruction transfers control. */
  public void setNextAddress(long nextAddress) {
    this.nextAddress = nextAddress;
  }

  /** The expressions built for this instruction, in creation order. */
  public ImmutableList<SymbolicExpression> getSymbolicExpressions() {
    return ImmutableList.copyOf(symbolicExpressions);
  }

  void addSymbolicExpression(SymbolicExpression expression) {
    symbolicExpressions.add(expression);
  }

  void removeSymbolicExpressions(Collection<SymbolicExpression> expressions) {
    symbolicExpressions.removeAll(expressions);
  }

  @Override
  public String toString() {
    return String.format("0x%x: %s", address, disassembly);
  }
}
