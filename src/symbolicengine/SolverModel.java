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

import java.math.BigInteger;

/**
 * The value a solver assigned to one symbolic variable in a model.
 */
public final class SolverModel {
  private final SymbolicVariable variable;
  private final BigInteger value;

  public SolverModel(SymbolicVariable variable, BigInteger value) {
    this.variable = variable;
    this.value = value;
  }

  public long getId() {
    return variable.getId();
  }

  public SymbolicVariable getVariable() {
    return variable;
  }

  public BigInteger getValue() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SolverModel)) {
      return false;
    }
    SolverModel other = (SolverModel) obj;
    return variable.getId() == other.variable.getId()
        && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return (int) variable.getId() * 31 + value.hashCode();
  }

  @Override
  public String toString() {
    return variable.getName() + " = 0x" + value.toString(16);
  }
}
