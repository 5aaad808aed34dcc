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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Sets;

import java.util.Map;
import java.util.Set;

/**
 * The complete state of a {@link SymbolicEngine} at one point in time. All
 * fields are immutable. Expressions are shared with the live engine, so
 * reference nodes keep pointing at the restored instances; their origins,
 * the only part of an expression that changes after registration, are
 * captured separately.
 */
final class SymbolicEngineSnapshot {
  final ImmutableMap<Register, Long> registers;
  final ImmutableMap<Long, Long> memory;
  final ImmutableSortedMap<Long, SymbolicExpression> expressions;
  /** Detached copies holding the origins at snapshot time. */
  final ImmutableSortedMap<Long, SymbolicExpression> origins;
  final ImmutableSortedMap<Long, SymbolicVariable> variables;
  final ImmutableSet<Long> taintedExpressions;
  final ImmutableList<PathConstraint> pathConstraints;
  final boolean enabled;
  final boolean solverSimplification;
  final ImmutableSet<SymbolicOptimization> optimizations;
  final long nextExpressionId;
  final long nextVariableId;

  SymbolicEngineSnapshot(Map<Register, Long> registers, Map<Long, Long> memory,
      Map<Long, SymbolicExpression> expressions,
      Map<Long, SymbolicVariable> variables, Set<Long> taintedExpressions,
      ImmutableList<PathConstraint> pathConstraints, boolean enabled,
      boolean solverSimplification, Set<SymbolicOptimization> optimizations,
      long nextExpressionId, long nextVariableId) {
    this.registers = ImmutableMap.copyOf(registers);
    this.memory = ImmutableMap.copyOf(memory);
    this.expressions = ImmutableSortedMap.copyOf(expressions);
    ImmutableSortedMap.Builder<Long, SymbolicExpression> copies =
        ImmutableSortedMap.naturalOrder();
    for (Map.Entry<Long, SymbolicExpression> entry : expressions.entrySet()) {
      copies.put(entry.getKey(), entry.getValue().copy());
    }
    this.origins = copies.build();
    this.variables = ImmutableSortedMap.copyOf(variables);
    this.taintedExpressions = ImmutableSet.copyOf(taintedExpressions);
    this.pathConstraints = pathConstraints;
    this.enabled = enabled;
    this.solverSimplification = solverSimplification;
    this.optimizations = Sets.immutableEnumSet(optimizations);
    this.nextExpressionId = nextExpressionId;
    this.nextVariableId = nextVariableId;
  }
}
