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

import java.math.BigInteger;

/**
 * A decision procedure over the engine's formulas. Implementations expand
 * references themselves, so callers may pass nodes straight from the
 * registry.
 */
public interface SolverEngine {
  /**
   * A model of {@code constraint}, keyed by variable id, or an empty map if
   * the constraint is unsatisfiable.
   *
   * @throws IllegalArgumentException if {@code constraint} is not logical
   */
  ImmutableMap<Long, SolverModel> getModel(AstNode constraint);

  /**
   * Up to {@code limit} pairwise distinct models of {@code constraint}.
   */
  ImmutableList<ImmutableMap<Long, SolverModel>> getModels(AstNode constraint,
      int limit);

  /**
   * The value of {@code node} with every variable replaced by its current
   * concrete value. Logical nodes evaluate to 0 or 1.
   */
  BigInteger evaluate(AstNode node);

  /** An equivalent, usually smaller, formula. */
  AstNode simplify(AstNode node);
}
