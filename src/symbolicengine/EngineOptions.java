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

import com.google.common.base.Splitter;

import java.util.EnumSet;
import java.util.Properties;

/**
 * Settings applied to the engines each time an {@link AnalysisContext}
 * initialises them.
 */
public class EngineOptions {
  public static final String SYMBOLIC_ENABLED = "symbolic.enabled";
  public static final String TAINT_ENABLED = "taint.enabled";
  public static final String SOLVER_SIMPLIFICATION =
      "symbolic.solverSimplification";
  public static final String OPTIMIZATIONS = "symbolic.optimizations";

  private static final Splitter LIST_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings();

  /** Whether instruction processing builds symbolic expressions */
  public boolean symbolicEngineEnabled = true;

  /** Whether taint may be set and propagated */
  public boolean taintEngineEnabled = true;

  /** Whether new expressions also go through the solver's simplifier */
  public boolean solverSimplification = false;

  public EnumSet<SymbolicOptimization> optimizations =
      EnumSet.of(SymbolicOptimization.AST_DICTIONARIES);

  /**
   * Reads options from {@code properties}; absent keys keep their defaults.
   * {@value #OPTIMIZATIONS} is a comma separated list of
   * {@link SymbolicOptimization} names and replaces the default set.
   *
   * @throws IllegalArgumentException if an optimization name is unknown
   */
  public static EngineOptions fromProperties(Properties properties) {
    EngineOptions options = new EngineOptions();
    options.symbolicEngineEnabled = readBoolean(properties, SYMBOLIC_ENABLED,
        options.symbolicEngineEnabled);
    options.taintEngineEnabled = readBoolean(properties, TAINT_ENABLED,
        options.taintEngineEnabled);
    options.solverSimplification = readBoolean(properties,
        SOLVER_SIMPLIFICATION, options.solverSimplification);
    String optimizations = properties.getProperty(OPTIMIZATIONS);
    if (optimizations != null) {
      options.optimizations = EnumSet.noneOf(SymbolicOptimization.class);
      for (String name : LIST_SPLITTER.split(optimizations)) {
        options.optimizations.add(SymbolicOptimization.valueOf(name));
      }
    }
    return options;
  }

  private static boolean readBoolean(Properties properties, String key,
      boolean defaultValue) {
    String value = properties.getProperty(key);
    return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
  }
}
