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

import junit.framework.TestCase;

import java.util.EnumSet;
import java.util.Properties;

public class EngineOptionsTest extends TestCase {

  public void testDefaults() {
    EngineOptions options = EngineOptions.fromProperties(new Properties());
    assertTrue(options.symbolicEngineEnabled);
    assertTrue(options.taintEngineEnabled);
    assertFalse(options.solverSimplification);
    assertEquals(EnumSet.of(SymbolicOptimization.AST_DICTIONARIES),
        options.optimizations);
  }

  public void testReadsEveryKey() {
    Properties properties = new Properties();
    properties.setProperty("symbolic.enabled", "false");
    properties.setProperty("taint.enabled", "false");
    properties.setProperty("symbolic.solverSimplification", "true");
    properties.setProperty("symbolic.optimizations",
        " ONLY_ON_TAINTED, ONLY_ON_SYMBOLIZED ,");
    EngineOptions options = EngineOptions.fromProperties(properties);
    assertFalse(options.symbolicEngineEnabled);
    assertFalse(options.taintEngineEnabled);
    assertTrue(options.solverSimplification);
    assertEquals(EnumSet.of(SymbolicOptimization.ONLY_ON_TAINTED,
        SymbolicOptimization.ONLY_ON_SYMBOLIZED), options.optimizations);
  }

  public void testUnknownOptimizationIsRejected() {
    Properties properties = new Properties();
    properties.setProperty("symbolic.optimizations", "AST_DICTIONARIES,FAST");
    try {
      EngineOptions.fromProperties(properties);
      fail("Should have thrown IllegalArgumentException");
    } catch (IllegalArgumentException expected) {
    }
  }

  public void testOptionsApplyToNewEngines() {
    EngineOptions options = new EngineOptions();
    options.taintEngineEnabled = false;
    options.optimizations = EnumSet.of(SymbolicOptimization.ONLY_ON_TAINTED);
    AnalysisContext context = new AnalysisContext(options);
    context.setArchitecture(GenericCpu.x86_64());
    assertFalse(context.isTaintEngineEnabled());
    assertTrue(context.isSymbolicEngineEnabled());
    assertTrue(context.isSymbolicOptimizationEnabled(
        SymbolicOptimization.ONLY_ON_TAINTED));
    assertFalse(context.isSymbolicOptimizationEnabled(
        SymbolicOptimization.AST_DICTIONARIES));
    assertFalse(context.getAstGarbageCollector().isDictionariesEnabled());
  }
}
