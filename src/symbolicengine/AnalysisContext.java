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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The entry point of the engine. A context owns one node graph, one symbolic
 * engine, one taint engine and the callbacks, all bound to the architecture
 * given to {@link #setArchitecture}. Contexts are independent of each other;
 * none of them is thread safe.
 * <p>
 * Until an architecture is set, every operation that needs an engine throws
 * {@link EngineNotInitializedException}.
 *
 * @see EngineOptions
 */
public class AnalysisContext {
  private static final Logger logger =
      Logger.getLogger(AnalysisContext.class.getName());

  private final EngineOptions options;
  private final Callbacks callbacks = new Callbacks();

  private CpuInterface cpu;
  private AstGarbageCollector collector;
  private AstContext astContext;
  private SymbolicEngine symbolicEngine;
  private TaintEngine taintEngine;
  private SolverEngine solverEngine;
  private boolean defaultSolver;
  private SemanticsBuilder semanticsBuilder;

  /** The single backup slot, or null. */
  private Backup backup;

  public AnalysisContext() {
    this(new EngineOptions());
  }

  public AnalysisContext(EngineOptions options) {
    this.options = options;
  }

  public EngineOptions getOptions() {
    return options;
  }

  /* Architecture ------------------------------------------------------- */

  /**
   * Binds the context to {@code cpu} and creates fresh engines. Any previous
   * symbolic, taint and node state is discarded.
   */
  public void setArchitecture(CpuInterface cpu) {
    Preconditions.checkNotNull(cpu);
    if (this.cpu != null) {
      removeEngines();
    }
    this.cpu = cpu;
    initEngines();
  }

  public boolean isArchitectureValid() {
    return cpu != null;
  }

  public void checkArchitecture() {
    if (cpu == null) {
      throw new EngineNotInitializedException(
          "No architecture set; call setArchitecture first");
    }
  }

  public CpuInterface getCpu() {
    checkArchitecture();
    return cpu;
  }

  /** Resets the concrete state of the architecture. */
  public void clearArchitecture() {
    checkArchitecture();
    cpu.clear();
  }

  public Register getRegister(String name) {
    checkArchitecture();
    return cpu.getRegister(name);
  }

  public Register getParentRegister(Register register) {
    checkArchitecture();
    return cpu.getParentRegister(register);
  }

  public ImmutableList<Register> getAllRegisters() {
    checkArchitecture();
    return cpu.getAllRegisters();
  }

  public ImmutableList<Register> getParentRegisters() {
    checkArchitecture();
    return cpu.getParentRegisters();
  }

  /* Engine lifecycle --------------------------------------------------- */

  private void initEngines() {
    collector = new AstGarbageCollector(
        options.optimizations.contains(SymbolicOptimization.AST_DICTIONARIES));
    astContext = new AstContext(collector);
    symbolicEngine = new SymbolicEngine(this, cpu, astContext);
    symbolicEngine.enable(options.symbolicEngineEnabled);
    symbolicEngine.enableSolverSimplification(options.solverSimplification);
    for (SymbolicOptimization optimization : options.optimizations) {
      symbolicEngine.enableOptimization(optimization, true);
    }
    taintEngine = new TaintEngine(cpu);
    taintEngine.enable(options.taintEngineEnabled);
    if (defaultSolver) {
      solverEngine = null;
      defaultSolver = false;
    }
    logger.log(Level.FINE, "Engines initialised for {0} registers",
        cpu.getAllRegisters().size());
  }

  /** Drops every engine and frees all nodes; the architecture stays set. */
  public void removeEngines() {
    checkArchitecture();
    collector.freeAllAstNodes();
    collector = null;
    astContext = null;
    symbolicEngine = null;
    taintEngine = null;
    backup = null;
    if (defaultSolver) {
      solverEngine = null;
      defaultSolver = false;
    }
    logger.log(Level.FINE, "Engines removed");
  }

  /** Replaces every engine by a fresh one. */
  public void resetEngines() {
    checkArchitecture();
    removeEngines();
    initEngines();
  }

  public void checkAstGarbageCollector() {
    if (collector == null) {
      throw new EngineNotInitializedException(
          "The node collector is not initialised");
    }
  }

  public void checkSymbolic() {
    if (symbolicEngine == null) {
      throw new EngineNotInitializedException(
          "The symbolic engine is not initialised");
    }
  }

  public void checkTaint() {
    if (taintEngine == null) {
      throw new EngineNotInitializedException(
          "The taint engine is not initialised");
    }
  }

  public AstContext getAstContext() {
    checkAstGarbageCollector();
    return astContext;
  }

  public AstGarbageCollector getAstGarbageCollector() {
    checkAstGarbageCollector();
    return collector;
  }

  public SymbolicEngine getSymbolicEngine() {
    checkSymbolic();
    return symbolicEngine;
  }

  public TaintEngine getTaintEngine() {
    checkTaint();
    return taintEngine;
  }

  /* Concrete state ----------------------------------------------------- */

  public BigInteger getConcreteRegisterValue(Register register) {
    return getConcreteRegisterValue(register, true);
  }

  /**
   * Reads a register from the concrete store, first giving every register
   * read callback the chance to update it if {@code execCallbacks} is set.
   */
  public BigInteger getConcreteRegisterValue(Register register,
      boolean execCallbacks) {
    checkArchitecture();
    if (execCallbacks) {
      callbacks.processCallbacks(this, register);
    }
    return cpu.getConcreteRegisterValue(register);
  }

  public int getConcreteMemoryValue(long address) {
    return getConcreteMemoryValue(address, true);
  }

  public int getConcreteMemoryValue(long address, boolean execCallbacks) {
    checkArchitecture();
    if (execCallbacks) {
      callbacks.processCallbacks(this, new MemoryAccess(address, 1));
    }
    return cpu.getConcreteMemoryValue(address);
  }

  public BigInteger getConcreteMemoryValue(MemoryAccess memory) {
    return getConcreteMemoryValue(memory, true);
  }

  public BigInteger getConcreteMemoryValue(MemoryAccess memory,
      boolean execCallbacks) {
    checkArchitecture();
    if (execCallbacks) {
      callbacks.processCallbacks(this, memory);
    }
    return cpu.getConcreteMemoryValue(memory);
  }

  /** Reads an area byte by byte; callbacks see one access per byte. */
  public byte[] getConcreteMemoryAreaValue(long address, int size,
      boolean execCallbacks) {
    checkArchitecture();
    if (execCallbacks) {
      for (int i = 0; i < size; i++) {
        callbacks.processCallbacks(this, new MemoryAccess(address + i, 1));
      }
    }
    return cpu.getConcreteMemoryAreaValue(address, size);
  }

  public byte[] getConcreteMemoryAreaValue(long address, int size) {
    return getConcreteMemoryAreaValue(address, size, true);
  }

  public void setConcreteRegisterValue(Register register, BigInteger value) {
    checkArchitecture();
    cpu.setConcreteRegisterValue(register, value);
  }

  public void setConcreteMemoryValue(long address, int value) {
    checkArchitecture();
    cpu.setConcreteMemoryValue(address, value);
  }

  public void setConcreteMemoryValue(MemoryAccess memory, BigInteger value) {
    checkArchitecture();
    cpu.setConcreteMemoryValue(memory, value);
  }

  public void setConcreteMemoryAreaValue(long address, byte[] values) {
    checkArchitecture();
    cpu.setConcreteMemoryAreaValue(address, values);
  }

  public boolean isMemoryMapped(long address, int size) {
    checkArchitecture();
    return cpu.isMemoryMapped(address, size);
  }

  public void unmapMemory(long address, int size) {
    checkArchitecture();
    cpu.unmapMemory(address, size);
  }

  /** Sets the value a variable takes when formulas are evaluated. */
  public void setConcreteVariableValue(SymbolicVariable variable,
      BigInteger value) {
    getAstContext().setVariableValue(variable, value);
  }

  public BigInteger getConcreteVariableValue(SymbolicVariable variable) {
    return getAstContext().getVariableValue(variable);
  }

  /* Callbacks ---------------------------------------------------------- */

  public CallbackHandle addCallback(GetConcreteMemoryValueCallback callback) {
    return callbacks.addCallback(callback);
  }

  public CallbackHandle addCallback(
      GetConcreteRegisterValueCallback callback) {
    return callbacks.addCallback(callback);
  }

  public CallbackHandle addCallback(SymbolicSimplificationCallback callback) {
    return callbacks.addCallback(callback);
  }

  public boolean removeCallback(CallbackHandle handle) {
    return callbacks.removeCallback(handle);
  }

  public void removeAllCallbacks() {
    callbacks.removeAllCallbacks();
  }

  public Callbacks getCallbacks() {
    return callbacks;
  }

  AstNode processSimplificationCallbacks(AstNode node) {
    return callbacks.processCallbacks(this, node);
  }

  /* Instruction processing --------------------------------------------- */

  public void setSemanticsBuilder(SemanticsBuilder semanticsBuilder) {
    this.semanticsBuilder = semanticsBuilder;
  }

  /**
   * Builds the semantics of {@code instruction} and then filters the
   * expressions it produced: all of them while the symbolic engine is
   * disabled, the unsymbolized ones under
   * {@link SymbolicOptimization#ONLY_ON_SYMBOLIZED} and the untainted ones
   * under {@link SymbolicOptimization#ONLY_ON_TAINTED}. A filtered
   * expression is removed and the locations it defined become concrete.
   *
   * @return whether the semantics builder handled the instruction
   */
  public boolean processing(Instruction instruction) {
    checkArchitecture();
    if (semanticsBuilder == null) {
      throw new EngineNotInitializedException("No semantics builder set");
    }
    boolean handled = semanticsBuilder.buildSemantics(instruction, this);
    postProcessing(instruction);
    logger.log(Level.FINER, "Processed {0}", instruction);
    return handled;
  }

  private void postProcessing(Instruction instruction) {
    boolean all = !symbolicEngine.isEnabled();
    boolean onlySymbolized = symbolicEngine.isOptimizationEnabled(
        SymbolicOptimization.ONLY_ON_SYMBOLIZED);
    boolean onlyTainted = symbolicEngine.isOptimizationEnabled(
        SymbolicOptimization.ONLY_ON_TAINTED);
    List<SymbolicExpression> dropped = Lists.newArrayList();
    for (SymbolicExpression expression :
        instruction.getSymbolicExpressions()) {
      if (all
          || (onlySymbolized && !expression.getAst().isSymbolized())
          || (onlyTainted && !isExpressionTainted(expression))) {
        dropped.add(expression);
        if (symbolicEngine.isSymbolicExpressionIdExists(expression.getId())) {
          symbolicEngine.removeSymbolicExpression(expression.getId());
        }
      }
    }
    instruction.removeSymbolicExpressions(dropped);
  }

  /**
   * An expression counts as tainted if it was marked so, or if the location
   * it defines is tainted.
   */
  private boolean isExpressionTainted(SymbolicExpression expression) {
    if (symbolicEngine.isTainted(expression)) {
      return true;
    }
    if (expression.getOriginRegister() != null) {
      return taintEngine.isRegisterTainted(expression.getOriginRegister());
    }
    if (expression.getOriginMemory() != null) {
      return taintEngine.isMemoryTainted(expression.getOriginMemory());
    }
    return false;
  }

  /* Backup ------------------------------------------------------------- */

  /**
   * Saves the symbolic state, the taint state and the variable name index
   * into the backup slot, replacing whatever it held.
   */
  public void backup() {
    checkSymbolic();
    checkTaint();
    backup = new Backup(symbolicEngine.snapshot(), taintEngine.snapshot(),
        collector.getAstVariableNodes());
    logger.log(Level.FINE, "Backup taken");
  }

  /**
   * Replaces the live state by the backup. The slot keeps its content, so a
   * backup can be restored more than once.
   *
   * @throws IllegalStateException if no backup was taken
   */
  public void restore() {
    checkSymbolic();
    checkTaint();
    Preconditions.checkState(backup != null, "No backup to restore");
    symbolicEngine.restore(backup.symbolic);
    taintEngine.restore(backup.taint);
    collector.setAstVariableNodes(backup.variableNodes);
  }

  private static final class Backup {
    final SymbolicEngineSnapshot symbolic;
    final TaintEngine.Snapshot taint;
    final ImmutableMap<String, AstNode> variableNodes;

    Backup(SymbolicEngineSnapshot symbolic, TaintEngine.Snapshot taint,
        ImmutableMap<String, AstNode> variableNodes) {
      this.symbolic = symbolic;
      this.taint = taint;
      this.variableNodes = variableNodes;
    }
  }

  /* Node graph --------------------------------------------------------- */

  public AstNode browseAstDictionaries(AstNode node) {
    return getAstGarbageCollector().browseAstDictionaries(node);
  }

  public ImmutableMap<String, Long> getAstDictionariesStats() {
    return getAstGarbageCollector().getAstDictionariesStats();
  }

  public Set<AstNode> extractUniqueAstNodes(AstNode root) {
    return getAstGarbageCollector().extractUniqueAstNodes(root);
  }

  public void freeAstNodes(Collection<AstNode> nodes) {
    getAstGarbageCollector().freeAstNodes(nodes);
  }

  public void freeAllAstNodes() {
    getAstGarbageCollector().freeAllAstNodes();
  }

  public Set<AstNode> getAllocatedAstNodes() {
    return getAstGarbageCollector().getAllocatedAstNodes();
  }

  public void recordVariableAstNode(String name, AstNode node) {
    getAstGarbageCollector().recordVariableAstNode(name, node);
  }

  public ImmutableMap<String, AstNode> getAstVariableNodes() {
    return getAstGarbageCollector().getAstVariableNodes();
  }

  public AstNode getAstVariableNode(String name) {
    return getAstGarbageCollector().getAstVariableNode(name);
  }

  /* Symbolic engine ---------------------------------------------------- */

  public boolean isSymbolicEngineEnabled() {
    return getSymbolicEngine().isEnabled();
  }

  public void enableSymbolicEngine(boolean flag) {
    getSymbolicEngine().enable(flag);
  }

  public boolean isSymbolicOptimizationEnabled(
      SymbolicOptimization optimization) {
    return getSymbolicEngine().isOptimizationEnabled(optimization);
  }

  public void enableSymbolicOptimization(SymbolicOptimization optimization,
      boolean flag) {
    getSymbolicEngine().enableOptimization(optimization, flag);
  }

  public boolean isSolverSimplificationEnabled() {
    return getSymbolicEngine().isSolverSimplificationEnabled();
  }

  public void enableSolverSimplification(boolean flag) {
    getSymbolicEngine().enableSolverSimplification(flag);
  }

  public SymbolicExpression newSymbolicExpression(AstNode node,
      String comment) {
    return getSymbolicEngine().newSymbolicExpression(node, comment);
  }

  public SymbolicVariable newSymbolicVariable(int bitSize, String comment) {
    return getSymbolicEngine().newSymbolicVariable(bitSize, comment);
  }

  public void removeSymbolicExpression(long id) {
    getSymbolicEngine().removeSymbolicExpression(id);
  }

  public SymbolicExpression getSymbolicExpressionFromId(long id) {
    return getSymbolicEngine().getSymbolicExpressionFromId(id);
  }

  public SymbolicVariable getSymbolicVariableFromId(long id) {
    return getSymbolicEngine().getSymbolicVariableFromId(id);
  }

  public SymbolicVariable getSymbolicVariableFromName(String name) {
    return getSymbolicEngine().getSymbolicVariableFromName(name);
  }

  public ImmutableSortedMap<Long, SymbolicExpression> getSymbolicExpressions() {
    return getSymbolicEngine().getSymbolicExpressions();
  }

  public ImmutableSortedMap<Long, SymbolicVariable> getSymbolicVariables() {
    return getSymbolicEngine().getSymbolicVariables();
  }

  public String getVariablesDeclaration() {
    return getSymbolicEngine().getVariablesDeclaration();
  }

  public SymbolicVariable convertExpressionToSymbolicVariable(long id,
      String comment) {
    return getSymbolicEngine().convertExpressionToSymbolicVariable(id,
        comment);
  }

  public SymbolicVariable convertMemoryToSymbolicVariable(MemoryAccess memory,
      String comment) {
    return getSymbolicEngine().convertMemoryToSymbolicVariable(memory,
        comment);
  }

  public SymbolicVariable convertRegisterToSymbolicVariable(
      Register register, String comment) {
    return getSymbolicEngine().convertRegisterToSymbolicVariable(register,
        comment);
  }

  public SymbolicExpression assignSymbolicExpressionToRegister(
      SymbolicExpression expression, Register register) {
    return getSymbolicEngine().assignSymbolicExpressionToRegister(expression,
        register);
  }

  public void assignSymbolicExpressionToMemory(SymbolicExpression expression,
      MemoryAccess memory) {
    getSymbolicEngine().assignSymbolicExpressionToMemory(expression, memory);
  }

  public SymbolicExpression getSymbolicRegister(Register register) {
    return getSymbolicEngine().getSymbolicRegister(register);
  }

  public SymbolicExpression getSymbolicMemory(long address) {
    return getSymbolicEngine().getSymbolicMemory(address);
  }

  public ImmutableMap<Register, SymbolicExpression> getSymbolicRegisters() {
    return getSymbolicEngine().getSymbolicRegisters();
  }

  public ImmutableMap<Long, SymbolicExpression> getSymbolicMemory() {
    return getSymbolicEngine().getSymbolicMemory();
  }

  public AstNode getRegisterAst(Register register) {
    return getSymbolicEngine().getRegisterAst(register);
  }

  public AstNode getMemoryAst(MemoryAccess memory) {
    return getSymbolicEngine().getMemoryAst(memory);
  }

  public AstNode getImmediateAst(Immediate immediate) {
    return getSymbolicEngine().getImmediateAst(immediate);
  }

  public AstNode getOperandAst(Operand operand) {
    return getSymbolicEngine().getOperandAst(operand);
  }

  public BigInteger getSymbolicRegisterValue(Register register) {
    return getSymbolicEngine().getSymbolicRegisterValue(register);
  }

  public BigInteger getSymbolicMemoryValue(MemoryAccess memory) {
    return getSymbolicEngine().getSymbolicMemoryValue(memory);
  }

  public int getSymbolicMemoryValue(long address) {
    return getSymbolicEngine().getSymbolicMemoryValue(address);
  }

  public SymbolicExpression createSymbolicExpression(Instruction instruction,
      AstNode node, Operand destination, String comment) {
    return getSymbolicEngine().createSymbolicExpression(instruction, node,
        destination, comment);
  }

  public SymbolicExpression createSymbolicRegisterExpression(
      Instruction instruction, AstNode node, Register register,
      String comment) {
    return getSymbolicEngine().createSymbolicRegisterExpression(instruction,
        node, register, comment);
  }

  public SymbolicExpression createSymbolicMemoryExpression(
      Instruction instruction, AstNode node, MemoryAccess memory,
      String comment) {
    return getSymbolicEngine().createSymbolicMemoryExpression(instruction,
        node, memory, comment);
  }

  public SymbolicExpression createSymbolicFlagExpression(
      Instruction instruction, AstNode node, Register flag, String comment) {
    return getSymbolicEngine().createSymbolicFlagExpression(instruction, node,
        flag, comment);
  }

  public SymbolicExpression createSymbolicVolatileExpression(
      Instruction instruction, AstNode node, String comment) {
    return getSymbolicEngine().createSymbolicVolatileExpression(instruction,
        node, comment);
  }

  public void concretizeRegister(Register register) {
    getSymbolicEngine().concretizeRegister(register);
  }

  public void concretizeMemory(long address) {
    getSymbolicEngine().concretizeMemory(address);
  }

  public void concretizeMemory(MemoryAccess memory) {
    getSymbolicEngine().concretizeMemory(memory);
  }

  public void concretizeAllRegister() {
    getSymbolicEngine().concretizeAllRegister();
  }

  public void concretizeAllMemory() {
    getSymbolicEngine().concretizeAllMemory();
  }

  public AstNode getAstFromId(long id) {
    return getSymbolicEngine().getAstFromId(id);
  }

  public AstNode getFullAst(AstNode node) {
    return getSymbolicEngine().getFullAst(node);
  }

  public AstNode getFullAstFromId(long id) {
    return getSymbolicEngine().getFullAstFromId(id);
  }

  public AstNode processSimplification(AstNode node,
      boolean useSolverSimplification) {
    return getSymbolicEngine().processSimplification(node,
        useSolverSimplification);
  }

  /** Marks an expression as carrying tainted data, or clears the mark. */
  public void setTaint(SymbolicExpression expression, boolean flag) {
    getSymbolicEngine().setTaint(expression, flag);
  }

  public ImmutableList<SymbolicExpression> getTaintedSymbolicExpressions() {
    return getSymbolicEngine().getTaintedSymbolicExpressions();
  }

  /* Path constraints --------------------------------------------------- */

  public void addPathConstraint(Instruction instruction,
      SymbolicExpression pcExpression) {
    getSymbolicEngine().addPathConstraint(instruction, pcExpression);
  }

  public ImmutableList<PathConstraint> getPathConstraints() {
    return getSymbolicEngine().getPathConstraints();
  }

  public AstNode getPathConstraintsAst() {
    return getSymbolicEngine().getPathConstraintsAst();
  }

  public void clearPathConstraints() {
    getSymbolicEngine().clearPathConstraints();
  }

  /* Solver ------------------------------------------------------------- */

  /** Uses {@code solverEngine} for every later solver query. */
  public void setSolverEngine(SolverEngine solverEngine) {
    this.solverEngine = Preconditions.checkNotNull(solverEngine);
    this.defaultSolver = false;
  }

  /**
   * The solver in use. Unless one was set, a {@link Z3SolverEngine} is
   * created on first use.
   */
  public SolverEngine getSolverEngine() {
    if (solverEngine == null) {
      solverEngine = new Z3SolverEngine(getAstContext());
      defaultSolver = true;
    }
    return solverEngine;
  }

  public ImmutableMap<Long, SolverModel> getModel(AstNode constraint) {
    checkSymbolic();
    return getSolverEngine().getModel(constraint);
  }

  public ImmutableList<ImmutableMap<Long, SolverModel>> getModels(
      AstNode constraint, int limit) {
    checkSymbolic();
    return getSolverEngine().getModels(constraint, limit);
  }

  public BigInteger evaluateAstViaSolver(AstNode node) {
    checkSymbolic();
    return getSolverEngine().evaluate(node);
  }

  /* Taint engine ------------------------------------------------------- */

  public boolean isTaintEngineEnabled() {
    return getTaintEngine().isEnabled();
  }

  public void enableTaintEngine(boolean flag) {
    getTaintEngine().enable(flag);
  }

  public boolean isTainted(Operand operand) {
    return getTaintEngine().isTainted(operand);
  }

  public boolean isRegisterTainted(Register register) {
    return getTaintEngine().isRegisterTainted(register);
  }

  public boolean isMemoryTainted(long address) {
    return getTaintEngine().isMemoryTainted(address);
  }

  public boolean isMemoryTainted(MemoryAccess memory) {
    return getTaintEngine().isMemoryTainted(memory);
  }

  public boolean setTaintRegister(Register register, boolean flag) {
    return getTaintEngine().setTaintRegister(register, flag);
  }

  public boolean setTaintMemory(MemoryAccess memory, boolean flag) {
    return getTaintEngine().setTaintMemory(memory, flag);
  }

  public boolean taintRegister(Register register) {
    return getTaintEngine().taintRegister(register);
  }

  public boolean untaintRegister(Register register) {
    return getTaintEngine().untaintRegister(register);
  }

  public boolean taintMemory(long address) {
    return getTaintEngine().taintMemory(address);
  }

  public boolean taintMemory(MemoryAccess memory) {
    return getTaintEngine().taintMemory(memory);
  }

  public boolean untaintMemory(long address) {
    return getTaintEngine().untaintMemory(address);
  }

  public boolean untaintMemory(MemoryAccess memory) {
    return getTaintEngine().untaintMemory(memory);
  }

  public boolean taintUnion(Operand dst, Operand src) {
    return getTaintEngine().taintUnion(dst, src);
  }

  public boolean taintAssignment(Operand dst, Operand src) {
    return getTaintEngine().taintAssignment(dst, src);
  }
}
