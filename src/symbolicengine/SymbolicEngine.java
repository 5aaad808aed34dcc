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
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.math.BigInteger;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The symbolic state of the program: which expression currently defines each
 * register and memory byte, the registries of expressions and variables, and
 * the path condition.
 * <p>
 * Registers are tracked at the granularity of parent registers and memory at
 * the granularity of bytes. A location with no entry is concrete: reading it
 * yields a constant built from the concrete store. Symbolic and concrete
 * state are updated independently; nothing here writes concrete values.
 * <p>
 * Expression and variable ids are handed out in increasing order, without
 * gaps. {@link #restore} rewinds the counters along with the registries.
 */
public class SymbolicEngine {
  private static final Logger logger =
      Logger.getLogger(SymbolicEngine.class.getName());

  private final AnalysisContext context;
  private final CpuInterface cpu;
  private final AstContext astContext;
  private PathManager pathManager;

  /** Parent register to the id of its defining expression. */
  private Map<Register, Long> symbolicRegisters = Maps.newHashMap();
  /** Byte address to the id of its defining expression. */
  private Map<Long, Long> symbolicMemory = Maps.newHashMap();
  private Map<Long, SymbolicExpression> expressions = Maps.newTreeMap();
  private Map<Long, SymbolicVariable> variables = Maps.newTreeMap();
  private Set<Long> taintedExpressions = Sets.newHashSet();

  private long nextExpressionId;
  private long nextVariableId;

  private boolean enabled = true;
  private boolean solverSimplification;
  private final EnumSet<SymbolicOptimization> optimizations =
      EnumSet.noneOf(SymbolicOptimization.class);

  SymbolicEngine(AnalysisContext context, CpuInterface cpu,
      AstContext astContext) {
    this.context = context;
    this.cpu = cpu;
    this.astContext = astContext;
    this.pathManager = new PathManager(astContext);
  }

  public AstContext getAstContext() {
    return astContext;
  }

  /* Registries --------------------------------------------------------- */

  /**
   * Registers a new expression under the next id. The node first goes
   * through {@link #processSimplification}, so the registered root may differ
   * from {@code node}.
   */
  public SymbolicExpression newSymbolicExpression(AstNode node,
      ExpressionKind kind, String comment) {
    return register(node, kind, comment, null, null);
  }

  /** Registers a new {@link ExpressionKind#VOLATILE} expression. */
  public SymbolicExpression newSymbolicExpression(AstNode node,
      String comment) {
    return newSymbolicExpression(node, ExpressionKind.VOLATILE, comment);
  }

  private SymbolicExpression register(AstNode node, ExpressionKind kind,
      String comment, Register originRegister, MemoryAccess originMemory) {
    long id = nextExpressionId++;
    AstNode simplified = processSimplification(node, solverSimplification);
    SymbolicExpression expression = new SymbolicExpression(id, simplified,
        kind, comment, originRegister, originMemory);
    expressions.put(id, expression);
    logger.log(Level.FINER, "New expression {0}", expression);
    return expression;
  }

  /**
   * Creates a free variable of {@code bitSize} bits under the next variable
   * id and indexes its leaf by name.
   */
  public SymbolicVariable newSymbolicVariable(int bitSize, String comment) {
    SymbolicVariable variable =
        SymbolicVariable.create(nextVariableId, bitSize, comment);
    nextVariableId++;
    variables.put(variable.getId(), variable);
    // A restore may hand out an id again; the value must not carry over.
    astContext.setVariableValue(variable, BigInteger.ZERO);
    astContext.getCollector().recordVariableAstNode(variable.getName(),
        astContext.variable(variable));
    return variable;
  }

  /**
   * Unregisters an expression and makes every location it defines concrete.
   * Nodes referring to the expression are left as they are.
   *
   * @throws NotFoundException if no expression has that id
   */
  public void removeSymbolicExpression(long id) {
    if (expressions.remove(id) == null) {
      throw new NotFoundException("No symbolic expression with id " + id);
    }
    taintedExpressions.remove(id);
    unbind(id);
  }

  private void unbind(long id) {
    Iterator<Long> registerIds = symbolicRegisters.values().iterator();
    while (registerIds.hasNext()) {
      if (registerIds.next() == id) {
        registerIds.remove();
      }
    }
    Iterator<Long> memoryIds = symbolicMemory.values().iterator();
    while (memoryIds.hasNext()) {
      if (memoryIds.next() == id) {
        memoryIds.remove();
      }
    }
  }

  /** @throws NotFoundException if no expression has that id */
  public SymbolicExpression getSymbolicExpressionFromId(long id) {
    SymbolicExpression expression = expressions.get(id);
    if (expression == null) {
      throw new NotFoundException("No symbolic expression with id " + id);
    }
    return expression;
  }

  public boolean isSymbolicExpressionIdExists(long id) {
    return expressions.containsKey(id);
  }

  /** @throws NotFoundException if no variable has that id */
  public SymbolicVariable getSymbolicVariableFromId(long id) {
    SymbolicVariable variable = variables.get(id);
    if (variable == null) {
      throw new NotFoundException("No symbolic variable with id " + id);
    }
    return variable;
  }

  /** @throws NotFoundException if no variable has that name */
  public SymbolicVariable getSymbolicVariableFromName(String name) {
    SymbolicVariable variable =
        astContext.getCollector().getAstVariableNode(name).getVariable();
    if (variables.get(variable.getId()) != variable) {
      throw new NotFoundException("No symbolic variable named " + name);
    }
    return variable;
  }

  public ImmutableSortedMap<Long, SymbolicExpression> getSymbolicExpressions() {
    return ImmutableSortedMap.copyOf(expressions);
  }

  public ImmutableSortedMap<Long, SymbolicVariable> getSymbolicVariables() {
    return ImmutableSortedMap.copyOf(variables);
  }

  /** One SMT-LIB2 {@code declare-fun} per variable, by increasing id. */
  public String getVariablesDeclaration() {
    return SmtRepresentation.variablesDeclaration(variables.values());
  }

  /** Marks an expression as carrying tainted data, or clears the mark. */
  public void setTaint(SymbolicExpression expression, boolean flag) {
    if (flag) {
      taintedExpressions.add(expression.getId());
    } else {
      taintedExpressions.remove(expression.getId());
    }
  }

  public boolean isTainted(SymbolicExpression expression) {
    return taintedExpressions.contains(expression.getId());
  }

  /** The registered expressions marked as tainted, by increasing id. */
  public ImmutableList<SymbolicExpression> getTaintedSymbolicExpressions() {
    ImmutableList.Builder<SymbolicExpression> tainted =
        ImmutableList.builder();
    for (SymbolicExpression expression : expressions.values()) {
      if (taintedExpressions.contains(expression.getId())) {
        tainted.add(expression);
      }
    }
    return tainted.build();
  }

  /* Locations ---------------------------------------------------------- */

  /**
   * Makes {@code expression} the definition of {@code register}. The
   * expression keeps its id and its root node. For a sub-register, the
   * parent becomes defined by a new expression splicing a reference to
   * {@code expression} into the parent's current value; that expression is
   * returned. Otherwise {@code expression} itself is returned.
   */
  public SymbolicExpression assignSymbolicExpressionToRegister(
      SymbolicExpression expression, Register register) {
    SymbolicExpression registered =
        getSymbolicExpressionFromId(expression.getId());
    Preconditions.checkArgument(
        registered.getAst().getBitvectorSize() == register.getBitSize(),
        "Expression size %s does not match %s",
        registered.getAst().getBitvectorSize(), register);
    registered.setOriginRegister(register);
    Register parent = cpu.getParentRegister(register);
    SymbolicExpression definition = registered;
    if (!register.equals(parent)) {
      definition = register(insertSubRegister(parent, register,
          astContext.reference(registered)), ExpressionKind.REGISTER,
          "insert " + register.getName(), parent, null);
    }
    symbolicRegisters.put(parent, definition.getId());
    return definition;
  }

  /**
   * Makes {@code expression} the definition of the bytes of {@code memory}.
   * A multi-byte expression is split into one byte expression per address.
   */
  public void assignSymbolicExpressionToMemory(SymbolicExpression expression,
      MemoryAccess memory) {
    SymbolicExpression registered =
        getSymbolicExpressionFromId(expression.getId());
    assignMemoryBytes(registered, memory);
    registered.setOriginMemory(memory);
  }

  private List<SymbolicExpression> assignMemoryBytes(
      SymbolicExpression expression, MemoryAccess memory) {
    Preconditions.checkArgument(
        expression.getAst().getBitvectorSize() == memory.getBitSize(),
        "Expression size %s does not match %s",
        expression.getAst().getBitvectorSize(), memory);
    List<SymbolicExpression> bytes = Lists.newArrayList();
    if (memory.getSize() == 1) {
      symbolicMemory.put(memory.getAddress(), expression.getId());
      return bytes;
    }
    AstNode whole = astContext.reference(expression);
    for (int i = 0; i < memory.getSize(); i++) {
      long address = memory.getAddress() + i;
      SymbolicExpression byteExpression = register(
          astContext.extract(8 * i + 7, 8 * i, whole), ExpressionKind.MEMORY,
          "byte reference", null, new MemoryAccess(address, 1));
      symbolicMemory.put(address, byteExpression.getId());
      bytes.add(byteExpression);
    }
    return bytes;
  }

  /** The expression defining {@code register}'s parent, or null. */
  public SymbolicExpression getSymbolicRegister(Register register) {
    Long id = symbolicRegisters.get(cpu.getParentRegister(register));
    return id == null ? null : expressions.get(id);
  }

  /** The expression defining the byte at {@code address}, or null. */
  public SymbolicExpression getSymbolicMemory(long address) {
    Long id = symbolicMemory.get(address);
    return id == null ? null : expressions.get(id);
  }

  /** Parent registers that are currently symbolic. */
  public ImmutableMap<Register, SymbolicExpression> getSymbolicRegisters() {
    ImmutableMap.Builder<Register, SymbolicExpression> result =
        ImmutableMap.builder();
    for (Map.Entry<Register, Long> entry : symbolicRegisters.entrySet()) {
      result.put(entry.getKey(), expressions.get(entry.getValue()));
    }
    return result.build();
  }

  /** Byte addresses that are currently symbolic. */
  public ImmutableMap<Long, SymbolicExpression> getSymbolicMemory() {
    ImmutableMap.Builder<Long, SymbolicExpression> result =
        ImmutableMap.builder();
    for (Map.Entry<Long, Long> entry : symbolicMemory.entrySet()) {
      result.put(entry.getKey(), expressions.get(entry.getValue()));
    }
    return result.build();
  }

  public void concretizeRegister(Register register) {
    symbolicRegisters.remove(cpu.getParentRegister(register));
  }

  public void concretizeMemory(long address) {
    symbolicMemory.remove(address);
  }

  public void concretizeMemory(MemoryAccess memory) {
    for (int i = 0; i < memory.getSize(); i++) {
      symbolicMemory.remove(memory.getAddress() + i);
    }
  }

  public void concretizeAllRegister() {
    symbolicRegisters.clear();
  }

  public void concretizeAllMemory() {
    symbolicMemory.clear();
  }

  /* Reading locations as nodes ----------------------------------------- */

  /**
   * The current value of {@code register}: a reference to (a slice of) its
   * parent's expression if symbolic, a constant from the concrete store
   * otherwise.
   */
  public AstNode getRegisterAst(Register register) {
    Register parent = cpu.getParentRegister(register);
    Long id = symbolicRegisters.get(parent);
    if (id == null) {
      return astContext.bv(context.getConcreteRegisterValue(register),
          register.getBitSize());
    }
    AstNode whole = astContext.reference(expressions.get(id));
    return astContext.extract(register.getHigh() - parent.getLow(),
        register.getLow() - parent.getLow(), whole);
  }

  /**
   * The current value of {@code memory}, byte by byte: references for
   * symbolic bytes, constants for concrete ones, most significant first.
   */
  public AstNode getMemoryAst(MemoryAccess memory) {
    List<AstNode> bytes = Lists.newArrayList();
    for (int i = memory.getSize() - 1; i >= 0; i--) {
      long address = memory.getAddress() + i;
      Long id = symbolicMemory.get(address);
      if (id == null) {
        bytes.add(astContext.bv(context.getConcreteMemoryValue(address), 8));
      } else {
        bytes.add(astContext.reference(expressions.get(id)));
      }
    }
    return bytes.size() == 1 ? bytes.get(0) : astContext.concat(bytes);
  }

  public AstNode getImmediateAst(Immediate immediate) {
    return astContext.bv(immediate.getValue(), immediate.getBitSize());
  }

  public AstNode getOperandAst(Operand operand) {
    switch (operand.getKind()) {
      case REGISTER:
        return getRegisterAst(operand.getRegister());
      case MEMORY:
        return getMemoryAst(operand.getMemory());
      default:
        return getImmediateAst(operand.getImmediate());
    }
  }

  public BigInteger getSymbolicRegisterValue(Register register) {
    return getRegisterAst(register).evaluate();
  }

  public BigInteger getSymbolicMemoryValue(MemoryAccess memory) {
    return getMemoryAst(memory).evaluate();
  }

  public int getSymbolicMemoryValue(long address) {
    return getMemoryAst(new MemoryAccess(address, 1)).evaluate().intValue();
  }

  /* Building expressions for an instruction ---------------------------- */

  /**
   * Registers {@code node} as the new value of {@code register} and links it
   * to {@code instruction}. A sub-register value is spliced into its parent.
   */
  public SymbolicExpression createSymbolicRegisterExpression(
      Instruction instruction, AstNode node, Register register,
      String comment) {
    return createRegisterExpression(instruction, node, register, comment,
        ExpressionKind.REGISTER);
  }

  /** Same as a register expression, tagged {@link ExpressionKind#FLAG}. */
  public SymbolicExpression createSymbolicFlagExpression(
      Instruction instruction, AstNode node, Register flag, String comment) {
    return createRegisterExpression(instruction, node, flag, comment,
        ExpressionKind.FLAG);
  }

  private SymbolicExpression createRegisterExpression(Instruction instruction,
      AstNode node, Register register, String comment, ExpressionKind kind) {
    Preconditions.checkArgument(
        node.getBitvectorSize() == register.getBitSize(),
        "Node size %s does not match %s", node.getBitvectorSize(), register);
    Register parent = cpu.getParentRegister(register);
    AstNode full = register.equals(parent)
        ? node : insertSubRegister(parent, register, node);
    SymbolicExpression expression =
        register(full, kind, comment, parent, null);
    symbolicRegisters.put(parent, expression.getId());
    instruction.addSymbolicExpression(expression);
    return expression;
  }

  /**
   * Registers {@code node} as the new value of {@code memory} and links it,
   * and its per-byte expressions, to {@code instruction}.
   */
  public SymbolicExpression createSymbolicMemoryExpression(
      Instruction instruction, AstNode node, MemoryAccess memory,
      String comment) {
    Preconditions.checkArgument(
        node.getBitvectorSize() == memory.getBitSize(),
        "Node size %s does not match %s", node.getBitvectorSize(), memory);
    SymbolicExpression expression =
        register(node, ExpressionKind.MEMORY, comment, null, memory);
    instruction.addSymbolicExpression(expression);
    for (SymbolicExpression byteExpression :
        assignMemoryBytes(expression, memory)) {
      instruction.addSymbolicExpression(byteExpression);
    }
    return expression;
  }

  /** Registers an intermediate result and links it to the instruction. */
  public SymbolicExpression createSymbolicVolatileExpression(
      Instruction instruction, AstNode node, String comment) {
    SymbolicExpression expression =
        register(node, ExpressionKind.VOLATILE, comment, null, null);
    instruction.addSymbolicExpression(expression);
    return expression;
  }

  /** Dispatches on the destination operand kind. */
  public SymbolicExpression createSymbolicExpression(Instruction instruction,
      AstNode node, Operand destination, String comment) {
    switch (destination.getKind()) {
      case REGISTER:
        return createSymbolicRegisterExpression(instruction, node,
            destination.getRegister(), comment);
      case MEMORY:
        return createSymbolicMemoryExpression(instruction, node,
            destination.getMemory(), comment);
      default:
        throw new IllegalArgumentException(
            "An immediate cannot be assigned: " + destination);
    }
  }

  /** {@code parent[high:reg.high+1] . node . parent[reg.low-1:0]} */
  private AstNode insertSubRegister(Register parent, Register register,
      AstNode node) {
    AstNode original = getRegisterAst(parent);
    int parentSize = parent.getBitSize();
    int high = register.getHigh() - parent.getLow();
    int low = register.getLow() - parent.getLow();
    List<AstNode> parts = Lists.newArrayList();
    if (high < parentSize - 1) {
      parts.add(astContext.extract(parentSize - 1, high + 1, original));
    }
    parts.add(node);
    if (low > 0) {
      parts.add(astContext.extract(low - 1, 0, original));
    }
    return parts.size() == 1 ? node : astContext.concat(parts);
  }

  /* Conversion to variables -------------------------------------------- */

  /**
   * Replaces the current value of {@code register} by a fresh variable whose
   * concrete value is the register's concrete value. The previous expression
   * stays registered under its id.
   */
  public SymbolicVariable convertRegisterToSymbolicVariable(Register register,
      String comment) {
    SymbolicVariable variable =
        newSymbolicVariable(register.getBitSize(), comment);
    astContext.setVariableValue(variable,
        context.getConcreteRegisterValue(register));
    Register parent = cpu.getParentRegister(register);
    AstNode leaf = astContext.variable(variable);
    AstNode full = register.equals(parent)
        ? leaf : insertSubRegister(parent, register, leaf);
    SymbolicExpression expression =
        register(full, ExpressionKind.REGISTER, comment, parent, null);
    symbolicRegisters.put(parent, expression.getId());
    return variable;
  }

  /**
   * Replaces the current value of {@code memory} by a fresh variable whose
   * concrete value is the memory's concrete value.
   */
  public SymbolicVariable convertMemoryToSymbolicVariable(MemoryAccess memory,
      String comment) {
    SymbolicVariable variable =
        newSymbolicVariable(memory.getBitSize(), comment);
    astContext.setVariableValue(variable,
        context.getConcreteMemoryValue(memory));
    SymbolicExpression expression = register(astContext.variable(variable),
        ExpressionKind.MEMORY, comment, null, memory);
    assignMemoryBytes(expression, memory);
    return variable;
  }

  /**
   * Mints a variable holding the current value of expression {@code id} and
   * moves every location defined by that expression to a new expression
   * over the variable. The old expression remains registered unchanged.
   */
  public SymbolicVariable convertExpressionToSymbolicVariable(long id,
      String comment) {
    SymbolicExpression old = getSymbolicExpressionFromId(id);
    SymbolicVariable variable = newSymbolicVariable(
        old.getAst().getBitvectorSize(), comment);
    astContext.setVariableValue(variable, old.getAst().evaluate());
    SymbolicExpression expression = register(astContext.variable(variable),
        old.getKind(), comment, old.getOriginRegister(),
        old.getOriginMemory());
    for (Map.Entry<Register, Long> entry : symbolicRegisters.entrySet()) {
      if (entry.getValue() == id) {
        entry.setValue(expression.getId());
      }
    }
    for (Map.Entry<Long, Long> entry : symbolicMemory.entrySet()) {
      if (entry.getValue() == id) {
        entry.setValue(expression.getId());
      }
    }
    return variable;
  }

  /* Full ASTs ---------------------------------------------------------- */

  /** The root node of expression {@code id}, references unexpanded. */
  public AstNode getAstFromId(long id) {
    return getSymbolicExpressionFromId(id).getAst();
  }

  public AstNode getFullAstFromId(long id) {
    return getFullAst(getAstFromId(id));
  }

  /**
   * Inlines every reference in {@code root}, recursively, giving a formula
   * over variables and constants only. Each referenced expression is
   * expanded once per call; the output may repeat structure that the input
   * shared through references.
   */
  public AstNode getFullAst(AstNode root) {
    Map<AstNode, AstNode> expanded = Maps.newIdentityHashMap();
    Map<Long, AstNode> expandedExpressions = Maps.newHashMap();
    Deque<AstNode> pending = Lists.newLinkedList();
    pending.push(root);
    while (!pending.isEmpty()) {
      AstNode node = pending.peek();
      if (expanded.containsKey(node)) {
        pending.pop();
        continue;
      }
      if (node.getKind() == AstKind.REFERENCE) {
        SymbolicExpression expression = node.getSymbolicExpression();
        AstNode target = expandedExpressions.get(expression.getId());
        if (target == null) {
          target = expanded.get(expression.getAst());
        }
        if (target == null) {
          pending.push(expression.getAst());
        } else {
          expandedExpressions.put(expression.getId(), target);
          expanded.put(node, target);
          pending.pop();
        }
        continue;
      }
      List<AstNode> children = Lists.newArrayList();
      boolean ready = true;
      for (AstNode child : node.getChildren()) {
        AstNode done = expanded.get(child);
        if (done == null) {
          pending.push(child);
          ready = false;
        }
        children.add(done);
      }
      if (ready) {
        pending.pop();
        expanded.put(node, astContext.rebuild(node, children));
      }
    }
    return expanded.get(root);
  }

  /* Simplification ----------------------------------------------------- */

  /**
   * Runs the simplification callbacks in registration order, each on the
   * previous one's output, then, if asked, the solver's simplifier.
   */
  public AstNode processSimplification(AstNode node,
      boolean useSolverSimplification) {
    AstNode result = context.processSimplificationCallbacks(node);
    if (useSolverSimplification) {
      result = context.getSolverEngine().simplify(getFullAst(result));
    }
    return result;
  }

  /* Path constraints --------------------------------------------------- */

  public void addPathConstraint(Instruction instruction,
      SymbolicExpression pcExpression) {
    pathManager.addPathConstraint(instruction, pcExpression);
  }

  public ImmutableList<PathConstraint> getPathConstraints() {
    return pathManager.getPathConstraints();
  }

  public AstNode getPathConstraintsAst() {
    return pathManager.getPathConstraintsAst();
  }

  public void clearPathConstraints() {
    pathManager.clearPathConstraints();
  }

  /* Modes -------------------------------------------------------------- */

  public boolean isEnabled() {
    return enabled;
  }

  public void enable(boolean flag) {
    this.enabled = flag;
  }

  public boolean isSolverSimplificationEnabled() {
    return solverSimplification;
  }

  public void enableSolverSimplification(boolean flag) {
    this.solverSimplification = flag;
  }

  public boolean isOptimizationEnabled(SymbolicOptimization optimization) {
    return optimizations.contains(optimization);
  }

  public void enableOptimization(SymbolicOptimization optimization,
      boolean flag) {
    if (flag) {
      optimizations.add(optimization);
    } else {
      optimizations.remove(optimization);
    }
    if (optimization == SymbolicOptimization.AST_DICTIONARIES) {
      astContext.getCollector().setDictionariesEnabled(flag);
    }
  }

  /* Backup ------------------------------------------------------------- */

  /** Captures the whole engine state. */
  SymbolicEngineSnapshot snapshot() {
    logger.log(Level.FINE, "Snapshot of {0} expressions, {1} variables",
        new Object[] {expressions.size(), variables.size()});
    return new SymbolicEngineSnapshot(symbolicRegisters, symbolicMemory,
        expressions, variables, taintedExpressions,
        pathManager.getPathConstraints(), enabled, solverSimplification,
        optimizations, nextExpressionId, nextVariableId);
  }

  /**
   * Replaces the whole engine state by {@code snapshot}, id counters
   * included. The snapshot is left intact and can be restored again.
   */
  void restore(SymbolicEngineSnapshot snapshot) {
    symbolicRegisters = Maps.newHashMap(snapshot.registers);
    symbolicMemory = Maps.newHashMap(snapshot.memory);
    expressions = Maps.newTreeMap(snapshot.expressions);
    for (SymbolicExpression expression : expressions.values()) {
      expression.restoreOrigins(snapshot.origins.get(expression.getId()));
    }
    nextExpressionId = snapshot.nextExpressionId;
    nextVariableId = snapshot.nextVariableId;
    variables = Maps.newTreeMap(snapshot.variables);
    taintedExpressions = Sets.newHashSet(snapshot.taintedExpressions);
    pathManager = new PathManager(astContext, snapshot.pathConstraints);
    enabled = snapshot.enabled;
    solverSimplification = snapshot.solverSimplification;
    for (SymbolicOptimization optimization : SymbolicOptimization.values()) {
      enableOptimization(optimization,
          snapshot.optimizations.contains(optimization));
    }
    logger.log(Level.FINE, "Restored {0} expressions, {1} variables",
        new Object[] {expressions.size(), variables.size()});
  }
}
