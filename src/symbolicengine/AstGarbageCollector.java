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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Collection;
import java.util.Deque;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps track of every node the engine has built.
 * <p>
 * With AST dictionaries enabled, {@link #recordAstNode(AstNode)} looks the
 * node up by its structural key and hands back the node recorded first, so
 * structurally equal constructions share one identity. Otherwise every node is
 * recorded as is.
 * <p>
 * Nodes stay recorded until {@link #freeAstNodes(Collection)} or
 * {@link #freeAllAstNodes()} drops them. Nothing checks that a freed node is
 * no longer reachable from a live expression or that it was not already
 * freed; both are the caller's responsibility.
 */
public class AstGarbageCollector {
  private static final Logger logger =
      Logger.getLogger(AstGarbageCollector.class.getName());

  /** Every recorded node, by identity. */
  private final Set<AstNode> allocatedNodes = Sets.newIdentityHashSet();

  /** The canonical node of each structural key. */
  private final Map<AstKey, AstNode> dictionary = Maps.newHashMap();

  /** Variable leaves by variable name. */
  private final Map<String, AstNode> variableNodes = Maps.newHashMap();

  private boolean dictionariesEnabled;
  private long hits;
  private long misses;

  public AstGarbageCollector(boolean dictionariesEnabled) {
    this.dictionariesEnabled = dictionariesEnabled;
  }

  public boolean isDictionariesEnabled() {
    return dictionariesEnabled;
  }

  /**
   * Turns deduplication on or off. Turning it off keeps the dictionary so
   * that turning it back on resumes canonicalization against it.
   */
  public void setDictionariesEnabled(boolean enabled) {
    this.dictionariesEnabled = enabled;
  }

  /**
   * Records a freshly built node and returns the node callers must use in its
   * place: an existing equal node when the dictionaries know one, the given
   * node otherwise.
   */
  public AstNode recordAstNode(AstNode node) {
    if (dictionariesEnabled) {
      AstNode known = browseAstDictionaries(node);
      if (known != null) {
        return known;
      }
      dictionary.put(node.key(), node);
    }
    allocatedNodes.add(node);
    return node;
  }

  /**
   * Looks a node up in the dictionaries without recording it, counting the
   * lookup as a hit or a miss.
   *
   * @return the recorded node with the same structural key, or null
   */
  public AstNode browseAstDictionaries(AstNode node) {
    AstNode known = dictionary.get(node.key());
    if (known != null) {
      hits++;
    } else {
      misses++;
    }
    return known;
  }

  /**
   * Statistics about the dictionaries: lookup hits and misses, the number of
   * canonical nodes and the number of allocated nodes, plus the number of
   * canonical nodes of each kind (keyed by kind name).
   */
  public ImmutableMap<String, Long> getAstDictionariesStats() {
    Map<AstKind, Long> perKind = Maps.newEnumMap(AstKind.class);
    for (AstNode node : dictionary.values()) {
      Long count = perKind.get(node.getKind());
      perKind.put(node.getKind(), count == null ? 1L : count + 1);
    }
    ImmutableMap.Builder<String, Long> stats = ImmutableMap.builder();
    stats.put("hits", hits);
    stats.put("misses", misses);
    stats.put("dictionarySize", (long) dictionary.size());
    stats.put("allocatedNodes", (long) allocatedNodes.size());
    for (Map.Entry<AstKind, Long> entry : perKind.entrySet()) {
      stats.put(entry.getKey().name(), entry.getValue());
    }
    return stats.build();
  }

  /** Indexes a variable leaf by name, replacing any earlier leaf. */
  public void recordVariableAstNode(String name, AstNode node) {
    variableNodes.put(name, node);
  }

  /**
   * Returns every distinct node reachable from {@code root}, references
   * excluded (a reference is a leaf here). Shared subgraphs are visited once.
   */
  public Set<AstNode> extractUniqueAstNodes(AstNode root) {
    Set<AstNode> unique = Sets.newIdentityHashSet();
    Deque<AstNode> pending = Lists.newLinkedList();
    pending.push(root);
    while (!pending.isEmpty()) {
      AstNode node = pending.pop();
      if (unique.add(node)) {
        for (AstNode child : node.getChildren()) {
          pending.push(child);
        }
      }
    }
    return unique;
  }

  /**
   * Forgets the given nodes: they leave the allocated set, the dictionaries
   * and the variable index. Any other node still pointing at one of them is
   * left dangling.
   */
  public void freeAstNodes(Collection<AstNode> nodes) {
    for (AstNode node : nodes) {
      allocatedNodes.remove(node);
      AstKey key = node.key();
      if (dictionary.get(key) == node) {
        dictionary.remove(key);
      }
      if (node.getVariable() != null) {
        String name = node.getVariable().getName();
        if (variableNodes.get(name) == node) {
          variableNodes.remove(name);
        }
      }
    }
    logger.log(Level.FINE, "Freed {0} nodes, {1} still allocated",
        new Object[] {nodes.size(), allocatedNodes.size()});
  }

  /** Forgets every node ever recorded. */
  public void freeAllAstNodes() {
    logger.log(Level.FINE, "Freeing all {0} allocated nodes",
        allocatedNodes.size());
    allocatedNodes.clear();
    dictionary.clear();
    variableNodes.clear();
  }

  /** A copy of the set of allocated nodes. */
  public Set<AstNode> getAllocatedAstNodes() {
    Set<AstNode> copy = Sets.newIdentityHashSet();
    copy.addAll(allocatedNodes);
    return copy;
  }

  public ImmutableMap<String, AstNode> getAstVariableNodes() {
    return ImmutableMap.copyOf(variableNodes);
  }

  /**
   * @return the variable leaf recorded under {@code name}
   * @throws NotFoundException if no variable of that name is recorded
   */
  public AstNode getAstVariableNode(String name) {
    AstNode node = variableNodes.get(name);
    if (node == null) {
      throw new NotFoundException("No variable node named " + name);
    }
    return node;
  }

  /**
   * Replaces the allocated set. The dictionaries are rebuilt from the new set
   * so that they never hand out a node outside it.
   */
  public void setAllocatedAstNodes(Set<AstNode> nodes) {
    allocatedNodes.clear();
    allocatedNodes.addAll(nodes);
    dictionary.clear();
    for (AstNode node : nodes) {
      AstKey key = node.key();
      if (!dictionary.containsKey(key)) {
        dictionary.put(key, node);
      }
    }
  }

  public void setAstVariableNodes(Map<String, AstNode> nodes) {
    variableNodes.clear();
    variableNodes.putAll(nodes);
  }
}
