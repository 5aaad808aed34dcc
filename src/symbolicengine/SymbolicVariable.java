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

/**
 * A free symbolic input: an unconstrained bitvector that the solver assigns
 * values to. Variables are numbered from 0 and named {@code SymVar_<id>}.
 */
public final class SymbolicVariable {
  /** Prefix of every variable name. */
  public static final String NAME_PREFIX = "SymVar_";

  private final long id;
  private final int bitSize;
  private final String comment;

  private SymbolicVariable(long id, int bitSize, String comment) {
    this.id = id;
    this.bitSize = bitSize;
    this.comment = comment == null ? "" : comment;
  }

  /**
   * @param id the unique variable id
   * @param bitSize the width of the variable, in bits
   * @param comment free text attached to the variable; may be null
   */
  static SymbolicVariable create(long id, int bitSize, String comment) {
    Preconditions.checkArgument(
        bitSize > 0 && bitSize <= AstContext.MAX_BITS_SUPPORTED,
        "Invalid variable size: %s", bitSize);
    return new SymbolicVariable(id, bitSize, comment);
  }

  public long getId() {
    return id;
  }

  public int getBitSize() {
    return bitSize;
  }

  public String getComment() {
    return comment;
  }

  public String getName() {
    return NAME_PREFIX + id;
  }

  @Override
  public String toString() {
    return getName() + ":" + bitSize;
  }
}
