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

/**
 * The branch taken at one control-flow instruction. It records every
 * successor the instruction could go to, with the predicate under which it
 * goes there, and which successor was actually taken.
 */
public final class PathConstraint {
  /** One possible successor. */
  public static final class Branch {
    private final boolean taken;
    private final long sourceAddress;
    private final long destinationAddress;
    private final AstNode predicate;

    Branch(boolean taken, long sourceAddress, long destinationAddress,
        AstNode predicate) {
      this.taken = taken;
      this.sourceAddress = sourceAddress;
      this.destinationAddress = destinationAddress;
      this.predicate = predicate;
    }

    public boolean isTaken() {
      return taken;
    }

    public long getSourceAddress() {
      return sourceAddress;
    }

    public long getDestinationAddress() {
      return destinationAddress;
    }

    /** The condition under which control goes to this successor. */
    public AstNode getPredicate() {
      return predicate;
    }

    @Override
    public String toString() {
      return String.format("%s0x%x -> 0x%x: %s", taken ? "*" : " ",
          sourceAddress, destinationAddress, predicate);
    }
  }

  private final long sourceAddress;
  private final ImmutableList<Branch> branches;
  private final Branch takenBranch;

  PathConstraint(long sourceAddress, ImmutableList<Branch> branches) {
    Branch taken = null;
    for (Branch branch : branches) {
      if (branch.isTaken()) {
        taken = branch;
      }
    }
    Preconditions.checkArgument(taken != null, "No branch was taken");
    this.sourceAddress = sourceAddress;
    this.branches = branches;
    this.takenBranch = taken;
  }

  /** The address of the branch instruction. */
  public long getSourceAddress() {
    return sourceAddress;
  }

  public ImmutableList<Branch> getBranches() {
    return branches;
  }

  /** True for a conditional branch with two successors. */
  public boolean isMultipleBranches() {
    return branches.size() > 1;
  }

  public long getTakenAddress() {
    return takenBranch.getDestinationAddress();
  }

  public AstNode getTakenPredicate() {
    return takenBranch.getPredicate();
  }

  @Override
  public String toString() {
    return branches.toString();
  }
}
