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
 * Register metadata supplied by the architecture: a name, the parent register
 * it is part of (itself for a parent) and the bits of the parent it covers.
 * Flags are 1-bit parent registers.
 */
public final class Register implements Comparable<Register> {
  private final String name;
  private final String parentName;
  private final int high;
  private final int low;
  private final boolean flag;

  private Register(String name, String parentName, int high, int low,
      boolean flag) {
    this.name = name;
    this.parentName = parentName;
    this.high = high;
    this.low = low;
    this.flag = flag;
  }

  /** A parent register of {@code bitSize} bits. */
  public static Register parent(String name, int bitSize) {
    Preconditions.checkArgument(bitSize > 0, "Invalid register size");
    return new Register(name, name, bitSize - 1, 0, false);
  }

  /** Bits {@code [high:low]} of the register named {@code parentName}. */
  public static Register sub(String name, String parentName, int high,
      int low) {
    Preconditions.checkArgument(low >= 0 && high >= low,
        "Invalid register range [%s:%s]", high, low);
    return new Register(name, parentName, high, low, false);
  }

  /** A 1-bit flag register. */
  public static Register flag(String name) {
    return new Register(name, name, 0, 0, true);
  }

  public String getName() {
    return name;
  }

  public String getParentName() {
    return parentName;
  }

  public boolean isParent() {
    return name.equals(parentName);
  }

  public boolean isFlag() {
    return flag;
  }

  /** The highest bit of the parent covered by this register. */
  public int getHigh() {
    return high;
  }

  /** The lowest bit of the parent covered by this register. */
  public int getLow() {
    return low;
  }

  public int getBitSize() {
    return high - low + 1;
  }

  /** The size in bytes, rounded up. */
  public int getSize() {
    return (getBitSize() + 7) / 8;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Register && ((Register) obj).name.equals(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public int compareTo(Register other) {
    return name.compareTo(other.name);
  }

  @Override
  public String toString() {
    return String.format("%s:%d bv[%d..%d]", name, getBitSize(), high, low);
  }
}
