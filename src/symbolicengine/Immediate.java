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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import java.math.BigInteger;

/**
 * An immediate operand of {@code size} bytes; the value is truncated to fit.
 */
public final class Immediate {
  private final BigInteger value;
  private final int size;

  public Immediate(BigInteger value, int size) {
    Preconditions.checkArgument(size > 0 && size <= MemoryAccess.MAX_SIZE,
        "Invalid immediate size: %s", size);
    this.size = size;
    this.value = value.and(BitvectorSemantics.mask(size * 8));
  }

  public Immediate(long value, int size) {
    this(BigInteger.valueOf(value), size);
  }

  public BigInteger getValue() {
    return value;
  }

  public int getSize() {
    return size;
  }

  public int getBitSize() {
    return size * 8;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Immediate)) {
      return false;
    }
    Immediate other = (Immediate) obj;
    return value.equals(other.value) && size == other.size;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value, size);
  }

  @Override
  public String toString() {
    return String.format("0x%x:%d", value, getBitSize());
  }
}
