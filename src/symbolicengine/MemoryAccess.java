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

/**
 * A memory access of {@code size} bytes starting at {@code address}. Multi-byte
 * values are little endian.
 */
public final class MemoryAccess {
  /** Largest access, in bytes. */
  public static final int MAX_SIZE = AstContext.MAX_BITS_SUPPORTED / 8;

  private final long address;
  private final int size;

  public MemoryAccess(long address, int size) {
    Preconditions.checkArgument(size > 0 && size <= MAX_SIZE,
        "Invalid memory access size: %s", size);
    this.address = address;
    this.size = size;
  }

  public long getAddress() {
    return address;
  }

  /** Size in bytes. */
  public int getSize() {
    return size;
  }

  public int getBitSize() {
    return size * 8;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof MemoryAccess)) {
      return false;
    }
    MemoryAccess other = (MemoryAccess) obj;
    return address == other.address && size == other.size;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(address, size);
  }

  @Override
  public String toString() {
    return String.format("[@0x%x]:%d", address, getBitSize());
  }
}
