// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.devtools.dexopt.dex;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import javax.annotation.Nullable;

/** A debug event at a code-unit address: either a position or a {@link DexDebugInstruction}. */
public final class DexDebugEntry {
  private final int address;
  @Nullable private final DexPosition position;
  @Nullable private final DexDebugInstruction insn;

  private DexDebugEntry(
      int address, @Nullable DexPosition position, @Nullable DexDebugInstruction insn) {
    this.address = address;
    this.position = position;
    this.insn = insn;
  }

  public static DexDebugEntry position(int address, DexPosition position) {
    return new DexDebugEntry(address, checkNotNull(position), null);
  }

  public static DexDebugEntry instruction(int address, DexDebugInstruction insn) {
    return new DexDebugEntry(address, null, checkNotNull(insn));
  }

  public int address() {
    return address;
  }

  public boolean isPosition() {
    return position != null;
  }

  @Nullable
  public DexPosition getPosition() {
    return position;
  }

  @Nullable
  public DexDebugInstruction getInstruction() {
    return insn;
  }

  DexDebugEntry deepCopy() {
    return insn == null ? this : new DexDebugEntry(address, null, insn.copy());
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof DexDebugEntry)) {
      return false;
    }
    DexDebugEntry that = (DexDebugEntry) o;
    return address == that.address
        && Objects.equals(position, that.position)
        && Objects.equals(insn, that.insn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(address, position, insn);
  }

  @Override
  public String toString() {
    return String.format("0x%04x: %s", address, isPosition() ? position : insn);
  }
}
