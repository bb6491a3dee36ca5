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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.devtools.dexopt.transform.MethodTransform;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * The body of a method.
 *
 * <p>A code item is in one of two forms. In binary form it holds a list of decoded instructions
 * (payloads included) whose addresses are implied by their sizes, together with try regions and
 * debug entries keyed by address. {@link #balloon()} converts it into the editable form, a {@link
 * MethodTransform}; {@link #sync()} converts back and recomputes every address-dependent field.
 */
public final class DexCode {
  /** Upper bound of the registers_size field. */
  public static final int MAX_REGISTERS = 0xffff;

  private int registersSize;
  private final int insSize;
  private int outsSize;
  private List<DexInstruction> instructions;
  private ImmutableList<DexTryItem> tries;
  private ImmutableList<DexDebugEntry> debugEntries;
  @Nullable private MethodTransform entries;

  public DexCode(
      int registersSize,
      int insSize,
      int outsSize,
      List<DexInstruction> instructions,
      List<DexTryItem> tries,
      List<DexDebugEntry> debugEntries) {
    checkArgument(
        insSize <= registersSize, "ins_size %s exceeds registers_size %s", insSize, registersSize);
    this.registersSize = registersSize;
    this.insSize = insSize;
    this.outsSize = outsSize;
    this.instructions = new ArrayList<>(instructions);
    this.tries = ImmutableList.copyOf(tries);
    this.debugEntries = ImmutableList.copyOf(debugEntries);
  }

  public int getRegistersSize() {
    return registersSize;
  }

  public void setRegistersSize(int registersSize) {
    checkArgument(
        registersSize >= insSize && registersSize <= MAX_REGISTERS,
        "bad registers_size %s",
        registersSize);
    this.registersSize = registersSize;
  }

  /** Number of parameter words, including the receiver; always the top registers. */
  public int getInsSize() {
    return insSize;
  }

  public int getOutsSize() {
    return outsSize;
  }

  public void setOutsSize(int outsSize) {
    this.outsSize = outsSize;
  }

  /** The instructions of the binary form. Must not be called while ballooned. */
  public List<DexInstruction> getInstructions() {
    checkState(entries == null, "code is ballooned");
    return instructions;
  }

  public void setInstructions(List<DexInstruction> instructions) {
    this.instructions = new ArrayList<>(checkNotNull(instructions));
  }

  public ImmutableList<DexTryItem> getTries() {
    return tries;
  }

  public void setTries(List<DexTryItem> tries) {
    this.tries = ImmutableList.copyOf(tries);
  }

  public ImmutableList<DexDebugEntry> getDebugEntries() {
    return debugEntries;
  }

  public void setDebugEntries(List<DexDebugEntry> debugEntries) {
    this.debugEntries = ImmutableList.copyOf(debugEntries);
  }

  /** Total size of the binary form, in code units. */
  public int sizeInCodeUnits() {
    int size = 0;
    for (DexInstruction insn : getInstructions()) {
      size += insn.size();
    }
    return size;
  }

  public boolean isBallooned() {
    return entries != null;
  }

  /** Converts the binary form into the editable item list. */
  public void balloon() {
    checkState(entries == null, "code is already ballooned");
    entries = MethodTransform.balloon(this);
  }

  public MethodTransform getEntries() {
    checkState(entries != null, "code is not ballooned");
    return entries;
  }

  /**
   * Lowers the item list back to the binary form: re-linearizes branches (widening gotos whose
   * offsets no longer fit), regenerates payloads, try regions and debug entries, and leaves the
   * code in binary form.
   */
  public void sync() {
    checkState(entries != null, "code is not ballooned");
    entries.sync(this);
    entries = null;
  }

  /** Returns a deep copy of the binary form. */
  public DexCode copy() {
    checkState(entries == null, "cannot copy ballooned code");
    List<DexInstruction> insns = new ArrayList<>(instructions.size());
    for (DexInstruction insn : instructions) {
      insns.add(insn.copy());
    }
    List<DexDebugEntry> debug = new ArrayList<>(debugEntries.size());
    for (DexDebugEntry entry : debugEntries) {
      debug.add(entry.deepCopy());
    }
    return new DexCode(registersSize, insSize, outsSize, insns, tries, debug);
  }

  @Override
  public String toString() {
    StringBuilder sb =
        new StringBuilder(
            String.format("registers=%d ins=%d outs=%d%n", registersSize, insSize, outsSize));
    if (entries != null) {
      return sb.append(entries).toString();
    }
    int addr = 0;
    for (DexInstruction insn : instructions) {
      sb.append(String.format("%04x: %s%n", addr, insn));
      addr += insn.size();
    }
    for (DexTryItem t : tries) {
      sb.append(t).append(System.lineSeparator());
    }
    return sb.toString();
  }
}
