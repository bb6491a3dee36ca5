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

package com.google.devtools.dexopt.testutil;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.devtools.dexopt.dex.DexCode;
import com.google.devtools.dexopt.dex.DexDebugEntry;
import com.google.devtools.dexopt.dex.DexDebugInstruction;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.dex.DexOpcode;
import com.google.devtools.dexopt.dex.DexOpcodeData;
import com.google.devtools.dexopt.dex.DexPosition;
import com.google.devtools.dexopt.dex.DexTryItem;
import com.google.devtools.dexopt.dex.DexType;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Assembles method bodies for tests. Branches, switch cases, try regions and handlers refer to
 * labels, which name the position of the next added instruction.
 *
 * <pre>{@code
 * DexCode code =
 *     new DexCodeBuilder(2, 1)
 *         .branch(new DexInstruction(DexOpcode.IF_EQZ).setSrc(0, 1), "zero")
 *         .add(new DexInstruction(DexOpcode.RETURN).setSrc(0, 1))
 *         .label("zero")
 *         .add(new DexInstruction(DexOpcode.RETURN_VOID))
 *         .build();
 * }</pre>
 */
public final class DexCodeBuilder {
  private final int registers;
  private final int ins;
  private int outs;
  private final List<DexInstruction> insns = new ArrayList<>();
  private final Map<String, Integer> labels = new HashMap<>();
  private final Map<Integer, String> branches = new HashMap<>();
  private final Map<Integer, SwitchCases> switches = new HashMap<>();
  private final Map<Integer, DexOpcodeData> arrays = new HashMap<>();
  private final List<TryRegion> tries = new ArrayList<>();
  private final List<PendingDebug> debug = new ArrayList<>();

  private record SwitchCases(boolean packed, int[] keys, String[] targets) {}

  private record TryRegion(
      String start, String end, List<DexType> types, List<String> handlers) {}

  private record PendingDebug(
      int index, @Nullable DexPosition position, @Nullable DexDebugInstruction insn) {}

  public DexCodeBuilder(int registers, int ins) {
    this.registers = registers;
    this.ins = ins;
  }

  @CanIgnoreReturnValue
  public DexCodeBuilder outs(int outs) {
    this.outs = outs;
    return this;
  }

  @CanIgnoreReturnValue
  public DexCodeBuilder add(DexInstruction insn) {
    checkArgument(!insn.opcode().isBranch(), "use branch() for %s", insn);
    insns.add(insn);
    return this;
  }

  @CanIgnoreReturnValue
  public DexCodeBuilder label(String name) {
    checkState(labels.put(name, insns.size()) == null, "duplicate label %s", name);
    return this;
  }

  @CanIgnoreReturnValue
  public DexCodeBuilder branch(DexInstruction insn, String target) {
    checkArgument(insn.opcode().isGoto() || insn.opcode().isConditionalBranch(), "%s", insn);
    branches.put(insns.size(), target);
    insns.add(insn);
    return this;
  }

  @CanIgnoreReturnValue
  public DexCodeBuilder packedSwitch(int reg, int firstKey, String... targets) {
    int[] keys = new int[targets.length];
    for (int i = 0; i < keys.length; i++) {
      keys[i] = firstKey + i;
    }
    switches.put(insns.size(), new SwitchCases(true, keys, targets));
    insns.add(new DexInstruction(DexOpcode.PACKED_SWITCH).setSrc(0, reg));
    return this;
  }

  @CanIgnoreReturnValue
  public DexCodeBuilder sparseSwitch(int reg, int[] keys, String... targets) {
    checkArgument(keys.length == targets.length, "keys and targets differ in length");
    switches.put(insns.size(), new SwitchCases(false, keys, targets));
    insns.add(new DexInstruction(DexOpcode.SPARSE_SWITCH).setSrc(0, reg));
    return this;
  }

  @CanIgnoreReturnValue
  public DexCodeBuilder fillArrayData(int reg, DexOpcodeData data) {
    arrays.put(insns.size(), data);
    insns.add(new DexInstruction(DexOpcode.FILL_ARRAY_DATA).setSrc(0, reg));
    return this;
  }

  /** A try region from label {@code start} to label {@code end} with one handler. */
  @CanIgnoreReturnValue
  public DexCodeBuilder tryCatch(
      String start, String end, @Nullable DexType type, String handler) {
    List<DexType> types = new ArrayList<>();
    types.add(type);
    tries.add(new TryRegion(start, end, types, ImmutableList.of(handler)));
    return this;
  }

  @CanIgnoreReturnValue
  public DexCodeBuilder position(int line) {
    debug.add(new PendingDebug(insns.size(), DexPosition.create(line, "Test.java"), null));
    return this;
  }

  @CanIgnoreReturnValue
  public DexCodeBuilder debug(DexDebugInstruction insn) {
    debug.add(new PendingDebug(insns.size(), null, insn));
    return this;
  }

  public DexCode build() {
    int[] addr = new int[insns.size() + 1];
    for (int i = 0; i < insns.size(); i++) {
      addr[i + 1] = addr[i] + insns.get(i).size();
    }
    int end = addr[insns.size()];
    for (Map.Entry<Integer, String> b : branches.entrySet()) {
      int i = b.getKey();
      insns.get(i).setOffset(addressOf(b.getValue(), addr) - addr[i]);
    }

    List<DexInstruction> out = new ArrayList<>(insns);
    int pos = end;
    for (int i = 0; i < insns.size(); i++) {
      DexOpcodeData payload = payloadFor(i, addr);
      if (payload == null) {
        continue;
      }
      if ((pos & 1) != 0) {
        out.add(new DexInstruction(DexOpcode.NOP));
        pos++;
      }
      insns.get(i).setOffset(pos - addr[i]);
      out.add(payload);
      pos += payload.size();
    }

    List<DexTryItem> tryItems = new ArrayList<>();
    for (TryRegion t : tries) {
      int start = addressOf(t.start(), addr);
      ImmutableList.Builder<DexTryItem.CatchHandler> handlers = ImmutableList.builder();
      for (int h = 0; h < t.handlers().size(); h++) {
        handlers.add(
            DexTryItem.CatchHandler.create(t.types().get(h), addressOf(t.handlers().get(h), addr)));
      }
      tryItems.add(DexTryItem.create(start, addressOf(t.end(), addr) - start, handlers.build()));
    }

    List<DexDebugEntry> debugEntries = new ArrayList<>();
    for (PendingDebug d : debug) {
      debugEntries.add(
          d.position() != null
              ? DexDebugEntry.position(addr[d.index()], d.position())
              : DexDebugEntry.instruction(addr[d.index()], d.insn()));
    }
    return new DexCode(registers, ins, outs, out, tryItems, debugEntries);
  }

  @Nullable
  private DexOpcodeData payloadFor(int i, int[] addr) {
    DexOpcodeData array = arrays.get(i);
    if (array != null) {
      return array;
    }
    SwitchCases cases = switches.get(i);
    if (cases == null) {
      return null;
    }
    int[] rel = new int[cases.targets().length];
    for (int c = 0; c < rel.length; c++) {
      rel[c] = addressOf(cases.targets()[c], addr) - addr[i];
    }
    return cases.packed()
        ? DexOpcodeData.packedSwitch(cases.keys().length > 0 ? cases.keys()[0] : 0, rel)
        : DexOpcodeData.sparseSwitch(cases.keys(), rel);
  }

  private int addressOf(String label, int[] addr) {
    Integer index = labels.get(label);
    checkArgument(index != null, "unknown label %s", label);
    return addr[index];
  }
}
