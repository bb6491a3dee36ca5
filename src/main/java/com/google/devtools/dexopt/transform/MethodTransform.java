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

package com.google.devtools.dexopt.transform;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Verify.verify;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.dexopt.dex.DexClass;
import com.google.devtools.dexopt.dex.DexCode;
import com.google.devtools.dexopt.dex.DexDebugEntry;
import com.google.devtools.dexopt.dex.DexFormatException;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.dex.DexMethod;
import com.google.devtools.dexopt.dex.DexOpcode;
import com.google.devtools.dexopt.dex.DexOpcodeData;
import com.google.devtools.dexopt.dex.DexTryItem;
import com.google.devtools.dexopt.dex.Scope;
import com.google.devtools.dexopt.ir.BranchTarget;
import com.google.devtools.dexopt.ir.CatchEntry;
import com.google.devtools.dexopt.ir.ControlFlowGraph;
import com.google.devtools.dexopt.ir.FatMethod;
import com.google.devtools.dexopt.ir.MethodItemEntry;
import com.google.devtools.dexopt.ir.MethodItemType;
import com.google.devtools.dexopt.ir.TryEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.IntUnaryOperator;
import javax.annotation.Nullable;

/**
 * The editable form of a {@link DexCode}: the method's item list plus the payload data that is
 * not itself an item (fill-array-data tables), and the operations that edit it.
 *
 * <p>Obtain one with {@link DexCode#balloon()} and commit it with {@link DexCode#sync()}.
 */
public final class MethodTransform implements Iterable<MethodItemEntry> {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final FatMethod fmethod = new FatMethod();
  /** fill-array-data instruction item to its data table. */
  private final Map<MethodItemEntry, DexOpcodeData> arrayData = new IdentityHashMap<>();
  /** First key of packed switches ballooned with an empty table. */
  private final Map<MethodItemEntry, Integer> emptyPackedFirstKeys = new IdentityHashMap<>();

  @Nullable private ControlFlowGraph cfg;

  private MethodTransform() {}

  /** Builds the item list of a code item in binary form. Use {@link DexCode#balloon()}. */
  public static MethodTransform balloon(DexCode code) {
    MethodTransform transform = new MethodTransform();
    transform.balloonFrom(code);
    return transform;
  }

  private void balloonFrom(DexCode code) {
    List<DexInstruction> insns = code.getInstructions();
    NavigableMap<Integer, MethodItemEntry> opcodeAt = new TreeMap<>();
    Map<Integer, DexOpcodeData> payloadAt = new HashMap<>();
    int addr = 0;
    for (int i = 0; i < insns.size(); i++) {
      DexInstruction insn = insns.get(i);
      if (insn.isPayload()) {
        payloadAt.put(addr, (DexOpcodeData) insn);
      } else if (!isAlignmentNop(insns, i)) {
        MethodItemEntry entry = MethodItemEntry.opcode(insn);
        entry.setAddr(addr);
        opcodeAt.put(addr, entry);
      }
      addr += insn.size();
    }
    int end = addr;

    ListMultimap<Integer, MethodItemEntry> tryEnds = ArrayListMultimap.create();
    ListMultimap<Integer, MethodItemEntry> catches = ArrayListMultimap.create();
    ListMultimap<Integer, MethodItemEntry> tryStarts = ArrayListMultimap.create();
    ListMultimap<Integer, MethodItemEntry> targets = ArrayListMultimap.create();
    ListMultimap<Integer, MethodItemEntry> debug = ArrayListMultimap.create();

    for (MethodItemEntry e : opcodeAt.values()) {
      DexInstruction insn = e.insn();
      DexOpcode op = insn.opcode();
      if (op.isGoto() || op.isConditionalBranch()) {
        int target = e.addr() + insn.offset();
        checkBranchTarget(opcodeAt, e, target);
        targets.put(target, MethodItemEntry.target(BranchTarget.simple(e)));
      } else if (op.isSwitch()) {
        DexOpcodeData payload = payloadAt.get(e.addr() + insn.offset());
        if (payload == null || !payload.isSwitchPayload()) {
          throw new DexFormatException("switch without switch payload", e.addr());
        }
        int[] keys = payload.switchKeys();
        int[] rel = payload.switchTargets();
        for (int i = 0; i < keys.length; i++) {
          int target = e.addr() + rel[i];
          checkBranchTarget(opcodeAt, e, target);
          targets.put(target, MethodItemEntry.target(BranchTarget.multi(e, keys[i])));
        }
        if (keys.length == 0 && op == DexOpcode.PACKED_SWITCH) {
          emptyPackedFirstKeys.put(e, payload.packedFirstKey());
        }
      } else if (op == DexOpcode.FILL_ARRAY_DATA) {
        DexOpcodeData payload = payloadAt.get(e.addr() + insn.offset());
        if (payload == null || payload.ident() != DexOpcodeData.FILL_ARRAY_DATA_IDENT) {
          throw new DexFormatException("fill-array-data without array payload", e.addr());
        }
        arrayData.put(e, payload);
      }
    }

    Map<ImmutableList<DexTryItem.CatchHandler>, MethodItemEntry> chains = new HashMap<>();
    for (DexTryItem t : code.getTries()) {
      MethodItemEntry catchStart = chains.get(t.handlers());
      if (catchStart == null) {
        catchStart = buildCatchChain(t, catches);
        chains.put(t.handlers(), catchStart);
      }
      tryStarts.put(t.startAddress(), MethodItemEntry.tryMarker(TryEntry.Type.START, catchStart));
      tryEnds.put(t.endAddress(), MethodItemEntry.tryMarker(TryEntry.Type.END, catchStart));
    }

    for (DexDebugEntry d : code.getDebugEntries()) {
      debug.put(
          d.address(),
          d.isPosition()
              ? MethodItemEntry.position(d.getPosition())
              : MethodItemEntry.debug(d.getInstruction()));
    }

    // Markers at addresses past the last instruction (the payload area) attach to the end.
    NavigableMap<Integer, List<MethodItemEntry>> before = new TreeMap<>();
    for (ListMultimap<Integer, MethodItemEntry> markers :
        Arrays.asList(tryEnds, catches, tryStarts, targets, debug)) {
      for (Integer key : markers.keySet()) {
        if (key < 0 || key > end) {
          throw new DexFormatException("marker outside of code", key);
        }
        Integer at = opcodeAt.ceilingKey(key);
        before.computeIfAbsent(at == null ? end : at, k -> new ArrayList<>())
            .addAll(markers.get(key));
      }
    }
    for (MethodItemEntry e : opcodeAt.values()) {
      List<MethodItemEntry> markers = before.get(e.addr());
      if (markers != null) {
        markers.forEach(fmethod::pushBack);
      }
      fmethod.pushBack(e);
    }
    List<MethodItemEntry> trailing = before.get(end);
    if (trailing != null) {
      trailing.forEach(fmethod::pushBack);
    }
    logger.atFinest().log("ballooned %d items", fmethod.size());
  }

  private static boolean isAlignmentNop(List<DexInstruction> insns, int i) {
    DexInstruction insn = insns.get(i);
    return insn.opcode() == DexOpcode.NOP
        && !insn.isPayload()
        && i + 1 < insns.size()
        && insns.get(i + 1).isPayload();
  }

  private static void checkBranchTarget(
      Map<Integer, MethodItemEntry> opcodeAt, MethodItemEntry branch, int target) {
    if (!opcodeAt.containsKey(target)) {
      throw new DexFormatException(
          "branch to 0x" + Integer.toHexString(target) + " is not an instruction boundary",
          branch.addr());
    }
  }

  private static MethodItemEntry buildCatchChain(
      DexTryItem t, ListMultimap<Integer, MethodItemEntry> catches) {
    MethodItemEntry first = null;
    MethodItemEntry last = null;
    for (DexTryItem.CatchHandler h : t.handlers()) {
      MethodItemEntry c = MethodItemEntry.catchMarker(new CatchEntry(h.type()));
      catches.put(h.address(), c);
      if (last == null) {
        first = c;
      } else {
        last.catchEntry().setNext(c);
      }
      last = c;
    }
    if (first == null) {
      throw new DexFormatException("try region without handlers", t.startAddress());
    }
    return first;
  }

  /** The item list. Edits made directly on it bypass target bookkeeping. */
  public FatMethod items() {
    return fmethod;
  }

  @Override
  public Iterator<MethodItemEntry> iterator() {
    return fmethod.iterator();
  }

  public InstructionIterable instructions() {
    return new InstructionIterable(fmethod);
  }

  /** Builds the control-flow graph, ending blocks before throwing instructions in try regions. */
  public ControlFlowGraph buildCfg() {
    return buildCfg(true);
  }

  public ControlFlowGraph buildCfg(boolean endBlockBeforeThrow) {
    cfg = ControlFlowGraph.build(fmethod, endBlockBeforeThrow);
    return cfg;
  }

  /** The graph from the last {@link #buildCfg}; fails if the method changed since. */
  public ControlFlowGraph cfg() {
    checkState(cfg != null, "no control flow graph has been built");
    cfg.checkFresh();
    return cfg;
  }

  /** Returns the item holding {@code insn}. */
  public MethodItemEntry findOpcode(DexInstruction insn) {
    for (MethodItemEntry e : fmethod) {
      if (e.isOpcode() && e.insn() == insn) {
        return e;
      }
    }
    throw new IllegalArgumentException("No match found for " + insn + " in method");
  }

  /**
   * Replaces a non-branch instruction. If {@code from} is a branch its targets are removed;
   * replacing with a branch requires {@link #replaceBranch}.
   */
  public void replaceOpcode(DexInstruction from, DexInstruction to) {
    checkArgument(!to.opcode().isBranch(), "use replaceBranch to install %s", to);
    MethodItemEntry entry = findOpcode(from);
    if (from.opcode().isBranch()) {
      removeBranchTargets(entry);
    }
    if (to.opcode() != DexOpcode.FILL_ARRAY_DATA) {
      arrayData.remove(entry);
    }
    entry.setInsn(to);
  }

  /** Replaces a branch by another branch of the same kind, keeping its targets. */
  public void replaceBranch(DexInstruction from, DexInstruction to) {
    checkArgument(from.opcode().isBranch(), "%s is not a branch", from);
    checkArgument(to.opcode().isBranch(), "%s is not a branch", to);
    checkArgument(
        from.opcode().isSwitch() == to.opcode().isSwitch(),
        "cannot replace %s by %s",
        from,
        to);
    findOpcode(from).setInsn(to);
  }

  /**
   * Inserts {@code insns} right after {@code position}, or at the very beginning of the method when
   * {@code position} is null.
   */
  public void insertAfter(@Nullable DexInstruction position, List<DexInstruction> insns) {
    for (DexInstruction insn : insns) {
      checkArgument(!insn.opcode().isBranch(), "cannot insert branch %s without a target", insn);
    }
    if (position == null) {
      for (int i = insns.size() - 1; i >= 0; i--) {
        fmethod.pushFront(MethodItemEntry.opcode(insns.get(i)));
      }
      return;
    }
    MethodItemEntry anchor = findOpcode(position);
    for (DexInstruction insn : insns) {
      MethodItemEntry e = MethodItemEntry.opcode(insn);
      fmethod.insertAfter(anchor, e);
      anchor = e;
    }
  }

  /**
   * Removes an instruction. The targets of a removed branch and the fallthrough marker in front of
   * the instruction go with it.
   */
  public void removeOpcode(DexInstruction insn) {
    MethodItemEntry entry = findOpcode(insn);
    if (insn.opcode().isBranch()) {
      removeBranchTargets(entry);
    }
    MethodItemEntry prev = fmethod.prev(entry);
    if (prev != null
        && prev.type() == MethodItemType.FALLTHROUGH
        && prev.throwingEntry() == entry) {
      fmethod.remove(prev);
    }
    arrayData.remove(entry);
    emptyPackedFirstKeys.remove(entry);
    fmethod.remove(entry);
  }

  private void removeBranchTargets(MethodItemEntry branch) {
    for (Iterator<MethodItemEntry> it = fmethod.iterator(); it.hasNext(); ) {
      MethodItemEntry e = it.next();
      if (e.type() == MethodItemType.TARGET && e.target().src() == branch) {
        it.remove();
      }
    }
  }

  /**
   * Removes the switch case(s) whose target markers directly precede {@code insn}; execution of
   * those keys then continues after the switch.
   */
  public void removeSwitchCase(DexInstruction insn) {
    MethodItemEntry entry = findOpcode(insn);
    List<MethodItemEntry> cases = new ArrayList<>();
    for (MethodItemEntry e = fmethod.prev(entry);
        e != null && !e.isOpcode();
        e = fmethod.prev(e)) {
      if (e.type() == MethodItemType.TARGET && e.target().type() == BranchTarget.Type.MULTI) {
        cases.add(e);
      }
    }
    checkArgument(!cases.isEmpty(), "no switch case targets %s", insn);
    cases.forEach(fmethod::remove);
  }

  public void pushBack(MethodItemEntry entry) {
    fmethod.pushBack(entry);
  }

  public void pushBack(DexInstruction insn) {
    checkArgument(!insn.opcode().isBranch(), "cannot append branch %s without a target", insn);
    fmethod.pushBack(MethodItemEntry.opcode(insn));
  }

  /** Size in code units of all instructions, payloads excluded. */
  public int sumOpcodeSizes() {
    int size = 0;
    for (DexInstruction insn : instructions()) {
      size += insn.size();
    }
    return size;
  }

  public int countOpcodes() {
    int count = 0;
    for (DexInstruction unused : instructions()) {
      count++;
    }
    return count;
  }

  /** Whether {@code entry} lies inside a try region. */
  public boolean isInTry(MethodItemEntry entry) {
    boolean inTry = false;
    for (MethodItemEntry e : fmethod) {
      if (e == entry) {
        return inTry;
      }
      if (e.type() == MethodItemType.TRY) {
        inTry = e.tryEntry().type() == TryEntry.Type.START;
      }
    }
    throw new IllegalArgumentException(entry + " is not part of this method");
  }

  public boolean hasTries() {
    for (MethodItemEntry e : fmethod) {
      if (e.type() == MethodItemType.TRY) {
        return true;
      }
    }
    return false;
  }

  @Nullable
  DexOpcodeData arrayDataOf(MethodItemEntry entry) {
    return arrayData.get(entry);
  }

  void putArrayData(MethodItemEntry entry, DexOpcodeData data) {
    arrayData.put(entry, data);
  }

  @Nullable
  Integer emptyPackedFirstKey(MethodItemEntry entry) {
    return emptyPackedFirstKeys.get(entry);
  }

  void putEmptyPackedFirstKey(MethodItemEntry entry, int key) {
    emptyPackedFirstKeys.put(entry, key);
  }

  /**
   * Renumbers every register of the method upward by {@code newRegs - registers_size}. The
   * parameters stay the top registers and {@code v0 .. v(delta - 1)} become free.
   *
   * @return false, leaving the method untouched, if {@code newRegs} is not encodable or a
   *     renumbered operand no longer fits its instruction
   */
  public static boolean enlargeRegs(DexMethod method, int newRegs) {
    DexCode code = checkNotNull(method.getCode(), "%s has no code", method);
    MethodTransform transform = code.getEntries();
    int oldRegs = code.getRegistersSize();
    checkArgument(newRegs >= oldRegs, "cannot shrink %s to %s registers", method, newRegs);
    if (newRegs > DexCode.MAX_REGISTERS) {
      logger.atFine().log("%s: %d registers exceed the encoding limit", method, newRegs);
      return false;
    }
    int delta = newRegs - oldRegs;
    if (delta == 0) {
      return true;
    }
    IntUnaryOperator shift = r -> r + delta;
    if (!RegisterRemapper.fits(transform.instructions(), shift)) {
      logger.atFine().log("%s: operands do not fit after growing to %d registers", method, newRegs);
      return false;
    }
    for (MethodItemEntry e : transform) {
      RegisterRemapper.remap(e, shift);
    }
    code.setRegistersSize(newRegs);
    return true;
  }

  public static void balloonAll(Scope scope) {
    for (DexClass cls : scope) {
      for (DexMethod m : cls.methods()) {
        DexCode code = m.getCode();
        if (code != null && !code.isBallooned()) {
          code.balloon();
        }
      }
    }
  }

  public static void syncAll(Scope scope) {
    for (DexClass cls : scope) {
      for (DexMethod m : cls.methods()) {
        DexCode code = m.getCode();
        if (code != null && code.isBallooned()) {
          code.sync();
        }
      }
    }
  }

  /** Lowers the item list into {@code code}. Use {@link DexCode#sync()}. */
  public void sync(DexCode code) {
    int gotos = 0;
    for (DexInstruction insn : instructions()) {
      if (insn.opcode().isGoto()) {
        gotos++;
      }
    }
    // Each failed attempt widens at least one goto, and a goto widens at most twice.
    int maxAttempts = 2 * gotos + 1;
    int attempts = 1;
    while (!trySync(code)) {
      attempts++;
      checkState(attempts <= maxAttempts, "sync did not converge after %s attempts", attempts);
    }
    cfg = null;
    logger.atFinest().log("synced in %d attempt(s)", attempts);
  }

  private boolean trySync(DexCode code) {
    int addr = 0;
    for (MethodItemEntry e : fmethod) {
      e.setAddr(addr);
      if (e.isOpcode()) {
        addr += e.insn().size();
      }
    }

    boolean allFit = true;
    Map<MethodItemEntry, List<MethodItemEntry>> cases = new IdentityHashMap<>();
    for (MethodItemEntry e : fmethod) {
      if (e.type() != MethodItemType.TARGET) {
        continue;
      }
      BranchTarget bt = e.target();
      MethodItemEntry src = bt.src();
      verify(fmethod.contains(src), "dangling branch target for %s", src);
      if (bt.type() == BranchTarget.Type.MULTI) {
        cases.computeIfAbsent(src, k -> new ArrayList<>()).add(e);
      } else {
        allFit &= encodeBranch(src, e.addr() - src.addr());
      }
    }
    if (!allFit) {
      return false;
    }

    List<DexInstruction> insns = new ArrayList<>();
    List<MethodItemEntry> payloadOwners = new ArrayList<>();
    for (MethodItemEntry e : fmethod) {
      if (!e.isOpcode()) {
        continue;
      }
      DexOpcode op = e.insn().opcode();
      if (op.isSwitch() || op == DexOpcode.FILL_ARRAY_DATA) {
        payloadOwners.add(e);
      }
    }
    Map<MethodItemEntry, DexOpcodeData> payloads = new IdentityHashMap<>();
    for (MethodItemEntry e : payloadOwners) {
      if (e.insn().opcode().isSwitch()) {
        payloads.put(e, buildSwitchPayload(e, cases.getOrDefault(e, ImmutableList.of())));
      } else {
        DexOpcodeData data = arrayData.get(e);
        checkState(data != null, "fill-array-data without data: %s", e);
        payloads.put(e, data);
      }
    }
    for (MethodItemEntry e : fmethod) {
      if (e.isOpcode()) {
        insns.add(e.insn());
      }
    }
    for (MethodItemEntry e : payloadOwners) {
      if ((addr & 1) != 0) {
        insns.add(new DexInstruction(DexOpcode.NOP));
        addr++;
      }
      DexOpcodeData payload = payloads.get(e);
      e.insn().setOffset(addr - e.addr());
      insns.add(payload);
      addr += payload.size();
    }

    code.setInstructions(insns);
    code.setTries(buildTries());
    code.setDebugEntries(buildDebugEntries());
    code.setOutsSize(Math.max(code.getOutsSize(), maxCallWords()));
    return true;
  }

  /**
   * Stores {@code offset} in the branch held by {@code src}. A goto that cannot hold it is widened
   * in place and false is returned so that addresses get recomputed.
   */
  private static boolean encodeBranch(MethodItemEntry src, int offset) {
    DexInstruction insn = src.insn();
    DexOpcode op = insn.opcode();
    if (op.isGoto()) {
      DexOpcode needed;
      if (offset != 0 && DexOpcode.GOTO.format().offsetFits(offset)) {
        needed = DexOpcode.GOTO;
      } else if (offset != 0 && DexOpcode.GOTO_16.format().offsetFits(offset)) {
        needed = DexOpcode.GOTO_16;
      } else {
        needed = DexOpcode.GOTO_32;
      }
      if (needed.format().codeUnits() > op.format().codeUnits()) {
        src.setInsn(new DexInstruction(needed));
        return false;
      }
      if (op == DexOpcode.GOTO_32 || offset != 0) {
        insn.setOffset(offset);
        return true;
      }
      src.setInsn(new DexInstruction(DexOpcode.GOTO_32));
      return false;
    }
    verify(
        offset != 0 && op.format().offsetFits(offset),
        "branch offset %s cannot be encoded by %s",
        offset,
        insn);
    insn.setOffset(offset);
    return true;
  }

  private DexOpcodeData buildSwitchPayload(MethodItemEntry sw, List<MethodItemEntry> caseTargets) {
    List<MethodItemEntry> sorted = new ArrayList<>(caseTargets);
    sorted.sort((a, b) -> Integer.compare(a.target().index(), b.target().index()));
    int n = sorted.size();
    int[] keys = new int[n];
    int[] rel = new int[n];
    for (int i = 0; i < n; i++) {
      keys[i] = sorted.get(i).target().index();
      rel[i] = sorted.get(i).addr() - sw.addr();
    }
    boolean contiguous = true;
    for (int i = 1; i < n; i++) {
      contiguous &= keys[i] == keys[i - 1] + 1;
    }
    DexInstruction insn = sw.insn();
    if (insn.opcode() == DexOpcode.PACKED_SWITCH) {
      if (contiguous) {
        Integer emptyKey = emptyPackedFirstKeys.get(sw);
        int first = n > 0 ? keys[0] : emptyKey == null ? 0 : emptyKey;
        return DexOpcodeData.packedSwitch(first, rel);
      }
      DexInstruction sparse = new DexInstruction(DexOpcode.SPARSE_SWITCH).setSrc(0, insn.src(0));
      sw.setInsn(sparse);
      logger.atFinest().log("re-encoding packed switch with %d keys as sparse", n);
    }
    return DexOpcodeData.sparseSwitch(keys, rel);
  }

  private List<DexTryItem> buildTries() {
    List<DexTryItem> tries = new ArrayList<>();
    MethodItemEntry open = null;
    for (MethodItemEntry e : fmethod) {
      if (e.type() != MethodItemType.TRY) {
        continue;
      }
      TryEntry t = e.tryEntry();
      if (t.type() == TryEntry.Type.START) {
        verify(open == null, "nested try start at %s", e.addr());
        open = e;
        continue;
      }
      verify(
          open != null && open.tryEntry().catchStart() == t.catchStart(),
          "unmatched try end at %s",
          e.addr());
      if (e.addr() > open.addr()) {
        tries.add(DexTryItem.create(open.addr(), e.addr() - open.addr(), handlers(t)));
      }
      open = null;
    }
    verify(open == null, "try region is never closed");
    return tries;
  }

  private ImmutableList<DexTryItem.CatchHandler> handlers(TryEntry t) {
    ImmutableList.Builder<DexTryItem.CatchHandler> handlers = ImmutableList.builder();
    for (MethodItemEntry c = t.catchStart(); c != null; c = c.catchEntry().next()) {
      verify(fmethod.contains(c), "catch handler is not part of the method");
      handlers.add(DexTryItem.CatchHandler.create(c.catchEntry().catchType(), c.addr()));
    }
    return handlers.build();
  }

  private List<DexDebugEntry> buildDebugEntries() {
    List<DexDebugEntry> entries = new ArrayList<>();
    for (MethodItemEntry e : fmethod) {
      if (e.type() == MethodItemType.POSITION) {
        entries.add(DexDebugEntry.position(e.addr(), e.position()));
      } else if (e.type() == MethodItemType.DEBUG) {
        entries.add(DexDebugEntry.instruction(e.addr(), e.debug()));
      }
    }
    return entries;
  }

  private int maxCallWords() {
    int words = 0;
    for (DexInstruction insn : instructions()) {
      DexOpcode op = insn.opcode();
      if (op.isInvoke() || op.isFilledNewArray()) {
        words = Math.max(words, insn.argWordCount());
      }
    }
    return words;
  }

  @Override
  public String toString() {
    return fmethod.toString();
  }
}
