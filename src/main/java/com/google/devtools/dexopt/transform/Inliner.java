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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.dexopt.dataflow.InstructionRegisters;
import com.google.devtools.dexopt.dex.DexCode;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.dex.DexMethod;
import com.google.devtools.dexopt.dex.DexOpcode;
import com.google.devtools.dexopt.dex.DexOpcodeMethod;
import com.google.devtools.dexopt.dex.DexType;
import com.google.devtools.dexopt.ir.BranchTarget;
import com.google.devtools.dexopt.ir.FatMethod;
import com.google.devtools.dexopt.ir.MethodItemEntry;
import com.google.devtools.dexopt.ir.MethodItemType;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.function.IntUnaryOperator;
import javax.annotation.Nullable;

/**
 * Splices callee bodies into callers. Both inliners leave the caller ballooned with a stale
 * control-flow graph, and report encoding limits by returning false before changing anything.
 */
public final class Inliner {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Register count addressable by the 4-bit operands of the 12x/22x/35c formats. */
  public static final int MAX_16_REGS = 16;

  private Inliner() {}

  /** A parameter of the callee: its first register word relative to the first input. */
  private record ParamSlot(int firstWord, int words, boolean isReference) {}

  /**
   * Inlines {@code callee} at {@code invoke}, a call site in the context's caller. Callee locals
   * get fresh registers below the caller's, parameters are read straight from the argument
   * registers unless the callee writes them while the caller still needs the value.
   *
   * @return false if the merged method would need more than {@value #MAX_16_REGS} registers, or if
   *     both methods have try regions around the call site
   */
  public static boolean inline16Regs(
      InlineContext context, DexMethod callee, DexOpcodeMethod invoke) {
    DexMethod caller = context.caller();
    checkArgument(caller != callee, "cannot inline %s into itself", caller);
    DexCode callerCode = caller.getCode();
    DexCode calleeCode = checkNotNull(callee.getCode(), "%s has no code", callee);
    MethodTransform transform = callerCode.getEntries();
    MethodTransform calleeTransform = entriesOf(calleeCode);
    MethodItemEntry invokeEntry = transform.findOpcode(invoke);

    if (calleeTransform.hasTries() && transform.isInTry(invokeEntry)) {
      logger.atFine().log("not inlining %s: nested try regions in %s", callee, caller);
      return false;
    }

    int[] args = argRegisters(invoke);
    int ins = calleeCode.getInsSize();
    checkArgument(
        args.length == ins, "%s passes %s words to %s (ins=%s)", invoke, args.length, callee, ins);
    int locals = calleeCode.getRegistersSize() - ins;
    BitSet written = writtenRegisters(calleeTransform);

    List<ParamSlot> copied = new ArrayList<>();
    int copyWords = 0;
    for (ParamSlot p : paramSlots(callee)) {
      boolean paramWritten = false;
      boolean callerNeedsValue = false;
      for (int w = p.firstWord(); w < p.firstWord() + p.words(); w++) {
        paramWritten |= written.get(locals + w);
        callerNeedsValue |= context.isLiveOut(invoke, args[w]) || isAliased(args, w);
      }
      if (paramWritten && callerNeedsValue) {
        copied.add(p);
        copyWords += p.words();
      }
    }

    int newRegs = callerCode.getRegistersSize() + locals + copyWords;
    if (newRegs > MAX_16_REGS) {
      logger.atFine().log("not inlining %s into %s: needs %d registers", callee, caller, newRegs);
      return false;
    }
    int delta = locals + copyWords;
    int[] paramMap = new int[ins];
    for (int w = 0; w < ins; w++) {
      paramMap[w] = args[w] + delta;
    }
    int next = locals;
    for (ParamSlot p : copied) {
      for (int w = p.firstWord(); w < p.firstWord() + p.words(); w++) {
        paramMap[w] = next++;
      }
    }
    IntUnaryOperator map = r -> r < locals ? r : paramMap[r - locals];
    if (!RegisterRemapper.fits(calleeTransform.instructions(), map)) {
      logger.atFine().log("not inlining %s into %s: operands do not fit", callee, caller);
      return false;
    }
    if (!MethodTransform.enlargeRegs(caller, newRegs)) {
      return false;
    }

    FatMethod items = transform.items();
    removeFallthrough(items, invokeEntry);
    MethodItemEntry callerPosition = lastPositionBefore(items, invokeEntry);
    for (ParamSlot p : copied) {
      DexOpcode op =
          p.words() == 2
              ? DexOpcode.MOVE_WIDE
              : p.isReference() ? DexOpcode.MOVE_OBJECT : DexOpcode.MOVE;
      DexInstruction move =
          new DexInstruction(op)
              .setDest(paramMap[p.firstWord()])
              .setSrc(0, args[p.firstWord()] + delta);
      items.insertBefore(invokeEntry, MethodItemEntry.opcode(move));
    }
    List<MethodItemEntry> body =
        new MethodSplicer(calleeTransform, transform, map).spliceBefore(invokeEntry);

    MethodItemEntry moveResult = nextOpcode(items, invokeEntry);
    if (moveResult != null && !moveResult.insn().opcode().isMoveResult()) {
      moveResult = null;
    }
    // Null when the call ends the method; markers then go to the end.
    MethodItemEntry continuation = items.next(moveResult != null ? moveResult : invokeEntry);
    MethodItemEntry lastOpcode = null;
    for (MethodItemEntry e : body) {
      if (e.isOpcode()) {
        lastOpcode = e;
      }
    }
    boolean bodyHasPosition = false;
    for (MethodItemEntry e : body) {
      bodyHasPosition |= e.type() == MethodItemType.POSITION;
      if (!e.isOpcode() || !e.insn().opcode().isReturn()) {
        continue;
      }
      DexInstruction ret = e.insn();
      if (moveResult != null && ret.opcode() != DexOpcode.RETURN_VOID) {
        DexInstruction move =
            new DexInstruction(moveFor(moveResult.insn().opcode()))
                .setDest(moveResult.insn().dest())
                .setSrc(0, ret.src(0));
        items.insertBefore(e, MethodItemEntry.opcode(move));
      }
      if (e == lastOpcode) {
        items.remove(e);
      } else {
        e.setInsn(new DexInstruction(DexOpcode.GOTO));
        items.insertBefore(continuation, MethodItemEntry.target(BranchTarget.simple(e)));
      }
    }
    if (bodyHasPosition && callerPosition != null) {
      items.insertBefore(continuation, MethodItemEntry.position(callerPosition.position()));
    }

    if (moveResult != null) {
      transform.removeOpcode(moveResult.insn());
    }
    transform.removeOpcode(invoke);
    context.addEstimatedInsnSize(calleeTransform.sumOpcodeSizes());
    logger.atFine().log("inlined %s into %s (%d registers)", callee, caller, newRegs);
    return true;
  }

  /**
   * Inlines {@code callee} at {@code invoke}, which must be followed only by an optional
   * move-result and a return of its value (or return-void). Since nothing of the caller runs after
   * the call, callee locals may reuse any caller register that does not hold an argument.
   *
   * @return false if the registers cannot be encoded, if a parameter the callee writes is passed
   *     twice, or if the return is also reached from elsewhere
   */
  public static boolean inlineTailCall(DexMethod caller, DexMethod callee, DexInstruction invoke) {
    checkArgument(caller != callee, "cannot inline %s into itself", caller);
    DexCode callerCode = checkNotNull(caller.getCode(), "%s has no code", caller);
    DexCode calleeCode = checkNotNull(callee.getCode(), "%s has no code", callee);
    MethodTransform transform = callerCode.getEntries();
    MethodTransform calleeTransform = entriesOf(calleeCode);
    FatMethod items = transform.items();
    MethodItemEntry invokeEntry = transform.findOpcode(invoke);

    MethodItemEntry moveResult = nextOpcode(items, invokeEntry);
    if (moveResult != null && !moveResult.insn().opcode().isMoveResult()) {
      moveResult = null;
    }
    MethodItemEntry ret = nextOpcode(items, moveResult != null ? moveResult : invokeEntry);
    checkArgument(
        ret != null && ret.insn().opcode().isReturn(), "%s is not followed by a return", invoke);
    DexOpcode retOp = ret.insn().opcode();
    if (moveResult == null) {
      checkArgument(retOp == DexOpcode.RETURN_VOID, "%s discards the result of %s", ret, invoke);
    } else {
      checkArgument(
          retOp != DexOpcode.RETURN_VOID && ret.insn().src(0) == moveResult.insn().dest(),
          "%s does not return the result of %s",
          ret,
          invoke);
    }
    for (MethodItemEntry e = items.next(invokeEntry); e != ret; e = items.next(e)) {
      if (e.type() == MethodItemType.TARGET || e.type() == MethodItemType.TRY) {
        logger.atFine().log("not inlining %s: the return of %s is shared", callee, caller);
        return false;
      }
    }
    if (calleeTransform.hasTries() && transform.isInTry(invokeEntry)) {
      logger.atFine().log("not inlining %s: nested try regions in %s", callee, caller);
      return false;
    }

    int[] args = argRegisters(invoke);
    int ins = calleeCode.getInsSize();
    checkArgument(
        args.length == ins, "%s passes %s words to %s (ins=%s)", invoke, args.length, callee, ins);
    int locals = calleeCode.getRegistersSize() - ins;
    BitSet written = writtenRegisters(calleeTransform);
    for (int w = 0; w < ins; w++) {
      if (written.get(locals + w) && isAliased(args, w)) {
        logger.atFine().log("not inlining %s: writes aliased parameter word %d", callee, w);
        return false;
      }
    }

    int regs = callerCode.getRegistersSize();
    int base = freeRun(args, regs, locals);
    int delta = 0;
    if (base < 0) {
      base = 0;
      delta = locals;
    }
    int localBase = base;
    int shift = delta;
    IntUnaryOperator map = r -> r < locals ? localBase + r : args[r - locals] + shift;
    if (!RegisterRemapper.fits(calleeTransform.instructions(), map)) {
      logger.atFine().log("not inlining %s into %s: operands do not fit", callee, caller);
      return false;
    }
    if (delta > 0 && !MethodTransform.enlargeRegs(caller, regs + delta)) {
      return false;
    }

    removeFallthrough(items, invokeEntry);
    List<MethodItemEntry> body =
        new MethodSplicer(calleeTransform, transform, map).spliceBefore(invokeEntry);
    if (retOp == DexOpcode.RETURN_VOID) {
      for (MethodItemEntry e : body) {
        if (e.isOpcode() && e.insn().opcode().isReturn()) {
          e.setInsn(new DexInstruction(DexOpcode.RETURN_VOID));
        }
      }
    }
    transform.removeOpcode(ret.insn());
    if (moveResult != null) {
      transform.removeOpcode(moveResult.insn());
    }
    transform.removeOpcode(invoke);
    logger.atFine().log("inlined tail call to %s into %s", callee, caller);
    return true;
  }

  private static MethodTransform entriesOf(DexCode code) {
    return code.isBallooned() ? code.getEntries() : MethodTransform.balloon(code);
  }

  /** The argument registers of a call, one per parameter word. */
  public static int[] argRegisters(DexInstruction invoke) {
    checkArgument(invoke.opcode().isInvoke(), "%s is not an invoke", invoke);
    if (invoke.hasRange()) {
      int[] args = new int[invoke.rangeSize()];
      for (int i = 0; i < args.length; i++) {
        args[i] = invoke.rangeBase() + i;
      }
      return args;
    }
    int[] args = new int[invoke.srcsSize()];
    for (int i = 0; i < args.length; i++) {
      args[i] = invoke.src(i);
    }
    return args;
  }

  private static ImmutableList<ParamSlot> paramSlots(DexMethod method) {
    ImmutableList.Builder<ParamSlot> slots = ImmutableList.builder();
    int word = 0;
    if (!method.isStatic()) {
      slots.add(new ParamSlot(word++, 1, true));
    }
    for (DexType t : method.ref().proto().parameters()) {
      slots.add(new ParamSlot(word, t.registerWords(), t.isReference()));
      word += t.registerWords();
    }
    return slots.build();
  }

  private static BitSet writtenRegisters(MethodTransform transform) {
    BitSet written = new BitSet();
    for (DexInstruction insn : transform.instructions()) {
      written.or(InstructionRegisters.defs(insn));
    }
    return written;
  }

  private static boolean isAliased(int[] args, int word) {
    for (int i = 0; i < args.length; i++) {
      if (i != word && args[i] == args[word]) {
        return true;
      }
    }
    return false;
  }

  /** Lowest base of {@code size} consecutive registers below {@code regs} holding no argument. */
  private static int freeRun(int[] args, int regs, int size) {
    BitSet taken = new BitSet();
    for (int a : args) {
      taken.set(a);
    }
    for (int base = 0; base + size <= regs; base++) {
      int nextTaken = taken.nextSetBit(base);
      if (nextTaken < 0 || nextTaken >= base + size) {
        return base;
      }
    }
    return -1;
  }

  private static DexOpcode moveFor(DexOpcode moveResult) {
    switch (moveResult) {
      case MOVE_RESULT_WIDE:
        return DexOpcode.MOVE_WIDE;
      case MOVE_RESULT_OBJECT:
        return DexOpcode.MOVE_OBJECT;
      default:
        return DexOpcode.MOVE;
    }
  }

  @Nullable
  private static MethodItemEntry nextOpcode(FatMethod items, MethodItemEntry from) {
    for (MethodItemEntry e = items.next(from); e != null; e = items.next(e)) {
      if (e.isOpcode()) {
        return e;
      }
    }
    return null;
  }

  private static void removeFallthrough(FatMethod items, MethodItemEntry insn) {
    MethodItemEntry prev = items.prev(insn);
    if (prev != null
        && prev.type() == MethodItemType.FALLTHROUGH
        && prev.throwingEntry() == insn) {
      items.remove(prev);
    }
  }

  @Nullable
  private static MethodItemEntry lastPositionBefore(FatMethod items, MethodItemEntry insn) {
    for (MethodItemEntry e = items.prev(insn); e != null; e = items.prev(e)) {
      if (e.type() == MethodItemType.POSITION) {
        return e;
      }
    }
    return null;
  }
}
