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

import com.google.devtools.dexopt.dex.DexDebugInstruction;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.ir.MethodItemEntry;
import com.google.devtools.dexopt.ir.MethodItemType;
import java.util.function.IntUnaryOperator;

/** Renumbers the registers of instructions and debug events through a mapping. */
final class RegisterRemapper {

  private RegisterRemapper() {}

  /**
   * Whether every operand of {@code insns} still fits its field after mapping, with register pairs
   * and ranges kept contiguous.
   */
  static boolean fits(Iterable<DexInstruction> insns, IntUnaryOperator map) {
    for (DexInstruction insn : insns) {
      if (!fits(insn, map)) {
        return false;
      }
    }
    return true;
  }

  static boolean fits(DexInstruction insn, IntUnaryOperator map) {
    if (insn.hasDest()
        && !fitsOperand(insn.dest(), insn.isDestWide(), insn.destBitWidth(), map)) {
      return false;
    }
    for (int i = 0; i < insn.srcsSize(); i++) {
      if (!fitsOperand(insn.src(i), insn.isSrcWide(i), insn.srcBitWidth(i), map)) {
        return false;
      }
    }
    if (insn.hasRange() && insn.rangeSize() > 0) {
      int base = map.applyAsInt(insn.rangeBase());
      if (!fitsWidth(base, insn.rangeBaseBitWidth())) {
        return false;
      }
      for (int i = 1; i < insn.rangeSize(); i++) {
        if (map.applyAsInt(insn.rangeBase() + i) != base + i) {
          return false;
        }
      }
    }
    return true;
  }

  private static boolean fitsOperand(int reg, boolean wide, int width, IntUnaryOperator map) {
    int mapped = map.applyAsInt(reg);
    if (!fitsWidth(mapped, width)) {
      return false;
    }
    return !wide || map.applyAsInt(reg + 1) == mapped + 1;
  }

  static boolean fitsWidth(int reg, int width) {
    return reg >= 0 && reg < (1 << width);
  }

  /** Rewrites the instruction's operands in place. Callers check {@link #fits} first. */
  static void remap(DexInstruction insn, IntUnaryOperator map) {
    int dest = insn.hasDest() ? map.applyAsInt(insn.dest()) : -1;
    int[] srcs = new int[insn.srcsSize()];
    for (int i = 0; i < srcs.length; i++) {
      srcs[i] = map.applyAsInt(insn.src(i));
    }
    if (dest >= 0) {
      insn.setDest(dest);
    }
    for (int i = 0; i < srcs.length; i++) {
      insn.setSrc(i, srcs[i]);
    }
    if (insn.hasRange() && insn.rangeSize() > 0) {
      insn.setRangeBase(map.applyAsInt(insn.rangeBase()));
    }
  }

  static void remap(MethodItemEntry entry, IntUnaryOperator map) {
    if (entry.type() == MethodItemType.OPCODE) {
      remap(entry.insn(), map);
    } else if (entry.type() == MethodItemType.DEBUG) {
      DexDebugInstruction debug = entry.debug();
      if (debug.hasRegister()) {
        debug.setRegister(map.applyAsInt(debug.register()));
      }
    }
  }
}
