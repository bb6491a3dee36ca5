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

package com.google.devtools.dexopt.dataflow;

import com.google.devtools.dexopt.dex.DexInstruction;
import java.util.BitSet;

/** Registers read and written by an instruction, with register pairs expanded. */
public final class InstructionRegisters {

  private InstructionRegisters() {}

  /** Every register the instruction reads. */
  public static BitSet uses(DexInstruction insn) {
    BitSet uses = new BitSet();
    if (insn.hasRange()) {
      uses.set(insn.rangeBase(), insn.rangeBase() + insn.rangeSize());
      return uses;
    }
    for (int i = 0; i < insn.srcsSize(); i++) {
      int reg = insn.src(i);
      uses.set(reg);
      if (insn.isSrcWide(i)) {
        uses.set(reg + 1);
      }
    }
    return uses;
  }

  /** Every register the instruction writes. */
  public static BitSet defs(DexInstruction insn) {
    BitSet defs = new BitSet();
    if (insn.hasDest()) {
      defs.set(insn.dest());
      if (insn.isDestWide()) {
        defs.set(insn.dest() + 1);
      }
    }
    return defs;
  }
}
