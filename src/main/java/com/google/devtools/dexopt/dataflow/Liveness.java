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
import com.google.devtools.dexopt.ir.ControlFlowGraph;
import java.util.BitSet;
import java.util.Map;

/** Backward liveness of registers. */
public final class Liveness {

  private Liveness() {}

  /** The set of registers that may be read before being written again. */
  public static final class LiveRegs implements AbstractState<LiveRegs> {
    private final BitSet regs;

    public LiveRegs() {
      this(new BitSet());
    }

    private LiveRegs(BitSet regs) {
      this.regs = regs;
    }

    public boolean isLive(int reg) {
      return regs.get(reg);
    }

    public BitSet bits() {
      return (BitSet) regs.clone();
    }

    @Override
    public LiveRegs copy() {
      return new LiveRegs((BitSet) regs.clone());
    }

    @Override
    public void meet(LiveRegs other) {
      regs.or(other.regs);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof LiveRegs && regs.equals(((LiveRegs) o).regs);
    }

    @Override
    public int hashCode() {
      return regs.hashCode();
    }

    @Override
    public String toString() {
      return regs.toString();
    }
  }

  static void transfer(DexInstruction insn, LiveRegs live) {
    live.regs.andNot(InstructionRegisters.defs(insn));
    live.regs.or(InstructionRegisters.uses(insn));
  }

  /** Registers live right after each instruction. */
  public static Map<DexInstruction, LiveRegs> liveOut(ControlFlowGraph cfg) {
    return Dataflow.backwards(cfg, new LiveRegs(), Liveness::transfer);
  }
}
