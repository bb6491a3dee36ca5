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

package com.google.devtools.dexopt.opt.removebuilders;

import com.google.devtools.dexopt.dataflow.AbstractState;
import java.util.BitSet;

/**
 * Registers that may hold a reference to the builder instance, or, for the field read analysis, a
 * value loaded from one of its fields. Bit {@link #RESULT} stands for the pending result of the
 * previous call, read by a following move-result.
 */
final class TaintedRegs implements AbstractState<TaintedRegs> {
  static final int RESULT = 1 << 16;

  private final BitSet regs;

  TaintedRegs() {
    this(new BitSet());
  }

  private TaintedRegs(BitSet regs) {
    this.regs = regs;
  }

  boolean isTainted(int reg) {
    return regs.get(reg);
  }

  void set(int reg, boolean tainted) {
    regs.set(reg, tainted);
  }

  @Override
  public TaintedRegs copy() {
    return new TaintedRegs((BitSet) regs.clone());
  }

  @Override
  public void meet(TaintedRegs other) {
    regs.or(other.regs);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TaintedRegs && regs.equals(((TaintedRegs) o).regs);
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
