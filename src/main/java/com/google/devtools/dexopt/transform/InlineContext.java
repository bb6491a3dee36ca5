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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.devtools.dexopt.dataflow.Liveness;
import com.google.devtools.dexopt.dataflow.Liveness.LiveRegs;
import com.google.devtools.dexopt.dex.DexCode;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.dex.DexMethod;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * State carried across several inlinings into the same caller. The liveness of the caller is
 * computed once, in the register numbering the caller had when the context was created.
 *
 * <p>Not thread-safe; a context belongs to the thread transforming its caller.
 */
public final class InlineContext {
  private final DexMethod caller;
  private final int originalRegs;
  @Nullable private final Map<DexInstruction, LiveRegs> liveOut;
  private long estimatedInsnSize;

  /**
   * @param caller a method whose code is ballooned
   * @param useLiveness whether to compute liveness; without it every caller register counts as
   *     live across a call site
   */
  public InlineContext(DexMethod caller, boolean useLiveness) {
    this.caller = caller;
    DexCode code = checkNotNull(caller.getCode(), "%s has no code", caller);
    MethodTransform transform = code.getEntries();
    this.originalRegs = code.getRegistersSize();
    this.estimatedInsnSize = transform.sumOpcodeSizes();
    this.liveOut = useLiveness ? Liveness.liveOut(transform.buildCfg()) : null;
  }

  public DexMethod caller() {
    return caller;
  }

  public int originalRegs() {
    return originalRegs;
  }

  public long estimatedInsnSize() {
    return estimatedInsnSize;
  }

  void addEstimatedInsnSize(long size) {
    estimatedInsnSize += size;
  }

  /**
   * Whether {@code reg}, in the caller's current numbering, may be read after {@code insn}.
   * Registers added since the context was created and instructions it does not know are
   * conservatively live.
   */
  public boolean isLiveOut(DexInstruction insn, int reg) {
    if (liveOut == null) {
      return true;
    }
    LiveRegs live = liveOut.get(insn);
    int original = reg - (caller.getCode().getRegistersSize() - originalRegs);
    if (live == null || original < 0) {
      return true;
    }
    return live.isLive(original);
  }
}
