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

import static com.google.common.truth.Truth.assertThat;

import com.google.devtools.dexopt.dex.DexCode;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.dex.DexOpcode;
import com.google.devtools.dexopt.ir.ControlFlowGraph;
import com.google.devtools.dexopt.testutil.DexCodeBuilder;
import com.google.devtools.dexopt.transform.MethodTransform;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Liveness} and the {@link Dataflow} solver behind it. */
@RunWith(JUnit4.class)
public class LivenessTest {

  @Test
  public void straightLine() {
    DexInstruction c0 = new DexInstruction(DexOpcode.CONST_4).setDest(0).setLiteral(1);
    DexInstruction c1 = new DexInstruction(DexOpcode.CONST_4).setDest(1).setLiteral(2);
    DexInstruction add =
        new DexInstruction(DexOpcode.ADD_INT).setDest(2).setSrc(0, 0).setSrc(1, 1);
    DexInstruction ret = new DexInstruction(DexOpcode.RETURN).setSrc(0, 2);
    DexCode code = new DexCodeBuilder(3, 0).add(c0).add(c1).add(add).add(ret).build();

    Map<DexInstruction, Liveness.LiveRegs> live = liveOut(code);

    assertThat(live.get(c0).bits().stream().toArray()).asList().containsExactly(0);
    assertThat(live.get(c1).bits().stream().toArray()).asList().containsExactly(0, 1);
    assertThat(live.get(add).bits().stream().toArray()).asList().containsExactly(2);
    assertThat(live.get(ret).bits().isEmpty()).isTrue();
  }

  @Test
  public void loop_keepsCounterLiveAroundBackEdge() {
    DexInstruction init = new DexInstruction(DexOpcode.CONST_4).setDest(0).setLiteral(3);
    DexInstruction dec =
        new DexInstruction(DexOpcode.ADD_INT_LIT8).setDest(0).setSrc(0, 0).setLiteral(-1);
    DexInstruction test = new DexInstruction(DexOpcode.IF_NEZ).setSrc(0, 0);
    DexInstruction ret = new DexInstruction(DexOpcode.RETURN_VOID);
    DexCode code =
        new DexCodeBuilder(1, 0)
            .add(init)
            .label("loop")
            .add(dec)
            .branch(test, "loop")
            .add(ret)
            .build();

    Map<DexInstruction, Liveness.LiveRegs> live = liveOut(code);

    assertThat(live.get(init).isLive(0)).isTrue();
    assertThat(live.get(dec).isLive(0)).isTrue();
    assertThat(live.get(test).isLive(0)).isTrue();
    assertThat(live.get(ret).isLive(0)).isFalse();
  }

  @Test
  public void widePairs() {
    DexInstruction wide = new DexInstruction(DexOpcode.CONST_WIDE_16).setDest(0).setLiteral(7);
    DexInstruction ret = new DexInstruction(DexOpcode.RETURN_WIDE).setSrc(0, 0);
    DexCode code = new DexCodeBuilder(2, 0).add(wide).add(ret).build();

    Liveness.LiveRegs afterConst = liveOut(code).get(wide);

    assertThat(afterConst.isLive(0)).isTrue();
    assertThat(afterConst.isLive(1)).isTrue();
  }

  @Test
  public void unreachableBlocksStillGetAState() {
    DexInstruction ret = new DexInstruction(DexOpcode.RETURN_VOID);
    DexInstruction dead = new DexInstruction(DexOpcode.RETURN).setSrc(0, 0);
    DexCode code = new DexCodeBuilder(1, 0).add(ret).add(dead).build();

    Map<DexInstruction, Liveness.LiveRegs> live = liveOut(code);

    assertThat(live).hasSize(2);
    assertThat(live.get(dead).bits().isEmpty()).isTrue();
  }

  @Test
  public void resultIsDeterministic() {
    MethodTransform transform = MethodTransform.balloon(diamond());
    ControlFlowGraph cfg = transform.buildCfg();

    Map<DexInstruction, Liveness.LiveRegs> first = Liveness.liveOut(cfg);
    Map<DexInstruction, Liveness.LiveRegs> second = Liveness.liveOut(cfg);

    for (DexInstruction insn : transform.instructions()) {
      assertThat(second.get(insn)).isEqualTo(first.get(insn));
    }
    assertThat(second).hasSize(first.size());
  }

  private static DexCode diamond() {
    return new DexCodeBuilder(2, 1)
        .branch(new DexInstruction(DexOpcode.IF_EQZ).setSrc(0, 1), "other")
        .add(new DexInstruction(DexOpcode.CONST_4).setDest(0).setLiteral(1))
        .branch(new DexInstruction(DexOpcode.GOTO), "join")
        .label("other")
        .add(new DexInstruction(DexOpcode.CONST_4).setDest(0).setLiteral(2))
        .label("join")
        .add(new DexInstruction(DexOpcode.RETURN).setSrc(0, 0))
        .build();
  }

  private static Map<DexInstruction, Liveness.LiveRegs> liveOut(DexCode code) {
    MethodTransform transform = MethodTransform.balloon(code);
    ControlFlowGraph cfg = transform.buildCfg();
    return Liveness.liveOut(cfg);
  }
}
