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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.devtools.dexopt.dex.AccessFlags;
import com.google.devtools.dexopt.dex.DexCode;
import com.google.devtools.dexopt.dex.DexCodeCodec;
import com.google.devtools.dexopt.dex.DexDebugEntry;
import com.google.devtools.dexopt.dex.DexDebugInstruction;
import com.google.devtools.dexopt.dex.DexFormatException;
import com.google.devtools.dexopt.dex.DexIdPool;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.dex.DexMethod;
import com.google.devtools.dexopt.dex.DexMethodRef;
import com.google.devtools.dexopt.dex.DexOpcode;
import com.google.devtools.dexopt.dex.DexOpcodeData;
import com.google.devtools.dexopt.dex.DexOpcodeMethod;
import com.google.devtools.dexopt.dex.DexProto;
import com.google.devtools.dexopt.dex.DexTryItem;
import com.google.devtools.dexopt.dex.DexType;
import com.google.devtools.dexopt.ir.ControlFlowGraph;
import com.google.devtools.dexopt.ir.MethodItemEntry;
import com.google.devtools.dexopt.ir.MethodItemType;
import com.google.devtools.dexopt.testutil.DexCodeBuilder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link MethodTransform}. */
@RunWith(JUnit4.class)
public class MethodTransformTest {
  private static final DexMethodRef LOG_INT =
      DexMethodRef.of(DexType.of("LLog;"), "log", DexProto.of(DexType.of("V"), DexType.of("I")));

  /**
   * Exercises every kind of item: a packed switch with a backward goto, a fill-array-data table, a
   * try region with a catch-all handler, positions and a local variable event.
   */
  private static DexCode everything() {
    return new DexCodeBuilder(3, 1)
        .outs(1)
        .position(10)
        .packedSwitch(2, 5, "a", "b")
        .add(new DexInstruction(DexOpcode.CONST_4).setDest(0).setLiteral(0))
        .debug(DexDebugInstruction.startLocal(0, "x", DexType.of("I")))
        .add(new DexInstruction(DexOpcode.RETURN).setSrc(0, 0))
        .label("a")
        .position(11)
        .fillArrayData(1, DexOpcodeData.fillArrayData(4, 2, new short[] {1, 0, 2, 0}))
        .label("start")
        .add(new DexOpcodeMethod(DexOpcode.INVOKE_STATIC, LOG_INT).setArgWordCount(1).setSrc(0, 2))
        .label("end")
        .add(new DexInstruction(DexOpcode.RETURN).setSrc(0, 2))
        .label("b")
        .branch(new DexInstruction(DexOpcode.GOTO), "a")
        .label("handler")
        .add(new DexInstruction(DexOpcode.MOVE_EXCEPTION).setDest(0))
        .add(new DexInstruction(DexOpcode.THROW).setSrc(0, 0))
        .tryCatch("start", "end", null, "handler")
        .build();
  }

  private static short[] encode(DexCode code) {
    return new DexCodeCodec(new DexIdPool()).encode(code);
  }

  private static List<DexInstruction> instructions(MethodTransform transform) {
    List<DexInstruction> insns = new ArrayList<>();
    transform.instructions().forEach(insns::add);
    return insns;
  }

  private static int countItems(MethodTransform transform, MethodItemType type) {
    int count = 0;
    for (MethodItemEntry e : transform) {
      if (e.type() == type) {
        count++;
      }
    }
    return count;
  }

  @Test
  public void balloonThenSync_reproducesCode() {
    DexCode code = everything();
    short[] units = encode(code);
    ImmutableList<DexTryItem> tries = code.getTries();
    ImmutableList<DexDebugEntry> debug = code.getDebugEntries();

    code.balloon();
    code.sync();

    assertThat(encode(code)).isEqualTo(units);
    assertThat(code.getTries()).isEqualTo(tries);
    assertThat(code.getDebugEntries()).isEqualTo(debug);
    assertThat(code.getRegistersSize()).isEqualTo(3);
    assertThat(code.getOutsSize()).isEqualTo(1);
  }

  @Test
  public void balloon_dropsPayloadsAndAlignment() {
    MethodTransform transform = MethodTransform.balloon(everything());

    for (DexInstruction insn : transform.instructions()) {
      assertThat(insn.isPayload()).isFalse();
      assertThat(insn.opcode()).isNotEqualTo(DexOpcode.NOP);
    }
    assertThat(transform.countOpcodes()).isEqualTo(9);
    assertThat(countItems(transform, MethodItemType.TARGET)).isEqualTo(3);
    assertThat(countItems(transform, MethodItemType.TRY)).isEqualTo(2);
    assertThat(countItems(transform, MethodItemType.CATCH)).isEqualTo(1);
    assertThat(countItems(transform, MethodItemType.POSITION)).isEqualTo(2);
    assertThat(countItems(transform, MethodItemType.DEBUG)).isEqualTo(1);
    assertThat(transform.hasTries()).isTrue();
  }

  @Test
  public void balloon_branchIntoInstructionFails() {
    DexCode code =
        new DexCode(
            1,
            0,
            0,
            ImmutableList.of(
                new DexInstruction(DexOpcode.CONST_16).setDest(0).setLiteral(300),
                new DexInstruction(DexOpcode.GOTO).setOffset(-1)),
            ImmutableList.of(),
            ImmutableList.of());

    assertThrows(DexFormatException.class, code::balloon);
  }

  @Test
  public void isInTry() {
    MethodTransform transform = MethodTransform.balloon(everything());

    List<Boolean> inTry = new ArrayList<>();
    for (MethodItemEntry e : transform) {
      if (e.isOpcode()) {
        inTry.add(transform.isInTry(e));
      }
    }

    assertThat(inTry)
        .containsExactly(false, false, false, false, true, false, false, false, false)
        .inOrder();
  }

  @Test
  public void insertAfter_nullPositionInsertsAtFront() {
    DexCode code = new DexCodeBuilder(1, 0).add(new DexInstruction(DexOpcode.RETURN_VOID)).build();
    code.balloon();
    MethodTransform transform = code.getEntries();
    DexInstruction first = new DexInstruction(DexOpcode.CONST_4).setDest(0).setLiteral(1);
    DexInstruction second = new DexInstruction(DexOpcode.CONST_4).setDest(0).setLiteral(2);

    transform.insertAfter(null, ImmutableList.of(first, second));
    code.sync();

    assertThat(code.getInstructions().subList(0, 2)).containsExactly(first, second).inOrder();
    assertThat(code.getInstructions().get(2).opcode()).isEqualTo(DexOpcode.RETURN_VOID);
  }

  @Test
  public void insertAfter_rejectsBranches() {
    MethodTransform transform = MethodTransform.balloon(everything());

    assertThrows(
        IllegalArgumentException.class,
        () -> transform.insertAfter(null, ImmutableList.of(new DexInstruction(DexOpcode.GOTO))));
  }

  @Test
  public void removeOpcode_branchTakesItsTargetAlong() {
    DexInstruction test = new DexInstruction(DexOpcode.IF_EQZ).setSrc(0, 0);
    DexCode code =
        new DexCodeBuilder(1, 1)
            .branch(test, "out")
            .add(new DexInstruction(DexOpcode.NOP))
            .label("out")
            .add(new DexInstruction(DexOpcode.RETURN_VOID))
            .build();
    code.balloon();
    MethodTransform transform = code.getEntries();

    transform.removeOpcode(test);

    assertThat(countItems(transform, MethodItemType.TARGET)).isEqualTo(0);
    code.sync();
    assertThat(code.sizeInCodeUnits()).isEqualTo(2);
  }

  @Test
  public void removeOpcode_unknownInstructionFails() {
    MethodTransform transform = MethodTransform.balloon(everything());

    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> transform.removeOpcode(new DexInstruction(DexOpcode.NOP)));
    assertThat(e).hasMessageThat().contains("No match found");
  }

  @Test
  public void replaceOpcode() {
    DexInstruction old = new DexInstruction(DexOpcode.CONST_4).setDest(0).setLiteral(1);
    DexCode code =
        new DexCodeBuilder(1, 0)
            .add(old)
            .add(new DexInstruction(DexOpcode.RETURN).setSrc(0, 0))
            .build();
    code.balloon();
    DexInstruction replacement = new DexInstruction(DexOpcode.CONST_16).setDest(0).setLiteral(1000);

    code.getEntries().replaceOpcode(old, replacement);
    code.sync();

    assertThat(code.getInstructions().get(0)).isSameInstanceAs(replacement);
    assertThat(code.sizeInCodeUnits()).isEqualTo(3);
  }

  @Test
  public void replaceOpcode_rejectsBranchReplacement() {
    DexInstruction nop = new DexInstruction(DexOpcode.NOP);
    DexCode code =
        new DexCodeBuilder(1, 0).add(nop).add(new DexInstruction(DexOpcode.RETURN_VOID)).build();
    MethodTransform transform = MethodTransform.balloon(code);

    assertThrows(
        IllegalArgumentException.class,
        () -> transform.replaceOpcode(nop, new DexInstruction(DexOpcode.GOTO)));
  }

  @Test
  public void replaceBranch_keepsTarget() {
    DexInstruction test = new DexInstruction(DexOpcode.IF_EQZ).setSrc(0, 0);
    DexCode code =
        new DexCodeBuilder(1, 1)
            .branch(test, "out")
            .add(new DexInstruction(DexOpcode.NOP))
            .label("out")
            .add(new DexInstruction(DexOpcode.RETURN_VOID))
            .build();
    code.balloon();
    DexInstruction inverted = new DexInstruction(DexOpcode.IF_NEZ).setSrc(0, 0);

    code.getEntries().replaceBranch(test, inverted);
    code.sync();

    assertThat(code.getInstructions().get(0)).isSameInstanceAs(inverted);
    assertThat(inverted.offset()).isEqualTo(3);
  }

  @Test
  public void replaceBranch_switchAndIfDoNotMix() {
    MethodTransform transform = MethodTransform.balloon(everything());
    DexInstruction sw = transform.instructions().iterator().next();

    assertThrows(
        IllegalArgumentException.class,
        () -> transform.replaceBranch(sw, new DexInstruction(DexOpcode.IF_EQZ)));
  }

  @Test
  public void sync_widensGotoWhenOffsetGrows() {
    DexInstruction jump = new DexInstruction(DexOpcode.GOTO);
    DexInstruction nop = new DexInstruction(DexOpcode.NOP);
    DexCode code =
        new DexCodeBuilder(1, 0)
            .branch(jump, "end")
            .add(nop)
            .label("end")
            .add(new DexInstruction(DexOpcode.RETURN_VOID))
            .build();
    code.balloon();
    List<DexInstruction> padding = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      padding.add(new DexInstruction(DexOpcode.NOP));
    }

    code.getEntries().insertAfter(nop, padding);
    code.sync();

    DexInstruction widened = code.getInstructions().get(0);
    assertThat(widened.opcode()).isEqualTo(DexOpcode.GOTO_16);
    assertThat(widened.offset()).isEqualTo(203);
  }

  @Test
  public void sync_selfLoopUsesGoto32() {
    DexCode code =
        new DexCodeBuilder(1, 0)
            .label("loop")
            .branch(new DexInstruction(DexOpcode.GOTO), "loop")
            .build();

    code.balloon();
    code.sync();

    DexInstruction jump = code.getInstructions().get(0);
    assertThat(jump.opcode()).isEqualTo(DexOpcode.GOTO_32);
    assertThat(jump.offset()).isEqualTo(0);
  }

  @Test
  public void removeSwitchCase_reencodesGappedPackedSwitchAsSparse() {
    DexInstruction middle = new DexInstruction(DexOpcode.CONST_4).setDest(0).setLiteral(1);
    DexCode code =
        new DexCodeBuilder(1, 1)
            .packedSwitch(0, 0, "c0", "c1", "c2")
            .label("c0")
            .add(new DexInstruction(DexOpcode.RETURN_VOID))
            .label("c1")
            .add(middle)
            .add(new DexInstruction(DexOpcode.RETURN).setSrc(0, 0))
            .label("c2")
            .add(new DexInstruction(DexOpcode.RETURN_VOID))
            .build();
    code.balloon();

    code.getEntries().removeSwitchCase(middle);
    code.sync();

    List<DexInstruction> insns = code.getInstructions();
    assertThat(insns.get(0).opcode()).isEqualTo(DexOpcode.SPARSE_SWITCH);
    DexOpcodeData payload = (DexOpcodeData) insns.get(insns.size() - 1);
    assertThat(payload.ident()).isEqualTo(DexOpcodeData.SPARSE_SWITCH_IDENT);
    assertThat(payload.switchKeys()).asList().containsExactly(0, 2).inOrder();
  }

  @Test
  public void removeSwitchCase_requiresCaseTarget() {
    DexInstruction ret = new DexInstruction(DexOpcode.RETURN_VOID);
    DexCode code = new DexCodeBuilder(1, 0).add(ret).build();
    MethodTransform transform = MethodTransform.balloon(code);

    assertThrows(IllegalArgumentException.class, () -> transform.removeSwitchCase(ret));
  }

  @Test
  public void cfg_failsAfterEdit() {
    MethodTransform transform = MethodTransform.balloon(everything());
    ControlFlowGraph cfg = transform.buildCfg();
    assertThat(transform.cfg()).isSameInstanceAs(cfg);

    transform.pushBack(new DexInstruction(DexOpcode.NOP));

    assertThrows(IllegalStateException.class, transform::cfg);
  }

  @Test
  public void sync_updatesOutsSize() {
    DexCode code =
        new DexCodeBuilder(1, 0)
            .add(new DexInstruction(DexOpcode.CONST_4).setDest(0).setLiteral(0))
            .add(new DexInstruction(DexOpcode.RETURN_VOID))
            .build();
    code.balloon();
    code.getEntries()
        .insertAfter(
            null,
            Collections.singletonList(
                new DexOpcodeMethod(DexOpcode.INVOKE_STATIC, LOG_INT)
                    .setArgWordCount(1)
                    .setSrc(0, 0)));

    code.sync();

    assertThat(code.getOutsSize()).isEqualTo(1);
  }

  @Test
  public void methodTransformer_syncsOnClose() {
    DexMethod method =
        new DexMethod(
            DexMethodRef.of(DexType.of("LFoo;"), "run", DexProto.of(DexType.of("V"))),
            AccessFlags.ACC_STATIC,
            new DexCodeBuilder(1, 0).add(new DexInstruction(DexOpcode.RETURN_VOID)).build());

    try (MethodTransformer mt = new MethodTransformer(method, true)) {
      assertThat(method.getCode().isBallooned()).isTrue();
      assertThat(mt.get().cfg().blocks()).hasSize(1);
      mt.get().insertAfter(null, ImmutableList.of(new DexInstruction(DexOpcode.NOP)));
    }

    assertThat(method.getCode().isBallooned()).isFalse();
    assertThat(method.getCode().getInstructions()).hasSize(2);
  }
}
