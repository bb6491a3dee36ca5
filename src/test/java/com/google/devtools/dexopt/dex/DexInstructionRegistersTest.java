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

package com.google.devtools.dexopt.dex;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.function.ObjIntConsumer;
import java.util.function.ToIntFunction;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Register operand round trips of {@link DexInstruction}, for every opcode. */
@RunWith(TestParameterInjector.class)
public class DexInstructionRegistersTest {

  @TestParameter private DexOpcode opcode;

  private record Operand(
      String name,
      int width,
      ToIntFunction<DexInstruction> get,
      ObjIntConsumer<DexInstruction> set) {
    int max() {
      return (1 << width) - 1;
    }
  }

  private DexInstruction newInstruction() {
    DexInstruction insn = new DexInstruction(opcode);
    if (opcode.format() == InstructionFormat.F35C) {
      insn.setArgWordCount(5);
    }
    return insn;
  }

  private static ImmutableList<Operand> operands(DexInstruction insn) {
    ImmutableList.Builder<Operand> operands = ImmutableList.builder();
    if (insn.hasDest()) {
      operands.add(
          new Operand("dest", insn.destBitWidth(), DexInstruction::dest, DexInstruction::setDest));
    }
    for (int i = 0; i < insn.srcsSize(); i++) {
      int index = i;
      operands.add(
          new Operand(
              "src" + i,
              insn.srcBitWidth(i),
              in -> in.src(index),
              (in, v) -> in.setSrc(index, v)));
    }
    if (insn.hasRange()) {
      operands.add(
          new Operand(
              "range",
              insn.rangeBaseBitWidth(),
              DexInstruction::rangeBase,
              DexInstruction::setRangeBase));
    }
    return operands.build();
  }

  private boolean aliased(Operand a, Operand b) {
    if (a.name().equals(b.name())) {
      return true;
    }
    boolean destAndSrc0 =
        (a.name().equals("dest") && b.name().equals("src0"))
            || (a.name().equals("src0") && b.name().equals("dest"));
    return destAndSrc0 && opcode.layout().destIsSrc0();
  }

  @Test
  public void setThenGet_returnsValue() {
    DexInstruction insn = newInstruction();
    for (Operand op : operands(insn)) {
      for (int v : new int[] {0, 1, op.max() / 2, op.max()}) {
        op.set().accept(insn, v);
        assertWithMessage("%s %s", opcode, op.name()).that(op.get().applyAsInt(insn)).isEqualTo(v);
      }
    }
  }

  @Test
  public void set_leavesOtherOperandsUnchanged() {
    DexInstruction insn = newInstruction();
    ImmutableList<Operand> operands = operands(insn);
    for (Operand target : operands) {
      for (Operand other : operands) {
        other.set().accept(insn, other.max());
      }
      target.set().accept(insn, 0);
      for (Operand other : operands) {
        int expected = aliased(target, other) ? 0 : other.max();
        assertWithMessage("%s: %s after setting %s", opcode, other.name(), target.name())
            .that(other.get().applyAsInt(insn))
            .isEqualTo(expected);
      }

      for (Operand other : operands) {
        other.set().accept(insn, 0);
      }
      target.set().accept(insn, target.max());
      for (Operand other : operands) {
        int expected = aliased(target, other) ? target.max() : 0;
        assertWithMessage("%s: %s after setting %s", opcode, other.name(), target.name())
            .that(other.get().applyAsInt(insn))
            .isEqualTo(expected);
      }
    }
  }

  @Test
  public void set_preservesOpcodeAndLiteral() {
    DexInstruction insn = newInstruction();
    if (insn.hasLiteral()) {
      insn.setLiteral(-1);
    }
    for (Operand op : operands(insn)) {
      op.set().accept(insn, op.max());
    }
    assertThat(insn.opcode()).isEqualTo(opcode);
    assertThat(insn.units[0] & 0xff).isEqualTo(opcode.value());
    if (insn.hasLiteral()) {
      assertThat(insn.literal()).isEqualTo(-1);
    }
  }

  @Test
  public void operandCounts_matchLayout() {
    DexInstruction insn = newInstruction();
    assertThat(insn.hasDest()).isEqualTo(opcode.layout().hasDest());
    if (opcode.layout() == RegisterLayout.ARGS) {
      assertThat(insn.srcsSize()).isEqualTo(5);
    } else if (opcode.hasRange()) {
      assertThat(insn.srcsSize()).isEqualTo(0);
    }
    if (insn.destIsSrc0()) {
      assertThat(insn.srcsSize()).isAtLeast(1);
      assertThat(insn.destBitWidth()).isEqualTo(insn.srcBitWidth(0));
    }
  }
}
