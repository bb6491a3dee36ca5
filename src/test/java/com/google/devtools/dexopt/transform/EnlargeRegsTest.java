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

import com.google.devtools.dexopt.dex.AccessFlags;
import com.google.devtools.dexopt.dex.DexCode;
import com.google.devtools.dexopt.dex.DexDebugEntry;
import com.google.devtools.dexopt.dex.DexDebugInstruction;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.dex.DexMethod;
import com.google.devtools.dexopt.dex.DexMethodRef;
import com.google.devtools.dexopt.dex.DexOpcode;
import com.google.devtools.dexopt.dex.DexProto;
import com.google.devtools.dexopt.dex.DexType;
import com.google.devtools.dexopt.testutil.DexCodeBuilder;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests for {@link MethodTransform#enlargeRegs}. */
@RunWith(TestParameterInjector.class)
public class EnlargeRegsTest {
  private static final DexType INT = DexType.of("I");

  private static DexMethod method(DexCode code) {
    return new DexMethod(
        DexMethodRef.of(DexType.of("LFoo;"), "sum", DexProto.of(INT, INT, INT)),
        AccessFlags.ACC_STATIC,
        code);
  }

  /** int sum(int a, int b) with two locals; the parameters live in v2 and v3. */
  private static DexCode sum() {
    return new DexCodeBuilder(4, 2)
        .add(new DexInstruction(DexOpcode.ADD_INT).setDest(0).setSrc(0, 2).setSrc(1, 3))
        .debug(DexDebugInstruction.startLocal(0, "s", INT))
        .add(new DexInstruction(DexOpcode.MOVE).setDest(1).setSrc(0, 0))
        .add(new DexInstruction(DexOpcode.RETURN).setSrc(0, 1))
        .build();
  }

  @Test
  public void shiftsEveryRegisterAndKeepsParametersOnTop(
      @TestParameter({"1", "3", "8"}) int delta) {
    DexMethod method = method(sum());
    method.getCode().balloon();

    assertThat(MethodTransform.enlargeRegs(method, 4 + delta)).isTrue();
    method.getCode().sync();

    DexCode code = method.getCode();
    assertThat(code.getRegistersSize()).isEqualTo(4 + delta);
    List<DexInstruction> insns = code.getInstructions();
    DexInstruction add = insns.get(0);
    assertThat(add.dest()).isEqualTo(delta);
    assertThat(add.src(0)).isEqualTo(code.getRegistersSize() - code.getInsSize());
    assertThat(add.src(1)).isEqualTo(code.getRegistersSize() - 1);
    assertThat(insns.get(1).dest()).isEqualTo(1 + delta);
    assertThat(insns.get(2).src(0)).isEqualTo(1 + delta);
    DexDebugEntry local = code.getDebugEntries().get(0);
    assertThat(local.getInstruction().register()).isEqualTo(delta);
  }

  @Test
  public void sameSizeIsANoOp() {
    DexMethod method = method(sum());
    method.getCode().balloon();

    assertThat(MethodTransform.enlargeRegs(method, 4)).isTrue();
    method.getCode().sync();

    assertThat(method.getCode().getInstructions().get(0).dest()).isEqualTo(0);
  }

  @Test
  public void failsPastEncodingLimit() {
    DexMethod method = method(sum());
    method.getCode().balloon();

    assertThat(MethodTransform.enlargeRegs(method, DexCode.MAX_REGISTERS + 1)).isFalse();

    assertThat(method.getCode().getRegistersSize()).isEqualTo(4);
  }

  @Test
  public void failsWhenNarrowOperandOverflows_leavingMethodUntouched() {
    DexInstruction narrow =
        new DexInstruction(DexOpcode.ADD_INT_2ADDR).setDest(13).setSrc(1, 14);
    DexCode code =
        new DexCodeBuilder(16, 2)
            .add(narrow)
            .add(new DexInstruction(DexOpcode.RETURN).setSrc(0, 13))
            .build();
    DexMethod method = method(code);
    code.balloon();

    assertThat(MethodTransform.enlargeRegs(method, 19)).isFalse();

    assertThat(code.getRegistersSize()).isEqualTo(16);
    assertThat(narrow.dest()).isEqualTo(13);
    assertThat(narrow.src(1)).isEqualTo(14);
  }
}
