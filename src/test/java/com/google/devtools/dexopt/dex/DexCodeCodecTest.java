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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link DexCodeCodec}. */
@RunWith(JUnit4.class)
public class DexCodeCodecTest {
  private static final DexType STRING = DexType.of("Ljava/lang/String;");
  private static final DexMethodRef VALUE_OF =
      DexMethodRef.of(STRING, "valueOf", DexProto.of(STRING, DexType.of("I")));

  private DexIdPool pool;
  private DexCodeCodec codec;

  @Before
  public void setUp() {
    pool = new DexIdPool();
    codec = new DexCodeCodec(pool);
  }

  private DexCode decode(short... units) {
    return codec.decode(2, 0, 1, units, ImmutableList.of(), ImmutableList.of());
  }

  @Test
  public void decode_simpleInstructions() {
    DexCode code =
        decode(
            (short) 0x1012, // const/4 v0, #1
            (short) 0x0038, (short) 0x0003, // if-eqz v0, +3
            (short) 0x000f, // return v0
            (short) 0x000e); // return-void

    assertThat(code.getInstructions()).hasSize(4);
    DexInstruction constInsn = code.getInstructions().get(0);
    assertThat(constInsn.opcode()).isEqualTo(DexOpcode.CONST_4);
    assertThat(constInsn.dest()).isEqualTo(0);
    assertThat(constInsn.literal()).isEqualTo(1);
    DexInstruction branch = code.getInstructions().get(1);
    assertThat(branch.opcode()).isEqualTo(DexOpcode.IF_EQZ);
    assertThat(branch.offset()).isEqualTo(3);
    assertThat(code.sizeInCodeUnits()).isEqualTo(5);
  }

  @Test
  public void decode_resolvesReferences() {
    pool.intern("hello");
    pool.intern(VALUE_OF);
    DexCode code =
        decode(
            (short) 0x001a, (short) 0x0000, // const-string v0, string@0
            (short) 0x2071, (short) 0x0000, (short) 0x0010, // invoke-static {v0, v1}, method@0
            (short) 0x0011); // return-object v0

    DexOpcodeString constString = (DexOpcodeString) code.getInstructions().get(0);
    assertThat(constString.getString()).isEqualTo("hello");
    DexOpcodeMethod invoke = (DexOpcodeMethod) code.getInstructions().get(1);
    assertThat(invoke.getMethod()).isEqualTo(VALUE_OF);
    assertThat(invoke.argWordCount()).isEqualTo(2);
    assertThat(invoke.src(0)).isEqualTo(0);
    assertThat(invoke.src(1)).isEqualTo(1);
  }

  @Test
  public void decodeThenEncode_reproducesInput() {
    pool.intern("hello");
    short[] units = {
      0x001a, 0x0000, // const-string v0, string@0
      0x002b, 0x0004, 0x0000, // packed-switch v0, +4
      0x000e, // return-void
      0x0100, 0x0001, 0x0005, 0x0000, 0x0003, 0x0000 // packed-switch payload: key 5 -> +3
    };
    DexCode code = decode(units);

    assertThat(code.getInstructions()).hasSize(4);
    DexOpcodeData payload = (DexOpcodeData) code.getInstructions().get(3);
    assertThat(payload.switchKeys()).asList().containsExactly(5);
    assertThat(codec.encode(code)).isEqualTo(units);
  }

  @Test
  public void encode_assignsIndicesFromPool() {
    DexCode code =
        new DexCode(
            1,
            0,
            0,
            ImmutableList.of(
                new DexOpcodeString(DexOpcode.CONST_STRING, "b"),
                new DexInstruction(DexOpcode.RETURN_VOID)),
            ImmutableList.of(),
            ImmutableList.of());
    pool.intern("a");

    short[] units = codec.encode(code);

    assertThat(units[1]).isEqualTo((short) 1);
    assertThat(pool.string(1)).isEqualTo("b");
  }

  @Test
  public void decode_truncatedInstruction_throws() {
    DexFormatException e = assertThrows(DexFormatException.class, () -> decode((short) 0x0038));
    assertThat(e.getAddress()).isEqualTo(0);
  }

  @Test
  public void decode_badIndex_throws() {
    DexFormatException e =
        assertThrows(
            DexFormatException.class,
            () -> decode((short) 0x000e, (short) 0x001a, (short) 0x0007));
    assertThat(e.getAddress()).isEqualTo(1);
    assertThat(e).hasCauseThat().isInstanceOf(IndexOutOfBoundsException.class);
  }

  @Test
  public void decode_tryPastEnd_throws() {
    DexTryItem tryItem =
        DexTryItem.create(0, 4, ImmutableList.of(DexTryItem.CatchHandler.catchAll(0)));
    assertThrows(
        DexFormatException.class,
        () ->
            codec.decode(
                1,
                0,
                0,
                new short[] {0x000e},
                ImmutableList.of(tryItem),
                ImmutableList.of()));
  }
}
