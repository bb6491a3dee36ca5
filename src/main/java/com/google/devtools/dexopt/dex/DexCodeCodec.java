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

import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts between the code-unit encoding of a method body and {@link DexCode}. Index operands are
 * resolved through, and on encoding re-assigned from, a {@link DexIdPool}. Decoding followed by
 * encoding reproduces the input exactly.
 */
public final class DexCodeCodec {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final DexIdPool pool;

  public DexCodeCodec(DexIdPool pool) {
    this.pool = pool;
  }

  /**
   * Decodes a code item.
   *
   * @throws DexFormatException if an instruction is truncated or an index is out of range
   */
  public DexCode decode(
      int registersSize,
      int insSize,
      int outsSize,
      short[] insns,
      List<DexTryItem> tries,
      List<DexDebugEntry> debugEntries) {
    List<DexInstruction> decoded = new ArrayList<>();
    int addr = 0;
    while (addr < insns.length) {
      DexInstruction insn = decodeInstruction(insns, addr);
      decoded.add(insn);
      addr += insn.size();
    }
    for (DexTryItem t : tries) {
      if (t.endAddress() > insns.length) {
        throw new DexFormatException("try region past end of code", t.startAddress());
      }
    }
    logger.atFinest().log("decoded %d instructions in %d code units", decoded.size(), addr);
    return new DexCode(registersSize, insSize, outsSize, decoded, tries, debugEntries);
  }

  DexInstruction decodeInstruction(short[] code, int addr) {
    if (DexOpcodeData.isPayloadStart(code, addr)) {
      int size = DexOpcodeData.payloadSize(code, addr);
      return new DexOpcodeData(slice(code, addr, size));
    }
    DexOpcode op = DexOpcode.fromValue(code[addr] & 0xff);
    short[] units = slice(code, addr, op.format().codeUnits());
    try {
      switch (op.referenceKind()) {
        case STRING:
          return new DexOpcodeString(op, units, pool.string(indexOf(op, units)));
        case TYPE:
          return new DexOpcodeType(op, units, pool.type(indexOf(op, units)));
        case FIELD:
          return new DexOpcodeField(op, units, pool.field(indexOf(op, units)));
        case METHOD:
          return new DexOpcodeMethod(op, units, pool.method(indexOf(op, units)));
        case NONE:
          return new DexInstruction(op, units);
      }
    } catch (IndexOutOfBoundsException e) {
      throw new DexFormatException("bad " + op.referenceKind() + " index in " + op, addr, e);
    }
    throw new AssertionError(op.referenceKind());
  }

  private static int indexOf(DexOpcode op, short[] units) {
    return op.format().indexBits() == 32
        ? (units[1] & 0xffff) | (units[2] << 16)
        : units[1] & 0xffff;
  }

  private static short[] slice(short[] code, int addr, int size) {
    if (addr + size > code.length) {
      throw new DexFormatException("truncated instruction", addr);
    }
    return Arrays.copyOfRange(code, addr, addr + size);
  }

  /**
   * Encodes the instructions of a code item in binary form, assigning index operands from the
   * pool.
   */
  public short[] encode(DexCode code) {
    List<DexInstruction> insns = code.getInstructions();
    short[] out = new short[code.sizeInCodeUnits()];
    int pos = 0;
    for (DexInstruction insn : insns) {
      if (insn instanceof DexOpcodeString) {
        insn.setIndex(pool.intern(((DexOpcodeString) insn).getString()));
      } else if (insn instanceof DexOpcodeType) {
        insn.setIndex(pool.intern(((DexOpcodeType) insn).getType()));
      } else if (insn instanceof DexOpcodeField) {
        insn.setIndex(pool.intern(((DexOpcodeField) insn).getField()));
      } else if (insn instanceof DexOpcodeMethod) {
        insn.setIndex(pool.intern(((DexOpcodeMethod) insn).getMethod()));
      }
      insn.writeTo(out, pos);
      pos += insn.size();
    }
    return out;
  }
}
