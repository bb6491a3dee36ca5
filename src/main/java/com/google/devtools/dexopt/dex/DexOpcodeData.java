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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * A payload pseudo-instruction: a packed-switch, sparse-switch or fill-array-data table. Payloads
 * are encoded with the {@code nop} opcode and a non-zero high byte identifying their kind.
 */
public final class DexOpcodeData extends DexInstruction {
  public static final int PACKED_SWITCH_IDENT = 0x0100;
  public static final int SPARSE_SWITCH_IDENT = 0x0200;
  public static final int FILL_ARRAY_DATA_IDENT = 0x0300;

  DexOpcodeData(short[] units) {
    super(DexOpcode.NOP, units);
    int ident = units[0] & 0xffff;
    checkArgument(
        ident == PACKED_SWITCH_IDENT
            || ident == SPARSE_SWITCH_IDENT
            || ident == FILL_ARRAY_DATA_IDENT,
        "not a payload: 0x%s",
        Integer.toHexString(ident));
  }

  /** Whether the code unit at {@code addr} starts a payload. */
  static boolean isPayloadStart(short[] code, int addr) {
    int unit = code[addr] & 0xffff;
    return unit == PACKED_SWITCH_IDENT
        || unit == SPARSE_SWITCH_IDENT
        || unit == FILL_ARRAY_DATA_IDENT;
  }

  /**
   * Size in code units of the payload starting at {@code addr}.
   *
   * @throws DexFormatException if the header runs past the end of {@code code}
   */
  static int payloadSize(short[] code, int addr) {
    int ident = code[addr] & 0xffff;
    int header = ident == SPARSE_SWITCH_IDENT ? 2 : 4;
    if (addr + header > code.length) {
      throw new DexFormatException("truncated payload header", addr);
    }
    int size = code[addr + 1] & 0xffff;
    switch (ident) {
      case PACKED_SWITCH_IDENT:
        return 4 + size * 2;
      case SPARSE_SWITCH_IDENT:
        return 2 + size * 4;
      default:
        long count = (code[addr + 2] & 0xffffL) | ((code[addr + 3] & 0xffffL) << 16);
        long bytes = count * size;
        if (bytes > Integer.MAX_VALUE) {
          throw new DexFormatException("array payload too large", addr);
        }
        return 4 + (int) ((bytes + 1) / 2);
    }
  }

  public static DexOpcodeData packedSwitch(int firstKey, int[] targets) {
    short[] units = new short[4 + targets.length * 2];
    units[0] = (short) PACKED_SWITCH_IDENT;
    units[1] = (short) targets.length;
    write32(units, 2, firstKey);
    for (int i = 0; i < targets.length; i++) {
      write32(units, 4 + i * 2, targets[i]);
    }
    return new DexOpcodeData(units);
  }

  public static DexOpcodeData sparseSwitch(int[] keys, int[] targets) {
    checkArgument(keys.length == targets.length, "keys and targets differ in length");
    short[] units = new short[2 + keys.length * 4];
    units[0] = (short) SPARSE_SWITCH_IDENT;
    units[1] = (short) keys.length;
    for (int i = 0; i < keys.length; i++) {
      write32(units, 2 + i * 2, keys[i]);
      write32(units, 2 + keys.length * 2 + i * 2, targets[i]);
    }
    return new DexOpcodeData(units);
  }

  /**
   * An array payload of {@code count} elements of {@code elementWidth} bytes each, packed
   * little-endian into {@code data}.
   */
  public static DexOpcodeData fillArrayData(int elementWidth, int count, short[] data) {
    checkArgument(
        elementWidth == 1 || elementWidth == 2 || elementWidth == 4 || elementWidth == 8,
        "bad element width %s",
        elementWidth);
    checkArgument(
        data.length == (count * elementWidth + 1) / 2, "%s elements need more data", count);
    short[] units = new short[4 + data.length];
    units[0] = (short) FILL_ARRAY_DATA_IDENT;
    units[1] = (short) elementWidth;
    write32(units, 2, count);
    System.arraycopy(data, 0, units, 4, data.length);
    return new DexOpcodeData(units);
  }

  public int ident() {
    return units[0] & 0xffff;
  }

  public boolean isSwitchPayload() {
    return ident() == PACKED_SWITCH_IDENT || ident() == SPARSE_SWITCH_IDENT;
  }

  /** Number of cases of a switch payload. */
  public int caseCount() {
    checkState(isSwitchPayload(), "not a switch payload");
    return units[1] & 0xffff;
  }

  /** Case keys of a switch payload, in table order. */
  public int[] switchKeys() {
    int n = caseCount();
    int[] keys = new int[n];
    if (ident() == PACKED_SWITCH_IDENT) {
      int first = read32(units, 2);
      for (int i = 0; i < n; i++) {
        keys[i] = first + i;
      }
    } else {
      for (int i = 0; i < n; i++) {
        keys[i] = read32(units, 2 + i * 2);
      }
    }
    return keys;
  }

  /** Case targets of a switch payload, relative to the address of the switch instruction. */
  public int[] switchTargets() {
    int n = caseCount();
    int base = ident() == PACKED_SWITCH_IDENT ? 4 : 2 + n * 2;
    int[] targets = new int[n];
    for (int i = 0; i < n; i++) {
      targets[i] = read32(units, base + i * 2);
    }
    return targets;
  }

  /** First key of a packed switch; kept so that empty tables round-trip. */
  public int packedFirstKey() {
    checkState(ident() == PACKED_SWITCH_IDENT, "not a packed switch payload");
    return read32(units, 2);
  }

  private static int read32(short[] units, int at) {
    return (units[at] & 0xffff) | (units[at + 1] << 16);
  }

  private static void write32(short[] units, int at, int value) {
    units[at] = (short) value;
    units[at + 1] = (short) (value >>> 16);
  }

  @Override
  public boolean isPayload() {
    return true;
  }

  @Override
  public DexOpcodeData copy() {
    return new DexOpcodeData(units.clone());
  }

  @Override
  public String toString() {
    switch (ident()) {
      case PACKED_SWITCH_IDENT:
        return "packed-switch-payload[" + caseCount() + "]";
      case SPARSE_SWITCH_IDENT:
        return "sparse-switch-payload[" + caseCount() + "]";
      default:
        return "fill-array-data-payload[" + (units.length - 4) + " units]";
    }
  }
}
