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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Dalvik instruction formats. The name encodes the size in code units, the number of registers
 * and an operand kind (x: none, n/s/h/b/i/l: literal, t: branch offset, c: constant pool index, rc:
 * register range).
 *
 * <p>Register fields are listed in operand order (vA, vB, vC). For {@link #F35C} the order is
 * vC, vD, vE, vF, vG, which is the order in which the arguments are passed.
 */
public enum InstructionFormat {
  F10X(1, 0, 0, 0),
  F12X(1, 0, 0, 0, OperandField.of(0, 8, 4), OperandField.of(0, 12, 4)),
  F11N(1, 4, 0, 0, OperandField.of(0, 8, 4)),
  F11X(1, 0, 0, 0, OperandField.of(0, 8, 8)),
  F10T(1, 0, 8, 0),
  F20T(2, 0, 16, 0),
  F22X(2, 0, 0, 0, OperandField.of(0, 8, 8), OperandField.of(1, 0, 16)),
  F21T(2, 0, 16, 0, OperandField.of(0, 8, 8)),
  F21S(2, 16, 0, 0, OperandField.of(0, 8, 8)),
  F21H(2, 16, 0, 0, OperandField.of(0, 8, 8)),
  F21C(2, 0, 0, 16, OperandField.of(0, 8, 8)),
  F23X(2, 0, 0, 0, OperandField.of(0, 8, 8), OperandField.of(1, 0, 8), OperandField.of(1, 8, 8)),
  F22B(2, 8, 0, 0, OperandField.of(0, 8, 8), OperandField.of(1, 0, 8)),
  F22T(2, 0, 16, 0, OperandField.of(0, 8, 4), OperandField.of(0, 12, 4)),
  F22S(2, 16, 0, 0, OperandField.of(0, 8, 4), OperandField.of(0, 12, 4)),
  F22C(2, 0, 0, 16, OperandField.of(0, 8, 4), OperandField.of(0, 12, 4)),
  F32X(3, 0, 0, 0, OperandField.of(1, 0, 16), OperandField.of(2, 0, 16)),
  F30T(3, 0, 32, 0),
  F31T(3, 0, 32, 0, OperandField.of(0, 8, 8)),
  F31I(3, 32, 0, 0, OperandField.of(0, 8, 8)),
  F31C(3, 0, 0, 32, OperandField.of(0, 8, 8)),
  F35C(
      3,
      0,
      0,
      16,
      OperandField.of(2, 0, 4),
      OperandField.of(2, 4, 4),
      OperandField.of(2, 8, 4),
      OperandField.of(2, 12, 4),
      OperandField.of(0, 8, 4)),
  F3RC(3, 0, 0, 16, OperandField.of(2, 0, 16)),
  F51L(5, 64, 0, 0, OperandField.of(0, 8, 8));

  private final int codeUnits;
  private final int literalBits;
  private final int offsetBits;
  private final int indexBits;
  private final ImmutableList<OperandField> registerFields;

  InstructionFormat(
      int codeUnits, int literalBits, int offsetBits, int indexBits, OperandField... registers) {
    this.codeUnits = codeUnits;
    this.literalBits = literalBits;
    this.offsetBits = offsetBits;
    this.indexBits = indexBits;
    this.registerFields = ImmutableList.copyOf(registers);
  }

  /** Size of an instruction of this format, in 16-bit code units. */
  public int codeUnits() {
    return codeUnits;
  }

  public int literalBits() {
    return literalBits;
  }

  public int offsetBits() {
    return offsetBits;
  }

  public int indexBits() {
    return indexBits;
  }

  ImmutableList<OperandField> registerFields() {
    return registerFields;
  }

  /** The argument word count field of {@link #F35C} and {@link #F3RC}, null elsewhere. */
  @Nullable
  OperandField countField() {
    switch (this) {
      case F35C:
        return OperandField.of(0, 12, 4);
      case F3RC:
        return OperandField.of(0, 8, 8);
      default:
        return null;
    }
  }

  /** Whether {@code offset} can be stored in the branch offset field of this format. */
  public boolean offsetFits(int offset) {
    switch (offsetBits) {
      case 8:
        return offset >= Byte.MIN_VALUE && offset <= Byte.MAX_VALUE;
      case 16:
        return offset >= Short.MIN_VALUE && offset <= Short.MAX_VALUE;
      case 32:
        return true;
      default:
        return false;
    }
  }
}
