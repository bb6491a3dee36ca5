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

/**
 * Maps the logical operands of an opcode (destination, sources) onto the register fields of its
 * {@link InstructionFormat}. Values are indices into the format's register field list.
 */
public enum RegisterLayout {
  NONE(-1),
  DEST(0),
  SRC(-1, 0),
  DEST_SRC(0, 1),
  DEST_SRC_SRC(0, 1, 2),
  SRC_SRC(-1, 0, 1),
  SRC_SRC_SRC(-1, 0, 1, 2),
  /** binop/2addr: vA is both the destination and the first source. */
  TWO_ADDR(0, 0, 1),
  /** check-cast: the checked register is rewritten in place. */
  DEST_IS_SRC(0, 0),
  /** 35c argument list, sized by the argument word count. */
  ARGS(-1, 0, 1, 2, 3, 4),
  /** 3rc register range; exposes no individual sources. */
  RANGE(-1);

  private final int destField;
  private final int[] srcFields;

  RegisterLayout(int destField, int... srcFields) {
    this.destField = destField;
    this.srcFields = srcFields;
  }

  public boolean hasDest() {
    return destField >= 0;
  }

  int destField() {
    return destField;
  }

  int srcField(int i) {
    return srcFields[i];
  }

  int maxSrcs() {
    return srcFields.length;
  }

  public boolean destIsSrc0() {
    return destField >= 0 && srcFields.length > 0 && srcFields[0] == destField;
  }
}
