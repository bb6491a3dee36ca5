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
import static com.google.common.base.Preconditions.checkNotNull;

/** An instruction whose index operand refers to a field. */
public final class DexOpcodeField extends DexInstruction {
  private DexFieldRef field;

  public DexOpcodeField(DexOpcode opcode, DexFieldRef field) {
    super(opcode);
    checkArgument(
        opcode.referenceKind() == ReferenceKind.FIELD,
        "%s does not reference a field",
        opcode);
    this.field = checkNotNull(field);
  }

  DexOpcodeField(DexOpcode opcode, short[] units, DexFieldRef field) {
    super(opcode, units);
    this.field = checkNotNull(field);
  }

  private DexOpcodeField(DexOpcodeField other) {
    super(other);
    this.field = other.field;
  }

  public DexFieldRef getField() {
    return field;
  }

  public void setField(DexFieldRef field) {
    this.field = checkNotNull(field);
  }

  @Override
  public DexOpcodeField copy() {
    return new DexOpcodeField(this);
  }

  @Override
  String referenceText() {
    return field.toString();
  }
}
