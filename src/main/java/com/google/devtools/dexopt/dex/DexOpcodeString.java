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

/**
 * const-string and const-string/jumbo. The string itself is kept rather than its pool index, so a
 * method can be moved between dex files without renumbering.
 */
public final class DexOpcodeString extends DexInstruction {
  private String string;

  public DexOpcodeString(DexOpcode opcode, String string) {
    super(opcode);
    checkArgument(
        opcode.referenceKind() == ReferenceKind.STRING,
        "%s does not reference a string",
        opcode);
    this.string = checkNotNull(string);
  }

  DexOpcodeString(DexOpcode opcode, short[] units, String string) {
    super(opcode, units);
    this.string = checkNotNull(string);
  }

  private DexOpcodeString(DexOpcodeString other) {
    super(other);
    this.string = other.string;
  }

  public String getString() {
    return string;
  }

  public void setString(String string) {
    this.string = checkNotNull(string);
  }

  @Override
  public DexOpcodeString copy() {
    return new DexOpcodeString(this);
  }

  @Override
  String referenceText() {
    return "\"" + string + "\"";
  }
}
