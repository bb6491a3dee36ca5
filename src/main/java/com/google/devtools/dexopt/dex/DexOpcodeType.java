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

/** new-instance, check-cast, instance-of, const-class and the array allocators. */
public final class DexOpcodeType extends DexInstruction {
  private DexType type;

  public DexOpcodeType(DexOpcode opcode, DexType type) {
    super(opcode);
    checkArgument(
        opcode.referenceKind() == ReferenceKind.TYPE,
        "%s does not reference a type",
        opcode);
    this.type = checkNotNull(type);
  }

  DexOpcodeType(DexOpcode opcode, short[] units, DexType type) {
    super(opcode, units);
    this.type = checkNotNull(type);
  }

  private DexOpcodeType(DexOpcodeType other) {
    super(other);
    this.type = other.type;
  }

  public DexType getType() {
    return type;
  }

  public void setType(DexType type) {
    this.type = checkNotNull(type);
  }

  @Override
  public DexOpcodeType copy() {
    return new DexOpcodeType(this);
  }

  @Override
  String referenceText() {
    return type.toString();
  }
}
