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
 * An invoke. The argument registers live in the instruction's source operands (or its register
 * range); the callee's {@link DexProto} decides how many words they span.
 */
public final class DexOpcodeMethod extends DexInstruction {
  private DexMethodRef method;

  public DexOpcodeMethod(DexOpcode opcode, DexMethodRef method) {
    super(opcode);
    checkArgument(
        opcode.referenceKind() == ReferenceKind.METHOD,
        "%s does not reference a method",
        opcode);
    this.method = checkNotNull(method);
  }

  DexOpcodeMethod(DexOpcode opcode, short[] units, DexMethodRef method) {
    super(opcode, units);
    this.method = checkNotNull(method);
  }

  private DexOpcodeMethod(DexOpcodeMethod other) {
    super(other);
    this.method = other.method;
  }

  public DexMethodRef getMethod() {
    return method;
  }

  public void setMethod(DexMethodRef method) {
    this.method = checkNotNull(method);
  }

  @Override
  public DexOpcodeMethod copy() {
    return new DexOpcodeMethod(this);
  }

  @Override
  String referenceText() {
    return method.toString();
  }
}
