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

package com.google.devtools.dexopt.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Payload of a {@link MethodItemType#TARGET} item. The target names the item holding the branch
 * that jumps here; for switches there is one MULTI target per case, indexed by the case key.
 */
public final class BranchTarget {
  /** SIMPLE for gotos and conditional branches, MULTI for switch cases. */
  public enum Type {
    SIMPLE,
    MULTI
  }

  private final Type type;
  private MethodItemEntry src;
  private final int index;

  private BranchTarget(Type type, MethodItemEntry src, int index) {
    checkArgument(checkNotNull(src).type() == MethodItemType.OPCODE, "branch source %s", src);
    this.type = type;
    this.src = src;
    this.index = index;
  }

  public static BranchTarget simple(MethodItemEntry src) {
    return new BranchTarget(Type.SIMPLE, src, 0);
  }

  public static BranchTarget multi(MethodItemEntry src, int caseKey) {
    return new BranchTarget(Type.MULTI, src, caseKey);
  }

  public Type type() {
    return type;
  }

  public MethodItemEntry src() {
    return src;
  }

  public void setSrc(MethodItemEntry src) {
    checkArgument(checkNotNull(src).type() == MethodItemType.OPCODE, "branch source %s", src);
    this.src = src;
  }

  /** Case key of a MULTI target. */
  public int index() {
    return index;
  }

  @Override
  public String toString() {
    return type == Type.SIMPLE ? "TARGET <- " + src.insn() : "CASE " + index + " <- " + src.insn();
  }
}
