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

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A debug-info state change other than a position. Local variable events name a register, which is
 * renumbered together with the code.
 */
public final class DexDebugInstruction {
  /** Kinds of debug events. */
  public enum Kind {
    START_LOCAL(true),
    END_LOCAL(true),
    RESTART_LOCAL(true),
    PROLOGUE_END(false),
    EPILOGUE_BEGIN(false);

    private final boolean hasRegister;

    Kind(boolean hasRegister) {
      this.hasRegister = hasRegister;
    }

    public boolean hasRegister() {
      return hasRegister;
    }
  }

  private final Kind kind;
  private int register;
  @Nullable private final String name;
  @Nullable private final DexType type;

  private DexDebugInstruction(
      Kind kind, int register, @Nullable String name, @Nullable DexType type) {
    this.kind = kind;
    this.register = register;
    this.name = name;
    this.type = type;
  }

  public static DexDebugInstruction startLocal(int register, String name, DexType type) {
    return new DexDebugInstruction(Kind.START_LOCAL, register, name, type);
  }

  public static DexDebugInstruction endLocal(int register) {
    return new DexDebugInstruction(Kind.END_LOCAL, register, null, null);
  }

  public static DexDebugInstruction restartLocal(int register) {
    return new DexDebugInstruction(Kind.RESTART_LOCAL, register, null, null);
  }

  public static DexDebugInstruction of(Kind kind) {
    checkArgument(!kind.hasRegister(), "%s needs a register", kind);
    return new DexDebugInstruction(kind, -1, null, null);
  }

  public Kind kind() {
    return kind;
  }

  public boolean hasRegister() {
    return kind.hasRegister();
  }

  public int register() {
    checkState(hasRegister(), "%s has no register", kind);
    return register;
  }

  public void setRegister(int register) {
    checkState(hasRegister(), "%s has no register", kind);
    this.register = register;
  }

  @Nullable
  public String name() {
    return name;
  }

  @Nullable
  public DexType type() {
    return type;
  }

  public DexDebugInstruction copy() {
    return new DexDebugInstruction(kind, register, name, type);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof DexDebugInstruction)) {
      return false;
    }
    DexDebugInstruction that = (DexDebugInstruction) o;
    return kind == that.kind
        && register == that.register
        && Objects.equals(name, that.name)
        && Objects.equals(type, that.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, register, name, type);
  }

  @Override
  public String toString() {
    return hasRegister() ? kind + " v" + register : kind.toString();
  }
}
