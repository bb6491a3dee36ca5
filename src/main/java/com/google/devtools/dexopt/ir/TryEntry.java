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

/** Payload of a {@link MethodItemType#TRY} item. */
public final class TryEntry {
  /** Whether the marker opens or closes the region. */
  public enum Type {
    START,
    END
  }

  private final Type type;
  private final MethodItemEntry catchStart;

  public TryEntry(Type type, MethodItemEntry catchStart) {
    checkArgument(
        checkNotNull(catchStart).type() == MethodItemType.CATCH,
        "try marker must point at a catch item, got %s",
        catchStart.type());
    this.type = type;
    this.catchStart = catchStart;
  }

  public Type type() {
    return type;
  }

  /** First handler of the region's catch chain. */
  public MethodItemEntry catchStart() {
    return catchStart;
  }

  @Override
  public String toString() {
    return "TRY_" + type;
  }
}
