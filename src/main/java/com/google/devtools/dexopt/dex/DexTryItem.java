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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * A try region of a code item: a half-open range of code-unit addresses and the ordered list of
 * handlers guarding it.
 */
@AutoValue
public abstract class DexTryItem {
  public static DexTryItem create(
      int startAddress, int instructionCount, ImmutableList<CatchHandler> handlers) {
    return new AutoValue_DexTryItem(startAddress, instructionCount, handlers);
  }

  public abstract int startAddress();

  /** Length of the region in code units. */
  public abstract int instructionCount();

  public abstract ImmutableList<CatchHandler> handlers();

  public int endAddress() {
    return startAddress() + instructionCount();
  }

  /** One handler of a try region. A null type catches everything. */
  @AutoValue
  public abstract static class CatchHandler {
    public static CatchHandler create(@Nullable DexType type, int address) {
      return new AutoValue_DexTryItem_CatchHandler(type, address);
    }

    public static CatchHandler catchAll(int address) {
      return create(null, address);
    }

    @Nullable
    public abstract DexType type();

    public abstract int address();
  }
}
