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

import com.google.devtools.dexopt.dex.DexType;
import javax.annotation.Nullable;

/** Payload of a {@link MethodItemType#CATCH} item: one link of a handler chain. */
public final class CatchEntry {
  @Nullable private final DexType catchType;
  @Nullable private MethodItemEntry next;

  public CatchEntry(@Nullable DexType catchType) {
    this.catchType = catchType;
  }

  /** The caught exception type, or null for a catch-all handler. */
  @Nullable
  public DexType catchType() {
    return catchType;
  }

  /** The next handler tried when this one does not match, or null. */
  @Nullable
  public MethodItemEntry next() {
    return next;
  }

  public void setNext(@Nullable MethodItemEntry next) {
    this.next = next;
  }

  @Override
  public String toString() {
    return "CATCH " + (catchType == null ? "<any>" : catchType.toString());
  }
}
