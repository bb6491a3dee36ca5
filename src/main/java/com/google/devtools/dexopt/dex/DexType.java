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

import com.google.auto.value.AutoValue;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/** An interned type descriptor such as {@code I}, {@code Ljava/lang/Object;} or {@code [J}. */
@AutoValue
public abstract class DexType {
  private static final Interner<DexType> interner = Interners.newWeakInterner();

  public static DexType of(String descriptor) {
    checkArgument(!descriptor.isEmpty(), "empty type descriptor");
    return interner.intern(new AutoValue_DexType(descriptor));
  }

  public abstract String descriptor();

  public boolean isVoid() {
    return descriptor().equals("V");
  }

  /** Whether values of this type occupy a register pair. */
  public boolean isWide() {
    return descriptor().equals("J") || descriptor().equals("D");
  }

  public boolean isReference() {
    char c = descriptor().charAt(0);
    return c == 'L' || c == '[';
  }

  /** Number of registers a value of this type occupies. */
  public int registerWords() {
    return isVoid() ? 0 : isWide() ? 2 : 1;
  }

  @Override
  public final String toString() {
    return descriptor();
  }
}
