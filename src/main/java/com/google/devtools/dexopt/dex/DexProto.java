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
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/** An interned method prototype. */
@AutoValue
public abstract class DexProto {
  private static final Interner<DexProto> interner = Interners.newWeakInterner();

  public static DexProto of(DexType returnType, DexType... parameters) {
    return of(returnType, ImmutableList.copyOf(parameters));
  }

  public static DexProto of(DexType returnType, ImmutableList<DexType> parameters) {
    return interner.intern(new AutoValue_DexProto(returnType, parameters));
  }

  public abstract DexType returnType();

  public abstract ImmutableList<DexType> parameters();

  /** Registers taken by the declared parameters, not counting an implicit receiver. */
  public int parameterWords() {
    int words = 0;
    for (DexType p : parameters()) {
      words += p.registerWords();
    }
    return words;
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder("(");
    for (DexType p : parameters()) {
      sb.append(p.descriptor());
    }
    return sb.append(')').append(returnType().descriptor()).toString();
  }
}
