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
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/** An interned field reference: owner, name and type. */
@AutoValue
public abstract class DexFieldRef {
  private static final Interner<DexFieldRef> interner = Interners.newWeakInterner();

  public static DexFieldRef of(DexType owner, String name, DexType type) {
    return interner.intern(new AutoValue_DexFieldRef(owner, name, type));
  }

  public abstract DexType owner();

  public abstract String name();

  public abstract DexType type();

  @Override
  public final String toString() {
    return owner() + "." + name() + ":" + type();
  }
}
