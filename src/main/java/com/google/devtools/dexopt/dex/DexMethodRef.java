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

/** An interned method reference: owner, name and prototype. */
@AutoValue
public abstract class DexMethodRef {
  private static final Interner<DexMethodRef> interner = Interners.newWeakInterner();

  public static DexMethodRef of(DexType owner, String name, DexProto proto) {
    return interner.intern(new AutoValue_DexMethodRef(owner, name, proto));
  }

  public abstract DexType owner();

  public abstract String name();

  public abstract DexProto proto();

  public boolean isConstructor() {
    return name().equals("<init>");
  }

  @Override
  public final String toString() {
    return owner() + "." + name() + ":" + proto();
  }
}
