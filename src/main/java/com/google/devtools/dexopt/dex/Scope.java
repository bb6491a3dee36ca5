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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Iterator;
import java.util.function.Function;
import javax.annotation.Nullable;

/** The ordered set of classes an optimization pass runs over. */
public final class Scope implements Iterable<DexClass> {
  private final ImmutableList<DexClass> classes;
  private final ImmutableMap<DexType, DexClass> byType;

  private Scope(ImmutableList<DexClass> classes) {
    this.classes = classes;
    this.byType =
        classes.stream()
            .collect(ImmutableMap.toImmutableMap(DexClass::type, Function.identity()));
  }

  public static Scope of(Iterable<DexClass> classes) {
    return new Scope(ImmutableList.copyOf(classes));
  }

  public static Scope of(DexClass... classes) {
    return new Scope(ImmutableList.copyOf(classes));
  }

  public ImmutableList<DexClass> classes() {
    return classes;
  }

  @Nullable
  public DexClass classFor(DexType type) {
    return byType.get(type);
  }

  /** Resolves a method reference to its definition when the owner is part of this scope. */
  @Nullable
  public DexMethod resolve(DexMethodRef ref) {
    DexClass owner = byType.get(ref.owner());
    return owner == null ? null : owner.findMethod(ref);
  }

  public ImmutableList<DexMethod> allMethods() {
    ImmutableList.Builder<DexMethod> result = ImmutableList.builder();
    for (DexClass c : classes) {
      result.addAll(c.methods());
    }
    return result.build();
  }

  @Override
  public Iterator<DexClass> iterator() {
    return classes.iterator();
  }
}
