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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** A class definition with its fields and methods. */
public final class DexClass {
  private final DexType type;
  @Nullable private final DexType superType;
  private final int accessFlags;
  private final List<DexField> fields = new ArrayList<>();
  private final List<DexMethod> methods = new ArrayList<>();

  public DexClass(DexType type, @Nullable DexType superType, int accessFlags) {
    this.type = checkNotNull(type);
    this.superType = superType;
    this.accessFlags = accessFlags;
  }

  public DexType type() {
    return type;
  }

  @Nullable
  public DexType superType() {
    return superType;
  }

  public int accessFlags() {
    return accessFlags;
  }

  public void addField(DexField field) {
    fields.add(checkNotNull(field));
  }

  public void addMethod(DexMethod method) {
    methods.add(checkNotNull(method));
  }

  public ImmutableList<DexField> fields() {
    return ImmutableList.copyOf(fields);
  }

  public ImmutableList<DexField> staticFields() {
    return fields.stream().filter(DexField::isStatic).collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<DexField> instanceFields() {
    return fields.stream().filter(f -> !f.isStatic()).collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<DexMethod> methods() {
    return ImmutableList.copyOf(methods);
  }

  public ImmutableList<DexMethod> constructors() {
    return methods.stream()
        .filter(m -> m.isConstructor() && !m.isStatic())
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the method defined here with exactly this reference, or null. */
  @Nullable
  public DexMethod findMethod(DexMethodRef ref) {
    for (DexMethod m : methods) {
      if (m.ref().equals(ref)) {
        return m;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return type.toString();
  }
}
