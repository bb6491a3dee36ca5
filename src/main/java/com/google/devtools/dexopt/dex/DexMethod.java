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

import javax.annotation.Nullable;

/**
 * A method definition. Abstract and native methods have no code. The code may be replaced, which
 * is how passes commit a transformed copy of a method body.
 */
public final class DexMethod {
  private final DexMethodRef ref;
  private final int accessFlags;
  @Nullable private DexCode code;

  public DexMethod(DexMethodRef ref, int accessFlags, @Nullable DexCode code) {
    this.ref = checkNotNull(ref);
    this.accessFlags = accessFlags;
    this.code = code;
  }

  public DexMethodRef ref() {
    return ref;
  }

  public int accessFlags() {
    return accessFlags;
  }

  public boolean isStatic() {
    return (accessFlags & AccessFlags.ACC_STATIC) != 0;
  }

  public boolean isConstructor() {
    return ref.isConstructor();
  }

  /** Constructors, private and static methods; these are dispatched without a vtable. */
  public boolean isDirect() {
    return (accessFlags & (AccessFlags.ACC_STATIC | AccessFlags.ACC_PRIVATE)) != 0
        || isConstructor();
  }

  @Nullable
  public DexCode getCode() {
    return code;
  }

  public void setCode(@Nullable DexCode code) {
    this.code = code;
  }

  @Override
  public String toString() {
    return ref.toString();
  }
}
