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

/** A field definition. */
public final class DexField {
  private final DexFieldRef ref;
  private final int accessFlags;

  public DexField(DexFieldRef ref, int accessFlags) {
    this.ref = checkNotNull(ref);
    this.accessFlags = accessFlags;
  }

  public DexFieldRef ref() {
    return ref;
  }

  public int accessFlags() {
    return accessFlags;
  }

  public boolean isStatic() {
    return (accessFlags & AccessFlags.ACC_STATIC) != 0;
  }

  @Override
  public String toString() {
    return ref.toString();
  }
}
