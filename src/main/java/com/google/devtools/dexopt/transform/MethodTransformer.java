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

package com.google.devtools.dexopt.transform;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.devtools.dexopt.dex.DexCode;
import com.google.devtools.dexopt.dex.DexMethod;

/**
 * Scoped editing of a method: balloons its code on construction and syncs it on {@link #close()}.
 *
 * <pre>{@code
 * try (MethodTransformer mt = new MethodTransformer(method, true)) {
 *   for (Block b : mt.get().cfg().blocks()) { ... }
 * }
 * }</pre>
 */
public final class MethodTransformer implements AutoCloseable {
  private final DexCode code;
  private final MethodTransform transform;

  public MethodTransformer(DexMethod method) {
    this(method, false);
  }

  public MethodTransformer(DexMethod method, boolean wantCfg) {
    this.code = checkNotNull(method.getCode(), "%s has no code", method);
    code.balloon();
    this.transform = code.getEntries();
    if (wantCfg) {
      transform.buildCfg();
    }
  }

  public MethodTransform get() {
    return transform;
  }

  @Override
  public void close() {
    code.sync();
  }
}
