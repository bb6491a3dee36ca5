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
import javax.annotation.Nullable;

/** A source position: line number and, when known, the source file. */
@AutoValue
public abstract class DexPosition {
  public static DexPosition create(int line, @Nullable String file) {
    return new AutoValue_DexPosition(line, file);
  }

  public abstract int line();

  @Nullable
  public abstract String file();
}
