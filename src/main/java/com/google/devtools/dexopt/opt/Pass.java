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

package com.google.devtools.dexopt.opt;

import com.google.devtools.dexopt.dex.Scope;

/**
 * An optimization over a whole program. The driver balloons every method before the first pass
 * runs and syncs them after the last; a pass must leave each method it touches syncable.
 */
public interface Pass {

  String name();

  void run(Scope scope);
}
