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

package com.google.devtools.dexopt.ir;

/** A directed control-flow edge. */
public final class Edge {
  private final Block src;
  private final Block target;
  private final EdgeType type;

  Edge(Block src, Block target, EdgeType type) {
    this.src = src;
    this.target = target;
    this.type = type;
  }

  public Block src() {
    return src;
  }

  public Block target() {
    return target;
  }

  public EdgeType type() {
    return type;
  }

  @Override
  public String toString() {
    return "B" + src.id() + " -" + type + "-> B" + target.id();
  }
}
