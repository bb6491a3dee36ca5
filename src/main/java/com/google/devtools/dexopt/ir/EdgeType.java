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

/** Why control can pass from one basic block to another. */
public enum EdgeType {
  /** Unconditional transfer: a goto or falling off the end of a block. */
  GOTO,
  /** The taken side of a conditional branch or a switch case. */
  BRANCH,
  /** An exception raised in a try region reaching one of its handlers. */
  THROW
}
