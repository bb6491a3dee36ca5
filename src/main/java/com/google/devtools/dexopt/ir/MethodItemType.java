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

/** Kinds of entries in a {@link FatMethod}. */
public enum MethodItemType {
  /** Start or end of a try region. */
  TRY,
  /** Start of an exception handler; handlers of one region are chained. */
  CATCH,
  /** An executable instruction. */
  OPCODE,
  /** Marks the location a branch (or one switch case) jumps to. */
  TARGET,
  /** A debug-info event other than a position. */
  DEBUG,
  /** A source position. */
  POSITION,
  /** Ends a basic block right before a throwing instruction inside a try region. */
  FALLTHROUGH
}
