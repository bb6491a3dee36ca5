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

package com.google.devtools.dexopt.dataflow;

/**
 * A lattice element tracked by {@link Dataflow}.
 *
 * <p>Implementations must define {@code equals} by value: the fixpoint iteration stops re-queuing a
 * block once its output state compares equal to the previous one.
 *
 * @param <S> the implementing class itself
 */
public interface AbstractState<S extends AbstractState<S>> {

  /** Returns an independent copy of this state. */
  S copy();

  /**
   * Combines {@code other} into this state, in place. Must be commutative, associative and
   * idempotent, and must only move this state up the lattice.
   */
  void meet(S other);
}
