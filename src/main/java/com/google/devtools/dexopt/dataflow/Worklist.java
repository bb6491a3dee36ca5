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

import com.google.devtools.dexopt.ir.Block;
import java.util.BitSet;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/** Blocks waiting to be (re)analyzed, polled in a fixed iteration order. */
final class Worklist {
  private final Map<Block, Integer> order = new IdentityHashMap<>();
  private final PriorityQueue<Block> queue;
  /** Positions in the iteration order of the blocks currently in {@link #queue}. */
  private final BitSet queued = new BitSet();

  Worklist(List<Block> iterationOrder) {
    for (Block b : iterationOrder) {
      order.put(b, order.size());
    }
    queue = new PriorityQueue<>(Math.max(1, order.size()), Comparator.comparing(order::get));
  }

  void add(Block block) {
    int position = order.get(block);
    if (!queued.get(position)) {
      queued.set(position);
      queue.add(block);
    }
  }

  boolean isEmpty() {
    return queue.isEmpty();
  }

  Block poll() {
    Block block = queue.poll();
    queued.clear(order.get(block));
    return block;
  }
}
