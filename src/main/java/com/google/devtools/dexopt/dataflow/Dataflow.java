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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.ir.Block;
import com.google.devtools.dexopt.ir.ControlFlowGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Worklist fixpoint solvers over a {@link ControlFlowGraph}.
 *
 * <p>A block's input is the meet of the outputs of its already computed neighbours; blocks none of
 * whose neighbours have been computed start from the supplied initial state. Blocks unreachable
 * from the entry are analyzed too, after the reachable ones, so every instruction gets a state.
 * Results are keyed by instruction identity.
 */
public final class Dataflow {

  private Dataflow() {}

  /** Blocks reachable from the entry, in depth-first postorder. */
  public static ImmutableList<Block> postorder(ControlFlowGraph cfg) {
    if (cfg.blocks().isEmpty()) {
      return ImmutableList.of();
    }
    List<Block> result = new ArrayList<>();
    Set<Block> visited = new LinkedHashSet<>();
    Deque<Iterator<Block>> stack = new ArrayDeque<>();
    Deque<Block> path = new ArrayDeque<>();
    Block entry = cfg.entryBlock();
    visited.add(entry);
    path.push(entry);
    stack.push(entry.succs().iterator());
    while (!stack.isEmpty()) {
      Iterator<Block> succs = stack.peek();
      if (succs.hasNext()) {
        Block next = succs.next();
        if (visited.add(next)) {
          path.push(next);
          stack.push(next.succs().iterator());
        }
      } else {
        stack.pop();
        result.add(path.pop());
      }
    }
    return ImmutableList.copyOf(result);
  }

  /** Blocks reachable from the entry, in reverse postorder; the entry comes first. */
  public static ImmutableList<Block> reversePostorder(ControlFlowGraph cfg) {
    return ImmutableList.copyOf(Lists.reverse(postorder(cfg)));
  }

  private static ImmutableList<Block> withUnreachable(
      ControlFlowGraph cfg, ImmutableList<Block> order) {
    Set<Block> all = new LinkedHashSet<>(order);
    all.addAll(cfg.blocks());
    return ImmutableList.copyOf(all);
  }

  /**
   * Runs a forward analysis and returns, for every instruction, the state on entry to it.
   *
   * @param entryState the state on entry to the method
   */
  public static <S extends AbstractState<S>> Map<DexInstruction, S> forwards(
      ControlFlowGraph cfg, S entryState, TransferFunction<S> transfer) {
    ImmutableList<Block> order = withUnreachable(cfg, reversePostorder(cfg));
    Map<Block, S> out = new IdentityHashMap<>();
    Worklist worklist = new Worklist(order);
    order.forEach(worklist::add);
    Block entry = order.isEmpty() ? null : order.get(0);
    while (!worklist.isEmpty()) {
      Block b = worklist.poll();
      S state = forwardInput(b, entry, entryState, out);
      for (DexInstruction insn : b.instructions()) {
        transfer.apply(insn, state);
      }
      S previous = out.put(b, state);
      if (!state.equals(previous)) {
        b.succs().forEach(worklist::add);
      }
    }
    Map<DexInstruction, S> result = new IdentityHashMap<>();
    for (Block b : order) {
      S state = forwardInput(b, entry, entryState, out);
      for (DexInstruction insn : b.instructions()) {
        result.put(insn, state.copy());
        transfer.apply(insn, state);
      }
    }
    return result;
  }

  private static <S extends AbstractState<S>> S forwardInput(
      Block b, @Nullable Block entry, S entryState, Map<Block, S> out) {
    S input = b == entry ? entryState.copy() : null;
    for (Block pred : b.preds()) {
      S predOut = out.get(pred);
      if (predOut == null) {
        continue;
      }
      if (input == null) {
        input = predOut.copy();
      } else {
        input.meet(predOut);
      }
    }
    return input == null ? entryState.copy() : input;
  }

  /**
   * Runs a backward analysis and returns, for every instruction, the state right after it (its
   * "out" state in execution order).
   *
   * @param exitState the state at method exits, also used where no successor is computed yet
   */
  public static <S extends AbstractState<S>> Map<DexInstruction, S> backwards(
      ControlFlowGraph cfg, S exitState, TransferFunction<S> transfer) {
    ImmutableList<Block> order = withUnreachable(cfg, postorder(cfg));
    Map<Block, S> in = new IdentityHashMap<>();
    Worklist worklist = new Worklist(order);
    order.forEach(worklist::add);
    while (!worklist.isEmpty()) {
      Block b = worklist.poll();
      S state = backwardOutput(b, exitState, in);
      for (DexInstruction insn : b.instructions().reverse()) {
        transfer.apply(insn, state);
      }
      S previous = in.put(b, state);
      if (!state.equals(previous)) {
        b.preds().forEach(worklist::add);
      }
    }
    Map<DexInstruction, S> result = new IdentityHashMap<>();
    for (Block b : order) {
      S state = backwardOutput(b, exitState, in);
      for (DexInstruction insn : b.instructions().reverse()) {
        result.put(insn, state.copy());
        transfer.apply(insn, state);
      }
    }
    return result;
  }

  private static <S extends AbstractState<S>> S backwardOutput(
      Block b, S exitState, Map<Block, S> in) {
    S output = null;
    for (Block succ : b.succs()) {
      S succIn = in.get(succ);
      if (succIn == null) {
        continue;
      }
      if (output == null) {
        output = succIn.copy();
      } else {
        output.meet(succIn);
      }
    }
    return output == null ? exitState.copy() : output;
  }
}
