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

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.devtools.dexopt.dex.DexInstruction;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A basic block: the items from {@link #begin()} up to, but not including, {@link #end()} (null
 * when the block runs to the end of the method).
 */
public final class Block implements Iterable<MethodItemEntry> {
  private final int id;
  private final MethodItemEntry begin;
  @Nullable private MethodItemEntry end;
  private final List<Edge> preds = new ArrayList<>();
  private final List<Edge> succs = new ArrayList<>();

  Block(int id, MethodItemEntry begin) {
    this.id = id;
    this.begin = begin;
  }

  /** Position of the block in method order; the entry block is 0. */
  public int id() {
    return id;
  }

  public MethodItemEntry begin() {
    return begin;
  }

  @Nullable
  public MethodItemEntry end() {
    return end;
  }

  void setEnd(@Nullable MethodItemEntry end) {
    this.end = end;
  }

  void addSucc(Edge edge) {
    succs.add(edge);
  }

  void addPred(Edge edge) {
    preds.add(edge);
  }

  public ImmutableList<Edge> predEdges() {
    return ImmutableList.copyOf(preds);
  }

  public ImmutableList<Edge> succEdges() {
    return ImmutableList.copyOf(succs);
  }

  /** Distinct predecessor blocks, in edge order. */
  public ImmutableList<Block> preds() {
    Set<Block> blocks = new LinkedHashSet<>();
    for (Edge e : preds) {
      blocks.add(e.src());
    }
    return ImmutableList.copyOf(blocks);
  }

  /** Distinct successor blocks, in edge order. */
  public ImmutableList<Block> succs() {
    Set<Block> blocks = new LinkedHashSet<>();
    for (Edge e : succs) {
      blocks.add(e.target());
    }
    return ImmutableList.copyOf(blocks);
  }

  @Override
  public Iterator<MethodItemEntry> iterator() {
    return new AbstractIterator<MethodItemEntry>() {
      @Nullable private MethodItemEntry next = begin;

      @Override
      protected MethodItemEntry computeNext() {
        if (next == null || next == end) {
          return endOfData();
        }
        MethodItemEntry result = next;
        next = result.next;
        return result;
      }
    };
  }

  /** The instructions of this block in execution order. */
  public ImmutableList<DexInstruction> instructions() {
    ImmutableList.Builder<DexInstruction> insns = ImmutableList.builder();
    for (MethodItemEntry e : this) {
      if (e.isOpcode()) {
        insns.add(e.insn());
      }
    }
    return insns.build();
  }

  /** The last instruction item of the block, or null if it holds only markers. */
  @Nullable
  public MethodItemEntry lastOpcode() {
    MethodItemEntry last = null;
    for (MethodItemEntry e : this) {
      if (e.isOpcode()) {
        last = e;
      }
    }
    return last;
  }

  @Override
  public String toString() {
    return "B" + id;
  }
}
