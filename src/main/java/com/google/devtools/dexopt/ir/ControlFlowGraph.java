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

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Verify.verify;
import static com.google.common.base.Verify.verifyNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.dexopt.dex.DexOpcode;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Basic blocks and edges derived from a {@link FatMethod}.
 *
 * <p>A block ends after a branch, return or throw and before any branch target, try or catch
 * marker. In the default mode a block also ends right before every may-throw instruction inside a
 * try region (a {@link MethodItemType#FALLTHROUGH} marker is inserted there), and the exception
 * edges leave that preceding block, so handlers see the state before the throwing instruction. In
 * the legacy mode the block ends after the throwing instruction instead.
 *
 * <p>The graph is a snapshot: any structural change to the method makes it stale, and using a
 * stale graph is an error.
 */
public final class ControlFlowGraph {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final FatMethod method;
  private final ImmutableList<Block> blocks;
  private final boolean endBlockBeforeThrow;
  private final int generation;

  private ControlFlowGraph(
      FatMethod method, ImmutableList<Block> blocks, boolean endBlockBeforeThrow) {
    this.method = method;
    this.blocks = blocks;
    this.endBlockBeforeThrow = endBlockBeforeThrow;
    this.generation = method.generation();
  }

  /**
   * Builds the graph. Fallthrough markers left by an earlier build are removed first and, in the
   * default mode, inserted again where needed.
   */
  public static ControlFlowGraph build(FatMethod method, boolean endBlockBeforeThrow) {
    removeFallthroughs(method);
    if (endBlockBeforeThrow) {
      insertFallthroughs(method);
    }
    ImmutableList<Block> blocks = splitBlocks(method, endBlockBeforeThrow);
    Map<MethodItemEntry, Block> blockOf = new IdentityHashMap<>();
    for (Block b : blocks) {
      for (MethodItemEntry e : b) {
        blockOf.put(e, b);
      }
    }
    connectFallthroughsAndBranches(blocks, blockOf);
    connectHandlers(blocks, blockOf, endBlockBeforeThrow);
    logger.atFinest().log("built %d blocks", blocks.size());
    return new ControlFlowGraph(method, blocks, endBlockBeforeThrow);
  }

  static void removeFallthroughs(FatMethod method) {
    for (Iterator<MethodItemEntry> it = method.iterator(); it.hasNext(); ) {
      if (it.next().type() == MethodItemType.FALLTHROUGH) {
        it.remove();
      }
    }
  }

  private static void insertFallthroughs(FatMethod method) {
    List<MethodItemEntry> throwing = new ArrayList<>();
    boolean inTry = false;
    for (MethodItemEntry e : method) {
      if (e.type() == MethodItemType.TRY) {
        inTry = e.tryEntry().type() == TryEntry.Type.START;
      } else if (inTry && e.isOpcode() && e.insn().opcode().mayThrow()) {
        throwing.add(e);
      }
    }
    for (MethodItemEntry e : throwing) {
      method.insertBefore(e, MethodItemEntry.fallthrough(e));
    }
  }

  private static boolean startsBlock(MethodItemEntry e) {
    switch (e.type()) {
      case TARGET:
      case TRY:
      case CATCH:
      case FALLTHROUGH:
        return true;
      default:
        return false;
    }
  }

  private static boolean endsBlock(MethodItemEntry e, boolean inTry, boolean endBlockBeforeThrow) {
    if (!e.isOpcode()) {
      return false;
    }
    DexOpcode op = e.insn().opcode();
    if (op.isBranch() || op.isReturn() || op.isThrow()) {
      return true;
    }
    return !endBlockBeforeThrow && inTry && op.mayThrow();
  }

  private static ImmutableList<Block> splitBlocks(FatMethod method, boolean endBlockBeforeThrow) {
    List<Block> blocks = new ArrayList<>();
    if (method.isEmpty()) {
      return ImmutableList.of();
    }
    Block current = new Block(0, method.first());
    blocks.add(current);
    boolean inTry = false;
    for (MethodItemEntry e = method.first(); e != null; e = method.next(e)) {
      if (e.type() == MethodItemType.TRY) {
        inTry = e.tryEntry().type() == TryEntry.Type.START;
      }
      MethodItemEntry next = method.next(e);
      if (next == null) {
        break;
      }
      if (startsBlock(next) || endsBlock(e, inTry, endBlockBeforeThrow)) {
        current.setEnd(next);
        current = new Block(blocks.size(), next);
        blocks.add(current);
      }
    }
    current.setEnd(null);
    return ImmutableList.copyOf(blocks);
  }

  private static void addEdge(Block src, Block target, EdgeType type) {
    Edge edge = new Edge(src, target, type);
    src.addSucc(edge);
    target.addPred(edge);
  }

  private static void connectFallthroughsAndBranches(
      ImmutableList<Block> blocks, Map<MethodItemEntry, Block> blockOf) {
    for (int i = 0; i < blocks.size(); i++) {
      Block b = blocks.get(i);
      MethodItemEntry last = b.lastOpcode();
      boolean fallsThrough = last == null || !last.insn().opcode().isTerminal();
      if (fallsThrough && i + 1 < blocks.size()) {
        addEdge(b, blocks.get(i + 1), EdgeType.GOTO);
      }
    }
    for (Block b : blocks) {
      for (MethodItemEntry e : b) {
        if (e.type() != MethodItemType.TARGET) {
          continue;
        }
        MethodItemEntry src = e.target().src();
        Block srcBlock = blockOf.get(src);
        verify(srcBlock != null, "branch target %s has no source in this method", e);
        addEdge(
            srcBlock, b, src.insn().opcode().isGoto() ? EdgeType.GOTO : EdgeType.BRANCH);
      }
    }
  }

  private static void connectHandlers(
      ImmutableList<Block> blocks,
      Map<MethodItemEntry, Block> blockOf,
      boolean endBlockBeforeThrow) {
    MethodItemEntry catchStart = null;
    for (Block b : blocks) {
      for (MethodItemEntry e : b) {
        if (e.type() == MethodItemType.TRY) {
          if (e.tryEntry().type() == TryEntry.Type.START) {
            verify(catchStart == null, "nested try region at %s", e);
            catchStart = e.tryEntry().catchStart();
          } else {
            verify(
                catchStart == e.tryEntry().catchStart(), "unmatched try end marker at %s", e);
            catchStart = null;
          }
        }
      }
      if (catchStart == null || !throwsOut(b, endBlockBeforeThrow)) {
        continue;
      }
      for (MethodItemEntry c = catchStart; c != null; c = c.catchEntry().next()) {
        Block handler = verifyNotNull(blockOf.get(c), "catch %s is not in this method", c);
        addEdge(b, handler, EdgeType.THROW);
      }
    }
  }

  private static boolean throwsOut(Block b, boolean endBlockBeforeThrow) {
    MethodItemEntry last = b.lastOpcode();
    if (endBlockBeforeThrow) {
      MethodItemEntry end = b.end();
      return end != null
          && end.type() == MethodItemType.FALLTHROUGH
          && (last == null || !last.insn().opcode().isTerminal());
    }
    return last != null && last.insn().opcode().mayThrow();
  }

  public ImmutableList<Block> blocks() {
    checkFresh();
    return blocks;
  }

  public Block entryBlock() {
    checkFresh();
    checkState(!blocks.isEmpty(), "empty method has no entry block");
    return blocks.get(0);
  }

  /** Blocks without successors: returns, throws that leave the method, dead ends. */
  public ImmutableList<Block> exitBlocks() {
    checkFresh();
    return blocks.stream()
        .filter(b -> b.succEdges().isEmpty())
        .collect(ImmutableList.toImmutableList());
  }

  public boolean endsBlockBeforeThrow() {
    return endBlockBeforeThrow;
  }

  /** Whether the method was structurally changed after this graph was built. */
  public boolean isStale() {
    return method.generation() != generation;
  }

  public void checkFresh() {
    checkState(!isStale(), "control flow graph is stale; rebuild it after editing the method");
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Block b : blocks) {
      sb.append(b).append(" succs=").append(b.succEdges()).append(System.lineSeparator());
      for (MethodItemEntry e : b) {
        sb.append("  ").append(e).append(System.lineSeparator());
      }
    }
    return sb.toString();
  }
}
