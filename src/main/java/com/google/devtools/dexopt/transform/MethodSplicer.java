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

package com.google.devtools.dexopt.transform;

import com.google.devtools.dexopt.dex.DexOpcodeData;
import com.google.devtools.dexopt.ir.BranchTarget;
import com.google.devtools.dexopt.ir.CatchEntry;
import com.google.devtools.dexopt.ir.MethodItemEntry;
import com.google.devtools.dexopt.ir.MethodItemType;
import com.google.devtools.dexopt.ir.TryEntry;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntUnaryOperator;
import javax.annotation.Nullable;

/**
 * Copies the items of one method into another, renumbering registers. Branch targets, try markers
 * and catch chains of the copy refer to the copied items.
 */
final class MethodSplicer {
  private final MethodTransform source;
  private final MethodTransform dest;
  private final IntUnaryOperator registerMap;
  private final Map<MethodItemEntry, MethodItemEntry> clones = new IdentityHashMap<>();

  MethodSplicer(MethodTransform source, MethodTransform dest, IntUnaryOperator registerMap) {
    this.source = source;
    this.dest = dest;
    this.registerMap = registerMap;
  }

  /**
   * Inserts a copy of every source item in front of {@code position} (at the end when null) and
   * returns the copies in order. Fallthrough markers are dropped; they are rebuilt with the
   * graph. So are local variable events, whose registers mean nothing in the destination.
   */
  List<MethodItemEntry> spliceBefore(@Nullable MethodItemEntry position) {
    List<MethodItemEntry> originals = new ArrayList<>();
    for (MethodItemEntry e : source) {
      if (e.type() == MethodItemType.FALLTHROUGH || e.type() == MethodItemType.DEBUG) {
        continue;
      }
      originals.add(e);
      if (e.type() != MethodItemType.TRY && e.type() != MethodItemType.TARGET) {
        clones.put(e, cloneLeaf(e));
      }
    }
    List<MethodItemEntry> result = new ArrayList<>(originals.size());
    for (MethodItemEntry e : originals) {
      MethodItemEntry copy = cloneLinked(e);
      dest.items().insertBefore(position, copy);
      result.add(copy);
    }
    return result;
  }

  private MethodItemEntry cloneLeaf(MethodItemEntry e) {
    switch (e.type()) {
      case OPCODE:
        MethodItemEntry op = MethodItemEntry.opcode(e.insn().copy());
        RegisterRemapper.remap(op.insn(), registerMap);
        DexOpcodeData data = source.arrayDataOf(e);
        if (data != null) {
          dest.putArrayData(op, data.copy());
        }
        Integer emptyKey = source.emptyPackedFirstKey(e);
        if (emptyKey != null) {
          dest.putEmptyPackedFirstKey(op, emptyKey);
        }
        return op;
      case CATCH:
        return MethodItemEntry.catchMarker(new CatchEntry(e.catchEntry().catchType()));
      case POSITION:
        return MethodItemEntry.position(e.position());
      default:
        throw new IllegalStateException("unexpected item " + e);
    }
  }

  /** Copies of items that refer to other items, once every item they may refer to is cloned. */
  private MethodItemEntry cloneLinked(MethodItemEntry e) {
    switch (e.type()) {
      case TRY:
        TryEntry t = e.tryEntry();
        return MethodItemEntry.tryMarker(t.type(), clones.get(t.catchStart()));
      case TARGET:
        BranchTarget bt = e.target();
        MethodItemEntry src = clones.get(bt.src());
        return MethodItemEntry.target(
            bt.type() == BranchTarget.Type.SIMPLE
                ? BranchTarget.simple(src)
                : BranchTarget.multi(src, bt.index()));
      case CATCH:
        MethodItemEntry copy = clones.get(e);
        MethodItemEntry next = e.catchEntry().next();
        if (next != null) {
          copy.catchEntry().setNext(clones.get(next));
        }
        return copy;
      default:
        return clones.get(e);
    }
  }
}
