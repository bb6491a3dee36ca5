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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.devtools.dexopt.dex.DexDebugInstruction;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.dex.DexPosition;
import javax.annotation.Nullable;

/**
 * One entry of a {@link FatMethod}. The payload accessor matching {@link #type()} may be used; the
 * others throw.
 *
 * <p>Entries are compared by identity. An entry belongs to at most one list at a time.
 */
public final class MethodItemEntry {
  private final MethodItemType type;
  @Nullable private DexInstruction insn;
  @Nullable private final TryEntry tryEntry;
  @Nullable private final CatchEntry catchEntry;
  @Nullable private final BranchTarget target;
  @Nullable private final DexDebugInstruction debug;
  @Nullable private final DexPosition position;
  @Nullable private final MethodItemEntry throwing;

  private int addr = -1;

  @Nullable MethodItemEntry prev;
  @Nullable MethodItemEntry next;
  @Nullable FatMethod owner;

  private MethodItemEntry(
      MethodItemType type,
      @Nullable DexInstruction insn,
      @Nullable TryEntry tryEntry,
      @Nullable CatchEntry catchEntry,
      @Nullable BranchTarget target,
      @Nullable DexDebugInstruction debug,
      @Nullable DexPosition position,
      @Nullable MethodItemEntry throwing) {
    this.type = type;
    this.insn = insn;
    this.tryEntry = tryEntry;
    this.catchEntry = catchEntry;
    this.target = target;
    this.debug = debug;
    this.position = position;
    this.throwing = throwing;
  }

  public static MethodItemEntry opcode(DexInstruction insn) {
    checkArgument(!checkNotNull(insn).isPayload(), "payloads are not items: %s", insn);
    return new MethodItemEntry(MethodItemType.OPCODE, insn, null, null, null, null, null, null);
  }

  public static MethodItemEntry tryMarker(TryEntry.Type type, MethodItemEntry catchStart) {
    return new MethodItemEntry(
        MethodItemType.TRY, null, new TryEntry(type, catchStart), null, null, null, null, null);
  }

  public static MethodItemEntry catchMarker(CatchEntry entry) {
    return new MethodItemEntry(
        MethodItemType.CATCH, null, null, checkNotNull(entry), null, null, null, null);
  }

  public static MethodItemEntry target(BranchTarget target) {
    return new MethodItemEntry(
        MethodItemType.TARGET, null, null, null, checkNotNull(target), null, null, null);
  }

  public static MethodItemEntry debug(DexDebugInstruction debug) {
    return new MethodItemEntry(
        MethodItemType.DEBUG, null, null, null, null, checkNotNull(debug), null, null);
  }

  public static MethodItemEntry position(DexPosition position) {
    return new MethodItemEntry(
        MethodItemType.POSITION, null, null, null, null, null, checkNotNull(position), null);
  }

  /** A block boundary placed right before {@code throwing}, a may-throw opcode item. */
  public static MethodItemEntry fallthrough(MethodItemEntry throwing) {
    checkArgument(throwing.type() == MethodItemType.OPCODE, "not an opcode item: %s", throwing);
    return new MethodItemEntry(
        MethodItemType.FALLTHROUGH, null, null, null, null, null, null, throwing);
  }

  public MethodItemType type() {
    return type;
  }

  public boolean isOpcode() {
    return type == MethodItemType.OPCODE;
  }

  public DexInstruction insn() {
    checkState(type == MethodItemType.OPCODE, "%s item has no instruction", type);
    return insn;
  }

  /**
   * Swaps the instruction held by this item. Branch targets refer to the item, so a branch swapped
   * in here keeps all of its targets.
   */
  public void setInsn(DexInstruction insn) {
    checkState(type == MethodItemType.OPCODE, "%s item has no instruction", type);
    checkArgument(!checkNotNull(insn).isPayload(), "payloads are not items: %s", insn);
    this.insn = insn;
    if (owner != null) {
      owner.modified();
    }
  }

  public TryEntry tryEntry() {
    checkState(type == MethodItemType.TRY, "%s item is not a try marker", type);
    return tryEntry;
  }

  public CatchEntry catchEntry() {
    checkState(type == MethodItemType.CATCH, "%s item is not a catch marker", type);
    return catchEntry;
  }

  public BranchTarget target() {
    checkState(type == MethodItemType.TARGET, "%s item is not a branch target", type);
    return target;
  }

  public DexDebugInstruction debug() {
    checkState(type == MethodItemType.DEBUG, "%s item is not a debug event", type);
    return debug;
  }

  public DexPosition position() {
    checkState(type == MethodItemType.POSITION, "%s item is not a position", type);
    return position;
  }

  /** The instruction item a FALLTHROUGH marker precedes. */
  public MethodItemEntry throwingEntry() {
    checkState(type == MethodItemType.FALLTHROUGH, "%s item is not a fallthrough", type);
    return throwing;
  }

  /** Code-unit address assigned by the last balloon or sync; -1 when unknown. */
  public int addr() {
    return addr;
  }

  public void setAddr(int addr) {
    this.addr = addr;
  }

  @Override
  public String toString() {
    switch (type) {
      case OPCODE:
        return insn.toString();
      case TRY:
        return tryEntry.toString();
      case CATCH:
        return catchEntry.toString();
      case TARGET:
        return target.toString();
      case DEBUG:
        return "DEBUG " + debug;
      case POSITION:
        return "POSITION " + position.line();
      case FALLTHROUGH:
        return "FALLTHROUGH";
    }
    throw new AssertionError(type);
  }
}
