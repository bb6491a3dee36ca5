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

package com.google.devtools.dexopt.opt.removebuilders;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import com.google.devtools.dexopt.dataflow.AbstractState;
import com.google.devtools.dexopt.dex.DexFieldRef;
import java.util.HashMap;
import java.util.Map;

/**
 * For each instance field of a builder, the register known to hold its value, or one of the
 * negative status values.
 */
final class FieldsRegs implements AbstractState<FieldsRegs> {
  /** No write (or read) of the field has been seen yet. */
  static final int UNDEFINED = -1;
  /** Paths disagree on the register. */
  static final int DIFFERENT = -2;
  /** The register was written by something else since. */
  static final int OVERWRITTEN = -3;

  private final Map<DexFieldRef, Integer> fieldToReg;

  FieldsRegs(Iterable<DexFieldRef> fields) {
    fieldToReg = new HashMap<>();
    for (DexFieldRef f : fields) {
      fieldToReg.put(f, UNDEFINED);
    }
  }

  private FieldsRegs(FieldsRegs other) {
    fieldToReg = new HashMap<>(other.fieldToReg);
  }

  ImmutableSet<DexFieldRef> fields() {
    return ImmutableSet.copyOf(fieldToReg.keySet());
  }

  int get(DexFieldRef field) {
    Integer reg = fieldToReg.get(field);
    checkArgument(reg != null, "%s is not tracked", field);
    return reg;
  }

  void set(DexFieldRef field, int reg) {
    checkArgument(fieldToReg.containsKey(field), "%s is not tracked", field);
    fieldToReg.put(field, reg);
  }

  boolean tracks(DexFieldRef field) {
    return fieldToReg.containsKey(field);
  }

  /**
   * Marks every field whose value lived in {@code reg} as {@link #OVERWRITTEN}, including wide
   * fields whose register pair covers it.
   */
  void overwrite(int reg) {
    fieldToReg.replaceAll(
        (f, r) -> r >= 0 && (r == reg || (f.type().isWide() && r + 1 == reg)) ? OVERWRITTEN : r);
  }

  @Override
  public FieldsRegs copy() {
    return new FieldsRegs(this);
  }

  @Override
  public void meet(FieldsRegs other) {
    fieldToReg.replaceAll((f, r) -> r.equals(other.fieldToReg.get(f)) ? r : DIFFERENT);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FieldsRegs && fieldToReg.equals(((FieldsRegs) o).fieldToReg);
  }

  @Override
  public int hashCode() {
    return fieldToReg.hashCode();
  }

  @Override
  public String toString() {
    return fieldToReg.toString();
  }
}
