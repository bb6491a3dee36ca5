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

package com.google.devtools.dexopt.dex;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A decoded Dalvik instruction: an opcode and the code units that encode it.
 *
 * <p>Operands are read from and written to the code units in place. The register accessors work in
 * terms of the opcode's {@link RegisterLayout}: {@code dest()} is the written register, {@code
 * src(i)} the i-th read register. Setters store the value truncated to the field width, so callers
 * that may exceed a width must range-check with {@link #destBitWidth()} or {@link
 * #srcBitWidth(int)} first.
 *
 * <p>Instructions are compared by identity; analyses key their results by instruction.
 */
public class DexInstruction {
  private final DexOpcode opcode;
  final short[] units;

  /** Creates an instruction with all operands zero. */
  public DexInstruction(DexOpcode opcode) {
    this(opcode, new short[opcode.format().codeUnits()]);
    units[0] = (short) opcode.value();
  }

  DexInstruction(DexOpcode opcode, short[] units) {
    checkArgument(
        units.length >= opcode.format().codeUnits(),
        "%s needs %s code units, got %s",
        opcode,
        opcode.format().codeUnits(),
        units.length);
    this.opcode = opcode;
    this.units = units;
  }

  protected DexInstruction(DexInstruction other) {
    this(other.opcode, other.units.clone());
  }

  public DexOpcode opcode() {
    return opcode;
  }

  /** Size in 16-bit code units. */
  public int size() {
    return units.length;
  }

  /** Whether this is a switch or array payload rather than an executable instruction. */
  public boolean isPayload() {
    return false;
  }

  /** Returns a deep copy; references to interned symbols are shared. */
  public DexInstruction copy() {
    return new DexInstruction(this);
  }

  private OperandField field(int index) {
    return opcode.format().registerFields().get(index);
  }

  public boolean hasDest() {
    return opcode.hasDest();
  }

  public int dest() {
    checkState(hasDest(), "%s has no destination", opcode);
    return field(opcode.layout().destField()).get(units);
  }

  @CanIgnoreReturnValue
  public DexInstruction setDest(int reg) {
    checkState(hasDest(), "%s has no destination", opcode);
    field(opcode.layout().destField()).set(units, reg);
    return this;
  }

  public int destBitWidth() {
    checkState(hasDest(), "%s has no destination", opcode);
    return field(opcode.layout().destField()).width;
  }

  public boolean isDestWide() {
    return opcode.isDestWide();
  }

  /** Whether the destination and the first source share one encoded field. */
  public boolean destIsSrc0() {
    return opcode.layout().destIsSrc0();
  }

  /**
   * Number of individually addressable source registers. For 35c instructions this is the argument
   * word count; register ranges report zero and are accessed through {@link #rangeBase()}.
   */
  public int srcsSize() {
    RegisterLayout layout = opcode.layout();
    if (layout == RegisterLayout.ARGS) {
      return argWordCount();
    }
    return layout.maxSrcs();
  }

  public int src(int i) {
    checkElementIndex(i, srcsSize());
    return field(opcode.layout().srcField(i)).get(units);
  }

  @CanIgnoreReturnValue
  public DexInstruction setSrc(int i, int reg) {
    checkElementIndex(i, srcsSize());
    field(opcode.layout().srcField(i)).set(units, reg);
    return this;
  }

  public int srcBitWidth(int i) {
    checkElementIndex(i, srcsSize());
    return field(opcode.layout().srcField(i)).width;
  }

  public boolean isSrcWide(int i) {
    return opcode.isSrcWide(i);
  }

  /** Argument word count of a 35c or 3rc instruction. */
  public int argWordCount() {
    OperandField count = opcode.format().countField();
    checkState(count != null, "%s has no argument list", opcode);
    return count.get(units);
  }

  @CanIgnoreReturnValue
  public DexInstruction setArgWordCount(int count) {
    OperandField field = opcode.format().countField();
    checkState(field != null, "%s has no argument list", opcode);
    checkArgument(count >= 0 && count <= field.mask(), "bad argument count %s", count);
    field.set(units, count);
    return this;
  }

  public boolean hasRange() {
    return opcode.hasRange();
  }

  public int rangeBase() {
    checkState(hasRange(), "%s is not a range instruction", opcode);
    return field(0).get(units);
  }

  @CanIgnoreReturnValue
  public DexInstruction setRangeBase(int reg) {
    checkState(hasRange(), "%s is not a range instruction", opcode);
    field(0).set(units, reg);
    return this;
  }

  public int rangeSize() {
    return argWordCount();
  }

  public int rangeBaseBitWidth() {
    checkState(hasRange(), "%s is not a range instruction", opcode);
    return field(0).width;
  }

  public boolean hasLiteral() {
    return opcode.format().literalBits() != 0;
  }

  /** The sign-extended literal operand, as encoded. */
  public long literal() {
    switch (opcode.format().literalBits()) {
      case 4:
        return units[0] >> 12;
      case 8:
        return units[1] >> 8;
      case 16:
        return units[1];
      case 32:
        return read32(1);
      case 64:
        return (read32(1) & 0xffffffffL) | ((long) read32(3) << 32);
      default:
        throw new IllegalStateException(opcode + " has no literal");
    }
  }

  @CanIgnoreReturnValue
  public DexInstruction setLiteral(long literal) {
    switch (opcode.format().literalBits()) {
      case 4:
        units[0] = (short) ((units[0] & 0x0fff) | ((int) literal << 12));
        break;
      case 8:
        units[1] = (short) ((units[1] & 0x00ff) | (((int) literal & 0xff) << 8));
        break;
      case 16:
        units[1] = (short) literal;
        break;
      case 32:
        write32(1, (int) literal);
        break;
      case 64:
        write32(1, (int) literal);
        write32(3, (int) (literal >>> 32));
        break;
      default:
        throw new IllegalStateException(opcode + " has no literal");
    }
    return this;
  }

  public boolean hasOffset() {
    return opcode.format().offsetBits() != 0;
  }

  /** Branch offset in code units, relative to the address of this instruction. */
  public int offset() {
    switch (opcode.format().offsetBits()) {
      case 8:
        return units[0] >> 8;
      case 16:
        return units[1];
      case 32:
        return read32(1);
      default:
        throw new IllegalStateException(opcode + " has no branch offset");
    }
  }

  @CanIgnoreReturnValue
  public DexInstruction setOffset(int offset) {
    checkArgument(
        opcode.format().offsetFits(offset), "offset %s does not fit %s", offset, opcode);
    switch (opcode.format().offsetBits()) {
      case 8:
        units[0] = (short) ((units[0] & 0x00ff) | (offset << 8));
        break;
      case 16:
        units[1] = (short) offset;
        break;
      default:
        write32(1, offset);
        break;
    }
    return this;
  }

  int index() {
    switch (opcode.format().indexBits()) {
      case 16:
        return units[1] & 0xffff;
      case 32:
        return read32(1);
      default:
        throw new IllegalStateException(opcode + " has no index");
    }
  }

  void setIndex(int index) {
    switch (opcode.format().indexBits()) {
      case 16:
        checkArgument(index >= 0 && index <= 0xffff, "index %s does not fit %s", index, opcode);
        units[1] = (short) index;
        break;
      case 32:
        write32(1, index);
        break;
      default:
        throw new IllegalStateException(opcode + " has no index");
    }
  }

  private int read32(int at) {
    return (units[at] & 0xffff) | (units[at + 1] << 16);
  }

  private void write32(int at, int value) {
    units[at] = (short) value;
    units[at + 1] = (short) (value >>> 16);
  }

  /** Appends this instruction's code units to {@code out} starting at {@code pos}. */
  void writeTo(short[] out, int pos) {
    System.arraycopy(units, 0, out, pos, units.length);
  }

  /** Operand text appended after the register list; subclasses print their reference. */
  String referenceText() {
    return "";
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(opcode.mnemonic());
    String sep = " ";
    if (hasDest() && !destIsSrc0()) {
      sb.append(sep).append('v').append(dest());
      sep = ", ";
    }
    if (hasRange()) {
      sb.append(sep)
          .append("{v")
          .append(rangeBase())
          .append(" .. v")
          .append(rangeBase() + rangeSize() - 1)
          .append('}');
      sep = ", ";
    } else if (opcode.layout() == RegisterLayout.ARGS) {
      sb.append(sep).append('{');
      for (int i = 0; i < srcsSize(); i++) {
        sb.append(i == 0 ? "v" : ", v").append(src(i));
      }
      sb.append('}');
      sep = ", ";
    } else {
      for (int i = 0; i < srcsSize(); i++) {
        sb.append(sep).append('v').append(src(i));
        sep = ", ";
      }
    }
    if (hasLiteral()) {
      sb.append(sep).append('#').append(literal());
      sep = ", ";
    }
    if (hasOffset()) {
      sb.append(sep).append(offset() >= 0 ? "+" : "").append(offset());
      sep = ", ";
    }
    String ref = referenceText();
    if (!ref.isEmpty()) {
      sb.append(sep).append(ref);
    }
    return sb.toString();
  }
}
