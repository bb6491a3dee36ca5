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

/** An unsigned bit field inside one code unit of an encoded instruction. */
final class OperandField {
  final int unit;
  final int shift;
  final int width;

  private OperandField(int unit, int shift, int width) {
    checkArgument(width > 0 && shift + width <= 16, "bad field %s:%s", shift, width);
    this.unit = unit;
    this.shift = shift;
    this.width = width;
  }

  static OperandField of(int unit, int shift, int width) {
    return new OperandField(unit, shift, width);
  }

  int mask() {
    return (1 << width) - 1;
  }

  int get(short[] units) {
    return ((units[unit] & 0xffff) >>> shift) & mask();
  }

  /** Stores {@code value} truncated to the field width; neighbouring bits are left untouched. */
  void set(short[] units, int value) {
    int bits = mask() << shift;
    units[unit] = (short) ((units[unit] & ~bits) | ((value << shift) & bits));
  }

  @Override
  public String toString() {
    return "unit" + unit + "[" + shift + ":" + width + "]";
  }
}
