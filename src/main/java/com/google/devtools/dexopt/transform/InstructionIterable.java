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

import com.google.common.collect.AbstractIterator;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.ir.FatMethod;
import com.google.devtools.dexopt.ir.MethodItemEntry;
import java.util.Iterator;

/**
 * The instructions of a method in item order, skipping markers. Removing the instruction just
 * returned through {@link MethodTransform#removeOpcode} while iterating is supported.
 */
public final class InstructionIterable implements Iterable<DexInstruction> {
  private final FatMethod method;

  public InstructionIterable(FatMethod method) {
    this.method = method;
  }

  @Override
  public Iterator<DexInstruction> iterator() {
    Iterator<MethodItemEntry> items = method.iterator();
    return new AbstractIterator<DexInstruction>() {
      @Override
      protected DexInstruction computeNext() {
        while (items.hasNext()) {
          MethodItemEntry e = items.next();
          if (e.isOpcode()) {
            return e.insn();
          }
        }
        return endOfData();
      }
    };
  }
}
