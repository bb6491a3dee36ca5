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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.dex.DexOpcode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FatMethod}. */
@RunWith(JUnit4.class)
public class FatMethodTest {

  private static MethodItemEntry nop() {
    return MethodItemEntry.opcode(new DexInstruction(DexOpcode.NOP));
  }

  @Test
  public void insertAndRemove_keepLinksConsistent() {
    FatMethod method = new FatMethod();
    MethodItemEntry a = nop();
    MethodItemEntry b = nop();
    MethodItemEntry c = nop();
    method.pushBack(a);
    method.pushBack(c);
    method.insertAfter(a, b);

    assertThat(method).containsExactly(a, b, c).inOrder();
    assertThat(method.next(a)).isSameInstanceAs(b);
    assertThat(method.prev(c)).isSameInstanceAs(b);

    assertThat(method.remove(b)).isSameInstanceAs(c);
    assertThat(method).containsExactly(a, c).inOrder();
    assertThat(method.contains(b)).isFalse();
    assertThat(method.size()).isEqualTo(2);
  }

  @Test
  public void entryCannotBelongToTwoMethods() {
    FatMethod first = new FatMethod();
    FatMethod second = new FatMethod();
    MethodItemEntry e = nop();
    first.pushBack(e);

    assertThrows(IllegalArgumentException.class, () -> second.pushBack(e));
    assertThrows(IllegalArgumentException.class, () -> second.remove(e));
  }

  @Test
  public void iterator_toleratesRemovingCurrentItem() {
    FatMethod method = new FatMethod();
    List<MethodItemEntry> all = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      MethodItemEntry e = nop();
      all.add(e);
      method.pushBack(e);
    }

    List<MethodItemEntry> visited = new ArrayList<>();
    for (MethodItemEntry e : method) {
      visited.add(e);
      method.remove(e);
    }

    assertThat(visited).containsExactlyElementsIn(all).inOrder();
    assertThat(method.isEmpty()).isTrue();
  }

  @Test
  public void iterator_visitsItemsInsertedAhead() {
    FatMethod method = new FatMethod();
    MethodItemEntry a = nop();
    MethodItemEntry inserted = nop();
    method.pushBack(a);

    List<MethodItemEntry> visited = new ArrayList<>();
    for (Iterator<MethodItemEntry> it = method.iterator(); it.hasNext(); ) {
      MethodItemEntry e = it.next();
      visited.add(e);
      if (e == a) {
        method.insertAfter(a, inserted);
      }
    }

    assertThat(visited).containsExactly(a, inserted).inOrder();
  }

  @Test
  public void iteratorRemove_unlinksReturnedItem() {
    FatMethod method = new FatMethod();
    MethodItemEntry a = nop();
    MethodItemEntry b = nop();
    method.pushBack(a);
    method.pushBack(b);

    Iterator<MethodItemEntry> it = method.iterator();
    it.next();
    it.remove();

    assertThrows(IllegalStateException.class, it::remove);
    assertThat(it.next()).isSameInstanceAs(b);
    assertThat(method).containsExactly(b);
  }

  @Test
  public void generation_changesOnEveryEdit() {
    FatMethod method = new FatMethod();
    MethodItemEntry e = nop();
    int before = method.generation();
    method.pushFront(e);
    int afterInsert = method.generation();
    e.setInsn(new DexInstruction(DexOpcode.RETURN_VOID));
    int afterSet = method.generation();

    assertThat(afterInsert).isGreaterThan(before);
    assertThat(afterSet).isGreaterThan(afterInsert);
  }
}
