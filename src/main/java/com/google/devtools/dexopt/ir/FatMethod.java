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

import java.util.Iterator;
import java.util.NoSuchElementException;
import javax.annotation.Nullable;

/**
 * The editable form of a method body: an intrusive doubly linked list of {@link MethodItemEntry}s.
 *
 * <p>Every structural change bumps a generation counter, which lets derived structures such as a
 * {@link ControlFlowGraph} detect that they are out of date. Iterators tolerate removal of any
 * item, including the one just returned, and visit items inserted ahead of them.
 */
public final class FatMethod implements Iterable<MethodItemEntry> {
  @Nullable private MethodItemEntry head;
  @Nullable private MethodItemEntry tail;
  private int size;
  private int generation;

  @Nullable
  public MethodItemEntry first() {
    return head;
  }

  @Nullable
  public MethodItemEntry last() {
    return tail;
  }

  @Nullable
  public MethodItemEntry next(MethodItemEntry entry) {
    checkOwned(entry);
    return entry.next;
  }

  @Nullable
  public MethodItemEntry prev(MethodItemEntry entry) {
    checkOwned(entry);
    return entry.prev;
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public boolean contains(MethodItemEntry entry) {
    return entry.owner == this;
  }

  /** Monotonic counter of structural modifications. */
  public int generation() {
    return generation;
  }

  void modified() {
    generation++;
  }

  public void pushBack(MethodItemEntry entry) {
    insertBefore(null, entry);
  }

  public void pushFront(MethodItemEntry entry) {
    insertBefore(head, entry);
  }

  /** Inserts {@code entry} before {@code position}, or at the end if {@code position} is null. */
  public void insertBefore(@Nullable MethodItemEntry position, MethodItemEntry entry) {
    checkArgument(checkNotNull(entry).owner == null, "%s is already in a method", entry);
    if (position != null) {
      checkOwned(position);
    }
    MethodItemEntry before = position == null ? tail : position.prev;
    entry.prev = before;
    entry.next = position;
    if (before == null) {
      head = entry;
    } else {
      before.next = entry;
    }
    if (position == null) {
      tail = entry;
    } else {
      position.prev = entry;
    }
    entry.owner = this;
    size++;
    generation++;
  }

  public void insertAfter(MethodItemEntry position, MethodItemEntry entry) {
    checkOwned(position);
    insertBefore(position.next, entry);
  }

  /**
   * Unlinks {@code entry} and returns the item that followed it. The removed entry keeps pointing
   * at that item so that iterators positioned on it can continue.
   */
  @Nullable
  public MethodItemEntry remove(MethodItemEntry entry) {
    checkOwned(entry);
    MethodItemEntry after = entry.next;
    if (entry.prev == null) {
      head = after;
    } else {
      entry.prev.next = after;
    }
    if (after == null) {
      tail = entry.prev;
    } else {
      after.prev = entry.prev;
    }
    entry.prev = null;
    entry.owner = null;
    size--;
    generation++;
    return after;
  }

  private void checkOwned(MethodItemEntry entry) {
    checkArgument(entry.owner == this, "%s is not part of this method", entry);
  }

  @Override
  public Iterator<MethodItemEntry> iterator() {
    return iteratorFrom(head);
  }

  /** Iterates from {@code start} (inclusive) to the end of the list. */
  public Iterator<MethodItemEntry> iteratorFrom(@Nullable MethodItemEntry start) {
    return new Iterator<MethodItemEntry>() {
      private boolean started;
      @Nullable private MethodItemEntry cursor;

      // A removed entry keeps its successor link, so the walk can resume from it.
      @Nullable
      private MethodItemEntry peek() {
        MethodItemEntry n = started ? (cursor == null ? null : cursor.next) : start;
        while (n != null && n.owner != FatMethod.this) {
          n = n.next;
        }
        return n;
      }

      @Override
      public boolean hasNext() {
        return peek() != null;
      }

      @Override
      public MethodItemEntry next() {
        MethodItemEntry n = peek();
        if (n == null) {
          throw new NoSuchElementException();
        }
        started = true;
        cursor = n;
        return n;
      }

      @Override
      public void remove() {
        if (cursor == null || cursor.owner != FatMethod.this) {
          throw new IllegalStateException();
        }
        FatMethod.this.remove(cursor);
      }
    };
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (MethodItemEntry e = head; e != null; e = e.next) {
      sb.append(e).append(System.lineSeparator());
    }
    return sb.toString();
  }
}
