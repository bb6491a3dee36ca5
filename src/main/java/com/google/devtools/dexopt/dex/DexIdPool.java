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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The string, type, field and method index tables that instruction index operands point into.
 * Interning a symbol that is not in a table appends it.
 */
public final class DexIdPool {
  private final Table<String> strings = new Table<>();
  private final Table<DexType> types = new Table<>();
  private final Table<DexFieldRef> fields = new Table<>();
  private final Table<DexMethodRef> methods = new Table<>();

  public int intern(String string) {
    return strings.intern(string);
  }

  public int intern(DexType type) {
    return types.intern(type);
  }

  public int intern(DexFieldRef field) {
    return fields.intern(field);
  }

  public int intern(DexMethodRef method) {
    return methods.intern(method);
  }

  public String string(int index) {
    return strings.get(index);
  }

  public DexType type(int index) {
    return types.get(index);
  }

  public DexFieldRef field(int index) {
    return fields.get(index);
  }

  public DexMethodRef method(int index) {
    return methods.get(index);
  }

  private static final class Table<T> {
    private final List<T> values = new ArrayList<>();
    private final Map<T, Integer> indices = new HashMap<>();

    int intern(T value) {
      checkNotNull(value);
      Integer index = indices.get(value);
      if (index == null) {
        index = values.size();
        values.add(value);
        indices.put(value, index);
      }
      return index;
    }

    T get(int index) {
      return values.get(index);
    }
  }
}
