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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.dexopt.dex.DexClass;
import com.google.devtools.dexopt.dex.DexCode;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.dex.DexMethod;
import com.google.devtools.dexopt.dex.DexOpcode;
import com.google.devtools.dexopt.dex.DexOpcodeMethod;
import com.google.devtools.dexopt.dex.DexOpcodeType;
import com.google.devtools.dexopt.dex.DexType;
import com.google.devtools.dexopt.dex.Scope;
import com.google.devtools.dexopt.opt.Pass;
import java.util.List;

/**
 * Removes builder objects whose only purpose is to collect values for their build method. Field
 * values are traced from the stores in the setters to the loads in the build method, so that after
 * inlining both the builder allocation and its fields disappear.
 *
 * <p>A class is a builder when its descriptor matches {@link RemoveBuildersOptions#builderPattern},
 * it extends {@code java.lang.Object}, has no static fields, only trivial constructors and exactly
 * one build method.
 */
public final class RemoveBuildersPass implements Pass {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final DexType OBJECT = DexType.of("Ljava/lang/Object;");

  /** Counters of the last {@link #run}. */
  public static final class Stats {
    int builders;
    int candidates;
    int removed;
    int escaped;
    int failed;

    public int builders() {
      return builders;
    }

    /** Methods that allocate a builder. */
    public int candidates() {
      return candidates;
    }

    public int removed() {
      return removed;
    }

    public int escaped() {
      return escaped;
    }

    /** Candidates left unchanged by inlining or by the field analysis. */
    public int failed() {
      return failed;
    }
  }

  private final RemoveBuildersOptions options;
  private Stats stats = new Stats();

  public RemoveBuildersPass(RemoveBuildersOptions options) {
    this.options = options;
  }

  @Override
  public String name() {
    return "RemoveBuildersPass";
  }

  public Stats stats() {
    return stats;
  }

  @Override
  public void run(Scope scope) {
    stats = new Stats();
    ImmutableList<DexClass> builders = findBuilders(scope);
    stats.builders = builders.size();
    for (DexClass builder : builders) {
      for (DexMethod method : scope.allMethods()) {
        if (method.getCode() == null
            || method.ref().owner().equals(builder.type())
            || !instantiates(method.getCode(), builder.type())) {
          continue;
        }
        stats.candidates++;
        removeFrom(method, builder);
      }
    }
    logger.atInfo().log(
        "%s: %d builders, %d candidate methods, %d removed, %d escaped, %d failed",
        name(),
        stats.builders,
        stats.candidates,
        stats.removed,
        stats.escaped,
        stats.failed);
  }

  ImmutableList<DexClass> findBuilders(Scope scope) {
    ImmutableList.Builder<DexClass> builders = ImmutableList.builder();
    for (DexClass cls : scope) {
      String descriptor = cls.type().descriptor();
      if (!options.builderPattern().matcher(descriptor).find()
          || options.blocklist().contains(descriptor)) {
        continue;
      }
      if (!OBJECT.equals(cls.superType()) || !cls.staticFields().isEmpty()) {
        logger.atFine().log("%s: not a plain builder", cls);
        continue;
      }
      if (!cls.constructors().stream().allMatch(RemoveBuildersPass::isTrivialConstructor)) {
        logger.atFine().log("%s: constructor does more than call super", cls);
        continue;
      }
      long buildMethods =
          cls.methods().stream()
              .filter(m -> !m.isStatic() && m.ref().name().equals(options.buildMethodName()))
              .count();
      if (buildMethods != 1) {
        logger.atFine().log("%s: %d build methods", cls, buildMethods);
        continue;
      }
      builders.add(cls);
    }
    return builders.build();
  }

  /** Whether the constructor only calls {@code Object.<init>} on the receiver and returns. */
  private static boolean isTrivialConstructor(DexMethod ctor) {
    DexCode code = ctor.getCode();
    if (code == null) {
      return false;
    }
    List<DexInstruction> insns = ImmutableList.copyOf(instructions(code));
    if (insns.size() != 2 || insns.get(1).opcode() != DexOpcode.RETURN_VOID) {
      return false;
    }
    DexInstruction first = insns.get(0);
    if (first.opcode() != DexOpcode.INVOKE_DIRECT) {
      return false;
    }
    DexOpcodeMethod call = (DexOpcodeMethod) first;
    return call.getMethod().owner().equals(OBJECT)
        && call.getMethod().isConstructor()
        && call.argWordCount() == 1
        && call.src(0) == code.getRegistersSize() - code.getInsSize();
  }

  private static Iterable<DexInstruction> instructions(DexCode code) {
    return code.isBallooned() ? code.getEntries().instructions() : code.getInstructions();
  }

  private static boolean instantiates(DexCode code, DexType type) {
    for (DexInstruction insn : instructions(code)) {
      if (insn.opcode() == DexOpcode.NEW_INSTANCE
          && ((DexOpcodeType) insn).getType().equals(type)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Works on a copy of the method body, which replaces the original only if the builder could be
   * removed.
   */
  private void removeFrom(DexMethod method, DexClass builder) {
    DexCode original = method.getCode();
    boolean wasBallooned = original.isBallooned();
    if (!wasBallooned) {
      original.balloon();
    }
    if (RemoveBuildersHelper.escapes(original.getEntries().buildCfg(), builder.type())) {
      stats.escaped++;
      logger.atFine().log("%s: %s escapes", method.ref(), builder.type());
      if (!wasBallooned) {
        original.sync();
      }
      return;
    }
    original.sync();
    DexCode working = original.copy();
    method.setCode(working);
    working.balloon();

    boolean removed =
        RemoveBuildersHelper.inlineBuild(
                method, builder, options.buildMethodName(), options.useLiveness())
            && !RemoveBuildersHelper.escapes(working.getEntries().buildCfg(), builder.type())
            && RemoveBuildersHelper.removeBuilder(method, builder);
    if (removed) {
      stats.removed++;
      if (!wasBallooned) {
        working.sync();
      }
      return;
    }
    stats.failed++;
    logger.atFine().log("%s: left unchanged, %s not removed", method.ref(), builder.type());
    method.setCode(original);
    if (wasBallooned) {
      original.balloon();
    }
  }
}
