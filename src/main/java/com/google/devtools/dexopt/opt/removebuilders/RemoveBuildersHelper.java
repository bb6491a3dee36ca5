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
import com.google.devtools.dexopt.dataflow.Dataflow;
import com.google.devtools.dexopt.dataflow.InstructionRegisters;
import com.google.devtools.dexopt.dex.DexClass;
import com.google.devtools.dexopt.dex.DexCode;
import com.google.devtools.dexopt.dex.DexField;
import com.google.devtools.dexopt.dex.DexFieldRef;
import com.google.devtools.dexopt.dex.DexInstruction;
import com.google.devtools.dexopt.dex.DexMethod;
import com.google.devtools.dexopt.dex.DexMethodRef;
import com.google.devtools.dexopt.dex.DexOpcode;
import com.google.devtools.dexopt.dex.DexOpcodeField;
import com.google.devtools.dexopt.dex.DexOpcodeMethod;
import com.google.devtools.dexopt.dex.DexOpcodeType;
import com.google.devtools.dexopt.dex.DexType;
import com.google.devtools.dexopt.ir.ControlFlowGraph;
import com.google.devtools.dexopt.transform.InlineContext;
import com.google.devtools.dexopt.transform.Inliner;
import com.google.devtools.dexopt.transform.MethodTransform;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** The analyses and rewrites behind {@link RemoveBuildersPass}. */
final class RemoveBuildersHelper {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Bound on builder calls inlined into one method, including calls exposed by inlining. */
  private static final int MAX_INLINED_CALLS = 64;

  private RemoveBuildersHelper() {}

  static ImmutableList<DexFieldRef> trackedFields(DexClass builder) {
    ImmutableList.Builder<DexFieldRef> fields = ImmutableList.builder();
    for (DexField f : builder.instanceFields()) {
      fields.add(f.ref());
    }
    return fields.build();
  }

  static void fieldsMapping(
      DexInstruction insn, FieldsRegs fregs, DexType builder, boolean isSetter) {
    if (insn.hasDest()) {
      fregs.overwrite(insn.dest());
      if (insn.isDestWide()) {
        fregs.overwrite(insn.dest() + 1);
      }
    }
    DexOpcode op = insn.opcode();
    if ((isSetter && op.isIput()) || (!isSetter && op.isIget())) {
      DexFieldRef field = ((DexOpcodeField) insn).getField();
      if (field.owner().equals(builder) && fregs.tracks(field)) {
        fregs.set(field, isSetter ? insn.src(0) : insn.dest());
      }
    }
  }

  /** For each instruction, the registers holding the last value written to each builder field. */
  static Map<DexInstruction, FieldsRegs> fieldsSetters(ControlFlowGraph cfg, DexClass builder) {
    return Dataflow.forwards(
        cfg,
        new FieldsRegs(trackedFields(builder)),
        (insn, fregs) -> fieldsMapping(insn, fregs, builder.type(), true));
  }

  /** For each instruction, the registers holding the last value read from each builder field. */
  static Map<DexInstruction, FieldsRegs> fieldsGetters(ControlFlowGraph cfg, DexClass builder) {
    return Dataflow.forwards(
        cfg,
        new FieldsRegs(trackedFields(builder)),
        (insn, fregs) -> fieldsMapping(insn, fregs, builder.type(), false));
  }

  static void taint(DexInstruction insn, TaintedRegs regs, DexType builder) {
    DexOpcode op = insn.opcode();
    boolean resultTainted = regs.isTainted(TaintedRegs.RESULT);
    regs.set(TaintedRegs.RESULT, false);
    if (op == DexOpcode.NEW_INSTANCE) {
      regs.set(insn.dest(), ((DexOpcodeType) insn).getType().equals(builder));
    } else if (op.isObjectMove()) {
      regs.set(insn.dest(), regs.isTainted(insn.src(0)));
    } else if (op == DexOpcode.MOVE_RESULT_OBJECT) {
      regs.set(insn.dest(), resultTainted);
    } else if (op == DexOpcode.CHECK_CAST) {
      // Same value, same register.
    } else if (op.isInvoke()) {
      DexMethodRef callee = ((DexOpcodeMethod) insn).getMethod();
      if (callee.owner().equals(builder)
          && callee.proto().returnType().equals(builder)
          && anyTainted(InstructionRegisters.uses(insn), regs)) {
        regs.set(TaintedRegs.RESULT, true);
      }
    } else if (insn.hasDest()) {
      regs.set(insn.dest(), false);
      if (insn.isDestWide()) {
        regs.set(insn.dest() + 1, false);
      }
    }
  }

  static Map<DexInstruction, TaintedRegs> taintedRegs(ControlFlowGraph cfg, DexType builder) {
    return Dataflow.forwards(cfg, new TaintedRegs(), (insn, regs) -> taint(insn, regs, builder));
  }

  /**
   * Marks the destination of a builder field read, and clears the destination of every other
   * instruction.
   */
  static void load(DexInstruction insn, TaintedRegs regs, DexType builder) {
    if (!insn.hasDest()) {
      return;
    }
    boolean fromBuilder =
        insn.opcode().isIget() && ((DexOpcodeField) insn).getField().owner().equals(builder);
    regs.set(insn.dest(), fromBuilder);
    if (insn.isDestWide()) {
      regs.set(insn.dest() + 1, fromBuilder);
    }
  }

  /** For each instruction, the registers that may hold a value read from a builder field. */
  static Map<DexInstruction, TaintedRegs> loadedRegs(ControlFlowGraph cfg, DexType builder) {
    return Dataflow.forwards(cfg, new TaintedRegs(), (insn, regs) -> load(insn, regs, builder));
  }

  /** Whether {@code reg} holds, or is the upper half of, the value of a field in {@code fregs}. */
  private static boolean holdsField(FieldsRegs fregs, List<DexFieldRef> fields, int reg) {
    for (DexFieldRef f : fields) {
      int r = fregs.get(f);
      if (r == reg || (r >= 0 && f.type().isWide() && r + 1 == reg)) {
        return true;
      }
    }
    return false;
  }

  private static boolean anyTainted(BitSet regs, TaintedRegs tainted) {
    for (int r = regs.nextSetBit(0); r >= 0; r = regs.nextSetBit(r + 1)) {
      if (tainted.isTainted(r)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether a builder instance created in the method may be seen by code other than the builder's
   * own fields and methods.
   */
  static boolean escapes(ControlFlowGraph cfg, DexType builder) {
    Map<DexInstruction, TaintedRegs> tainted = taintedRegs(cfg, builder);
    for (Map.Entry<DexInstruction, TaintedRegs> e : tainted.entrySet()) {
      if (escapesAt(e.getKey(), e.getValue(), builder)) {
        logger.atFine().log("%s escapes through %s", builder, e.getKey());
        return true;
      }
    }
    return false;
  }

  private static boolean escapesAt(DexInstruction insn, TaintedRegs tainted, DexType builder) {
    if (!anyTainted(InstructionRegisters.uses(insn), tainted)) {
      return false;
    }
    DexOpcode op = insn.opcode();
    if (op.isObjectMove() || op == DexOpcode.CHECK_CAST) {
      return false;
    }
    if (op.isIget()) {
      return !((DexOpcodeField) insn).getField().owner().equals(builder);
    }
    if (op.isIput()) {
      return !((DexOpcodeField) insn).getField().owner().equals(builder)
          || tainted.isTainted(insn.src(0));
    }
    if (op.isInvoke()) {
      return !((DexOpcodeMethod) insn).getMethod().owner().equals(builder);
    }
    return true;
  }

  /**
   * Inlines every call to a builder method other than a constructor. Calls exposed by inlining
   * are inlined too.
   *
   * @return false if the build method is called more than once, or if a call cannot be inlined
   */
  static boolean inlineBuild(
      DexMethod method, DexClass builder, String buildMethodName, boolean useLiveness) {
    MethodTransform transform = method.getCode().getEntries();
    int buildCalls = 0;
    for (DexInstruction insn : transform.instructions()) {
      DexMethodRef callee = builderCallee(insn, builder.type());
      if (callee != null && callee.name().equals(buildMethodName)) {
        buildCalls++;
      }
    }
    // Two instances of the same builder are not handled.
    if (buildCalls > 1) {
      logger.atFine().log("%s calls %s.%s %d times", method, builder, buildMethodName, buildCalls);
      return false;
    }

    InlineContext context = new InlineContext(method, useLiveness);
    for (int inlined = 0; ; inlined++) {
      DexOpcodeMethod call = null;
      for (DexInstruction insn : transform.instructions()) {
        DexMethodRef callee = builderCallee(insn, builder.type());
        if (callee != null && !callee.isConstructor()) {
          call = (DexOpcodeMethod) insn;
          break;
        }
      }
      if (call == null) {
        return true;
      }
      DexMethod callee = builder.findMethod(call.getMethod());
      if (callee == null || callee.getCode() == null || inlined >= MAX_INLINED_CALLS) {
        logger.atFine().log("cannot inline %s into %s", call.getMethod(), method);
        return false;
      }
      if (!Inliner.inline16Regs(context, callee, call)) {
        return false;
      }
    }
  }

  @Nullable
  private static DexMethodRef builderCallee(DexInstruction insn, DexType builder) {
    if (!insn.opcode().isInvoke()) {
      return null;
    }
    DexMethodRef callee = ((DexOpcodeMethod) insn).getMethod();
    return callee.owner().equals(builder) ? callee : null;
  }

  private record Replacement(DexInstruction insn, int srcIndex, int reg) {}

  /**
   * Deletes the builder instance of {@code method}: its allocation, construction, field accesses
   * and copies of its reference. Uses of registers loaded from builder fields are redirected to the
   * registers the values were stored from.
   *
   * <p>Expects every other call to a builder method to be inlined already.
   *
   * @return false, after changing nothing, if some field value cannot be traced to exactly one
   *     register
   */
  static boolean removeBuilder(DexMethod method, DexClass builder) {
    DexType type = builder.type();
    DexCode code = method.getCode();
    MethodTransform transform = code.getEntries();
    ControlFlowGraph cfg = transform.buildCfg();
    Map<DexInstruction, FieldsRegs> setters = fieldsSetters(cfg, builder);
    Map<DexInstruction, FieldsRegs> getters = fieldsGetters(cfg, builder);
    Map<DexInstruction, TaintedRegs> tainted = taintedRegs(cfg, type);
    Map<DexInstruction, TaintedRegs> loaded = loadedRegs(cfg, type);
    ImmutableList<DexFieldRef> fields = trackedFields(builder);

    List<DexInstruction> deletes = new ArrayList<>();
    List<Replacement> replacements = new ArrayList<>();
    List<Replacement> undefined = new ArrayList<>();
    int instances = 0;

    for (DexInstruction insn : transform.instructions()) {
      DexOpcode op = insn.opcode();
      TaintedRegs taint = tainted.get(insn);
      if (op.isIget() || op.isIput()) {
        DexFieldRef field = ((DexOpcodeField) insn).getField();
        if (field.owner().equals(type)) {
          int object = op.isIget() ? insn.src(0) : insn.src(1);
          if (!taint.isTainted(object)) {
            logger.atFine().log("%s: %s is applied to another instance", method, insn);
            return false;
          }
          deletes.add(insn);
          continue;
        }
      } else if (op == DexOpcode.NEW_INSTANCE) {
        if (((DexOpcodeType) insn).getType().equals(type)) {
          instances++;
          deletes.add(insn);
          continue;
        }
      } else if (op.isInvoke()) {
        DexMethodRef callee = builderCallee(insn, type);
        if (callee != null) {
          if (!callee.isConstructor() || !taint.isTainted(Inliner.argRegisters(insn)[0])) {
            logger.atFine().log("%s: %s was not inlined", method, insn);
            return false;
          }
          deletes.add(insn);
          continue;
        }
      } else if ((op.isObjectMove() || op == DexOpcode.CHECK_CAST)
          && taint.isTainted(insn.src(0))) {
        deletes.add(insn);
        continue;
      } else if (op == DexOpcode.MOVE_RESULT_OBJECT && taint.isTainted(TaintedRegs.RESULT)) {
        deletes.add(insn);
        continue;
      }

      FieldsRegs fieldsIn = setters.get(insn);
      FieldsRegs fieldsOut = getters.get(insn);
      // A field read is deleted, so each register it may reach here must be one the rewrite
      // below can redirect.
      BitSet uses = InstructionRegisters.uses(insn);
      for (int r = uses.nextSetBit(0); r >= 0; r = uses.nextSetBit(r + 1)) {
        if (loaded.get(insn).isTainted(r) && !holdsField(fieldsOut, fields, r)) {
          logger.atFine().log("%s: v%d may hold a field value of %s at %s", method, r, type, insn);
          return false;
        }
      }
      if (insn.hasRange()) {
        for (DexFieldRef f : fields) {
          int reg = fieldsOut.get(f);
          if (reg >= insn.rangeBase() && reg < insn.rangeBase() + insn.rangeSize()) {
            logger.atFine().log("%s: field value passed in register range by %s", method, insn);
            return false;
          }
        }
      }
      for (int i = 0; i < insn.srcsSize(); i++) {
        int src = insn.src(i);
        for (DexFieldRef f : fields) {
          if (fieldsOut.get(f) != src) {
            continue;
          }
          int value = fieldsIn.get(f);
          if (value == FieldsRegs.UNDEFINED) {
            if (f.type().isWide()) {
              logger.atFine().log("%s: wide field %s read before written", method, f);
              return false;
            }
            undefined.add(new Replacement(insn, i, 0));
          } else if (value < 0) {
            logger.atFine().log("%s: no single register holds %s at %s", method, f, insn);
            return false;
          } else if (value != src) {
            replacements.add(new Replacement(insn, i, value));
          }
        }
      }
    }

    if (instances != 1) {
      logger.atFine().log("%s: %d instances of %s", method, instances, type);
      return false;
    }
    int shift = undefined.isEmpty() ? 0 : 1;
    for (Replacement r : replacements) {
      if (r.insn().destIsSrc0() && r.srcIndex() == 0) {
        logger.atFine().log("%s: cannot rewrite the source of %s alone", method, r.insn());
        return false;
      }
      if (r.reg() + shift >= 1 << r.insn().srcBitWidth(r.srcIndex())) {
        logger.atFine().log("%s: v%d does not fit %s", method, r.reg() + shift, r.insn());
        return false;
      }
    }
    for (Replacement r : undefined) {
      if (r.insn().destIsSrc0() && r.srcIndex() == 0) {
        logger.atFine().log("%s: cannot rewrite the source of %s alone", method, r.insn());
        return false;
      }
    }

    if (!undefined.isEmpty()) {
      // Every register moves up by one, which frees v0 to hold the default value.
      if (!MethodTransform.enlargeRegs(method, code.getRegistersSize() + 1)) {
        return false;
      }
      transform.insertAfter(
          null, ImmutableList.of(new DexInstruction(DexOpcode.CONST_4).setDest(0).setLiteral(0)));
    }
    for (DexInstruction insn : deletes) {
      transform.removeOpcode(insn);
    }
    for (Replacement r : replacements) {
      r.insn().setSrc(r.srcIndex(), r.reg() + shift);
    }
    for (Replacement r : undefined) {
      r.insn().setSrc(r.srcIndex(), r.reg());
    }
    logger.atFine().log("removed %s from %s", type, method);
    return true;
  }
}
