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
import static com.google.devtools.dexopt.dex.InstructionFormat.F10T;
import static com.google.devtools.dexopt.dex.InstructionFormat.F10X;
import static com.google.devtools.dexopt.dex.InstructionFormat.F11N;
import static com.google.devtools.dexopt.dex.InstructionFormat.F11X;
import static com.google.devtools.dexopt.dex.InstructionFormat.F12X;
import static com.google.devtools.dexopt.dex.InstructionFormat.F20T;
import static com.google.devtools.dexopt.dex.InstructionFormat.F21C;
import static com.google.devtools.dexopt.dex.InstructionFormat.F21H;
import static com.google.devtools.dexopt.dex.InstructionFormat.F21S;
import static com.google.devtools.dexopt.dex.InstructionFormat.F21T;
import static com.google.devtools.dexopt.dex.InstructionFormat.F22B;
import static com.google.devtools.dexopt.dex.InstructionFormat.F22C;
import static com.google.devtools.dexopt.dex.InstructionFormat.F22S;
import static com.google.devtools.dexopt.dex.InstructionFormat.F22T;
import static com.google.devtools.dexopt.dex.InstructionFormat.F22X;
import static com.google.devtools.dexopt.dex.InstructionFormat.F23X;
import static com.google.devtools.dexopt.dex.InstructionFormat.F30T;
import static com.google.devtools.dexopt.dex.InstructionFormat.F31C;
import static com.google.devtools.dexopt.dex.InstructionFormat.F31I;
import static com.google.devtools.dexopt.dex.InstructionFormat.F31T;
import static com.google.devtools.dexopt.dex.InstructionFormat.F32X;
import static com.google.devtools.dexopt.dex.InstructionFormat.F35C;
import static com.google.devtools.dexopt.dex.InstructionFormat.F3RC;
import static com.google.devtools.dexopt.dex.InstructionFormat.F51L;
import static com.google.devtools.dexopt.dex.OpcodeFlags.MAY_THROW;
import static com.google.devtools.dexopt.dex.OpcodeFlags.WIDE_DEST;
import static com.google.devtools.dexopt.dex.OpcodeFlags.WIDE_SRC0;
import static com.google.devtools.dexopt.dex.OpcodeFlags.WIDE_SRC1;
import static com.google.devtools.dexopt.dex.RegisterLayout.ARGS;
import static com.google.devtools.dexopt.dex.RegisterLayout.DEST;
import static com.google.devtools.dexopt.dex.RegisterLayout.DEST_IS_SRC;
import static com.google.devtools.dexopt.dex.RegisterLayout.DEST_SRC;
import static com.google.devtools.dexopt.dex.RegisterLayout.DEST_SRC_SRC;
import static com.google.devtools.dexopt.dex.RegisterLayout.NONE;
import static com.google.devtools.dexopt.dex.RegisterLayout.RANGE;
import static com.google.devtools.dexopt.dex.RegisterLayout.SRC;
import static com.google.devtools.dexopt.dex.RegisterLayout.SRC_SRC;
import static com.google.devtools.dexopt.dex.RegisterLayout.SRC_SRC_SRC;
import static com.google.devtools.dexopt.dex.RegisterLayout.TWO_ADDR;

/**
 * The Dalvik opcode table. Every one of the 256 opcode values has an entry; values the instruction
 * set leaves unassigned are {@code unused-xx} entries of format 10x.
 *
 * <p>Payload pseudo-instructions share the {@code nop} opcode and are modelled by {@link
 * DexOpcodeData}.
 */
public enum DexOpcode {
  NOP(0x00, "nop", F10X, NONE),
  MOVE(0x01, "move", F12X, DEST_SRC),
  MOVE_FROM16(0x02, "move/from16", F22X, DEST_SRC),
  MOVE_16(0x03, "move/16", F32X, DEST_SRC),
  MOVE_WIDE(0x04, "move-wide", F12X, DEST_SRC, WIDE_DEST | WIDE_SRC0),
  MOVE_WIDE_FROM16(0x05, "move-wide/from16", F22X, DEST_SRC, WIDE_DEST | WIDE_SRC0),
  MOVE_WIDE_16(0x06, "move-wide/16", F32X, DEST_SRC, WIDE_DEST | WIDE_SRC0),
  MOVE_OBJECT(0x07, "move-object", F12X, DEST_SRC),
  MOVE_OBJECT_FROM16(0x08, "move-object/from16", F22X, DEST_SRC),
  MOVE_OBJECT_16(0x09, "move-object/16", F32X, DEST_SRC),
  MOVE_RESULT(0x0a, "move-result", F11X, DEST),
  MOVE_RESULT_WIDE(0x0b, "move-result-wide", F11X, DEST, WIDE_DEST),
  MOVE_RESULT_OBJECT(0x0c, "move-result-object", F11X, DEST),
  MOVE_EXCEPTION(0x0d, "move-exception", F11X, DEST),
  RETURN_VOID(0x0e, "return-void", F10X, NONE),
  RETURN(0x0f, "return", F11X, SRC),
  RETURN_WIDE(0x10, "return-wide", F11X, SRC, WIDE_SRC0),
  RETURN_OBJECT(0x11, "return-object", F11X, SRC),
  CONST_4(0x12, "const/4", F11N, DEST),
  CONST_16(0x13, "const/16", F21S, DEST),
  CONST(0x14, "const", F31I, DEST),
  CONST_HIGH16(0x15, "const/high16", F21H, DEST),
  CONST_WIDE_16(0x16, "const-wide/16", F21S, DEST, WIDE_DEST),
  CONST_WIDE_32(0x17, "const-wide/32", F31I, DEST, WIDE_DEST),
  CONST_WIDE(0x18, "const-wide", F51L, DEST, WIDE_DEST),
  CONST_WIDE_HIGH16(0x19, "const-wide/high16", F21H, DEST, WIDE_DEST),
  CONST_STRING(0x1a, "const-string", F21C, DEST, ReferenceKind.STRING, MAY_THROW),
  CONST_STRING_JUMBO(0x1b, "const-string/jumbo", F31C, DEST, ReferenceKind.STRING, MAY_THROW),
  CONST_CLASS(0x1c, "const-class", F21C, DEST, ReferenceKind.TYPE, MAY_THROW),
  MONITOR_ENTER(0x1d, "monitor-enter", F11X, SRC, MAY_THROW),
  MONITOR_EXIT(0x1e, "monitor-exit", F11X, SRC, MAY_THROW),
  CHECK_CAST(0x1f, "check-cast", F21C, DEST_IS_SRC, ReferenceKind.TYPE, MAY_THROW),
  INSTANCE_OF(0x20, "instance-of", F22C, DEST_SRC, ReferenceKind.TYPE, MAY_THROW),
  ARRAY_LENGTH(0x21, "array-length", F12X, DEST_SRC, MAY_THROW),
  NEW_INSTANCE(0x22, "new-instance", F21C, DEST, ReferenceKind.TYPE, MAY_THROW),
  NEW_ARRAY(0x23, "new-array", F22C, DEST_SRC, ReferenceKind.TYPE, MAY_THROW),
  FILLED_NEW_ARRAY(0x24, "filled-new-array", F35C, ARGS, ReferenceKind.TYPE, MAY_THROW),
  FILLED_NEW_ARRAY_RANGE(
      0x25, "filled-new-array/range", F3RC, RANGE, ReferenceKind.TYPE, MAY_THROW),
  FILL_ARRAY_DATA(0x26, "fill-array-data", F31T, SRC, MAY_THROW),
  THROW(0x27, "throw", F11X, SRC, MAY_THROW),
  GOTO(0x28, "goto", F10T, NONE),
  GOTO_16(0x29, "goto/16", F20T, NONE),
  GOTO_32(0x2a, "goto/32", F30T, NONE),
  PACKED_SWITCH(0x2b, "packed-switch", F31T, SRC),
  SPARSE_SWITCH(0x2c, "sparse-switch", F31T, SRC),
  CMPL_FLOAT(0x2d, "cmpl-float", F23X, DEST_SRC_SRC),
  CMPG_FLOAT(0x2e, "cmpg-float", F23X, DEST_SRC_SRC),
  CMPL_DOUBLE(0x2f, "cmpl-double", F23X, DEST_SRC_SRC, WIDE_SRC0 | WIDE_SRC1),
  CMPG_DOUBLE(0x30, "cmpg-double", F23X, DEST_SRC_SRC, WIDE_SRC0 | WIDE_SRC1),
  CMP_LONG(0x31, "cmp-long", F23X, DEST_SRC_SRC, WIDE_SRC0 | WIDE_SRC1),
  IF_EQ(0x32, "if-eq", F22T, SRC_SRC),
  IF_NE(0x33, "if-ne", F22T, SRC_SRC),
  IF_LT(0x34, "if-lt", F22T, SRC_SRC),
  IF_GE(0x35, "if-ge", F22T, SRC_SRC),
  IF_GT(0x36, "if-gt", F22T, SRC_SRC),
  IF_LE(0x37, "if-le", F22T, SRC_SRC),
  IF_EQZ(0x38, "if-eqz", F21T, SRC),
  IF_NEZ(0x39, "if-nez", F21T, SRC),
  IF_LTZ(0x3a, "if-ltz", F21T, SRC),
  IF_GEZ(0x3b, "if-gez", F21T, SRC),
  IF_GTZ(0x3c, "if-gtz", F21T, SRC),
  IF_LEZ(0x3d, "if-lez", F21T, SRC),
  UNUSED_3E(0x3e, "unused-3e", F10X, NONE),
  UNUSED_3F(0x3f, "unused-3f", F10X, NONE),
  UNUSED_40(0x40, "unused-40", F10X, NONE),
  UNUSED_41(0x41, "unused-41", F10X, NONE),
  UNUSED_42(0x42, "unused-42", F10X, NONE),
  UNUSED_43(0x43, "unused-43", F10X, NONE),
  AGET(0x44, "aget", F23X, DEST_SRC_SRC, MAY_THROW),
  AGET_WIDE(0x45, "aget-wide", F23X, DEST_SRC_SRC, MAY_THROW | WIDE_DEST),
  AGET_OBJECT(0x46, "aget-object", F23X, DEST_SRC_SRC, MAY_THROW),
  AGET_BOOLEAN(0x47, "aget-boolean", F23X, DEST_SRC_SRC, MAY_THROW),
  AGET_BYTE(0x48, "aget-byte", F23X, DEST_SRC_SRC, MAY_THROW),
  AGET_CHAR(0x49, "aget-char", F23X, DEST_SRC_SRC, MAY_THROW),
  AGET_SHORT(0x4a, "aget-short", F23X, DEST_SRC_SRC, MAY_THROW),
  APUT(0x4b, "aput", F23X, SRC_SRC_SRC, MAY_THROW),
  APUT_WIDE(0x4c, "aput-wide", F23X, SRC_SRC_SRC, MAY_THROW | WIDE_SRC0),
  APUT_OBJECT(0x4d, "aput-object", F23X, SRC_SRC_SRC, MAY_THROW),
  APUT_BOOLEAN(0x4e, "aput-boolean", F23X, SRC_SRC_SRC, MAY_THROW),
  APUT_BYTE(0x4f, "aput-byte", F23X, SRC_SRC_SRC, MAY_THROW),
  APUT_CHAR(0x50, "aput-char", F23X, SRC_SRC_SRC, MAY_THROW),
  APUT_SHORT(0x51, "aput-short", F23X, SRC_SRC_SRC, MAY_THROW),
  IGET(0x52, "iget", F22C, DEST_SRC, ReferenceKind.FIELD, MAY_THROW),
  IGET_WIDE(0x53, "iget-wide", F22C, DEST_SRC, ReferenceKind.FIELD, MAY_THROW | WIDE_DEST),
  IGET_OBJECT(0x54, "iget-object", F22C, DEST_SRC, ReferenceKind.FIELD, MAY_THROW),
  IGET_BOOLEAN(0x55, "iget-boolean", F22C, DEST_SRC, ReferenceKind.FIELD, MAY_THROW),
  IGET_BYTE(0x56, "iget-byte", F22C, DEST_SRC, ReferenceKind.FIELD, MAY_THROW),
  IGET_CHAR(0x57, "iget-char", F22C, DEST_SRC, ReferenceKind.FIELD, MAY_THROW),
  IGET_SHORT(0x58, "iget-short", F22C, DEST_SRC, ReferenceKind.FIELD, MAY_THROW),
  IPUT(0x59, "iput", F22C, SRC_SRC, ReferenceKind.FIELD, MAY_THROW),
  IPUT_WIDE(0x5a, "iput-wide", F22C, SRC_SRC, ReferenceKind.FIELD, MAY_THROW | WIDE_SRC0),
  IPUT_OBJECT(0x5b, "iput-object", F22C, SRC_SRC, ReferenceKind.FIELD, MAY_THROW),
  IPUT_BOOLEAN(0x5c, "iput-boolean", F22C, SRC_SRC, ReferenceKind.FIELD, MAY_THROW),
  IPUT_BYTE(0x5d, "iput-byte", F22C, SRC_SRC, ReferenceKind.FIELD, MAY_THROW),
  IPUT_CHAR(0x5e, "iput-char", F22C, SRC_SRC, ReferenceKind.FIELD, MAY_THROW),
  IPUT_SHORT(0x5f, "iput-short", F22C, SRC_SRC, ReferenceKind.FIELD, MAY_THROW),
  SGET(0x60, "sget", F21C, DEST, ReferenceKind.FIELD, MAY_THROW),
  SGET_WIDE(0x61, "sget-wide", F21C, DEST, ReferenceKind.FIELD, MAY_THROW | WIDE_DEST),
  SGET_OBJECT(0x62, "sget-object", F21C, DEST, ReferenceKind.FIELD, MAY_THROW),
  SGET_BOOLEAN(0x63, "sget-boolean", F21C, DEST, ReferenceKind.FIELD, MAY_THROW),
  SGET_BYTE(0x64, "sget-byte", F21C, DEST, ReferenceKind.FIELD, MAY_THROW),
  SGET_CHAR(0x65, "sget-char", F21C, DEST, ReferenceKind.FIELD, MAY_THROW),
  SGET_SHORT(0x66, "sget-short", F21C, DEST, ReferenceKind.FIELD, MAY_THROW),
  SPUT(0x67, "sput", F21C, SRC, ReferenceKind.FIELD, MAY_THROW),
  SPUT_WIDE(0x68, "sput-wide", F21C, SRC, ReferenceKind.FIELD, MAY_THROW | WIDE_SRC0),
  SPUT_OBJECT(0x69, "sput-object", F21C, SRC, ReferenceKind.FIELD, MAY_THROW),
  SPUT_BOOLEAN(0x6a, "sput-boolean", F21C, SRC, ReferenceKind.FIELD, MAY_THROW),
  SPUT_BYTE(0x6b, "sput-byte", F21C, SRC, ReferenceKind.FIELD, MAY_THROW),
  SPUT_CHAR(0x6c, "sput-char", F21C, SRC, ReferenceKind.FIELD, MAY_THROW),
  SPUT_SHORT(0x6d, "sput-short", F21C, SRC, ReferenceKind.FIELD, MAY_THROW),
  INVOKE_VIRTUAL(0x6e, "invoke-virtual", F35C, ARGS, ReferenceKind.METHOD, MAY_THROW),
  INVOKE_SUPER(0x6f, "invoke-super", F35C, ARGS, ReferenceKind.METHOD, MAY_THROW),
  INVOKE_DIRECT(0x70, "invoke-direct", F35C, ARGS, ReferenceKind.METHOD, MAY_THROW),
  INVOKE_STATIC(0x71, "invoke-static", F35C, ARGS, ReferenceKind.METHOD, MAY_THROW),
  INVOKE_INTERFACE(0x72, "invoke-interface", F35C, ARGS, ReferenceKind.METHOD, MAY_THROW),
  UNUSED_73(0x73, "unused-73", F10X, NONE),
  INVOKE_VIRTUAL_RANGE(0x74, "invoke-virtual/range", F3RC, RANGE, ReferenceKind.METHOD, MAY_THROW),
  INVOKE_SUPER_RANGE(0x75, "invoke-super/range", F3RC, RANGE, ReferenceKind.METHOD, MAY_THROW),
  INVOKE_DIRECT_RANGE(0x76, "invoke-direct/range", F3RC, RANGE, ReferenceKind.METHOD, MAY_THROW),
  INVOKE_STATIC_RANGE(0x77, "invoke-static/range", F3RC, RANGE, ReferenceKind.METHOD, MAY_THROW),
  INVOKE_INTERFACE_RANGE(
      0x78, "invoke-interface/range", F3RC, RANGE, ReferenceKind.METHOD, MAY_THROW),
  UNUSED_79(0x79, "unused-79", F10X, NONE),
  UNUSED_7A(0x7a, "unused-7a", F10X, NONE),
  NEG_INT(0x7b, "neg-int", F12X, DEST_SRC),
  NOT_INT(0x7c, "not-int", F12X, DEST_SRC),
  NEG_LONG(0x7d, "neg-long", F12X, DEST_SRC, WIDE_DEST | WIDE_SRC0),
  NOT_LONG(0x7e, "not-long", F12X, DEST_SRC, WIDE_DEST | WIDE_SRC0),
  NEG_FLOAT(0x7f, "neg-float", F12X, DEST_SRC),
  NEG_DOUBLE(0x80, "neg-double", F12X, DEST_SRC, WIDE_DEST | WIDE_SRC0),
  INT_TO_LONG(0x81, "int-to-long", F12X, DEST_SRC, WIDE_DEST),
  INT_TO_FLOAT(0x82, "int-to-float", F12X, DEST_SRC),
  INT_TO_DOUBLE(0x83, "int-to-double", F12X, DEST_SRC, WIDE_DEST),
  LONG_TO_INT(0x84, "long-to-int", F12X, DEST_SRC, WIDE_SRC0),
  LONG_TO_FLOAT(0x85, "long-to-float", F12X, DEST_SRC, WIDE_SRC0),
  LONG_TO_DOUBLE(0x86, "long-to-double", F12X, DEST_SRC, WIDE_DEST | WIDE_SRC0),
  FLOAT_TO_INT(0x87, "float-to-int", F12X, DEST_SRC),
  FLOAT_TO_LONG(0x88, "float-to-long", F12X, DEST_SRC, WIDE_DEST),
  FLOAT_TO_DOUBLE(0x89, "float-to-double", F12X, DEST_SRC, WIDE_DEST),
  DOUBLE_TO_INT(0x8a, "double-to-int", F12X, DEST_SRC, WIDE_SRC0),
  DOUBLE_TO_LONG(0x8b, "double-to-long", F12X, DEST_SRC, WIDE_DEST | WIDE_SRC0),
  DOUBLE_TO_FLOAT(0x8c, "double-to-float", F12X, DEST_SRC, WIDE_SRC0),
  INT_TO_BYTE(0x8d, "int-to-byte", F12X, DEST_SRC),
  INT_TO_CHAR(0x8e, "int-to-char", F12X, DEST_SRC),
  INT_TO_SHORT(0x8f, "int-to-short", F12X, DEST_SRC),
  ADD_INT(0x90, "add-int", F23X, DEST_SRC_SRC),
  SUB_INT(0x91, "sub-int", F23X, DEST_SRC_SRC),
  MUL_INT(0x92, "mul-int", F23X, DEST_SRC_SRC),
  DIV_INT(0x93, "div-int", F23X, DEST_SRC_SRC, MAY_THROW),
  REM_INT(0x94, "rem-int", F23X, DEST_SRC_SRC, MAY_THROW),
  AND_INT(0x95, "and-int", F23X, DEST_SRC_SRC),
  OR_INT(0x96, "or-int", F23X, DEST_SRC_SRC),
  XOR_INT(0x97, "xor-int", F23X, DEST_SRC_SRC),
  SHL_INT(0x98, "shl-int", F23X, DEST_SRC_SRC),
  SHR_INT(0x99, "shr-int", F23X, DEST_SRC_SRC),
  USHR_INT(0x9a, "ushr-int", F23X, DEST_SRC_SRC),
  ADD_LONG(0x9b, "add-long", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  SUB_LONG(0x9c, "sub-long", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  MUL_LONG(0x9d, "mul-long", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  DIV_LONG(0x9e, "div-long", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1 | MAY_THROW),
  REM_LONG(0x9f, "rem-long", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1 | MAY_THROW),
  AND_LONG(0xa0, "and-long", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  OR_LONG(0xa1, "or-long", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  XOR_LONG(0xa2, "xor-long", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  SHL_LONG(0xa3, "shl-long", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0),
  SHR_LONG(0xa4, "shr-long", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0),
  USHR_LONG(0xa5, "ushr-long", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0),
  ADD_FLOAT(0xa6, "add-float", F23X, DEST_SRC_SRC),
  SUB_FLOAT(0xa7, "sub-float", F23X, DEST_SRC_SRC),
  MUL_FLOAT(0xa8, "mul-float", F23X, DEST_SRC_SRC),
  DIV_FLOAT(0xa9, "div-float", F23X, DEST_SRC_SRC),
  REM_FLOAT(0xaa, "rem-float", F23X, DEST_SRC_SRC),
  ADD_DOUBLE(0xab, "add-double", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  SUB_DOUBLE(0xac, "sub-double", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  MUL_DOUBLE(0xad, "mul-double", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  DIV_DOUBLE(0xae, "div-double", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  REM_DOUBLE(0xaf, "rem-double", F23X, DEST_SRC_SRC, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  ADD_INT_2ADDR(0xb0, "add-int/2addr", F12X, TWO_ADDR),
  SUB_INT_2ADDR(0xb1, "sub-int/2addr", F12X, TWO_ADDR),
  MUL_INT_2ADDR(0xb2, "mul-int/2addr", F12X, TWO_ADDR),
  DIV_INT_2ADDR(0xb3, "div-int/2addr", F12X, TWO_ADDR, MAY_THROW),
  REM_INT_2ADDR(0xb4, "rem-int/2addr", F12X, TWO_ADDR, MAY_THROW),
  AND_INT_2ADDR(0xb5, "and-int/2addr", F12X, TWO_ADDR),
  OR_INT_2ADDR(0xb6, "or-int/2addr", F12X, TWO_ADDR),
  XOR_INT_2ADDR(0xb7, "xor-int/2addr", F12X, TWO_ADDR),
  SHL_INT_2ADDR(0xb8, "shl-int/2addr", F12X, TWO_ADDR),
  SHR_INT_2ADDR(0xb9, "shr-int/2addr", F12X, TWO_ADDR),
  USHR_INT_2ADDR(0xba, "ushr-int/2addr", F12X, TWO_ADDR),
  ADD_LONG_2ADDR(0xbb, "add-long/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  SUB_LONG_2ADDR(0xbc, "sub-long/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  MUL_LONG_2ADDR(0xbd, "mul-long/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  DIV_LONG_2ADDR(
      0xbe, "div-long/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1 | MAY_THROW),
  REM_LONG_2ADDR(
      0xbf, "rem-long/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1 | MAY_THROW),
  AND_LONG_2ADDR(0xc0, "and-long/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  OR_LONG_2ADDR(0xc1, "or-long/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  XOR_LONG_2ADDR(0xc2, "xor-long/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  SHL_LONG_2ADDR(0xc3, "shl-long/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0),
  SHR_LONG_2ADDR(0xc4, "shr-long/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0),
  USHR_LONG_2ADDR(0xc5, "ushr-long/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0),
  ADD_FLOAT_2ADDR(0xc6, "add-float/2addr", F12X, TWO_ADDR),
  SUB_FLOAT_2ADDR(0xc7, "sub-float/2addr", F12X, TWO_ADDR),
  MUL_FLOAT_2ADDR(0xc8, "mul-float/2addr", F12X, TWO_ADDR),
  DIV_FLOAT_2ADDR(0xc9, "div-float/2addr", F12X, TWO_ADDR),
  REM_FLOAT_2ADDR(0xca, "rem-float/2addr", F12X, TWO_ADDR),
  ADD_DOUBLE_2ADDR(0xcb, "add-double/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  SUB_DOUBLE_2ADDR(0xcc, "sub-double/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  MUL_DOUBLE_2ADDR(0xcd, "mul-double/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  DIV_DOUBLE_2ADDR(0xce, "div-double/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  REM_DOUBLE_2ADDR(0xcf, "rem-double/2addr", F12X, TWO_ADDR, WIDE_DEST | WIDE_SRC0 | WIDE_SRC1),
  ADD_INT_LIT16(0xd0, "add-int/lit16", F22S, DEST_SRC),
  RSUB_INT(0xd1, "rsub-int", F22S, DEST_SRC),
  MUL_INT_LIT16(0xd2, "mul-int/lit16", F22S, DEST_SRC),
  DIV_INT_LIT16(0xd3, "div-int/lit16", F22S, DEST_SRC, MAY_THROW),
  REM_INT_LIT16(0xd4, "rem-int/lit16", F22S, DEST_SRC, MAY_THROW),
  AND_INT_LIT16(0xd5, "and-int/lit16", F22S, DEST_SRC),
  OR_INT_LIT16(0xd6, "or-int/lit16", F22S, DEST_SRC),
  XOR_INT_LIT16(0xd7, "xor-int/lit16", F22S, DEST_SRC),
  ADD_INT_LIT8(0xd8, "add-int/lit8", F22B, DEST_SRC),
  RSUB_INT_LIT8(0xd9, "rsub-int/lit8", F22B, DEST_SRC),
  MUL_INT_LIT8(0xda, "mul-int/lit8", F22B, DEST_SRC),
  DIV_INT_LIT8(0xdb, "div-int/lit8", F22B, DEST_SRC, MAY_THROW),
  REM_INT_LIT8(0xdc, "rem-int/lit8", F22B, DEST_SRC, MAY_THROW),
  AND_INT_LIT8(0xdd, "and-int/lit8", F22B, DEST_SRC),
  OR_INT_LIT8(0xde, "or-int/lit8", F22B, DEST_SRC),
  XOR_INT_LIT8(0xdf, "xor-int/lit8", F22B, DEST_SRC),
  SHL_INT_LIT8(0xe0, "shl-int/lit8", F22B, DEST_SRC),
  SHR_INT_LIT8(0xe1, "shr-int/lit8", F22B, DEST_SRC),
  USHR_INT_LIT8(0xe2, "ushr-int/lit8", F22B, DEST_SRC),
  UNUSED_E3(0xe3, "unused-e3", F10X, NONE),
  UNUSED_E4(0xe4, "unused-e4", F10X, NONE),
  UNUSED_E5(0xe5, "unused-e5", F10X, NONE),
  UNUSED_E6(0xe6, "unused-e6", F10X, NONE),
  UNUSED_E7(0xe7, "unused-e7", F10X, NONE),
  UNUSED_E8(0xe8, "unused-e8", F10X, NONE),
  UNUSED_E9(0xe9, "unused-e9", F10X, NONE),
  UNUSED_EA(0xea, "unused-ea", F10X, NONE),
  UNUSED_EB(0xeb, "unused-eb", F10X, NONE),
  UNUSED_EC(0xec, "unused-ec", F10X, NONE),
  UNUSED_ED(0xed, "unused-ed", F10X, NONE),
  UNUSED_EE(0xee, "unused-ee", F10X, NONE),
  UNUSED_EF(0xef, "unused-ef", F10X, NONE),
  UNUSED_F0(0xf0, "unused-f0", F10X, NONE),
  UNUSED_F1(0xf1, "unused-f1", F10X, NONE),
  UNUSED_F2(0xf2, "unused-f2", F10X, NONE),
  UNUSED_F3(0xf3, "unused-f3", F10X, NONE),
  UNUSED_F4(0xf4, "unused-f4", F10X, NONE),
  UNUSED_F5(0xf5, "unused-f5", F10X, NONE),
  UNUSED_F6(0xf6, "unused-f6", F10X, NONE),
  UNUSED_F7(0xf7, "unused-f7", F10X, NONE),
  UNUSED_F8(0xf8, "unused-f8", F10X, NONE),
  UNUSED_F9(0xf9, "unused-f9", F10X, NONE),
  UNUSED_FA(0xfa, "unused-fa", F10X, NONE),
  UNUSED_FB(0xfb, "unused-fb", F10X, NONE),
  UNUSED_FC(0xfc, "unused-fc", F10X, NONE),
  UNUSED_FD(0xfd, "unused-fd", F10X, NONE),
  UNUSED_FE(0xfe, "unused-fe", F10X, NONE),
  UNUSED_FF(0xff, "unused-ff", F10X, NONE);

  private static final DexOpcode[] BY_VALUE = new DexOpcode[256];

  static {
    for (DexOpcode op : values()) {
      BY_VALUE[op.value] = op;
    }
  }

  private final int value;
  private final String mnemonic;
  private final InstructionFormat format;
  private final RegisterLayout layout;
  private final ReferenceKind referenceKind;
  private final int flags;

  DexOpcode(int value, String mnemonic, InstructionFormat format, RegisterLayout layout) {
    this(value, mnemonic, format, layout, ReferenceKind.NONE, 0);
  }

  DexOpcode(
      int value, String mnemonic, InstructionFormat format, RegisterLayout layout, int flags) {
    this(value, mnemonic, format, layout, ReferenceKind.NONE, flags);
  }

  DexOpcode(
      int value,
      String mnemonic,
      InstructionFormat format,
      RegisterLayout layout,
      ReferenceKind referenceKind,
      int flags) {
    this.value = value;
    this.mnemonic = mnemonic;
    this.format = format;
    this.layout = layout;
    this.referenceKind = referenceKind;
    this.flags = flags;
  }

  /** Returns the opcode encoded in the low byte of an instruction's first code unit. */
  public static DexOpcode fromValue(int value) {
    checkArgument(value >= 0 && value < BY_VALUE.length, "opcode out of range: %s", value);
    return BY_VALUE[value];
  }

  public int value() {
    return value;
  }

  public String mnemonic() {
    return mnemonic;
  }

  public InstructionFormat format() {
    return format;
  }

  public RegisterLayout layout() {
    return layout;
  }

  public ReferenceKind referenceKind() {
    return referenceKind;
  }

  public boolean hasDest() {
    return layout.hasDest();
  }

  /** Whether the destination is a register pair (vX, vX+1). */
  public boolean isDestWide() {
    return (flags & WIDE_DEST) != 0;
  }

  /** Whether source {@code i} is a register pair. Argument lists name both halves explicitly. */
  public boolean isSrcWide(int i) {
    switch (i) {
      case 0:
        return (flags & WIDE_SRC0) != 0;
      case 1:
        return (flags & WIDE_SRC1) != 0;
      default:
        return false;
    }
  }

  public boolean mayThrow() {
    return (flags & MAY_THROW) != 0;
  }

  public boolean isUnused() {
    return mnemonic.startsWith("unused-");
  }

  public boolean isGoto() {
    return this == GOTO || this == GOTO_16 || this == GOTO_32;
  }

  public boolean isConditionalBranch() {
    return value >= IF_EQ.value && value <= IF_LEZ.value;
  }

  public boolean isSwitch() {
    return this == PACKED_SWITCH || this == SPARSE_SWITCH;
  }

  public boolean isBranch() {
    return isGoto() || isConditionalBranch() || isSwitch();
  }

  public boolean isReturn() {
    return value >= RETURN_VOID.value && value <= RETURN_OBJECT.value;
  }

  public boolean isThrow() {
    return this == THROW;
  }

  public boolean isInvoke() {
    return (value >= INVOKE_VIRTUAL.value && value <= INVOKE_INTERFACE.value)
        || (value >= INVOKE_VIRTUAL_RANGE.value && value <= INVOKE_INTERFACE_RANGE.value);
  }

  public boolean isFilledNewArray() {
    return this == FILLED_NEW_ARRAY || this == FILLED_NEW_ARRAY_RANGE;
  }

  public boolean hasRange() {
    return layout == RANGE;
  }

  public boolean isIget() {
    return value >= IGET.value && value <= IGET_SHORT.value;
  }

  public boolean isIput() {
    return value >= IPUT.value && value <= IPUT_SHORT.value;
  }

  public boolean isSget() {
    return value >= SGET.value && value <= SGET_SHORT.value;
  }

  public boolean isSput() {
    return value >= SPUT.value && value <= SPUT_SHORT.value;
  }

  public boolean isAput() {
    return value >= APUT.value && value <= APUT_SHORT.value;
  }

  /** move-result, move-result-wide and move-result-object; not move-exception. */
  public boolean isMoveResult() {
    return value >= MOVE_RESULT.value && value <= MOVE_RESULT_OBJECT.value;
  }

  /** The register-to-register moves, in all three widths. */
  public boolean isMove() {
    return value >= MOVE.value && value <= MOVE_OBJECT_16.value;
  }

  public boolean isObjectMove() {
    return value >= MOVE_OBJECT.value && value <= MOVE_OBJECT_16.value;
  }

  public boolean isConst() {
    return value >= CONST_4.value && value <= CONST_WIDE_HIGH16.value;
  }

  /** Whether execution never continues with the following instruction. */
  public boolean isTerminal() {
    return isGoto() || isReturn() || isThrow();
  }

  @Override
  public String toString() {
    return mnemonic;
  }
}
