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

/** Thrown when a code item cannot be decoded. Carries the offending code-unit address. */
public class DexFormatException extends RuntimeException {
  private final int address;

  public DexFormatException(String message, int address) {
    super(String.format("%s at address 0x%04x", message, address));
    this.address = address;
  }

  public DexFormatException(String message, int address, Throwable cause) {
    super(String.format("%s at address 0x%04x", message, address), cause);
    this.address = address;
  }

  /** Code-unit address at which decoding failed. */
  public int getAddress() {
    return address;
  }
}
