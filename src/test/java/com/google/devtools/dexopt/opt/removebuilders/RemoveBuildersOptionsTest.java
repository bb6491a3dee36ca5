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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link RemoveBuildersOptions}. */
@RunWith(JUnit4.class)
public class RemoveBuildersOptionsTest {

  @Test
  public void defaults() {
    RemoveBuildersOptions options = RemoveBuildersOptions.defaults();

    assertThat(options.builderPattern().pattern()).isEqualTo("^L.*Builder;$");
    assertThat(options.buildMethodName()).isEqualTo("build");
    assertThat(options.useLiveness()).isFalse();
    assertThat(options.blocklist()).isEmpty();
  }

  @Test
  public void parsesAllFlags() {
    RemoveBuildersOptions options =
        RemoveBuildersOptions.parse(
            "--builder_pattern=Maker;$",
            "--build_method_name",
            "make",
            "--use_liveness=true",
            "--blocklist=LAMaker;",
            "--blocklist=LBMaker;");

    assertThat(options.builderPattern().matcher("Lcom/FooMaker;").find()).isTrue();
    assertThat(options.buildMethodName()).isEqualTo("make");
    assertThat(options.useLiveness()).isTrue();
    assertThat(options.blocklist()).containsExactly("LAMaker;", "LBMaker;");
  }

  @Test
  public void laterValueWins() {
    RemoveBuildersOptions options =
        RemoveBuildersOptions.parse("--build_method_name=a", "--build_method_name=b");

    assertThat(options.buildMethodName()).isEqualTo("b");
  }

  @Test
  public void badPatternIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> RemoveBuildersOptions.parse("--builder_pattern=[unclosed"));
  }

  @Test
  public void unknownFlagIsRejected() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> RemoveBuildersOptions.parse("--no_such_flag"));
    assertThat(e).hasMessageThat().isEqualTo("Error parsing args");
  }

  @Test
  public void emptyBuildMethodNameIsRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> RemoveBuildersOptions.parse("--build_method_name="));
  }
}
