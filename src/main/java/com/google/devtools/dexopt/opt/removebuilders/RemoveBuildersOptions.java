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

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Options of {@link RemoveBuildersPass}. */
@Parameters(separators = "= ", optionPrefixes = "--")
public final class RemoveBuildersOptions {
  static final String DEFAULT_BUILDER_PATTERN = "^L.*Builder;$";

  @Parameter(
      names = "--builder_pattern",
      description = "Regular expression matched against the descriptors of candidate classes.")
  private String builderPattern = DEFAULT_BUILDER_PATTERN;

  @Parameter(names = "--build_method_name", description = "Name of the terminal method.")
  private String buildMethodName = "build";

  @Parameter(
      names = "--use_liveness",
      arity = 1,
      description = "Whether the inliner computes liveness to avoid copying parameters.")
  private boolean useLiveness = false;

  @Parameter(
      names = "--blocklist",
      description = "Descriptor of a class never treated as a builder; may be repeated.")
  private List<String> blocklist = new ArrayList<>();

  private Pattern compiledPattern;

  public Pattern builderPattern() {
    return compiledPattern;
  }

  public String buildMethodName() {
    return buildMethodName;
  }

  public boolean useLiveness() {
    return useLiveness;
  }

  public ImmutableSet<String> blocklist() {
    return ImmutableSet.copyOf(blocklist);
  }

  public static RemoveBuildersOptions defaults() {
    return parse();
  }

  public static RemoveBuildersOptions parse(String... args) {
    RemoveBuildersOptions options = new RemoveBuildersOptions();
    JCommander jCommander = new JCommander(options);
    jCommander.setAllowParameterOverwriting(true);
    try {
      jCommander.parse(args);
    } catch (ParameterException e) {
      throw new IllegalArgumentException("Error parsing args", e);
    }
    try {
      options.compiledPattern = Pattern.compile(options.builderPattern);
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("bad --builder_pattern " + options.builderPattern, e);
    }
    if (options.buildMethodName.isEmpty()) {
      throw new IllegalArgumentException("build_method_name must not be empty.");
    }
    return options;
  }
}
