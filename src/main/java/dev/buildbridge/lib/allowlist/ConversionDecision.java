// Copyright 2025 The Bazel Authors. All rights reserved.
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
package dev.buildbridge.lib.allowlist;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;

/** Whether a module is converted, plus the configuration conflicts found while deciding. */
@Immutable
public final class ConversionDecision {

  private static final ConversionDecision CONVERT =
      new ConversionDecision(true, ImmutableList.of());
  private static final ConversionDecision SKIP = new ConversionDecision(false, ImmutableList.of());

  private final boolean convert;
  private final ImmutableList<String> diagnostics;

  private ConversionDecision(boolean convert, ImmutableList<String> diagnostics) {
    this.convert = convert;
    this.diagnostics = diagnostics;
  }

  public static ConversionDecision of(boolean convert) {
    return convert ? CONVERT : SKIP;
  }

  /** A refusal caused by a configuration conflict. */
  public static ConversionDecision conflict(String message) {
    return new ConversionDecision(false, ImmutableList.of(message));
  }

  public boolean shouldConvert() {
    return convert;
  }

  public ImmutableList<String> getDiagnostics() {
    return diagnostics;
  }

  public boolean hasConflict() {
    return !diagnostics.isEmpty();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("convert", convert)
        .add("diagnostics", diagnostics)
        .toString();
  }
}
