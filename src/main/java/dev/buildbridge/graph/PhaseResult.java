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
package dev.buildbridge.graph;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/** The outcome of one {@link Phase}. */
public final class PhaseResult {

  private final String phaseName;
  private final ImmutableSet<String> completed;
  private final ImmutableSet<String> skipped;
  private final ImmutableMap<String, ErrorInfo> errors;

  private PhaseResult(
      String phaseName,
      ImmutableSet<String> completed,
      ImmutableSet<String> skipped,
      ImmutableMap<String, ErrorInfo> errors) {
    this.phaseName = phaseName;
    this.completed = completed;
    this.skipped = skipped;
    this.errors = errors;
  }

  public String getPhaseName() {
    return phaseName;
  }

  /** Modules whose step ran and succeeded, in completion order. */
  public ImmutableSet<String> getCompleted() {
    return completed;
  }

  /** Modules whose step did not run because they had already failed. */
  public ImmutableSet<String> getSkipped() {
    return skipped;
  }

  /** Modules that failed in this phase, by their own step or by a cycle. */
  public ImmutableMap<String, ErrorInfo> getErrors() {
    return errors;
  }

  @Nullable
  public ErrorInfo getError(String module) {
    return errors.get(module);
  }

  public boolean hasError() {
    return !errors.isEmpty();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("phase", phaseName)
        .add("completed", completed.size())
        .add("skipped", skipped)
        .add("errors", errors)
        .toString();
  }

  static Builder builder(String phaseName) {
    return new Builder(phaseName);
  }

  /** Thread-safe collector used while the phase runs. */
  static final class Builder {
    private final String phaseName;
    private final Set<String> completed = new LinkedHashSet<>();
    private final Set<String> skipped = new LinkedHashSet<>();
    private final Map<String, ErrorInfo> errors = new LinkedHashMap<>();

    private Builder(String phaseName) {
      this.phaseName = phaseName;
    }

    @CanIgnoreReturnValue
    synchronized Builder addCompleted(String module) {
      completed.add(module);
      return this;
    }

    @CanIgnoreReturnValue
    synchronized Builder addSkipped(String module) {
      skipped.add(module);
      return this;
    }

    @CanIgnoreReturnValue
    synchronized Builder addError(String module, ErrorInfo error) {
      errors.putIfAbsent(module, error);
      return this;
    }

    synchronized PhaseResult build() {
      return new PhaseResult(
          phaseName,
          ImmutableSet.copyOf(completed),
          ImmutableSet.copyOf(skipped),
          ImmutableMap.copyOf(errors));
    }
  }
}
