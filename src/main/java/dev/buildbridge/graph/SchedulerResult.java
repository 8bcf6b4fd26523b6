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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;

/**
 * The outcome of a {@link PhaseScheduler} run: one {@link PhaseResult} per phase, and the first
 * error of every module that failed, directly or through a dependency.
 */
public final class SchedulerResult {

  private final ImmutableList<PhaseResult> phaseResults;
  private final ImmutableMap<String, ErrorInfo> errorMap;

  SchedulerResult(
      ImmutableList<PhaseResult> phaseResults, ImmutableMap<String, ErrorInfo> errorMap) {
    this.phaseResults = phaseResults;
    this.errorMap = errorMap;
  }

  public ImmutableList<PhaseResult> getPhaseResults() {
    return phaseResults;
  }

  @Nullable
  public PhaseResult getPhaseResult(String phaseName) {
    for (PhaseResult result : phaseResults) {
      if (result.getPhaseName().equals(phaseName)) {
        return result;
      }
    }
    return null;
  }

  /** Every failed module and the first error recorded for it. */
  public ImmutableMap<String, ErrorInfo> errorMap() {
    return errorMap;
  }

  @Nullable
  public ErrorInfo getError(String module) {
    return errorMap.get(module);
  }

  public ImmutableSet<String> getFailedModules() {
    return errorMap.keySet();
  }

  public boolean hasError() {
    return !errorMap.isEmpty();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("phases", phaseResults)
        .add("errorMap", errorMap)
        .toString();
  }
}
