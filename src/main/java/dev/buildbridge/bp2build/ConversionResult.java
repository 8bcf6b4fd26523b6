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
package dev.buildbridge.bp2build;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import dev.buildbridge.graph.ConversionStatus;
import dev.buildbridge.graph.SchedulerResult;
import dev.buildbridge.lib.allowlist.ConversionDecision;
import dev.buildbridge.lib.events.Event;
import javax.annotation.Nullable;

/** Everything a {@link ConversionPipeline} run produced. */
public final class ConversionResult {

  private final BuildMode buildMode;
  private final ImmutableSortedMap<String, ImmutableList<TargetDeclaration>> targetsByPackage;
  private final ImmutableMap<String, ConversionDecision> decisions;
  private final ImmutableMap<String, ConversionStatus> statuses;
  private final ImmutableMap<String, Boolean> mixedBuildEnabled;
  private final ImmutableList<Event> events;
  private final SchedulerResult schedulerResult;
  private final ConversionMetrics metrics;

  ConversionResult(
      BuildMode buildMode,
      ImmutableSortedMap<String, ImmutableList<TargetDeclaration>> targetsByPackage,
      ImmutableMap<String, ConversionDecision> decisions,
      ImmutableMap<String, ConversionStatus> statuses,
      ImmutableMap<String, Boolean> mixedBuildEnabled,
      ImmutableList<Event> events,
      SchedulerResult schedulerResult,
      ConversionMetrics metrics) {
    this.buildMode = buildMode;
    this.targetsByPackage = targetsByPackage;
    this.decisions = decisions;
    this.statuses = statuses;
    this.mixedBuildEnabled = mixedBuildEnabled;
    this.events = events;
    this.schedulerResult = schedulerResult;
    this.metrics = metrics;
  }

  public BuildMode getBuildMode() {
    return buildMode;
  }

  /** Generated targets, keyed by package directory ({@code .} for the top level). */
  public ImmutableSortedMap<String, ImmutableList<TargetDeclaration>> getTargetsByPackage() {
    return targetsByPackage;
  }

  public ImmutableList<TargetDeclaration> getTargets(String packageName) {
    ImmutableList<TargetDeclaration> targets = targetsByPackage.get(packageName);
    return targets == null ? ImmutableList.of() : targets;
  }

  /** The conversion decision of every module that was decided on. */
  public ImmutableMap<String, ConversionDecision> getDecisions() {
    return decisions;
  }

  @Nullable
  public ConversionDecision getDecision(String module) {
    return decisions.get(module);
  }

  public ImmutableMap<String, ConversionStatus> getStatuses() {
    return statuses;
  }

  public ImmutableSet<String> getMissingDependencies(String module) {
    ConversionStatus status = statuses.get(module);
    return status == null ? ImmutableSet.of() : status.getMissingDependencies();
  }

  public ImmutableSet<String> getUnconvertedDependencies(String module) {
    ConversionStatus status = statuses.get(module);
    return status == null ? ImmutableSet.of() : status.getUnconvertedDependencies();
  }

  /** For mixed builds: whether each mixed-buildable module was handed to the external executor. */
  public ImmutableMap<String, Boolean> getMixedBuildEnabled() {
    return mixedBuildEnabled;
  }

  /** Every event reported during the run. */
  public ImmutableList<Event> getEvents() {
    return events;
  }

  public ImmutableList<Event> getErrors() {
    return events.stream()
        .filter(event -> event.getKind().isError())
        .collect(ImmutableList.toImmutableList());
  }

  public SchedulerResult getSchedulerResult() {
    return schedulerResult;
  }

  public boolean hasErrors() {
    return schedulerResult.hasError() || !getErrors().isEmpty();
  }

  public ConversionMetrics getMetrics() {
    return metrics;
  }

  /** The BUILD file contents of every package with targets. */
  public ImmutableSortedMap<String, String> renderBuildFiles(BuildFileRenderer renderer) {
    return renderer.renderAll(targetsByPackage);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("buildMode", buildMode)
        .add("packages", targetsByPackage.keySet())
        .add("metrics", metrics)
        .add("errors", getErrors().size())
        .toString();
  }
}
