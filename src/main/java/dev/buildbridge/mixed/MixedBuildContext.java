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
package dev.buildbridge.mixed;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import dev.buildbridge.graph.ModuleNode;
import dev.buildbridge.graph.OsType;
import dev.buildbridge.graph.ProviderKey;
import dev.buildbridge.graph.StepEnvironment;
import dev.buildbridge.lib.label.Label;

/** What a {@link MixedBuildable} module sees while taking part in a mixed build. */
public final class MixedBuildContext {

  private final ModuleNode module;
  private final StepEnvironment env;
  private final ExternalExecutor executor;
  private final Label label;
  private final OsType targetOs;
  private final boolean converted;
  private final boolean mixedBuildAllowlisted;

  /**
   * @param label the module's own absolute label
   * @param converted whether the module is converted or has a hand-authored target
   * @param mixedBuildAllowlisted whether the module is in the mixed-build allowlist
   */
  public MixedBuildContext(
      ModuleNode module,
      StepEnvironment env,
      ExternalExecutor executor,
      Label label,
      OsType targetOs,
      boolean converted,
      boolean mixedBuildAllowlisted) {
    this.module = checkNotNull(module);
    this.env = checkNotNull(env);
    this.executor = checkNotNull(executor);
    this.label = checkNotNull(label);
    this.targetOs = checkNotNull(targetOs);
    this.converted = converted;
    this.mixedBuildAllowlisted = mixedBuildAllowlisted;
  }

  public ModuleNode getModule() {
    return module;
  }

  public ExternalExecutor getExecutor() {
    return executor;
  }

  public Label getLabel() {
    return label;
  }

  public OsType getTargetOs() {
    return targetOs;
  }

  public boolean isConverted() {
    return converted;
  }

  public boolean isMixedBuildAllowlisted() {
    return mixedBuildAllowlisted;
  }

  public void reportError(String message) {
    env.reportError(message);
  }

  /** Queues {@code requestType} for this module's label. */
  public ExternalRequest queue(RequestType requestType, ConfigKey configKey) {
    ExternalRequest request = ExternalRequest.create(label, requestType, configKey);
    executor.queueRequest(request);
    return request;
  }

  /** Reads the answer to a request this module queued. */
  public ImmutableList<String> getResult(RequestType requestType, ConfigKey configKey)
      throws ExternalQueryException {
    return executor.getResult(ExternalRequest.create(label, requestType, configKey));
  }

  /** Publishes a provider on this module for its dependents. */
  public <T> void publish(ProviderKey<T> key, T value) {
    module.getProviders().publish(key, value, env.getPhaseName());
  }

  /** Reads a provider of one of this module's direct dependencies. */
  public <T> T getDependencyProvider(ModuleNode dependency, ProviderKey<T> key) {
    checkArgument(
        env.getGraph().getDirectDependencies(module).contains(dependency),
        "'%s' is not a dependency of '%s'",
        dependency.getName(),
        module.getName());
    return dependency.getProviders().get(key);
  }
}
