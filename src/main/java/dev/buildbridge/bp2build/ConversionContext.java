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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import dev.buildbridge.graph.DependencyTag;
import dev.buildbridge.graph.ModuleGraph;
import dev.buildbridge.graph.ModuleNode;
import dev.buildbridge.graph.ModuleStepException;
import dev.buildbridge.graph.PropertyBag;
import dev.buildbridge.graph.ProviderKey;
import dev.buildbridge.graph.StepEnvironment;
import dev.buildbridge.lib.label.Label;
import dev.buildbridge.lib.label.LabelList;
import dev.buildbridge.lib.label.LabelPartitions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * What a {@link Converter} sees while converting one module: the module, the graph, the
 * configuration, a sink for target declarations, and label helpers for other modules.
 */
public final class ConversionContext {

  private final ModuleNode module;
  private final StepEnvironment env;
  private final ConversionConfig config;
  private final ConversionDecisions decisions;
  private final ModuleTypeRegistry registry;
  private final List<TargetDeclaration> targets = new ArrayList<>();
  @Nullable private String unconvertibleReason;
  @Nullable private ReferenceExpander referenceExpander;

  ConversionContext(
      ModuleNode module,
      StepEnvironment env,
      ConversionConfig config,
      ConversionDecisions decisions,
      ModuleTypeRegistry registry) {
    this.module = module;
    this.env = env;
    this.config = config;
    this.decisions = decisions;
    this.registry = registry;
  }

  public ModuleNode getModule() {
    return module;
  }

  public String getModuleName() {
    return module.getName();
  }

  public String getModuleDir() {
    return module.getDirectory();
  }

  public PropertyBag getProperties() {
    return module.getProperties();
  }

  public ModuleGraph getGraph() {
    return env.getGraph();
  }

  public ConversionConfig getConfig() {
    return config;
  }

  /** Reports a module error. The module's targets are dropped and the module fails. */
  public void reportError(String format, Object... args) {
    env.reportError(String.format(format, args));
  }

  public void reportWarning(String format, Object... args) {
    env.reportWarning(String.format(format, args));
  }

  public boolean hasErrors() {
    return env.hasErrors();
  }

  /** Adds a target; targets without a package go into the module's directory. */
  public void createTarget(TargetDeclaration target) {
    targets.add(target.inPackageIfUnset(module.getDirectory()));
  }

  ImmutableList<TargetDeclaration> getTargets() {
    return ImmutableList.copyOf(targets);
  }

  /** Gives up on converting the module without failing it. */
  public void markUnconvertible(String reason) {
    this.unconvertibleReason = reason;
  }

  @Nullable
  String getUnconvertibleReason() {
    return unconvertibleReason;
  }

  /**
   * Returns the single package that owns {@code labels}, with the labels relative to it, for an
   * attribute of a rule that cannot span packages. No labels means the module's own package.
   *
   * @throws ModuleStepException if the labels belong to more than one package
   */
  public Map.Entry<String, LabelList> singlePackage(String attribute, LabelList labels)
      throws ModuleStepException {
    ImmutableSortedMap<String, LabelList> partitions =
        LabelPartitions.partitionByPackage(module.getDirectory(), labels);
    if (partitions.size() > 1) {
      throw new ModuleStepException(
          String.format(
              "%s of '%s' belong to packages %s, but only one package is supported",
              attribute, module.getName(), partitions.keySet()));
    }
    return partitions.isEmpty()
        ? Maps.immutableEntry(module.getDirectory(), LabelList.empty())
        : partitions.firstEntry();
  }

  /** The expander for source and dependency references of this module. */
  public ReferenceExpander references() {
    if (referenceExpander == null) {
      referenceExpander = new ReferenceExpander(this);
    }
    return referenceExpander;
  }

  /** Looks up a module by the name used in a reference, or returns null. */
  @Nullable
  public ModuleNode findModule(String referencedName) {
    return env.getGraph().lookup(referencedName);
  }

  /** Whether {@code other} has a target in the converted build. */
  public boolean isConvertedToBazel(ModuleNode other) {
    return decisions.isConvertedToBazel(other);
  }

  /** The absolute label of this module's own target. */
  public Label getModuleLabel() {
    return Label.of(
        ModuleLabels.moduleLabel(module, registry.isPrebuilt(module)), module.getName());
  }

  /**
   * The label by which this module refers to {@code other}: the other module's label, shortened to
   * {@code :name} when both are in the same package.
   */
  public String labelFor(ModuleNode other) {
    Label own = getModuleLabel();
    Label otherLabel = Label.of(ModuleLabels.moduleLabel(other, registry.isPrebuilt(other)));
    return own.isSamePackage(otherLabel) ? otherLabel.getShortForm() : otherLabel.getAddress();
  }

  /**
   * Records that this module's conversion refers to {@code other}, unless the configuration exempts
   * the pair.
   */
  void addConversionEdge(ModuleNode other) {
    if (config.skipsConversionEdge(module.getName(), other.getName())) {
      return;
    }
    env.getGraph().addEdge(module, other, DependencyTag.CONVERSION_ONLY);
  }

  void recordMissingDependency(String name) {
    module.getConversionStatus().addMissingDependency(name);
  }

  void recordUnconvertedDependency(String name) {
    module.getConversionStatus().addUnconvertedDependency(name);
  }

  /**
   * Reads a provider of one of this module's direct dependencies. Reading from a dependent, or a
   * provider that was never published, is a wiring bug and throws.
   */
  public <T> T getDependencyProvider(ModuleNode dependency, ProviderKey<T> key) {
    checkArgument(
        env.getGraph().getDirectDependencies(module).contains(dependency),
        "'%s' is not a dependency of '%s'",
        dependency.getName(),
        module.getName());
    return dependency.getProviders().get(key);
  }

  /** Publishes a provider on this module. */
  public <T> void publish(ProviderKey<T> key, T value) {
    module.getProviders().publish(key, value, env.getPhaseName());
  }
}
