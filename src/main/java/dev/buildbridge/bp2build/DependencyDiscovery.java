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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import dev.buildbridge.graph.ModuleGraph;
import dev.buildbridge.graph.ModuleNode;
import dev.buildbridge.graph.ModuleStep;
import dev.buildbridge.graph.StepEnvironment;
import dev.buildbridge.lib.label.ModuleReference;
import dev.buildbridge.lib.label.ModuleReference.MalformedReferenceException;
import java.util.Optional;

/**
 * The dependency discovery step: adds an edge for every dependency a module declares. Runs
 * bottom-up over the declared dependencies, since the graph has no edges yet.
 */
final class DependencyDiscovery implements ModuleStep {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ModuleTypeRegistry registry;
  private final boolean allowMissingDependencies;

  DependencyDiscovery(ModuleTypeRegistry registry, boolean allowMissingDependencies) {
    this.registry = registry;
    this.allowMissingDependencies = allowMissingDependencies;
  }

  /** Names of the modules {@code module} declares; used to order the discovery phase. */
  ImmutableSet<String> declaredModuleNames(ModuleNode module) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (DeclaredDependency dependency : declaredDependencies(module)) {
      try {
        toReference(dependency.value()).ifPresent(ref -> names.add(ref.getModuleName()));
      } catch (MalformedReferenceException e) {
        // Only ordering is computed here; the discovery step reports the entry.
        logger.atFine().log("Unordered malformed entry in %s: %s", module.getName(), e);
      }
    }
    return names.build();
  }

  @Override
  public void run(ModuleNode module, StepEnvironment env) {
    ModuleGraph graph = env.getGraph();
    for (DeclaredDependency dependency : declaredDependencies(module)) {
      Optional<ModuleReference> reference;
      try {
        reference = toReference(dependency.value());
      } catch (MalformedReferenceException e) {
        env.reportError(String.format("property %s: %s", dependency.property(), e.getMessage()));
        continue;
      }
      if (reference.isEmpty()) {
        env.reportError(
            String.format(
                "property %s: \"%s\" is not a module reference",
                dependency.property(),
                dependency.value()));
        continue;
      }
      String name = reference.get().getModuleName();
      ModuleNode target = graph.lookup(name);
      if (target == null) {
        if (allowMissingDependencies) {
          module.getConversionStatus().addMissingDependency(name);
        } else {
          env.reportError(
              String.format(
                  "depends on undefined module \"%s\" (property %s)", name, dependency.property()));
        }
        continue;
      }
      graph.addEdge(module, target, dependency.tag());
    }
  }

  private ImmutableList<DeclaredDependency> declaredDependencies(ModuleNode module) {
    return registry
        .getDependencyDeclarer(module)
        .map(declarer -> declarer.declareDependencies(module))
        .orElse(ImmutableList.of());
  }

  /** Bare names in dependency properties mean references to the module of that name. */
  private static Optional<ModuleReference> toReference(String value)
      throws MalformedReferenceException {
    return ModuleReference.parse(ModuleReference.looksLikeReference(value) ? value : ":" + value);
  }
}
