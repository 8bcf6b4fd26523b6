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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/**
 * The graph of declared modules and the dependency edges between them.
 *
 * <p>The set of modules is fixed when the graph is built. Edges are added by each module's own
 * steps: any role during dependency discovery, and only {@link DependencyTag#CONVERSION_ONLY} once
 * discovery has been completed.
 */
public final class ModuleGraph {

  private final ImmutableMap<String, ModuleNode> modules;
  private final Map<String, Set<String>> reverseDependencies = new ConcurrentHashMap<>();
  private volatile boolean discoveryComplete;

  private ModuleGraph(ImmutableMap<String, ModuleNode> modules) {
    this.modules = modules;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** All modules, in declaration order. */
  public ImmutableList<ModuleNode> getModules() {
    return modules.values().asList();
  }

  public int size() {
    return modules.size();
  }

  /** Returns the module called {@code name}, or null. */
  @Nullable
  public ModuleNode getModule(String name) {
    return modules.get(name);
  }

  /**
   * Looks up a module by the name used in a reference: either a plain name, or {@code //dir:name}
   * for a module that must live in directory {@code dir}.
   */
  @Nullable
  public ModuleNode lookup(String referencedName) {
    if (!referencedName.startsWith("//")) {
      return modules.get(referencedName);
    }
    int colon = referencedName.indexOf(':');
    checkArgument(colon > 0, "namespaced reference '%s' has no ':'", referencedName);
    ModuleNode module = modules.get(referencedName.substring(colon + 1));
    if (module == null) {
      return null;
    }
    String namespace = referencedName.substring(2, colon);
    String directory = namespace.isEmpty() ? "." : namespace;
    return module.getDirectory().equals(directory) ? module : null;
  }

  /**
   * Adds an edge from {@code from} to {@code to}. Must be called from a step of {@code from}.
   *
   * @return the edge, whether or not it was already present
   * @throws IllegalStateException if discovery is complete and the edge is not conversion-only
   */
  @CanIgnoreReturnValue
  public DependencyEdge addEdge(ModuleNode from, ModuleNode to, DependencyTag tag) {
    checkArgument(modules.get(from.getName()) == from, "%s is not in this graph", from);
    checkArgument(modules.get(to.getName()) == to, "%s is not in this graph", to);
    checkState(
        !discoveryComplete || tag.isConversionOnly(),
        "cannot add %s edge %s -> %s after dependency discovery",
        tag,
        from.getName(),
        to.getName());
    DependencyEdge edge = DependencyEdge.create(from.getName(), to.getName(), tag);
    if (from.addEdge(edge)) {
      reverseDependencies
          .computeIfAbsent(to.getName(), k -> ConcurrentHashMap.newKeySet())
          .add(from.getName());
    }
    return edge;
  }

  /** The distinct modules {@code module} has an edge to, in edge order. */
  public ImmutableList<ModuleNode> getDirectDependencies(ModuleNode module) {
    return getDirectDependencies(module, /* includeConversionOnly= */ true);
  }

  public ImmutableList<ModuleNode> getDirectDependencies(
      ModuleNode module, boolean includeConversionOnly) {
    ImmutableSet.Builder<ModuleNode> dependencies = ImmutableSet.builder();
    for (DependencyEdge edge : module.getEdges()) {
      if (includeConversionOnly || !edge.tag().isConversionOnly()) {
        dependencies.add(modules.get(edge.to()));
      }
    }
    return dependencies.build().asList();
  }

  /** Names of the modules that have an edge to {@code moduleName}. */
  public ImmutableSet<String> getReverseDependencies(String moduleName) {
    Set<String> dependents = reverseDependencies.get(moduleName);
    return dependents == null ? ImmutableSet.of() : ImmutableSet.copyOf(dependents);
  }

  /** Forbids further discovery-time edges. */
  public void completeDiscovery() {
    discoveryComplete = true;
  }

  public boolean isDiscoveryComplete() {
    return discoveryComplete;
  }

  /** Builder for {@link ModuleGraph}. Module names must be unique. */
  public static final class Builder {
    private final Map<String, ModuleNode> modules = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addModule(ModuleNode module) {
      ModuleNode previous = modules.putIfAbsent(module.getName(), module);
      checkArgument(previous == null, "duplicate module '%s'", module.getName());
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addModules(Iterable<ModuleNode> modules) {
      modules.forEach(this::addModule);
      return this;
    }

    public ModuleGraph build() {
      return new ModuleGraph(ImmutableMap.copyOf(modules));
    }
  }
}
