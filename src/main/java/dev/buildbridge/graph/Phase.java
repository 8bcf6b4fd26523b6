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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * One pass of the {@link PhaseScheduler} over the whole graph.
 *
 * <p>An ordered phase takes its ordering edges from the graph, or, for phases that run before the
 * edges exist, from a function returning each module's declared dependency names.
 */
public final class Phase {

  private final String name;
  private final PhaseOrdering ordering;
  @Nullable private final Function<ModuleNode, ? extends Collection<String>> declaredDependencies;
  private final ModuleStep step;

  private Phase(
      String name,
      PhaseOrdering ordering,
      @Nullable Function<ModuleNode, ? extends Collection<String>> declaredDependencies,
      ModuleStep step) {
    this.name = checkNotNull(name);
    this.ordering = checkNotNull(ordering);
    this.declaredDependencies = declaredDependencies;
    this.step = checkNotNull(step);
  }

  public static Phase bottomUp(String name, ModuleStep step) {
    return new Phase(name, PhaseOrdering.BOTTOM_UP, null, step);
  }

  public static Phase topDown(String name, ModuleStep step) {
    return new Phase(name, PhaseOrdering.TOP_DOWN, null, step);
  }

  public static Phase unordered(String name, ModuleStep step) {
    return new Phase(name, PhaseOrdering.UNORDERED, null, step);
  }

  /**
   * A bottom-up phase ordered by declared dependency names rather than graph edges. Names that do
   * not denote a module of the graph are ignored for ordering.
   */
  public static Phase bottomUpByDeclaredDependencies(
      String name,
      Function<ModuleNode, ? extends Collection<String>> declaredDependencies,
      ModuleStep step) {
    return new Phase(name, PhaseOrdering.BOTTOM_UP, checkNotNull(declaredDependencies), step);
  }

  public String getName() {
    return name;
  }

  public PhaseOrdering getOrdering() {
    return ordering;
  }

  public ModuleStep getStep() {
    return step;
  }

  public boolean usesDeclaredDependencies() {
    return declaredDependencies != null;
  }

  /** The distinct dependencies of {@code module} this phase orders by, excluding itself. */
  ImmutableList<ModuleNode> orderingDependencies(ModuleGraph graph, ModuleNode module) {
    if (declaredDependencies == null) {
      return graph.getDirectDependencies(module).stream()
          .filter(dep -> dep != module)
          .collect(ImmutableList.toImmutableList());
    }
    return declaredDependencies.apply(module).stream()
        .map(graph::lookup)
        .filter(dep -> dep != null && dep != module)
        .distinct()
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("ordering", ordering)
        .add("declaredDependencies", declaredDependencies != null)
        .toString();
  }
}
