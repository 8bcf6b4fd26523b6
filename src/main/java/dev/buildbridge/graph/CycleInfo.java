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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * A single cycle among the ordering edges of a phase, together with the path that leads to it. For
 * a module in the cycle the path is empty and the cycle starts with that module; for a module that
 * is merely blocked by the cycle the path starts with that module.
 */
public final class CycleInfo {

  private final ImmutableList<String> pathToCycle;
  private final ImmutableList<String> cycle;

  private CycleInfo(ImmutableList<String> pathToCycle, ImmutableList<String> cycle) {
    checkArgument(!cycle.isEmpty(), "cycle may not be empty");
    this.pathToCycle = pathToCycle;
    this.cycle = cycle;
  }

  public static CycleInfo create(Iterable<String> cycle) {
    return new CycleInfo(ImmutableList.of(), ImmutableList.copyOf(cycle));
  }

  public static CycleInfo create(Iterable<String> pathToCycle, Iterable<String> cycle) {
    return new CycleInfo(ImmutableList.copyOf(pathToCycle), ImmutableList.copyOf(cycle));
  }

  /**
   * Returns the same cycle as seen from {@code module}: rotated to start at it if it participates,
   * otherwise with {@code module} prepended to the path.
   */
  public CycleInfo fromPerspectiveOf(String module) {
    int index = cycle.indexOf(module);
    if (index < 0) {
      return new CycleInfo(
          ImmutableList.<String>builder().add(module).addAll(pathToCycle).build(), cycle);
    }
    return new CycleInfo(
        ImmutableList.of(),
        ImmutableList.<String>builder()
            .addAll(cycle.subList(index, cycle.size()))
            .addAll(cycle.subList(0, index))
            .build());
  }

  public ImmutableList<String> getPathToCycle() {
    return pathToCycle;
  }

  public ImmutableList<String> getCycle() {
    return cycle;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CycleInfo)) {
      return false;
    }
    CycleInfo other = (CycleInfo) obj;
    return pathToCycle.equals(other.pathToCycle) && cycle.equals(other.cycle);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pathToCycle, cycle);
  }

  @Override
  public String toString() {
    String cycleText = Joiner.on(" -> ").join(cycle) + " -> " + cycle.get(0);
    return pathToCycle.isEmpty()
        ? cycleText
        : Joiner.on(" -> ").join(pathToCycle) + " -> [" + cycleText + "]";
  }
}
