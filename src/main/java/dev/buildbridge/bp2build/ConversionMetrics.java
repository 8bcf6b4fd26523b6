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
import com.google.common.collect.ImmutableSortedMap;
import dev.buildbridge.graph.ConversionStatus;
import dev.buildbridge.graph.ModuleNode;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/** Counts describing how much of the module graph a run converted. */
public final class ConversionMetrics {

  private final int totalModuleCount;
  private final int convertedModuleCount;
  private final int handcraftedModuleCount;
  private final ImmutableSortedMap<String, Integer> ruleClassCount;
  private final ImmutableSortedMap<String, String> unconvertedModules;

  private ConversionMetrics(
      int totalModuleCount,
      int convertedModuleCount,
      int handcraftedModuleCount,
      ImmutableSortedMap<String, Integer> ruleClassCount,
      ImmutableSortedMap<String, String> unconvertedModules) {
    this.totalModuleCount = totalModuleCount;
    this.convertedModuleCount = convertedModuleCount;
    this.handcraftedModuleCount = handcraftedModuleCount;
    this.ruleClassCount = ruleClassCount;
    this.unconvertedModules = unconvertedModules;
  }

  static ConversionMetrics compute(
      Collection<ModuleNode> modules, Collection<TargetDeclaration> targets) {
    int converted = 0;
    int handcrafted = 0;
    Map<String, String> unconverted = new TreeMap<>();
    for (ModuleNode module : modules) {
      ConversionStatus status = module.getConversionStatus();
      switch (status.getState()) {
        case CONVERTED:
          converted++;
          break;
        case HANDCRAFTED:
          handcrafted++;
          break;
        case UNCONVERTED:
          String reason = status.getUnconvertedReason();
          unconverted.put(module.getName(), reason == null ? "" : reason);
          break;
      }
    }
    Map<String, Integer> ruleClasses = new TreeMap<>();
    for (TargetDeclaration target : targets) {
      ruleClasses.merge(target.getRuleClass(), 1, Integer::sum);
    }
    return new ConversionMetrics(
        modules.size(),
        converted,
        handcrafted,
        ImmutableSortedMap.copyOf(ruleClasses),
        ImmutableSortedMap.copyOf(unconverted));
  }

  public int getTotalModuleCount() {
    return totalModuleCount;
  }

  public int getConvertedModuleCount() {
    return convertedModuleCount;
  }

  public int getHandcraftedModuleCount() {
    return handcraftedModuleCount;
  }

  /** Number of generated targets per rule class. */
  public ImmutableSortedMap<String, Integer> getRuleClassCount() {
    return ruleClassCount;
  }

  public int getGeneratedTargetCount() {
    return ruleClassCount.values().stream().mapToInt(Integer::intValue).sum();
  }

  /** Modules that were not converted, with the reason when one is known. */
  public ImmutableSortedMap<String, String> getUnconvertedModules() {
    return unconvertedModules;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("total", totalModuleCount)
        .add("converted", convertedModuleCount)
        .add("handcrafted", handcraftedModuleCount)
        .add("ruleClassCount", ruleClassCount)
        .toString();
  }
}
