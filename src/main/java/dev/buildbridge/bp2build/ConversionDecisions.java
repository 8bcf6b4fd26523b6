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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import dev.buildbridge.graph.ModuleNode;
import dev.buildbridge.lib.allowlist.ConversionDecider;
import dev.buildbridge.lib.allowlist.ConversionDecision;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Memoizes the conversion decision of every module for one run. */
final class ConversionDecisions {

  private final ConversionDecider decider;
  private final Map<String, ConversionDecision> decisions = new ConcurrentHashMap<>();
  private volatile ImmutableSet<String> earlierFailures = ImmutableSet.of();

  ConversionDecisions(ConversionDecider decider) {
    this.decider = decider;
  }

  ConversionDecision decide(ModuleNode module) {
    return decisions.computeIfAbsent(module.getName(), name -> decider.decide(module));
  }

  /**
   * Records the modules that failed before the phase about to run. Set between phases only, so
   * every step of a phase sees the same set.
   */
  void setEarlierFailures(ImmutableSet<String> failedModules) {
    this.earlierFailures = failedModules;
  }

  /**
   * Whether {@code module} has a target in the converted build: it has a hand-authored label, or
   * the allowlist converts it and it did not fail in an earlier phase.
   */
  boolean isConvertedToBazel(ModuleNode module) {
    if (module.getHandcraftedLabel() != null) {
      return true;
    }
    return decide(module).shouldConvert() && !earlierFailures.contains(module.getName());
  }

  ImmutableMap<String, ConversionDecision> snapshot() {
    return ImmutableMap.copyOf(decisions);
  }
}
