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
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * What conversion found out about one module: whether it was converted, and which of its
 * dependencies were missing from the graph or present but not converted. Callers use the
 * distinction to choose between permissive and strict handling.
 */
public final class ConversionStatus {

  /** How a module ended up in the converted build. */
  public enum State {
    /** Conversion was not attempted or did not succeed. */
    UNCONVERTED,
    /** The conversion routine produced the module's targets. */
    CONVERTED,
    /** The module points at a hand-authored target instead of being converted. */
    HANDCRAFTED;
  }

  private State state = State.UNCONVERTED;
  @Nullable private String unconvertedReason;
  private final Set<String> missingDependencies = new LinkedHashSet<>();
  private final Set<String> unconvertedDependencies = new LinkedHashSet<>();

  public synchronized State getState() {
    return state;
  }

  public synchronized boolean isConverted() {
    return state != State.UNCONVERTED;
  }

  public synchronized void setState(State state) {
    this.state = state;
  }

  /** Why the module was not converted, or null if it was converted or no reason was given. */
  @Nullable
  public synchronized String getUnconvertedReason() {
    return unconvertedReason;
  }

  public synchronized void markUnconverted(String reason) {
    this.state = State.UNCONVERTED;
    this.unconvertedReason = reason;
  }

  public synchronized void addMissingDependency(String name) {
    missingDependencies.add(name);
  }

  public synchronized void addUnconvertedDependency(String name) {
    unconvertedDependencies.add(name);
  }

  public synchronized ImmutableSet<String> getMissingDependencies() {
    return ImmutableSet.copyOf(missingDependencies);
  }

  public synchronized ImmutableSet<String> getUnconvertedDependencies() {
    return ImmutableSet.copyOf(unconvertedDependencies);
  }

  public synchronized boolean hasMissingDependencies() {
    return !missingDependencies.isEmpty();
  }

  @Override
  public synchronized String toString() {
    return MoreObjects.toStringHelper(this)
        .add("state", state)
        .add("reason", unconvertedReason)
        .add("missing", missingDependencies)
        .add("unconverted", unconvertedDependencies)
        .toString();
  }
}
