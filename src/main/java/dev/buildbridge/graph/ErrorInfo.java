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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import javax.annotation.Nullable;

/** Information about why a module failed during a scheduler run. */
public final class ErrorInfo {

  /** Creates an ErrorInfo for a module whose own step failed. */
  public static ErrorInfo fromException(Exception exception) {
    return new ErrorInfo(
        Preconditions.checkNotNull(exception, "exception is null"),
        /* cycles= */ ImmutableList.of(),
        /* failedDependency= */ null);
  }

  /** Creates an ErrorInfo for a module that could not be ordered because of a cycle. */
  public static ErrorInfo fromCycle(CycleInfo cycleInfo) {
    return new ErrorInfo(
        /* exception= */ null, ImmutableList.of(cycleInfo), /* failedDependency= */ null);
  }

  /**
   * Creates an ErrorInfo for a module that failed only because {@code dependency}, which it
   * requires, failed with {@code dependencyError}.
   */
  public static ErrorInfo fromDependencyFailure(
      String module, String dependency, ErrorInfo dependencyError) {
    ImmutableList.Builder<CycleInfo> cycles = ImmutableList.builder();
    for (CycleInfo cycle : dependencyError.cycles) {
      cycles.add(cycle.fromPerspectiveOf(module));
    }
    return new ErrorInfo(dependencyError.exception, cycles.build(), dependency);
  }

  @Nullable private final Exception exception;
  private final ImmutableList<CycleInfo> cycles;
  @Nullable private final String failedDependency;

  private ErrorInfo(
      @Nullable Exception exception,
      ImmutableList<CycleInfo> cycles,
      @Nullable String failedDependency) {
    Preconditions.checkState(
        exception != null || !cycles.isEmpty(),
        "At least one of exception and cycles must be non-null/empty, respectively");
    this.exception = exception;
    this.cycles = cycles;
    this.failedDependency = failedDependency;
  }

  /**
   * The exception thrown by the failing step, or by the step of the dependency that caused this
   * failure. Null if the failure is due to a cycle.
   */
  @Nullable
  public Exception getException() {
    return exception;
  }

  public ImmutableList<CycleInfo> getCycleInfo() {
    return cycles;
  }

  /** The dependency whose failure caused this one, or null if the module failed by itself. */
  @Nullable
  public String getFailedDependency() {
    return failedDependency;
  }

  public boolean isDependencyFailure() {
    return failedDependency != null;
  }

  /** A one-line description suitable for a diagnostic. */
  public String describe() {
    StringBuilder description = new StringBuilder();
    if (failedDependency != null) {
      description.append("dependency '").append(failedDependency).append("' failed: ");
    }
    if (exception != null) {
      description.append(exception.getMessage());
    } else {
      description.append("cycle ").append(cycles.get(0));
    }
    return description.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ErrorInfo)) {
      return false;
    }
    ErrorInfo other = (ErrorInfo) obj;
    if (!Objects.equals(cycles, other.cycles)
        || !Objects.equals(failedDependency, other.failedDependency)) {
      return false;
    }
    // Exceptions rarely implement equality; compare their types and messages.
    if (exception != other.exception) {
      if (exception == null || other.exception == null) {
        return false;
      }
      return exception.getClass() == other.exception.getClass()
          && Objects.equals(exception.getMessage(), other.exception.getMessage());
    }
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        exception == null ? null : exception.getClass(),
        exception == null ? "" : exception.getMessage(),
        cycles,
        failedDependency);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("exception", exception)
        .add("cycles", cycles)
        .add("failedDependency", failedDependency)
        .toString();
  }
}
