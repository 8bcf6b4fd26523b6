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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.buildbridge.lib.events.EventHandler;

/** Options and state used by {@link PhaseScheduler}. */
public final class SchedulerContext {

  private final int parallelism;
  private final EventHandler eventHandler;

  private SchedulerContext(int parallelism, EventHandler eventHandler) {
    this.parallelism = parallelism;
    this.eventHandler = Preconditions.checkNotNull(eventHandler);
  }

  public int getParallelism() {
    return parallelism;
  }

  public EventHandler getEventHandler() {
    return eventHandler;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Builder for {@link SchedulerContext}. */
  public static class Builder {
    private int parallelism = Runtime.getRuntime().availableProcessors();
    private EventHandler eventHandler = EventHandler.NOOP;

    protected Builder() {}

    @CanIgnoreReturnValue
    public Builder copyFrom(SchedulerContext context) {
      this.parallelism = context.parallelism;
      this.eventHandler = context.eventHandler;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setParallelism(int parallelism) {
      Preconditions.checkArgument(parallelism > 0, "parallelism must be positive: %s", parallelism);
      this.parallelism = parallelism;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setEventHandler(EventHandler eventHandler) {
      this.eventHandler = eventHandler;
      return this;
    }

    public SchedulerContext build() {
      return new SchedulerContext(parallelism, eventHandler);
    }
  }
}
