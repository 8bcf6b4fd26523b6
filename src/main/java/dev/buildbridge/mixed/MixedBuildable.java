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
package dev.buildbridge.mixed;

import dev.buildbridge.graph.ModuleStepException;

/** Capability of module types that can be handed to the external executor in a mixed build. */
public interface MixedBuildable {

  /**
   * Returns true if and only if this module should be built by the external executor. Lets module
   * types opt out of corner cases the executor does not handle.
   */
  boolean isMixedBuildSupported(MixedBuildContext ctx);

  /** Queues the requests whose answers {@link #processExternalQueryResponse} needs. */
  void queueExternalCall(MixedBuildContext ctx);

  /**
   * Reads the answers to the queued requests and publishes what dependents need as providers, so
   * that they need not know the module was built externally.
   */
  void processExternalQueryResponse(MixedBuildContext ctx) throws ModuleStepException;
}
