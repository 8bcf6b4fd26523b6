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

import com.google.common.collect.ImmutableList;

/**
 * The external build executor that runs the modules of a mixed build.
 *
 * <p>Requests are queued concurrently by many modules during one phase, answered together by
 * {@link #invokeQueries} at the barrier that follows it, and read back in a later phase.
 */
public interface ExternalExecutor {

  /** Queues {@code request}. Safe to call from concurrent module steps; duplicates are merged. */
  void queueRequest(ExternalRequest request);

  /** Answers every queued request. Called once, between the queueing and processing phases. */
  void invokeQueries() throws ExternalQueryException, InterruptedException;

  /**
   * Returns the answer to a request queued before {@link #invokeQueries}.
   *
   * @throws ExternalQueryException if the request was never queued or could not be answered
   */
  ImmutableList<String> getResult(ExternalRequest request) throws ExternalQueryException;
}
