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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Base class for executors that answer all queued requests in one batch. Subclasses implement
 * {@link #answer}, which sees every distinct request exactly once.
 */
public abstract class BatchingExternalExecutor implements ExternalExecutor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Set<ExternalRequest> queued = ConcurrentHashMap.newKeySet();
  private volatile ImmutableMap<ExternalRequest, ImmutableList<String>> answers;

  @Override
  public final void queueRequest(ExternalRequest request) {
    checkState(answers == null, "request %s queued after queries were invoked", request);
    queued.add(request);
  }

  @Override
  public final synchronized void invokeQueries()
      throws ExternalQueryException, InterruptedException {
    checkState(answers == null, "queries were already invoked");
    ImmutableSet<ExternalRequest> requests = ImmutableSet.copyOf(queued);
    logger.atInfo().log("Invoking %d external queries", requests.size());
    answers = ImmutableMap.copyOf(answer(requests));
  }

  @Override
  public final ImmutableList<String> getResult(ExternalRequest request)
      throws ExternalQueryException {
    Map<ExternalRequest, ImmutableList<String>> current = answers;
    if (current == null) {
      throw new ExternalQueryException("queries have not been invoked; cannot answer " + request);
    }
    ImmutableList<String> result = current.get(request);
    if (result == null) {
      throw new ExternalQueryException(
          queued.contains(request)
              ? "no answer for " + request
              : "request was never queued: " + request);
    }
    return result;
  }

  /** The requests queued so far. */
  public ImmutableSet<ExternalRequest> getQueuedRequests() {
    return ImmutableSet.copyOf(queued);
  }

  /**
   * Answers {@code requests}. A request missing from the returned map is reported as unanswered
   * when it is read.
   */
  protected abstract Map<ExternalRequest, ImmutableList<String>> answer(
      ImmutableSet<ExternalRequest> requests) throws ExternalQueryException, InterruptedException;
}
