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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * An {@link ExternalExecutor} for tests. Output-file requests are answered from canned outputs per
 * label address; requests without a canned answer stay unanswered.
 */
public final class FakeExternalExecutor extends BatchingExternalExecutor {

  private final Map<String, ImmutableList<String>> outputs = new HashMap<>();
  @Nullable private ExternalQueryException failure;
  private int invocations;

  @CanIgnoreReturnValue
  public FakeExternalExecutor setOutputs(String address, String... files) {
    outputs.put(address, ImmutableList.copyOf(files));
    return this;
  }

  /** Makes {@link #invokeQueries} fail with {@code failure}. */
  @CanIgnoreReturnValue
  public FakeExternalExecutor failWith(ExternalQueryException failure) {
    this.failure = failure;
    return this;
  }

  public synchronized int getInvocationCount() {
    return invocations;
  }

  @Override
  protected synchronized Map<ExternalRequest, ImmutableList<String>> answer(
      ImmutableSet<ExternalRequest> requests) throws ExternalQueryException {
    invocations++;
    if (failure != null) {
      throw failure;
    }
    Map<ExternalRequest, ImmutableList<String>> answers = new LinkedHashMap<>();
    for (ExternalRequest request : requests) {
      ImmutableList<String> files = outputs.get(request.address());
      if (files != null) {
        answers.put(request, files);
      }
    }
    return ImmutableMap.copyOf(answers);
  }
}
