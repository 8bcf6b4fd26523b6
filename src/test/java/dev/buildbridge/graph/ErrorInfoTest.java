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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.testing.EqualsTester;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ErrorInfoTest {

  @Test
  public void testFromException() {
    ModuleStepException exception = new ModuleStepException("boom");

    ErrorInfo errorInfo = ErrorInfo.fromException(exception);

    assertThat(errorInfo.getException()).isSameInstanceAs(exception);
    assertThat(errorInfo.getCycleInfo()).isEmpty();
    assertThat(errorInfo.isDependencyFailure()).isFalse();
    assertThat(errorInfo.describe()).isEqualTo("boom");
  }

  @Test
  public void testFromCycle() {
    CycleInfo cycle = CycleInfo.create(ImmutableList.of("a", "b"));

    ErrorInfo errorInfo = ErrorInfo.fromCycle(cycle);

    assertThat(errorInfo.getException()).isNull();
    assertThat(errorInfo.getCycleInfo()).containsExactly(cycle);
    assertThat(errorInfo.describe()).isEqualTo("cycle a -> b -> a");
  }

  @Test
  public void testFromDependencyFailureKeepsRootCause() {
    ErrorInfo root = ErrorInfo.fromException(new ModuleStepException("boom"));

    ErrorInfo errorInfo = ErrorInfo.fromDependencyFailure("app", "lib", root);

    assertThat(errorInfo.getFailedDependency()).isEqualTo("lib");
    assertThat(errorInfo.getException()).isSameInstanceAs(root.getException());
    assertThat(errorInfo.describe()).isEqualTo("dependency 'lib' failed: boom");
  }

  @Test
  public void testFromDependencyFailureExtendsCyclePath() {
    ErrorInfo root = ErrorInfo.fromCycle(CycleInfo.create(ImmutableList.of("a", "b")));

    ErrorInfo errorInfo = ErrorInfo.fromDependencyFailure("app", "a", root);

    assertThat(errorInfo.getCycleInfo())
        .containsExactly(CycleInfo.create(ImmutableList.of("app"), ImmutableList.of("a", "b")));
  }

  @Test
  public void testEquality() {
    new EqualsTester()
        .addEqualityGroup(
            ErrorInfo.fromException(new ModuleStepException("x")),
            ErrorInfo.fromException(new ModuleStepException("x")))
        .addEqualityGroup(ErrorInfo.fromException(new ModuleStepException("y")))
        .addEqualityGroup(ErrorInfo.fromCycle(CycleInfo.create(ImmutableList.of("a"))))
        .testEquals();
  }

  @Test
  public void testCycleInfoPerspective() {
    CycleInfo cycle = CycleInfo.create(ImmutableList.of("a", "b", "c"));

    assertThat(cycle.fromPerspectiveOf("b").getCycle()).containsExactly("b", "c", "a").inOrder();
    assertThat(cycle.fromPerspectiveOf("x").getPathToCycle()).containsExactly("x");
    assertThat(cycle.fromPerspectiveOf("x").toString()).isEqualTo("x -> [a -> b -> c -> a]");
    assertThrows(IllegalArgumentException.class, () -> CycleInfo.create(ImmutableList.of()));
  }
}
