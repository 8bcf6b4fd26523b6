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
package dev.buildbridge.lib.allowlist;

import static com.google.common.truth.Truth.assertThat;
import static dev.buildbridge.lib.allowlist.DirectoryDefault.DEFAULT_FALSE;
import static dev.buildbridge.lib.allowlist.DirectoryDefault.DEFAULT_FALSE_RECURSIVELY;
import static dev.buildbridge.lib.allowlist.DirectoryDefault.DEFAULT_TRUE;
import static dev.buildbridge.lib.allowlist.DirectoryDefault.DEFAULT_TRUE_RECURSIVELY;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DirectoryDefaultsTest {

  @Test
  public void testRecursiveAncestorApplies() {
    DirectoryMatch match =
        DirectoryDefaults.resolve("a/b/c", ImmutableMap.of("a", DEFAULT_TRUE_RECURSIVELY));

    assertThat(match).isEqualTo(DirectoryMatch.of(true, "a"));
  }

  @Test
  public void testExactFalseWinsOverRecursiveAncestor() {
    DirectoryMatch match =
        DirectoryDefaults.resolve(
            "a/b", ImmutableMap.of("a", DEFAULT_TRUE_RECURSIVELY, "a/b", DEFAULT_FALSE));

    assertThat(match).isEqualTo(DirectoryMatch.of(false, "a/b"));
  }

  @Test
  public void testNonRecursiveTrueDoesNotPropagate() {
    ImmutableMap<String, DirectoryDefault> config = ImmutableMap.of("a", DEFAULT_TRUE);

    assertThat(DirectoryDefaults.resolve("a", config).convert()).isTrue();
    assertThat(DirectoryDefaults.resolve("a/b", config)).isEqualTo(DirectoryMatch.of(false, "a/b"));
  }

  @Test
  public void testDeepestRecursiveEntryWins() {
    ImmutableMap<String, DirectoryDefault> config =
        ImmutableMap.of(
            "a", DEFAULT_TRUE_RECURSIVELY,
            "a/b", DEFAULT_FALSE_RECURSIVELY,
            "a/b/c", DEFAULT_TRUE_RECURSIVELY);

    assertThat(DirectoryDefaults.resolve("a/x", config)).isEqualTo(DirectoryMatch.of(true, "a"));
    assertThat(DirectoryDefaults.resolve("a/b/x", config))
        .isEqualTo(DirectoryMatch.of(false, "a/b"));
    assertThat(DirectoryDefaults.resolve("a/b/c/d", config))
        .isEqualTo(DirectoryMatch.of(true, "a/b/c"));
  }

  @Test
  public void testNoMatchIsScopedToRequestedPath() {
    assertThat(DirectoryDefaults.resolve("x/y", ImmutableMap.of()))
        .isEqualTo(DirectoryMatch.of(false, "x/y"));
  }
}
