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
package dev.buildbridge.lib.vfs;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GlobPatternTest {

  @Test
  public void testSingleStarStaysWithinSegment() {
    GlobPattern glob = GlobPattern.compile("src/*.c");

    assertThat(glob.matches("src/a.c")).isTrue();
    assertThat(glob.matches("src/sub/a.c")).isFalse();
    assertThat(glob.matches("src/a.h")).isFalse();
  }

  @Test
  public void testDoubleStarMatchesZeroOrMoreSegments() {
    GlobPattern glob = GlobPattern.compile("a/**/b.c");

    assertThat(glob.matches("a/b.c")).isTrue();
    assertThat(glob.matches("a/x/b.c")).isTrue();
    assertThat(glob.matches("a/x/y/b.c")).isTrue();
    assertThat(glob.matches("ab.c")).isFalse();
  }

  @Test
  public void testTrailingDoubleStar() {
    GlobPattern glob = GlobPattern.compile("res/**");

    assertThat(glob.matches("res/a")).isTrue();
    assertThat(glob.matches("res/x/y")).isTrue();
    assertThat(glob.matches("other/a")).isFalse();
  }

  @Test
  public void testQuestionMarkAndDotsAreLiteralSafe() {
    GlobPattern glob = GlobPattern.compile("v?.c");

    assertThat(glob.matches("v1.c")).isTrue();
    assertThat(glob.matches("v1xc")).isFalse();
    assertThat(glob.matches("v/.c")).isFalse();
  }

  @Test
  public void testCharacterClass() {
    GlobPattern glob = GlobPattern.compile("[ab].c");

    assertThat(glob.matches("a.c")).isTrue();
    assertThat(glob.matches("c.c")).isFalse();
  }

  @Test
  public void testLiteralPrefix() {
    assertThat(GlobPattern.compile("src/foo/*.c").literalPrefix()).isEqualTo("src/foo");
    assertThat(GlobPattern.compile("**/*.c").literalPrefix()).isEqualTo(".");
    assertThat(GlobPattern.compile("src/a.c").literalPrefix()).isEqualTo("src");
    assertThat(GlobPattern.compile("a.c").literalPrefix()).isEqualTo(".");
  }

  @Test
  public void testEmptyPatternIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> GlobPattern.compile(""));
  }
}
