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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConversionDeciderTest {

  private static final class Candidate implements ConversionCandidate {
    private final String name;
    private final String type;
    private final String directory;
    @Nullable private final Boolean optIn;
    private boolean convertible = true;
    private boolean api = false;

    Candidate(String name, String type, String directory, @Nullable Boolean optIn) {
      this.name = name;
      this.type = type;
      this.directory = directory;
      this.optIn = optIn;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public String getType() {
      return type;
    }

    @Override
    public String getDirectory() {
      return directory;
    }

    @Override
    @Nullable
    public Boolean getExplicitOptIn() {
      return optIn;
    }

    @Override
    public boolean isConvertible() {
      return convertible;
    }

    @Override
    public boolean contributesApi() {
      return api;
    }
  }

  private static Candidate module(String name, String dir) {
    return new Candidate(name, "cc_library", dir, null);
  }

  private static ConversionDecision decide(ConversionAllowlist allowlist, ConversionCandidate m) {
    return new ConversionDecider(allowlist, /* apiSurfaceOnly= */ false).decide(m);
  }

  @Test
  public void testRecursiveDirectoryDefaultConverts() {
    ConversionAllowlist allowlist =
        ConversionAllowlist.builder()
            .setDirectoryDefault("a", DirectoryDefault.DEFAULT_TRUE_RECURSIVELY)
            .build();

    ConversionDecision decision = decide(allowlist, module("foo", "a/b/c"));

    assertThat(decision.shouldConvert()).isTrue();
    assertThat(decision.getDiagnostics()).isEmpty();
  }

  @Test
  public void testExactDirectoryFalseWins() {
    ConversionAllowlist allowlist =
        ConversionAllowlist.builder()
            .setDirectoryDefault("a", DirectoryDefault.DEFAULT_TRUE_RECURSIVELY)
            .setDirectoryDefault("a/b", DirectoryDefault.DEFAULT_FALSE)
            .build();

    assertThat(decide(allowlist, module("foo", "a/b")).shouldConvert()).isFalse();
  }

  @Test
  public void testNameAllowlistedInDefaultTrueDirectoryIsConflict() {
    ConversionAllowlist allowlist =
        ConversionAllowlist.builder()
            .addModuleAlwaysConvert(ImmutableList.of("foo"))
            .setDefaultConfig(ImmutableMap.of("existing/dir", DirectoryDefault.DEFAULT_TRUE))
            .build();

    ConversionDecision decision = decide(allowlist, module("foo", "existing/dir"));

    assertThat(decision.shouldConvert()).isFalse();
    assertThat(decision.hasConflict()).isTrue();
    assertThat(decision.getDiagnostics()).hasSize(1);
    assertThat(decision.getDiagnostics().get(0)).contains("existing/dir");
  }

  @Test
  public void testNameAndTypeAllowlistedIsConflict() {
    ConversionAllowlist allowlist =
        ConversionAllowlist.builder()
            .addModuleAlwaysConvert(ImmutableList.of("foo"))
            .addModuleTypeAlwaysConvert(ImmutableList.of("cc_library"))
            .build();

    ConversionDecision decision = decide(allowlist, module("foo", "x"));

    assertThat(decision.shouldConvert()).isFalse();
    assertThat(decision.getDiagnostics()).hasSize(1);
  }

  @Test
  public void testDenylistedAndAllowlistedIsConflict() {
    ConversionAllowlist allowlist =
        ConversionAllowlist.builder()
            .addModuleAlwaysConvert(ImmutableList.of("foo"))
            .addModuleDoNotConvert(ImmutableList.of("foo"))
            .build();

    ConversionDecision decision = decide(allowlist, module("foo", "x"));

    assertThat(decision.shouldConvert()).isFalse();
    assertThat(decision.hasConflict()).isTrue();
  }

  @Test
  public void testDenylistedIsNotConvertedEvenInDefaultTrueDirectory() {
    ConversionAllowlist allowlist =
        ConversionAllowlist.builder()
            .addModuleDoNotConvert(ImmutableList.of("foo"))
            .setDirectoryDefault("x", DirectoryDefault.DEFAULT_TRUE)
            .build();

    ConversionDecision decision = decide(allowlist, module("foo", "x"));

    assertThat(decision.shouldConvert()).isFalse();
    assertThat(decision.hasConflict()).isFalse();
  }

  @Test
  public void testOptOutOverridesDirectoryDefault() {
    ConversionAllowlist allowlist =
        ConversionAllowlist.builder()
            .setDirectoryDefault("x", DirectoryDefault.DEFAULT_TRUE)
            .build();

    Candidate optedOut = new Candidate("foo", "cc_library", "x", false);

    assertThat(decide(allowlist, optedOut).shouldConvert()).isFalse();
  }

  @Test
  public void testTopLevelOptInSkipsConflictChecks() {
    ConversionAllowlist allowlist =
        ConversionAllowlist.builder()
            .addModuleAlwaysConvert(ImmutableList.of("foo"))
            .addModuleTypeAlwaysConvert(ImmutableList.of("cc_library"))
            .build();

    ConversionDecision decision = decide(allowlist, new Candidate("foo", "cc_library", ".", true));

    assertThat(decision.shouldConvert()).isTrue();
    assertThat(decision.getDiagnostics()).isEmpty();
  }

  @Test
  public void testAllowlistFallback() {
    ConversionAllowlist byName =
        ConversionAllowlist.builder().addModuleAlwaysConvert(ImmutableList.of("foo")).build();
    ConversionAllowlist byType =
        ConversionAllowlist.builder()
            .addModuleTypeAlwaysConvert(ImmutableList.of("cc_library"))
            .build();

    assertThat(decide(byName, module("foo", "x")).shouldConvert()).isTrue();
    assertThat(decide(byType, module("foo", "x")).shouldConvert()).isTrue();
    assertThat(decide(ConversionAllowlist.empty(), module("foo", "x")).shouldConvert()).isFalse();
  }

  @Test
  public void testExplicitOptInWithoutAllowlist() {
    Candidate optedIn = new Candidate("foo", "cc_library", "x", true);

    assertThat(decide(ConversionAllowlist.empty(), optedIn).shouldConvert()).isTrue();
  }

  @Test
  public void testUnconvertibleTypeIsNeverConverted() {
    Candidate candidate = new Candidate("foo", "cc_library", ".", true);
    candidate.convertible = false;

    assertThat(decide(ConversionAllowlist.empty(), candidate).shouldConvert()).isFalse();
  }

  @Test
  public void testApiSurfaceOnly() {
    Candidate contributor = module("api", "x");
    contributor.api = true;
    ConversionAllowlist allowlist =
        ConversionAllowlist.builder().addModuleAlwaysConvert(ImmutableList.of("foo")).build();
    ConversionDecider decider = new ConversionDecider(allowlist, /* apiSurfaceOnly= */ true);

    assertThat(decider.decide(contributor).shouldConvert()).isTrue();
    assertThat(decider.decide(module("foo", "x")).shouldConvert()).isFalse();
  }
}
