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
package dev.buildbridge.bp2build;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import dev.buildbridge.graph.ModuleNode;
import dev.buildbridge.lib.allowlist.ConversionAllowlist;
import dev.buildbridge.lib.allowlist.ConversionDecider;
import dev.buildbridge.lib.allowlist.DirectoryDefault;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConversionDecisionsTest {

  private final ModuleTypeRegistry registry = TestModuleTypes.registry();
  private final ConversionDecisions decisions =
      new ConversionDecisions(
          new ConversionDecider(
              ConversionAllowlist.builder()
                  .setDirectoryDefault("x", DirectoryDefault.DEFAULT_TRUE)
                  .build(),
              /* apiSurfaceOnly= */ false));

  @Test
  public void testOnlyEarlierFailuresCountAsUnconverted() {
    ModuleNode lib = registry.newModule("cc_library", "lib").setDirectory("x").build();
    ModuleNode other = registry.newModule("cc_library", "other").setDirectory("x").build();

    assertThat(decisions.isConvertedToBazel(lib)).isTrue();

    decisions.setEarlierFailures(ImmutableSet.of("lib"));

    assertThat(decisions.isConvertedToBazel(lib)).isFalse();
    assertThat(decisions.isConvertedToBazel(other)).isTrue();
    assertThat(decisions.decide(lib).shouldConvert()).isTrue();
  }

  @Test
  public void testHandcraftedModulesAreAlwaysConverted() {
    ModuleNode hand =
        registry
            .newModule("cc_library", "hand")
            .setDirectory("elsewhere")
            .setHandcraftedLabel("//hand:made")
            .build();

    decisions.setEarlierFailures(ImmutableSet.of("hand"));

    assertThat(decisions.isConvertedToBazel(hand)).isTrue();
  }

  @Test
  public void testDecisionsAreMemoized() {
    ModuleNode lib = registry.newModule("cc_library", "lib").setDirectory("x").build();

    assertThat(decisions.decide(lib)).isSameInstanceAs(decisions.decide(lib));
    assertThat(decisions.snapshot()).containsKey("lib");
  }
}
