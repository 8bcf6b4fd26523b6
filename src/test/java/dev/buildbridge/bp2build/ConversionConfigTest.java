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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import dev.buildbridge.graph.ModuleNode;
import dev.buildbridge.graph.OsType;
import dev.buildbridge.lib.allowlist.ConversionAllowlist;
import dev.buildbridge.lib.allowlist.DirectoryDefault;
import dev.buildbridge.lib.packages.PackageBoundaryResolver;
import dev.buildbridge.lib.vfs.InMemorySourceTree;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConversionConfigTest {

  private final InMemorySourceTree tree = new InMemorySourceTree().addFiles("x/Android.bp");

  @Test
  public void testDefaults() {
    ConversionConfig config = ConversionConfig.newBuilder(tree).build();

    assertThat(config.getBuildMode()).isEqualTo(BuildMode.BP2BUILD);
    assertThat(config.getTargetOs()).isEqualTo(OsType.ANDROID);
    assertThat(config.allowMissingDependencies()).isFalse();
    assertThat(config.getNativeBuildFile())
        .isEqualTo(PackageBoundaryResolver.DEFAULT_NATIVE_BUILD_FILE);
    assertThat(config.getAllowlist()).isSameInstanceAs(ConversionAllowlist.empty());
    assertThat(config.getSourceTree()).isSameInstanceAs(tree);
    assertThat(config.getParallelism()).isGreaterThan(0);
    assertThat(config.isMixedBuildAllowlisted("lib")).isFalse();
  }

  @Test
  public void testCopyFromKeepsEverySetting() {
    ConversionConfig original =
        ConversionConfig.newBuilder(tree)
            .setBuildMode(BuildMode.MIXED_BUILD)
            .setTargetOs(OsType.LINUX)
            .setAllowMissingDependencies(true)
            .addMixedBuildAllowlist(ImmutableList.of("lib"))
            .addModulesWithoutConversionEdges(ImmutableList.of("bootstrap"))
            .setNativeBuildFile("Blueprints")
            .setParallelism(3)
            .build();

    ConversionConfig copy =
        ConversionConfig.newBuilder(new InMemorySourceTree())
            .copyFrom(original)
            .addMixedBuildAllowlist(ImmutableList.of("util"))
            .build();

    assertThat(copy.getBuildMode()).isEqualTo(BuildMode.MIXED_BUILD);
    assertThat(copy.getTargetOs()).isEqualTo(OsType.LINUX);
    assertThat(copy.allowMissingDependencies()).isTrue();
    assertThat(copy.isMixedBuildAllowlisted("lib")).isTrue();
    assertThat(copy.isMixedBuildAllowlisted("util")).isTrue();
    assertThat(original.isMixedBuildAllowlisted("util")).isFalse();
    assertThat(copy.skipsConversionEdge("bootstrap", "anything")).isTrue();
    assertThat(copy.getNativeBuildFile()).isEqualTo("Blueprints");
    assertThat(copy.getSourceTree()).isSameInstanceAs(tree);
    assertThat(copy.getParallelism()).isEqualTo(3);
  }

  @Test
  public void testSkipsConversionEdgesFromOrToListedModules() {
    ConversionConfig config =
        ConversionConfig.newBuilder(tree)
            .addModulesWithoutConversionEdges(ImmutableList.of("libc"))
            .addDependenciesWithoutConversionEdges(ImmutableList.of("crt"))
            .build();

    assertThat(config.skipsConversionEdge("libc", "libm")).isTrue();
    assertThat(config.skipsConversionEdge("app", "crt")).isTrue();
    assertThat(config.skipsConversionEdge("app", "libc")).isFalse();
    assertThat(config.skipsConversionEdge("crt", "app")).isFalse();
  }

  @Test
  public void testDeciderFollowsTheBuildMode() {
    ModuleTypeRegistry registry = TestModuleTypes.registry();
    ModuleNode library = registry.newModule("cc_library", "lib").setDirectory("x").build();
    ModuleNode contribution = registry.newModule("api_library", "api").setDirectory("y").build();
    ConversionConfig.Builder builder =
        ConversionConfig.newBuilder(tree)
            .setAllowlist(
                ConversionAllowlist.builder()
                    .setDirectoryDefault("x", DirectoryDefault.DEFAULT_TRUE)
                    .build());

    ConversionConfig full = builder.build();
    ConversionConfig api = builder.setBuildMode(BuildMode.API_BP2BUILD).build();

    assertThat(full.newDecider().decide(library).shouldConvert()).isTrue();
    assertThat(full.newDecider().decide(contribution).shouldConvert()).isFalse();
    assertThat(api.newDecider().decide(library).shouldConvert()).isFalse();
    assertThat(api.newDecider().decide(contribution).shouldConvert()).isTrue();
  }

  @Test
  public void testPackageBoundariesUseTheNativeBuildFile() {
    tree.addFiles("y/Blueprints", "y/z/a.c");

    ConversionConfig config =
        ConversionConfig.newBuilder(tree).setNativeBuildFile("Blueprints").build();

    assertThat(config.getPackageBoundaryResolver().isPackageBoundary("y")).isTrue();
    assertThat(config.getPackageBoundaryResolver().isPackageBoundary("x")).isFalse();
  }

  @Test
  public void testRejectsInvalidValues() {
    ConversionConfig.Builder builder = ConversionConfig.newBuilder(tree);

    assertThrows(IllegalArgumentException.class, () -> builder.setParallelism(0));
    assertThrows(IllegalArgumentException.class, () -> builder.setNativeBuildFile(""));
  }
}
