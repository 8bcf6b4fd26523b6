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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ModuleGraphTest {

  private final ModuleNode app = ModuleNode.builder("app", "cc_binary").setDirectory("x").build();
  private final ModuleNode lib =
      ModuleNode.builder("lib", "cc_library").setDirectory("x/y").build();
  private final ModuleNode top = ModuleNode.builder("top", "cc_library").build();
  private final ModuleGraph graph =
      ModuleGraph.builder().addModules(ImmutableList.of(app, lib, top)).build();

  @Test
  public void testDuplicateModuleNamesAreRejected() {
    ModuleGraph.Builder builder = ModuleGraph.builder().addModule(app);

    assertThrows(
        IllegalArgumentException.class,
        () -> builder.addModule(ModuleNode.builder("app", "other").build()));
  }

  @Test
  public void testLookup() {
    assertThat(graph.lookup("lib")).isSameInstanceAs(lib);
    assertThat(graph.lookup("//x/y:lib")).isSameInstanceAs(lib);
    assertThat(graph.lookup("//x:lib")).isNull();
    assertThat(graph.lookup("//:top")).isSameInstanceAs(top);
    assertThat(graph.lookup("missing")).isNull();
  }

  @Test
  public void testEdgesAndReverseDependencies() {
    graph.addEdge(app, lib, DependencyTag.DEPS);
    graph.addEdge(app, lib, DependencyTag.DEPS);
    graph.addEdge(app, lib, DependencyTag.LICENSE);
    graph.addEdge(top, lib, DependencyTag.CONVERSION_ONLY);

    assertThat(app.getEdges())
        .containsExactly(
            DependencyEdge.create("app", "lib", DependencyTag.DEPS),
            DependencyEdge.create("app", "lib", DependencyTag.LICENSE))
        .inOrder();
    assertThat(graph.getDirectDependencies(app)).containsExactly(lib);
    assertThat(graph.getReverseDependencies("lib")).containsExactly("app", "top");
    assertThat(graph.getDirectDependencies(top, /* includeConversionOnly= */ false)).isEmpty();
  }

  @Test
  public void testOnlyConversionEdgesAfterDiscovery() {
    graph.completeDiscovery();

    assertThat(graph.isDiscoveryComplete()).isTrue();
    assertThrows(IllegalStateException.class, () -> graph.addEdge(app, lib, DependencyTag.DEPS));
    graph.addEdge(app, lib, DependencyTag.CONVERSION_ONLY);
    assertThat(graph.getDirectDependencies(app)).containsExactly(lib);
  }

  @Test
  public void testForeignModuleIsRejected() {
    ModuleNode stranger = ModuleNode.builder("lib", "cc_library").build();

    assertThrows(
        IllegalArgumentException.class, () -> graph.addEdge(app, stranger, DependencyTag.DEPS));
  }

  @Test
  public void testModuleBuilderChecks() {
    assertThrows(IllegalArgumentException.class, () -> ModuleNode.builder("", "t"));
    assertThrows(
        IllegalArgumentException.class,
        () -> ModuleNode.builder("m", "t").setHandcraftedLabel("relative:label"));
    assertThrows(
        IllegalArgumentException.class,
        () -> ModuleNode.builder("m", "t").setHandcraftedLabel("//hand/made"));
    assertThat(
            ModuleNode.builder("m", "t")
                .setHandcraftedLabel("//hand:made")
                .setDirectory("./a/../b")
                .build()
                .getDirectory())
        .isEqualTo("b");
  }

  @Test
  public void testCapabilities() {
    ModuleNode module =
        ModuleNode.builder("m", "t")
            .addCapability(Capability.CONVERTIBLE)
            .addCapability(Capability.API_CONTRIBUTOR)
            .build();

    assertThat(module.isConvertible()).isTrue();
    assertThat(module.contributesApi()).isTrue();
    assertThat(module.hasCapability(Capability.MIXED_BUILDABLE)).isFalse();
    assertThat(app.isConvertible()).isFalse();
  }
}
