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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import dev.buildbridge.graph.DependencyTag;
import dev.buildbridge.graph.ModuleGraph;
import dev.buildbridge.graph.ModuleNode;
import dev.buildbridge.graph.OsType;
import dev.buildbridge.graph.StepEnvironment;
import dev.buildbridge.lib.label.Label;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MixedBuildsTest {

  private final StepEnvironment env = mock(StepEnvironment.class);
  private final FakeExternalExecutor executor = new FakeExternalExecutor();
  private final ModuleNode lib = ModuleNode.builder("lib", "cc_library").setDirectory("x").build();
  private final ModuleNode app = ModuleNode.builder("app", "cc_binary").setDirectory("x").build();
  private final ModuleGraph graph =
      ModuleGraph.builder().addModules(ImmutableList.of(lib, app)).build();

  @Before
  public void setUpEnvironment() {
    when(env.getGraph()).thenReturn(graph);
    when(env.getPhaseName()).thenReturn("mixed_build_process");
  }

  private MixedBuildContext context(
      ModuleNode module, OsType targetOs, boolean converted, boolean allowlisted) {
    return new MixedBuildContext(
        module,
        env,
        executor,
        Label.of("//x:" + module.getName()),
        targetOs,
        converted,
        allowlisted);
  }

  @Test
  public void testEnabledWhenConvertedAndAllowlisted() {
    assertThat(MixedBuilds.isEnabled(context(lib, OsType.ANDROID, true, true))).isTrue();
  }

  @Test
  public void testDisabledForUnsupportedPlatform() {
    ModuleNode windowsLib =
        ModuleNode.builder("winlib", "cc_library").setOsType(OsType.WINDOWS).build();

    assertThat(MixedBuilds.isEnabled(context(lib, OsType.WINDOWS, true, true))).isFalse();
    assertThat(MixedBuilds.isEnabled(context(windowsLib, OsType.ANDROID, true, true))).isFalse();
  }

  @Test
  public void testDisabledUnlessConvertedAndAllowlisted() {
    assertThat(MixedBuilds.isEnabled(context(lib, OsType.ANDROID, false, true))).isFalse();
    assertThat(MixedBuilds.isEnabled(context(lib, OsType.ANDROID, true, false))).isFalse();
  }

  @Test
  public void testDisabledForDisabledModule() {
    ModuleNode disabled = ModuleNode.builder("off", "cc_library").setEnabled(false).build();

    assertThat(MixedBuilds.isEnabled(context(disabled, OsType.ANDROID, true, true))).isFalse();
  }

  @Test
  public void testMissingDependenciesDoNotDisable() {
    lib.getConversionStatus().addMissingDependency("ghost");

    assertThat(MixedBuilds.isEnabled(context(lib, OsType.ANDROID, true, true))).isTrue();
  }

  @Test
  public void testQueueThenReadResult() throws Exception {
    executor.setOutputs("//x:lib", "out/lib.so");
    MixedBuildContext ctx = context(lib, OsType.ANDROID, true, true);

    ExternalRequest request = ctx.queue(RequestType.GET_OUTPUT_FILES, ConfigKey.COMMON);
    executor.invokeQueries();

    assertThat(request.address()).isEqualTo("//x:lib");
    assertThat(ctx.getResult(RequestType.GET_OUTPUT_FILES, ConfigKey.COMMON))
        .containsExactly("out/lib.so");
  }

  @Test
  public void testProvidersFlowToDirectDependents() {
    graph.addEdge(app, lib, DependencyTag.DEPS);
    MixedBuildInfo info = MixedBuildInfo.create("//x:lib", ImmutableList.of("out/lib.so"));

    context(lib, OsType.ANDROID, true, true).publish(MixedBuildInfo.KEY, info);

    assertThat(lib.getProviders().publishingPhase(MixedBuildInfo.KEY))
        .isEqualTo("mixed_build_process");
    assertThat(
            context(app, OsType.ANDROID, true, true)
                .getDependencyProvider(lib, MixedBuildInfo.KEY))
        .isEqualTo(info);
    assertThrows(
        IllegalArgumentException.class,
        () ->
            context(lib, OsType.ANDROID, true, true)
                .getDependencyProvider(app, MixedBuildInfo.KEY));
  }

  @Test
  public void testReportErrorGoesToEnvironment() {
    context(lib, OsType.ANDROID, true, true).reportError("bad output");

    verify(env).reportError("bad output");
  }
}
