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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.buildbridge.graph.DependencyTag;
import dev.buildbridge.graph.ModuleStepException;
import dev.buildbridge.lib.label.LabelList;
import dev.buildbridge.mixed.ConfigKey;
import dev.buildbridge.mixed.ExternalQueryException;
import dev.buildbridge.mixed.MixedBuildContext;
import dev.buildbridge.mixed.MixedBuildInfo;
import dev.buildbridge.mixed.MixedBuildable;
import dev.buildbridge.mixed.RequestType;
import java.util.Map;

/** Module types shaped like the common native ones, for conversion tests. */
final class TestModuleTypes {

  static final String CC_LOAD = "//build/bazel/rules/cc:cc_library.bzl";

  /** {@code srcs} and {@code exclude_srcs}; converts to a {@code filegroup}. */
  static final ModuleType FILEGROUP =
      ModuleType.builder("filegroup")
          .setDependencyDeclarer(
              DependencyDeclarer.fromProperties(ImmutableMap.of(), ImmutableList.of("srcs")))
          .setConverter(
              ctx ->
                  ctx.createTarget(
                      TargetDeclaration.builder("filegroup", ctx.getModuleName())
                          .setLabelList("srcs", sources(ctx))
                          .build()))
          .build();

  /** {@code srcs}, {@code exclude_srcs} and {@code deps}; mixed-buildable. */
  static final ModuleType CC_LIBRARY =
      ModuleType.builder("cc_library")
          .setDependencyDeclarer(
              DependencyDeclarer.fromProperties(
                  ImmutableMap.of("deps", DependencyTag.DEPS), ImmutableList.of("srcs")))
          .setConverter(
              ctx -> {
                LabelList deps =
                    ctx.references()
                        .labelsForModuleDeps(ctx.getProperties().getStringListOrNull("deps"));
                ctx.createTarget(
                    TargetDeclaration.builder("cc_library", ctx.getModuleName())
                        .setLoadLocation(CC_LOAD)
                        .setLabelList("srcs", sources(ctx))
                        .setLabelList("deps", deps)
                        .build());
              })
          .setMixedBuildable(new OutputFilesMixedBuild())
          .build();

  /** A prebuilt whose target drops the {@code prebuilt_} prefix. */
  static final ModuleType PREBUILT_LIBRARY =
      ModuleType.builder("cc_prebuilt_library")
          .setPrebuilt(true)
          .setConverter(
              ctx -> {
                String name = ctx.getModuleLabel().getShortForm().substring(1);
                ctx.createTarget(
                    TargetDeclaration.builder("cc_prebuilt_library", name)
                        .setString("src", ctx.getProperties().getString("src"))
                        .build());
              })
          .build();

  /** Contributes to an API surface only. */
  static final ModuleType API_LIBRARY =
      ModuleType.builder("api_library")
          .setApiConverter(
              ctx ->
                  ctx.createTarget(
                      TargetDeclaration.builder("api_contribution", ctx.getModuleName() + ".api")
                          .setString("api_surface", ctx.getProperties().getString("surface"))
                          .setLabelList("hdrs", sources(ctx))
                          .build()))
          .build();

  /** Has a tool that may be a module, a local file or a plain command. */
  static final ModuleType GENRULE =
      ModuleType.builder("genrule")
          .setConverter(
              ctx -> {
                String toolProperty = ctx.getProperties().getString("tool");
                StringOrLabel tool = ctx.references().stringOrLabelFromProperty(toolProperty);
                TargetDeclaration.Builder target =
                    TargetDeclaration.builder("genrule", ctx.getModuleName());
                if (tool.label() != null) {
                  target.setLabel("tool", tool.label());
                } else {
                  target.setString("cmd", tool.string());
                }
                ctx.createTarget(target.build());
              })
          .build();

  /** Its target goes into the one package that owns all of its sources. */
  static final ModuleType PROTO_LIBRARY =
      ModuleType.builder("proto_library")
          .setConverter(
              ctx -> {
                Map.Entry<String, LabelList> srcs = ctx.singlePackage("srcs", sources(ctx));
                ctx.createTarget(
                    TargetDeclaration.builder("proto_library", ctx.getModuleName())
                        .setPackageName(srcs.getKey())
                        .setLabelList("srcs", srcs.getValue())
                        .build());
              })
          .build();

  /** Fails conversion unless property {@code ok} is true. */
  static final ModuleType FRAGILE =
      ModuleType.builder("fragile")
          .setDependencyDeclarer(
              DependencyDeclarer.fromProperties(
                  ImmutableMap.of("deps", DependencyTag.DEPS), ImmutableList.of()))
          .setConverter(
              ctx -> {
                if (!ctx.getProperties().getBoolean("ok", false)) {
                  throw new ModuleStepException("cannot convert " + ctx.getModuleName());
                }
                ctx.createTarget(TargetDeclaration.builder("fragile", ctx.getModuleName()).build());
              })
          .build();

  /** Gives up on conversion without failing. */
  static final ModuleType UNSUPPORTED =
      ModuleType.builder("unsupported")
          .setConverter(ctx -> ctx.markUnconvertible("property 'magic' has no equivalent"))
          .build();

  static ModuleTypeRegistry registry() {
    return ModuleTypeRegistry.builder()
        .register(FILEGROUP)
        .register(CC_LIBRARY)
        .register(PREBUILT_LIBRARY)
        .register(API_LIBRARY)
        .register(GENRULE)
        .register(PROTO_LIBRARY)
        .register(FRAGILE)
        .register(UNSUPPORTED)
        .build();
  }

  private static LabelList sources(ConversionContext ctx) {
    return ctx.references()
        .labelsForModuleSrcExcludes(
            ctx.getProperties().getStringListOrNull("srcs"),
            ctx.getProperties().getStringListOrNull("exclude_srcs"));
  }

  /** Asks the external executor for the library's output files and publishes them. */
  private static final class OutputFilesMixedBuild implements MixedBuildable {
    @Override
    public boolean isMixedBuildSupported(MixedBuildContext ctx) {
      return !ctx.getModule().getProperties().getBoolean("no_mixed", false);
    }

    @Override
    public void queueExternalCall(MixedBuildContext ctx) {
      ctx.queue(RequestType.GET_OUTPUT_FILES, ConfigKey.COMMON);
    }

    @Override
    public void processExternalQueryResponse(MixedBuildContext ctx) throws ModuleStepException {
      ImmutableList<String> files;
      try {
        files = ctx.getResult(RequestType.GET_OUTPUT_FILES, ConfigKey.COMMON);
      } catch (ExternalQueryException e) {
        throw new ModuleStepException("no output files for " + ctx.getLabel(), e);
      }
      ctx.publish(MixedBuildInfo.KEY, MixedBuildInfo.create(ctx.getLabel().getAddress(), files));
    }
  }

  private TestModuleTypes() {}
}
