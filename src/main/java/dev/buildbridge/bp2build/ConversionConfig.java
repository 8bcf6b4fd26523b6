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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import dev.buildbridge.graph.OsType;
import dev.buildbridge.lib.allowlist.ConversionAllowlist;
import dev.buildbridge.lib.allowlist.ConversionDecider;
import dev.buildbridge.lib.packages.PackageBoundaryResolver;
import dev.buildbridge.lib.vfs.SourceTree;

/**
 * Configuration of a conversion run. Built once before the run and shared read-only by every
 * worker.
 */
@Immutable
public final class ConversionConfig {

  private final ConversionAllowlist allowlist;
  private final BuildMode buildMode;
  private final OsType targetOs;
  private final boolean allowMissingDependencies;
  private final ImmutableSet<String> mixedBuildAllowlist;
  private final ImmutableSet<String> modulesWithoutConversionEdges;
  private final ImmutableSet<String> dependenciesWithoutConversionEdges;
  private final String nativeBuildFile;

  @SuppressWarnings("Immutable") // Source trees are only read.
  private final SourceTree sourceTree;

  private final int parallelism;

  @SuppressWarnings("Immutable") // Derived from the fields above.
  private final PackageBoundaryResolver packageBoundaryResolver;

  private ConversionConfig(Builder builder) {
    this.allowlist = builder.allowlist;
    this.buildMode = builder.buildMode;
    this.targetOs = builder.targetOs;
    this.allowMissingDependencies = builder.allowMissingDependencies;
    this.mixedBuildAllowlist = builder.mixedBuildAllowlist.build();
    this.modulesWithoutConversionEdges = builder.modulesWithoutConversionEdges.build();
    this.dependenciesWithoutConversionEdges = builder.dependenciesWithoutConversionEdges.build();
    this.nativeBuildFile = builder.nativeBuildFile;
    this.sourceTree = builder.sourceTree;
    this.parallelism = builder.parallelism;
    this.packageBoundaryResolver =
        new PackageBoundaryResolver(sourceTree, allowlist, nativeBuildFile);
  }

  public static Builder newBuilder(SourceTree sourceTree) {
    return new Builder(sourceTree);
  }

  public ConversionAllowlist getAllowlist() {
    return allowlist;
  }

  public BuildMode getBuildMode() {
    return buildMode;
  }

  public OsType getTargetOs() {
    return targetOs;
  }

  /** Whether dependencies on undefined modules are recorded instead of reported as errors. */
  public boolean allowMissingDependencies() {
    return allowMissingDependencies;
  }

  public boolean isMixedBuildAllowlisted(String moduleName) {
    return mixedBuildAllowlist.contains(moduleName);
  }

  /**
   * Whether references made while converting should leave no conversion-only edge. Used for
   * bootstrap modules that depend on a variant of themselves, which would otherwise form a cycle.
   */
  public boolean skipsConversionEdge(String fromModule, String toModule) {
    return modulesWithoutConversionEdges.contains(fromModule)
        || dependenciesWithoutConversionEdges.contains(toModule);
  }

  public String getNativeBuildFile() {
    return nativeBuildFile;
  }

  public SourceTree getSourceTree() {
    return sourceTree;
  }

  public int getParallelism() {
    return parallelism;
  }

  public PackageBoundaryResolver getPackageBoundaryResolver() {
    return packageBoundaryResolver;
  }

  /** A decider for this configuration's allowlist and build mode. */
  public ConversionDecider newDecider() {
    return new ConversionDecider(allowlist, buildMode == BuildMode.API_BP2BUILD);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("buildMode", buildMode)
        .add("targetOs", targetOs)
        .add("allowMissingDependencies", allowMissingDependencies)
        .add("mixedBuildAllowlist", mixedBuildAllowlist.size())
        .add("nativeBuildFile", nativeBuildFile)
        .add("parallelism", parallelism)
        .toString();
  }

  /** Builder for {@link ConversionConfig}. */
  public static class Builder {
    private ConversionAllowlist allowlist = ConversionAllowlist.empty();
    private BuildMode buildMode = BuildMode.BP2BUILD;
    private OsType targetOs = OsType.ANDROID;
    private boolean allowMissingDependencies;
    private ImmutableSet.Builder<String> mixedBuildAllowlist = ImmutableSet.builder();
    private ImmutableSet.Builder<String> modulesWithoutConversionEdges = ImmutableSet.builder();
    private ImmutableSet.Builder<String> dependenciesWithoutConversionEdges =
        ImmutableSet.builder();
    private String nativeBuildFile = PackageBoundaryResolver.DEFAULT_NATIVE_BUILD_FILE;
    private SourceTree sourceTree;
    private int parallelism = Runtime.getRuntime().availableProcessors();

    protected Builder(SourceTree sourceTree) {
      this.sourceTree = Preconditions.checkNotNull(sourceTree);
    }

    @CanIgnoreReturnValue
    public Builder copyFrom(ConversionConfig config) {
      this.allowlist = config.allowlist;
      this.buildMode = config.buildMode;
      this.targetOs = config.targetOs;
      this.allowMissingDependencies = config.allowMissingDependencies;
      this.mixedBuildAllowlist = ImmutableSet.<String>builder().addAll(config.mixedBuildAllowlist);
      this.modulesWithoutConversionEdges =
          ImmutableSet.<String>builder().addAll(config.modulesWithoutConversionEdges);
      this.dependenciesWithoutConversionEdges =
          ImmutableSet.<String>builder().addAll(config.dependenciesWithoutConversionEdges);
      this.nativeBuildFile = config.nativeBuildFile;
      this.sourceTree = config.sourceTree;
      this.parallelism = config.parallelism;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setAllowlist(ConversionAllowlist allowlist) {
      this.allowlist = Preconditions.checkNotNull(allowlist);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setBuildMode(BuildMode buildMode) {
      this.buildMode = Preconditions.checkNotNull(buildMode);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTargetOs(OsType targetOs) {
      this.targetOs = Preconditions.checkNotNull(targetOs);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setAllowMissingDependencies(boolean allowMissingDependencies) {
      this.allowMissingDependencies = allowMissingDependencies;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addMixedBuildAllowlist(Iterable<String> moduleNames) {
      this.mixedBuildAllowlist.addAll(moduleNames);
      return this;
    }

    /** Modules whose references never leave conversion-only edges. */
    @CanIgnoreReturnValue
    public Builder addModulesWithoutConversionEdges(Iterable<String> moduleNames) {
      this.modulesWithoutConversionEdges.addAll(moduleNames);
      return this;
    }

    /** Modules that never receive conversion-only edges. */
    @CanIgnoreReturnValue
    public Builder addDependenciesWithoutConversionEdges(Iterable<String> moduleNames) {
      this.dependenciesWithoutConversionEdges.addAll(moduleNames);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setNativeBuildFile(String nativeBuildFile) {
      Preconditions.checkArgument(!nativeBuildFile.isEmpty(), "empty build file name");
      this.nativeBuildFile = nativeBuildFile;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSourceTree(SourceTree sourceTree) {
      this.sourceTree = Preconditions.checkNotNull(sourceTree);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setParallelism(int parallelism) {
      Preconditions.checkArgument(parallelism > 0, "parallelism must be positive: %s", parallelism);
      this.parallelism = parallelism;
      return this;
    }

    public ConversionConfig build() {
      return new ConversionConfig(this);
    }
  }
}
