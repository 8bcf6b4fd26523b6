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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.buildbridge.graph.Capability;
import dev.buildbridge.mixed.MixedBuildable;
import javax.annotation.Nullable;

/**
 * A registered module type: its name and the implementations of the capabilities it has. The
 * capability set of a module of this type follows from which implementations are present.
 */
public final class ModuleType {

  private final String name;
  @Nullable private final DependencyDeclarer dependencyDeclarer;
  @Nullable private final Converter converter;
  @Nullable private final ApiConverter apiConverter;
  @Nullable private final MixedBuildable mixedBuildable;
  private final boolean prebuilt;

  private ModuleType(Builder builder) {
    this.name = builder.name;
    this.dependencyDeclarer = builder.dependencyDeclarer;
    this.converter = builder.converter;
    this.apiConverter = builder.apiConverter;
    this.mixedBuildable = builder.mixedBuildable;
    this.prebuilt = builder.prebuilt;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  /** Whether modules of this type are prebuilts, whose labels drop the {@code prebuilt_} prefix. */
  public boolean isPrebuilt() {
    return prebuilt;
  }

  public ImmutableSet<Capability> getCapabilities() {
    ImmutableSet.Builder<Capability> capabilities = ImmutableSet.builder();
    if (dependencyDeclarer != null) {
      capabilities.add(Capability.DEPENDENCY_DECLARER);
    }
    if (converter != null) {
      capabilities.add(Capability.CONVERTIBLE);
    }
    if (apiConverter != null) {
      capabilities.add(Capability.API_CONTRIBUTOR);
    }
    if (mixedBuildable != null) {
      capabilities.add(Capability.MIXED_BUILDABLE);
    }
    return capabilities.build();
  }

  @Nullable
  DependencyDeclarer getDependencyDeclarer() {
    return dependencyDeclarer;
  }

  @Nullable
  Converter getConverter() {
    return converter;
  }

  @Nullable
  ApiConverter getApiConverter() {
    return apiConverter;
  }

  @Nullable
  MixedBuildable getMixedBuildable() {
    return mixedBuildable;
  }

  @Override
  public String toString() {
    return name + getCapabilities();
  }

  /** Builder for {@link ModuleType}. */
  public static final class Builder {
    private final String name;
    @Nullable private DependencyDeclarer dependencyDeclarer;
    @Nullable private Converter converter;
    @Nullable private ApiConverter apiConverter;
    @Nullable private MixedBuildable mixedBuildable;
    private boolean prebuilt;

    private Builder(String name) {
      checkArgument(!name.isEmpty(), "module type name may not be empty");
      this.name = name;
    }

    @CanIgnoreReturnValue
    public Builder setDependencyDeclarer(DependencyDeclarer dependencyDeclarer) {
      this.dependencyDeclarer = checkNotNull(dependencyDeclarer);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setConverter(Converter converter) {
      this.converter = checkNotNull(converter);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setApiConverter(ApiConverter apiConverter) {
      this.apiConverter = checkNotNull(apiConverter);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMixedBuildable(MixedBuildable mixedBuildable) {
      this.mixedBuildable = checkNotNull(mixedBuildable);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setPrebuilt(boolean prebuilt) {
      this.prebuilt = prebuilt;
      return this;
    }

    public ModuleType build() {
      return new ModuleType(this);
    }
  }
}
