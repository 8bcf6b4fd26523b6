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

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.buildbridge.graph.Capability;
import dev.buildbridge.graph.ModuleNode;
import dev.buildbridge.mixed.MixedBuildable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The registered module types. Capability implementations are looked up by a module's capability
 * tags and its type name.
 */
public final class ModuleTypeRegistry {

  private final ImmutableMap<String, ModuleType> types;

  private ModuleTypeRegistry(ImmutableMap<String, ModuleType> types) {
    this.types = types;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Nullable
  public ModuleType getType(String typeName) {
    return types.get(typeName);
  }

  /** Starts a module of registered type {@code typeName}, with that type's capability tags. */
  public ModuleNode.Builder newModule(String typeName, String moduleName) {
    return ModuleNode.builder(moduleName, typeName)
        .addCapabilities(typeOf(typeName).getCapabilities());
  }

  public Optional<DependencyDeclarer> getDependencyDeclarer(ModuleNode module) {
    return module.hasCapability(Capability.DEPENDENCY_DECLARER)
        ? Optional.ofNullable(typeOf(module.getType()).getDependencyDeclarer())
        : Optional.empty();
  }

  public Optional<Converter> getConverter(ModuleNode module) {
    return module.hasCapability(Capability.CONVERTIBLE)
        ? Optional.ofNullable(typeOf(module.getType()).getConverter())
        : Optional.empty();
  }

  public Optional<ApiConverter> getApiConverter(ModuleNode module) {
    return module.hasCapability(Capability.API_CONTRIBUTOR)
        ? Optional.ofNullable(typeOf(module.getType()).getApiConverter())
        : Optional.empty();
  }

  public Optional<MixedBuildable> getMixedBuildable(ModuleNode module) {
    return module.hasCapability(Capability.MIXED_BUILDABLE)
        ? Optional.ofNullable(typeOf(module.getType()).getMixedBuildable())
        : Optional.empty();
  }

  /** Whether {@code module} is of a prebuilt type. Unregistered types are not prebuilt. */
  public boolean isPrebuilt(ModuleNode module) {
    ModuleType type = types.get(module.getType());
    return type != null && type.isPrebuilt();
  }

  private ModuleType typeOf(String typeName) {
    ModuleType type = types.get(typeName);
    checkArgument(type != null, "unregistered module type '%s'", typeName);
    return type;
  }

  /** Builder for {@link ModuleTypeRegistry}. */
  public static final class Builder {
    private final Map<String, ModuleType> types = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder register(ModuleType type) {
      ModuleType previous = types.putIfAbsent(type.getName(), type);
      checkArgument(previous == null, "module type '%s' registered twice", type.getName());
      return this;
    }

    public ModuleTypeRegistry build() {
      return new ModuleTypeRegistry(ImmutableMap.copyOf(types));
    }
  }
}
