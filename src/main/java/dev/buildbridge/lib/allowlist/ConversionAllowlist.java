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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The tables that decide which modules are converted.
 *
 * <p>Built once per process and shared read-only between all workers; instances are immutable and
 * safe for unsynchronized concurrent reads.
 *
 * <p>A module may be opted in by name or by type, but not both, and a name may not be both in an
 * always-convert and a never-convert list. These conflicts are reported against the module when
 * it is evaluated (see {@link ConversionDecider}); {@link #findConflicts} lists the ones that are
 * visible from the tables alone, which a conversion run reports as warnings before it starts.
 */
@Immutable
public final class ConversionAllowlist {

  private static final ConversionAllowlist EMPTY = builder().build();

  private final ImmutableMap<String, DirectoryDefault> defaultConfig;
  // Directory -> whether the entry also covers subdirectories.
  private final ImmutableMap<String, Boolean> keepExistingBuildFile;
  private final ImmutableSet<String> moduleAlwaysConvert;
  private final ImmutableSet<String> moduleTypeAlwaysConvert;
  private final ImmutableSet<String> moduleDoNotConvert;

  private ConversionAllowlist(Builder builder) {
    this.defaultConfig = ImmutableMap.copyOf(builder.defaultConfig);
    this.keepExistingBuildFile = ImmutableMap.copyOf(builder.keepExistingBuildFile);
    this.moduleAlwaysConvert = ImmutableSet.copyOf(builder.moduleAlwaysConvert);
    this.moduleTypeAlwaysConvert = ImmutableSet.copyOf(builder.moduleTypeAlwaysConvert);
    this.moduleDoNotConvert = ImmutableSet.copyOf(builder.moduleDoNotConvert);
  }

  public static ConversionAllowlist empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setDefaultConfig(defaultConfig)
        .setKeepExistingBuildFile(keepExistingBuildFile)
        .addModuleAlwaysConvert(moduleAlwaysConvert)
        .addModuleTypeAlwaysConvert(moduleTypeAlwaysConvert)
        .addModuleDoNotConvert(moduleDoNotConvert);
  }

  public ImmutableMap<String, DirectoryDefault> getDefaultConfig() {
    return defaultConfig;
  }

  public boolean isModuleAlwaysConverted(String moduleName) {
    return moduleAlwaysConvert.contains(moduleName);
  }

  public boolean isModuleTypeAlwaysConverted(String moduleType) {
    return moduleTypeAlwaysConvert.contains(moduleType);
  }

  public boolean isModuleDoNotConvert(String moduleName) {
    return moduleDoNotConvert.contains(moduleName);
  }

  /**
   * Returns whether the checked-in BUILD file of {@code dir} is kept instead of generating one:
   * {@code dir} has an entry of its own, or an ancestor has a recursive entry.
   */
  public boolean shouldKeepExistingBuildFileForDir(String dir) {
    if (keepExistingBuildFile.containsKey(dir)) {
      return true;
    }
    for (Map.Entry<String, Boolean> entry : keepExistingBuildFile.entrySet()) {
      if (entry.getValue() && dir.startsWith(entry.getKey() + "/")) {
        return true;
      }
    }
    return false;
  }

  /** Returns one message per module name that is both always- and never-converted. */
  public ImmutableList<String> findConflicts() {
    return Sets.intersection(moduleAlwaysConvert, moduleDoNotConvert).stream()
        .sorted()
        .map(
            name ->
                String.format(
                    "module '%s' is in both the always-convert and do-not-convert lists", name))
        .collect(toImmutableList());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("defaultConfig", defaultConfig)
        .add("keepExistingBuildFile", keepExistingBuildFile)
        .add("moduleAlwaysConvert", moduleAlwaysConvert)
        .add("moduleTypeAlwaysConvert", moduleTypeAlwaysConvert)
        .add("moduleDoNotConvert", moduleDoNotConvert)
        .toString();
  }

  /** Builder for {@link ConversionAllowlist}. Setters merge into what was set before. */
  public static final class Builder {
    private final Map<String, DirectoryDefault> defaultConfig = new LinkedHashMap<>();
    private final Map<String, Boolean> keepExistingBuildFile = new LinkedHashMap<>();
    private final Set<String> moduleAlwaysConvert = new LinkedHashSet<>();
    private final Set<String> moduleTypeAlwaysConvert = new LinkedHashSet<>();
    private final Set<String> moduleDoNotConvert = new LinkedHashSet<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setDefaultConfig(Map<String, DirectoryDefault> config) {
      defaultConfig.putAll(config);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDirectoryDefault(String dir, DirectoryDefault value) {
      defaultConfig.put(dir, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setKeepExistingBuildFile(Map<String, Boolean> dirs) {
      keepExistingBuildFile.putAll(dirs);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addModuleAlwaysConvert(Iterable<String> names) {
      names.forEach(moduleAlwaysConvert::add);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addModuleTypeAlwaysConvert(Iterable<String> types) {
      types.forEach(moduleTypeAlwaysConvert::add);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addModuleDoNotConvert(Iterable<String> names) {
      names.forEach(moduleDoNotConvert::add);
      return this;
    }

    public ConversionAllowlist build() {
      return new ConversionAllowlist(this);
    }
  }
}
