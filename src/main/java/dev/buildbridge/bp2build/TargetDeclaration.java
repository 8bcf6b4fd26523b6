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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.buildbridge.lib.label.Label;
import dev.buildbridge.lib.label.LabelList;
import dev.buildbridge.lib.vfs.PathFragments;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A target of the converted build: a rule class instantiated with a name and attributes in a
 * package.
 *
 * <p>Attribute values are strings, booleans, integers, or lists of strings. Labels are stored as
 * their addresses; label lists as the addresses of their includes.
 */
public final class TargetDeclaration {

  private final String ruleClass;
  private final String name;
  @Nullable private final String packageName;
  @Nullable private final String loadLocation;
  private final ImmutableMap<String, Object> attributes;

  private TargetDeclaration(Builder builder) {
    this.ruleClass = builder.ruleClass;
    this.name = builder.name;
    this.packageName = builder.packageName;
    this.loadLocation = builder.loadLocation;
    this.attributes = ImmutableMap.copyOf(builder.attributes);
  }

  public static Builder builder(String ruleClass, String name) {
    return new Builder(ruleClass, name);
  }

  public String getRuleClass() {
    return ruleClass;
  }

  public String getName() {
    return name;
  }

  /** The package the target goes into, or null for the package of the module that made it. */
  @Nullable
  public String getPackageName() {
    return packageName;
  }

  /** The {@code .bzl} file defining the rule class, or null for native rules. */
  @Nullable
  public String getLoadLocation() {
    return loadLocation;
  }

  public ImmutableMap<String, Object> getAttributes() {
    return attributes;
  }

  /** Returns a copy placed in {@code packageName} if this declaration names no package. */
  TargetDeclaration inPackageIfUnset(String packageName) {
    if (this.packageName != null) {
      return this;
    }
    Builder builder =
        builder(ruleClass, name).setPackageName(packageName).setLoadLocation(loadLocation);
    builder.attributes.putAll(attributes);
    return builder.build();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TargetDeclaration)) {
      return false;
    }
    TargetDeclaration other = (TargetDeclaration) obj;
    return ruleClass.equals(other.ruleClass)
        && name.equals(other.name)
        && Objects.equals(packageName, other.packageName)
        && Objects.equals(loadLocation, other.loadLocation)
        && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ruleClass, name, packageName, loadLocation, attributes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("ruleClass", ruleClass)
        .add("name", name)
        .add("package", packageName)
        .add("attributes", attributes)
        .toString();
  }

  /** Builder for {@link TargetDeclaration}. Unset and empty-list attributes are omitted. */
  public static final class Builder {
    private final String ruleClass;
    private final String name;
    @Nullable private String packageName;
    @Nullable private String loadLocation;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    private Builder(String ruleClass, String name) {
      checkArgument(!ruleClass.isEmpty(), "empty rule class");
      checkArgument(!name.isEmpty(), "empty target name");
      this.ruleClass = ruleClass;
      this.name = name;
    }

    @CanIgnoreReturnValue
    public Builder setPackageName(@Nullable String packageName) {
      this.packageName = packageName == null ? null : PathFragments.normalize(packageName);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLoadLocation(@Nullable String loadLocation) {
      this.loadLocation = loadLocation;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setString(String attribute, @Nullable String value) {
      return put(attribute, value);
    }

    @CanIgnoreReturnValue
    public Builder setBoolean(String attribute, @Nullable Boolean value) {
      return put(attribute, value);
    }

    @CanIgnoreReturnValue
    public Builder setInteger(String attribute, @Nullable Integer value) {
      return put(attribute, value);
    }

    @CanIgnoreReturnValue
    public Builder setStringList(String attribute, Iterable<String> values) {
      ImmutableList<String> list = ImmutableList.copyOf(values);
      return put(attribute, list.isEmpty() ? null : list);
    }

    @CanIgnoreReturnValue
    public Builder setLabel(String attribute, @Nullable Label label) {
      return put(attribute, label == null ? null : label.getAddress());
    }

    @CanIgnoreReturnValue
    public Builder setLabelList(String attribute, LabelList labels) {
      return setStringList(attribute, labels.includeAddresses());
    }

    private Builder put(String attribute, @Nullable Object value) {
      checkArgument(!attribute.equals("name"), "'name' is set by the builder");
      checkNotNull(attribute);
      if (value == null) {
        attributes.remove(attribute);
      } else {
        attributes.put(attribute, value);
      }
      return this;
    }

    public TargetDeclaration build() {
      return new TargetDeclaration(this);
    }
  }
}
