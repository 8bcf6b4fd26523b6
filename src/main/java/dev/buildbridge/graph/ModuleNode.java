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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.buildbridge.lib.allowlist.ConversionCandidate;
import dev.buildbridge.lib.vfs.PathFragments;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;

/**
 * A vertex of the {@link ModuleGraph}: one variant of a declared build module.
 *
 * <p>The declaration (name, type, directory, properties, flags, capabilities) is fixed at
 * construction. The per-run state (outgoing edges, providers, conversion status, failure) is
 * written only by the module's own phase steps, except for the failure flag which the scheduler
 * sets.
 */
public final class ModuleNode implements ConversionCandidate {

  private final String name;
  private final String type;
  private final String directory;
  private final OsType osType;
  private final PropertyBag properties;
  private final boolean enabled;
  @Nullable private final String handcraftedLabel;
  @Nullable private final Boolean explicitOptIn;
  private final ImmutableSet<Capability> capabilities;

  private final CopyOnWriteArrayList<DependencyEdge> edges = new CopyOnWriteArrayList<>();
  private final ProviderStore providers;
  private final ConversionStatus conversionStatus = new ConversionStatus();
  private final AtomicBoolean failed = new AtomicBoolean();

  private ModuleNode(Builder builder) {
    this.name = checkNotNull(builder.name, "name");
    this.type = checkNotNull(builder.type, "type");
    this.directory = PathFragments.normalize(builder.directory);
    this.osType = builder.osType;
    this.properties = builder.properties;
    this.enabled = builder.enabled;
    this.handcraftedLabel = builder.handcraftedLabel;
    this.explicitOptIn = builder.explicitOptIn;
    this.capabilities = builder.capabilities.build();
    this.providers = new ProviderStore(name);
  }

  public static Builder builder(String name, String type) {
    return new Builder(name, type);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getType() {
    return type;
  }

  @Override
  public String getDirectory() {
    return directory;
  }

  public OsType getOsType() {
    return osType;
  }

  public PropertyBag getProperties() {
    return properties;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /** The hand-authored target this module maps to, or null. */
  @Nullable
  public String getHandcraftedLabel() {
    return handcraftedLabel;
  }

  @Override
  @Nullable
  public Boolean getExplicitOptIn() {
    return explicitOptIn;
  }

  public ImmutableSet<Capability> getCapabilities() {
    return capabilities;
  }

  public boolean hasCapability(Capability capability) {
    return capabilities.contains(capability);
  }

  @Override
  public boolean isConvertible() {
    return hasCapability(Capability.CONVERTIBLE);
  }

  @Override
  public boolean contributesApi() {
    return hasCapability(Capability.API_CONTRIBUTOR);
  }

  /** The edges from this module to its dependencies, in insertion order. */
  public ImmutableList<DependencyEdge> getEdges() {
    return ImmutableList.copyOf(edges);
  }

  public ProviderStore getProviders() {
    return providers;
  }

  public ConversionStatus getConversionStatus() {
    return conversionStatus;
  }

  /** Whether this module, or a module it requires, failed earlier in the run. */
  public boolean isFailed() {
    return failed.get();
  }

  /** Returns true if the module was not already failed. */
  boolean markFailed() {
    return failed.compareAndSet(false, true);
  }

  /** Returns false if the same edge was already present. */
  boolean addEdge(DependencyEdge edge) {
    checkArgument(edge.from().equals(name), "edge %s does not start at '%s'", edge, name);
    return edges.addIfAbsent(edge);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("type", type)
        .add("directory", directory)
        .add("os", osType)
        .toString();
  }

  /** Builder for {@link ModuleNode}. */
  public static final class Builder {
    private final String name;
    private final String type;
    private String directory = PathFragments.ROOT;
    private OsType osType = OsType.COMMON_OS;
    private PropertyBag properties = PropertyBag.empty();
    private boolean enabled = true;
    @Nullable private String handcraftedLabel;
    @Nullable private Boolean explicitOptIn;
    private final ImmutableSet.Builder<Capability> capabilities = ImmutableSet.builder();

    private Builder(String name, String type) {
      checkArgument(!name.isEmpty(), "module name may not be empty");
      this.name = name;
      this.type = checkNotNull(type);
    }

    @CanIgnoreReturnValue
    public Builder setDirectory(String directory) {
      this.directory = checkNotNull(directory);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setOsType(OsType osType) {
      this.osType = checkNotNull(osType);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setProperties(PropertyBag properties) {
      this.properties = checkNotNull(properties);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setEnabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setHandcraftedLabel(@Nullable String handcraftedLabel) {
      checkArgument(
          handcraftedLabel == null
              || (handcraftedLabel.startsWith("//") && handcraftedLabel.contains(":")),
          "hand-authored label '%s' must be absolute",
          handcraftedLabel);
      this.handcraftedLabel = handcraftedLabel;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setExplicitOptIn(@Nullable Boolean explicitOptIn) {
      this.explicitOptIn = explicitOptIn;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addCapabilities(Iterable<Capability> capabilities) {
      this.capabilities.addAll(capabilities);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addCapability(Capability capability) {
      this.capabilities.add(capability);
      return this;
    }

    public ModuleNode build() {
      return new ModuleNode(this);
    }
  }
}
