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
package dev.buildbridge.lib.label;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * An ordered set of included labels plus a separate set of excluded labels.
 *
 * <p>Includes keep their first occurrence: adding a label whose address is already present is a
 * no-op, even if it was spelled differently. Excludes are subtracted from includes by address,
 * never by spelling.
 */
@Immutable
public final class LabelList {

  private static final LabelList EMPTY = new LabelList(ImmutableList.of(), ImmutableList.of());

  private final ImmutableList<Label> includes;
  private final ImmutableList<Label> excludes;

  private LabelList(ImmutableList<Label> includes, ImmutableList<Label> excludes) {
    this.includes = includes;
    this.excludes = excludes;
  }

  public static LabelList empty() {
    return EMPTY;
  }

  public static LabelList of(Collection<Label> includes) {
    return builder().addIncludes(includes).build();
  }

  public static LabelList of(Collection<Label> includes, Collection<Label> excludes) {
    return builder().addIncludes(includes).addExcludes(excludes).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableList<Label> getIncludes() {
    return includes;
  }

  public ImmutableList<Label> getExcludes() {
    return excludes;
  }

  public boolean isEmpty() {
    return includes.isEmpty() && excludes.isEmpty();
  }

  public ImmutableSet<String> includeAddresses() {
    return addresses(includes);
  }

  public ImmutableSet<String> excludeAddresses() {
    return addresses(excludes);
  }

  /** Returns a list whose includes are this list's includes minus its excludes. */
  public LabelList subtractExcludes() {
    if (excludes.isEmpty()) {
      return this;
    }
    Set<String> excluded = excludeAddresses();
    Builder builder = builder();
    for (Label include : includes) {
      if (!excluded.contains(include.getAddress())) {
        builder.addInclude(include);
      }
    }
    return builder.addExcludes(excludes).build();
  }

  /** Returns the concatenation of both lists, keeping first occurrences. */
  public LabelList append(LabelList other) {
    return builder()
        .addIncludes(includes)
        .addIncludes(other.includes)
        .addExcludes(excludes)
        .addExcludes(other.excludes)
        .build();
  }

  /** Applies {@code fn} to every include and exclude. Labels that collapse onto one are merged. */
  public LabelList transform(Function<Label, Label> fn) {
    Builder builder = builder();
    includes.forEach(label -> builder.addInclude(fn.apply(label)));
    excludes.forEach(label -> builder.addExclude(fn.apply(label)));
    return builder.build();
  }

  private static ImmutableSet<String> addresses(Collection<Label> labels) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builderWithExpectedSize(labels.size());
    labels.forEach(label -> builder.add(label.getAddress()));
    return builder.build();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof LabelList other
        && includes.equals(other.includes)
        && excludes.equals(other.excludes);
  }

  @Override
  public int hashCode() {
    return 31 * includes.hashCode() + excludes.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("includes", includes)
        .add("excludes", excludes)
        .toString();
  }

  /** Builder for {@link LabelList}. Not thread-safe. */
  public static final class Builder {
    private final Map<String, Label> includes = new LinkedHashMap<>();
    private final Map<String, Label> excludes = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addInclude(Label label) {
      includes.putIfAbsent(label.getAddress(), label);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addIncludes(Iterable<Label> labels) {
      labels.forEach(this::addInclude);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addExclude(Label label) {
      excludes.putIfAbsent(label.getAddress(), label);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addExcludes(Iterable<Label> labels) {
      labels.forEach(this::addExclude);
      return this;
    }

    public LabelList build() {
      if (includes.isEmpty() && excludes.isEmpty()) {
        return EMPTY;
      }
      return new LabelList(
          ImmutableList.copyOf(includes.values()), ImmutableList.copyOf(excludes.values()));
    }
  }
}
