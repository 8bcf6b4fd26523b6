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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The parsed properties of a module. Values are strings, booleans, lists of strings, or nested
 * property bags.
 */
@Immutable
public final class PropertyBag {

  private static final PropertyBag EMPTY = new PropertyBag(ImmutableMap.of());

  @SuppressWarnings("Immutable") // Values are immutable by construction.
  private final ImmutableMap<String, Object> values;

  private PropertyBag(ImmutableMap<String, Object> values) {
    this.values = values;
  }

  public static PropertyBag empty() {
    return EMPTY;
  }

  /** Creates a bag, copying lists and maps into immutable ones. */
  public static PropertyBag of(Map<String, ?> values) {
    ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
    values.forEach((name, value) -> builder.put(name, freeze(name, value)));
    return new PropertyBag(builder.buildOrThrow());
  }

  private static Object freeze(String name, Object value) {
    if (value instanceof String || value instanceof Boolean || value instanceof PropertyBag) {
      return value;
    }
    if (value instanceof List<?> list) {
      for (Object element : list) {
        checkArgument(element instanceof String, "property '%s' has non-string element", name);
      }
      return ImmutableList.copyOf(list);
    }
    if (value instanceof Map<?, ?> map) {
      ImmutableMap.Builder<String, Object> nested = ImmutableMap.builder();
      map.forEach((k, v) -> nested.put((String) k, v));
      return of(nested.buildOrThrow());
    }
    throw new IllegalArgumentException(
        String.format("property '%s' has unsupported type %s", name, value.getClass().getName()));
  }

  public boolean has(String name) {
    return values.containsKey(name);
  }

  public ImmutableSet<String> names() {
    return values.keySet();
  }

  @Nullable
  public String getString(String name) {
    return get(name, String.class);
  }

  @Nullable
  public Boolean getBoolean(String name) {
    return get(name, Boolean.class);
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    Boolean value = getBoolean(name);
    return value == null ? defaultValue : value;
  }

  /**
   * Returns the string list {@code name}, or null if the property is not set. An explicitly empty
   * list is returned as such.
   */
  @Nullable
  @SuppressWarnings("unchecked")
  public ImmutableList<String> getStringListOrNull(String name) {
    return (ImmutableList<String>) get(name, ImmutableList.class);
  }

  public ImmutableList<String> getStringList(String name) {
    ImmutableList<String> value = getStringListOrNull(name);
    return value == null ? ImmutableList.of() : value;
  }

  public PropertyBag getBag(String name) {
    PropertyBag value = get(name, PropertyBag.class);
    return value == null ? EMPTY : value;
  }

  @Nullable
  private <T> T get(String name, Class<T> type) {
    Object value = values.get(name);
    if (value == null) {
      return null;
    }
    checkArgument(
        type.isInstance(value),
        "property '%s' is a %s, not a %s",
        name,
        value.getClass().getSimpleName(),
        type.getSimpleName());
    return type.cast(value);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof PropertyBag other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
