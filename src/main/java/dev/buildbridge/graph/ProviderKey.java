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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A typed key for a provider: a value a module publishes for other modules to read in later
 * phases.
 *
 * <p>Keys compare by identity. Create each key once, as a constant.
 */
public final class ProviderKey<T> {

  private final String name;
  private final Class<T> type;

  private ProviderKey(String name, Class<T> type) {
    this.name = checkNotNull(name);
    this.type = checkNotNull(type);
  }

  public static <T> ProviderKey<T> create(String name, Class<T> type) {
    return new ProviderKey<>(name, type);
  }

  public String getName() {
    return name;
  }

  T cast(Object value) {
    return type.cast(value);
  }

  boolean accepts(Object value) {
    return type.isInstance(value);
  }

  @Override
  public String toString() {
    return name + "<" + type.getSimpleName() + ">";
  }
}
