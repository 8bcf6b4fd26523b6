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
import static com.google.common.base.Preconditions.checkState;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/**
 * The providers published by one module.
 *
 * <p>Each key is written at most once. Writing a key twice, or reading a key that was never
 * written, means that a phase was wired without the ordering it relies on; both fail fast with an
 * {@link IllegalStateException} that must be fixed at the call site.
 *
 * <p>Only the owning module's step writes, so writes never race with each other; reads from other
 * modules happen in later phases, after the barrier.
 */
public final class ProviderStore {

  private final String owner;
  private final Map<ProviderKey<?>, Published> providers = new ConcurrentHashMap<>();

  ProviderStore(String owner) {
    this.owner = owner;
  }

  /** Publishes {@code value} under {@code key} during {@code phase}. */
  public <T> void publish(ProviderKey<T> key, T value, String phase) {
    checkNotNull(value, "null value for %s", key);
    checkArgument(key.accepts(value), "%s is not a valid value for %s", value, key);
    Published previous = providers.putIfAbsent(key, new Published(value, phase));
    checkState(
        previous == null,
        "module '%s' already published %s in phase '%s', cannot publish again in '%s'",
        owner,
        key,
        previous == null ? null : previous.phase,
        phase);
  }

  /**
   * Returns the value published under {@code key}.
   *
   * @throws IllegalStateException if nothing was published
   */
  public <T> T get(ProviderKey<T> key) {
    Published published = providers.get(key);
    checkState(
        published != null,
        "provider %s of module '%s' was read before it was published; a phase is missing an"
            + " ordering dependency",
        key,
        owner);
    return key.cast(published.value);
  }

  /** Returns the value published under {@code key}, or null. For optional providers only. */
  @Nullable
  public <T> T getIfPresent(ProviderKey<T> key) {
    Published published = providers.get(key);
    return published == null ? null : key.cast(published.value);
  }

  public boolean has(ProviderKey<?> key) {
    return providers.containsKey(key);
  }

  /** Returns the phase that published {@code key}, or null. */
  @Nullable
  public String publishingPhase(ProviderKey<?> key) {
    Published published = providers.get(key);
    return published == null ? null : published.phase;
  }

  private static final class Published {
    private final Object value;
    private final String phase;

    private Published(Object value, String phase) {
      this.value = value;
      this.phase = phase;
    }
  }
}
