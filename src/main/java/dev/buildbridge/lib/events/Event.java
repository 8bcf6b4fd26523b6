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
package dev.buildbridge.lib.events;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A diagnostic produced while mutating the module graph.
 *
 * <p>Events are the user-facing channel: allowlist conflicts, unresolvable references and failed
 * conversions are reported as events tagged with the module they concern. Internal progress goes
 * to the logger instead.
 */
@Immutable
public final class Event {

  private final EventKind kind;
  private final String message;
  @Nullable private final String tag;

  private Event(EventKind kind, String message, @Nullable String tag) {
    this.kind = checkNotNull(kind);
    this.message = checkNotNull(message);
    this.tag = tag;
  }

  public static Event of(EventKind kind, String message) {
    return new Event(kind, message, /* tag= */ null);
  }

  public static Event error(String message) {
    return of(EventKind.ERROR, message);
  }

  public static Event warn(String message) {
    return of(EventKind.WARNING, message);
  }

  public static Event info(String message) {
    return of(EventKind.INFO, message);
  }

  public static Event progress(String message) {
    return of(EventKind.PROGRESS, message);
  }

  /** Returns a copy of this event tagged with the name of the module it concerns. */
  public Event withTag(@Nullable String tag) {
    if (Objects.equals(tag, this.tag)) {
      return this;
    }
    return new Event(kind, message, tag);
  }

  public EventKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  /** The name of the module this event concerns, or null for global events. */
  @Nullable
  public String getTag() {
    return tag;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Event other)) {
      return false;
    }
    return kind == other.kind && message.equals(other.message) && Objects.equals(tag, other.tag);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, message, tag);
  }

  @Override
  public String toString() {
    return tag == null ? kind + ": " + message : kind + ": module \"" + tag + "\": " + message;
  }
}
