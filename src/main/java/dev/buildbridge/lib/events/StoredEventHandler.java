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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/** Stores the events it receives so they can be inspected or replayed later. */
public class StoredEventHandler implements EventHandler {

  private final List<Event> events = new ArrayList<>();
  private boolean hasErrors;

  @Override
  public synchronized void handle(Event event) {
    hasErrors |= event.getKind().isError();
    events.add(event);
  }

  public synchronized ImmutableList<Event> getEvents() {
    return ImmutableList.copyOf(events);
  }

  /** Returns the events whose tag is the given module name, in the order they were reported. */
  public synchronized ImmutableList<Event> getEventsForTag(String tag) {
    return filter(event -> tag.equals(event.getTag()));
  }

  public synchronized ImmutableList<Event> getErrors() {
    return filter(event -> event.getKind().isError());
  }

  public synchronized boolean hasErrors() {
    return hasErrors;
  }

  public synchronized boolean isEmpty() {
    return events.isEmpty();
  }

  /** Forwards every stored event to {@code handler}, in order. */
  public synchronized void replayOn(EventHandler handler) {
    for (Event event : events) {
      handler.handle(event);
    }
  }

  public synchronized void clear() {
    events.clear();
    hasErrors = false;
  }

  private ImmutableList<Event> filter(Predicate<Event> predicate) {
    return events.stream().filter(predicate).collect(ImmutableList.toImmutableList());
  }
}
