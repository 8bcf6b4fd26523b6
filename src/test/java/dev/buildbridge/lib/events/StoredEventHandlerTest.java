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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StoredEventHandlerTest {

  @Test
  public void testStoresEventsInOrder() {
    StoredEventHandler handler = new StoredEventHandler();
    Event warning = Event.warn("careful").withTag("foo");
    Event error = Event.error("broken").withTag("bar");

    handler.handle(warning);
    handler.handle(error);

    assertThat(handler.getEvents()).containsExactly(warning, error).inOrder();
    assertThat(handler.getErrors()).containsExactly(error);
    assertThat(handler.getEventsForTag("foo")).containsExactly(warning);
    assertThat(handler.hasErrors()).isTrue();
  }

  @Test
  public void testWarningsAreNotErrors() {
    StoredEventHandler handler = new StoredEventHandler();

    handler.handle(Event.warn("careful"));
    handler.handle(Event.info("fyi"));

    assertThat(handler.hasErrors()).isFalse();
    assertThat(handler.isEmpty()).isFalse();
  }

  @Test
  public void testReplayAndClear() {
    StoredEventHandler handler = new StoredEventHandler();
    handler.handle(Event.error("one"));
    handler.handle(Event.progress("two"));
    List<Event> replayed = new ArrayList<>();

    handler.replayOn(replayed::add);
    handler.clear();

    assertThat(replayed).hasSize(2);
    assertThat(handler.isEmpty()).isTrue();
    assertThat(handler.hasErrors()).isFalse();
  }

  @Test
  public void testTeeForwardsToBoth() {
    StoredEventHandler first = new StoredEventHandler();
    StoredEventHandler second = new StoredEventHandler();
    Event event = Event.info("hello");

    new TeeEventHandler(first, second).handle(event);

    assertThat(first.getEvents()).containsExactly(event);
    assertThat(second.getEvents()).containsExactly(event);
  }

  @Test
  public void testEventToStringMentionsModule() {
    assertThat(Event.error("bad").withTag("libfoo").toString())
        .isEqualTo("ERROR: module \"libfoo\": bad");
    assertThat(Event.error("bad").toString()).isEqualTo("ERROR: bad");
  }
}
