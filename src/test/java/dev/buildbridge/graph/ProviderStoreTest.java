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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ProviderStoreTest {

  private static final ProviderKey<String> NAME = ProviderKey.create("name", String.class);
  private static final ProviderKey<Integer> COUNT = ProviderKey.create("count", Integer.class);

  private final ProviderStore store = new ProviderStore("libfoo");

  @Test
  public void testPublishThenGet() {
    store.publish(NAME, "foo", "conversion");

    assertThat(store.get(NAME)).isEqualTo("foo");
    assertThat(store.has(NAME)).isTrue();
    assertThat(store.publishingPhase(NAME)).isEqualTo("conversion");
    assertThat(store.getIfPresent(COUNT)).isNull();
    assertThat(store.has(COUNT)).isFalse();
  }

  @Test
  public void testPublishIsWriteOnce() {
    store.publish(NAME, "foo", "first");

    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> store.publish(NAME, "bar", "second"));
    assertThat(e).hasMessageThat().contains("libfoo");
    assertThat(e).hasMessageThat().contains("first");
    assertThat(store.get(NAME)).isEqualTo("foo");
  }

  @Test
  public void testReadBeforePublishIsFatal() {
    IllegalStateException e = assertThrows(IllegalStateException.class, () -> store.get(COUNT));

    assertThat(e).hasMessageThat().contains("read before it was published");
  }

  @Test
  public void testKeysAreDistinctByIdentity() {
    ProviderKey<String> otherName = ProviderKey.create("name", String.class);
    store.publish(NAME, "foo", "p");

    assertThat(store.has(otherName)).isFalse();
  }
}
