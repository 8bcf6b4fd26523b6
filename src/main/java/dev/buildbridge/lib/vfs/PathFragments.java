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
package dev.buildbridge.lib.vfs;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

/** String helpers for {@code /}-separated, root-relative paths. */
public final class PathFragments {

  /** The directory name used for the root of the source tree. */
  public static final String ROOT = ".";

  private static final Splitter SEGMENT_SPLITTER = Splitter.on('/');
  private static final Joiner SEGMENT_JOINER = Joiner.on('/');

  private PathFragments() {}

  /**
   * Joins path fragments, dropping empty and {@code .} fragments, and normalizes the result. The
   * join of nothing is {@code .}.
   */
  public static String join(String... fragments) {
    StringBuilder joined = new StringBuilder();
    for (String fragment : fragments) {
      if (fragment.isEmpty() || fragment.equals(ROOT)) {
        continue;
      }
      if (joined.length() > 0) {
        joined.append('/');
      }
      joined.append(fragment);
    }
    return normalize(joined.toString());
  }

  /** Collapses {@code .}, {@code ..} and duplicate separators. Returns {@code .} for the root. */
  public static String normalize(String path) {
    if (path.isEmpty()) {
      return ROOT;
    }
    return Files.simplifyPath(path);
  }

  /** Splits a path into its segments. The root has no segments. */
  public static ImmutableList<String> segments(String path) {
    String normalized = normalize(path);
    if (normalized.equals(ROOT)) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(SEGMENT_SPLITTER.split(normalized));
  }

  public static String joinSegments(Iterable<String> segments) {
    return SEGMENT_JOINER.join(segments);
  }

  /** Returns {@code path} relative to {@code dir}, or {@code path} itself if it is not beneath. */
  public static String relativize(String dir, String path) {
    String normalizedDir = normalize(dir);
    String normalizedPath = normalize(path);
    if (normalizedDir.equals(ROOT)) {
      return normalizedPath;
    }
    if (normalizedPath.startsWith(normalizedDir + "/")) {
      return normalizedPath.substring(normalizedDir.length() + 1);
    }
    return normalizedPath;
  }

  /** Returns the parent directory of {@code path}, {@code .} for top-level entries. */
  public static String parent(String path) {
    String normalized = normalize(path);
    int slash = normalized.lastIndexOf('/');
    return slash < 0 ? ROOT : normalized.substring(0, slash);
  }

  /** Returns whether {@code path} contains glob metacharacters. */
  public static boolean isGlob(String path) {
    return CharMatcher.anyOf("*?[").matchesAnyOf(path);
  }
}
