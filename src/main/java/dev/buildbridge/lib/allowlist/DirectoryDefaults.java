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
package dev.buildbridge.lib.allowlist;

import com.google.common.collect.ImmutableMap;
import dev.buildbridge.lib.vfs.PathFragments;

/** Resolves the {@link DirectoryDefault} that applies to a package directory. */
public final class DirectoryDefaults {

  private DirectoryDefaults() {}

  /**
   * Returns whether all modules in {@code packagePath} are converted by default.
   *
   * <p>An entry for exactly {@code packagePath} decides on its own: either kind of true converts,
   * either kind of false does not, and no ancestor is consulted. Otherwise the ancestors are walked
   * from the root inwards and the deepest recursive entry wins. Non-recursive entries never apply
   * to descendants. If nothing matches, modules are not converted and the match is reported against
   * {@code packagePath} itself.
   */
  public static DirectoryMatch resolve(
      String packagePath, ImmutableMap<String, DirectoryDefault> config) {
    DirectoryDefault exact = config.get(packagePath);
    if (exact != null) {
      return DirectoryMatch.of(exact.isTrue(), packagePath);
    }

    DirectoryMatch deepest = null;
    StringBuilder prefix = new StringBuilder();
    // e.g. for x/y/z, look at x, x/y, then x/y/z.
    for (String segment : PathFragments.segments(packagePath)) {
      if (prefix.length() > 0) {
        prefix.append('/');
      }
      prefix.append(segment);
      DirectoryDefault entry = config.get(prefix.toString());
      if (entry != null && entry.isRecursive()) {
        deepest = DirectoryMatch.of(entry.isTrue(), prefix.toString());
      }
    }
    if (deepest != null && deepest.convert()) {
      return deepest;
    }
    return DirectoryMatch.of(false, deepest == null ? packagePath : deepest.matchedPath());
  }
}
