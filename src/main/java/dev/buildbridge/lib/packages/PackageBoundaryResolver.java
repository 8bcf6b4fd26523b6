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
package dev.buildbridge.lib.packages;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import dev.buildbridge.lib.allowlist.ConversionAllowlist;
import dev.buildbridge.lib.label.Label;
import dev.buildbridge.lib.label.LabelList;
import dev.buildbridge.lib.vfs.PathFragments;
import dev.buildbridge.lib.vfs.SourceTree;
import java.util.List;

/**
 * Rewrites paths so that they respect Bazel package boundaries.
 *
 * <p>Globs and relative paths in the source modules freely cross directories. Once expanded, a path
 * such as {@code async_safe/include/CHECK.h} in package {@code bionic/libc} has to become {@code
 * //bionic/libc/async_safe:include/CHECK.h} if {@code async_safe} is a package of its own. This
 * must happen after glob expansion: a glob handed to Bazel would silently stop at the boundary.
 *
 * <p>A directory is a package boundary if it contains a native build description, which is always
 * converted to a sibling BUILD file, or if it contains a checked-in BUILD file that is kept,
 * because the allowlist says so or because the directory is a symlink into a tree that has its
 * own.
 *
 * <p>Nothing is cached: the allowlist and the tree are stable within a build, but not across.
 */
public final class PackageBoundaryResolver {

  public static final String DEFAULT_NATIVE_BUILD_FILE = "Android.bp";
  public static final ImmutableList<String> TARGET_BUILD_FILES =
      ImmutableList.of("BUILD", "BUILD.bazel");

  private final SourceTree sourceTree;
  private final ConversionAllowlist allowlist;
  private final String nativeBuildFile;

  public PackageBoundaryResolver(SourceTree sourceTree, ConversionAllowlist allowlist) {
    this(sourceTree, allowlist, DEFAULT_NATIVE_BUILD_FILE);
  }

  public PackageBoundaryResolver(
      SourceTree sourceTree, ConversionAllowlist allowlist, String nativeBuildFile) {
    this.sourceTree = checkNotNull(sourceTree);
    this.allowlist = checkNotNull(allowlist);
    this.nativeBuildFile = checkNotNull(nativeBuildFile);
  }

  /** Returns whether {@code dir} (root-relative) is a package boundary. */
  public boolean isPackageBoundary(String dir) {
    if (sourceTree.exists(PathFragments.join(dir, nativeBuildFile))) {
      return true;
    }
    if (allowlist.shouldKeepExistingBuildFileForDir(dir) || sourceTree.isSymlink(dir)) {
      for (String buildFile : TARGET_BUILD_FILES) {
        if (sourceTree.exists(PathFragments.join(dir, buildFile))) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Resolves a path label relative to {@code baseDirectory}.
   *
   * <p>Absolute labels are returned unchanged. Otherwise the path is scanned from its deepest
   * directory upwards; the first package boundary found splits it into package and target, and the
   * result is absolute. A path that crosses no boundary stays relative to {@code baseDirectory}.
   * The original spelling is kept, or set to the path itself for labels that have none.
   */
  public Label resolve(String baseDirectory, Label path) {
    if (path.isAbsolute()) {
      return path;
    }
    String relative = path.getAddress();
    // "./y/a.c" must become "//x/y:a.c", not "//x/.:y/a.c".
    while (relative.startsWith("./")) {
      relative = relative.substring(2);
    }

    List<String> segments = PathFragments.segments(relative);
    if (segments.isEmpty()) {
      return path;
    }
    StringBuilder label = new StringBuilder();
    boolean foundBoundary = false;
    // Check the deepest directory first and work upwards.
    for (int i = segments.size() - 1; i >= 0; i--) {
      char separator = '/';
      String prefix =
          PathFragments.join(baseDirectory, PathFragments.joinSegments(segments.subList(0, i + 1)));
      if (!foundBoundary && isPackageBoundary(prefix)) {
        separator = ':';
        foundBoundary = true;
      }
      if (label.length() > 0) {
        label.insert(0, separator);
      }
      label.insert(0, segments.get(i));
    }

    String address = label.toString();
    if (foundBoundary) {
      String moduleDir = PathFragments.normalize(baseDirectory);
      address =
          moduleDir.equals(PathFragments.ROOT) ? "//" + address : "//" + moduleDir + "/" + address;
    }
    return Label.of(address, path.getOriginalSpelling());
  }

  /** Resolves every include and exclude of {@code paths}. */
  public LabelList resolveAll(String baseDirectory, LabelList paths) {
    return paths.transform(label -> resolve(baseDirectory, label));
  }
}
