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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Collection;
import java.util.stream.Stream;

/** A {@link SourceTree} backed by a directory on the local file system. */
public final class LocalSourceTree implements SourceTree {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Path root;

  public LocalSourceTree(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  public Path getRoot() {
    return root;
  }

  @Override
  public boolean exists(String path) {
    return Files.exists(resolve(path), LinkOption.NOFOLLOW_LINKS);
  }

  @Override
  public boolean isSymlink(String path) {
    return Files.isSymbolicLink(resolve(path));
  }

  @Override
  public ImmutableList<String> glob(String pattern, Collection<String> excludes)
      throws IOException {
    GlobPattern include = GlobPattern.compile(PathFragments.normalize(pattern));
    ImmutableList<GlobPattern> excluded =
        excludes.stream()
            .map(e -> GlobPattern.compile(PathFragments.normalize(e)))
            .collect(toImmutableList());
    Path start = resolve(include.literalPrefix());
    if (!Files.isDirectory(start)) {
      logger.atFine().log("glob %s: %s is not a directory", pattern, start);
      return ImmutableList.of();
    }
    try (Stream<Path> files = Files.walk(start)) {
      return files
          .filter(Files::isRegularFile)
          .map(p -> root.relativize(p).toString().replace('\\', '/'))
          .filter(include::matches)
          .filter(p -> excluded.stream().noneMatch(e -> e.matches(p)))
          .sorted()
          .collect(toImmutableList());
    }
  }

  private Path resolve(String path) {
    String normalized = PathFragments.normalize(path);
    return normalized.equals(PathFragments.ROOT) ? root : root.resolve(normalized);
  }
}
