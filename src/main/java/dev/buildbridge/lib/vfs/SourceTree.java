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

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.Collection;

/**
 * Read-only view of the source tree being converted. All paths are relative to the root of the
 * tree and use {@code /} as separator.
 *
 * <p>Implementations must be safe for concurrent use: every phase worker queries the tree.
 */
public interface SourceTree {

  /** Returns whether a file or directory exists at {@code path}. */
  boolean exists(String path);

  /** Returns whether {@code path} is a symbolic link. Missing paths are not symlinks. */
  boolean isSymlink(String path);

  /**
   * Returns the root-relative paths of all files matching {@code pattern}, minus those matching any
   * of {@code excludes}, in lexicographic order. Both the pattern and the excludes are
   * root-relative and may use {@code *}, {@code **} and {@code ?}.
   */
  ImmutableList<String> glob(String pattern, Collection<String> excludes) throws IOException;
}
