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

import com.google.auto.value.AutoValue;

/**
 * Outcome of resolving a directory default: whether modules there are converted by default, and
 * the allowlist entry responsible. When nothing matched, the entry is the requested directory.
 */
@AutoValue
public abstract class DirectoryMatch {

  public static DirectoryMatch of(boolean convert, String matchedPath) {
    return new AutoValue_DirectoryMatch(convert, matchedPath);
  }

  public abstract boolean convert();

  public abstract String matchedPath();
}
