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

/**
 * Per-directory default for whether modules are converted. A directory without an entry is unset.
 */
public enum DirectoryDefault {
  /** Convert every module in exactly this directory. */
  DEFAULT_TRUE,
  /** Convert every module in this directory and its descendants. */
  DEFAULT_TRUE_RECURSIVELY,
  /** Do not convert modules in exactly this directory unless they opt in. */
  DEFAULT_FALSE,
  /** Do not convert modules in this directory and its descendants unless they opt in. */
  DEFAULT_FALSE_RECURSIVELY;

  boolean isTrue() {
    return this == DEFAULT_TRUE || this == DEFAULT_TRUE_RECURSIVELY;
  }

  boolean isRecursive() {
    return this == DEFAULT_TRUE_RECURSIVELY || this == DEFAULT_FALSE_RECURSIVELY;
  }
}
