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

import javax.annotation.Nullable;

/** What the {@link ConversionDecider} needs to know about a module. */
public interface ConversionCandidate {

  String getName();

  String getType();

  /** Directory of the module, {@code .} for the top level. */
  String getDirectory();

  /** The module's own opt-in ({@code true}), opt-out ({@code false}), or null if unset. */
  @Nullable
  Boolean getExplicitOptIn();

  /** Whether the module type has a conversion routine at all. */
  boolean isConvertible();

  /** Whether the module contributes to an API surface. */
  boolean contributesApi();
}
