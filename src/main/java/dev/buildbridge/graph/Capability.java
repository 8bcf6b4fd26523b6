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

/**
 * What a module type can do beyond being a graph vertex. Modules carry the set of their tags; the
 * implementations are looked up by tag and module type in a registry.
 */
public enum Capability {
  /** Declares dependencies from its properties during dependency discovery. */
  DEPENDENCY_DECLARER,
  /** Has a conversion routine. */
  CONVERTIBLE,
  /** Contributes to an API surface and can be converted in API-only mode. */
  API_CONTRIBUTOR,
  /** Can be handed to the external executor in a mixed build. */
  MIXED_BUILDABLE;
}
