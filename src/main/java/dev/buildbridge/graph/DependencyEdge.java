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

import com.google.auto.value.AutoValue;

/** A directed edge from a module to one of its dependencies. */
@AutoValue
public abstract class DependencyEdge {

  public static DependencyEdge create(String from, String to, DependencyTag tag) {
    return new AutoValue_DependencyEdge(from, to, tag);
  }

  /** Name of the depending module. */
  public abstract String from();

  /** Name of the dependency. */
  public abstract String to();

  public abstract DependencyTag tag();
}
