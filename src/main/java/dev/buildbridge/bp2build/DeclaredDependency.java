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
package dev.buildbridge.bp2build;

import com.google.auto.value.AutoValue;
import dev.buildbridge.graph.DependencyTag;

/** A dependency a module declares in one of its properties. */
@AutoValue
public abstract class DeclaredDependency {

  public static DeclaredDependency create(String property, String value, DependencyTag tag) {
    return new AutoValue_DeclaredDependency(property, value, tag);
  }

  /** The property the dependency was declared in. */
  public abstract String property();

  /** The entry as written: a bare module name or a module reference. */
  public abstract String value();

  public abstract DependencyTag tag();
}
