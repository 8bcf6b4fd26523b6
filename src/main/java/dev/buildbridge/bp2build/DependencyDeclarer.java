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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import dev.buildbridge.graph.DependencyTag;
import dev.buildbridge.graph.ModuleNode;
import dev.buildbridge.lib.label.ModuleReference;
import java.util.Map;

/** Capability of module types that declare dependencies on other modules. */
@FunctionalInterface
public interface DependencyDeclarer {

  /** The dependencies declared by {@code module}, in declaration order. */
  ImmutableList<DeclaredDependency> declareDependencies(ModuleNode module);

  /**
   * Declares every entry of each dependency property with the property's tag, and every module
   * reference found in a path property with {@link DependencyTag#OUTPUT_REFERENCE}.
   */
  static DependencyDeclarer fromProperties(
      Map<String, DependencyTag> dependencyProperties, Iterable<String> pathProperties) {
    ImmutableMap<String, DependencyTag> deps = ImmutableMap.copyOf(dependencyProperties);
    ImmutableSet<String> paths = ImmutableSet.copyOf(pathProperties);
    return module -> {
      ImmutableList.Builder<DeclaredDependency> declared = ImmutableList.builder();
      deps.forEach(
          (property, tag) -> {
            for (String value : module.getProperties().getStringList(property)) {
              declared.add(DeclaredDependency.create(property, value, tag));
            }
          });
      for (String property : paths) {
        for (String value : module.getProperties().getStringList(property)) {
          if (ModuleReference.looksLikeReference(value)) {
            declared.add(
                DeclaredDependency.create(property, value, DependencyTag.OUTPUT_REFERENCE));
          }
        }
      }
      return declared.build();
    };
  }
}
