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

import dev.buildbridge.graph.ModuleNode;
import dev.buildbridge.lib.vfs.PathFragments;

/** Labels of modules in the converted build. */
public final class ModuleLabels {

  /** Name prefix of prebuilt modules that their targets do not carry. */
  public static final String PREBUILT_PREFIX = "prebuilt_";

  /** Suffix of the placeholder address used for references to undefined modules. */
  public static final String MISSING_DEPENDENCY_SUFFIX = "__BP2BUILD__MISSING__DEP";

  private ModuleLabels() {}

  /** The label of the target generated for {@code module}: {@code //dir:name}. */
  public static String generatedLabel(ModuleNode module, boolean prebuilt) {
    String directory = module.getDirectory();
    if (directory.equals(PathFragments.ROOT)) {
      directory = "";
    }
    String name = module.getName();
    if (prebuilt && name.startsWith(PREBUILT_PREFIX)) {
      name = name.substring(PREBUILT_PREFIX.length());
    }
    return "//" + directory + ":" + name;
  }

  /**
   * The label other modules use for {@code module}: its hand-authored label if it has one,
   * otherwise its generated label.
   */
  public static String moduleLabel(ModuleNode module, boolean prebuilt) {
    String handcrafted = module.getHandcraftedLabel();
    return handcrafted != null ? handcrafted : generatedLabel(module, prebuilt);
  }

  /** The placeholder address for a reference to the undefined module {@code name}. */
  public static String missingDependencyLabel(String name) {
    return ":" + name + MISSING_DEPENDENCY_SUFFIX;
  }
}
