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
package dev.buildbridge.lib.label;

import com.google.common.collect.ImmutableSortedMap;
import dev.buildbridge.lib.vfs.PathFragments;
import java.util.Map;
import java.util.TreeMap;

/** Groups labels by the package that owns them. */
public final class LabelPartitions {

  private LabelPartitions() {}

  /**
   * Partitions the includes of {@code labels} by owning package, relative to {@code moduleDir}.
   *
   * <p>Package-relative labels belong to {@code moduleDir}. Absolute labels belong to the package
   * before their {@code :}; their part after the {@code :} becomes a label in that package. Keys
   * are package directories without the leading {@code //}, with the root rendered as {@code .}.
   */
  public static ImmutableSortedMap<String, LabelList> partitionByPackage(
      String moduleDir, LabelList labels) {
    Map<String, LabelList.Builder> partitions = new TreeMap<>();
    for (Label label : labels.getIncludes()) {
      String pkg = moduleDir;
      Label inPackage = label;
      if (label.isAbsolute()) {
        pkg = PathFragments.normalize(label.getPackageName().substring(2));
        inPackage = label.withAddress(label.getShortForm().substring(1));
      }
      partitions.computeIfAbsent(PathFragments.normalize(pkg), k -> LabelList.builder())
          .addInclude(inPackage);
    }
    ImmutableSortedMap.Builder<String, LabelList> result = ImmutableSortedMap.naturalOrder();
    partitions.forEach((pkg, builder) -> result.put(pkg, builder.build()));
    return result.buildOrThrow();
  }
}
