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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;

/**
 * Classifies the role of a {@link DependencyEdge}.
 *
 * <p>Tags compare by identity; each role is created once, usually as a constant.
 */
@Immutable
public final class DependencyTag {

  /** An ordinary build dependency. */
  public static final DependencyTag DEPS = new DependencyTag("deps", false);

  /** The dependency is referenced as a source or output, e.g. {@code srcs: [":gen"]}. */
  public static final DependencyTag OUTPUT_REFERENCE = new DependencyTag("output_reference", false);

  /** A license dependency. */
  public static final DependencyTag LICENSE = new DependencyTag("license", false);

  /**
   * Bookkeeping edge recorded while converting, so that dependencies that are missing or not
   * converted become visible. This is the only role that may be added after dependency discovery.
   */
  public static final DependencyTag CONVERSION_ONLY = new DependencyTag("conversion_only", true);

  private final String name;
  private final boolean conversionOnly;

  private DependencyTag(String name, boolean conversionOnly) {
    this.name = checkNotNull(name);
    this.conversionOnly = conversionOnly;
  }

  /** Creates a new discovery-time role. */
  public static DependencyTag create(String name) {
    return new DependencyTag(name, false);
  }

  public String getName() {
    return name;
  }

  public boolean isConversionOnly() {
    return conversionOnly;
  }

  @Override
  public String toString() {
    return name;
  }
}
