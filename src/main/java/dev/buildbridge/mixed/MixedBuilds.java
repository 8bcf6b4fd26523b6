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
package dev.buildbridge.mixed;

import dev.buildbridge.graph.OsType;

/** Static helpers for mixed builds. */
public final class MixedBuilds {

  /** The operating system the external executor has no toolchains for. */
  public static final OsType UNSUPPORTED_OS = OsType.WINDOWS;

  private MixedBuilds() {}

  /**
   * Returns true if the module of {@code ctx} is ready to be replaced by a converted or
   * hand-authored target of the external executor: it targets a supported OS, is enabled, is
   * converted and is allowlisted for mixed builds.
   */
  public static boolean isEnabled(MixedBuildContext ctx) {
    if (ctx.getTargetOs() == UNSUPPORTED_OS || ctx.getModule().getOsType() == UNSUPPORTED_OS) {
      return false;
    }
    if (!ctx.getModule().isEnabled()) {
      return false;
    }
    if (!ctx.isConverted()) {
      return false;
    }
    return ctx.isMixedBuildAllowlisted();
  }
}
