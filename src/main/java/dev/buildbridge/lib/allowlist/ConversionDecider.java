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

import static com.google.common.base.Preconditions.checkNotNull;

import dev.buildbridge.lib.vfs.PathFragments;

/**
 * Decides, per module, whether it is converted.
 *
 * <p>Rules, first match wins:
 *
 * <ol>
 *   <li>When only API surfaces are converted, a module is converted iff it contributes to one.
 *   <li>A module in the top-level directory that opts in is converted. Unit tests rely on this to
 *       exercise conversion without any allowlist; conflicts are not checked.
 *   <li>A module allowlisted both by name and by type is a conflict. A denylisted module is never
 *       converted, and it is a conflict if it is also allowlisted by name.
 *   <li>If the directory default converts the module's directory, the module is converted unless
 *       it opts out. It is a conflict if the module is also allowlisted by name.
 *   <li>Otherwise the module's own opt-in or opt-out applies, falling back to whether it is
 *       allowlisted by name or type.
 * </ol>
 *
 * <p>A conflict never converts the module and yields exactly one diagnostic.
 */
public final class ConversionDecider {

  private final ConversionAllowlist allowlist;
  private final boolean apiSurfaceOnly;

  public ConversionDecider(ConversionAllowlist allowlist, boolean apiSurfaceOnly) {
    this.allowlist = checkNotNull(allowlist);
    this.apiSurfaceOnly = apiSurfaceOnly;
  }

  public ConversionDecision decide(ConversionCandidate module) {
    if (apiSurfaceOnly) {
      return ConversionDecision.of(module.contributesApi());
    }
    if (!module.isConvertible()) {
      return ConversionDecision.of(false);
    }

    Boolean optIn = module.getExplicitOptIn();
    String packagePath = module.getDirectory();
    if (packagePath.equals(PathFragments.ROOT) && Boolean.TRUE.equals(optIn)) {
      return ConversionDecision.of(true);
    }

    String name = module.getName();
    boolean nameAllowed = allowlist.isModuleAlwaysConverted(name);
    boolean typeAllowed = allowlist.isModuleTypeAlwaysConverted(module.getType());
    if (nameAllowed && typeAllowed) {
      return ConversionDecision.conflict(
          String.format(
              "module '%s' of type '%s' cannot be in both moduleAlwaysConvert and"
                  + " moduleTypeAlwaysConvert",
              name, module.getType()));
    }

    if (allowlist.isModuleDoNotConvert(name)) {
      if (nameAllowed) {
        return ConversionDecision.conflict(
            String.format(
                "module '%s' cannot be in both moduleDoNotConvert and moduleAlwaysConvert", name));
      }
      return ConversionDecision.of(false);
    }

    DirectoryMatch directory = DirectoryDefaults.resolve(packagePath, allowlist.getDefaultConfig());
    if (directory.convert()) {
      if (nameAllowed) {
        return ConversionDecision.conflict(
            String.format(
                "module '%s' cannot be in moduleAlwaysConvert and also in directory '%s', which is"
                    + " marked DEFAULT_TRUE or DEFAULT_TRUE_RECURSIVELY",
                name, directory.matchedPath()));
      }
      return ConversionDecision.of(optIn == null || optIn);
    }

    return ConversionDecision.of(optIn != null ? optIn : nameAllowed || typeAllowed);
  }
}
