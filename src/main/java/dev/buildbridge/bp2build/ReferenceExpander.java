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
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import dev.buildbridge.graph.ModuleNode;
import dev.buildbridge.lib.label.Label;
import dev.buildbridge.lib.label.LabelList;
import dev.buildbridge.lib.label.ModuleReference;
import dev.buildbridge.lib.label.ModuleReference.MalformedReferenceException;
import dev.buildbridge.lib.packages.PackageBoundaryResolver;
import dev.buildbridge.lib.vfs.PathFragments;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Turns the source and dependency lists of a module into labels of the converted build.
 *
 * <p>Source entries are paths relative to the module directory, globs, or module references
 * ({@code :name}, {@code :name{.tag}}, {@code //namespace:name}). Paths end up relative to the
 * module's package, or absolute when they lie in a subpackage. Excludes are compared by resolved
 * address, so {@code a.c}, {@code ./a.c} and {@code b/../a.c} exclude each other.
 *
 * <p>A reference to an undefined module is recorded as a missing dependency of the current module
 * and produces a placeholder label ending in {@link ModuleLabels#MISSING_DEPENDENCY_SUFFIX}; a
 * reference to a module that is not converted is recorded as an unconverted dependency. Resolving
 * a reference adds a conversion-only edge to the referenced module unless the caller opts out.
 */
public final class ReferenceExpander {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ConversionContext ctx;
  private final PackageBoundaryResolver resolver;

  ReferenceExpander(ConversionContext ctx) {
    this.ctx = ctx;
    this.resolver = ctx.getConfig().getPackageBoundaryResolver();
  }

  /** Labels for {@code paths}, relative to the module directory. */
  public LabelList labelsForModuleSrc(@Nullable List<String> paths) {
    return labelsForModuleSrcExcludes(paths, null);
  }

  /**
   * Labels for {@code paths} minus {@code excludes}, relative to the module directory. The excludes
   * are kept in the result's exclude list.
   */
  public LabelList labelsForModuleSrcExcludes(
      @Nullable List<String> paths, @Nullable List<String> excludes) {
    String moduleDir = ctx.getModuleDir();
    LabelList excludeLabels =
        expandSources(excludes, ImmutableSet.of(), ImmutableList.of(), /* markAsDeps= */ false);
    LabelList resolvedExcludes = resolver.resolveAll(moduleDir, excludeLabels);
    Set<String> excluded = new LinkedHashSet<>(excludeLabels.includeAddresses());
    excluded.addAll(resolvedExcludes.includeAddresses());

    List<String> globExcludes = new ArrayList<>();
    if (excludes != null) {
      for (String exclude : excludes) {
        if (!ModuleReference.looksLikeReference(exclude)) {
          globExcludes.add(PathFragments.join(moduleDir, exclude));
        }
      }
    }

    LabelList includes = expandSources(paths, excluded, globExcludes, /* markAsDeps= */ true);
    LabelList resolved =
        resolver.resolveAll(
            moduleDir,
            LabelList.builder()
                .addIncludes(includes.getIncludes())
                .addExcludes(excludeLabels.getIncludes())
                .build());
    // Resolution can map a differently spelled include onto an excluded address.
    return resolved.subtractExcludes();
  }

  /**
   * Labels for the files matching {@code pattern} in {@code dir} (root-relative), minus {@code
   * excludes} (root-relative patterns). The labels are relative to {@code dir}.
   */
  public LabelList labelsForSrcPatternExcludes(
      String dir, String pattern, @Nullable List<String> excludes) {
    ImmutableList<String> matches;
    try {
      matches =
          ctx.getConfig()
              .getSourceTree()
              .glob(
                  PathFragments.join(dir, pattern),
                  excludes == null ? ImmutableList.of() : excludes);
    } catch (IOException e) {
      ctx.reportError("could not search %s for pattern %s: %s", dir, pattern, e.getMessage());
      return LabelList.empty();
    }
    LabelList.Builder labels = LabelList.builder();
    for (String match : matches) {
      labels.addInclude(Label.of("./" + PathFragments.relativize(dir, match)));
    }
    return resolver.resolveAll(dir, labels.build());
  }

  /** Labels for a list of module names or references. */
  public LabelList labelsForModuleDeps(@Nullable List<String> modules) {
    return labelsForModuleDeps(modules, /* markAsDeps= */ true);
  }

  /**
   * Labels for {@code modules} minus {@code excludes}; the excluded modules become the result's
   * excludes and leave no edge. Exclusion compares the addresses the names resolve to, so
   * {@code gen} and {@code :gen} exclude each other.
   */
  public LabelList labelsForModuleDepsExcludes(
      @Nullable List<String> modules, @Nullable List<String> excludes) {
    if (excludes == null || excludes.isEmpty()) {
      return labelsForModuleDeps(modules, /* markAsDeps= */ true);
    }
    LabelList.Builder excludeLabels = LabelList.builder();
    for (String exclude : ImmutableSet.copyOf(excludes)) {
      parseModuleName(exclude)
          .ifPresent(
              reference ->
                  excludeLabels.addInclude(Label.of(referencedAddress(reference), exclude)));
    }
    LabelList excluded = excludeLabels.build();
    LabelList moduleLabels =
        labelsForModuleDeps(modules, excluded.includeAddresses(), /* markAsDeps= */ true);
    return LabelList.of(moduleLabels.getIncludes(), excluded.getIncludes()).subtractExcludes();
  }

  /** The label of a single source entry, if it produces one. */
  public Optional<Label> labelForModuleSrcSingle(String path) {
    return labelsForModuleSrcExcludes(ImmutableList.of(path), null).getIncludes().stream()
        .findFirst();
  }

  /** The label of a single module name or reference, if it produces one. */
  public Optional<Label> labelForModuleDepSingle(String module) {
    return labelsForModuleDepsExcludes(ImmutableList.of(module), null).getIncludes().stream()
        .findFirst();
  }

  /**
   * Splits a property that may name a module, a file in the module's own directory, or neither. A
   * file in a subdirectory is not a label: it stays a plain string.
   */
  public StringOrLabel stringOrLabelFromProperty(@Nullable String value) {
    if (value == null) {
      return StringOrLabel.empty();
    }
    if (ModuleReference.looksLikeReference(value)) {
      return labelForModuleDepSingle(value)
          .map(StringOrLabel::ofLabel)
          .orElse(StringOrLabel.empty());
    }
    String moduleDir = ctx.getModuleDir();
    String path = PathFragments.join(moduleDir, value);
    if (ctx.getConfig().getSourceTree().exists(path)
        && PathFragments.parent(path).equals(moduleDir)) {
      return labelForModuleSrcSingle(value)
          .map(StringOrLabel::ofLabel)
          .orElse(StringOrLabel.empty());
    }
    return StringOrLabel.ofString(value);
  }

  private LabelList labelsForModuleDeps(@Nullable List<String> modules, boolean markAsDeps) {
    return labelsForModuleDeps(modules, ImmutableSet.of(), markAsDeps);
  }

  private LabelList labelsForModuleDeps(
      @Nullable List<String> modules, Set<String> excluded, boolean markAsDeps) {
    if (modules == null || modules.isEmpty()) {
      return LabelList.empty();
    }
    LabelList.Builder labels = LabelList.builder();
    for (String module : ImmutableSet.copyOf(modules)) {
      Optional<ModuleReference> reference = parseModuleName(module);
      if (reference.isEmpty() || excluded.contains(referencedAddress(reference.get()))) {
        continue;
      }
      labels.addInclude(otherModuleLabel(reference.get(), markAsDeps).withOriginalSpelling(module));
    }
    return labels.build();
  }

  /** Parses a bare module name or a reference, reporting entries that are neither. */
  private Optional<ModuleReference> parseModuleName(String module) {
    String reference = ModuleReference.looksLikeReference(module) ? module : ":" + module;
    Optional<ModuleReference> parsed;
    try {
      parsed = ModuleReference.parse(reference);
    } catch (MalformedReferenceException e) {
      ctx.reportError("%s", e.getMessage());
      return Optional.empty();
    }
    if (parsed.isEmpty()) {
      ctx.reportError("\"%s\" is not a module reference", module);
    }
    return parsed;
  }

  /**
   * Expands {@code paths} without package-boundary resolution of literal paths, dropping entries
   * whose address is in {@code excluded}.
   */
  private LabelList expandSources(
      @Nullable List<String> paths,
      Set<String> excluded,
      List<String> rootRelativeGlobExcludes,
      boolean markAsDeps) {
    if (paths == null) {
      return LabelList.empty();
    }
    String moduleDir = ctx.getModuleDir();
    LabelList.Builder labels = LabelList.builder();
    for (String path : paths) {
      if (ModuleReference.looksLikeReference(path)) {
        Optional<ModuleReference> parsed;
        try {
          parsed = ModuleReference.parse(path);
        } catch (MalformedReferenceException e) {
          ctx.reportError("%s", e.getMessage());
          continue;
        }
        ModuleReference reference = parsed.get();
        if (excluded.contains(referencedAddress(reference))) {
          continue;
        }
        String spelling =
            reference.isNamespaced() ? reference.getModuleName() : ":" + reference.getModuleName();
        labels.addInclude(otherModuleLabel(reference, markAsDeps).withOriginalSpelling(spelling));
      } else if (PathFragments.isGlob(path)) {
        ImmutableList<String> matches;
        try {
          matches =
              ctx.getConfig()
                  .getSourceTree()
                  .glob(PathFragments.join(moduleDir, path), rootRelativeGlobExcludes);
        } catch (IOException e) {
          ctx.reportError("could not expand %s in %s: %s", path, moduleDir, e.getMessage());
          continue;
        }
        logger.atFine().log(
            "%s: %s matched %d files", ctx.getModuleName(), path, matches.size());
        for (String match : matches) {
          Label label =
              resolver.resolve(moduleDir, Label.of(PathFragments.relativize(moduleDir, match)));
          if (!excluded.contains(label.getAddress())) {
            labels.addInclude(label);
          }
        }
      } else {
        String normalized = PathFragments.normalize(path);
        if (!excluded.contains(normalized)) {
          labels.addInclude(Label.of(normalized, path));
        }
      }
    }
    return labels.build();
  }

  /** The address {@link #otherModuleLabel} yields for {@code reference}, without side effects. */
  private String referencedAddress(ModuleReference reference) {
    ModuleNode other = ctx.findModule(reference.getModuleName());
    return other == null
        ? ModuleLabels.missingDependencyLabel(reference.getModuleName())
        : ctx.labelFor(other);
  }

  /** The label of the module {@code reference} points at, recording what conversion needs. */
  private Label otherModuleLabel(ModuleReference reference, boolean markAsDependency) {
    String name = reference.getModuleName();
    ModuleNode other = ctx.findModule(name);
    if (other == null) {
      ctx.recordMissingDependency(name);
      return Label.of(ModuleLabels.missingDependencyLabel(name));
    }
    if (markAsDependency) {
      ctx.addConversionEdge(other);
    }
    if (!ctx.isConvertedToBazel(other)) {
      ctx.recordUnconvertedDependency(name);
    }
    return Label.of(ctx.labelFor(other));
  }
}
