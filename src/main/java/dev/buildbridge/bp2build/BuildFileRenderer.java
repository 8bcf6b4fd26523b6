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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Renders the targets of one package as the contents of a BUILD file. */
public final class BuildFileRenderer {

  private static final String INDENT = "    ";
  private static final CharMatcher ESCAPED = CharMatcher.anyOf("\\\"");

  /**
   * Returns the BUILD file text for {@code targets}: sorted, de-duplicated {@code load} statements,
   * then the targets sorted by name.
   */
  public String render(Collection<TargetDeclaration> targets) {
    StringBuilder out = new StringBuilder();
    Map<String, ImmutableSortedSet.Builder<String>> loads = new TreeMap<>();
    for (TargetDeclaration target : targets) {
      if (target.getLoadLocation() != null) {
        loads
            .computeIfAbsent(target.getLoadLocation(), k -> ImmutableSortedSet.naturalOrder())
            .add(target.getRuleClass());
      }
    }
    loads.forEach(
        (location, symbols) -> {
          out.append("load(").append(quote(location));
          for (String symbol : symbols.build()) {
            out.append(", ").append(quote(symbol));
          }
          out.append(")\n");
        });

    ImmutableList<TargetDeclaration> sorted =
        ImmutableList.sortedCopyOf(
            Comparator.comparing(TargetDeclaration::getName)
                .thenComparing(TargetDeclaration::getRuleClass),
            targets);
    for (TargetDeclaration target : sorted) {
      if (out.length() > 0) {
        out.append('\n');
      }
      renderTarget(target, out);
    }
    return out.toString();
  }

  private static void renderTarget(TargetDeclaration target, StringBuilder out) {
    out.append(target.getRuleClass()).append("(\n");
    out.append(INDENT).append("name = ").append(quote(target.getName())).append(",\n");
    new TreeMap<>(target.getAttributes())
        .forEach(
            (name, value) ->
                out.append(INDENT)
                    .append(name)
                    .append(" = ")
                    .append(renderValue(value))
                    .append(",\n"));
    out.append(")\n");
  }

  private static String renderValue(Object value) {
    if (value instanceof String s) {
      return quote(s);
    }
    if (value instanceof Boolean b) {
      return b ? "True" : "False";
    }
    if (value instanceof Integer) {
      return value.toString();
    }
    if (value instanceof List<?> list) {
      if (list.size() == 1) {
        return "[" + quote((String) list.get(0)) + "]";
      }
      StringBuilder rendered = new StringBuilder("[\n");
      for (Object element : list) {
        rendered.append(INDENT).append(INDENT).append(quote((String) element)).append(",\n");
      }
      return rendered.append(INDENT).append("]").toString();
    }
    throw new IllegalArgumentException("unsupported attribute value: " + value);
  }

  private static String quote(String value) {
    StringBuilder quoted = new StringBuilder("\"");
    for (char c : value.toCharArray()) {
      if (ESCAPED.matches(c)) {
        quoted.append('\\');
      }
      quoted.append(c);
    }
    return quoted.append('"').toString();
  }

  /** Renders each package of {@code targetsByPackage}, keyed by package. */
  public ImmutableSortedMap<String, String> renderAll(
      Map<String, ? extends Collection<TargetDeclaration>> targetsByPackage) {
    ImmutableSortedMap.Builder<String, String> files = ImmutableSortedMap.naturalOrder();
    targetsByPackage.forEach((pkg, targets) -> files.put(pkg, render(targets)));
    return files.buildOrThrow();
  }
}
