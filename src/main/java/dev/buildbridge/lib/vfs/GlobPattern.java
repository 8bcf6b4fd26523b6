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
package dev.buildbridge.lib.vfs;

import com.google.common.base.Preconditions;
import java.util.regex.Pattern;

/**
 * A compiled glob over {@code /}-separated paths.
 *
 * <p>{@code *} and {@code ?} never cross a separator; {@code **} matches any number of whole
 * segments, including none, so {@code a/**}{@code /b.c} matches {@code a/b.c}.
 */
public final class GlobPattern {

  private final String pattern;
  private final Pattern regex;

  private GlobPattern(String pattern, Pattern regex) {
    this.pattern = pattern;
    this.regex = regex;
  }

  public static GlobPattern compile(String pattern) {
    Preconditions.checkArgument(!pattern.isEmpty(), "empty glob pattern");
    return new GlobPattern(pattern, Pattern.compile(toRegex(pattern)));
  }

  public boolean matches(String path) {
    return regex.matcher(path).matches();
  }

  /**
   * Returns the longest leading directory of the pattern without metacharacters, {@code .} if the
   * first segment is already a wildcard. Walking can start there.
   */
  public String literalPrefix() {
    StringBuilder prefix = new StringBuilder();
    for (String segment : PathFragments.segments(pattern)) {
      if (PathFragments.isGlob(segment)) {
        break;
      }
      if (prefix.length() > 0) {
        prefix.append('/');
      }
      prefix.append(segment);
    }
    String literal = prefix.toString();
    // The last literal segment may be the file itself.
    if (literal.equals(PathFragments.normalize(pattern))) {
      return PathFragments.parent(literal);
    }
    return literal.isEmpty() ? PathFragments.ROOT : literal;
  }

  @Override
  public String toString() {
    return pattern;
  }

  private static String toRegex(String glob) {
    StringBuilder regex = new StringBuilder();
    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i);
      if (c == '*') {
        boolean doubleStar = i + 1 < glob.length() && glob.charAt(i + 1) == '*';
        if (doubleStar) {
          boolean followedBySlash = i + 2 < glob.length() && glob.charAt(i + 2) == '/';
          if (followedBySlash) {
            regex.append("(?:.*/)?");
            i += 3;
          } else {
            regex.append(".*");
            i += 2;
          }
          continue;
        }
        regex.append("[^/]*");
      } else if (c == '?') {
        regex.append("[^/]");
      } else if (c == '[') {
        int close = glob.indexOf(']', i);
        if (close < 0) {
          regex.append("\\[");
        } else {
          regex.append('[').append(glob, i + 1, close).append(']');
          i = close;
        }
      } else if ("\\.^$+{}()|".indexOf(c) >= 0) {
        regex.append('\\').append(c);
      } else {
        regex.append(c);
      }
      i++;
    }
    return regex.toString();
  }
}
