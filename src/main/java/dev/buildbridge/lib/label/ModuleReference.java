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

import com.google.common.base.Strings;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import java.util.Optional;

/**
 * A reference from a path-valued property to another module: {@code :name}, {@code :name{.tag}}
 * or, for modules in a namespace, {@code //namespace:name{.tag}}.
 */
@Immutable
public final class ModuleReference {

  private final String moduleName;
  private final String tag;

  private ModuleReference(String moduleName, String tag) {
    this.moduleName = moduleName;
    this.tag = tag;
  }

  /**
   * Returns whether {@code value} is written in module-reference syntax, whether or not it is well
   * formed.
   */
  public static boolean looksLikeReference(String value) {
    return value.startsWith(":") || (value.startsWith("//") && value.contains(":"));
  }

  /**
   * Parses {@code value}. Returns empty if it is not in module-reference syntax.
   *
   * @throws MalformedReferenceException if it is in module-reference syntax but cannot be parsed
   */
  public static Optional<ModuleReference> parse(String value) throws MalformedReferenceException {
    if (!looksLikeReference(value)) {
      return Optional.empty();
    }
    String body = value.startsWith(":") ? value.substring(1) : value;
    String tag = "";
    int tagStart = body.indexOf('{');
    if (tagStart >= 0) {
      if (!body.endsWith("}") || body.indexOf('}') != body.length() - 1) {
        throw new MalformedReferenceException(value, "unterminated output tag");
      }
      tag = body.substring(tagStart + 1, body.length() - 1);
      body = body.substring(0, tagStart);
    } else if (body.indexOf('}') >= 0) {
      throw new MalformedReferenceException(value, "unbalanced '}'");
    }
    if (body.isEmpty() || body.endsWith(":")) {
      throw new MalformedReferenceException(value, "missing module name");
    }
    return Optional.of(new ModuleReference(body, tag));
  }

  /** Returns a reference to {@code moduleName} with no output tag. */
  public static ModuleReference of(String moduleName) {
    return new ModuleReference(moduleName, "");
  }

  /** The referenced module name, including its {@code //namespace:} prefix when present. */
  public String getModuleName() {
    return moduleName;
  }

  /** The output tag, e.g. {@code .h} for {@code :gen{.h}}; empty if none. */
  public String getTag() {
    return tag;
  }

  public boolean isNamespaced() {
    return moduleName.startsWith("//");
  }

  /** Spelling of this reference as it appears in a source list. */
  public String toSourceSpelling() {
    String withTag = Strings.isNullOrEmpty(tag) ? moduleName : moduleName + "{" + tag + "}";
    return isNamespaced() ? withTag : ":" + withTag;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ModuleReference other
        && moduleName.equals(other.moduleName)
        && tag.equals(other.tag);
  }

  @Override
  public int hashCode() {
    return Objects.hash(moduleName, tag);
  }

  @Override
  public String toString() {
    return toSourceSpelling();
  }

  /** Thrown for values in module-reference syntax that cannot be parsed. */
  public static final class MalformedReferenceException extends Exception {
    public MalformedReferenceException(String reference, String reason) {
      super(String.format("'%s' is not a valid module reference: %s", reference, reason));
    }
  }
}
