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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;

/**
 * A reference to a Bazel target, either absolute ({@code //pkg:target}), package-relative
 * ({@code :target}) or a plain path relative to the referencing package ({@code a/b.c}).
 *
 * <p>Besides its address a label remembers how it was spelled in the source module ({@link
 * #getOriginalSpelling}), so that later passes can substitute occurrences of that spelling verbatim
 * without re-deriving them. Two labels are equal iff their addresses are equal; the spelling is
 * bookkeeping only.
 */
@Immutable
public final class Label implements Comparable<Label> {

  private static final String ABSOLUTE_PREFIX = "//";

  private final String address;
  private final String originalSpelling;

  private Label(String address, String originalSpelling) {
    checkArgument(!address.isEmpty(), "empty label address");
    this.address = address;
    this.originalSpelling = checkNotNull(originalSpelling);
  }

  /** Creates a label spelled exactly as its address. */
  public static Label of(String address) {
    return new Label(address, address);
  }

  public static Label of(String address, String originalSpelling) {
    return new Label(address, originalSpelling);
  }

  public String getAddress() {
    return address;
  }

  public String getOriginalSpelling() {
    return originalSpelling;
  }

  public Label withAddress(String newAddress) {
    return new Label(newAddress, originalSpelling);
  }

  public Label withOriginalSpelling(String spelling) {
    return new Label(address, spelling);
  }

  public boolean isAbsolute() {
    return address.startsWith(ABSOLUTE_PREFIX);
  }

  /**
   * Returns the package part of a qualified label, e.g. {@code //a/b} for {@code //a/b:c}.
   *
   * @throws IllegalStateException if the address has no {@code :}
   */
  public String getPackageName() {
    return address.substring(0, colonIndex());
  }

  /** Returns the package-relative form of a qualified label, e.g. {@code :c} for {@code //a:c}. */
  public String getShortForm() {
    return address.substring(colonIndex());
  }

  /** Returns whether both qualified labels live in the same package. */
  public boolean isSamePackage(Label other) {
    return getPackageName().equals(other.getPackageName());
  }

  private int colonIndex() {
    int i = address.indexOf(':');
    if (i < 0) {
      throw new IllegalStateException(
          String.format("Could not find ':' in '%s', expected a fully qualified label", address));
    }
    return i;
  }

  @Override
  public int compareTo(Label other) {
    return address.compareTo(other.address);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof Label other && address.equals(other.address);
  }

  @Override
  public int hashCode() {
    return address.hashCode();
  }

  @Override
  public String toString() {
    return address;
  }
}
