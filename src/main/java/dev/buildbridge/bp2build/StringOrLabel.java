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

import com.google.auto.value.AutoValue;
import dev.buildbridge.lib.label.Label;
import javax.annotation.Nullable;

/**
 * A property value split by meaning: a label, when it names a module or a file of the module's
 * own directory, or otherwise a plain string. At most one of the two is set.
 */
@AutoValue
public abstract class StringOrLabel {

  private static final StringOrLabel EMPTY = new AutoValue_StringOrLabel(null, null);

  static StringOrLabel empty() {
    return EMPTY;
  }

  static StringOrLabel ofLabel(Label label) {
    return new AutoValue_StringOrLabel(label, null);
  }

  static StringOrLabel ofString(String value) {
    return new AutoValue_StringOrLabel(null, value);
  }

  @Nullable
  public abstract Label label();

  @Nullable
  public abstract String string();

  public boolean isEmpty() {
    return label() == null && string() == null;
  }
}
