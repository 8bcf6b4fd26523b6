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

import com.google.auto.value.AutoValue;
import dev.buildbridge.graph.OsType;

/** The configuration a request is evaluated in: an architecture and an operating system. */
@AutoValue
public abstract class ConfigKey {

  /** The configuration shared by all architectures and operating systems. */
  public static final ConfigKey COMMON = create("common", OsType.COMMON_OS);

  public static ConfigKey create(String arch, OsType osType) {
    return new AutoValue_ConfigKey(arch, osType);
  }

  public abstract String arch();

  public abstract OsType osType();

  @Override
  public final String toString() {
    return arch() + "|" + osType().name().toLowerCase();
  }
}
