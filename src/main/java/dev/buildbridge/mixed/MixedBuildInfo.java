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
import com.google.common.collect.ImmutableList;
import dev.buildbridge.graph.ProviderKey;

/** Provider published by a module that the external executor built. */
@AutoValue
public abstract class MixedBuildInfo {

  public static final ProviderKey<MixedBuildInfo> KEY =
      ProviderKey.create("mixed_build_info", MixedBuildInfo.class);

  public static MixedBuildInfo create(String address, ImmutableList<String> outputFiles) {
    return new AutoValue_MixedBuildInfo(address, outputFiles);
  }

  /** The label of the external target that replaced the module. */
  public abstract String address();

  /** Output files of that target, relative to the output root. */
  public abstract ImmutableList<String> outputFiles();
}
