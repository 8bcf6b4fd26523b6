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

/** What a {@link ConversionPipeline} run produces. */
public enum BuildMode {
  /** Convert every allowlisted module into targets. */
  BP2BUILD,
  /** Convert only the API surface contributions. */
  API_BP2BUILD,
  /** Hand allowlisted modules to the external executor and bridge their results back. */
  MIXED_BUILD;
}
