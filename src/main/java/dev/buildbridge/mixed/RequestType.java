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

/** The kind of information asked of the external executor about a target. */
public enum RequestType {
  /** The files a target produces. */
  GET_OUTPUT_FILES,
  /** Compilation and linking information of a native library target. */
  GET_CC_INFO,
  /** The launcher and runfiles of a binary target. */
  GET_BINARY_INFO;
}
