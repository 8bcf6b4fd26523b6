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

import dev.buildbridge.graph.ModuleStepException;

/** Capability of module types that can be converted into targets. */
@FunctionalInterface
public interface Converter {

  /**
   * Emits the targets for the module of {@code ctx}. Problems are reported through {@code ctx} or
   * by throwing; either way the module's targets are dropped.
   */
  void convert(ConversionContext ctx) throws ModuleStepException;
}
