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
package dev.buildbridge.graph;

/** The per-module work of a {@link Phase}. */
@FunctionalInterface
public interface ModuleStep {

  /**
   * Runs the phase for {@code module}. Implementations report recoverable problems through {@code
   * env} or by throwing {@link ModuleStepException}; either fails the module. Any unchecked
   * exception aborts the whole run.
   */
  void run(ModuleNode module, StepEnvironment env)
      throws ModuleStepException, InterruptedException;
}
