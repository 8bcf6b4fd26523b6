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

import dev.buildbridge.lib.events.EventHandler;

/** What a {@link ModuleStep} sees of the run it is part of. */
public interface StepEnvironment {

  ModuleGraph getGraph();

  String getPhaseName();

  /** Reports an error against the current module. The module fails once its step returns. */
  void reportError(String message);

  void reportWarning(String message);

  /** Handler for events about the current module; events are tagged with its name. */
  EventHandler getEventHandler();

  /** Whether an error has been reported for the current module in this step. */
  boolean hasErrors();
}
