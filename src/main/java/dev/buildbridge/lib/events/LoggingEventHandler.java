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
package dev.buildbridge.lib.events;

import com.google.common.flogger.GoogleLogger;

/** Forwards events to the process log. Useful as the second half of a {@link TeeEventHandler}. */
public final class LoggingEventHandler implements EventHandler {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  @Override
  public void handle(Event event) {
    switch (event.getKind()) {
      case ERROR:
        logger.atSevere().log("%s", event);
        break;
      case WARNING:
        logger.atWarning().log("%s", event);
        break;
      case DEBUG:
        logger.atFine().log("%s", event);
        break;
      default:
        logger.atInfo().log("%s", event);
    }
  }
}
