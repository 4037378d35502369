// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler;

import org.pantsbuild.tools.scheduler.impl.ConsoleRunnerImpl;

/**
 * Main entry point for the test scheduler.
 *
 * All implementation classes live in the impl sub-package so they can be shaded.
 */
public class ConsoleRunner {
  public static void main(String[] args) {
    ConsoleRunnerImpl.main(args);
  }
}
