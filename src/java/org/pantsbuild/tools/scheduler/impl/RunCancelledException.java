// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

/**
 * Thrown from a run whose {@link CancellationToken} was cancelled when the {@link AbortHandler}
 * returned instead of ending the process.
 */
public class RunCancelledException extends RuntimeException {
  public RunCancelledException() {
    super("Test run cancelled");
  }
}
