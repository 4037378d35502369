// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

/**
 * Indicates a test could not be executed at all, as opposed to having failed. Aborts the run.
 */
public class TestWorkerException extends RuntimeException {
  private final String testPath;

  public TestWorkerException(String testPath, Throwable cause) {
    super(String.format("Error executing test '%s': %s", testPath, cause), cause);
    this.testPath = testPath;
  }

  public String getTestPath() {
    return testPath;
  }
}
