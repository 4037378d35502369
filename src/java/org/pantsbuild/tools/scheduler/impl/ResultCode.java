// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

/**
 * The outcome of executing a single test item.
 */
public enum ResultCode {
  PASS("Passed", false),
  FAIL("Failed", true),
  XFAIL("Expectedly Failed", false),
  XPASS("Unexpectedly Passed", true),
  SKIP("Skipped", false),
  UNSUPPORTED("Unsupported", false),
  UNRESOLVED("Unresolved", true),
  TIMEOUT("Timed Out", true);

  private final String label;
  private final boolean failure;

  ResultCode(String label, boolean failure) {
    this.label = label;
    this.failure = failure;
  }

  /**
   * Returns a human readable plural label for summary output, ie: "Passed".
   */
  public String getLabel() {
    return label;
  }

  /**
   * Returns {@code true} if a test ending with this code should fail the overall run.
   *
   * <p>Note that only {@link #FAIL} counts toward the maximum failure threshold of a run.
   */
  public boolean isFailure() {
    return failure;
  }
}
