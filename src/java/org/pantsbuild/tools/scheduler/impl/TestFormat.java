// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

/**
 * Knows how to run one kind of test and classify its outcome.
 *
 * @see GroupedTestExecution
 */
public interface TestFormat {

  /**
   * Runs the test and returns its code and output. The elapsed time of the returned result is
   * replaced with the measured wall time of this call.
   *
   * @throws Exception if the test could not be run.
   */
  TestResult execute(TestItem test, RunConfig config) throws Exception;
}
