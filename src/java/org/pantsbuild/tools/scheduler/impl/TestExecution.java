// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

/**
 * Executes a single test. Instances are created per worker by a {@link WorkerInitializer}.
 */
public interface TestExecution {

  /**
   * Runs {@code test} and returns a copy of it carrying its result, paired with {@code index}.
   *
   * <p>Test failures are results, not exceptions. Implementations take the permit of the test's
   * parallelism group themselves and must release it on every exit path.
   *
   * @param index The position of the test in the run.
   * @param test The test to run.
   * @return The completed test.
   * @throws InterruptedException if the worker was interrupted, which happens when the run is torn
   *     down.
   * @throws Exception if the test could not be executed at all. This aborts the whole run.
   */
  CompletedTest runOne(int index, TestItem test) throws Exception;
}
