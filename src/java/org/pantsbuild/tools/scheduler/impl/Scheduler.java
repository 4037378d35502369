// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

/**
 * Drives the execution of every test held by a {@link ResultSink}.
 */
interface Scheduler {

  /**
   * Runs the tests of {@code sink}, feeding each completed test back into it, until all tests have
   * completed, the sink halts or the deadline passes. Tests that are not consumed are left without
   * a result.
   *
   * @param sink The sink holding the tests of the run.
   * @param deadlineNanos The {@link System#nanoTime()} after which no more waiting is done.
   * @throws InterruptedException if the calling thread is interrupted.
   * @throws TestWorkerException if a test could not be executed.
   * @throws RunCancelledException if the run was cancelled and the abort handler returned.
   */
  void run(ResultSink sink, long deadlineNanos) throws InterruptedException;
}
