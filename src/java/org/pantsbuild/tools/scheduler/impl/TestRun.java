// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

/**
 * A configured test run: executes a list of tests with a number of workers, reports each completed
 * test to a {@link ProgressCallback} and leaves every test with a result.
 *
 * <p>One worker runs the tests serially on the calling thread; more workers run them on a thread
 * pool of that size. A run stops early when the configured maximum number of failures is reached
 * or when the timeout passes. Tests that never completed are given an
 * {@link ResultCode#UNRESOLVED} result.
 */
public final class TestRun {
  private static final Logger LOG = Logger.getLogger(TestRun.class.getName());

  /**
   * The horizon of runs without a timeout. Finite so deadline arithmetic stays well defined.
   */
  @VisibleForTesting
  static final Duration NO_TIMEOUT = Duration.ofDays(365);

  private final RunConfig config;
  private final int workers;
  private final Scheduler scheduler;
  private final CancellationToken cancellation;

  /**
   * Creates a run that cannot be cancelled from outside.
   */
  public TestRun(RunConfig config, WorkerInitializer initializer, int workers) {
    this(config, initializer, workers, new CancellationToken(), AbortHandler.HALT);
  }

  /**
   * @param config The configuration shared by all workers.
   * @param initializer Creates the test execution of each worker.
   * @param workers Number of tests to run concurrently, must be positive.
   * @param cancellation Cancelling this token stops the workers and calls {@code abortHandler}.
   * @param abortHandler Ends the process after a cancellation.
   */
  public TestRun(RunConfig config, WorkerInitializer initializer, int workers,
      CancellationToken cancellation, AbortHandler abortHandler) {
    Preconditions.checkNotNull(config);
    Preconditions.checkNotNull(initializer);
    Preconditions.checkArgument(workers > 0, "Number of workers must be positive, given: %s",
        workers);
    Preconditions.checkNotNull(cancellation);
    Preconditions.checkNotNull(abortHandler);

    this.config = config;
    this.workers = workers;
    this.cancellation = cancellation;
    if (workers == 1) {
      this.scheduler = new SequentialScheduler(config, initializer, cancellation, abortHandler);
    } else {
      this.scheduler =
          new ConcurrentScheduler(config, initializer, workers, cancellation, abortHandler);
    }
  }

  @VisibleForTesting
  TestRun(RunConfig config, Scheduler scheduler, CancellationToken cancellation) {
    this.config = Preconditions.checkNotNull(config);
    this.workers = 0;
    this.scheduler = Preconditions.checkNotNull(scheduler);
    this.cancellation = Preconditions.checkNotNull(cancellation);
  }

  /**
   * Equivalent to {@code execute(tests, progress, null)}.
   */
  public double execute(List<TestItem> tests, ProgressCallback progress)
      throws InterruptedException {
    return execute(tests, progress, null);
  }

  /**
   * Executes {@code tests}, storing each completed test back into the list at its index.
   *
   * <p>On return every test in {@code tests} has a result. This also holds when a test could not
   * be executed and a {@link TestWorkerException} propagates, but not when the run was cancelled.
   *
   * @param tests The tests to run, in the order results are reported. The list must support
   *     {@link List#set(int, Object)}.
   * @param progress Notified once for every test that completed.
   * @param timeout Time after which to stop waiting for tests, or {@code null} for no limit.
   * @return The elapsed wall time of the run in seconds.
   * @throws InterruptedException if the calling thread is interrupted.
   * @throws TestWorkerException if a test could not be executed.
   * @throws RunCancelledException if the run was cancelled and the abort handler returned.
   */
  public double execute(List<TestItem> tests, ProgressCallback progress,
      @Nullable Duration timeout) throws InterruptedException {
    Preconditions.checkNotNull(tests);
    Preconditions.checkNotNull(progress);
    Preconditions.checkArgument(timeout == null || !timeout.isNegative(),
        "Timeout cannot be negative: %s", timeout);

    if (tests.isEmpty()) {
      return 0.0;
    }

    // Longer timeouts are capped so the deadline cannot overflow.
    Duration horizon =
        timeout == null || timeout.compareTo(NO_TIMEOUT) > 0 ? NO_TIMEOUT : timeout;
    LOG.fine(String.format("Running %d tests with %d workers, timeout %s, config %s",
        tests.size(), workers, horizon, config));

    ResultSink sink = new ResultSink(tests, config.getMaxFailures(), progress);
    Stopwatch stopwatch = Stopwatch.createStarted();
    long deadlineNanos = System.nanoTime() + horizon.toNanos();
    try {
      scheduler.run(sink, deadlineNanos);
    } finally {
      // A cancelled run bypasses result reconciliation.
      if (!cancellation.isCancelled()) {
        markUnresolved(tests);
      }
    }
    double elapsedSeconds = stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1e9;
    LOG.fine(String.format("Ran %d tests in %.3fs with %d failures",
        tests.size(), elapsedSeconds, sink.getFailureCount()));
    return elapsedSeconds;
  }

  private static void markUnresolved(List<TestItem> tests) {
    for (TestItem test : tests) {
      if (!test.hasResult()) {
        test.setResult(TestResult.unresolved());
      }
    }
  }
}
