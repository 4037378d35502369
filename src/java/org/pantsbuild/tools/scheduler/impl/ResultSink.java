// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.util.List;
import java.util.logging.Logger;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Verify;

/**
 * Collects the results of a single run into the caller's list of tests, by index, and tracks
 * failures against the run's failure threshold.
 *
 * <p>Once the threshold is reached the sink halts: later results are dropped so they cannot race
 * with the teardown of the workers. The halt is cooperative; schedulers check {@link #isHalted()}
 * after consuming and stop on their own.
 */
public final class ResultSink {
  private static final Logger LOG = Logger.getLogger(ResultSink.class.getName());

  private final List<TestItem> tests;
  private final Optional<Integer> maxFailures;
  private final ProgressCallback progress;

  private int failureCount;
  private boolean halted;

  /**
   * @param tests The tests of the run in input order. Completed tests are stored back into this
   *     list, which must therefore support {@link List#set(int, Object)}.
   * @param maxFailures The number of failures after which the run halts, if any.
   * @param progress Notified of each consumed test.
   */
  public ResultSink(List<TestItem> tests, Optional<Integer> maxFailures,
      ProgressCallback progress) {
    this.tests = Preconditions.checkNotNull(tests);
    this.maxFailures = Preconditions.checkNotNull(maxFailures);
    this.progress = Preconditions.checkNotNull(progress);
  }

  /**
   * Records a completed test at {@code index}, notifies the progress callback and counts a
   * {@link ResultCode#FAIL}. Does nothing once the sink has halted.
   *
   * @throws com.google.common.base.VerifyException if the completed test is not the test stored
   *     at {@code index}. This is a scheduler bug, never a test failure.
   */
  public synchronized void consume(int index, TestItem completed) {
    if (halted) {
      return;
    }

    Verify.verify(tests.get(index).getPath().equals(completed.getPath()),
        "Scheduler and worker disagree on the test at index %s: %s vs %s",
        index, tests.get(index).getPath(), completed.getPath());
    Verify.verify(completed.hasResult(), "Test %s completed without a result",
        completed.getPath());

    tests.set(index, completed);
    progress.update(completed);

    if (completed.getResult().getCode() == ResultCode.FAIL) {
      failureCount++;
    }
    if (maxFailures.isPresent() && failureCount == maxFailures.get()) {
      LOG.info(String.format("Reached the maximum of %d failures, halting.", failureCount));
      halted = true;
    }
  }

  public void consume(CompletedTest completed) {
    consume(completed.getIndex(), completed.getTest());
  }

  public synchronized boolean isHalted() {
    return halted;
  }

  public synchronized int getFailureCount() {
    return failureCount;
  }

  public int size() {
    return tests.size();
  }

  public synchronized TestItem get(int index) {
    return tests.get(index);
  }
}
