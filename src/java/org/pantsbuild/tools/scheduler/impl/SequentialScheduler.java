// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.util.logging.Logger;

import com.google.common.base.Preconditions;

/**
 * Runs tests one at a time, in input order, on the calling thread.
 *
 * <p>The deadline is not enforced: a single slow test can overrun the timeout of the run.
 */
final class SequentialScheduler implements Scheduler {
  private static final Logger LOG = Logger.getLogger(SequentialScheduler.class.getName());

  private final RunConfig config;
  private final WorkerInitializer initializer;
  private final CancellationToken cancellation;
  private final AbortHandler abortHandler;

  SequentialScheduler(RunConfig config, WorkerInitializer initializer,
      CancellationToken cancellation, AbortHandler abortHandler) {
    this.config = Preconditions.checkNotNull(config);
    this.initializer = Preconditions.checkNotNull(initializer);
    this.cancellation = Preconditions.checkNotNull(cancellation);
    this.abortHandler = Preconditions.checkNotNull(abortHandler);
  }

  @Override
  public void run(ResultSink sink, long deadlineNanos) throws InterruptedException {
    // With no workers to stop, cancelling only has to end the process.
    CancellationToken.Registration registration = cancellation.onCancel(new Runnable() {
      @Override public void run() {
        LOG.severe("Test run cancelled.");
        abortHandler.abort();
      }
    });
    try {
      TestExecution execution = initializer.initialize(config, PermitSet.create(config));
      for (int index = 0; index < sink.size(); index++) {
        if (cancellation.isCancelled()) {
          throw new RunCancelledException();
        }
        TestItem test = sink.get(index);
        CompletedTest completed;
        try {
          completed = execution.runOne(index, test);
        } catch (InterruptedException e) {
          throw e;
        } catch (Exception e) {
          throw new TestWorkerException(test.getPath(), e);
        }
        sink.consume(completed);
        if (sink.isHalted()) {
          break;
        }
      }
    } finally {
      registration.close();
    }
  }
}
