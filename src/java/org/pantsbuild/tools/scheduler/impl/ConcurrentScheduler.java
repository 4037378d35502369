// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;

/**
 * Runs tests on a fixed pool of worker threads.
 *
 * <p>Every test is submitted up front. The calling thread then waits for the tests in the order
 * they were submitted, each wait bounded by the time left until the deadline, and consumes
 * completions as they arrive, so progress is reported in completion order. A test that raised is
 * rethrown when its turn to be waited on comes.
 *
 * <p>If the run stops early, because of an error, the failure threshold or the deadline, the pool
 * is shut down forcibly: queued tests are discarded and running ones interrupted. In every case
 * the pool has terminated before {@link #run} returns or throws.
 */
final class ConcurrentScheduler implements Scheduler {
  private static final Logger LOG = Logger.getLogger(ConcurrentScheduler.class.getName());

  private final RunConfig config;
  private final WorkerInitializer initializer;
  private final int workers;
  private final CancellationToken cancellation;
  private final AbortHandler abortHandler;
  private final ThreadFactory threadFactory;

  ConcurrentScheduler(RunConfig config, WorkerInitializer initializer, int workers,
      CancellationToken cancellation, AbortHandler abortHandler) {
    this(config, initializer, workers, cancellation, abortHandler,
        new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("test-scheduler-worker-%d")
            .build());
  }

  @VisibleForTesting
  ConcurrentScheduler(RunConfig config, WorkerInitializer initializer, int workers,
      CancellationToken cancellation, AbortHandler abortHandler, ThreadFactory threadFactory) {
    Preconditions.checkArgument(workers > 0, "Number of workers must be positive, given: %s",
        workers);
    this.config = Preconditions.checkNotNull(config);
    this.initializer = Preconditions.checkNotNull(initializer);
    this.workers = workers;
    this.cancellation = Preconditions.checkNotNull(cancellation);
    this.abortHandler = Preconditions.checkNotNull(abortHandler);
    this.threadFactory = Preconditions.checkNotNull(threadFactory);
  }

  @Override
  public void run(ResultSink sink, long deadlineNanos) throws InterruptedException {
    final PermitSet permits = PermitSet.create(config);
    final ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory);
    final BlockingQueue<Future<CompletedTest>> completed =
        new LinkedBlockingQueue<Future<CompletedTest>>();
    CompletionService<CompletedTest> completions =
        new ExecutorCompletionService<CompletedTest>(pool, completed);

    // Each worker thread sets itself up on the first test it picks up.
    final ThreadLocal<TestExecution> workerExecution = new ThreadLocal<TestExecution>() {
      @Override protected TestExecution initialValue() {
        return initializer.initialize(config, permits);
      }
    };

    final List<Future<CompletedTest>> units = new ArrayList<Future<CompletedTest>>(sink.size());
    Map<Future<CompletedTest>, Integer> unitIndexes =
        new IdentityHashMap<Future<CompletedTest>, Integer>();
    final AtomicBoolean cancelled = new AtomicBoolean(false);
    CancellationToken.Registration registration = null;
    boolean finishedCleanly = false;
    try {
      for (int i = 0; i < sink.size(); i++) {
        final int index = i;
        final TestItem test = sink.get(i);
        Future<CompletedTest> unit = completions.submit(new Callable<CompletedTest>() {
          @Override public CompletedTest call() throws Exception {
            return workerExecution.get().runOne(index, test);
          }
        });
        units.add(unit);
        unitIndexes.put(unit, index);
      }
      // No more submissions; idle workers exit once the queue drains.
      pool.shutdown();

      registration = cancellation.onCancel(new Runnable() {
        @Override public void run() {
          cancelled.set(true);
          terminate(pool, completed);
        }
      });

      finishedCleanly = awaitUnits(sink, completions, units, unitIndexes, deadlineNanos, cancelled);
    } finally {
      if (registration != null) {
        registration.close();
      }
      if (!finishedCleanly) {
        pool.shutdownNow();
      }
      Uninterruptibles.awaitTerminationUninterruptibly(pool);
    }
  }

  /**
   * Waits for every unit in submission order, consuming completions as they arrive.
   *
   * @return {@code true} if every unit completed and was consumed, {@code false} if waiting
   *     stopped early because the sink halted or the deadline passed.
   */
  private boolean awaitUnits(ResultSink sink, CompletionService<CompletedTest> completions,
      List<Future<CompletedTest>> units, Map<Future<CompletedTest>, Integer> unitIndexes,
      long deadlineNanos, AtomicBoolean cancelled) throws InterruptedException {

    boolean[] collected = new boolean[units.size()];
    for (int i = 0; i < units.size(); i++) {
      while (!collected[i]) {
        if (cancelled.get()) {
          throw new RunCancelledException();
        }
        long remainingNanos = deadlineNanos - System.nanoTime();
        Future<CompletedTest> done =
            completions.poll(Math.max(remainingNanos, 0L), TimeUnit.NANOSECONDS);
        if (cancelled.get()) {
          throw new RunCancelledException();
        }
        if (done == null) {
          LOG.warning(String.format(
              "Reached the deadline while waiting for test %s, skipping remaining tests.",
              sink.get(i).getPath()));
          return false;
        }
        collected[unitIndexes.get(done)] = true;
        consumeIfSuccessful(sink, done);
        if (sink.isHalted()) {
          return false;
        }
      }
      rethrowIfFailed(sink, i, units.get(i));
    }
    return true;
  }

  private static void consumeIfSuccessful(ResultSink sink, Future<CompletedTest> done) {
    CompletedTest completed;
    try {
      completed = Futures.getDone(done);
    } catch (ExecutionException e) {
      // Rethrown by rethrowIfFailed when this unit's turn comes.
      LOG.log(Level.FINE, "Test execution raised, deferring until its turn", e.getCause());
      return;
    }
    sink.consume(completed);
  }

  private static void rethrowIfFailed(ResultSink sink, int index, Future<CompletedTest> unit) {
    try {
      Futures.getDone(unit);
    } catch (ExecutionException e) {
      throw new TestWorkerException(sink.get(index).getPath(), e.getCause());
    } catch (CancellationException e) {
      // The scheduler never cancels units; only an outside cancel of the run gets here.
      throw new RunCancelledException();
    }
  }

  /**
   * Stops the pool from the cancelling thread, waits for the workers to exit, wakes up the thread
   * waiting on completions and aborts.
   */
  private void terminate(ExecutorService pool, BlockingQueue<Future<CompletedTest>> completed) {
    LOG.severe("Test run cancelled, terminating workers.");
    // Queued units are discarded and never complete; running ones are interrupted.
    pool.shutdownNow();
    Uninterruptibles.awaitTerminationUninterruptibly(pool);
    completed.add(Futures.<CompletedTest>immediateCancelledFuture());
    abortHandler.abort();
  }
}
