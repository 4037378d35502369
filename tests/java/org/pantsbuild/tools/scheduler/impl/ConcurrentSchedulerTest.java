// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.base.Optional;
import com.google.common.util.concurrent.Uninterruptibles;
import org.junit.Test;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ConcurrentSchedulerTest extends SchedulerTestCase {

  private static final RunConfig CONFIG = RunConfig.builder().build();

  /**
   * An execution passing every test after running {@code body}.
   */
  private abstract static class BodyExecution implements TestExecution {
    @Override
    public CompletedTest runOne(int index, TestItem test) throws Exception {
      body(index);
      return new CompletedTest(index, test.withResult(new TestResult(ResultCode.PASS, "")));
    }

    abstract void body(int index) throws Exception;
  }

  private static WorkerInitializer initializerOf(final TestExecution execution) {
    return new WorkerInitializer() {
      @Override public TestExecution initialize(RunConfig config, PermitSet permits) {
        return execution;
      }
    };
  }

  private static long deadlineIn(long seconds) {
    return System.nanoTime() + TimeUnit.SECONDS.toNanos(seconds);
  }

  private static ConcurrentScheduler newScheduler(WorkerInitializer initializer, int workers,
      CancellationToken cancellation, AbortHandler abortHandler) {
    return new ConcurrentScheduler(CONFIG, initializer, workers, cancellation, abortHandler);
  }

  private static final AbortHandler FAIL_ON_ABORT = new AbortHandler() {
    @Override public void abort() {
      throw new AssertionError("Run was not cancelled");
    }
  };

  @Test
  public void testWorkersAreInitializedOncePerThread() throws Exception {
    final Set<String> initializedThreads =
        ConcurrentHashMap.<String>newKeySet();
    final AtomicInteger initializations = new AtomicInteger();
    final TestExecution execution = new BodyExecution() {
      @Override void body(int index) throws InterruptedException {
        Thread.sleep(5);
      }
    };
    WorkerInitializer initializer = new WorkerInitializer() {
      @Override public TestExecution initialize(RunConfig config, PermitSet permits) {
        initializations.incrementAndGet();
        initializedThreads.add(Thread.currentThread().getName());
        return execution;
      }
    };

    List<TestItem> tests = tests(40);
    ResultSink sink = new ResultSink(tests, Optional.<Integer>absent(), new RecordingProgress());
    newScheduler(initializer, 3, new CancellationToken(), FAIL_ON_ABORT).run(sink, deadlineIn(30));

    assertThat(initializations.get(), lessThanOrEqualTo(3));
    assertEquals(initializations.get(), initializedThreads.size());
    for (String thread : initializedThreads) {
      assertThat(thread, startsWith("test-scheduler-worker-"));
    }
    for (TestItem test : tests) {
      assertEquals(ResultCode.PASS, test.getResult().getCode());
    }
  }

  @Test
  public void testPermitsAreSharedByAllWorkers() throws Exception {
    final Set<PermitSet> seen = ConcurrentHashMap.<PermitSet>newKeySet();
    final TestExecution execution = new BodyExecution() {
      @Override void body(int index) throws InterruptedException {
        Thread.sleep(10);
      }
    };
    WorkerInitializer initializer = new WorkerInitializer() {
      @Override public TestExecution initialize(RunConfig config, PermitSet permits) {
        seen.add(permits);
        return execution;
      }
    };

    List<TestItem> tests = tests(12);
    ResultSink sink = new ResultSink(tests, Optional.<Integer>absent(), new RecordingProgress());
    newScheduler(initializer, 4, new CancellationToken(), FAIL_ON_ABORT).run(sink, deadlineIn(30));

    assertEquals(1, seen.size());
  }

  @Test
  public void testWorkersAreJoinedBeforeErrorSurfaces() throws Exception {
    final CountDownLatch stragglerStarted = newLatch(1);
    final AtomicBoolean stragglerFinished = new AtomicBoolean(false);
    TestExecution execution = new BodyExecution() {
      @Override void body(int index) throws Exception {
        if (index == 0) {
          await(stragglerStarted);
          throw new IllegalStateException("worker environment is broken");
        }
        stragglerStarted.countDown();
        // Ignores the interrupt of the forced shutdown.
        Uninterruptibles.sleepUninterruptibly(300, TimeUnit.MILLISECONDS);
        stragglerFinished.set(true);
      }
    };

    List<TestItem> tests = tests(2);
    ResultSink sink = new ResultSink(tests, Optional.<Integer>absent(), new RecordingProgress());
    try {
      newScheduler(initializerOf(execution), 2, new CancellationToken(), FAIL_ON_ABORT)
          .run(sink, deadlineIn(30));
      fail("Expected the worker error to propagate");
    } catch (TestWorkerException e) {
      assertEquals("test-0", e.getTestPath());
      assertTrue(e.getCause() instanceof IllegalStateException);
    }
    assertTrue(stragglerFinished.get());
  }

  @Test
  public void testLaterCompletionsAreConsumedWhileWaiting() throws Exception {
    final CountDownLatch othersReported = newLatch(3);
    RecordingProgress progress = new RecordingProgress() {
      @Override public void update(TestItem test) {
        super.update(test);
        othersReported.countDown();
      }
    };
    TestExecution execution = new BodyExecution() {
      @Override void body(int index) throws InterruptedException {
        if (index == 0) {
          // Only finishes once the later tests have been reported.
          assertTrue(await(othersReported));
        }
      }
    };

    List<TestItem> tests = tests(4);
    ResultSink sink = new ResultSink(tests, Optional.<Integer>absent(), progress);
    newScheduler(initializerOf(execution), 2, new CancellationToken(), FAIL_ON_ABORT)
        .run(sink, deadlineIn(30));

    List<TestItem> updates = progress.getUpdates();
    assertEquals(4, updates.size());
    assertEquals("test-0", updates.get(3).getPath());
  }

  @Test
  public void testPastDeadlineStopsWaiting() throws Exception {
    final CountDownLatch never = newLatch(1);
    final AtomicInteger interrupted = new AtomicInteger();
    TestExecution execution = new BodyExecution() {
      @Override void body(int index) throws InterruptedException {
        try {
          never.await();
        } catch (InterruptedException e) {
          interrupted.incrementAndGet();
          throw e;
        }
      }
    };

    List<TestItem> tests = tests(3);
    RecordingProgress progress = new RecordingProgress();
    ResultSink sink = new ResultSink(tests, Optional.<Integer>absent(), progress);
    long start = System.nanoTime();
    newScheduler(initializerOf(execution), 2, new CancellationToken(), FAIL_ON_ABORT)
        .run(sink, System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(200));

    assertThat(System.nanoTime() - start, greaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(200)));
    // Both running tests were interrupted and the queued one discarded.
    assertEquals(2, interrupted.get());
    assertTrue(progress.getUpdates().isEmpty());
    for (TestItem test : tests) {
      assertFalse(test.hasResult());
    }
  }

  @Test
  public void testCancellationTerminatesWorkersThenAborts() throws Exception {
    final CountDownLatch started = newLatch(2);
    final CountDownLatch never = newLatch(1);
    final AtomicInteger interrupted = new AtomicInteger();
    TestExecution execution = new BodyExecution() {
      @Override void body(int index) throws InterruptedException {
        started.countDown();
        try {
          never.await();
        } catch (InterruptedException e) {
          interrupted.incrementAndGet();
          throw e;
        }
      }
    };
    final AtomicInteger interruptedAtAbort = new AtomicInteger(-1);
    AbortHandler recordingAbort = new AbortHandler() {
      @Override public void abort() {
        interruptedAtAbort.set(interrupted.get());
      }
    };

    final CancellationToken cancellation = new CancellationToken();
    Thread canceller = new Thread() {
      @Override public void run() {
        try {
          if (await(started)) {
            cancellation.cancel();
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    };
    canceller.start();

    List<TestItem> tests = tests(5);
    ResultSink sink = new ResultSink(tests, Optional.<Integer>absent(), new RecordingProgress());
    try {
      newScheduler(initializerOf(execution), 2, cancellation, recordingAbort)
          .run(sink, deadlineIn(30));
      fail("Expected the run to be cancelled");
    } catch (RunCancelledException e) {
      // Expected
    }
    canceller.join();

    assertTrue(cancellation.isCancelled());
    assertEquals(2, interruptedAtAbort.get());
  }

  @Test
  public void testHaltStopsWaiting() throws Exception {
    final CountDownLatch never = newLatch(1);
    TestExecution execution = new TestExecution() {
      @Override public CompletedTest runOne(int index, TestItem test) throws Exception {
        if (index > 0) {
          never.await();
        }
        return new CompletedTest(index, test.withResult(new TestResult(ResultCode.FAIL, "")));
      }
    };

    List<TestItem> tests = tests(4);
    ResultSink sink = new ResultSink(tests, Optional.of(1), new RecordingProgress());
    newScheduler(initializerOf(execution), 2, new CancellationToken(), FAIL_ON_ABORT)
        .run(sink, deadlineIn(30));

    assertTrue(sink.isHalted());
    assertEquals(ResultCode.FAIL, tests.get(0).getResult().getCode());
    for (TestItem test : tests.subList(1, tests.size())) {
      assertFalse(test.hasResult());
    }
  }

  @Test
  public void testCancellationWakesRunWithNoRunningTests() throws Exception {
    // A factory that never yields a thread leaves every test queued.
    ThreadFactory noThreads = new ThreadFactory() {
      @Override public Thread newThread(Runnable runnable) {
        return null;
      }
    };
    final AtomicInteger aborts = new AtomicInteger();
    AbortHandler countingAbort = new AbortHandler() {
      @Override public void abort() {
        aborts.incrementAndGet();
      }
    };
    final CancellationToken cancellation = new CancellationToken();
    Thread canceller = new Thread() {
      @Override public void run() {
        Uninterruptibles.sleepUninterruptibly(100, TimeUnit.MILLISECONDS);
        cancellation.cancel();
      }
    };
    canceller.start();

    List<TestItem> tests = tests(3);
    ResultSink sink = new ResultSink(tests, Optional.<Integer>absent(), new RecordingProgress());
    ConcurrentScheduler scheduler = new ConcurrentScheduler(CONFIG,
        initializerOf(new BodyExecution() {
          @Override void body(int index) {
          }
        }),
        2, cancellation, countingAbort, noThreads);
    long start = System.nanoTime();
    try {
      scheduler.run(sink, deadlineIn(60));
      fail("Expected the run to be cancelled");
    } catch (RunCancelledException e) {
      // Expected
    }
    canceller.join();

    assertThat(System.nanoTime() - start, lessThanOrEqualTo(TimeUnit.SECONDS.toNanos(10)));
    assertEquals(1, aborts.get());
    for (TestItem test : tests) {
      assertFalse(test.hasResult());
    }
  }
}
