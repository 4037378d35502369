// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;

/**
 * Runs a {@link TestFormat} inside the parallelism group of each test.
 *
 * <p>The permit of the test's group is held for the duration of the test only. Exceptions raised
 * by the format become {@link ResultCode#UNRESOLVED} results carrying the stack trace, unless the
 * run is in {@link RunConfig#isDebug() debug} mode where they abort the run.
 */
public final class GroupedTestExecution implements TestExecution {
  private static final Logger LOG = Logger.getLogger(GroupedTestExecution.class.getName());

  /**
   * Returns a worker initializer creating a {@code GroupedTestExecution} of {@code format} for
   * each worker.
   */
  public static WorkerInitializer initializer(final TestFormat format) {
    Preconditions.checkNotNull(format);
    return new WorkerInitializer() {
      @Override public TestExecution initialize(RunConfig config, PermitSet permits) {
        return new GroupedTestExecution(format, config, permits);
      }
    };
  }

  private final TestFormat format;
  private final RunConfig config;
  private final PermitSet permits;

  public GroupedTestExecution(TestFormat format, RunConfig config, PermitSet permits) {
    this.format = Preconditions.checkNotNull(format);
    this.config = Preconditions.checkNotNull(config);
    this.permits = Preconditions.checkNotNull(permits);
  }

  @Override
  public CompletedTest runOne(int index, TestItem test) throws Exception {
    return new CompletedTest(index, test.withResult(execute(test)));
  }

  private TestResult execute(TestItem test) throws Exception {
    Permit permit = null;
    try {
      String group = test.getParallelismGroup();
      if (group != null) {
        Permit groupPermit = permits.forGroup(group);
        groupPermit.acquire();
        permit = groupPermit;
      }

      Stopwatch stopwatch = Stopwatch.createStarted();
      TestResult result = format.execute(test, config);
      if (result == null) {
        throw new IllegalStateException("unexpected result from test execution");
      }
      return result.withElapsed(stopwatch.elapsed());
    } catch (InterruptedException e) {
      throw e;
    } catch (Exception e) {
      if (config.isDebug()) {
        throw e;
      }
      LOG.log(Level.FINE, "Exception executing " + test.getPath(), e);
      return new TestResult(ResultCode.UNRESOLVED,
          "Exception during script execution:\n" + Throwables.getStackTraceAsString(e));
    } finally {
      if (permit != null) {
        permit.release();
      }
    }
  }
}
