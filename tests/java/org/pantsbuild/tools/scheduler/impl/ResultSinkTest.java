// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.util.List;

import com.google.common.base.Optional;
import com.google.common.base.VerifyException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ResultSinkTest extends SchedulerTestCase {

  private static TestItem complete(List<TestItem> tests, int index, ResultCode code) {
    return tests.get(index).withResult(new TestResult(code, ""));
  }

  @Test
  public void testConsumeStoresCompletedTestAtIndex() {
    List<TestItem> tests = tests(3);
    RecordingProgress progress = new RecordingProgress();
    ResultSink sink = new ResultSink(tests, Optional.<Integer>absent(), progress);

    TestItem completed = complete(tests, 1, ResultCode.PASS);
    sink.consume(1, completed);

    assertSame(completed, tests.get(1));
    assertSame(completed, sink.get(1));
    assertFalse(tests.get(0).hasResult());
    assertEquals(1, progress.getUpdates().size());
    assertSame(completed, progress.getUpdates().get(0));
  }

  @Test
  public void testOnlyFailCountsAsFailure() {
    List<TestItem> tests = tests(5);
    ResultSink sink = new ResultSink(tests, Optional.of(10), new RecordingProgress());

    sink.consume(new CompletedTest(0, complete(tests, 0, ResultCode.FAIL)));
    sink.consume(new CompletedTest(1, complete(tests, 1, ResultCode.XPASS)));
    sink.consume(new CompletedTest(2, complete(tests, 2, ResultCode.UNRESOLVED)));
    sink.consume(new CompletedTest(3, complete(tests, 3, ResultCode.TIMEOUT)));
    sink.consume(new CompletedTest(4, complete(tests, 4, ResultCode.FAIL)));

    assertEquals(2, sink.getFailureCount());
    assertFalse(sink.isHalted());
  }

  @Test
  public void testHaltsAtThresholdAndDropsLaterResults() {
    List<TestItem> tests = tests(4);
    RecordingProgress progress = new RecordingProgress();
    ResultSink sink = new ResultSink(tests, Optional.of(2), progress);

    sink.consume(0, complete(tests, 0, ResultCode.FAIL));
    assertFalse(sink.isHalted());
    sink.consume(2, complete(tests, 2, ResultCode.FAIL));
    assertTrue(sink.isHalted());

    sink.consume(1, complete(tests, 1, ResultCode.FAIL));
    sink.consume(3, complete(tests, 3, ResultCode.PASS));

    assertEquals(2, sink.getFailureCount());
    assertEquals(2, progress.getUpdates().size());
    assertFalse(tests.get(1).hasResult());
    assertFalse(tests.get(3).hasResult());
  }

  @Test
  public void testNoThresholdNeverHalts() {
    List<TestItem> tests = tests(3);
    ResultSink sink = new ResultSink(tests, Optional.<Integer>absent(), new RecordingProgress());
    for (int i = 0; i < tests.size(); i++) {
      sink.consume(i, complete(tests, i, ResultCode.FAIL));
    }
    assertEquals(3, sink.getFailureCount());
    assertFalse(sink.isHalted());
  }

  @Test(expected = VerifyException.class)
  public void testMismatchedPathIsRejected() {
    List<TestItem> tests = tests(2);
    ResultSink sink = new ResultSink(tests, Optional.<Integer>absent(), new RecordingProgress());
    sink.consume(0, complete(tests, 1, ResultCode.PASS));
  }

  @Test(expected = VerifyException.class)
  public void testTestWithoutResultIsRejected() {
    List<TestItem> tests = tests(1);
    ResultSink sink = new ResultSink(tests, Optional.<Integer>absent(), new RecordingProgress());
    sink.consume(0, new TestItem("test-0"));
  }
}
