// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.time.Duration;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * The immutable result of executing a test item: a code, the captured output and the time spent.
 */
public final class TestResult {
  private final ResultCode code;
  private final String output;
  private final Duration elapsed;

  public TestResult(ResultCode code, String output) {
    this(code, output, Duration.ZERO);
  }

  public TestResult(ResultCode code, String output, Duration elapsed) {
    this.code = Preconditions.checkNotNull(code);
    this.output = Preconditions.checkNotNull(output);
    this.elapsed = Preconditions.checkNotNull(elapsed);
    Preconditions.checkArgument(!elapsed.isNegative(), "Elapsed time cannot be negative: %s",
        elapsed);
  }

  /**
   * The result given to tests that never completed execution.
   */
  static TestResult unresolved() {
    return new TestResult(ResultCode.UNRESOLVED, "", Duration.ZERO);
  }

  public ResultCode getCode() {
    return code;
  }

  public String getOutput() {
    return output;
  }

  public Duration getElapsed() {
    return elapsed;
  }

  /**
   * Returns a copy of this result with the given elapsed time.
   */
  public TestResult withElapsed(Duration elapsed) {
    return new TestResult(code, output, elapsed);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TestResult)) {
      return false;
    }
    TestResult other = (TestResult) o;
    return code == other.code && output.equals(other.output) && elapsed.equals(other.elapsed);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, output, elapsed);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("code", code)
        .add("elapsed", elapsed)
        .toString();
  }
}
