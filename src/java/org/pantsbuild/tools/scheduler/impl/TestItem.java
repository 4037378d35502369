// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A single test to run, identified by its path.
 *
 * <p>The result slot is written at most once. Workers never write into the caller's instance;
 * they hand back a copy made with {@link #withResult(TestResult)} which the run then stores at the
 * test's index.
 */
public final class TestItem {
  private final String path;
  @Nullable private final String parallelismGroup;
  @Nullable private TestResult result;

  public TestItem(String path) {
    this(path, null);
  }

  public TestItem(String path, @Nullable String parallelismGroup) {
    this(path, parallelismGroup, null);
  }

  private TestItem(String path, @Nullable String parallelismGroup, @Nullable TestResult result) {
    this.path = Preconditions.checkNotNull(path);
    this.parallelismGroup = parallelismGroup;
    this.result = result;
  }

  public String getPath() {
    return path;
  }

  /**
   * Returns the name of the parallelism group this test runs under, or {@code null} if the test is
   * not constrained by any group.
   */
  @Nullable
  public String getParallelismGroup() {
    return parallelismGroup;
  }

  /**
   * Returns the result of this test, or {@code null} if it has not completed.
   */
  @Nullable
  public synchronized TestResult getResult() {
    return result;
  }

  public synchronized boolean hasResult() {
    return result != null;
  }

  /**
   * Attaches a result to this test.
   *
   * @throws IllegalStateException if a result was already attached.
   */
  public synchronized void setResult(TestResult result) {
    Preconditions.checkNotNull(result);
    Preconditions.checkState(this.result == null, "Test %s already has a result", path);
    this.result = result;
  }

  /**
   * Returns a copy of this test, with the same identity, carrying the given result.
   */
  public TestItem withResult(TestResult result) {
    Preconditions.checkNotNull(result);
    return new TestItem(path, parallelismGroup, result);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("path", path)
        .add("parallelismGroup", parallelismGroup)
        .add("result", getResult())
        .toString();
  }
}
