// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

/**
 * Limits how many tests of one parallelism group run at the same time.
 *
 * <p>Every successful {@link #acquire()} must be paired with exactly one {@link #release()}.
 */
public interface Permit {

  /**
   * Blocks until a slot is available.
   *
   * @throws InterruptedException if interrupted while waiting.
   */
  void acquire() throws InterruptedException;

  /**
   * Returns a slot taken by {@link #acquire()}.
   */
  void release();
}
