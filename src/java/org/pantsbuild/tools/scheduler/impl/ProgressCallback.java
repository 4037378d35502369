// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

/**
 * Receives each test as it completes.
 */
public interface ProgressCallback {

  /**
   * Called once for every test that actually ran, from the thread driving the run. Tests that
   * never ran are not reported. Implementations should return promptly since the next completed
   * test is not consumed until this returns.
   *
   * @param test The completed test, carrying its result.
   */
  void update(TestItem test);
}
