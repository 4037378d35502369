// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

/**
 * Sets up a worker before it runs its first test.
 */
public interface WorkerInitializer {

  /**
   * Called once per worker, on the worker's own thread, before the first test it runs.
   *
   * @param config The configuration of the run.
   * @param permits The permits of the run, shared by all workers.
   * @return The execution the worker uses for every test it runs.
   */
  TestExecution initialize(RunConfig config, PermitSet permits);
}
