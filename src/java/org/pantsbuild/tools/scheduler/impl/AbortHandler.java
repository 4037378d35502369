// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

/**
 * Ends the process after a run was cancelled and its workers were stopped.
 */
public interface AbortHandler {

  /**
   * Halts the VM with exit status 1, without running shutdown hooks or finalizers.
   */
  AbortHandler HALT = new AbortHandler() {
    @Override public void abort() {
      System.err.println("FATAL: test run cancelled, terminating.");
      System.err.flush();
      Runtime.getRuntime().halt(1);
    }
  };

  /**
   * Called from the cancelling thread once the workers of the run have terminated. Normally does
   * not return.
   */
  void abort();
}
