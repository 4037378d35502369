// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

/**
 * A permit for parallelism groups declared without a bound. It never blocks.
 */
enum UnboundedPermit implements Permit {
  INSTANCE;

  @Override
  public void acquire() {
  }

  @Override
  public void release() {
  }
}
