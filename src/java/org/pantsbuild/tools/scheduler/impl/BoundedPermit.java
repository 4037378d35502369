// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.util.concurrent.Semaphore;

import com.google.common.base.Preconditions;

/**
 * A counting permit admitting at most {@code bound} concurrent holders.
 */
final class BoundedPermit implements Permit {
  private final int bound;
  private final Semaphore semaphore;

  BoundedPermit(int bound) {
    Preconditions.checkArgument(bound > 0, "Permit bound must be positive, given: %s", bound);
    this.bound = bound;
    // Fair so a waiting test is not overtaken indefinitely by later arrivals.
    this.semaphore = new Semaphore(bound, true);
  }

  @Override
  public void acquire() throws InterruptedException {
    semaphore.acquire();
  }

  @Override
  public void release() {
    semaphore.release();
  }

  int getBound() {
    return bound;
  }

  int availablePermits() {
    return semaphore.availablePermits();
  }

  @Override
  public String toString() {
    return String.format("BoundedPermit(%d of %d available)", semaphore.availablePermits(), bound);
  }
}
