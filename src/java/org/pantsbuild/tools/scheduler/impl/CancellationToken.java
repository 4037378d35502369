// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A trigger the host environment pulls to stop a test run immediately, for example when the user
 * hits Ctrl-C.
 *
 * <p>Cancellation is permanent. Listeners run on the thread that calls {@link #cancel()}.
 */
public final class CancellationToken {

  /**
   * Undoes an {@link #onCancel(Runnable)} registration.
   */
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }

  private final List<Runnable> listeners = new ArrayList<Runnable>();
  private boolean cancelled;

  /**
   * Cancels the token, running every registered listener. Later calls do nothing.
   */
  public void cancel() {
    List<Runnable> toNotify;
    synchronized (this) {
      if (cancelled) {
        return;
      }
      cancelled = true;
      toNotify = ImmutableList.copyOf(listeners);
      listeners.clear();
    }
    for (Runnable listener : toNotify) {
      listener.run();
    }
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  /**
   * Registers {@code listener} to run on cancellation. If the token is already cancelled the
   * listener runs right away on the calling thread.
   */
  public Registration onCancel(final Runnable listener) {
    Preconditions.checkNotNull(listener);
    synchronized (this) {
      if (!cancelled) {
        listeners.add(listener);
        return new Registration() {
          @Override public void close() {
            synchronized (CancellationToken.this) {
              listeners.remove(listener);
            }
          }
        };
      }
    }
    listener.run();
    return new Registration() {
      @Override public void close() {
      }
    };
  }
}
