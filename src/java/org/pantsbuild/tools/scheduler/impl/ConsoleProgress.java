// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.io.PrintStream;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Prints a line for each completed test, followed by the output of failed tests.
 */
class ConsoleProgress implements ProgressCallback {
  private static final String BANNER = Strings.repeat("*", 20);

  private final PrintStream out;
  private final int total;
  private final boolean showAll;
  private int completed;

  /**
   * @param out Where to print.
   * @param total The number of tests in the run.
   * @param showAll Print a line for passing tests too, not just for failures.
   */
  ConsoleProgress(PrintStream out, int total, boolean showAll) {
    this.out = Preconditions.checkNotNull(out);
    this.total = total;
    this.showAll = showAll;
  }

  @Override
  public void update(TestItem test) {
    completed++;
    ResultCode code = test.getResult().getCode();
    if (!showAll && !code.isFailure()) {
      return;
    }

    out.printf("%s: %s (%d of %d)%n", code, test.getPath(), completed, total);
    if (code.isFailure()) {
      out.printf("%s TEST '%s' %s %s%n", BANNER, test.getPath(), code, BANNER);
      out.println(test.getResult().getOutput());
      out.println(BANNER);
    }
    out.flush();
  }
}
