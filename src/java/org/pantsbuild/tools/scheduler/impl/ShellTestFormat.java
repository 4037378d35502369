// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

/**
 * Runs each test as a script with a shell. A zero exit status passes, anything else fails.
 *
 * <p>Standard output and error are merged and captured into a temporary file while the script runs.
 */
public final class ShellTestFormat implements TestFormat {
  private final String shell;
  @Nullable private final Duration perTestTimeout;

  /**
   * @param shell The shell used to run each test script, ie: {@code /bin/sh}.
   * @param perTestTimeout Scripts running longer than this are killed and given a
   *     {@link ResultCode#TIMEOUT} result; {@code null} for no limit.
   */
  public ShellTestFormat(String shell, @Nullable Duration perTestTimeout) {
    this.shell = Preconditions.checkNotNull(shell);
    Preconditions.checkArgument(perTestTimeout == null || !perTestTimeout.isNegative(),
        "Per-test timeout cannot be negative: %s", perTestTimeout);
    this.perTestTimeout = perTestTimeout;
  }

  @Override
  public TestResult execute(TestItem test, RunConfig config)
      throws IOException, InterruptedException {
    File script = new File(test.getPath());
    if (!script.isFile()) {
      return new TestResult(ResultCode.UNRESOLVED, "Test script not found: " + script);
    }

    File output = File.createTempFile("test-output", ".txt");
    try {
      Process process = new ProcessBuilder(ImmutableList.of(shell, script.getPath()))
          .directory(script.getAbsoluteFile().getParentFile())
          .redirectErrorStream(true)
          .redirectOutput(output)
          .start();
      try {
        if (!waitFor(process)) {
          process.destroyForcibly().waitFor();
          return new TestResult(ResultCode.TIMEOUT,
              read(output) + String.format("\nReached timeout of %d seconds",
                  perTestTimeout.getSeconds()));
        }
      } catch (InterruptedException e) {
        process.destroyForcibly();
        throw e;
      }

      int exitCode = process.exitValue();
      if (exitCode == 0) {
        return new TestResult(ResultCode.PASS, read(output));
      }
      return new TestResult(ResultCode.FAIL,
          read(output) + String.format("\nExit code: %d", exitCode));
    } finally {
      if (!output.delete()) {
        output.deleteOnExit();
      }
    }
  }

  private boolean waitFor(Process process) throws InterruptedException {
    if (perTestTimeout == null) {
      process.waitFor();
      return true;
    }
    return process.waitFor(perTestTimeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  private static String read(File output) throws IOException {
    return Files.asCharSource(output, Charsets.UTF_8).read();
  }
}
