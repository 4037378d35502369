// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.io.Files;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.StringArrayOptionHandler;

/**
 * Runs shell test scripts with a {@link TestRun} and reports their results on the console.
 */
public class ConsoleRunnerImpl {
  private static final Logger LOG = Logger.getLogger(ConsoleRunnerImpl.class.getName());

  /** Should be set to false for unit testing via {@link #setCallSystemExitOnFinish} */
  private static boolean callSystemExitOnFinish = true;
  /** Replaced in unit tests so a cancelled run does not halt the VM. */
  private static AbortHandler abortHandler = AbortHandler.HALT;

  private final RunConfig config;
  private final int workers;
  @Nullable private final Duration maxTime;
  @Nullable private final String testGroup;
  private final TestFormat format;
  private final boolean showAll;
  private final PrintStream out;
  private final PrintStream err;

  ConsoleRunnerImpl(
      RunConfig config,
      int workers,
      @Nullable Duration maxTime,
      @Nullable String testGroup,
      TestFormat format,
      boolean showAll,
      PrintStream out,
      PrintStream err) {

    Preconditions.checkNotNull(config);
    Preconditions.checkNotNull(format);
    Preconditions.checkNotNull(out);
    Preconditions.checkNotNull(err);

    this.config = config;
    this.workers = workers;
    this.maxTime = maxTime;
    this.testGroup = testGroup;
    this.format = format;
    this.showAll = showAll;
    this.out = out;
    this.err = err;
  }

  void run(List<String> testPaths) {
    List<TestItem> tests = Lists.newArrayListWithCapacity(testPaths.size());
    for (String path : testPaths) {
      tests.add(new TestItem(path, testGroup));
    }

    final CancellationToken cancellation = new CancellationToken();
    TestRun run = new TestRun(config, GroupedTestExecution.initializer(format), workers,
        cancellation, abortHandler);
    ConsoleProgress progress = new ConsoleProgress(out, tests.size(), showAll);

    // Ctrl-C and external kills arrive as a VM shutdown; cancel the run so the workers are
    // stopped before the VM goes away.
    Thread cancelHook = new Thread() {
      @Override public void run() {
        cancellation.cancel();
      }
    };
    Runtime.getRuntime().addShutdownHook(cancelHook);

    double elapsed;
    try {
      elapsed = run.execute(tests, progress, maxTime);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      err.println("Interrupted while running tests.");
      exit(1);
      return;
    } catch (TestWorkerException e) {
      LOG.log(Level.FINE, "Test run aborted", e);
      err.println("FATAL: " + e.getMessage());
      exit(1);
      return;
    } finally {
      Runtime.getRuntime().removeShutdownHook(cancelHook);
    }

    exit(printSummary(tests, elapsed));
  }

  /**
   * Prints the outcome of the run and returns the exit status it warrants.
   */
  private int printSummary(List<TestItem> tests, double elapsed) {
    Map<ResultCode, Integer> counts = new EnumMap<ResultCode, Integer>(ResultCode.class);
    for (TestItem test : tests) {
      ResultCode code = test.getResult().getCode();
      Integer count = counts.get(code);
      counts.put(code, count == null ? 1 : count + 1);
    }

    out.printf("Testing Time: %.2fs%n", elapsed);
    for (Map.Entry<ResultCode, Integer> entry : counts.entrySet()) {
      out.printf("  %-20s: %d%n", entry.getKey().getLabel(), entry.getValue());
    }

    if (maxTime != null && elapsed >= maxTime.getSeconds()
        && counts.containsKey(ResultCode.UNRESOLVED)) {
      err.println("warning: reached timeout, skipping remaining tests");
    }
    Integer failures = counts.get(ResultCode.FAIL);
    if (config.getMaxFailures().isPresent() && failures != null
        && failures >= config.getMaxFailures().get()) {
      err.println("note: reached maximum number of test failures, skipping remaining tests");
    }
    out.flush();
    err.flush();

    for (ResultCode code : counts.keySet()) {
      if (code.isFailure()) {
        return 1;
      }
    }
    return 0;
  }

  /**
   * Launcher for the test scheduler.
   *
   * @param args options from the command line
   */
  public static void main(String[] args) {
    /**
     * Command line option bean.
     */
    class Options {
      private int workers = Runtime.getRuntime().availableProcessors();

      @Option(name = "-workers", aliases = {"-j"},
          usage = "Number of tests to run in parallel. 1 runs tests serially. "
              + "(default: number of processors)")
      public void setWorkers(int workers) {
        if (workers <= 0) {
          throw new InvalidOptionValueException("-workers", workers, "must be positive");
        }
        this.workers = workers;
      }

      private Integer maxFailures;

      @Option(name = "-max-failures", usage = "Stop the run after this many failed tests.")
      public void setMaxFailures(int maxFailures) {
        if (maxFailures <= 0) {
          throw new InvalidOptionValueException("-max-failures", maxFailures, "must be positive");
        }
        this.maxFailures = maxFailures;
      }

      private Duration maxTime;

      @Option(name = "-max-time",
          usage = "Maximum time in seconds to spend running tests. Tests that have not "
              + "completed by then are reported as unresolved.")
      public void setMaxTime(int seconds) {
        if (seconds <= 0) {
          throw new InvalidOptionValueException("-max-time", seconds, "must be positive");
        }
        this.maxTime = Duration.ofSeconds(seconds);
      }

      private Duration perTestTimeout;

      @Option(name = "-per-test-timeout",
          usage = "Kill tests running longer than this many seconds.")
      public void setPerTestTimeout(int seconds) {
        if (seconds <= 0) {
          throw new InvalidOptionValueException("-per-test-timeout", seconds, "must be positive");
        }
        this.perTestTimeout = Duration.ofSeconds(seconds);
      }

      private final RunConfig.Builder config = RunConfig.builder();

      @Option(name = "-parallelism-group",
          usage = "Declare a parallelism group as NAME or NAME=BOUND. At most BOUND tests of the "
              + "group run at once; a missing bound or 'none' means no limit. May be repeated.")
      public void addParallelismGroup(String group) {
        List<String> parts = Splitter.on('=').trimResults().splitToList(group);
        if (parts.size() > 2 || parts.get(0).isEmpty()) {
          throw new InvalidOptionValueException("-parallelism-group", group,
              "expected NAME or NAME=BOUND");
        }
        String name = parts.get(0);
        try {
          if (parts.size() == 1 || "none".equals(parts.get(1))) {
            config.addUnboundedGroup(name);
          } else {
            config.addParallelismGroup(name, Integer.parseInt(parts.get(1)));
          }
        } catch (IllegalArgumentException e) {
          // Includes NumberFormatException.
          throw new InvalidOptionValueException("-parallelism-group", group, e.getMessage());
        }
      }

      @Option(name = "-test-group",
          usage = "Run every test in this parallelism group, which must be declared with "
              + "-parallelism-group.")
      private String testGroup;

      @Option(name = "-shell", usage = "The shell used to run test scripts. (default: /bin/sh)")
      private String shell = "/bin/sh";

      @Option(name = "-debug",
          usage = "Abort the run when a test cannot be executed instead of reporting it as "
              + "unresolved, and log at FINE level.")
      private boolean debug;

      @Option(name = "-show-all", usage = "Show every test result, not only failures.")
      private boolean showAll;

      @Argument(usage = "Paths of test scripts to run. Names prefixed with @ are considered arg "
                        + "file paths and these will be loaded and the whitespace delimited "
                        + "arguments found inside added to the list",
                required = true,
                metaVar = "TESTS",
                handler = StringArrayOptionHandler.class)
      private String[] tests = {};
    }

    Options options = new Options();
    CmdLineParser parser = new CmdLineParser(options);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      System.err.println(e.getMessage());
      parser.printUsage(System.err);
      exit(1);
      return;
    } catch (InvalidOptionValueException e) {
      System.err.println(e.getMessage());
      parser.printUsage(System.err);
      exit(1);
      return;
    }

    if (options.testGroup != null
        && !options.config.build().getParallelismGroups().containsKey(options.testGroup)) {
      System.err.printf("Undeclared parallelism group for -test-group: %s%n", options.testGroup);
      parser.printUsage(System.err);
      exit(1);
      return;
    }

    if (options.maxFailures != null) {
      options.config.setMaxFailures(options.maxFailures);
    }
    options.config.setDebug(options.debug);
    if (options.debug) {
      enableDebugLogging(Logger.getLogger(""));
    }

    List<String> tests = Lists.newArrayList();
    for (String test : options.tests) {
      if (test.startsWith("@")) {
        try {
          String argFileContents = Files.asCharSource(new File(test.substring(1)), Charsets.UTF_8)
              .read();
          tests.addAll(Splitter.onPattern("\\s+").omitEmptyStrings().splitToList(argFileContents));
        } catch (IOException e) {
          System.err.printf("Failed to load args from arg file %s: %s%n", test, e.getMessage());
          exit(1);
          return;
        }
      } else {
        tests.add(test);
      }
    }

    ConsoleRunnerImpl runner =
        new ConsoleRunnerImpl(options.config.build(),
            options.workers,
            options.maxTime,
            options.testGroup,
            new ShellTestFormat(options.shell, options.perTestTimeout),
            options.showAll,
            // NB: Buffering helps speedup output-heavy tests.
            new PrintStream(new BufferedOutputStream(System.out), true),
            new PrintStream(new BufferedOutputStream(System.err), true));
    runner.run(tests);
  }

  /**
   * Lowers {@code logger} and its handlers to {@link Level#FINE}. Handlers keep their own level,
   * INFO for the default console handler, so lowering the logger alone prints nothing more.
   */
  @VisibleForTesting
  static void enableDebugLogging(Logger logger) {
    logger.setLevel(Level.FINE);
    for (Handler handler : logger.getHandlers()) {
      handler.setLevel(Level.FINE);
    }
  }

  private static void exit(int code) {
    if (callSystemExitOnFinish) {
      // We're a main - its fine to exit.
      System.exit(code);
    } else {
      if (code != 0) {
        throw new RuntimeException("ConsoleRunner exited with status " + code);
      }
    }
  }

  // ---------------------------- For testing only ---------------------------------

  @VisibleForTesting
  static void setCallSystemExitOnFinish(boolean exitOnFinish) {
    callSystemExitOnFinish = exitOnFinish;
  }

  @VisibleForTesting
  static void setAbortHandler(AbortHandler handler) {
    abortHandler = Preconditions.checkNotNull(handler);
  }
}
