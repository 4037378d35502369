// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * The configuration shared by every worker of a test run.
 */
public final class RunConfig {

  /**
   * Builds a {@link RunConfig}. Parallelism groups keep their declaration order.
   */
  public static final class Builder {
    private final Map<String, Optional<Integer>> parallelismGroups =
        new LinkedHashMap<String, Optional<Integer>>();
    private Optional<Integer> maxFailures = Optional.absent();
    private boolean debug;

    private Builder() {
    }

    /**
     * Declares a parallelism group that admits any number of concurrent tests.
     */
    public Builder addUnboundedGroup(String name) {
      return addGroup(name, Optional.<Integer>absent());
    }

    /**
     * Declares a parallelism group that admits at most {@code bound} concurrent tests.
     */
    public Builder addParallelismGroup(String name, int bound) {
      Preconditions.checkArgument(bound > 0,
          "Parallelism group %s must have a positive bound, given: %s", name, bound);
      return addGroup(name, Optional.of(bound));
    }

    private Builder addGroup(String name, Optional<Integer> bound) {
      Preconditions.checkNotNull(name);
      Preconditions.checkArgument(!name.isEmpty(), "Parallelism group name cannot be empty");
      Preconditions.checkArgument(!parallelismGroups.containsKey(name),
          "Parallelism group %s declared more than once", name);
      parallelismGroups.put(name, bound);
      return this;
    }

    /**
     * Stops the run once this many tests have failed.
     */
    public Builder setMaxFailures(int maxFailures) {
      Preconditions.checkArgument(maxFailures > 0,
          "Maximum failures must be positive, given: %s", maxFailures);
      this.maxFailures = Optional.of(maxFailures);
      return this;
    }

    /**
     * When set, exceptions raised while executing a test abort the run instead of being recorded
     * as {@link ResultCode#UNRESOLVED}.
     */
    public Builder setDebug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public RunConfig build() {
      return new RunConfig(ImmutableMap.copyOf(parallelismGroups), maxFailures, debug);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  private final ImmutableMap<String, Optional<Integer>> parallelismGroups;
  private final Optional<Integer> maxFailures;
  private final boolean debug;

  private RunConfig(ImmutableMap<String, Optional<Integer>> parallelismGroups,
      Optional<Integer> maxFailures, boolean debug) {
    this.parallelismGroups = parallelismGroups;
    this.maxFailures = maxFailures;
    this.debug = debug;
  }

  /**
   * Returns the declared parallelism groups; an absent bound means the group is unbounded.
   */
  public ImmutableMap<String, Optional<Integer>> getParallelismGroups() {
    return parallelismGroups;
  }

  public Optional<Integer> getMaxFailures() {
    return maxFailures;
  }

  public boolean isDebug() {
    return debug;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("parallelismGroups", parallelismGroups)
        .add("maxFailures", maxFailures.orNull())
        .add("debug", debug)
        .toString();
  }
}
