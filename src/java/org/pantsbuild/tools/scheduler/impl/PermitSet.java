// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import java.util.Map;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * The permits of every parallelism group of a run. A single instance is shared by all workers of
 * the run.
 */
public final class PermitSet {

  /**
   * Creates one permit per parallelism group declared in {@code config}.
   */
  public static PermitSet create(RunConfig config) {
    ImmutableMap.Builder<String, Permit> permits = ImmutableMap.builder();
    for (Map.Entry<String, Optional<Integer>> group : config.getParallelismGroups().entrySet()) {
      Optional<Integer> bound = group.getValue();
      permits.put(group.getKey(),
          bound.isPresent() ? new BoundedPermit(bound.get()) : UnboundedPermit.INSTANCE);
    }
    return new PermitSet(permits.build());
  }

  private final ImmutableMap<String, Permit> permits;

  private PermitSet(ImmutableMap<String, Permit> permits) {
    this.permits = permits;
  }

  /**
   * Returns the permit guarding the named group.
   *
   * @throws IllegalArgumentException if no such group was configured.
   */
  public Permit forGroup(String group) {
    Preconditions.checkNotNull(group);
    Permit permit = permits.get(group);
    Preconditions.checkArgument(permit != null, "Unknown parallelism group: %s", group);
    return permit;
  }

  public boolean hasGroup(String group) {
    return permits.containsKey(group);
  }

  @Override
  public String toString() {
    return "PermitSet" + permits;
  }
}
