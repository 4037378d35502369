// Copyright 2026 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.pantsbuild.tools.scheduler.impl;

import javax.annotation.Nullable;

/**
 * Thrown by command line option setters rejecting a malformed value.
 *
 * <p>args4j rethrows runtime exceptions raised from option setters, so the launcher can catch this
 * alongside {@link org.kohsuke.args4j.CmdLineException} and print usage.
 */
class InvalidOptionValueException extends RuntimeException {

  /**
   * @param optionName The option being parsed, ie: {@code -max-failures}.
   * @param optionValue The raw value given for the option.
   * @param message Why the value is invalid.
   */
  InvalidOptionValueException(String optionName, @Nullable Object optionValue, String message) {
    super(String.format("Invalid value '%s' for option '%s': %s",
        optionValue, optionName, message));
  }
}
