// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

/**
 * Resolves the {@link LogSink} that handles a category of messages.
 *
 * <p>Used to route error messages to a different destination than
 * informational ones, e.g. a dedicated error log.</p>
 */
@FunctionalInterface
public interface LogSinkFactory {
  /**
   * Category of info and debug messages.
   */
  String DEFAULT_CATEGORY = "";

  /**
   * Category of error messages.
   */
  String ERROR_CATEGORY = "error";

  /**
   * Get the sink for a category.
   *
   * @param category the message category, never empty.
   *
   * @return the sink, or null to fall back to standard output.
   */
  /* @Nullable */ LogSink sinkFor(final String category);
}
