// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

/**
 * Renders a log call into the line handed to a {@link LogSink}.
 *
 * <p>Formatters are expected to start the output of {@link LogLevel#ERROR_LEVEL}
 * and {@link LogLevel#FATAL_LEVEL} messages with {@link #ERROR_MARKER}.
 * The marker is removed again before a message is sent to a
 * {@link CrashReporter}.</p>
 */
@FunctionalInterface
public interface LogFormatter {
  /**
   * Colored marker for error and fatal messages.
   */
  String ERROR_MARKER = "\033[031;1m[ERROR]\033[031;0m";

  /**
   * Render a log call.
   *
   * @param logLevel the level of the message.
   * @param callDepth the number of stack frames between the logging
   *     call of the application and this method.
   * @param format a {@link String#format(String, Object...)} pattern.
   * @param args the arguments for {@code format}.
   *
   * @return the rendered line.
   */
  String format(final LogLevel logLevel, final int callDepth,
      final String format, final Object... args);
}
