// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog.util;

import org.driverlog.LogFormatter;
import org.driverlog.LogLevel;

/**
 * Formats messages for a terminal: a colored level marker, optionally
 * the source location of the logging call, then the message.
 *
 * <p>Error and fatal messages start with {@link LogFormatter#ERROR_MARKER}.</p>
 */
public class AnsiLevelFormatter implements LogFormatter {
  static final String DEBUG_MARKER = "\033[036;1m[DEBUG]\033[036;0m";
  static final String INFO_MARKER = "\033[032;1m[INFO]\033[032;0m";
  static final String WARN_MARKER = "\033[033;1m[WARN]\033[033;0m";

  private final boolean callerLocation;

  public AnsiLevelFormatter() {
    this(false);
  }

  /**
   * @param callerLocation whether to include {@code File.java:line} of the
   *     logging call.
   */
  public AnsiLevelFormatter(final boolean callerLocation) {
    this.callerLocation = callerLocation;
  }

  @Override
  public String format(final LogLevel logLevel, final int callDepth, final String format,
      final Object... args) {
    final StringBuilder sb = new StringBuilder(marker(logLevel));
    if (callerLocation) {
      // must be taken here: callDepth counts the frames from this method
      final String location = location(Thread.currentThread().getStackTrace(), callDepth);
      if (location != null) {
        sb.append(location).append(' ');
      }
    }
    return sb.append(String.format(format, args)).toString();
  }

  static String marker(final LogLevel logLevel) {
    switch (logLevel) {
      case DEBUG_LEVEL:
        return DEBUG_MARKER;
      case INFO_LEVEL:
        return INFO_MARKER;
      case WARN_LEVEL:
        return WARN_MARKER;
      case ERROR_LEVEL:
      case FATAL_LEVEL:
        return ERROR_MARKER;
      default:
        throw new IllegalArgumentException("Unknown log level: " + logLevel);
    }
  }

  /**
   * Location of the logging call in a stack trace taken by {@link #format}.
   * The trace starts with {@code Thread.getStackTrace} and {@code format}
   * itself, so the caller is at {@code callDepth + 1}.
   */
  static /* @Nullable */ String location(final StackTraceElement[] frames, final int callDepth) {
    final int index = callDepth + 1;
    if (index < 0 || index >= frames.length) {
      return null;
    }
    final StackTraceElement frame = frames[index];
    final String file = frame.getFileName() != null ? frame.getFileName() : frame.getClassName();
    return file + ":" + frame.getLineNumber();
  }
}
