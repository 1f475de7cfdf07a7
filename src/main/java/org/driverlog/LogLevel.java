// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

/**
 * Severity of a driver log message. Declaration order is severity order,
 * the byte values are the numeric levels handed to formatters.
 */
public enum LogLevel {
  /**
   * Protocol and connection tracing, off unless debug output is enabled.
   */
  DEBUG_LEVEL((byte)0),

  /**
   * Normal operation: connects, failovers, pool resizes.
   */
  INFO_LEVEL((byte)1),

  /**
   * Recoverable problems.
   */
  WARN_LEVEL((byte)2),

  /**
   * Failed operations. Never filtered and sent to the crash reporter.
   */
  ERROR_LEVEL((byte)3),

  /**
   * Failures the driver cannot continue after.
   */
  FATAL_LEVEL((byte)4);

  private final byte value_;

  LogLevel(final byte value) {
    value_ = value;
  }

  /**
   * Numeric level, 0 for debug up to 4 for fatal.
   *
   * @return the numeric level.
   */
  public byte getValue() {
    return value_;
  }

  /**
   * Whether this level is at least as severe as {@code other}.
   *
   * @param other the level to compare against.
   *
   * @return true if {@code this >= other}.
   */
  public boolean isAtLeast(final LogLevel other) {
    return value_ >= other.value_;
  }

  /**
   * Look up a level by its numeric value, e.g. one read from a
   * configuration file.
   *
   * @param value the numeric level, 0 to 4.
   *
   * @return the level.
   * @throws IllegalArgumentException if no level has this value.
   */
  public static LogLevel getLogLevel(final byte value) {
    for (final LogLevel logLevel : LogLevel.values()) {
      if (logLevel.getValue() == value) {
        return logLevel;
      }
    }
    throw new IllegalArgumentException(
        "No log level with value " + value);
  }
}
