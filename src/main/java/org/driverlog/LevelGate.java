// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

/**
 * Decides whether a log call is emitted.
 */
final class LevelGate {
  /**
   * Debug messages longer than this many code points are dropped.
   */
  static final int MAX_DEBUG_OUTPUT = 256;

  private LevelGate() {
  }

  /**
   * Error and fatal messages always pass. Debug messages additionally
   * require debug output to be enabled.
   */
  static boolean shouldEmit(final LogLevel logLevel, final LogLevel threshold,
      final boolean debugEnabled) {
    if (logLevel.isAtLeast(LogLevel.ERROR_LEVEL)) {
      return true;
    }
    if (threshold.getValue() > logLevel.getValue()) {
      return false;
    }
    return logLevel != LogLevel.DEBUG_LEVEL || debugEnabled;
  }

  static boolean withinDebugLimit(final String content) {
    return content.codePointCount(0, content.length()) <= MAX_DEBUG_OUTPUT;
  }
}
