// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog.util;

/**
 * Helpers for writing rendered messages as lines.
 */
public final class LogLines {
  private LogLines() {
  }

  /**
   * Append a newline unless the message already ends with one.
   *
   * @param message the message.
   *
   * @return the message ending with exactly the newlines it had, or one.
   */
  public static String terminate(final String message) {
    if (message.endsWith("\n")) {
      return message;
    }
    return message + '\n';
  }
}
