// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.IllegalFormatException;

/**
 * Renders the arguments of a log call into the message content.
 */
final class Messages {
  private Messages() {
  }

  /**
   * Concatenates the operands, separating two adjacent operands with a
   * space when neither of them is a {@link String}.
   */
  static String sprint(final Object... args) {
    final StringBuilder sb = new StringBuilder();
    for (int i = 0; i < args.length; i++) {
      if (i > 0 && !(args[i - 1] instanceof String) && !(args[i] instanceof String)) {
        sb.append(' ');
      }
      sb.append(args[i]);
    }
    return sb.toString();
  }

  /**
   * Separates all operands with a space and appends a newline.
   */
  static String sprintln(final Object... args) {
    final StringBuilder sb = new StringBuilder();
    for (int i = 0; i < args.length; i++) {
      if (i > 0) {
        sb.append(' ');
      }
      sb.append(args[i]);
    }
    return sb.append('\n').toString();
  }

  /**
   * Formats like {@link String#format(String, Object...)}. A malformed
   * pattern yields the pattern followed by the operands instead of an
   * exception.
   */
  static String sprintf(/* @Nullable */ final String format, final Object... args) {
    if (format == null) {
      return sprint(args);
    }
    try {
      return String.format(format, args);
    } catch (final IllegalFormatException e) {
      return format + " %!(" + e.getClass().getSimpleName() + ") " + Arrays.deepToString(args);
    }
  }

  /**
   * Reports a failure of the logging machinery itself. Never throws.
   */
  static void printFailure(final PrintStream stderr, final String what, final Throwable t) {
    stderr.println("driverlog: " + what + ": " + t);
    stderr.flush();
  }
}
