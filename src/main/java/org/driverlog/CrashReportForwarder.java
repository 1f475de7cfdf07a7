// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

import java.io.PrintStream;

/**
 * Forwards formatted error messages to the configured {@link CrashReporter}.
 *
 * <p>Immutable: reconfiguring creates a new forwarder.</p>
 */
final class CrashReportForwarder {
  static final String PLAIN_ERROR_MARKER = "[ERROR]";

  private final PrintStream stderr;
  private final String namePrefix;
  private final boolean enabled;
  /* @Nullable */ private final CrashReporter crashReporter;

  CrashReportForwarder(final PrintStream stderr, /* @Nullable */ final String namePrefix,
      final boolean enabled, /* @Nullable */ final CrashReporter crashReporter) {
    this.stderr = stderr;
    this.namePrefix = namePrefix == null ? "" : namePrefix;
    this.enabled = enabled;
    this.crashReporter = crashReporter;
  }

  CrashReportForwarder configure(/* @Nullable */ final String namePrefix,
      final boolean enabled) {
    return new CrashReportForwarder(stderr, namePrefix, enabled, crashReporter);
  }

  CrashReportForwarder withCrashReporter(/* @Nullable */ final CrashReporter crashReporter) {
    return new CrashReportForwarder(stderr, namePrefix, enabled, crashReporter);
  }

  /**
   * Sends {@code namePrefix + body} where body is the formatted message
   * without its leading error marker.
   *
   * @param logLevel the level of the message.
   * @param formatted the output of the {@link LogFormatter}.
   */
  void forward(final LogLevel logLevel, final String formatted) {
    if (!logLevel.isAtLeast(LogLevel.ERROR_LEVEL) || !enabled || crashReporter == null) {
      return;
    }
    try {
      crashReporter.captureMessage(namePrefix + stripMarker(formatted));
    } catch (final RuntimeException e) {
      Messages.printFailure(stderr, "crash report forwarding failed", e);
    }
  }

  static String stripMarker(final String formatted) {
    if (formatted.startsWith(LogFormatter.ERROR_MARKER)) {
      return formatted.substring(LogFormatter.ERROR_MARKER.length());
    }
    if (formatted.startsWith(PLAIN_ERROR_MARKER)) {
      return formatted.substring(PLAIN_ERROR_MARKER.length());
    }
    // formatter emitted no marker, forward it whole
    return formatted;
  }
}
