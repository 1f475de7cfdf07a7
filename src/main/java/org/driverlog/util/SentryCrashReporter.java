// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog.util;

import io.sentry.Sentry;
import io.sentry.SentryLevel;
import java.util.Objects;
import org.driverlog.CrashReporter;

/**
 * Sends crash reports to Sentry through the process-wide Sentry client.
 *
 * <p>The client must be set up by the application with
 * {@code Sentry.init(...)}. Until then Sentry drops the messages.</p>
 */
public class SentryCrashReporter implements CrashReporter {
  private final SentryLevel level;

  /**
   * Reports messages as {@link SentryLevel#ERROR} events.
   */
  public SentryCrashReporter() {
    this(SentryLevel.ERROR);
  }

  /**
   * @param level the level of the Sentry events.
   */
  public SentryCrashReporter(final SentryLevel level) {
    this.level = Objects.requireNonNull(level, "level");
  }

  public SentryLevel level() {
    return level;
  }

  @Override
  public void captureMessage(final String message) {
    Sentry.captureMessage(message, level);
  }
}
