// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Options to construct a {@link DriverLogger} with.
 *
 * <p>All setters return {@code this} so options can be chained:</p>
 * <pre>{@code
 * final DriverLogger logger = new DriverLogger(new LogOptions()
 *     .setLogLevel(LogLevel.INFO_LEVEL)
 *     .setNamePrefix("[shard-3] ")
 *     .setFormatter(new AnsiLevelFormatter(true)));
 * }</pre>
 *
 * <p>The options are copied when the logger is constructed, changing
 * them afterwards has no effect on the logger.</p>
 */
public class LogOptions {
  private LogLevel logLevel = LogLevel.DEBUG_LEVEL;
  private boolean debug;
  private String namePrefix = "";
  private boolean crashReporting;
  /* @Nullable */ private LogSink logger;
  /* @Nullable */ private LogSinkFactory loggerFactory;
  /* @Nullable */ private LogFormatter formatter;
  /* @Nullable */ private CrashReporter crashReporter;
  private PrintStream stdout = System.out;
  private PrintStream stderr = System.err;
  private LockingMode lockingMode = LockingMode.STRICT;

  /**
   * Minimum level of info messages. Error messages are emitted
   * regardless of this level.
   *
   * @param logLevel the threshold, {@link LogLevel#DEBUG_LEVEL} by default.
   *
   * @return the reference to the current options.
   */
  public LogOptions setLogLevel(final LogLevel logLevel) {
    this.logLevel = Objects.requireNonNull(logLevel, "logLevel");
    return this;
  }

  public LogLevel logLevel() {
    return logLevel;
  }

  /**
   * Whether debug messages are emitted at all. Disabled by default.
   *
   * @param debug true to enable debug messages.
   *
   * @return the reference to the current options.
   */
  public LogOptions setDebug(final boolean debug) {
    this.debug = debug;
    return this;
  }

  public boolean debug() {
    return debug;
  }

  /**
   * String put in front of every message sent to the crash reporter,
   * usually the name of the server or service.
   *
   * @param namePrefix the prefix, empty by default. Null is the same as empty.
   *
   * @return the reference to the current options.
   */
  public LogOptions setNamePrefix(/* @Nullable */ final String namePrefix) {
    this.namePrefix = namePrefix == null ? "" : namePrefix;
    return this;
  }

  public String namePrefix() {
    return namePrefix;
  }

  public LogOptions setCrashReporting(final boolean crashReporting) {
    this.crashReporting = crashReporting;
    return this;
  }

  public boolean crashReporting() {
    return crashReporting;
  }

  /**
   * Sink for all messages, taking precedence over
   * {@link #setLoggerFactory(LogSinkFactory)}.
   *
   * @param logger the sink, or null.
   *
   * @return the reference to the current options.
   */
  public LogOptions setLogger(/* @Nullable */ final LogSink logger) {
    this.logger = logger;
    return this;
  }

  /* @Nullable */
  public LogSink logger() {
    return logger;
  }

  public LogOptions setLoggerFactory(/* @Nullable */ final LogSinkFactory loggerFactory) {
    this.loggerFactory = loggerFactory;
    return this;
  }

  /* @Nullable */
  public LogSinkFactory loggerFactory() {
    return loggerFactory;
  }

  /**
   * Formatter for all messages. Without a formatter messages are printed
   * as-is to standard output, and neither sinks nor the crash reporter
   * are used.
   *
   * @param formatter the formatter, or null.
   *
   * @return the reference to the current options.
   */
  public LogOptions setFormatter(/* @Nullable */ final LogFormatter formatter) {
    this.formatter = formatter;
    return this;
  }

  /* @Nullable */
  public LogFormatter formatter() {
    return formatter;
  }

  public LogOptions setCrashReporter(/* @Nullable */ final CrashReporter crashReporter) {
    this.crashReporter = crashReporter;
    return this;
  }

  /* @Nullable */
  public CrashReporter crashReporter() {
    return crashReporter;
  }

  /**
   * Stream used when no sink handles a message.
   *
   * @param stdout the stream, {@link System#out} by default.
   *
   * @return the reference to the current options.
   */
  public LogOptions setStdout(final PrintStream stdout) {
    this.stdout = Objects.requireNonNull(stdout, "stdout");
    return this;
  }

  public PrintStream stdout() {
    return stdout;
  }

  /**
   * Stream for crash backtraces and failures of the logging machinery.
   *
   * @param stderr the stream, {@link System#err} by default.
   *
   * @return the reference to the current options.
   */
  public LogOptions setStderr(final PrintStream stderr) {
    this.stderr = Objects.requireNonNull(stderr, "stderr");
    return this;
  }

  public PrintStream stderr() {
    return stderr;
  }

  public LogOptions setLockingMode(final LockingMode lockingMode) {
    this.lockingMode = Objects.requireNonNull(lockingMode, "lockingMode");
    return this;
  }

  public LockingMode lockingMode() {
    return lockingMode;
  }
}
