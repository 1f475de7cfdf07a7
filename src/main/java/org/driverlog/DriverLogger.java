// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * <p>Logging facade of the driver.</p>
 *
 * <p>Each call is checked against the configured level, rendered by the
 * {@link LogFormatter}, forwarded to the {@link CrashReporter} when it is an
 * error, and finally written to the {@link LogSink} resolved for its category
 * or, if there is none, to standard output.</p>
 *
 * <p>Logging never fails: errors of sinks and crash reporters are reported
 * on standard error and otherwise ignored.</p>
 *
 * <p>Components of the driver either receive a logger explicitly or use the
 * process-wide instance returned by {@link #global()}. The configuration
 * methods may be called at any time in {@link LockingMode#STRICT} mode, also
 * from a formatter, sink or crash reporter. A log call uses the configuration
 * it read when it started. In {@link LockingMode#RELAXED} mode they must only
 * be called once, before any thread logs.</p>
 */
public final class DriverLogger {
  /**
   * Call depth handed to the {@link LogFormatter}: the formatter, the
   * internal write and dispatch methods, and the public logging method.
   */
  static final int FORMATTER_CALL_DEPTH = 4;

  /**
   * Call depth handed to a {@link LogSink}.
   */
  static final int SINK_CALL_DEPTH = 2;

  private enum Rendering {
    PRINT,
    PRINTLN,
    FORMAT
  }

  /* @Nullable */ private static volatile DriverLogger global;

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final LockingMode lockingMode;
  private final PrintStream stdout;
  private final PrintStream stderr;
  private final BacktraceReporter backtraceReporter;

  private SinkRegistry sinks;
  private CrashReportForwarder crashReports;

  private LogLevel logLevel;
  private boolean debug;
  /* @Nullable */ private LogFormatter formatter;

  /**
   * Construct a logger with default options: everything but debug
   * messages printed unformatted to {@link System#out}.
   */
  public DriverLogger() {
    this(new LogOptions());
  }

  /**
   * Construct a logger.
   *
   * @param options the configuration, copied.
   */
  public DriverLogger(final LogOptions options) {
    this.lockingMode = options.lockingMode();
    this.stdout = options.stdout();
    this.stderr = options.stderr();
    this.crashReports = new CrashReportForwarder(stderr, options.namePrefix(),
        options.crashReporting(), options.crashReporter());
    this.sinks = new SinkRegistry(options.logger(), options.loggerFactory());
    this.logLevel = options.logLevel();
    this.debug = options.debug();
    this.formatter = options.formatter();
    this.backtraceReporter = new BacktraceReporter(this, stderr);
  }

  /**
   * The process-wide logger, created with default options on first use.
   *
   * @return the process-wide logger.
   */
  public static DriverLogger global() {
    DriverLogger logger = global;
    if (logger == null) {
      synchronized (DriverLogger.class) {
        logger = global;
        if (logger == null) {
          logger = new DriverLogger();
          global = logger;
        }
      }
    }
    return logger;
  }

  /**
   * Set the sink which receives all messages regardless of their category.
   *
   * @param logger the sink, or null to resolve sinks by category again.
   */
  public void setLogger(/* @Nullable */ final LogSink logger) {
    beginWrite();
    try {
      sinks = sinks.withSink(logger);
    } finally {
      endWrite();
    }
  }

  /**
   * Configure the logger.
   *
   * @param namePrefix put in front of messages sent to the crash reporter,
   *     null is the same as empty.
   * @param crashReporting whether error messages are sent to the crash reporter.
   * @param logLevel minimum level of info messages.
   * @param loggerFactory resolves the sink of the {@code "error"} category, or null.
   * @param formatter renders messages, or null to print them as-is.
   */
  public void setLoggerFunc(final String namePrefix, final boolean crashReporting,
      final LogLevel logLevel, /* @Nullable */ final LogSinkFactory loggerFactory,
      /* @Nullable */ final LogFormatter formatter) {
    Objects.requireNonNull(logLevel, "logLevel");
    beginWrite();
    try {
      crashReports = crashReports.configure(namePrefix, crashReporting);
      sinks = sinks.withSinkFactory(loggerFactory);
      this.logLevel = logLevel;
      this.formatter = formatter;
    } finally {
      endWrite();
    }
  }

  /**
   * Enable or disable the delivery of debug messages.
   *
   * @param debug true to deliver debug messages.
   */
  public void setDebug(final boolean debug) {
    beginWrite();
    try {
      this.debug = debug;
    } finally {
      endWrite();
    }
  }

  /**
   * Set the client of the error tracking service.
   *
   * @param crashReporter the client, or null.
   */
  public void setCrashReporter(/* @Nullable */ final CrashReporter crashReporter) {
    beginWrite();
    try {
      crashReports = crashReports.withCrashReporter(crashReporter);
    } finally {
      endWrite();
    }
  }

  public LogLevel logLevel() {
    beginRead();
    try {
      return logLevel;
    } finally {
      endRead();
    }
  }

  public boolean isDebugEnabled() {
    beginRead();
    try {
      return debug;
    } finally {
      endRead();
    }
  }

  public LockingMode lockingMode() {
    return lockingMode;
  }

  /**
   * Reporter of crashed worker threads which logs through this logger.
   *
   * @return the backtrace reporter.
   */
  public BacktraceReporter backtraceReporter() {
    return backtraceReporter;
  }

  public void log(final Object... args) {
    emit(LogLevel.INFO_LEVEL, LogSinkFactory.DEFAULT_CATEGORY, Rendering.PRINT, null, args);
  }

  public void logln(final Object... args) {
    emit(LogLevel.INFO_LEVEL, LogSinkFactory.DEFAULT_CATEGORY, Rendering.PRINTLN, null, args);
  }

  public void logf(final String format, final Object... args) {
    emit(LogLevel.INFO_LEVEL, LogSinkFactory.DEFAULT_CATEGORY, Rendering.FORMAT, format, args);
  }

  /**
   * Log a debug message. Messages longer than 256 code points are dropped.
   *
   * @param args the operands of the message.
   */
  public void debug(final Object... args) {
    emit(LogLevel.DEBUG_LEVEL, LogSinkFactory.DEFAULT_CATEGORY, Rendering.PRINT, null, args);
  }

  public void debugln(final Object... args) {
    emit(LogLevel.DEBUG_LEVEL, LogSinkFactory.DEFAULT_CATEGORY, Rendering.PRINTLN, null, args);
  }

  public void debugf(final String format, final Object... args) {
    emit(LogLevel.DEBUG_LEVEL, LogSinkFactory.DEFAULT_CATEGORY, Rendering.FORMAT, format, args);
  }

  /**
   * Log an error message. Error messages are never filtered by level.
   *
   * @param args the operands of the message.
   */
  public void errorln(final Object... args) {
    emit(LogLevel.ERROR_LEVEL, LogSinkFactory.ERROR_CATEGORY, Rendering.PRINTLN, null, args);
  }

  public void errorf(final String format, final Object... args) {
    emit(LogLevel.ERROR_LEVEL, LogSinkFactory.ERROR_CATEGORY, Rendering.FORMAT, format, args);
  }

  /**
   * Report that a worker is exiting, with the stack trace of the
   * current thread. See {@link BacktraceReporter#reportCrash(String)}.
   *
   * @param workerName the name of the exiting worker.
   */
  public void reportCrash(final String workerName) {
    backtraceReporter.reportCrash(workerName);
  }

  // Public methods call emit, emit calls write and write calls the
  // formatter: FORMATTER_CALL_DEPTH depends on this nesting.
  // The lock is only held while the configuration is read, callbacks may
  // reconfigure this logger.
  private void emit(final LogLevel level, final String category, final Rendering rendering,
      /* @Nullable */ final String format, final Object[] args) {
    final LogFormatter formatter;
    final SinkRegistry sinks;
    final CrashReportForwarder crashReports;
    beginRead();
    try {
      if (!LevelGate.shouldEmit(level, logLevel, debug)) {
        return;
      }
      formatter = this.formatter;
      sinks = this.sinks;
      crashReports = this.crashReports;
    } finally {
      endRead();
    }

    final String content = render(rendering, format, args);
    if (level == LogLevel.DEBUG_LEVEL && !LevelGate.withinDebugLimit(content)) {
      return;
    }
    write(level, category, content, formatter, sinks, crashReports);
  }

  private void write(final LogLevel level, final String category, final String content,
      /* @Nullable */ final LogFormatter formatter, final SinkRegistry sinks,
      final CrashReportForwarder crashReports) {
    if (formatter == null) {
      printLine(content);
      return;
    }

    final String formatted;
    try {
      formatted = formatter.format(level, FORMATTER_CALL_DEPTH, "%s", content);
    } catch (final RuntimeException e) {
      Messages.printFailure(stderr, "log formatter failed", e);
      printLine(content);
      return;
    }

    crashReports.forward(level, formatted);

    final LogSink sink;
    try {
      sink = sinks.resolve(category);
    } catch (final RuntimeException e) {
      Messages.printFailure(stderr, "log sink factory failed for category '" + category + "'", e);
      printLine(formatted);
      return;
    }
    if (sink == null) {
      printLine(formatted);
      return;
    }

    try {
      sink.output(SINK_CALL_DEPTH, formatted);
    } catch (final IOException | RuntimeException e) {
      Messages.printFailure(stderr, "failed to write log message", e);
    }
  }

  private void printLine(final String line) {
    stdout.print(line + '\n');
    stdout.flush();
  }

  private static String render(final Rendering rendering, /* @Nullable */ final String format,
      /* @Nullable */ final Object[] args) {
    // log((Object[]) null) logs a single null operand
    final Object[] operands = args == null ? new Object[] {null} : args;
    switch (rendering) {
      case PRINT:
        return Messages.sprint(operands);
      case PRINTLN:
        return Messages.sprintln(operands);
      case FORMAT:
        return Messages.sprintf(format, operands);
      default:
        throw new IllegalArgumentException("Unknown rendering: " + rendering);
    }
  }

  private void beginRead() {
    if (lockingMode == LockingMode.STRICT) {
      lock.readLock().lock();
    }
  }

  private void endRead() {
    if (lockingMode == LockingMode.STRICT) {
      lock.readLock().unlock();
    }
  }

  private void beginWrite() {
    if (lockingMode == LockingMode.STRICT) {
      lock.writeLock().lock();
    }
  }

  private void endWrite() {
    if (lockingMode == LockingMode.STRICT) {
      lock.writeLock().unlock();
    }
  }
}
