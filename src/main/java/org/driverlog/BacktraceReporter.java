// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <p>Reports worker threads of the driver which exit abnormally.</p>
 *
 * <p>A report is an error message naming the worker followed by a stack
 * trace. The stack trace is always written straight to standard error,
 * independently of the logger configuration, and then logged as an error
 * so that it also reaches the configured sink and crash reporter.</p>
 *
 * <p>The reporter can be installed as the {@link Thread.UncaughtExceptionHandler}
 * of worker threads, either directly or through {@link #newThreadFactory(String)},
 * or wrap individual tasks with {@link #wrap(String, Runnable)}.</p>
 */
public class BacktraceReporter implements Thread.UncaughtExceptionHandler {
  private final DriverLogger logger;
  private final PrintStream stderr;

  /**
   * Constructs a BacktraceReporter.
   *
   * @param logger the logger error messages are sent to.
   * @param stderr the stream stack traces are written to.
   */
  public BacktraceReporter(final DriverLogger logger, final PrintStream stderr) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.stderr = Objects.requireNonNull(stderr, "stderr");
  }

  /**
   * Report that a worker is exiting, with the stack trace of the
   * calling thread.
   *
   * @param workerName the name of the worker.
   */
  public void reportCrash(final String workerName) {
    report(workerName, currentThreadStack());
  }

  /**
   * Report that a worker is exiting because of {@code cause}.
   *
   * @param workerName the name of the worker.
   * @param cause the error which ended the worker.
   */
  public void reportCrash(final String workerName, final Throwable cause) {
    final StringWriter trace = new StringWriter();
    try (final PrintWriter writer = new PrintWriter(trace)) {
      cause.printStackTrace(writer);
    }
    report(workerName, trace.toString());
  }

  @Override
  public void uncaughtException(final Thread thread, final Throwable cause) {
    reportCrash(thread.getName(), cause);
  }

  /**
   * Wrap a task so that a failure of the task is reported before it
   * propagates.
   *
   * @param workerName the name reported for the task.
   * @param task the task.
   *
   * @return the wrapped task.
   */
  public Runnable wrap(final String workerName, final Runnable task) {
    Objects.requireNonNull(task, "task");
    return () -> {
      try {
        task.run();
      } catch (final RuntimeException | Error e) {
        reportCrash(workerName, e);
        throw e;
      }
    };
  }

  /**
   * Thread factory naming its threads {@code prefix-N} and installing this
   * reporter as their uncaught exception handler.
   *
   * @param prefix the thread name prefix.
   *
   * @return the thread factory.
   */
  public ThreadFactory newThreadFactory(final String prefix) {
    final String threadPrefix = (prefix == null || prefix.isEmpty()) ? "driver-worker" : prefix;
    final AtomicInteger index = new AtomicInteger();
    return runnable -> {
      final Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(this);
      return thread;
    };
  }

  private void report(final String workerName, final String trace) {
    logger.errorf("worker[%s] is exiting...\n", workerName);
    stderr.print(trace);
    stderr.flush();
    logger.errorln(trace);
  }

  static String currentThreadStack() {
    final Thread thread = Thread.currentThread();
    final StackTraceElement[] frames = thread.getStackTrace();
    final StringBuilder sb = new StringBuilder();
    sb.append("thread \"").append(thread.getName()).append("\" [")
        .append(thread.getState()).append("]:\n");
    // frames[0] is Thread.getStackTrace itself
    for (int i = 1; i < frames.length; i++) {
      sb.append("\tat ").append(frames[i]).append('\n');
    }
    return sb.toString();
  }
}
