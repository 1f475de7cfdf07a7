// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog.util;

import java.io.PrintStream;
import java.util.Objects;
import org.driverlog.LogSink;
import org.driverlog.SinkWriteException;

/**
 * Simply writes all log messages to a {@link PrintStream}, one per line.
 */
public class PrintStreamLogSink implements LogSink {
  private final PrintStream stream;
  private final String logPrefix;

  /**
   * Constructs a new PrintStreamLogSink.
   *
   * @param stream the stream to write to.
   */
  public PrintStreamLogSink(final PrintStream stream) {
    this(stream, null);
  }

  /**
   * Constructs a new PrintStreamLogSink.
   *
   * @param stream the stream to write to.
   * @param logPrefix the string with which to prefix all log messages.
   */
  public PrintStreamLogSink(final PrintStream stream, /* @Nullable */ final String logPrefix) {
    this.stream = Objects.requireNonNull(stream, "stream");
    this.logPrefix = logPrefix == null ? "" : logPrefix;
  }

  public static PrintStreamLogSink stdout(/* @Nullable */ final String logPrefix) {
    return new PrintStreamLogSink(System.out, logPrefix);
  }

  public static PrintStreamLogSink stderr(/* @Nullable */ final String logPrefix) {
    return new PrintStreamLogSink(System.err, logPrefix);
  }

  /**
   * @throws SinkWriteException if the stream is in an error state after
   *     the write. {@link PrintStream} keeps the state, so every later
   *     write fails too.
   */
  @Override
  public void output(final int callDepth, final String message) throws SinkWriteException {
    stream.print(LogLines.terminate(logPrefix + message));
    stream.flush();
    if (stream.checkError()) {
      throw new SinkWriteException("Failed to write to print stream");
    }
  }
}
