// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

import java.io.IOException;

/**
 * LogSink is a thin interface that specifies the most basic
 * functionality of a log destination: a console, a file or
 * a log aggregator.
 *
 * <p>Implementations receive fully rendered messages and must be
 * safe to call from several threads at once.</p>
 */
public interface LogSink {
  /**
   * Write a rendered log message.
   *
   * @param callDepth the number of stack frames between the logging
   *     call of the application and this method. Sinks which report the
   *     location of the caller use it to find the originating frame.
   * @param message the rendered message.
   *
   * @throws IOException if the message could not be written.
   */
  void output(final int callDepth, final String message) throws IOException;
}
