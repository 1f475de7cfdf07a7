// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

import java.io.IOException;

/**
 * A SinkWriteException is thrown by a {@link LogSink} when the
 * underlying destination rejected a message.
 */
public class SinkWriteException extends IOException {
  private static final long serialVersionUID = 4021785530281761843L;

  /**
   * Constructs a SinkWriteException.
   *
   * @param message the detail message.
   */
  public SinkWriteException(final String message) {
    super(message);
  }
}
