// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

/**
 * Client of an external error tracking service which receives
 * error and fatal messages for alerting.
 *
 * <p>The logger never configures the client, it only hands over
 * messages. Calls are fire-and-forget: an exception thrown here is
 * reported on standard error and otherwise ignored.</p>
 */
public interface CrashReporter {
  /**
   * Send a message to the error tracking service.
   *
   * @param message the message, prefixed with the configured name prefix.
   */
  void captureMessage(final String message);
}
