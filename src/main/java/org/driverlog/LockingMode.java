// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

/**
 * How a {@link DriverLogger} guards its configuration against
 * concurrent access.
 */
public enum LockingMode {
  /**
   * Configuration changes take a write lock, log calls a read lock.
   */
  STRICT,

  /**
   * No locking. Only valid when the logger is configured once, before
   * any thread starts logging.
   */
  RELAXED
}
