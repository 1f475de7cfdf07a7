// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

/**
 * This module is the logging facade of the driver.
 * <p>
 * {@link org.driverlog.DriverLogger} filters log calls by level, renders them
 * with a {@link org.driverlog.LogFormatter}, routes them to a
 * {@link org.driverlog.LogSink} and forwards errors to a
 * {@link org.driverlog.CrashReporter}.
 * </p>
 */
package org.driverlog;
