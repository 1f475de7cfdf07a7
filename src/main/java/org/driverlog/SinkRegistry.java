// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

/**
 * Immutable pair of the configured sink and sink factory which resolves
 * the sink for a message category.
 *
 * <p>Reconfiguring creates a new registry, so a log call keeps using the
 * registry it started with.</p>
 */
final class SinkRegistry {
  /* @Nullable */ private final LogSink sink;
  /* @Nullable */ private final LogSinkFactory sinkFactory;

  SinkRegistry(/* @Nullable */ final LogSink sink,
      /* @Nullable */ final LogSinkFactory sinkFactory) {
    this.sink = sink;
    this.sinkFactory = sinkFactory;
  }

  SinkRegistry withSink(/* @Nullable */ final LogSink sink) {
    return new SinkRegistry(sink, sinkFactory);
  }

  SinkRegistry withSinkFactory(/* @Nullable */ final LogSinkFactory sinkFactory) {
    return new SinkRegistry(sink, sinkFactory);
  }

  /**
   * An explicit sink wins for every category. Otherwise the factory is
   * asked for non-empty categories.
   *
   * @param category the message category.
   *
   * @return the sink, or null when the message goes to standard output.
   *
   * @throws RuntimeException whatever the factory throws.
   */
  /* @Nullable */ LogSink resolve(final String category) {
    if (sink != null) {
      return sink;
    }
    if (!category.isEmpty() && sinkFactory != null) {
      return sinkFactory.sinkFor(category);
    }
    return null;
  }
}
