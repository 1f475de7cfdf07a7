// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog.util;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.driverlog.LogSink;
import org.driverlog.LogSinkFactory;

/**
 * A {@link LogSinkFactory} backed by a fixed map of categories to sinks,
 * with an optional sink for all other categories.
 *
 * <pre>{@code
 * final CategorySinkFactory factory = new CategorySinkFactory()
 *     .setSink(LogSinkFactory.ERROR_CATEGORY, new PrintStreamLogSink(errorStream))
 *     .setDefaultSink(new PrintStreamLogSink(System.out));
 * }</pre>
 */
public class CategorySinkFactory implements LogSinkFactory {
  private final Map<String, LogSink> sinks = new HashMap<>();
  /* @Nullable */ private LogSink defaultSink;

  /**
   * Route a category to a sink.
   *
   * @param category the category.
   * @param sink the sink.
   *
   * @return the reference to the current factory.
   */
  public synchronized CategorySinkFactory setSink(final String category, final LogSink sink) {
    sinks.put(Objects.requireNonNull(category, "category"),
        Objects.requireNonNull(sink, "sink"));
    return this;
  }

  /**
   * Sink for categories without a sink of their own.
   *
   * @param defaultSink the sink, or null to let those categories fall
   *     back to standard output.
   *
   * @return the reference to the current factory.
   */
  public synchronized CategorySinkFactory setDefaultSink(
      /* @Nullable */ final LogSink defaultSink) {
    this.defaultSink = defaultSink;
    return this;
  }

  public synchronized Map<String, LogSink> sinks() {
    return Collections.unmodifiableMap(new HashMap<>(sinks));
  }

  @Override
  public synchronized /* @Nullable */ LogSink sinkFor(final String category) {
    final LogSink sink = sinks.get(category);
    return sink != null ? sink : defaultSink;
  }
}
