// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Before;
import org.junit.Test;

public class SinkRegistryTest {
  private RecordingLogSink errorSink;

  @Before
  public void beforeTest() {
    errorSink = new RecordingLogSink();
  }

  @Test
  public void nothingConfigured() {
    final SinkRegistry registry = new SinkRegistry(null, null);
    assertThat(registry.resolve(LogSinkFactory.DEFAULT_CATEGORY)).isNull();
    assertThat(registry.resolve(LogSinkFactory.ERROR_CATEGORY)).isNull();
  }

  @Test
  public void factoryIsAskedForNonEmptyCategoriesOnly() {
    final SinkRegistry registry = new SinkRegistry(null, category -> errorSink);
    assertThat(registry.resolve(LogSinkFactory.ERROR_CATEGORY)).isSameAs(errorSink);
    assertThat(registry.resolve(LogSinkFactory.DEFAULT_CATEGORY)).isNull();
  }

  @Test
  public void explicitSinkWinsForEveryCategory() {
    final RecordingLogSink sink = new RecordingLogSink();
    final SinkRegistry registry = new SinkRegistry(null, category -> errorSink).withSink(sink);
    assertThat(registry.resolve(LogSinkFactory.DEFAULT_CATEGORY)).isSameAs(sink);
    assertThat(registry.resolve(LogSinkFactory.ERROR_CATEGORY)).isSameAs(sink);
    assertThat(registry.resolve("audit")).isSameAs(sink);
  }

  @Test
  public void reconfiguringLeavesOriginalUnchanged() {
    final SinkRegistry original = new SinkRegistry(null, category -> errorSink);
    final SinkRegistry changed = original.withSinkFactory(null);
    assertThat(original.resolve(LogSinkFactory.ERROR_CATEGORY)).isSameAs(errorSink);
    assertThat(changed.resolve(LogSinkFactory.ERROR_CATEGORY)).isNull();
  }

  @Test
  public void factoryReturningNull() {
    final SinkRegistry registry = new SinkRegistry(null, category -> null);
    assertThat(registry.resolve(LogSinkFactory.ERROR_CATEGORY)).isNull();
  }
}
