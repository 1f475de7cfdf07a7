// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

public class DriverLoggerConcurrencyTest {
  private static final int THREADS = 8;
  private static final int MESSAGES_PER_THREAD = 1000;

  @Rule
  public final CapturedStreamsResource streams = new CapturedStreamsResource();

  private ExecutorService executor;

  @Before
  public void beforeTest() {
    executor = Executors.newFixedThreadPool(THREADS + 1);
  }

  @After
  public void afterTest() throws InterruptedException {
    executor.shutdownNow();
    executor.awaitTermination(10, TimeUnit.SECONDS);
  }

  @Test
  public void logWhileReconfiguring() throws Exception {
    final RecordingLogSink sink = new RecordingLogSink();
    final RecordingLogSink errorSink = new RecordingLogSink();
    final LogFormatter formatter = (logLevel, callDepth, format, args) ->
        String.format(format, args);
    final DriverLogger logger = new DriverLogger(streams.options()
        .setLoggerFactory(category -> errorSink)
        .setFormatter(formatter));

    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<?>> loggers = new ArrayList<>();
    for (int t = 0; t < THREADS; t++) {
      final int thread = t;
      loggers.add(executor.submit(() -> {
        start.await();
        for (int i = 0; i < MESSAGES_PER_THREAD; i++) {
          logger.logf("thread %d message %d", thread, i);
          logger.debug("debug ", i);
        }
        return null;
      }));
    }
    final Future<?> configurer = executor.submit(() -> {
      start.await();
      for (int i = 0; i < 200; i++) {
        logger.setDebug(i % 2 == 0);
        logger.setLogger(sink);
        logger.setLoggerFunc("", false, LogLevel.DEBUG_LEVEL, category -> errorSink, formatter);
      }
      return null;
    });

    start.countDown();
    for (final Future<?> future : loggers) {
      future.get(30, TimeUnit.SECONDS);
    }
    configurer.get(30, TimeUnit.SECONDS);

    // info messages logged before the sink was set went to stdout
    final long infoInSink = sink.messages().stream().filter(m -> m.startsWith("thread")).count();
    final long infoOnStdout = streams.stdoutText().lines()
        .filter(m -> m.startsWith("thread")).count();
    assertThat(infoInSink + infoOnStdout).isEqualTo((long) THREADS * MESSAGES_PER_THREAD);
    assertThat(errorSink.messages()).isEmpty();
    assertThat(streams.stderrText()).isEmpty();
  }
}
