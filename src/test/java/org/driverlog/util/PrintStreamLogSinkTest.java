// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import org.driverlog.SinkWriteException;
import org.junit.Test;

public class PrintStreamLogSinkTest {

  @Test
  public void writesOneLinePerMessage() throws Exception {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final PrintStreamLogSink sink =
        new PrintStreamLogSink(new PrintStream(bytes, false, "UTF-8"), "[db] ");
    sink.output(2, "opened");
    sink.output(2, "closed\n");

    assertThat(bytes.toString("UTF-8")).isEqualTo("[db] opened\n[db] closed\n");
  }

  @Test
  public void withoutPrefix() throws Exception {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    new PrintStreamLogSink(new PrintStream(bytes, false, "UTF-8")).output(2, "x");

    assertThat(bytes.toString("UTF-8")).isEqualTo("x\n");
  }

  @Test(expected = SinkWriteException.class)
  public void failsWhenStreamFails() throws Exception {
    final OutputStream broken = new OutputStream() {
      @Override
      public void write(final int b) throws IOException {
        throw new IOException("broken pipe");
      }
    };
    new PrintStreamLogSink(new PrintStream(broken)).output(2, "lost");
  }

  @Test
  public void standardStreamFactories() {
    assertThat(PrintStreamLogSink.stdout("[out] ")).isNotNull();
    assertThat(PrintStreamLogSink.stderr(null)).isNotNull();
  }

  @Test(expected = NullPointerException.class)
  public void requiresStream() {
    new PrintStreamLogSink(null);
  }
}
