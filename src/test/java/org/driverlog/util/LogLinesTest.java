// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

public class LogLinesTest {
  @Test
  public void terminate() {
    assertThat(LogLines.terminate("a")).isEqualTo("a\n");
    assertThat(LogLines.terminate("a\n")).isEqualTo("a\n");
    assertThat(LogLines.terminate("")).isEqualTo("\n");
  }
}
