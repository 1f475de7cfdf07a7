// Copyright (c) 2011-present, Facebook, Inc.  All rights reserved.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.driverlog;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

public class LevelGateTest {

  @Test
  public void infoEmittedIffLevelReachesThreshold() {
    for (final LogLevel threshold : LogLevel.values()) {
      assertThat(LevelGate.shouldEmit(LogLevel.INFO_LEVEL, threshold, false))
          .as("threshold %s", threshold)
          .isEqualTo(threshold.getValue() <= LogLevel.INFO_LEVEL.getValue());
    }
  }

  @Test
  public void errorsAreNeverGated() {
    for (final LogLevel threshold : LogLevel.values()) {
      assertThat(LevelGate.shouldEmit(LogLevel.ERROR_LEVEL, threshold, false)).isTrue();
      assertThat(LevelGate.shouldEmit(LogLevel.FATAL_LEVEL, threshold, false)).isTrue();
    }
  }

  @Test
  public void debugNeedsDebugEnabled() {
    assertThat(LevelGate.shouldEmit(LogLevel.DEBUG_LEVEL, LogLevel.DEBUG_LEVEL, true)).isTrue();
    assertThat(LevelGate.shouldEmit(LogLevel.DEBUG_LEVEL, LogLevel.DEBUG_LEVEL, false)).isFalse();
    assertThat(LevelGate.shouldEmit(LogLevel.DEBUG_LEVEL, LogLevel.INFO_LEVEL, true)).isFalse();
  }

  @Test
  public void debugLimitCountsCodePoints() {
    final StringBuilder limit = new StringBuilder();
    for (int i = 0; i < LevelGate.MAX_DEBUG_OUTPUT; i++) {
      // one code point, two chars
      limit.append("\uD83D\uDE00");
    }
    assertThat(LevelGate.withinDebugLimit(limit.toString())).isTrue();
    assertThat(LevelGate.withinDebugLimit(limit.append('x').toString())).isFalse();
  }
}
