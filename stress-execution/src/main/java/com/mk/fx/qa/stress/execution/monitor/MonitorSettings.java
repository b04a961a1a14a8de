package com.mk.fx.qa.stress.execution.monitor;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of a {@link MonitorLoop}.
 *
 * @param interval pause between ticks
 * @param warmup settle delay after the first telemetry refresh
 * @param core core to pin the monitor thread to, {@code null} to leave it unpinned
 * @param errorHistorySize how many surfaced error records to keep
 * @param topOffenders how many offenders each snapshot carries
 */
public record MonitorSettings(
    Duration interval, Duration warmup, Integer core, int errorHistorySize, int topOffenders) {

  public static final int DEFAULT_TOP_OFFENDERS = 5;

  public MonitorSettings {
    Objects.requireNonNull(interval, "interval");
    Objects.requireNonNull(warmup, "warmup");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("Monitor interval must be positive: " + interval);
    }
    if (warmup.isNegative()) {
      throw new IllegalArgumentException("Monitor warm-up must not be negative: " + warmup);
    }
    errorHistorySize = Math.max(1, errorHistorySize);
    topOffenders = Math.max(0, topOffenders);
  }
}
