package com.mk.fx.qa.stress.execution.metrics;

import java.time.Instant;

/** One row of the ranked error view. */
public record OffenderEntry(
    String key, int consecutive, long total, Instant lastAt, String lastMessage) {

  static OffenderEntry of(FailureKey key, FailureCounters counters) {
    return new OffenderEntry(
        key.toString(),
        counters.consecutiveFailures(),
        counters.totalFailures(),
        counters.lastFailureAt(),
        counters.lastMessage());
  }
}
