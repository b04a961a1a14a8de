package com.mk.fx.qa.stress.execution.metrics;

import java.time.Instant;

/**
 * Failure statistics of one {@link FailureKey}. Immutable; the aggregator swaps in a new value on
 * every update.
 *
 * @param consecutiveFailures failures since the last successful cycle
 * @param totalFailures failures over the whole run, never decreases
 * @param firstFailureAt start of the current streak, {@code null} once a success reset it
 * @param lastFailureAt time of the most recent failure
 * @param lastMessage message of the most recent failure
 */
public record FailureCounters(
    int consecutiveFailures,
    long totalFailures,
    Instant firstFailureAt,
    Instant lastFailureAt,
    String lastMessage) {

  static FailureCounters first(Instant now, String message) {
    return new FailureCounters(1, 1, now, now, message);
  }

  FailureCounters withFailure(Instant now, String message) {
    return new FailureCounters(
        consecutiveFailures + 1,
        totalFailures + 1,
        firstFailureAt != null ? firstFailureAt : now,
        now,
        message);
  }

  FailureCounters withSuccess() {
    return new FailureCounters(0, totalFailures, null, lastFailureAt, lastMessage);
  }
}
