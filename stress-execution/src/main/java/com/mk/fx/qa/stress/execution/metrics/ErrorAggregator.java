package com.mk.fx.qa.stress.execution.metrics;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe failure statistics keyed by (core, workload kind), plus run-wide totals.
 *
 * <p>Updates for one key go through {@link ConcurrentHashMap#compute} on immutable {@link
 * FailureCounters} values, so they are linearizable per key and readers always see a consistent
 * value. There is no atomicity across keys.
 */
@Slf4j
public class ErrorAggregator {

  static final Comparator<Map.Entry<FailureKey, FailureCounters>> OFFENDER_ORDER =
      Comparator.<Map.Entry<FailureKey, FailureCounters>>comparingInt(
              e -> e.getValue().consecutiveFailures())
          .reversed()
          .thenComparing(e -> e.getValue().lastFailureAt(), Comparator.reverseOrder())
          .thenComparing(Map.Entry::getKey);

  private final Clock clock;
  private final Map<FailureKey, FailureCounters> counters = new ConcurrentHashMap<>();
  private final AtomicLong totalErrors = new AtomicLong();
  private final AtomicBoolean anyErrorSeen = new AtomicBoolean(false);

  public ErrorAggregator(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Records a failure of {@code workloadKind} on {@code core}. */
  public void report(int core, String workloadKind, Throwable error) {
    report(core, workloadKind, describe(error));
  }

  /** Records a failure of {@code workloadKind} on {@code core} with an explicit message. */
  public void report(int core, String workloadKind, String message) {
    var key = new FailureKey(core, workloadKind);
    var now = clock.instant();
    var msg = message != null ? message : "";
    var updated =
        counters.compute(
            key,
            (k, old) -> old == null ? FailureCounters.first(now, msg) : old.withFailure(now, msg));
    totalErrors.incrementAndGet();
    anyErrorSeen.set(true);
    log.debug(
        "Failure recorded for {} (consecutive={}, total={})",
        key,
        updated.consecutiveFailures(),
        updated.totalFailures());
  }

  /**
   * Ends the consecutive-failure streak of a key after a successful cycle. Does nothing when the
   * key never failed.
   */
  public void resetOk(int core, String workloadKind) {
    counters.computeIfPresent(new FailureKey(core, workloadKind), (k, old) -> old.withSuccess());
  }

  public Optional<FailureCounters> counters(int core, String workloadKind) {
    return Optional.ofNullable(counters.get(new FailureKey(core, workloadKind)));
  }

  public boolean hasFailures(int core, String workloadKind) {
    var c = counters.get(new FailureKey(core, workloadKind));
    return c != null && c.totalFailures() > 0;
  }

  /**
   * Returns up to {@code n} entries, most consecutive failures first, ties broken by the most
   * recent failure and then by key.
   */
  public List<OffenderEntry> topOffenders(int n) {
    if (n <= 0) {
      return List.of();
    }
    return Map.copyOf(counters).entrySet().stream()
        .sorted(OFFENDER_ORDER)
        .limit(n)
        .map(e -> OffenderEntry.of(e.getKey(), e.getValue()))
        .toList();
  }

  public ErrorSummary summary(int topN) {
    return new ErrorSummary(anyErrorSeen.get(), totalErrors.get(), topOffenders(topN));
  }

  public boolean anyErrorSeen() {
    return anyErrorSeen.get();
  }

  public long totalErrors() {
    return totalErrors.get();
  }

  public int trackedKeys() {
    return counters.size();
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return "unknown error";
    }
    var msg = error.getMessage();
    return msg != null && !msg.isBlank() ? msg : error.getClass().getSimpleName();
  }
}
