package com.mk.fx.qa.stress.execution.monitor;

import com.mk.fx.qa.stress.execution.metrics.ErrorSummary;
import com.mk.fx.qa.stress.execution.state.WorkloadProgressSnapshot;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Everything the monitor observed in one tick. Written as one line of the snapshot log and served
 * as the latest snapshot of the current run.
 *
 * @param timestamp when the tick was taken
 * @param deviceName processor name reported by telemetry
 * @param coreLoads busy percentage per core
 * @param sensors temperature per sensor, degrees Celsius
 * @param errors global error statistics and top offenders
 * @param progress per-core workload progress, ordered by core
 */
public record MonitorSnapshot(
    Instant timestamp,
    String deviceName,
    Map<Integer, Double> coreLoads,
    Map<String, Double> sensors,
    ErrorSummary errors,
    Map<Integer, List<WorkloadProgressSnapshot>> progress) {

  public MonitorSnapshot {
    coreLoads = sortedCopy(coreLoads);
    sensors = sortedCopy(sensors);
    errors = errors != null ? errors : ErrorSummary.empty();
    SortedMap<Integer, List<WorkloadProgressSnapshot>> byCore = new TreeMap<>();
    if (progress != null) {
      progress.forEach((core, entries) -> byCore.put(core, List.copyOf(entries)));
    }
    progress = Collections.unmodifiableSortedMap(byCore);
  }

  public long completedCycles() {
    return progress.values().stream()
        .flatMap(List::stream)
        .mapToLong(WorkloadProgressSnapshot::completedCycles)
        .sum();
  }

  public long totalCycles() {
    return progress.values().stream()
        .flatMap(List::stream)
        .mapToLong(WorkloadProgressSnapshot::totalCycles)
        .sum();
  }

  private static <K, V> Map<K, V> sortedCopy(Map<K, V> source) {
    return source == null
        ? Collections.emptySortedMap()
        : Collections.unmodifiableSortedMap(new TreeMap<>(source));
  }
}
