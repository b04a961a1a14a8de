package com.mk.fx.qa.stress.execution.telemetry;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One telemetry sample.
 *
 * @param coreLoads busy percentage per logical core since the previous sample
 * @param sensors temperature per sensor name, degrees Celsius
 */
public record TelemetryReading(Map<Integer, Double> coreLoads, Map<String, Double> sensors) {

  public TelemetryReading {
    coreLoads = unmodifiableSorted(coreLoads);
    sensors = unmodifiableSorted(sensors);
  }

  public static TelemetryReading empty() {
    return new TelemetryReading(Map.of(), Map.of());
  }

  private static <K, V> Map<K, V> unmodifiableSorted(Map<K, V> source) {
    SortedMap<K, V> copy = new TreeMap<>();
    if (source != null) {
      copy.putAll(source);
    }
    return Collections.unmodifiableSortedMap(copy);
  }
}
