package com.mk.fx.qa.stress.execution.telemetry;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads processor telemetry from the Linux pseudo file systems under a configurable root.
 *
 * <ul>
 *   <li>{@code proc/cpuinfo}: the first {@code model name}
 *   <li>{@code proc/stat}: per-core busy share between two refreshes, in percent
 *   <li>{@code sys/class/thermal/thermal_zone*}: {@code type} and {@code temp} (millidegrees)
 * </ul>
 *
 * Missing files yield empty readings rather than errors. Not thread-safe; the monitor thread is the
 * only caller.
 */
@Slf4j
public class ProcfsTelemetrySource implements TelemetrySource {

  static final String UNKNOWN_DEVICE = "Unknown CPU";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern CORE_LINE = Pattern.compile("^cpu\\d+\\s.*");

  private final Path root;
  private final Map<Integer, long[]> previousTicks = new HashMap<>();
  private String deviceName;

  public ProcfsTelemetrySource(Path root) {
    this.root = Objects.requireNonNull(root, "root");
  }

  @Override
  public String deviceName() {
    if (deviceName == null) {
      deviceName = readDeviceName();
    }
    return deviceName;
  }

  @Override
  public TelemetryReading refresh() throws IOException {
    return new TelemetryReading(readCoreLoads(), readSensors());
  }

  // -----------------------------------------------------
  // cpuinfo
  // -----------------------------------------------------

  private String readDeviceName() {
    Path cpuinfo = root.resolve("proc/cpuinfo");
    if (!Files.isReadable(cpuinfo)) {
      return UNKNOWN_DEVICE;
    }
    try {
      for (String line : Files.readAllLines(cpuinfo)) {
        int colon = line.indexOf(':');
        if (colon > 0 && line.substring(0, colon).trim().equals("model name")) {
          String name = line.substring(colon + 1).trim();
          if (!name.isEmpty()) {
            return name;
          }
        }
      }
    } catch (IOException e) {
      log.debug("Cannot read {}: {}", cpuinfo, e.getMessage());
    }
    return UNKNOWN_DEVICE;
  }

  // -----------------------------------------------------
  // stat
  // -----------------------------------------------------

  private Map<Integer, Double> readCoreLoads() throws IOException {
    Path stat = root.resolve("proc/stat");
    if (!Files.isReadable(stat)) {
      return Map.of();
    }
    Map<Integer, Double> loads = new LinkedHashMap<>();
    for (String line : Files.readAllLines(stat)) {
      if (!CORE_LINE.matcher(line).matches()) {
        continue;
      }
      String[] parts = WHITESPACE.split(line.trim());
      if (parts.length < 5) {
        continue;
      }
      int core = Integer.parseInt(parts[0].substring(3));
      long[] ticks = parseTicks(parts);
      long[] previous = previousTicks.put(core, ticks);
      long total = ticks[0] - (previous != null ? previous[0] : 0);
      long idle = ticks[1] - (previous != null ? previous[1] : 0);
      loads.put(core, total <= 0 ? 0.0 : 100.0 * (total - idle) / total);
    }
    return loads;
  }

  /** Returns {total, idle} where idle includes iowait. */
  private static long[] parseTicks(String[] parts) {
    long total = 0;
    for (int i = 1; i < parts.length; i++) {
      total += Long.parseLong(parts[i]);
    }
    long idle = Long.parseLong(parts[4]);
    if (parts.length > 5) {
      idle += Long.parseLong(parts[5]);
    }
    return new long[] {total, idle};
  }

  // -----------------------------------------------------
  // thermal
  // -----------------------------------------------------

  private Map<String, Double> readSensors() throws IOException {
    Path thermal = root.resolve("sys/class/thermal");
    if (!Files.isDirectory(thermal)) {
      return Map.of();
    }
    Map<String, Double> sensors = new LinkedHashMap<>();
    try (DirectoryStream<Path> zones = Files.newDirectoryStream(thermal, "thermal_zone*")) {
      for (Path zone : zones) {
        Path typeFile = zone.resolve("type");
        Path tempFile = zone.resolve("temp");
        if (!Files.isReadable(tempFile)) {
          continue;
        }
        String zoneName = zone.getFileName().toString();
        try {
          String type = Files.isReadable(typeFile) ? firstLine(typeFile) : zoneName;
          double celsius = Long.parseLong(firstLine(tempFile)) / 1000.0;
          String key = sensors.containsKey(type) ? type + " (" + zoneName + ")" : type;
          sensors.put(key, celsius);
        } catch (NumberFormatException e) {
          log.debug("Ignoring unparsable temperature in {}", tempFile);
        } catch (IOException e) {
          log.debug("Skipping unreadable thermal zone {}: {}", zoneName, e.getMessage());
        }
      }
    }
    return sensors;
  }

  private static String firstLine(Path file) throws IOException {
    List<String> lines = Files.readAllLines(file);
    return lines.isEmpty() ? "" : lines.get(0).trim();
  }
}
