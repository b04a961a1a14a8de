package com.mk.fx.qa.stress.execution.telemetry;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcfsTelemetrySourceTest {

  @TempDir Path root;

  private void write(String relative, String content) throws IOException {
    Path file = root.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content);
  }

  @Test
  void deviceName_readsFirstModelName() throws IOException {
    write(
        "proc/cpuinfo",
        """
        processor\t: 0
        vendor_id\t: GenuineIntel
        model name\t: Intel(R) Core(TM) i7-9700K CPU @ 3.60GHz

        processor\t: 1
        model name\t: ignored
        """);

    assertEquals(
        "Intel(R) Core(TM) i7-9700K CPU @ 3.60GHz",
        new ProcfsTelemetrySource(root).deviceName());
  }

  @Test
  void deviceName_fallsBackWhenMissing() {
    assertEquals(ProcfsTelemetrySource.UNKNOWN_DEVICE, new ProcfsTelemetrySource(root).deviceName());
  }

  @Test
  void refresh_computesPerCoreLoadBetweenSamples() throws IOException {
    write(
        "proc/stat",
        """
        cpu  200 0 100 700 0 0 0 0 0 0
        cpu0 100 0 50 350 0 0 0 0 0 0
        cpu1 100 0 50 350 0 0 0 0 0 0
        intr 12345
        """);
    var source = new ProcfsTelemetrySource(root);
    var first = source.refresh();
    assertEquals(30.0, first.coreLoads().get(0), 1e-9);

    write(
        "proc/stat",
        """
        cpu  400 0 100 1000 0 0 0 0 0 0
        cpu0 200 0 50 350 0 0 0 0 0 0
        cpu1 100 0 50 650 0 0 0 0 0 0
        """);
    var second = source.refresh();

    assertEquals(Map.of(0, 100.0, 1, 0.0), second.coreLoads());
  }

  @Test
  void refresh_countsIowaitAsIdle() throws IOException {
    write("proc/stat", "cpu0 10 0 10 40 40 0 0 0 0 0\n");

    var reading = new ProcfsTelemetrySource(root).refresh();

    assertEquals(20.0, reading.coreLoads().get(0), 1e-9);
  }

  @Test
  void refresh_readsThermalZonesInCelsius() throws IOException {
    write("sys/class/thermal/thermal_zone0/type", "x86_pkg_temp\n");
    write("sys/class/thermal/thermal_zone0/temp", "54000\n");
    write("sys/class/thermal/thermal_zone1/type", "acpitz\n");
    write("sys/class/thermal/thermal_zone1/temp", "not-a-number\n");
    write("sys/class/thermal/cooling_device0/type", "Fan\n");

    var reading = new ProcfsTelemetrySource(root).refresh();

    assertEquals(Map.of("x86_pkg_temp", 54.0), reading.sensors());
  }

  @Test
  void refresh_skipsUnreadableZoneAndKeepsCoreLoads() throws IOException {
    write("proc/stat", "cpu0 10 0 10 80 0 0 0 0 0 0\n");
    write("sys/class/thermal/thermal_zone0/type", "x86_pkg_temp\n");
    write("sys/class/thermal/thermal_zone0/temp", "61500\n");
    write("sys/class/thermal/thermal_zone1/type", "disabled\n");
    Files.createDirectories(root.resolve("sys/class/thermal/thermal_zone1/temp"));

    var reading = new ProcfsTelemetrySource(root).refresh();

    assertEquals(Map.of("x86_pkg_temp", 61.5), reading.sensors());
    assertEquals(20.0, reading.coreLoads().get(0), 1e-9);
  }

  @Test
  void refresh_isEmptyWithoutProcOrSys() throws IOException {
    var reading = new ProcfsTelemetrySource(root).refresh();

    assertEquals(TelemetryReading.empty(), reading);
  }
}
