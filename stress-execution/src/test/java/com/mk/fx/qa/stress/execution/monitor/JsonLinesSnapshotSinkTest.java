package com.mk.fx.qa.stress.execution.monitor;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.stress.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.stress.execution.metrics.ErrorSummary;
import com.mk.fx.qa.stress.execution.metrics.OffenderEntry;
import com.mk.fx.qa.stress.execution.state.WorkloadProgressSnapshot;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonLinesSnapshotSinkTest {

  @TempDir Path dir;

  private final ObjectMapper mapper = ObjectMapperConfig.create();

  private static MonitorSnapshot snapshot(Instant at, int completed) {
    var offender =
        new OffenderEntry("0:MemoryWorkload", 2, 3, at.minusSeconds(1), "shadow copy mismatch");
    return new MonitorSnapshot(
        at,
        "Test CPU",
        Map.of(0, 97.5, 1, 12.0),
        Map.of("x86_pkg_temp", 61.0),
        new ErrorSummary(true, 3, List.of(offender)),
        Map.of(
            1,
            List.of(
                new WorkloadProgressSnapshot(
                    "IntegerWorkload", 1, completed, 10, true, false, false)),
            0,
            List.of(
                new WorkloadProgressSnapshot("MemoryWorkload", 0, 4, 10, false, true, false))));
  }

  @Test
  void writesOneJsonObjectPerLineThatReadsBackEqual() throws IOException {
    Path file = dir.resolve("nested/log.json");
    var first = snapshot(Instant.parse("2024-05-01T10:00:00Z"), 3);
    var second = snapshot(Instant.parse("2024-05-01T10:00:01.250Z"), 4);

    try (var sink = new JsonLinesSnapshotSink(file, mapper)) {
      sink.open();
      sink.write(first);
      sink.write(second);
    }

    List<String> lines = Files.readAllLines(file);
    assertEquals(2, lines.size());
    JsonNode node = mapper.readTree(lines.get(0));
    assertEquals("2024-05-01T10:00:00Z", node.get("timestamp").asText());
    assertEquals("0:MemoryWorkload", node.at("/errors/top/0/key").asText());
    assertEquals(3, node.at("/progress/1/0/completedCycles").asInt());
    assertEquals(List.of(first, second), JsonLinesSnapshotSink.readAll(file, mapper));
  }

  @Test
  void openTruncatesPreviousRun() throws IOException {
    Path file = dir.resolve("log.json");
    Files.writeString(file, "stale\nstale\n");

    var sink = new JsonLinesSnapshotSink(file, mapper);
    sink.open();
    sink.write(snapshot(Instant.parse("2024-05-01T10:00:00Z"), 1));
    sink.close();
    sink.close();

    assertEquals(1, Files.readAllLines(file).size());
  }

  @Test
  void writeBeforeOpenIsRejected() {
    var sink = new JsonLinesSnapshotSink(dir.resolve("log.json"), mapper);

    assertThrows(
        IllegalStateException.class,
        () -> sink.write(snapshot(Instant.parse("2024-05-01T10:00:00Z"), 1)));
  }
}
