package com.mk.fx.qa.stress.execution.monitor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/** Appends every snapshot as one JSON object per line. The file is truncated on open. */
@Slf4j
public class JsonLinesSnapshotSink implements SnapshotSink {

  private final Path file;
  private final ObjectMapper mapper;
  private BufferedWriter writer;

  /**
   * @param file target file, parent directories are created on open
   * @param mapper application mapper; a single-line copy of it is used for writing
   */
  public JsonLinesSnapshotSink(Path file, ObjectMapper mapper) {
    this.file = Objects.requireNonNull(file, "file");
    this.mapper = lineMapper(Objects.requireNonNull(mapper, "mapper"));
  }

  static ObjectMapper lineMapper(ObjectMapper mapper) {
    ObjectMapper copy = mapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
    copy.setDefaultPropertyInclusion(JsonInclude.Include.ALWAYS);
    return copy;
  }

  public Path file() {
    return file;
  }

  @Override
  public void open() throws IOException {
    if (writer != null) {
      throw new IllegalStateException("Snapshot sink already open: " + file);
    }
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    writer =
        Files.newBufferedWriter(
            file,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
    log.info("Writing monitor snapshots to {}", file.toAbsolutePath());
  }

  @Override
  public void write(MonitorSnapshot snapshot) throws IOException {
    if (writer == null) {
      throw new IllegalStateException("Snapshot sink is not open: " + file);
    }
    writer.write(mapper.writeValueAsString(snapshot));
    writer.newLine();
    writer.flush();
  }

  @Override
  public void close() throws IOException {
    if (writer == null) {
      return;
    }
    try {
      writer.close();
    } finally {
      writer = null;
    }
  }

  /** Reads back every snapshot of a file written by this sink. */
  public static List<MonitorSnapshot> readAll(Path file, ObjectMapper mapper) throws IOException {
    ObjectMapper reader = lineMapper(mapper);
    List<MonitorSnapshot> snapshots = new ArrayList<>();
    for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
      if (!line.isBlank()) {
        snapshots.add(reader.readValue(line, MonitorSnapshot.class));
      }
    }
    return snapshots;
  }
}
