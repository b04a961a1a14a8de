package com.mk.fx.qa.stress.execution.telemetry;

import java.io.IOException;

/** Best-effort host readings for the monitor. */
public interface TelemetrySource {

  /** Human-readable processor name. Never {@code null}. */
  String deviceName();

  /**
   * Takes a fresh reading.
   *
   * @throws IOException if the underlying source cannot be read at all
   */
  TelemetryReading refresh() throws IOException;
}
