package com.mk.fx.qa.stress.execution.monitor;

import java.io.Closeable;
import java.io.IOException;

/** Destination of the monitor's per-tick snapshots. Used by the monitor thread only. */
public interface SnapshotSink extends Closeable {

  void open() throws IOException;

  void write(MonitorSnapshot snapshot) throws IOException;
}
