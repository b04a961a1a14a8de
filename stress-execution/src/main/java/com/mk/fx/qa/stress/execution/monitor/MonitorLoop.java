package com.mk.fx.qa.stress.execution.monitor;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.stress.execution.engine.AffinityBinder;
import com.mk.fx.qa.stress.execution.metrics.ErrorAggregator;
import com.mk.fx.qa.stress.execution.metrics.OffenderEntry;
import com.mk.fx.qa.stress.execution.state.ErrorRecord;
import com.mk.fx.qa.stress.execution.state.RunState;
import com.mk.fx.qa.stress.execution.telemetry.TelemetryReading;
import com.mk.fx.qa.stress.execution.telemetry.TelemetrySource;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Observer of a run. Runs on its own thread, independent from the engine threads.
 *
 * <p>On start it optionally pins itself, warms telemetry up, opens the sink and then opens the
 * readiness barrier. The barrier is opened even when start-up fails. Every tick it snapshots error
 * statistics, progress and telemetry, writes the snapshot and surfaces queued error records. It
 * stops once cancellation is requested, after one final tick.
 */
@Slf4j
public class MonitorLoop implements Runnable {

  private static final long SLEEP_CHUNK_MILLIS = 100L;

  private final RunState runState;
  private final ErrorAggregator errorAggregator;
  private final TelemetrySource telemetry;
  private final SnapshotSink sink;
  private final AffinityBinder affinityBinder;
  private final MonitorSettings settings;
  private final Clock clock;

  private final Deque<ErrorRecord> recentErrors = new ConcurrentLinkedDeque<>();
  private final AtomicLong ticks = new AtomicLong();
  private volatile MonitorSnapshot latest;

  public MonitorLoop(
      RunState runState,
      ErrorAggregator errorAggregator,
      TelemetrySource telemetry,
      SnapshotSink sink,
      AffinityBinder affinityBinder,
      MonitorSettings settings,
      Clock clock) {
    this.runState = Objects.requireNonNull(runState, "runState");
    this.errorAggregator = Objects.requireNonNull(errorAggregator, "errorAggregator");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.affinityBinder = Objects.requireNonNull(affinityBinder, "affinityBinder");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void run() {
    boolean sinkOpen = false;
    try {
      bindIfConfigured();
      warmUp();
      sink.open();
      sinkOpen = true;
      runState.signalMonitorReady();
      log.info("Monitor ready, ticking every {}", settings.interval());

      while (!runState.isCancelRequested()) {
        tick();
        sleepUntilNextTick(settings.interval());
      }
      tick();
      log.info("Monitor stopped after {} ticks", ticks.get());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Monitor interrupted after {} ticks", ticks.get());
    } catch (Exception e) {
      log.error("Monitor failed after {} ticks", ticks.get(), e);
      runState.publishError(ErrorRecord.fromMonitor(e, clock.instant()));
    } finally {
      runState.signalMonitorReady();
      if (sinkOpen) {
        closeSink();
      }
    }
  }

  // -----------------------------------------------------
  // Start-up
  // -----------------------------------------------------

  private void bindIfConfigured() {
    Integer core = settings.core();
    if (core == null) {
      return;
    }
    if (!affinityBinder.bindCurrentThread(core)) {
      log.warn("Could not pin monitor thread to core {}", core);
    }
  }

  private void warmUp() throws InterruptedException {
    log.info("Monitor warming up telemetry on {}", telemetry.deviceName());
    try {
      telemetry.refresh();
    } catch (IOException | RuntimeException e) {
      log.debug("Telemetry warm-up failed: {}", e.getMessage());
    }
    sleepUntilNextTick(settings.warmup());
  }

  // -----------------------------------------------------
  // Tick
  // -----------------------------------------------------

  /** Takes, writes and publishes one snapshot, then surfaces queued errors. */
  @VisibleForTesting
  void tick() throws IOException {
    var errors = errorAggregator.summary(settings.topOffenders());
    var progress = runState.snapshotProgress(errorAggregator::hasFailures);
    var reading = readTelemetry();

    var snapshot =
        new MonitorSnapshot(
            clock.instant(),
            telemetry.deviceName(),
            reading.coreLoads(),
            reading.sensors(),
            errors,
            progress);
    sink.write(snapshot);
    latest = snapshot;

    surfaceQueuedErrors();
    logSummary(ticks.incrementAndGet(), snapshot);
  }

  private TelemetryReading readTelemetry() {
    try {
      return telemetry.refresh();
    } catch (IOException | RuntimeException e) {
      log.debug("Telemetry unavailable this tick: {}", e.getMessage());
      return TelemetryReading.empty();
    }
  }

  /**
   * Drains the run's error queue. Each record is logged once and kept in the bounded recent-errors
   * history.
   */
  public void surfaceQueuedErrors() {
    for (ErrorRecord record : runState.drainErrors()) {
      log.error(
          "[{}] {}: {}{}",
          record.source(),
          record.type(),
          record.message(),
          record.rootCause() != null ? " (root cause: " + record.rootCause() + ")" : "");
      recentErrors.addFirst(record);
      while (recentErrors.size() > settings.errorHistorySize()) {
        recentErrors.pollLast();
      }
    }
  }

  private void logSummary(long tick, MonitorSnapshot snapshot) {
    log.info(
        "Tick {}: {}/{} cycles across {} cores, {} errors",
        tick,
        snapshot.completedCycles(),
        snapshot.totalCycles(),
        snapshot.progress().size(),
        snapshot.errors().totalErrors());
    if (snapshot.errors().anyErrorSeen()) {
      for (OffenderEntry offender : snapshot.errors().top()) {
        log.warn(
            "  {} consecutive={} total={} last={} \"{}\"",
            offender.key(),
            offender.consecutive(),
            offender.total(),
            offender.lastAt(),
            offender.lastMessage());
      }
    }
  }

  // -----------------------------------------------------
  // Helpers
  // -----------------------------------------------------

  private void sleepUntilNextTick(Duration duration) throws InterruptedException {
    long remaining = duration.toMillis();
    while (remaining > 0 && !runState.isCancelRequested()) {
      var chunk = Math.min(SLEEP_CHUNK_MILLIS, remaining);
      TimeUnit.MILLISECONDS.sleep(chunk);
      remaining -= chunk;
    }
  }

  private void closeSink() {
    try {
      sink.close();
    } catch (IOException e) {
      log.warn("Failed to close snapshot sink: {}", e.getMessage());
    }
  }

  public Optional<MonitorSnapshot> latestSnapshot() {
    return Optional.ofNullable(latest);
  }

  /** Most recent first. */
  public List<ErrorRecord> recentErrors() {
    return new ArrayList<>(recentErrors);
  }

  public long tickCount() {
    return ticks.get();
  }
}
