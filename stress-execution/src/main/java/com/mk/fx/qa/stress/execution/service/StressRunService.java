package com.mk.fx.qa.stress.execution.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.stress.execution.cfg.StressRunCfg;
import com.mk.fx.qa.stress.execution.dto.RunStatusResponse;
import com.mk.fx.qa.stress.execution.dto.WorkloadInfo;
import com.mk.fx.qa.stress.execution.engine.AffinityBinder;
import com.mk.fx.qa.stress.execution.engine.CoreTermination;
import com.mk.fx.qa.stress.execution.engine.SchedulingEngine;
import com.mk.fx.qa.stress.execution.metrics.ErrorAggregator;
import com.mk.fx.qa.stress.execution.model.RunConfiguration;
import com.mk.fx.qa.stress.execution.model.RunPhase;
import com.mk.fx.qa.stress.execution.monitor.JsonLinesSnapshotSink;
import com.mk.fx.qa.stress.execution.monitor.MonitorLoop;
import com.mk.fx.qa.stress.execution.monitor.MonitorSettings;
import com.mk.fx.qa.stress.execution.monitor.MonitorSnapshot;
import com.mk.fx.qa.stress.execution.state.ErrorRecord;
import com.mk.fx.qa.stress.execution.state.RunState;
import com.mk.fx.qa.stress.execution.state.WorkloadProgressSnapshot;
import com.mk.fx.qa.stress.execution.telemetry.TelemetrySource;
import com.mk.fx.qa.stress.workloads.Workload;
import com.mk.fx.qa.stress.workloads.catalog.WorkloadCatalog;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Starts, tracks and cancels stress runs. At most one run is active at a time.
 *
 * <p>A run owns one platform thread per selected core ({@code stress-core-<n>}), one monitor thread
 * ({@code stress-monitor}) and one supervisor thread ({@code stress-supervisor}) that waits for the
 * cores, stops the monitor when configured to and marks the run finished. Every core waits for the
 * monitor to become ready, bounded by {@code stress.monitor.ready-timeout}, before running its first
 * cycle.
 */
@Slf4j
@Service
public class StressRunService {

  private final StressRunCfg properties;
  private final WorkloadCatalog catalog;
  private final AffinityBinder affinityBinder;
  private final TelemetrySource telemetry;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private final Object lifecycleLock = new Object();
  private volatile ActiveRun current;

  public StressRunService(
      StressRunCfg properties,
      WorkloadCatalog catalog,
      AffinityBinder affinityBinder,
      TelemetrySource telemetry,
      ObjectMapper objectMapper,
      Clock clock) {
    this.properties = properties;
    this.catalog = catalog;
    this.affinityBinder = affinityBinder;
    this.telemetry = telemetry;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "StressRunService initialised with affinity={} monitorInterval={} readyTimeout={}"
            + " logFile={}",
        affinityBinder.describe(),
        properties.getMonitor().getInterval(),
        properties.getMonitor().getReadyTimeout(),
        properties.getMonitor().getLogFile());
  }

  // -----------------------------------------------------
  // Run lifecycle
  // -----------------------------------------------------

  /**
   * Starts a run.
   *
   * @return the status of the new run, or empty when another run is still active
   * @throws IllegalArgumentException if the configuration is invalid or names unknown workloads
   */
  public Optional<RunStatusResponse> start(RunConfiguration configuration) {
    configuration.validate();
    for (int core : configuration.coreIds()) {
      if (core < 0) {
        throw new IllegalArgumentException("Core index must not be negative: " + core);
      }
    }
    for (int id : configuration.workloadIds()) {
      if (!catalog.contains(id)) {
        throw new IllegalArgumentException("Unknown workload id: " + id);
      }
    }

    synchronized (lifecycleLock) {
      ActiveRun previous = current;
      if (previous != null && !previous.isDone()) {
        log.warn("Rejecting run request, run {} is still active", previous.id);
        return Optional.empty();
      }
      ActiveRun run = new ActiveRun(UUID.randomUUID(), configuration, clock.instant());
      current = run;
      launch(run);
      return Optional.of(run.toStatus());
    }
  }

  private void launch(ActiveRun run) {
    var cfg = run.configuration;
    log.info(
        "Run {} starting on cores {} with workloads {} cycles {} policy {}",
        run.id,
        cfg.coreIds(),
        cfg.workloadIds(),
        Arrays.toString(cfg.cyclesPerWorkload()),
        cfg.policy());

    run.monitorThread = newThread("stress-monitor", run.monitor);
    run.monitorThread.start();

    var engine = new SchedulingEngine(run.state, run.errors, affinityBinder, clock);
    for (int core : cfg.coreIds()) {
      List<Workload> workloads = catalog.createAll(cfg.workloadIds());
      int[] cycles = cfg.cyclesPerWorkload();
      Thread worker =
          newThread("stress-core-" + core, () -> runCore(run, engine, core, workloads, cycles));
      run.workers.add(worker);
    }
    run.workers.forEach(Thread::start);

    Thread supervisor = newThread("stress-supervisor", () -> supervise(run));
    supervisor.start();
  }

  private void runCore(
      ActiveRun run, SchedulingEngine engine, int core, List<Workload> workloads, int[] cycles) {
    awaitMonitor(run, core);
    CoreTermination termination =
        engine.runOnCore(core, workloads, cycles, run.configuration.policy());
    run.coreResults.put(core, termination);
  }

  private void awaitMonitor(ActiveRun run, int core) {
    Duration timeout = properties.getMonitor().getReadyTimeout();
    try {
      if (!run.state.awaitMonitorReady(timeout)
          && run.readinessWarned.compareAndSet(false, true)) {
        log.warn("Monitor not ready after {}, core {} starts without it", timeout, core);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Core {} interrupted while waiting for the monitor", core);
    }
  }

  private void supervise(ActiveRun run) {
    try {
      for (Thread worker : run.workers) {
        worker.join();
      }
      log.info("Run {}: all cores stopped {}", run.id, new TreeMap<>(run.coreResults));
      if (properties.getRun().isStopWhenFinished()) {
        run.state.requestCancel();
      }
      run.monitorThread.join();
      run.monitor.surfaceQueuedErrors();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Supervisor of run {} interrupted", run.id);
      run.state.requestCancel();
    } finally {
      run.finishedAt = clock.instant();
      run.done.countDown();
      log.info(
          "Run {} finished in {} with {} errors",
          run.id,
          Duration.between(run.startedAt, run.finishedAt),
          run.errors.totalErrors());
    }
  }

  /**
   * Requests cancellation of the current run. Cores stop at their next cycle boundary and the
   * monitor writes a final snapshot.
   *
   * @return status of the run, or empty when no run was ever started
   */
  public Optional<RunStatusResponse> cancel() {
    ActiveRun run = current;
    if (run == null) {
      return Optional.empty();
    }
    if (!run.isDone()) {
      log.info("Cancellation requested for run {}", run.id);
      run.state.requestCancel();
    }
    return Optional.of(run.toStatus());
  }

  /**
   * Waits for the current run to finish.
   *
   * @return {@code true} if no run is active when this returns
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    ActiveRun run = current;
    return run == null || run.done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  @PreDestroy
  void shutdown() {
    ActiveRun run = current;
    if (run == null || run.isDone()) {
      return;
    }
    log.info("Shutting down, cancelling run {}", run.id);
    run.state.requestCancel();
    try {
      if (!awaitCompletion(properties.getRun().getShutdownTimeout())) {
        log.warn("Run {} did not stop within {}", run.id, properties.getRun().getShutdownTimeout());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  // -----------------------------------------------------
  // Queries
  // -----------------------------------------------------

  public Optional<RunStatusResponse> status() {
    ActiveRun run = current;
    return run == null ? Optional.empty() : Optional.of(run.toStatus());
  }

  public boolean isRunning() {
    ActiveRun run = current;
    return run != null && !run.isDone();
  }

  public Optional<MonitorSnapshot> latestSnapshot() {
    ActiveRun run = current;
    return run == null ? Optional.empty() : run.monitor.latestSnapshot();
  }

  /** Error records surfaced by the monitor, most recent first. */
  public List<ErrorRecord> recentErrors() {
    ActiveRun run = current;
    return run == null ? List.of() : run.monitor.recentErrors();
  }

  public List<WorkloadInfo> listedWorkloads() {
    return catalog.listed().stream().map(d -> new WorkloadInfo(d.id(), d.displayName())).toList();
  }

  // -----------------------------------------------------
  // Helpers
  // -----------------------------------------------------

  private MonitorLoop newMonitor(RunState state, ErrorAggregator errors) {
    var monitorCfg = properties.getMonitor();
    var settings =
        new MonitorSettings(
            monitorCfg.getInterval(),
            monitorCfg.getWarmup(),
            monitorCfg.getCore(),
            monitorCfg.getErrorHistorySize(),
            monitorCfg.getTopOffenders());
    var sink = new JsonLinesSnapshotSink(Path.of(monitorCfg.getLogFile()), objectMapper);
    return new MonitorLoop(state, errors, telemetry, sink, affinityBinder, settings, clock);
  }

  private static Thread newThread(String name, Runnable runnable) {
    Thread thread = new Thread(runnable);
    thread.setName(name);
    thread.setDaemon(true);
    return thread;
  }

  /** Threads and state of one run. */
  private final class ActiveRun {
    private final UUID id;
    private final RunConfiguration configuration;
    private final Instant startedAt;
    private final RunState state = new RunState();
    private final ErrorAggregator errors = new ErrorAggregator(clock);
    private final MonitorLoop monitor;
    private final List<Thread> workers = new ArrayList<>();
    private final Map<Integer, CoreTermination> coreResults = new ConcurrentHashMap<>();
    private final AtomicBoolean readinessWarned = new AtomicBoolean(false);
    private final CountDownLatch done = new CountDownLatch(1);
    private Thread monitorThread;
    private volatile Instant finishedAt;

    private ActiveRun(UUID id, RunConfiguration configuration, Instant startedAt) {
      this.id = id;
      this.configuration = configuration;
      this.startedAt = startedAt;
      this.monitor = newMonitor(state, errors);
    }

    boolean isDone() {
      return done.getCount() == 0;
    }

    RunPhase phase() {
      if (isDone()) {
        return RunPhase.FINISHED;
      }
      return state.isCancelRequested() ? RunPhase.STOPPING : RunPhase.RUNNING;
    }

    RunStatusResponse toStatus() {
      long completed =
          state.snapshotProgress(errors::hasFailures).values().stream()
              .flatMap(List::stream)
              .mapToLong(WorkloadProgressSnapshot::completedCycles)
              .sum();
      long total = configuration.totalCyclesPerCore() * configuration.coreIds().size();
      return new RunStatusResponse(
          id,
          phase(),
          configuration.policy(),
          configuration.coreIds(),
          configuration.workloadIds(),
          Arrays.stream(configuration.cyclesPerWorkload()).boxed().toList(),
          startedAt,
          finishedAt,
          state.isMonitorReady(),
          completed,
          total,
          errors.totalErrors(),
          new TreeMap<>(coreResults));
    }
  }
}
