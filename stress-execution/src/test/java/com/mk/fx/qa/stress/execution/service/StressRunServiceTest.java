package com.mk.fx.qa.stress.execution.service;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.stress.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.stress.execution.cfg.StressRunCfg;
import com.mk.fx.qa.stress.execution.dto.RunStatusResponse;
import com.mk.fx.qa.stress.execution.engine.CoreTermination;
import com.mk.fx.qa.stress.execution.engine.NoOpAffinityBinder;
import com.mk.fx.qa.stress.execution.metrics.OffenderEntry;
import com.mk.fx.qa.stress.execution.model.RunConfiguration;
import com.mk.fx.qa.stress.execution.model.RunPhase;
import com.mk.fx.qa.stress.execution.model.SchedulingPolicy;
import com.mk.fx.qa.stress.execution.monitor.JsonLinesSnapshotSink;
import com.mk.fx.qa.stress.execution.state.WorkloadProgressSnapshot;
import com.mk.fx.qa.stress.execution.support.StubTelemetrySource;
import com.mk.fx.qa.stress.workloads.catalog.WorkloadCatalog;
import com.mk.fx.qa.stress.workloads.catalog.WorkloadDescriptor;
import com.mk.fx.qa.stress.workloads.impl.FailingWorkload;
import com.mk.fx.qa.stress.workloads.impl.IntegerWorkload;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.random.RandomGenerator;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StressRunServiceTest {

  private static final int QUICK = 1;
  private static final int FAILING = 2;

  @TempDir Path dir;

  private Path logFile;
  private StressRunService service;

  private static StressRunCfg cfg(Path logFile) {
    StressRunCfg cfg = new StressRunCfg();
    cfg.getMonitor().setInterval(Duration.ofMillis(50));
    cfg.getMonitor().setWarmup(Duration.ZERO);
    cfg.getMonitor().setReadyTimeout(Duration.ofSeconds(2));
    cfg.getMonitor().setLogFile(logFile.toString());
    cfg.getMonitor().setErrorHistorySize(10);
    cfg.getRun().setShutdownTimeout(Duration.ofSeconds(5));
    return cfg;
  }

  private static WorkloadCatalog catalog() {
    var catalog = new WorkloadCatalog();
    catalog.register(QUICK, "Quick integer", () -> new IntegerWorkload(1_000));
    catalog.register(
        new WorkloadDescriptor(
            FAILING,
            "Fails on third validation",
            false,
            () -> new FailingWorkload(2, 1.0, RandomGenerator.getDefault())));
    return catalog;
  }

  private static RunConfiguration config(List<Integer> cores, List<Integer> ids, int... cycles) {
    return new RunConfiguration(cores, ids, cycles, SchedulingPolicy.SEQUENTIAL);
  }

  @BeforeEach
  void setUp() {
    logFile = dir.resolve("log.json");
    service =
        new StressRunService(
            cfg(logFile),
            catalog(),
            NoOpAffinityBinder.INSTANCE,
            new StubTelemetrySource(),
            ObjectMapperConfig.create(),
            Clock.systemUTC());
  }

  @AfterEach
  void tearDown() {
    service.shutdown();
  }

  private RunStatusResponse awaitFinished() throws InterruptedException {
    assertTrue(service.awaitCompletion(Duration.ofSeconds(20)), "run did not finish");
    return service.status().orElseThrow();
  }

  @Test
  void queries_areEmptyBeforeAnyRun() throws InterruptedException {
    assertTrue(service.status().isEmpty());
    assertTrue(service.cancel().isEmpty());
    assertTrue(service.latestSnapshot().isEmpty());
    assertTrue(service.recentErrors().isEmpty());
    assertFalse(service.isRunning());
    assertTrue(service.awaitCompletion(Duration.ZERO));
  }

  @Test
  void start_runsEveryCoreToCompletionAndLogsSnapshots() throws Exception {
    var started = service.start(config(List.of(0, 1), List.of(QUICK), 20)).orElseThrow();
    assertEquals(40, started.totalCycles());

    var status = awaitFinished();

    assertEquals(RunPhase.FINISHED, status.phase());
    assertEquals(started.runId(), status.runId());
    assertEquals(40, status.completedCycles());
    assertEquals(0, status.totalErrors());
    assertTrue(status.monitorReady());
    assertNotNull(status.finishedAt());
    assertEquals(
        Map.of(0, CoreTermination.COMPLETED, 1, CoreTermination.COMPLETED), status.coreResults());

    var snapshot = service.latestSnapshot().orElseThrow();
    assertEquals(40, snapshot.completedCycles());
    assertTrue(
        snapshot.progress().values().stream()
            .flatMap(List::stream)
            .allMatch(WorkloadProgressSnapshot::finished));
    assertFalse(snapshot.errors().anyErrorSeen());

    var logged = JsonLinesSnapshotSink.readAll(logFile, ObjectMapperConfig.create());
    assertFalse(logged.isEmpty());
    assertEquals(snapshot, logged.get(logged.size() - 1));
  }

  @Test
  void start_isRejectedWhileARunIsActive() throws Exception {
    service.start(config(List.of(0), List.of(QUICK), 10_000_000)).orElseThrow();

    assertTrue(service.start(config(List.of(1), List.of(QUICK), 1)).isEmpty());
    assertTrue(service.isRunning());

    var cancelling = service.cancel().orElseThrow();
    assertNotEquals(RunPhase.RUNNING, cancelling.phase());
    var status = awaitFinished();

    assertEquals(RunPhase.FINISHED, status.phase());
    assertEquals(CoreTermination.CANCELLED, status.coreResults().get(0));
    assertTrue(status.completedCycles() < status.totalCycles());
    assertTrue(service.start(config(List.of(1), List.of(QUICK), 1)).isPresent());
    awaitFinished();
  }

  @Test
  void status_reportsTotalsBeyondIntRange() throws Exception {
    var started =
        service
            .start(
                new RunConfiguration(
                    List.of(0, 1),
                    List.of(QUICK, QUICK),
                    new int[] {Integer.MAX_VALUE, Integer.MAX_VALUE},
                    SchedulingPolicy.ROUND_ROBIN))
            .orElseThrow();

    assertEquals(4L * Integer.MAX_VALUE, started.totalCycles());

    service.cancel();
    var status = awaitFinished();
    assertEquals(4L * Integer.MAX_VALUE, status.totalCycles());
    assertTrue(status.completedCycles() >= 0);
  }

  @Test
  void failingWorkload_haltsOnlyItsCoreAndShowsInSnapshot() throws Exception {
    service.start(
        new RunConfiguration(
            List.of(0, 1), List.of(FAILING, QUICK), new int[] {5, 5}, SchedulingPolicy.SEQUENTIAL));

    var status = awaitFinished();

    assertEquals(CoreTermination.WORKLOAD_FAILED, status.coreResults().get(0));
    assertEquals(CoreTermination.WORKLOAD_FAILED, status.coreResults().get(1));
    assertEquals(2, status.totalErrors());
    assertEquals(4, status.completedCycles());

    var snapshot = service.latestSnapshot().orElseThrow();
    assertEquals(
        Set.of("0:FailingWorkload", "1:FailingWorkload"),
        snapshot.errors().top().stream().map(OffenderEntry::key).collect(Collectors.toSet()));
    var failing = snapshot.progress().get(0).get(0);
    assertEquals(2, failing.completedCycles());
    assertTrue(failing.error());
    assertFalse(failing.finished());
    assertEquals(0, snapshot.progress().get(0).get(1).completedCycles());
  }

  @Test
  void engineError_onOneCoreIsSurfacedAsRecentError() throws Exception {
    service.start(config(List.of(3, 3), List.of(QUICK), 5));

    var status = awaitFinished();

    assertEquals(5, status.completedCycles());
    var errors = service.recentErrors();
    assertEquals(1, errors.size());
    assertEquals("core-3", errors.get(0).source());
    assertEquals("IllegalStateException", errors.get(0).type());
  }

  @Test
  void start_rejectsInvalidConfiguration() {
    assertThrows(
        IllegalArgumentException.class,
        () -> service.start(config(List.of(0), List.of(99), 1)));
    assertThrows(
        IllegalArgumentException.class,
        () -> service.start(config(List.of(0), List.of(QUICK), 1, 2)));
    assertThrows(
        IllegalArgumentException.class,
        () -> service.start(config(List.of(-1), List.of(QUICK), 1)));
    assertTrue(service.status().isEmpty());
  }

  @Test
  void listedWorkloads_hidesUnlistedEntries() {
    var listed = service.listedWorkloads();

    assertEquals(1, listed.size());
    assertEquals(QUICK, listed.get(0).id());
    assertEquals("Quick integer", listed.get(0).name());
  }
}
