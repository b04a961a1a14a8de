package com.mk.fx.qa.stress.execution.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.stress.execution.metrics.ErrorAggregator;
import com.mk.fx.qa.stress.execution.model.SchedulingPolicy;
import com.mk.fx.qa.stress.execution.state.RunState;
import com.mk.fx.qa.stress.execution.state.WorkloadProgress;
import com.mk.fx.qa.stress.execution.support.MutableClock;
import com.mk.fx.qa.stress.execution.support.RecordingWorkload;
import com.mk.fx.qa.stress.workloads.Workload;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SchedulingEngineTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
  private final RunState runState = new RunState();
  private final ErrorAggregator errors = new ErrorAggregator(clock);
  private final List<String> executions = Collections.synchronizedList(new ArrayList<>());
  private final AtomicInteger bindCalls = new AtomicInteger();
  private final AffinityBinder binder =
      core -> {
        bindCalls.incrementAndGet();
        return true;
      };
  private final SchedulingEngine engine = new SchedulingEngine(runState, errors, binder, clock);

  private RecordingWorkload workload(String name) {
    return new RecordingWorkload(name, executions);
  }

  private List<WorkloadProgress> progress(int core) {
    return runState.progressFor(core).orElseThrow();
  }

  @Test
  void sequential_skipsZeroCycleWorkloadsAndRunsInListOrder() {
    var w1 = workload("W1");
    var w2 = workload("W2");

    var result =
        engine.runOnCore(0, List.of(w1, w2), new int[] {2, 0}, SchedulingPolicy.SEQUENTIAL);

    assertEquals(CoreTermination.COMPLETED, result);
    assertEquals(List.of("W1", "W1"), executions);
    assertEquals(0, w2.steps());
    assertEquals(2, progress(0).get(0).getCompletedCycles());
    assertEquals(0, progress(0).get(1).getCompletedCycles());
    assertEquals(1, bindCalls.get());
  }

  @Test
  void sequential_runsEachWorkloadToCompletionBeforeTheNext() {
    engine.runOnCore(
        1, List.of(workload("A"), workload("B")), new int[] {2, 2}, SchedulingPolicy.SEQUENTIAL);

    assertEquals(List.of("A", "A", "B", "B"), executions);
  }

  @Test
  void roundRobin_interleavesUntilEveryWorkloadIsExhausted() {
    var result =
        engine.runOnCore(
            0,
            List.of(workload("W1"), workload("W2")),
            new int[] {3, 1},
            SchedulingPolicy.ROUND_ROBIN);

    assertEquals(CoreTermination.COMPLETED, result);
    assertEquals(List.of("W1", "W2", "W1", "W1"), executions);
  }

  @Test
  void random_withNoCyclesReturnsImmediately() {
    var result =
        engine.runOnCore(
            0, List.of(workload("W1"), workload("W2")), new int[] {0, 0}, SchedulingPolicy.RANDOM);

    assertEquals(CoreTermination.COMPLETED, result);
    assertTrue(executions.isEmpty());
  }

  @Test
  void random_runsExactlyTheRequestedCycles() {
    var seeded = new SchedulingEngine(runState, errors, binder, clock, core -> new Random(42));
    var a = workload("A");
    var b = workload("B");
    var c = workload("C");

    var result = seeded.runOnCore(0, List.of(a, b, c), new int[] {5, 0, 3}, SchedulingPolicy.RANDOM);

    assertEquals(CoreTermination.COMPLETED, result);
    assertEquals(5, a.steps());
    assertEquals(0, b.steps());
    assertEquals(3, c.steps());
    assertEquals(8, executions.size());
  }

  @Test
  void seededRandom_differsBetweenCoresStartedTogether() {
    var first = SchedulingEngine.seededRandom(0);
    var second = SchedulingEngine.seededRandom(0);
    assertNotEquals(first.nextLong(), second.nextLong());
  }

  @Test
  void validationFailure_haltsCoreAndLeavesCountIncomplete() {
    var w1 = workload("W1").failValidationOnStep(2);
    var w2 = workload("W2");

    var result =
        engine.runOnCore(3, List.of(w1, w2), new int[] {5, 5}, SchedulingPolicy.SEQUENTIAL);

    assertEquals(CoreTermination.WORKLOAD_FAILED, result);
    assertEquals(List.of("W1", "W1"), executions);
    assertEquals(0, w2.steps());
    assertEquals(1, progress(3).get(0).getCompletedCycles());
    var counters = errors.counters(3, "W1").orElseThrow();
    assertEquals(1, counters.totalFailures());
    assertEquals("W1 mismatch on step 2", counters.lastMessage());
    assertEquals(0, runState.pendingErrors());
    assertFalse(progress(3).get(0).snapshot(true).finished());
  }

  @Test
  void unexpectedWorkloadError_isReportedAsFailureOfThatWorkload() {
    var w1 = workload("W1").throwOnStep(1);

    var result = engine.runOnCore(0, List.of(w1), new int[] {3}, SchedulingPolicy.ROUND_ROBIN);

    assertEquals(CoreTermination.WORKLOAD_FAILED, result);
    assertEquals("W1 blew up on step 1", errors.counters(0, "W1").orElseThrow().lastMessage());
    assertEquals(0, progress(0).get(0).getCompletedCycles());
  }

  @Test
  void errorThrownByWorkload_isReportedAsFailureOfThatWorkload() {
    Workload overflowing =
        new Workload() {
          @Override
          public String name() {
            return "Recursive";
          }

          @Override
          public void runStep() {
            throw new StackOverflowError("recursion too deep");
          }

          @Override
          public void validate() {}
        };

    var result =
        engine.runOnCore(0, List.of(overflowing), new int[] {2}, SchedulingPolicy.SEQUENTIAL);

    assertEquals(CoreTermination.WORKLOAD_FAILED, result);
    assertEquals(1, errors.counters(0, "Recursive").orElseThrow().totalFailures());
    assertTrue(runState.drainErrors().isEmpty());
  }

  @Test
  void success_resetsAnExistingStreak() {
    errors.report(0, "W1", "earlier failure");

    engine.runOnCore(0, List.of(workload("W1")), new int[] {1}, SchedulingPolicy.SEQUENTIAL);

    var counters = errors.counters(0, "W1").orElseThrow();
    assertEquals(0, counters.consecutiveFailures());
    assertEquals(1, counters.totalFailures());
  }

  @Test
  void cancellation_stopsBeforeTheNextCycleButFinishesTheCurrentOne() {
    var w1 = workload("W1");
    w1.onStep(
        () -> {
          if (w1.steps() == 3) {
            runState.requestCancel();
          }
        });

    var result = engine.runOnCore(0, List.of(w1), new int[] {10}, SchedulingPolicy.SEQUENTIAL);

    assertEquals(CoreTermination.CANCELLED, result);
    assertEquals(3, w1.steps());
    assertEquals(3, progress(0).get(0).getCompletedCycles());
    assertFalse(errors.anyErrorSeen());
  }

  @Test
  void cancelledBeforeStart_runsNothing() {
    runState.requestCancel();

    var result =
        engine.runOnCore(0, List.of(workload("W1")), new int[] {4}, SchedulingPolicy.RANDOM);

    assertEquals(CoreTermination.CANCELLED, result);
    assertTrue(executions.isEmpty());
  }

  @Test
  void negativeCycleCounts_areClampedOnACopy() {
    int[] cycles = {-3, 1};

    engine.runOnCore(
        0, List.of(workload("A"), workload("B")), cycles, SchedulingPolicy.SEQUENTIAL);

    assertEquals(List.of("B"), executions);
    assertArrayEquals(new int[] {-3, 1}, cycles);
    assertEquals(0, progress(0).get(0).getTotalCycles());
  }

  @Test
  void mismatchedCycleCounts_areRejected() {
    List<Workload> workloads = List.of(workload("A"), workload("B"));
    assertThrows(
        IllegalArgumentException.class,
        () -> engine.runOnCore(0, workloads, new int[] {1}, SchedulingPolicy.SEQUENTIAL));
  }

  @Test
  void failedAffinityBinding_isNotFatal() {
    var unpinned = new SchedulingEngine(runState, errors, NoOpAffinityBinder.INSTANCE, clock);

    var result =
        unpinned.runOnCore(0, List.of(workload("W1")), new int[] {2}, SchedulingPolicy.SEQUENTIAL);

    assertEquals(CoreTermination.COMPLETED, result);
    assertEquals(2, executions.size());
    assertEquals(0, runState.pendingErrors());
  }

  @Test
  void engineError_isQueuedAndHaltsOnlyThatCore() {
    AffinityBinder exploding =
        core -> {
          throw new IllegalStateException("affinity syscall failed");
        };
    var broken = new SchedulingEngine(runState, errors, exploding, clock);

    var result =
        broken.runOnCore(5, List.of(workload("W1")), new int[] {2}, SchedulingPolicy.SEQUENTIAL);

    assertEquals(CoreTermination.ENGINE_ERROR, result);
    assertTrue(executions.isEmpty());
    var queued = runState.drainErrors();
    assertEquals(1, queued.size());
    assertEquals("core-5", queued.get(0).source());
    assertEquals(5, queued.get(0).core());
    assertEquals("affinity syscall failed", queued.get(0).message());
    assertFalse(errors.anyErrorSeen());

    var other =
        engine.runOnCore(6, List.of(workload("W2")), new int[] {1}, SchedulingPolicy.SEQUENTIAL);
    assertEquals(CoreTermination.COMPLETED, other);
  }

  @Test
  void duplicateCoreRegistration_isQueuedAsEngineError() {
    engine.runOnCore(0, List.of(workload("W1")), new int[] {1}, SchedulingPolicy.SEQUENTIAL);

    var second =
        engine.runOnCore(0, List.of(workload("W1")), new int[] {1}, SchedulingPolicy.SEQUENTIAL);

    assertEquals(CoreTermination.ENGINE_ERROR, second);
    assertEquals("IllegalStateException", runState.drainErrors().get(0).type());
  }

  @Test
  void atMostOneWorkloadIsActive_andNoneAfterTheLoop() {
    List<Integer> activeCounts = new ArrayList<>();
    var a = workload("A");
    var b = workload("B");
    Runnable countActive =
        () ->
            activeCounts.add(
                (int) progress(0).stream().filter(WorkloadProgress::isActive).count());
    a.onStep(countActive);
    b.onStep(countActive);

    engine.runOnCore(0, List.of(a, b), new int[] {2, 2}, SchedulingPolicy.ROUND_ROBIN);

    assertEquals(List.of(1, 1, 1, 1), activeCounts);
    assertTrue(progress(0).stream().noneMatch(WorkloadProgress::isActive));
  }

  @Test
  void runCycle_mapsOutcomes() {
    assertTrue(SchedulingEngine.runCycle(workload("ok")).isSuccess());
    assertEquals(
        CycleOutcome.Kind.VALIDATION_FAILURE,
        SchedulingEngine.runCycle(workload("bad").failValidationOnStep(1)).kind());
    var thrown = SchedulingEngine.runCycle(workload("boom").throwOnStep(1));
    assertEquals(CycleOutcome.Kind.UNEXPECTED_ERROR, thrown.kind());
    assertInstanceOf(IllegalStateException.class, thrown.error());
  }
}
