package com.mk.fx.qa.stress.execution.engine;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.stress.execution.metrics.ErrorAggregator;
import com.mk.fx.qa.stress.execution.model.SchedulingPolicy;
import com.mk.fx.qa.stress.execution.state.ErrorRecord;
import com.mk.fx.qa.stress.execution.state.RunState;
import com.mk.fx.qa.stress.execution.state.WorkloadProgress;
import com.mk.fx.qa.stress.workloads.Workload;
import com.mk.fx.qa.stress.workloads.WorkloadValidationException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a core's workloads on the calling thread under a {@link SchedulingPolicy}.
 *
 * <p>One instance serves every core of a run; all per-core state lives on the stack of {@link
 * #runOnCore}. A failing cycle halts only the core that ran it. Cancellation is observed between
 * cycles, a cycle that already started always runs to completion.
 */
@Slf4j
public class SchedulingEngine {

  private static final long SEED_INCREMENT = 0x9E3779B97F4A7C15L;
  private static final AtomicLong SEED_SEQUENCE = new AtomicLong(System.nanoTime());

  private final RunState runState;
  private final ErrorAggregator errorAggregator;
  private final AffinityBinder affinityBinder;
  private final Clock clock;
  private final IntFunction<Random> randomForCore;

  public SchedulingEngine(
      RunState runState, ErrorAggregator errorAggregator, AffinityBinder affinityBinder, Clock clock) {
    this(runState, errorAggregator, affinityBinder, clock, SchedulingEngine::seededRandom);
  }

  @VisibleForTesting
  SchedulingEngine(
      RunState runState,
      ErrorAggregator errorAggregator,
      AffinityBinder affinityBinder,
      Clock clock,
      IntFunction<Random> randomForCore) {
    this.runState = Objects.requireNonNull(runState, "runState");
    this.errorAggregator = Objects.requireNonNull(errorAggregator, "errorAggregator");
    this.affinityBinder = Objects.requireNonNull(affinityBinder, "affinityBinder");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.randomForCore = Objects.requireNonNull(randomForCore, "randomForCore");
  }

  /**
   * Runs every cycle of {@code workloads} on the calling thread, which is first pinned to {@code
   * coreId}.
   *
   * <p>Failures never escape: workload failures go to the {@link ErrorAggregator}, anything else is
   * queued on the {@link RunState} as an {@link ErrorRecord}. Both halt this core only.
   *
   * @param coreId logical processor the calling thread is pinned to
   * @param workloads this core's own workload instances
   * @param cyclesPerWorkload cycles per workload, same order; negative counts run zero cycles
   * @param policy order in which workloads are interleaved
   * @return why the core stopped
   * @throws IllegalArgumentException if the cycle counts do not match the workloads
   */
  public CoreTermination runOnCore(
      int coreId, List<Workload> workloads, int[] cyclesPerWorkload, SchedulingPolicy policy) {
    Objects.requireNonNull(workloads, "workloads");
    Objects.requireNonNull(cyclesPerWorkload, "cyclesPerWorkload");
    Objects.requireNonNull(policy, "policy");
    if (cyclesPerWorkload.length != workloads.size()) {
      throw new IllegalArgumentException(
          "Core "
              + coreId
              + ": "
              + workloads.size()
              + " workloads but "
              + cyclesPerWorkload.length
              + " cycle counts");
    }

    int[] remaining = new int[cyclesPerWorkload.length];
    for (int i = 0; i < remaining.length; i++) {
      remaining[i] = Math.max(0, cyclesPerWorkload[i]);
    }

    List<WorkloadProgress> progress = new ArrayList<>(workloads.size());
    try {
      if (!affinityBinder.bindCurrentThread(coreId)) {
        log.warn(
            "Could not pin thread {} to core {} with {}, continuing unpinned",
            Thread.currentThread().getName(),
            coreId,
            affinityBinder.describe());
      }

      for (int i = 0; i < workloads.size(); i++) {
        progress.add(new WorkloadProgress(workloads.get(i).name(), coreId, remaining[i]));
      }
      runState.registerProgress(coreId, progress);

      log.info("Core {} starting {} workloads under {}", coreId, workloads.size(), policy);
      var termination =
          switch (policy) {
            case SEQUENTIAL -> runSequential(coreId, workloads, progress, remaining);
            case ROUND_ROBIN -> runRoundRobin(coreId, workloads, progress, remaining);
            case RANDOM -> runRandom(coreId, workloads, progress, remaining);
          };
      log.info("Core {} finished: {}", coreId, termination);
      return termination;
    } catch (Throwable t) {
      log.error("Core {} halted by unexpected engine error", coreId, t);
      runState.publishError(ErrorRecord.fromCore(coreId, t, clock.instant()));
      return CoreTermination.ENGINE_ERROR;
    } finally {
      for (WorkloadProgress p : progress) {
        p.setActive(false);
      }
    }
  }

  // -----------------------------------------------------
  // Policies
  // -----------------------------------------------------

  private CoreTermination runSequential(
      int core, List<Workload> workloads, List<WorkloadProgress> progress, int[] remaining) {
    for (int i = 0; i < workloads.size(); i++) {
      while (remaining[i] > 0) {
        if (runState.isCancelRequested()) {
          return CoreTermination.CANCELLED;
        }
        if (!executeCycle(core, workloads.get(i), progress.get(i), progress)) {
          return CoreTermination.WORKLOAD_FAILED;
        }
        remaining[i]--;
      }
    }
    return CoreTermination.COMPLETED;
  }

  private CoreTermination runRoundRobin(
      int core, List<Workload> workloads, List<WorkloadProgress> progress, int[] remaining) {
    boolean anyLeft = true;
    while (anyLeft) {
      anyLeft = false;
      for (int i = 0; i < workloads.size(); i++) {
        if (remaining[i] <= 0) {
          continue;
        }
        if (runState.isCancelRequested()) {
          return CoreTermination.CANCELLED;
        }
        if (!executeCycle(core, workloads.get(i), progress.get(i), progress)) {
          return CoreTermination.WORKLOAD_FAILED;
        }
        remaining[i]--;
        anyLeft |= remaining[i] > 0;
      }
    }
    return CoreTermination.COMPLETED;
  }

  private CoreTermination runRandom(
      int core, List<Workload> workloads, List<WorkloadProgress> progress, int[] remaining) {
    Random random = randomForCore.apply(core);
    List<Integer> candidates = new ArrayList<>();
    for (int i = 0; i < remaining.length; i++) {
      if (remaining[i] > 0) {
        candidates.add(i);
      }
    }
    while (!candidates.isEmpty()) {
      if (runState.isCancelRequested()) {
        return CoreTermination.CANCELLED;
      }
      int slot = random.nextInt(candidates.size());
      int i = candidates.get(slot);
      if (!executeCycle(core, workloads.get(i), progress.get(i), progress)) {
        return CoreTermination.WORKLOAD_FAILED;
      }
      if (--remaining[i] == 0) {
        candidates.remove(slot);
      }
    }
    return CoreTermination.COMPLETED;
  }

  // -----------------------------------------------------
  // Cycle
  // -----------------------------------------------------

  /** Runs one cycle and records its outcome. Returns {@code false} when the core must halt. */
  private boolean executeCycle(
      int core, Workload workload, WorkloadProgress current, List<WorkloadProgress> all) {
    for (WorkloadProgress p : all) {
      if (p != current) {
        p.setActive(false);
      }
    }
    current.setActive(true);

    var outcome = runCycle(workload);
    return switch (outcome.kind()) {
      case SUCCESS -> {
        current.incrementCompleted();
        errorAggregator.resetOk(core, workload.name());
        yield true;
      }
      case VALIDATION_FAILURE -> {
        log.error(
            "Core {} workload {} failed validation after {}/{} cycles: {}",
            core,
            workload.name(),
            current.getCompletedCycles(),
            current.getTotalCycles(),
            outcome.message());
        errorAggregator.report(core, workload.name(), outcome.message());
        yield false;
      }
      case UNEXPECTED_ERROR -> {
        log.error(
            "Core {} workload {} threw after {}/{} cycles",
            core,
            workload.name(),
            current.getCompletedCycles(),
            current.getTotalCycles(),
            outcome.error());
        errorAggregator.report(core, workload.name(), outcome.error());
        yield false;
      }
    };
  }

  static CycleOutcome runCycle(Workload workload) {
    try {
      workload.runStep();
      workload.validate();
      return CycleOutcome.success();
    } catch (WorkloadValidationException e) {
      return CycleOutcome.validationFailure(e.getMessage());
    } catch (Throwable t) {
      return CycleOutcome.unexpectedError(t);
    }
  }

  /** Seeds differ between cores started together, even within the same clock tick. */
  static Random seededRandom(int core) {
    long seed = SEED_SEQUENCE.addAndGet(SEED_INCREMENT) ^ ((long) core * 0xBF58476D1CE4E5B9L);
    return new Random(seed);
  }
}
