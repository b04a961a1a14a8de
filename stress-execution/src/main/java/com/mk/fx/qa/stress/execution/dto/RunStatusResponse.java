package com.mk.fx.qa.stress.execution.dto;

import com.mk.fx.qa.stress.execution.engine.CoreTermination;
import com.mk.fx.qa.stress.execution.model.RunPhase;
import com.mk.fx.qa.stress.execution.model.SchedulingPolicy;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Current view of a run. {@code coreResults} only lists cores that have stopped.
 */
public record RunStatusResponse(
    UUID runId,
    RunPhase phase,
    SchedulingPolicy policy,
    List<Integer> cores,
    List<Integer> workloads,
    List<Integer> cycles,
    Instant startedAt,
    Instant finishedAt,
    boolean monitorReady,
    long completedCycles,
    long totalCycles,
    long totalErrors,
    Map<Integer, CoreTermination> coreResults) {}
