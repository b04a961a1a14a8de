package com.mk.fx.qa.stress.execution.state;

/** Immutable copy of a {@link WorkloadProgress} taken for reporting. */
public record WorkloadProgressSnapshot(
    String workloadName,
    int core,
    int completedCycles,
    int totalCycles,
    boolean active,
    boolean error,
    boolean finished) {}
