package com.mk.fx.qa.stress.execution.state;

import lombok.Getter;

/**
 * Live progress of one workload on one core.
 *
 * <p>Single writer: only the engine thread that owns the core mutates an instance. Other threads
 * read it through {@link #snapshot(boolean)}, never by holding on to the live object.
 */
public final class WorkloadProgress {

  @Getter private final String workloadName;
  @Getter private final int core;
  @Getter private final int totalCycles;

  private volatile int completedCycles;
  private volatile boolean active;

  public WorkloadProgress(String workloadName, int core, int totalCycles) {
    this.workloadName = workloadName;
    this.core = core;
    this.totalCycles = Math.max(0, totalCycles);
  }

  public int getCompletedCycles() {
    return completedCycles;
  }

  public boolean isActive() {
    return active;
  }

  /** Owning engine thread only. */
  public void incrementCompleted() {
    completedCycles++;
  }

  /** Owning engine thread only. */
  public void setActive(boolean active) {
    this.active = active;
  }

  /**
   * Copies the current values.
   *
   * @param hasFailures whether the aggregator holds any failure for this core and workload
   */
  public WorkloadProgressSnapshot snapshot(boolean hasFailures) {
    int completed = completedCycles;
    return new WorkloadProgressSnapshot(
        workloadName,
        core,
        completed,
        totalCycles,
        active,
        hasFailures,
        completed == totalCycles && !hasFailures);
  }
}
