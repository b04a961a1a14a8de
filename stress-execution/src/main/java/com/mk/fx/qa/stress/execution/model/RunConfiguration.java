package com.mk.fx.qa.stress.execution.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Everything needed to start one run: the cores to load, the catalog ids of the workloads each
 * core runs, the cycle count per workload and the scheduling policy.
 */
public record RunConfiguration(
    List<Integer> coreIds, List<Integer> workloadIds, int[] cyclesPerWorkload, SchedulingPolicy policy) {

  public RunConfiguration {
    Objects.requireNonNull(coreIds, "coreIds");
    Objects.requireNonNull(workloadIds, "workloadIds");
    Objects.requireNonNull(cyclesPerWorkload, "cyclesPerWorkload");
    coreIds = List.copyOf(coreIds);
    workloadIds = List.copyOf(workloadIds);
    cyclesPerWorkload = cyclesPerWorkload.clone();
    policy = policy != null ? policy : SchedulingPolicy.SEQUENTIAL;
  }

  /**
   * Checks the shape of the configuration.
   *
   * @throws IllegalArgumentException if no core or workload is selected or the cycle counts do not
   *     line up with the workloads
   */
  public void validate() {
    if (coreIds.isEmpty()) {
      throw new IllegalArgumentException("At least one core must be selected");
    }
    if (workloadIds.isEmpty()) {
      throw new IllegalArgumentException("At least one workload must be selected");
    }
    if (cyclesPerWorkload.length != workloadIds.size()) {
      throw new IllegalArgumentException(
          "Expected "
              + workloadIds.size()
              + " cycle counts (one per workload) but got "
              + cyclesPerWorkload.length);
    }
  }

  /** Returns a copy, so every core gets its own array. */
  @Override
  public int[] cyclesPerWorkload() {
    return cyclesPerWorkload.clone();
  }

  public long totalCyclesPerCore() {
    return Arrays.stream(cyclesPerWorkload).mapToLong(c -> Math.max(0, c)).sum();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RunConfiguration other)) {
      return false;
    }
    return coreIds.equals(other.coreIds)
        && workloadIds.equals(other.workloadIds)
        && Arrays.equals(cyclesPerWorkload, other.cyclesPerWorkload)
        && policy == other.policy;
  }

  @Override
  public int hashCode() {
    return Objects.hash(coreIds, workloadIds, Arrays.hashCode(cyclesPerWorkload), policy);
  }

  @Override
  public String toString() {
    return "RunConfiguration[cores="
        + coreIds
        + ", workloads="
        + workloadIds
        + ", cycles="
        + Arrays.toString(cyclesPerWorkload)
        + ", policy="
        + policy
        + "]";
  }
}
