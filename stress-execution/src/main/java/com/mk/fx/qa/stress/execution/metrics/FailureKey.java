package com.mk.fx.qa.stress.execution.metrics;

import java.util.Objects;

/** Aggregation key: one workload kind on one core. Rendered as {@code "<core>:<kind>"}. */
public record FailureKey(int core, String workloadKind) implements Comparable<FailureKey> {

  public FailureKey {
    Objects.requireNonNull(workloadKind, "workloadKind");
  }

  @Override
  public int compareTo(FailureKey other) {
    int byCore = Integer.compare(core, other.core);
    return byCore != 0 ? byCore : workloadKind.compareTo(other.workloadKind);
  }

  @Override
  public String toString() {
    return core + ":" + workloadKind;
  }
}
