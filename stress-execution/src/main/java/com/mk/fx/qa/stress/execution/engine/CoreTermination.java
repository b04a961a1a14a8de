package com.mk.fx.qa.stress.execution.engine;

/** Why a core stopped running cycles. */
public enum CoreTermination {
  /** Every cycle of every workload ran and validated. */
  COMPLETED,
  /** Cancellation was observed at a cycle boundary. */
  CANCELLED,
  /** A workload failed validation or threw; reported to the aggregator. */
  WORKLOAD_FAILED,
  /** The engine itself failed; queued as an error record. */
  ENGINE_ERROR
}
