package com.mk.fx.qa.stress.execution.model;

/** Lifecycle of a run as seen from outside. */
public enum RunPhase {
  RUNNING,
  /** Cancellation requested, threads still winding down. */
  STOPPING,
  FINISHED
}
