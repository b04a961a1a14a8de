package com.mk.fx.qa.stress.execution.engine;

/** Pins the calling thread to one logical processor. */
public interface AffinityBinder {

  /**
   * Binds the current thread to {@code core}.
   *
   * @return {@code true} if the binding was applied, {@code false} if it could not be
   */
  boolean bindCurrentThread(int core);

  /** Short name used in logs. */
  default String describe() {
    return getClass().getSimpleName();
  }
}
