package com.mk.fx.qa.stress.execution.engine;

/** Used where thread pinning is unavailable or disabled. Never binds. */
public final class NoOpAffinityBinder implements AffinityBinder {

  public static final NoOpAffinityBinder INSTANCE = new NoOpAffinityBinder();

  private NoOpAffinityBinder() {}

  @Override
  public boolean bindCurrentThread(int core) {
    return false;
  }
}
