package com.mk.fx.qa.stress.execution.metrics;

import java.util.List;

/** Global error statistics plus the top offenders at one point in time. */
public record ErrorSummary(boolean anyErrorSeen, long totalErrors, List<OffenderEntry> top) {

  public static ErrorSummary empty() {
    return new ErrorSummary(false, 0, List.of());
  }
}
