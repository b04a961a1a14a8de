package com.mk.fx.qa.stress.execution.state;

import java.time.Instant;

/**
 * Error published to the monitor through the run state's error queue. Consumed exactly once.
 *
 * @param occurredAt when the error was captured
 * @param source thread role that produced it, e.g. {@code core-3} or {@code monitor}
 * @param core core index, or {@code null} when not tied to a core
 * @param type simple class name of the root cause
 * @param message best available message
 * @param rootCause root cause summary when the error was wrapped, otherwise {@code null}
 */
public record ErrorRecord(
    Instant occurredAt, String source, Integer core, String type, String message, String rootCause) {

  public static ErrorRecord fromCore(int core, Throwable error, Instant now) {
    return of("core-" + core, core, error, now);
  }

  public static ErrorRecord fromMonitor(Throwable error, Instant now) {
    return of("monitor", null, error, now);
  }

  static ErrorRecord of(String source, Integer core, Throwable error, Instant now) {
    if (error == null) {
      return new ErrorRecord(now, source, core, "UNKNOWN", "unknown error", null);
    }
    Throwable root = rootCause(error);

    String msg = error.getMessage();
    if (msg == null || msg.equals("null")) {
      msg = root.getMessage();
    }
    if (msg == null || msg.equals("null")) {
      msg = root.getClass().getSimpleName() + " occurred";
    }

    String rootSummary = null;
    if (root != error) {
      rootSummary =
          root.getClass().getSimpleName()
              + " - "
              + (root.getMessage() != null ? root.getMessage() : "no message");
    }
    return new ErrorRecord(now, source, core, root.getClass().getSimpleName(), msg, rootSummary);
  }

  private static Throwable rootCause(Throwable t) {
    Throwable rootCause = t;
    while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
      rootCause = rootCause.getCause();
    }
    return rootCause;
  }
}
