package com.mk.fx.qa.stress.execution.engine;

/**
 * Result of one run-then-validate cycle. The engine decides what to do with it.
 *
 * @param kind what happened
 * @param message validation message, or the message of the unexpected error
 * @param error the unexpected error, {@code null} for the other kinds
 */
public record CycleOutcome(Kind kind, String message, Throwable error) {

  public enum Kind {
    SUCCESS,
    VALIDATION_FAILURE,
    UNEXPECTED_ERROR
  }

  private static final CycleOutcome SUCCESS = new CycleOutcome(Kind.SUCCESS, null, null);

  public static CycleOutcome success() {
    return SUCCESS;
  }

  public static CycleOutcome validationFailure(String message) {
    return new CycleOutcome(Kind.VALIDATION_FAILURE, message, null);
  }

  public static CycleOutcome unexpectedError(Throwable error) {
    return new CycleOutcome(Kind.UNEXPECTED_ERROR, error.getMessage(), error);
  }

  public boolean isSuccess() {
    return kind == Kind.SUCCESS;
  }
}
