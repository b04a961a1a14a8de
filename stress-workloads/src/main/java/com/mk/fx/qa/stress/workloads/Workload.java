package com.mk.fx.qa.stress.workloads;

/**
 * A pluggable stress computation. One instance belongs to exactly one core thread and is driven
 * repeatedly through cycles of {@link #runStep()} followed by {@link #validate()}.
 *
 * <p>Implementations keep whatever state {@link #validate()} needs to check the outcome of the
 * most recent {@link #runStep()}. A validation failure is reported with {@link
 * WorkloadValidationException}; any other exception is treated by callers as an unexpected error.
 */
public interface Workload {

    /**
     * Returns the workload kind, used as part of the failure key and in progress reports. Two
     * instances of the same implementation return the same name.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /** Performs one unit of work. Repeatable on the same instance. */
    void runStep();

    /**
     * Checks the outcome of the last {@link #runStep()}.
     *
     * @throws WorkloadValidationException if the computed result is wrong
     */
    void validate() throws WorkloadValidationException;
}
