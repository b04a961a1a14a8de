package com.mk.fx.qa.stress.workloads;

/**
 * Signals that a workload computed a wrong result. Kept distinct from unrelated runtime errors so
 * the scheduling engine can tell a hardware-suspect failure from a defect.
 */
public class WorkloadValidationException extends Exception {

    public WorkloadValidationException(String message) {
        super(message);
    }
}
