package com.mk.fx.qa.stress.workloads.impl;

import com.mk.fx.qa.stress.workloads.Workload;
import com.mk.fx.qa.stress.workloads.WorkloadValidationException;
import java.util.random.RandomGenerator;

/**
 * Self-test workload that is guaranteed to fail eventually. After a warm-up of successful
 * validations, failures arrive with geometrically distributed gaps. Used to exercise the error
 * paths of the harness; it is not listed in the public catalog.
 */
public final class FailingWorkload implements Workload {

    public static final int DEFAULT_WARMUP_VALIDATIONS = 2000;
    public static final double DEFAULT_FAIL_PROBABILITY = 0.002;

    private final int warmupValidations;
    private final double failProbability;
    private final RandomGenerator random;

    private int validations;
    private int nextFailAt;
    private double sink;

    public FailingWorkload() {
        this(DEFAULT_WARMUP_VALIDATIONS, DEFAULT_FAIL_PROBABILITY, RandomGenerator.getDefault());
    }

    public FailingWorkload(int warmupValidations, double failProbability, RandomGenerator random) {
        this.warmupValidations = Math.max(0, warmupValidations);
        this.failProbability = failProbability;
        this.random = random;
    }

    @Override
    public void runStep() {
        double s = 0;
        for (int i = 0; i < 50_000; i++) {
            s += Math.sqrt(i);
        }
        sink = s;
    }

    @Override
    public void validate() throws WorkloadValidationException {
        int n = ++validations;
        if (n <= warmupValidations) {
            return;
        }
        if (nextFailAt == 0) {
            nextFailAt = warmupValidations + sampleGeometric();
        }
        if (n >= nextFailAt) {
            nextFailAt = n + sampleGeometric();
            throw new WorkloadValidationException(
                    "Synthetic failure (validation #" + n + "), next expected around #" + nextFailAt);
        }
    }

    private int sampleGeometric() {
        if (failProbability <= 0) {
            return Integer.MAX_VALUE / 2;
        }
        if (failProbability >= 1) {
            return 1;
        }
        double u;
        do {
            u = random.nextDouble();
        } while (u == 0.0);
        int k = (int) Math.ceil(Math.log(u) / Math.log(1.0 - failProbability));
        return Math.max(1, k);
    }
}
