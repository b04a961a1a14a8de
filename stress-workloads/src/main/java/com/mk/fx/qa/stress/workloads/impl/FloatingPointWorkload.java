package com.mk.fx.qa.stress.workloads.impl;

import com.mk.fx.qa.stress.workloads.Workload;
import com.mk.fx.qa.stress.workloads.WorkloadValidationException;

/** Floating point load mixing fused multiply-add, sqrt and division chains. */
public final class FloatingPointWorkload implements Workload {

    public static final int DEFAULT_ITERATIONS = 2_000_000;

    private static final double K1 = 0.4142135623730950488;
    private static final double K2 = 1.7320508075688772935;
    private static final double EPS = 1e-12;
    private static final double SCALE = 0.999999997;

    private final int iterations;

    private double probe;
    private double reference;
    private boolean referenceSet;

    public FloatingPointWorkload() {
        this(DEFAULT_ITERATIONS);
    }

    public FloatingPointWorkload(int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        this.iterations = iterations;
    }

    @Override
    public void runStep() {
        double a = 1.6180339887498948482;
        double b = 2.7182818284590452354;
        double c = 3.1415926535897932385;
        double d = 0.5772156649015328606;
        double acc = 0.0;

        for (int i = 0; i < iterations; i++) {
            double k1 = (i & 1) == 0 ? K1 : K2;
            double k2 = (i & 1) == 0 ? K2 : K1;

            a = Math.fma(a, k1, b);
            b = Math.fma(b, k2, c);
            c = Math.fma(c, k1, d);
            d = Math.fma(d, k2, a);

            double ab = a * b + c;
            double cd = c * d + a;
            double bc = b * c - d;

            a = (Math.sqrt(Math.abs(ab)) + EPS) * SCALE;
            b = (Math.sqrt(Math.abs(cd)) + EPS) * SCALE;
            c = (Math.abs(bc) + EPS) / (1.0 + Math.abs(ab * k1) + EPS);
            d = (Math.abs(ab - cd) + EPS) / (1.0 + Math.abs(bc * k2) + EPS);

            acc = Math.fma(acc, 0.9999999, a + b * 1e-6 + c * 1e-9 + d * 1e-12);
        }

        double mix = (a + b) * (c + d);
        mix = Math.sqrt(Math.abs(mix) + EPS) / (1.0 + Math.abs(a * d - b * c) + EPS);
        probe = mix + acc * 1e-9;
        if (!referenceSet) {
            reference = probe;
            referenceSet = true;
        }
    }

    @Override
    public void validate() throws WorkloadValidationException {
        if (Double.isNaN(probe) || Double.isInfinite(probe)) {
            throw new WorkloadValidationException("Floating point error: probe is " + probe);
        }
        double s = 0.0;
        for (int i = 1; i <= 1000; i++) {
            s += i;
        }
        if (s != 500_500.0) {
            throw new WorkloadValidationException("Floating point error: exact sum 1..1000 was " + s);
        }
        if (Double.compare(probe, reference) != 0) {
            throw new WorkloadValidationException(
                    "Floating point error: probe " + probe + " differs from reference " + reference);
        }
    }
}
