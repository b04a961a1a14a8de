package com.mk.fx.qa.stress.workloads.impl;

import com.mk.fx.qa.stress.workloads.Workload;
import com.mk.fx.qa.stress.workloads.WorkloadValidationException;
import java.util.SplittableRandom;

/**
 * Sweeps two cache-resident float arrays in lane-sized blocks, applying a chain of arithmetic
 * micro-steps per block. The lane width mirrors the vector register being exercised (4 floats for
 * 128-bit lanes, 8 floats for 256-bit lanes), which lets the JIT vectorise the inner loop.
 *
 * <p>Validation recomputes a sample of blocks on the scalar path and compares bit for bit.
 */
public final class CacheSweepWorkload implements Workload {

    public static final int DEFAULT_LENGTH = 1 << 16;

    private static final int MICRO_STEPS = 16;
    private static final int SAMPLED_BLOCKS = 64;
    private static final float CAP = 1e20f;

    private final String name;
    private final int laneWidth;
    private final boolean fused;
    private final float[] a;
    private final float[] b;
    private final float[] out;

    private int runId;
    private int phase;

    private CacheSweepWorkload(String name, int laneWidth, boolean fused, int length) {
        if (length < laneWidth * 2 || Integer.bitCount(length) != 1) {
            throw new IllegalArgumentException("length must be a power of two >= " + laneWidth * 2);
        }
        this.name = name;
        this.laneWidth = laneWidth;
        this.fused = fused;
        this.a = new float[length];
        this.b = new float[length];
        this.out = new float[length];
        var random = new SplittableRandom(0x5EED ^ laneWidth);
        for (int i = 0; i < length; i++) {
            a[i] = (float) (random.nextDouble() * 2.0 - 1.0);
            b[i] = (float) (random.nextDouble() * 2.0 - 1.0);
        }
    }

    /** 128-bit lanes, plain multiply/add. */
    public static CacheSweepWorkload narrowLanes() {
        return narrowLanes(DEFAULT_LENGTH);
    }

    public static CacheSweepWorkload narrowLanes(int length) {
        return new CacheSweepWorkload("CacheSweep128Workload", 4, false, length);
    }

    /** 256-bit lanes, plain multiply/add. */
    public static CacheSweepWorkload wideLanes() {
        return wideLanes(DEFAULT_LENGTH);
    }

    public static CacheSweepWorkload wideLanes(int length) {
        return new CacheSweepWorkload("CacheSweep256Workload", 8, false, length);
    }

    /** 256-bit lanes using fused multiply-add. */
    public static CacheSweepWorkload fusedWideLanes() {
        return fusedWideLanes(DEFAULT_LENGTH);
    }

    public static CacheSweepWorkload fusedWideLanes(int length) {
        return new CacheSweepWorkload("CacheSweepFmaWorkload", 8, true, length);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void runStep() {
        int length = a.length;
        phase = (++runId * 17 * laneWidth) & (length - 1);
        for (int base = 0; base < length; base += laneWidth) {
            for (int lane = 0; lane < laneWidth; lane++) {
                int i = base + lane;
                out[i] = kernel(a[(i + phase) & (length - 1)], b[i]);
            }
        }
    }

    @Override
    public void validate() throws WorkloadValidationException {
        int length = a.length;
        int blocks = length / laneWidth;
        var random = new SplittableRandom(runId);
        for (int s = 0; s < SAMPLED_BLOCKS; s++) {
            int base = random.nextInt(blocks) * laneWidth;
            for (int lane = 0; lane < laneWidth; lane++) {
                int i = base + lane;
                float expected = kernel(a[(i + phase) & (length - 1)], b[i]);
                if (Float.floatToIntBits(expected) != Float.floatToIntBits(out[i])) {
                    throw new WorkloadValidationException(
                            name + " mismatch at index " + i + ": " + out[i] + " != " + expected);
                }
                if (Float.isNaN(out[i])) {
                    throw new WorkloadValidationException(name + " produced NaN at index " + i);
                }
            }
        }
    }

    private float kernel(float x, float y) {
        for (int step = 0; step < MICRO_STEPS; step++) {
            if (fused) {
                x = Math.fma(x, y + 0.6180339f, 1.4142135f);
                y = Math.fma(y, 0.9999993f, -x * 1e-3f);
            } else {
                x = x * (y + 0.6180339f) + 1.4142135f;
                y = y * 0.9999993f - x * 1e-3f;
            }
            x = x / (Math.abs(x) + 1e-8f);
            y = y / (float) Math.sqrt(y * y + 0.5f);
            x = Math.min(Math.max(x, -CAP), CAP);
        }
        return x + y;
    }
}
