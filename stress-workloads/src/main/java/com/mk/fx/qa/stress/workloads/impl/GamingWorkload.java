package com.mk.fx.qa.stress.workloads.impl;

import com.mk.fx.qa.stress.workloads.Workload;
import com.mk.fx.qa.stress.workloads.WorkloadValidationException;
import java.util.SplittableRandom;

/**
 * Game-like mixed load: a fixed number of simulation frames over a particle set with velocity
 * integration, wall bounces and a rotating camera transform.
 */
public final class GamingWorkload implements Workload {

    public static final int DEFAULT_OBJECTS = 1000;
    public static final int DEFAULT_FRAMES = 2000;

    private static final float DT = 0.007f;
    private static final float MIN = 0f;
    private static final float MAX = 100f;

    private final int frames;
    private final float[] x;
    private final float[] y;
    private final float[] z;
    private final float[] vx;
    private final float[] vy;
    private final float[] vz;

    private float angle;
    private double checksum;
    private String violation;

    public GamingWorkload() {
        this(DEFAULT_OBJECTS, DEFAULT_FRAMES);
    }

    public GamingWorkload(int objects, int frames) {
        if (objects < 1 || frames < 1) {
            throw new IllegalArgumentException("objects and frames must be positive");
        }
        this.frames = frames;
        this.x = new float[objects];
        this.y = new float[objects];
        this.z = new float[objects];
        this.vx = new float[objects];
        this.vy = new float[objects];
        this.vz = new float[objects];

        var random = new SplittableRandom(12345);
        for (int i = 0; i < objects; i++) {
            x[i] = MIN + (float) random.nextDouble() * (MAX - MIN);
            y[i] = MIN + (float) random.nextDouble() * (MAX - MIN);
            z[i] = MIN + (float) random.nextDouble() * (MAX - MIN);
            vx[i] = (float) random.nextDouble() * 10f - 5f;
            vy[i] = (float) random.nextDouble() * 10f - 5f;
            vz[i] = (float) random.nextDouble() * 10f - 5f;
        }
    }

    @Override
    public void runStep() {
        violation = null;
        for (int frame = 0; frame < frames; frame++) {
            stepFrame();
        }
        for (int i = 0; i < x.length && violation == null; i++) {
            if (!inBounds(x[i]) || !inBounds(y[i]) || !inBounds(z[i])) {
                violation = "object " + i + " left the world at (" + x[i] + ", " + y[i] + ", " + z[i] + ")";
            }
        }
    }

    @Override
    public void validate() throws WorkloadValidationException {
        if (violation != null) {
            throw new WorkloadValidationException("Simulation error: " + violation);
        }
        if (Double.isNaN(checksum) || Double.isInfinite(checksum)) {
            throw new WorkloadValidationException("Simulation error: checksum is " + checksum);
        }
    }

    private void stepFrame() {
        angle += 0.001f;
        float cos = (float) Math.cos(angle);
        float sin = (float) Math.sin(angle);
        float sumPositions = 0f;

        for (int i = 0; i < x.length; i++) {
            x[i] += vx[i] * DT;
            y[i] += vy[i] * DT;
            z[i] += vz[i] * DT;

            if (x[i] < MIN || x[i] > MAX) {
                vx[i] = -vx[i];
                x[i] = clamp(x[i]);
            }
            if (y[i] < MIN || y[i] > MAX) {
                vy[i] = -vy[i];
                y[i] = clamp(y[i]);
            }
            if (z[i] < MIN || z[i] > MAX) {
                vz[i] = -vz[i];
                z[i] = clamp(z[i]);
            }
            sumPositions += x[i] * cos + z[i] * sin - y[i] * 1e-3f;
        }

        float dummy = sumPositions + cos - sin;
        checksum += Math.sqrt(dummy * dummy + Math.abs(Math.sin(dummy)));
        if (checksum > 1e300) {
            checksum = 0;
        }
    }

    private static boolean inBounds(float v) {
        return v >= MIN && v <= MAX;
    }

    private static float clamp(float v) {
        return Math.min(Math.max(v, MIN), MAX);
    }
}
