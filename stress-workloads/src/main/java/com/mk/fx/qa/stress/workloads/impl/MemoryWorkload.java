package com.mk.fx.qa.stress.workloads.impl;

import com.mk.fx.qa.stress.workloads.Workload;
import com.mk.fx.qa.stress.workloads.WorkloadValidationException;
import java.util.Arrays;
import java.util.SplittableRandom;

/**
 * Memory load: pattern fill, overlapping block moves, page-strided writes and a self-cancelling
 * random read-modify-write pass over a large buffer. After a run the buffer must match the shadow
 * copy taken right after the fill.
 */
public final class MemoryWorkload implements Workload {

    public static final int DEFAULT_BUFFER_BYTES = 16 * 1024 * 1024;

    private static final int STRIDE = 4096;
    private static final int OVERLAP = 2048;
    private static final int GOLDEN = 0x9E3779B1;

    private final int bufferBytes;
    private final int randomOps;

    private byte[] buffer;
    private byte[] shadow;
    private int runId;
    private long checksumAfter;

    public MemoryWorkload() {
        this(DEFAULT_BUFFER_BYTES, 2_000_000);
    }

    public MemoryWorkload(int bufferBytes, int randomOps) {
        if (bufferBytes < 2 * STRIDE) {
            throw new IllegalArgumentException("bufferBytes must be at least " + 2 * STRIDE);
        }
        this.bufferBytes = bufferBytes;
        this.randomOps = Math.max(0, randomOps);
    }

    @Override
    public void runStep() {
        if (buffer == null) {
            buffer = new byte[bufferBytes];
            shadow = new byte[bufferBytes];
        }

        fillPattern(buffer);
        System.arraycopy(buffer, 0, shadow, 0, bufferBytes);

        // overlapping move, then restore from the shadow copy
        System.arraycopy(buffer, 0, buffer, OVERLAP, bufferBytes - OVERLAP);
        System.arraycopy(shadow, 0, buffer, 0, bufferBytes);

        stridedMarkerXor(buffer);
        stridedMarkerXor(buffer);

        long seed = 0xC0FFEEL ^ ++runId;
        randomXor(buffer, seed);
        randomXor(buffer, seed);

        checksumAfter = checksum(buffer);
    }

    @Override
    public void validate() throws WorkloadValidationException {
        if (buffer == null) {
            throw new WorkloadValidationException("Memory error: buffer was never filled");
        }
        if (checksumAfter != checksum(shadow) || !Arrays.equals(buffer, shadow)) {
            int mismatch = Arrays.mismatch(buffer, shadow);
            throw new WorkloadValidationException(
                    "Memory error: buffer integrity broken at offset " + mismatch);
        }
    }

    private static void fillPattern(byte[] data) {
        for (int i = 0; i < data.length; i++) {
            int t = i * GOLDEN;
            t ^= (t >>> 13) | (t << 19);
            data[i] = (byte) (t ^ (t >>> 8));
        }
    }

    private static void stridedMarkerXor(byte[] data) {
        for (int i = 0; i < data.length; i += STRIDE) {
            data[i] ^= (byte) 0xA5;
        }
    }

    private void randomXor(byte[] data, long seed) {
        var random = new SplittableRandom(seed);
        for (int i = 0; i < randomOps; i++) {
            int index = random.nextInt(data.length);
            data[index] ^= (byte) (i | 1);
        }
    }

    private static long checksum(byte[] data) {
        long h = 0xCBF29CE484222325L;
        for (byte b : data) {
            h ^= b & 0xFF;
            h *= 0x100000001B3L;
        }
        return h;
    }
}
