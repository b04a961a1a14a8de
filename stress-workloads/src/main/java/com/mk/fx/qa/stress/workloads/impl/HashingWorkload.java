package com.mk.fx.qa.stress.workloads.impl;

import com.mk.fx.qa.stress.workloads.Workload;
import com.mk.fx.qa.stress.workloads.WorkloadValidationException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * SHA-256 and SHA-512 chained over a 32 byte feedback state. Every 1024 iterations the SHA-256
 * digest of the same message is recomputed and compared; validation also runs the FIPS 180-2
 * known-answer vector for "abc".
 */
public final class HashingWorkload implements Workload {

    public static final int DEFAULT_ITERATIONS = 200_000;

    private static final int MESSAGE_SIZE = 128;
    private static final byte[] KAT_INPUT = {'a', 'b', 'c'};
    private static final byte[] KAT_SHA256 =
            HexFormat.of().parseHex("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");

    private final int iterations;
    private final MessageDigest sha256;
    private final MessageDigest sha512;
    private final byte[] state = new byte[32];

    private boolean passed;
    private String failure;
    private int probe;

    public HashingWorkload() {
        this(DEFAULT_ITERATIONS);
    }

    public HashingWorkload(int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        this.iterations = iterations;
        try {
            this.sha256 = MessageDigest.getInstance("SHA-256");
            this.sha512 = MessageDigest.getInstance("SHA-512");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-2 digests are not available", e);
        }
        for (int i = 0; i < state.length; i++) {
            state[i] = (byte) (i * 0x3B + 0x6D);
        }
    }

    @Override
    public void runStep() {
        var message = ByteBuffer.allocate(MESSAGE_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        long s0 = 0x9E3779B97F4A7C15L;
        long s1 = 0xC2B2AE3D27D4EB4FL;
        passed = false;
        failure = null;

        for (int i = 0; i < iterations; i++) {
            message.clear();
            message.put(state);
            message.putLong(i);
            while (message.remaining() >= Long.BYTES) {
                long x = s0;
                long y = s1;
                s0 = y;
                x ^= x << 23;
                s1 = x ^ y ^ (x >>> 17) ^ (y >>> 26);
                message.putLong(s1 + y);
            }
            byte[] msg = message.array();

            byte[] h256 = sha256.digest(msg);
            byte[] h512 = sha512.digest(msg);
            for (int k = 0; k < state.length; k++) {
                state[k] ^= (byte) (h256[k] ^ h512[k] ^ h512[k + 32]);
            }

            if ((i & 1023) == 0 && !Arrays.equals(h256, sha256.digest(msg))) {
                failure = "SHA-256 recheck mismatch at iteration " + i;
                return;
            }
        }

        probe = ByteBuffer.wrap(state).getInt() ^ Arrays.hashCode(state);
        passed = true;
    }

    @Override
    public void validate() throws WorkloadValidationException {
        if (!passed) {
            throw new WorkloadValidationException(
                    "Hashing error: " + (failure != null ? failure : "run did not complete"));
        }
        if (probe == 0 || probe == -1) {
            throw new WorkloadValidationException("Hashing error: trivial state probe " + probe);
        }
        if (!Arrays.equals(KAT_SHA256, sha256.digest(KAT_INPUT))) {
            throw new WorkloadValidationException("Hashing error: SHA-256 known-answer test failed");
        }
    }
}
