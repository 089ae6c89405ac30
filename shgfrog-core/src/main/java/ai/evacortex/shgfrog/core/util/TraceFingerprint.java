/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.util;

import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * xxHash64 content fingerprint of a trace. Results carry it so a stored
 * reconstruction can be matched to the measurement it came from.
 */
public final class TraceFingerprint {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private TraceFingerprint() {}

    /**
     * Hashes the shape and every sample, row by row.
     */
    public static long of(double[][] trace) {
        Objects.requireNonNull(trace, "trace must not be null");
        int cols = trace.length == 0 ? 0 : trace[0].length;
        ByteBuffer buffer = ByteBuffer.allocate(8 + trace.length * cols * Double.BYTES);
        buffer.putInt(trace.length).putInt(cols);
        for (double[] row : trace) {
            if (row.length != cols) {
                throw new IllegalArgumentException("Ragged trace: expected " + cols + " columns, got " + row.length);
            }
            for (double v : row) {
                buffer.putDouble(v);
            }
        }
        byte[] bytes = buffer.array();
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    public static String hex(long fingerprint) {
        return String.format("%016x", fingerprint);
    }
}
