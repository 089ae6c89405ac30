/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TraceFingerprintTest {

    @Test
    void sameContentSameFingerprint() {
        double[][] a = {{1.0, 2.0}, {3.0, 4.0}};
        double[][] b = {{1.0, 2.0}, {3.0, 4.0}};
        assertEquals(TraceFingerprint.of(a), TraceFingerprint.of(b));
    }

    @Test
    void shapeAndValuesMatter() {
        long base = TraceFingerprint.of(new double[][]{{1.0, 2.0, 3.0, 4.0}});
        assertNotEquals(base, TraceFingerprint.of(new double[][]{{1.0, 2.0}, {3.0, 4.0}}));
        assertNotEquals(base, TraceFingerprint.of(new double[][]{{1.0, 2.0, 3.0, 4.000001}}));
    }

    @Test
    void hexIsSixteenDigits() {
        assertEquals("00000000000000ff", TraceFingerprint.hex(255L));
        assertEquals(16, TraceFingerprint.hex(TraceFingerprint.of(new double[][]{{1.0}})).length());
    }

    @Test
    void raggedTraceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TraceFingerprint.of(new double[][]{{1.0, 2.0}, {3.0}}));
    }
}
