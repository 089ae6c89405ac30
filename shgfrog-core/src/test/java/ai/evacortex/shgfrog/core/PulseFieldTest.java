/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core;

import ai.evacortex.shgfrog.core.exceptions.ZeroSignalException;
import ai.evacortex.shgfrog.core.math.TraceMath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PulseFieldTest {

    @Test
    void samplesAreCopied() {
        double[] re = {1.0, 2.0};
        PulseField field = new PulseField(re, new double[2]);
        re[0] = 9.0;
        assertEquals(1.0, field.real()[0], 0.0);
        field.real()[1] = 9.0;
        assertEquals(2.0, field.real()[1], 0.0);
    }

    @Test
    void normalizedHasUnitNorm() {
        PulseField field = new PulseField(new double[]{3.0, 0.0}, new double[]{0.0, 4.0});
        assertEquals(5.0, field.norm(), 1e-12);
        assertEquals(1.0, field.normalized().norm(), 1e-12);
        assertThrows(ZeroSignalException.class, () -> new PulseField(new double[3], new double[3]).normalized());
    }

    @Test
    void shiftedIsCyclic() {
        PulseField field = new PulseField(new double[]{1, 2, 3, 4}, new double[4]);
        assertArrayEquals(new double[]{4, 1, 2, 3}, field.shifted(1).real(), 0.0);
        assertArrayEquals(new double[]{2, 3, 4, 1}, field.shifted(-1).real(), 0.0);
    }

    @Test
    void overlapIgnoresGlobalPhase() {
        PulseField field = PulseTestUtils.gaussian(16, 8.0, 3.0, 0.1);
        double[] re = field.real();
        double[] im = field.imag();
        for (int i = 0; i < re.length; i++) {
            double r = -im[i];
            im[i] = re[i];
            re[i] = r;
        }
        assertEquals(1.0, PulseTestUtils.overlap(field, new PulseField(re, im)), 1e-12);
    }

    @Test
    void centredImpulseHasFlatSpectrum() {
        int n = 9;
        double[] re = new double[n];
        re[TraceMath.centerIndex(n)] = 1.0;
        PulseField spectrum = new PulseField(re, new double[n]).spectrum();
        for (int k = 0; k < n; k++) {
            assertEquals(1.0, spectrum.intensity()[k], 1e-12);
            assertEquals(0.0, spectrum.phase()[k], 1e-12);
        }
    }

    @Test
    void mismatchedOrEmptyArraysAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PulseField(new double[2], new double[3]));
        assertThrows(IllegalArgumentException.class, () -> new PulseField(new double[0], new double[0]));
    }
}
