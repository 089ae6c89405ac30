/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core;

import ai.evacortex.shgfrog.core.math.TraceMath;

/**
 * Progress notification emitted after every iteration. Every array is a
 * private copy, so a listener may keep or modify it.
 *
 * <p>Intensities are scaled to unit peak; phases are in radians.</p>
 */
public record IterationSnapshot(int iteration,
                                double error,
                                double[][] reconstructedTrace,
                                double[] timeIntensity,
                                double[] timePhase,
                                double[] spectralIntensity,
                                double[] spectralPhase,
                                double[] delayAxis,
                                double[] frequencyAxis) {

    /**
     * Builds a snapshot from the current field and trace. Axes come from the
     * prepared trace time step.
     */
    public static IterationSnapshot capture(int iteration,
                                            double error,
                                            double[][] reconstructedTrace,
                                            PulseField field,
                                            PreparedTrace trace) {
        PulseField spectrum = field.spectrum();
        return new IterationSnapshot(
                iteration,
                error,
                TraceMath.copy(reconstructedTrace),
                unitPeak(field.intensity()),
                field.phase(),
                unitPeak(spectrum.intensity()),
                spectrum.phase(),
                trace.delayAxis(),
                trace.frequencyAxis());
    }

    private static double[] unitPeak(double[] values) {
        double max = 0.0;
        for (double v : values) {
            if (v > max) max = v;
        }
        if (max == 0.0) return values;
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] / max;
        }
        return out;
    }
}
