/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core;

import ai.evacortex.shgfrog.core.exceptions.InvalidTraceException;
import ai.evacortex.shgfrog.core.math.TraceMath;

/**
 * Camera image of a FROG trace as delivered by the acquisition side.
 *
 * @param intensity     rows are frequency (wavelength) bins, columns delay positions
 * @param delayStep     delay per pixel column
 * @param frequencyStep frequency per pixel row
 */
public record RawTrace(double[][] intensity, double delayStep, double frequencyStep) {

    public RawTrace {
        checkSamples(intensity);
        if (!(delayStep > 0.0) || !Double.isFinite(delayStep)) {
            throw new InvalidTraceException("delay step must be positive and finite, got " + delayStep);
        }
        if (!(frequencyStep > 0.0) || !Double.isFinite(frequencyStep)) {
            throw new InvalidTraceException("frequency step must be positive and finite, got " + frequencyStep);
        }
        intensity = TraceMath.copy(intensity);
    }

    @Override
    public double[][] intensity() {
        return TraceMath.copy(intensity);
    }

    /**
     * Rejects null, empty, ragged, negative or non-finite sample arrays.
     */
    static void checkSamples(double[][] samples) {
        if (samples == null || samples.length == 0 || samples[0] == null || samples[0].length == 0) {
            throw new InvalidTraceException("image is empty");
        }
        int cols = samples[0].length;
        for (int i = 0; i < samples.length; i++) {
            if (samples[i] == null || samples[i].length != cols) {
                throw new InvalidTraceException("row " + i + " does not have " + cols + " columns");
            }
            for (int j = 0; j < cols; j++) {
                double v = samples[i][j];
                if (!Double.isFinite(v) || v < 0.0) {
                    throw new InvalidTraceException("sample (" + i + ", " + j + ") = " + v
                            + " is not a nonnegative finite value");
                }
            }
        }
    }
}
