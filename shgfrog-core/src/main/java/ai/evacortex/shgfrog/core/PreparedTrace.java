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
 * Square N x N trace ready for retrieval. Rows are frequency, columns delay;
 * zero delay and zero frequency sit at {@link TraceMath#centerIndex(int)}.
 *
 * <p>The time step fixes both axes: the frequency step follows from the
 * sampling identity {@code dt * dv = 1 / N}.</p>
 *
 * @param intensity nonnegative N x N samples
 * @param timeStep  delay per column
 */
public record PreparedTrace(double[][] intensity, double timeStep) {

    public PreparedTrace {
        RawTrace.checkSamples(intensity);
        if (intensity.length != intensity[0].length) {
            throw new InvalidTraceException("prepared trace must be square, got "
                    + intensity.length + "x" + intensity[0].length);
        }
        if (!(timeStep > 0.0) || !Double.isFinite(timeStep)) {
            throw new InvalidTraceException("time step must be positive and finite, got " + timeStep);
        }
        intensity = TraceMath.copy(intensity);
    }

    @Override
    public double[][] intensity() {
        return TraceMath.copy(intensity);
    }

    public int size() {
        return intensity.length;
    }

    public double frequencyStep() {
        return 1.0 / (size() * timeStep);
    }

    public double[] delayAxis() {
        return TraceMath.axis(size(), timeStep);
    }

    public double[] frequencyAxis() {
        return TraceMath.axis(size(), frequencyStep());
    }

    /**
     * Copy scaled to unit peak.
     *
     * @throws ai.evacortex.shgfrog.core.exceptions.ZeroSignalException if every sample is zero
     */
    public PreparedTrace normalized() {
        return new PreparedTrace(TraceMath.normalizeToPeak(intensity), timeStep);
    }
}
