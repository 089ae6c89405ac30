/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.engine;

import ai.evacortex.shgfrog.core.PulseField;
import ai.evacortex.shgfrog.core.config.RetrievalConfig;

import java.util.Objects;
import java.util.Random;

/**
 * Starting fields for the solvers.
 */
final class InitialGuess {

    /** Spread of the random starting phase, radians. */
    static final double PHASE_SPREAD = 0.2 * Math.PI;

    private InitialGuess() {}

    static Random random(RetrievalConfig config) {
        Long seed = config.randomSeed();
        return seed == null ? new Random() : new Random(seed);
    }

    /**
     * Gaussian envelope of intensity FWHM about N/5 samples, centred at N/2,
     * times a small random phase. A purely real start tends to stay real; a
     * wide phase spread aliases.
     */
    static PulseField gaussian(int n, Random random) {
        double[] amplitude = new double[n];
        double[] phase = new double[n];
        double width = n / 10.0;
        for (int i = 0; i < n; i++) {
            double x = (i - n / 2.0) / width;
            amplitude[i] = Math.exp(-2.0 * Math.log(2.0) * x * x);
            phase[i] = PHASE_SPREAD * random.nextDouble();
        }
        return PulseField.polar(amplitude, phase).normalized();
    }

    /**
     * Size-checked, unit-norm copy of a caller-supplied seed.
     */
    static PulseField fromSeed(PulseField seed, int n) {
        Objects.requireNonNull(seed, "seed must not be null");
        if (seed.size() != n) {
            throw new IllegalArgumentException("Seed has " + seed.size() + " samples, trace needs " + n);
        }
        return seed.normalized();
    }
}
