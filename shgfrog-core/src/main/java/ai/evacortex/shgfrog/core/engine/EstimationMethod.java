/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.engine;

import ai.evacortex.shgfrog.core.math.ComplexMatrix;

/**
 * Way the field is pulled out of the outer-product form O of a field-product
 * matrix. Resolved once per run from the configuration.
 */
public enum EstimationMethod {

    /**
     * One power-iteration step {@code O Oᴴ p_prev}. Cheap; leans toward the
     * dominant mode.
     */
    POWER {
        @Override
        double[][] extract(ComplexMatrix outer, double[] prevRe, double[] prevIm) {
            double[][] t = outer.adjointMultiply(prevRe, prevIm);
            return outer.multiply(t[0], t[1]);
        }
    },

    /**
     * Leading left singular vector of O. Exact but costlier; the previous
     * field is not used.
     */
    SVD {
        @Override
        double[][] extract(ComplexMatrix outer, double[] prevRe, double[] prevIm) {
            return LeadingSingularVector.of(outer);
        }
    };

    /**
     * Returns the unnormalized estimate as {@code {re, im}}.
     */
    abstract double[][] extract(ComplexMatrix outer, double[] prevRe, double[] prevIm);
}
