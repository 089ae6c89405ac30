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

import java.util.List;
import java.util.Objects;

/**
 * Final outcome of one retrieval run: the best field seen, its trace scaled to
 * the measurement, the error of that state and the per-iteration history.
 *
 * @param status            terminal state
 * @param field             best field, unit norm
 * @param reconstructedTrace {@code alpha * |EF|^2} of the best field
 * @param error             error of the best field
 * @param iterations        iterations actually performed
 * @param errorHistory      error after every iteration, in order
 * @param traceFingerprint  xxHash64 of the prepared trace the run consumed
 */
public record RetrievalResult(RetrievalStatus status,
                              PulseField field,
                              double[][] reconstructedTrace,
                              double error,
                              int iterations,
                              List<Double> errorHistory,
                              long traceFingerprint) {

    public RetrievalResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(reconstructedTrace, "reconstructedTrace must not be null");
        reconstructedTrace = TraceMath.copy(reconstructedTrace);
        errorHistory = List.copyOf(errorHistory);
    }

    @Override
    public double[][] reconstructedTrace() {
        return TraceMath.copy(reconstructedTrace);
    }

    public boolean converged() {
        return status == RetrievalStatus.CONVERGED;
    }

    @Override
    public String toString() {
        return "RetrievalResult[status=" + status + ", error=" + error + ", iterations=" + iterations
                + ", fingerprint=" + Long.toHexString(traceFingerprint) + "]";
    }
}
