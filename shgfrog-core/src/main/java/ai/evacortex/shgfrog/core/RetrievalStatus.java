/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core;

/**
 * Terminal state of a retrieval run.
 *
 * <p>None of these is a failure: the caller inspects the returned error and
 * decides whether the estimate is acceptable. Failures surface as exceptions.</p>
 */
public enum RetrievalStatus {

    /** Error reached the configured tolerance. */
    CONVERGED,

    /** Iteration cap reached; best estimate returned. */
    MAX_ITER_REACHED,

    /** Stopped through a {@code CancellationToken}; best estimate returned. */
    CANCELLED
}
