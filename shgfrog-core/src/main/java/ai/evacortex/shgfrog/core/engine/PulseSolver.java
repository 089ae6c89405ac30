/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.engine;

import ai.evacortex.shgfrog.core.PreparedTrace;
import ai.evacortex.shgfrog.core.PulseField;
import ai.evacortex.shgfrog.core.RetrievalResult;
import ai.evacortex.shgfrog.core.progress.NoOpListener;
import ai.evacortex.shgfrog.core.progress.RetrievalListener;

/**
 * Iterative reconstruction of a pulse field from a prepared trace.
 *
 * <p>A solver holds only its immutable configuration; every call to
 * {@link #solve} owns its own buffers, so one instance may serve concurrent
 * runs on different threads.</p>
 *
 * <p>Reaching the iteration cap or being cancelled is reported through
 * {@link ai.evacortex.shgfrog.core.RetrievalStatus}, never thrown. The result
 * always carries the lowest-error state the run visited. A run with an
 * iteration cap of zero returns the normalized starting field as
 * {@code MAX_ITER_REACHED}, whatever its error.</p>
 *
 * @see GeneralizedProjectionsSolver
 * @see PtychographicSolver
 */
public interface PulseSolver {

    /**
     * @param trace    prepared N x N measurement
     * @param seed     starting field of length N, or {@code null} for a gaussian guess
     * @param listener receives a snapshot after every iteration; may be {@code null}
     * @param token    polled before every iteration; may be {@code null}
     * @return best state of the run
     * @throws ai.evacortex.shgfrog.core.exceptions.ZeroSignalException if the trace or seed is all zero
     * @throws IllegalArgumentException if the seed length differs from N
     */
    RetrievalResult solve(PreparedTrace trace, PulseField seed, RetrievalListener listener, CancellationToken token);

    default RetrievalResult solve(PreparedTrace trace) {
        return solve(trace, null, NoOpListener.INSTANCE, null);
    }

    SolverKind kind();
}
