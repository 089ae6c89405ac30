/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.engine;

import ai.evacortex.shgfrog.core.config.RetrievalConfig;

/**
 * Solver families, chosen once per run from {@link RetrievalConfig#solver()}.
 */
public enum SolverKind {

    GENERALIZED_PROJECTIONS {
        @Override
        public PulseSolver create(RetrievalConfig config) {
            return new GeneralizedProjectionsSolver(config);
        }
    },

    PTYCHOGRAPHIC {
        @Override
        public PulseSolver create(RetrievalConfig config) {
            return new PtychographicSolver(config);
        }
    };

    public abstract PulseSolver create(RetrievalConfig config);
}
