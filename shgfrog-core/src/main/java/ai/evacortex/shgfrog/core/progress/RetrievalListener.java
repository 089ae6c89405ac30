/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.progress;

import ai.evacortex.shgfrog.core.IterationSnapshot;
import ai.evacortex.shgfrog.core.RetrievalResult;

/**
 * Observer of a retrieval run.
 *
 * <p>Calls arrive on the solver thread. Implementations must return quickly
 * and must not call back into the solver; wrap a slow consumer in
 * {@link AsyncRetrievalListener}. An exception thrown here is logged and does
 * not affect the run.</p>
 */
public interface RetrievalListener {

    void onIteration(IterationSnapshot snapshot);

    default void onComplete(RetrievalResult result) {
        // nothing by default
    }
}
