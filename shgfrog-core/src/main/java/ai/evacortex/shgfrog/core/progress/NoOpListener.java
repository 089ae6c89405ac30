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

public final class NoOpListener implements RetrievalListener {

    public static final NoOpListener INSTANCE = new NoOpListener();

    private NoOpListener() {}

    @Override
    public void onIteration(IterationSnapshot snapshot) {
        // no-op
    }
}
