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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delegating listener that logs and drops any exception thrown by the
 * delegate, so a faulty observer can never abort a run.
 */
public final class GuardedListener implements RetrievalListener {

    private static final Logger LOG = LoggerFactory.getLogger(GuardedListener.class);

    private final RetrievalListener delegate;

    private GuardedListener(RetrievalListener delegate) {
        this.delegate = delegate;
    }

    /**
     * Wraps {@code listener}; {@code null} becomes {@link NoOpListener}.
     */
    public static RetrievalListener wrap(RetrievalListener listener) {
        if (listener == null || listener instanceof NoOpListener) return NoOpListener.INSTANCE;
        if (listener instanceof GuardedListener) return listener;
        return new GuardedListener(listener);
    }

    @Override
    public void onIteration(IterationSnapshot snapshot) {
        try {
            delegate.onIteration(snapshot);
        } catch (RuntimeException e) {
            LOG.warn("Listener failed on iteration {}: {}", snapshot.iteration(), e.toString(), e);
        }
    }

    @Override
    public void onComplete(RetrievalResult result) {
        try {
            delegate.onComplete(result);
        } catch (RuntimeException e) {
            LOG.warn("Listener failed on completion: {}", e.toString(), e);
        }
    }
}
