/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.config;

/**
 * What a solver does when its best error stops improving. Generalized
 * projections is not monotone, so a stall is not a failure.
 */
public enum StallAction {
    /** Keep iterating from the current field. */
    CONTINUE,
    /** Restart from a fresh gaussian guess; the best state so far is kept. */
    RESEED
}
