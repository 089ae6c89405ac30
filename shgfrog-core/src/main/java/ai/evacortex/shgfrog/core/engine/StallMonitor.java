/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.engine;

/**
 * Counts iterations in which the best error failed to drop by a relative
 * margin. One instance per run.
 */
final class StallMonitor {

    private final int window;
    private final double improvement;
    private double reference = Double.POSITIVE_INFINITY;
    private int idle;

    StallMonitor(int window, double improvement) {
        this.window = window;
        this.improvement = improvement;
    }

    /**
     * Records the best error after an iteration.
     *
     * @return {@code true} when {@code window} consecutive iterations brought no
     *         sufficient improvement; the window then starts over
     */
    boolean stalled(double bestError) {
        if (bestError < reference * (1.0 - improvement)) {
            reference = bestError;
            idle = 0;
            return false;
        }
        if (++idle >= window) {
            idle = 0;
            reference = bestError;
            return true;
        }
        return false;
    }
}
