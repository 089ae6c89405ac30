/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StallMonitorTest {

    @Test
    void stallsAfterWindowWithoutImprovement() {
        StallMonitor monitor = new StallMonitor(3, 0.1);
        assertFalse(monitor.stalled(1.0));
        assertFalse(monitor.stalled(0.95));
        assertFalse(monitor.stalled(0.95));
        assertTrue(monitor.stalled(0.92));
        // window restarts at the stalled value
        assertFalse(monitor.stalled(0.92));
    }

    @Test
    void sufficientDropResetsWindow() {
        StallMonitor monitor = new StallMonitor(2, 0.1);
        assertFalse(monitor.stalled(1.0));
        assertFalse(monitor.stalled(1.0));
        assertFalse(monitor.stalled(0.5));
        assertFalse(monitor.stalled(0.5));
        assertTrue(monitor.stalled(0.5));
    }
}
