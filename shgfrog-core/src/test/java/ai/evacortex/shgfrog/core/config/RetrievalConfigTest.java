/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.config;

import ai.evacortex.shgfrog.core.engine.TraceDomain;
import ai.evacortex.shgfrog.core.exceptions.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetrievalConfigTest {

    @Test
    void toBuilderRoundTrips() {
        RetrievalConfig c = RetrievalConfig.builder()
                .prepSize(64)
                .domain(TraceDomain.FREQUENCY)
                .randomSeed(5L)
                .supportStride(2)
                .build();
        assertEquals(c, c.toBuilder().build());
        assertEquals(TraceDomain.FREQUENCY, c.transformOptions().domain());
        assertFalse(c.transformOptions().antiAlias());
    }

    @Test
    void zeroIterationsIsAllowed() {
        assertEquals(0, RetrievalConfig.builder().maxIterations(0).build().maxIterations());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(InvalidConfigurationException.class, () -> RetrievalConfig.builder().prepSize(3).build());
        assertThrows(InvalidConfigurationException.class, () -> RetrievalConfig.builder().maxIterations(-1).build());
        assertThrows(InvalidConfigurationException.class, () -> RetrievalConfig.builder().tolerance(Double.NaN).build());
        assertThrows(InvalidConfigurationException.class, () -> RetrievalConfig.builder().solver(null).build());
        assertThrows(InvalidConfigurationException.class, () -> RetrievalConfig.builder().stallWindow(0).build());
        assertThrows(InvalidConfigurationException.class, () -> RetrievalConfig.builder().stallImprovement(1.0).build());
        assertThrows(InvalidConfigurationException.class, () -> RetrievalConfig.builder().supportStride(0).build());
    }
}
