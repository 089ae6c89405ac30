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
 * Convention in which the field-product matrix is built. Both describe the
 * same SHG-FROG trace; they differ in how discretization and anti-aliasing act.
 */
public enum TraceDomain {
    /** Outer product of the time samples, Fourier transformed along delay. */
    TIME,
    /** Outer product of the spectrum, inverse transformed along frequency. */
    FREQUENCY
}
