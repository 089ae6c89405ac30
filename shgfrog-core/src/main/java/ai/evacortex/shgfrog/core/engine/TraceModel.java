/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.engine;

import ai.evacortex.shgfrog.core.math.ComplexMatrix;

/**
 * Output of {@link ForwardTransform}: the field-product matrix EF and the
 * trace {@code F = |EF|^2}. Rows are frequency, columns delay.
 */
public record TraceModel(ComplexMatrix fieldProduct, double[][] trace) {

    public int size() {
        return fieldProduct.size();
    }
}
