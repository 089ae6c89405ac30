/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.engine;

import java.util.Objects;

/**
 * Forward-model settings shared by {@link ForwardTransform} and the matching
 * {@link FieldEstimator}.
 */
public record TransformOptions(
        TraceDomain domain,     // construction convention of EF
        boolean antiAlias       // drop products outside the measured window
) {
    public TransformOptions {
        Objects.requireNonNull(domain, "domain must not be null");
    }

    public static TransformOptions defaultOptions() {
        return new TransformOptions(TraceDomain.TIME, false);
    }
}
