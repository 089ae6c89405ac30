/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.math;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.jtransforms.fft.DoubleFFT_1D;
import org.jtransforms.fft.DoubleFFT_2D;

/**
 * Shared cache of JTransforms plans. A plan only holds precomputed twiddle
 * tables, so one instance per size serves every concurrent run.
 */
final class FftPlans {

    /* 2D plans are keyed by (rows, cols) */
    private record Shape(int rows, int cols) {}

    private static final LoadingCache<Integer, DoubleFFT_1D> PLANS_1D = Caffeine.newBuilder()
            .maximumSize(32)
            .build(n -> new DoubleFFT_1D(n.longValue()));

    private static final LoadingCache<Shape, DoubleFFT_2D> PLANS_2D = Caffeine.newBuilder()
            .maximumSize(8)
            .build(s -> new DoubleFFT_2D(s.rows(), s.cols()));

    private FftPlans() {}

    static DoubleFFT_1D plan(int n) {
        if (n <= 0) throw new IllegalArgumentException("FFT size must be positive: " + n);
        return PLANS_1D.get(n);
    }

    static DoubleFFT_2D plan(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("FFT shape must be positive: " + rows + "x" + cols);
        }
        return PLANS_2D.get(new Shape(rows, cols));
    }
}
