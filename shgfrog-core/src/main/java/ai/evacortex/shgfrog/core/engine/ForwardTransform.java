/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.engine;

import ai.evacortex.shgfrog.core.PulseField;
import ai.evacortex.shgfrog.core.math.ComplexMatrix;
import ai.evacortex.shgfrog.core.math.Fourier;

import java.util.Objects;

/**
 * SHG-FROG forward model: predicts the trace of a candidate field.
 *
 * <p>With {@code c = ceil(N/2)}, zero delay and zero frequency land at index
 * {@code c - 1} in both conventions. Column {@code j} holds delay lag
 * {@code c - 1 - j} in samples, row {@code r} frequency {@code r - (c - 1)}.</p>
 *
 * <pre>
 *     TIME:      EF = p pᵀ → [mask] → rotate rows → center columns → FFT columns
 *     FREQUENCY: EF = P Pᵀ → [mask] → flip → rotate rows → IFFT columns → re-center → transpose
 * </pre>
 *
 * <p>Without anti-aliasing both conventions yield the same trace. The class is
 * stateless apart from its options and safe to share.</p>
 */
public final class ForwardTransform {

    private final TransformOptions options;

    public ForwardTransform(TransformOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public TraceModel apply(PulseField field) {
        Objects.requireNonNull(field, "field must not be null");
        ComplexMatrix ef = options.domain() == TraceDomain.TIME
                ? timeDomain(field)
                : frequencyDomain(field);
        return new TraceModel(ef, ef.intensity());
    }

    private ComplexMatrix timeDomain(PulseField field) {
        int n = field.size();
        int c = ceilHalf(n);
        ComplexMatrix ef = ComplexMatrix.outer(field.real(), field.imag());
        if (options.antiAlias()) {
            ef = maskTime(ef);
        }
        return ef.rotateRows(-1)
                .rollColumns(n / 2)
                .flipLeftRight()
                .fftColumns()
                .rollRows(c - 1);
    }

    private ComplexMatrix frequencyDomain(PulseField field) {
        int n = field.size();
        int c = ceilHalf(n);
        double[] re = field.real();
        double[] im = field.imag();
        Fourier.forward(re, im);
        ComplexMatrix ef = ComplexMatrix.outer(re, im);
        if (options.antiAlias()) {
            ef = maskFrequency(ef);
        }
        return ef.flipLeftRight()
                .rotateRows(-1)
                .ifftColumns()
                .flipUpDown()
                .flipLeftRight()
                .rollRows(c)
                .rollColumns(c - 1)
                .transpose();
    }

    static int ceilHalf(int n) {
        return (n + 1) / 2;
    }

    /**
     * Zeroes products {@code p_i p_j} with {@code |i - j| >= ceil(N/2)}: delays
     * the measurement window cannot hold. Both halves go, so the trace stays
     * symmetric under delay reversal.
     */
    static ComplexMatrix maskTime(ComplexMatrix outer) {
        int c = ceilHalf(outer.size());
        return outer.zeroWhere((i, j) -> Math.abs(i - j) >= c);
    }

    /**
     * Zeroes spectral products {@code P(v1) P(v2)} whose sum frequency falls
     * outside the band. For even N the edge frequency counts as positive.
     */
    static ComplexMatrix maskFrequency(ComplexMatrix outer) {
        int n = outer.size();
        int vmax = n / 2;
        int vmin = vmax + 1;
        return outer.zeroWhere((row, col) -> {
            if (row >= 1 && row <= vmax) {
                return col >= vmax - row + 1 && col <= vmax;
            }
            if (row >= vmin) {
                return col >= vmin && col <= vmin + n - row - 1;
            }
            return false;
        });
    }
}
