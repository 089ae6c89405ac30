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
 * Inverse of {@link ForwardTransform}: undoes its index operations in
 * reverse order to get back the outer-product form O, then extracts a field
 * from O with the configured {@link EstimationMethod}.
 *
 * <p>Applied to the unmodified output of the forward model, O is exactly
 * {@code p pᵀ} (or {@code P Pᵀ}) and the estimate equals the input field up to
 * a global phase.</p>
 */
public final class FieldEstimator {

    private final TransformOptions options;
    private final EstimationMethod method;

    public FieldEstimator(TransformOptions options, EstimationMethod method) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.method = Objects.requireNonNull(method, "method must not be null");
    }

    /**
     * @param fieldProduct amplitude-corrected EF in trace layout
     * @param previous     field the power step starts from
     * @return unit-norm estimate
     * @throws IllegalArgumentException if sizes differ
     * @throws ai.evacortex.shgfrog.core.exceptions.ZeroSignalException if the estimate vanishes
     * @throws ai.evacortex.shgfrog.core.exceptions.EstimationFailedException if the SVD fails
     */
    public PulseField estimate(ComplexMatrix fieldProduct, PulseField previous) {
        Objects.requireNonNull(fieldProduct, "fieldProduct must not be null");
        Objects.requireNonNull(previous, "previous must not be null");
        if (fieldProduct.size() != previous.size()) {
            throw new IllegalArgumentException("Matrix size " + fieldProduct.size()
                    + " does not match field length " + previous.size());
        }

        ComplexMatrix outer = outerProductForm(fieldProduct);
        double[] re = previous.real();
        double[] im = previous.imag();
        if (options.domain() == TraceDomain.TIME) {
            double[][] est = method.extract(outer, re, im);
            return new PulseField(est[0], est[1]).normalized();
        }

        Fourier.forward(re, im);
        double[][] est = method.extract(outer, re, im);
        Fourier.inverse(est[0], est[1]);
        return new PulseField(est[0], est[1]).normalized();
    }

    ComplexMatrix outerProductForm(ComplexMatrix ef) {
        int n = ef.size();
        int c = ForwardTransform.ceilHalf(n);
        if (options.domain() == TraceDomain.TIME) {
            ComplexMatrix outer = ef.rollRows(-(c - 1))
                    .ifftColumns()
                    .flipLeftRight()
                    .rollColumns(-(n / 2))
                    .rotateRows(1);
            return options.antiAlias() ? ForwardTransform.maskTime(outer) : outer;
        }

        ComplexMatrix outer = ef.transpose()
                .rollColumns(-(c - 1))
                .rollRows(-c)
                .flipUpDown()
                .flipLeftRight()
                .fftColumns()
                .rotateRows(1)
                .flipLeftRight();
        return options.antiAlias() ? ForwardTransform.maskFrequency(outer) : outer;
    }
}
