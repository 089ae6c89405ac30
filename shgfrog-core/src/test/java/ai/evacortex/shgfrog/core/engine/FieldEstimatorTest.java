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
import ai.evacortex.shgfrog.core.PulseTestUtils;
import ai.evacortex.shgfrog.core.exceptions.EstimationFailedException;
import ai.evacortex.shgfrog.core.exceptions.ZeroSignalException;
import ai.evacortex.shgfrog.core.math.ComplexMatrix;
import ai.evacortex.shgfrog.core.math.Fourier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.Random;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FieldEstimatorTest {

    static Stream<Arguments> domainsAndMethods() {
        return Stream.of(
                Arguments.of(TraceDomain.TIME, EstimationMethod.POWER),
                Arguments.of(TraceDomain.TIME, EstimationMethod.SVD),
                Arguments.of(TraceDomain.FREQUENCY, EstimationMethod.POWER),
                Arguments.of(TraceDomain.FREQUENCY, EstimationMethod.SVD));
    }

    @ParameterizedTest
    @MethodSource("domainsAndMethods")
    @DisplayName("estimating from an unmodified forward output recovers the field up to global phase")
    void roundTripRecoversField(TraceDomain domain, EstimationMethod method) {
        int n = 24;
        TransformOptions options = new TransformOptions(domain, false);
        PulseField truth = PulseTestUtils.gaussian(n, 11.0, 3.0, 0.04).normalized();
        PulseField previous = PulseTestUtils.randomField(n, 99L);

        ComplexMatrix ef = new ForwardTransform(options).apply(truth).fieldProduct();
        PulseField estimate = new FieldEstimator(options, method).estimate(ef, previous);

        assertEquals(1.0, estimate.norm(), 1e-12, "estimate must be unit norm");
        assertEquals(1.0, PulseTestUtils.overlap(truth, estimate), 1e-9);
    }

    @Test
    void outerProductForm_invertsForwardExactly() {
        for (TraceDomain domain : TraceDomain.values()) {
            TransformOptions options = new TransformOptions(domain, false);
            PulseField p = PulseTestUtils.randomField(9, 3L);
            ComplexMatrix outer = new FieldEstimator(options, EstimationMethod.POWER)
                    .outerProductForm(new ForwardTransform(options).apply(p).fieldProduct());
            double[] zr = p.real();
            double[] zi = p.imag();
            if (domain == TraceDomain.FREQUENCY) {
                Fourier.forward(zr, zi);
            }
            ComplexMatrix expected = ComplexMatrix.outer(zr, zi);
            for (int i = 0; i < 9; i++) {
                for (int j = 0; j < 9; j++) {
                    assertEquals(expected.re(i, j), outer.re(i, j), 1e-9, domain + " re");
                    assertEquals(expected.im(i, j), outer.im(i, j), 1e-9, domain + " im");
                }
            }
        }
    }

    @Test
    void timeAntiAlias_recoversNarrowPulse() {
        TransformOptions options = new TransformOptions(TraceDomain.TIME, true);
        PulseField truth = PulseTestUtils.gaussian(64, 32.0, 4.0, 0.02);
        ComplexMatrix ef = new ForwardTransform(options).apply(truth).fieldProduct();
        PulseField estimate = new FieldEstimator(options, EstimationMethod.POWER)
                .estimate(ef, PulseTestUtils.transformLimited(64));
        assertEquals(1.0, PulseTestUtils.overlap(truth, estimate), 1e-9);
    }

    @Test
    @DisplayName("power and SVD estimates agree on a matrix with a dominant singular value")
    void powerAndSvdAgree() {
        int n = 32;
        TransformOptions options = TransformOptions.defaultOptions();
        PulseField truth = PulseTestUtils.gaussian(n, 15.0, 5.0, 0.03).normalized();
        ComplexMatrix ef = perturb(new ForwardTransform(options).apply(truth).fieldProduct(), 1e-5, 17L);

        PulseField power = new FieldEstimator(options, EstimationMethod.POWER).estimate(ef, truth);
        PulseField svd = new FieldEstimator(options, EstimationMethod.SVD).estimate(ef, truth);

        assertTrue(PulseTestUtils.overlap(power, svd) > 1.0 - 1e-4,
                "overlap " + PulseTestUtils.overlap(power, svd));
    }

    @Test
    void zeroMatrix_powerRaisesZeroSignal_svdRaisesEstimationFailure() {
        ComplexMatrix zero = ComplexMatrix.zeros(8);
        PulseField prev = PulseTestUtils.randomField(8, 1L);
        TransformOptions options = TransformOptions.defaultOptions();
        assertThrows(ZeroSignalException.class,
                () -> new FieldEstimator(options, EstimationMethod.POWER).estimate(zero, prev));
        assertThrows(EstimationFailedException.class,
                () -> new FieldEstimator(options, EstimationMethod.SVD).estimate(zero, prev));
    }

    @Test
    void nonFiniteMatrix_svdRaisesEstimationFailure() {
        double[][] re = new double[6][6];
        for (double[] row : re) Arrays.fill(row, Double.NaN);
        ComplexMatrix bad = ComplexMatrix.of(re, new double[6][6]);
        assertThrows(EstimationFailedException.class,
                () -> new FieldEstimator(TransformOptions.defaultOptions(), EstimationMethod.SVD)
                        .estimate(bad, PulseTestUtils.randomField(6, 2L)));
    }

    @Test
    void sizeMismatch_throwsIae() {
        assertThrows(IllegalArgumentException.class,
                () -> new FieldEstimator(TransformOptions.defaultOptions(), EstimationMethod.POWER)
                        .estimate(ComplexMatrix.zeros(8), PulseTestUtils.randomField(9, 1L)));
    }

    private static ComplexMatrix perturb(ComplexMatrix m, double amplitude, long seed) {
        Random r = new Random(seed);
        int n = m.size();
        double[][] re = new double[n][n];
        double[][] im = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                re[i][j] = m.re(i, j) + amplitude * r.nextGaussian();
                im[i][j] = m.im(i, j) + amplitude * r.nextGaussian();
            }
        }
        return ComplexMatrix.of(re, im);
    }
}
