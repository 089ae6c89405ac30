/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.engine;

import ai.evacortex.shgfrog.core.PreparedTrace;
import ai.evacortex.shgfrog.core.PulseField;
import ai.evacortex.shgfrog.core.PulseTestUtils;
import ai.evacortex.shgfrog.core.RetrievalResult;
import ai.evacortex.shgfrog.core.RetrievalStatus;
import ai.evacortex.shgfrog.core.config.RetrievalConfig;
import ai.evacortex.shgfrog.core.config.StallAction;
import ai.evacortex.shgfrog.core.exceptions.InvalidTraceException;
import ai.evacortex.shgfrog.core.exceptions.UnsupportedConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PtychographicSolverTest {

    private static final int N = 32;

    private static RetrievalConfig.Builder config() {
        return RetrievalConfig.builder()
                .prepSize(N)
                .randomSeed(3L)
                .solver(SolverKind.PTYCHOGRAPHIC);
    }

    @Test
    void unsupportedOptionsAreRejected() {
        assertThrows(UnsupportedConfigurationException.class,
                () -> SolverKind.PTYCHOGRAPHIC.create(config().antiAlias(true).build()));
        assertThrows(UnsupportedConfigurationException.class,
                () -> SolverKind.PTYCHOGRAPHIC.create(config().estimationMethod(EstimationMethod.SVD).build()));
        assertThrows(UnsupportedConfigurationException.class,
                () -> SolverKind.PTYCHOGRAPHIC.create(config().domain(TraceDomain.FREQUENCY).build()));
    }

    @Test
    void exactSeed_reproducesTrace() {
        PulseField truth = PulseTestUtils.transformLimited(N);
        RetrievalResult result = new PtychographicSolver(config().tolerance(1e-9).build())
                .solve(PulseTestUtils.traceOf(truth), truth, null, null);

        assertEquals(RetrievalStatus.CONVERGED, result.status());
        assertEquals(0, result.iterations());
        assertTrue(result.error() <= 1e-9);
    }

    @Test
    @DisplayName("noise-free 64-point trace is retrieved up to global phase and time shift")
    void noiseFreeRoundTrip_converges() {
        int n = 64;
        PulseField truth = PulseTestUtils.transformLimited(n);
        RetrievalResult result = new PtychographicSolver(RetrievalConfig.builder()
                .solver(SolverKind.PTYCHOGRAPHIC)
                .prepSize(n)
                .maxIterations(200)
                .tolerance(1e-3)
                .randomSeed(1L)
                .build())
                .solve(PulseTestUtils.traceOf(truth), PulseTestUtils.withPhaseNoise(truth, 0.1, 7L), null, null);

        assertEquals(RetrievalStatus.CONVERGED, result.status());
        assertTrue(result.error() <= 1e-3, "error " + result.error());
        assertTrue(PulseTestUtils.bestOverlap(truth, result.field()) > 0.999);
    }

    @Test
    void zeroIterationCap_winsOverConvergedSeed() {
        PulseField truth = PulseTestUtils.transformLimited(N);
        RetrievalResult result = new PtychographicSolver(config().maxIterations(0).tolerance(1e-3).build())
                .solve(PulseTestUtils.traceOf(truth), truth, null, null);
        assertEquals(RetrievalStatus.MAX_ITER_REACHED, result.status());
        assertEquals(0, result.iterations());
    }

    @Test
    @DisplayName("a reseed that already fits the trace becomes the returned state")
    void reseedMeetingTolerance_isReturned() {
        // two passes consume one shuffle and one step draw each before the stall fires
        Random random = new Random(3L);
        int[] order = new int[N];
        for (int pass = 0; pass < 2; pass++) {
            PtychographicSolver.shuffle(order, random);
            random.nextGaussian();
        }
        PulseField reseed = InitialGuess.gaussian(N, random);

        RetrievalResult result = new PtychographicSolver(config()
                .stallAction(StallAction.RESEED)
                .stallWindow(1)
                .stallImprovement(0.999)
                .tolerance(1e-6)
                .maxIterations(50)
                .build())
                .solve(PulseTestUtils.traceOf(reseed), PulseTestUtils.randomField(N, 99L), null, null);

        assertEquals(RetrievalStatus.CONVERGED, result.status());
        assertEquals(2, result.iterations());
        assertTrue(result.error() <= 1e-6, "error " + result.error());
        assertTrue(PulseTestUtils.overlap(reseed, result.field()) > 0.999999);
    }

    @Test
    void noisySeed_errorDrops() {
        PulseField truth = PulseTestUtils.transformLimited(N);
        PreparedTrace trace = PulseTestUtils.traceOf(truth);
        PulseField seed = PulseTestUtils.withPhaseNoise(truth, 0.3, 5L);

        RetrievalResult start = new PtychographicSolver(config().maxIterations(0).tolerance(0.0).build())
                .solve(trace, seed, null, null);
        RetrievalResult result = new PtychographicSolver(config().maxIterations(80).tolerance(0.0).build())
                .solve(trace, seed, null, null);

        assertTrue(start.error() > 0.0);
        assertTrue(result.error() < start.error(), "error should drop from " + start.error());
        assertTrue(PulseTestUtils.bestOverlap(truth, result.field()) > 0.9);
    }

    @Test
    void support_keepsEveryStrideRow() {
        boolean[] all = PtychographicSolver.support(6, 1);
        boolean[] half = PtychographicSolver.support(6, 2);
        assertArrayEquals(new boolean[]{true, true, true, true, true, true}, all);
        assertArrayEquals(new boolean[]{true, false, true, false, true, false}, half);
    }

    @Test
    void error_ignoresUnsupportedRows() {
        double[][] fm = {{1.0, 0.0}, {0.0, 1.0}};
        double[][] ir = {{1.0, 0.0}, {5.0, 5.0}};
        boolean[] support = {true, false};
        assertEquals(0.0, PtychographicSolver.error(ir, fm, support, 1.0), 0.0);
        assertEquals(Math.sqrt(2.0) / Math.sqrt(2.0),
                PtychographicSolver.error(new double[2][2], fm, new boolean[]{true, true}, 2.0), 1e-15);
    }

    @Test
    void stridedSupport_runs() {
        PulseField truth = PulseTestUtils.gaussian(N, N / 2.0, 5.0, 0.02);
        RetrievalResult result = new PtychographicSolver(config().supportStride(2).maxIterations(4).tolerance(0.0).build())
                .solve(PulseTestUtils.traceOf(truth));
        assertEquals(4, result.iterations());
        assertTrue(Double.isFinite(result.error()));
    }

    @Test
    void signalOnlyOffSupport_isRejected() {
        double[][] f = new double[N][N];
        f[1][3] = 1.0;
        PtychographicSolver solver = new PtychographicSolver(config().supportStride(2).build());
        assertThrows(InvalidTraceException.class, () -> solver.solve(new PreparedTrace(f, 1.0)));
    }
}
