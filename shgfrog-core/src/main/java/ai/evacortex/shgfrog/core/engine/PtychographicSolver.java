/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.engine;

import ai.evacortex.shgfrog.core.IterationSnapshot;
import ai.evacortex.shgfrog.core.PreparedTrace;
import ai.evacortex.shgfrog.core.PulseField;
import ai.evacortex.shgfrog.core.RetrievalResult;
import ai.evacortex.shgfrog.core.RetrievalStatus;
import ai.evacortex.shgfrog.core.config.RetrievalConfig;
import ai.evacortex.shgfrog.core.config.StallAction;
import ai.evacortex.shgfrog.core.exceptions.InvalidTraceException;
import ai.evacortex.shgfrog.core.exceptions.UnsupportedConfigurationException;
import ai.evacortex.shgfrog.core.math.Fourier;
import ai.evacortex.shgfrog.core.math.TraceMath;
import ai.evacortex.shgfrog.core.progress.GuardedListener;
import ai.evacortex.shgfrog.core.progress.RetrievalListener;
import ai.evacortex.shgfrog.core.util.TraceFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Ptychographic (ePIE) retrieval working column by column on the measured
 * trace. Makes no assumption linking the delay and frequency axes beyond the
 * SHG signal {@code E(t) E(t + τ)} itself.
 *
 * <p>Column {@code j} is delay lag {@code L = c0 - j} samples and FFT bin
 * {@code m} is trace row {@code (m + c0) mod N}, with {@code c0 = ceil(N/2) - 1},
 * the layout {@link ForwardTransform} produces in the time convention. Delays
 * fall on the sample grid, so the probe shift is a cyclic index shift.</p>
 *
 * <p>Error after every pass:</p>
 * <pre>
 *     e = sqrt(Σ_supp (Ir - Fm)²) / sqrt(Σ_supp Fm²)
 * </pre>
 */
public final class PtychographicSolver implements PulseSolver {

    private static final Logger LOG = LoggerFactory.getLogger(PtychographicSolver.class);

    static final double STEP_MEAN = 0.2;
    static final double STEP_SPREAD = 1.0 / 20.0;

    private final RetrievalConfig config;

    public PtychographicSolver(RetrievalConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (config.antiAlias()) {
            throw new UnsupportedConfigurationException("ptychographic solver has no anti-alias mode");
        }
        if (config.estimationMethod() != EstimationMethod.POWER) {
            throw new UnsupportedConfigurationException("ptychographic solver does not use " + config.estimationMethod());
        }
        if (config.domain() != TraceDomain.TIME) {
            throw new UnsupportedConfigurationException("ptychographic solver works on the time-domain layout only");
        }
    }

    @Override
    public SolverKind kind() {
        return SolverKind.PTYCHOGRAPHIC;
    }

    @Override
    public RetrievalResult solve(PreparedTrace trace,
                                 PulseField seed,
                                 RetrievalListener listener,
                                 CancellationToken token) {
        Objects.requireNonNull(trace, "trace must not be null");
        RetrievalListener out = GuardedListener.wrap(listener);
        int n = trace.size();
        double[][] measured = trace.intensity();
        long fingerprint = TraceFingerprint.of(measured);
        double[][] fm = TraceMath.normalizeToPeak(measured);
        double[][] amplitude = TraceMath.sqrt(fm);
        boolean[] support = support(n, config.supportStride());
        double supportEnergy = supportedEnergy(fm, support);
        if (!(supportEnergy > 0.0)) {
            throw new InvalidTraceException("no signal on the supported frequency rows");
        }

        Random random = InitialGuess.random(config);
        PulseField start = seed == null ? InitialGuess.gaussian(n, random) : InitialGuess.fromSeed(seed, n);
        Workspace ws = new Workspace(n);
        ws.load(start, fm);
        ws.rebuildTrace();

        double error = error(ws.ir, fm, support, supportEnergy);
        Best best = new Best(ws.field(), TraceMath.copy(ws.ir), error);
        List<Double> history = new ArrayList<>();
        StallMonitor stall = new StallMonitor(config.stallWindow(), config.stallImprovement());
        int[] order = new int[n];

        int iteration = 0;
        RetrievalStatus status;
        while (true) {
            if (token != null && token.isCancelled()) {
                status = RetrievalStatus.CANCELLED;
                break;
            }
            if (config.maxIterations() > 0 && error <= config.tolerance()) {
                status = RetrievalStatus.CONVERGED;
                break;
            }
            if (iteration >= config.maxIterations()) {
                status = RetrievalStatus.MAX_ITER_REACHED;
                break;
            }
            iteration++;

            shuffle(order, random);
            double beta = Math.abs(STEP_MEAN + random.nextGaussian() * STEP_SPREAD);
            for (int j : order) {
                ws.updateColumn(j, beta, amplitude, support);
            }

            error = error(ws.ir, fm, support, supportEnergy);
            history.add(error);
            PulseField field = ws.field();
            if (error < best.error()) {
                best = new Best(field, TraceMath.copy(ws.ir), error);
            }
            LOG.debug("ePIE iteration {}: step {}, error {}", iteration, beta, error);
            out.onIteration(IterationSnapshot.capture(iteration, error, ws.ir, field, trace));

            if (config.stallAction() == StallAction.RESEED
                    && error > config.tolerance()
                    && stall.stalled(best.error())) {
                LOG.warn("ePIE error stalled at {} after {} iterations, reseeding", best.error(), iteration);
                ws.load(InitialGuess.gaussian(n, random), fm);
                ws.rebuildTrace();
                error = error(ws.ir, fm, support, supportEnergy);
                if (error < best.error()) {
                    best = new Best(ws.field(), TraceMath.copy(ws.ir), error);
                }
            }
        }

        LOG.info("ePIE finished: {} after {} iterations, error {}", status, iteration, best.error());
        return new RetrievalResult(status, best.field(), best.trace(), best.error(), iteration, history, fingerprint);
    }

    static boolean[] support(int n, int stride) {
        boolean[] support = new boolean[n];
        for (int row = 0; row < n; row++) {
            support[row] = row % stride == 0;
        }
        return support;
    }

    static double error(double[][] ir, double[][] fm, boolean[] support, double supportEnergy) {
        double sum = 0.0;
        for (int row = 0; row < fm.length; row++) {
            if (!support[row]) continue;
            for (int col = 0; col < fm[row].length; col++) {
                double d = ir[row][col] - fm[row][col];
                sum += d * d;
            }
        }
        return Math.sqrt(sum) / Math.sqrt(supportEnergy);
    }

    private static double supportedEnergy(double[][] fm, boolean[] support) {
        double sum = 0.0;
        for (int row = 0; row < fm.length; row++) {
            if (!support[row]) continue;
            for (double v : fm[row]) {
                sum += v * v;
            }
        }
        return sum;
    }

    /** Fisher-Yates over 0..n-1. */
    static void shuffle(int[] order, Random random) {
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        for (int i = order.length - 1; i > 0; i--) {
            int k = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[k];
            order[k] = tmp;
        }
    }

    private record Best(PulseField field, double[][] trace, double error) {}

    /**
     * Per-run mutable state: the running object and the reconstructed trace,
     * plus scratch buffers reused for every column.
     */
    private static final class Workspace {
        final int n;
        final int c0;
        final double[] objRe;
        final double[] objIm;
        final double[][] ir;
        final double[] tempRe;
        final double[] tempIm;
        final double[] psiRe;
        final double[] psiIm;
        final double[] bufRe;
        final double[] bufIm;

        Workspace(int n) {
            this.n = n;
            this.c0 = TraceMath.centerIndex(n);
            this.objRe = new double[n];
            this.objIm = new double[n];
            this.ir = new double[n][n];
            this.tempRe = new double[n];
            this.tempIm = new double[n];
            this.psiRe = new double[n];
            this.psiIm = new double[n];
            this.bufRe = new double[n];
            this.bufIm = new double[n];
        }

        /**
         * Loads a unit-norm start field scaled so its trace carries the same
         * total energy as {@code fm}: the trace energy is
         * {@code (Σ|E|²)² / N}, so the factor is {@code (N·ΣFm)^(1/4)}.
         */
        void load(PulseField start, double[][] fm) {
            double total = 0.0;
            for (double[] row : fm) {
                for (double v : row) total += v;
            }
            double scale = Math.pow(n * total, 0.25);
            double[] re = start.real();
            double[] im = start.imag();
            for (int i = 0; i < n; i++) {
                objRe[i] = re[i] * scale;
                objIm[i] = im[i] * scale;
            }
        }

        PulseField field() {
            return new PulseField(objRe, objIm).normalized();
        }

        /** Recomputes every column of the reconstructed trace from the object. */
        void rebuildTrace() {
            for (int j = 0; j < n; j++) {
                probe(c0 - j);
                for (int i = 0; i < n; i++) {
                    bufRe[i] = objRe[i] * tempRe[i] - objIm[i] * tempIm[i];
                    bufIm[i] = objRe[i] * tempIm[i] + objIm[i] * tempRe[i];
                }
                storeColumn(j);
            }
        }

        void updateColumn(int j, double beta, double[][] amplitude, boolean[] support) {
            int lag = c0 - j;
            probe(lag);

            // exit wave psi = obj * temp
            for (int i = 0; i < n; i++) {
                psiRe[i] = objRe[i] * tempRe[i] - objIm[i] * tempIm[i];
                psiIm[i] = objRe[i] * tempIm[i] + objIm[i] * tempRe[i];
                bufRe[i] = psiRe[i];
                bufIm[i] = psiIm[i];
            }

            // measured modulus, own phase; the 1/N and N scalings cancel out
            Fourier.forward(bufRe, bufIm);
            for (int m = 0; m < n; m++) {
                int row = (m + c0) % n;
                if (!support[row]) continue;
                double target = amplitude[row][j] * n;
                double mag = Math.hypot(bufRe[m], bufIm[m]);
                if (mag > 0.0) {
                    bufRe[m] *= target / mag;
                    bufIm[m] *= target / mag;
                } else {
                    bufRe[m] = target;
                    bufIm[m] = 0.0;
                }
            }
            Fourier.inverse(bufRe, bufIm);

            double maxTemp = 0.0;
            double maxObj = 0.0;
            for (int i = 0; i < n; i++) {
                maxTemp = Math.max(maxTemp, tempRe[i] * tempRe[i] + tempIm[i] * tempIm[i]);
                maxObj = Math.max(maxObj, objRe[i] * objRe[i] + objIm[i] * objIm[i]);
            }
            if (maxTemp > 0.0 && maxObj > 0.0) {
                double[] dRe = new double[n];
                double[] dIm = new double[n];
                double[] corrRe = new double[n];
                double[] corrIm = new double[n];
                for (int i = 0; i < n; i++) {
                    dRe[i] = bufRe[i] - psiRe[i];
                    dIm[i] = bufIm[i] - psiIm[i];
                    // conj(obj) * diff, placed back at sample i + lag
                    double gRe = objRe[i] * dRe[i] + objIm[i] * dIm[i];
                    double gIm = objRe[i] * dIm[i] - objIm[i] * dRe[i];
                    int k = Math.floorMod(i + lag, n);
                    corrRe[k] = beta * gRe / maxObj;
                    corrIm[k] = beta * gIm / maxObj;
                }
                for (int i = 0; i < n; i++) {
                    // conj(temp) * diff
                    double hRe = tempRe[i] * dRe[i] + tempIm[i] * dIm[i];
                    double hIm = tempRe[i] * dIm[i] - tempIm[i] * dRe[i];
                    objRe[i] += beta * hRe / maxTemp + corrRe[i];
                    objIm[i] += beta * hIm / maxTemp + corrIm[i];
                }
            }

            // trace column from the updated object against the probe used for the update
            for (int i = 0; i < n; i++) {
                bufRe[i] = objRe[i] * tempRe[i] - objIm[i] * tempIm[i];
                bufIm[i] = objRe[i] * tempIm[i] + objIm[i] * tempRe[i];
            }
            storeColumn(j);
        }

        /** temp[i] = obj[i + lag]. */
        private void probe(int lag) {
            for (int i = 0; i < n; i++) {
                int src = Math.floorMod(i + lag, n);
                tempRe[i] = objRe[src];
                tempIm[i] = objIm[src];
            }
        }

        /** Writes |FFT(buf) / N|² into column j, mapping bin m to row (m + c0) mod N. */
        private void storeColumn(int j) {
            Fourier.forward(bufRe, bufIm);
            double norm = (double) n * n;
            for (int m = 0; m < n; m++) {
                int row = (m + c0) % n;
                ir[row][j] = (bufRe[m] * bufRe[m] + bufIm[m] * bufIm[m]) / norm;
            }
        }
    }
}
