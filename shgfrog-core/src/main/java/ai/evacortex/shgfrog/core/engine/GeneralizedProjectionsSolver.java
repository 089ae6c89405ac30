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
import ai.evacortex.shgfrog.core.math.ComplexMatrix;
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
 * Generalized-projections retrieval.
 *
 * <p>Each iteration projects onto the data set (the field-product matrix
 * takes the measured amplitude {@code sqrt(Fm)} and keeps its own phase) and
 * then onto the set of fields that can form an SHG outer product (one
 * {@link FieldEstimator} step). The error is</p>
 * <pre>
 *     G = RMS(Fm, α·Fr),   α = Σ(Fm·Fr) / Σ(Fr²)
 * </pre>
 * <p>G is not monotone in the iteration count; the run returns the lowest-G
 * state it visited.</p>
 */
public final class GeneralizedProjectionsSolver implements PulseSolver {

    private static final Logger LOG = LoggerFactory.getLogger(GeneralizedProjectionsSolver.class);

    private final RetrievalConfig config;
    private final ForwardTransform forward;
    private final FieldEstimator estimator;

    public GeneralizedProjectionsSolver(RetrievalConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.forward = new ForwardTransform(config.transformOptions());
        this.estimator = new FieldEstimator(config.transformOptions(), config.estimationMethod());
    }

    @Override
    public SolverKind kind() {
        return SolverKind.GENERALIZED_PROJECTIONS;
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

        Random random = InitialGuess.random(config);
        PulseField pt = seed == null ? InitialGuess.gaussian(n, random) : InitialGuess.fromSeed(seed, n);
        Evaluation current = evaluate(pt, fm);
        Evaluation best = current;
        List<Double> history = new ArrayList<>();
        StallMonitor stall = new StallMonitor(config.stallWindow(), config.stallImprovement());

        int iteration = 0;
        RetrievalStatus status;
        while (true) {
            if (token != null && token.isCancelled()) {
                status = RetrievalStatus.CANCELLED;
                break;
            }
            if (config.maxIterations() > 0 && current.error() <= config.tolerance()) {
                status = RetrievalStatus.CONVERGED;
                break;
            }
            if (iteration >= config.maxIterations()) {
                status = RetrievalStatus.MAX_ITER_REACHED;
                break;
            }
            iteration++;

            ComplexMatrix corrected = current.model().fieldProduct().withAmplitude(amplitude);
            pt = estimator.estimate(corrected, pt);
            if (config.recenter()) {
                pt = recenter(pt);
            }
            current = evaluate(pt, fm);
            history.add(current.error());
            if (current.error() < best.error()) {
                best = current;
            }
            LOG.debug("GP iteration {}: error {}", iteration, current.error());
            out.onIteration(IterationSnapshot.capture(iteration, current.error(), current.scaledTrace(), pt, trace));

            if (config.stallAction() == StallAction.RESEED
                    && current.error() > config.tolerance()
                    && stall.stalled(best.error())) {
                LOG.warn("GP error stalled at {} after {} iterations, reseeding", best.error(), iteration);
                pt = InitialGuess.gaussian(n, random);
                current = evaluate(pt, fm);
                if (current.error() < best.error()) {
                    best = current;
                }
            }
        }

        LOG.info("GP finished: {} after {} iterations, error {}", status, iteration, best.error());
        return new RetrievalResult(status, best.field(), best.scaledTrace(), best.error(),
                iteration, history, fingerprint);
    }

    private Evaluation evaluate(PulseField field, double[][] fm) {
        TraceModel model = forward.apply(field);
        double alpha = TraceMath.leastSquaresScale(fm, model.trace());
        double[][] scaled = TraceMath.scale(model.trace(), alpha);
        return new Evaluation(field, model, scaled, TraceMath.rmsDiff(fm, scaled));
    }

    /**
     * Cyclic shift putting the |E|^4-weighted centroid on the centre index.
     * Leaves the trace unchanged.
     */
    static PulseField recenter(PulseField field) {
        double[] intensity = field.intensity();
        double weight = 0.0;
        double moment = 0.0;
        for (int i = 0; i < intensity.length; i++) {
            double w = intensity[i] * intensity[i];
            weight += w;
            moment += i * w;
        }
        if (!(weight > 0.0)) return field;
        int shift = (int) Math.round(TraceMath.centerIndex(field.size()) - moment / weight);
        return shift == 0 ? field : field.shifted(shift);
    }

    private record Evaluation(PulseField field, TraceModel model, double[][] scaledTrace, double error) {}
}
