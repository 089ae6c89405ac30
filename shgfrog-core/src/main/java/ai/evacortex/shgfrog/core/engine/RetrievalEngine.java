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
import ai.evacortex.shgfrog.core.RawTrace;
import ai.evacortex.shgfrog.core.RetrievalResult;
import ai.evacortex.shgfrog.core.config.RetrievalConfig;
import ai.evacortex.shgfrog.core.prep.TracePreprocessor;
import ai.evacortex.shgfrog.core.progress.GuardedListener;
import ai.evacortex.shgfrog.core.progress.NoOpListener;
import ai.evacortex.shgfrog.core.progress.RetrievalListener;
import ai.evacortex.shgfrog.core.util.TraceFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point tying preparation and retrieval together under one immutable
 * {@link RetrievalConfig}. The solver family is chosen when the engine is
 * built; an instance holds no per-run state and may be shared.
 */
public class RetrievalEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RetrievalEngine.class);

    private final RetrievalConfig config;
    private final TracePreprocessor preprocessor;
    private final PulseSolver solver;

    public RetrievalEngine(RetrievalConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.preprocessor = new TracePreprocessor(config.prepSize(), config.orientation());
        this.solver = config.solver().create(config);
    }

    public RetrievalConfig config() {
        return config;
    }

    public PulseSolver solver() {
        return solver;
    }

    public PreparedTrace prepare(RawTrace raw) {
        return preprocessor.prepare(raw);
    }

    public RetrievalResult retrieve(PreparedTrace trace) {
        return retrieve(trace, null, NoOpListener.INSTANCE, null);
    }

    /**
     * Runs the configured solver and reports the result to
     * {@link RetrievalListener#onComplete}.
     */
    public RetrievalResult retrieve(PreparedTrace trace,
                                    PulseField seed,
                                    RetrievalListener listener,
                                    CancellationToken token) {
        Objects.requireNonNull(trace, "trace must not be null");
        RetrievalListener out = GuardedListener.wrap(listener);
        LOG.info("Retrieving {}x{} trace with {}", trace.size(), trace.size(), config);
        RetrievalResult result = solver.solve(trace, seed, out, token);
        LOG.info("Trace {}: {} in {} iterations, error {}",
                TraceFingerprint.hex(result.traceFingerprint()), result.status(), result.iterations(), result.error());
        out.onComplete(result);
        return result;
    }

    public RetrievalResult prepareAndRetrieve(RawTrace raw,
                                              PulseField seed,
                                              RetrievalListener listener,
                                              CancellationToken token) {
        return retrieve(prepare(raw), seed, listener, token);
    }
}
