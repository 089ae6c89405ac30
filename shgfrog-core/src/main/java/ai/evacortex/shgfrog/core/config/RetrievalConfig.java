/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.config;

import ai.evacortex.shgfrog.core.engine.EstimationMethod;
import ai.evacortex.shgfrog.core.engine.SolverKind;
import ai.evacortex.shgfrog.core.engine.TraceDomain;
import ai.evacortex.shgfrog.core.engine.TransformOptions;
import ai.evacortex.shgfrog.core.exceptions.InvalidConfigurationException;
import ai.evacortex.shgfrog.core.prep.Orientation;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable settings of one preparation + retrieval run. A solver captures
 * the instance it is built with; later changes elsewhere never reach a
 * running loop.
 *
 * @param prepSize         N, edge of the prepared trace
 * @param maxIterations    iteration cap, 0 allowed
 * @param tolerance        error at or below which a run converges
 * @param solver           GP or ePIE
 * @param domain           forward-model convention (GP only)
 * @param antiAlias        anti-alias masking (GP only)
 * @param estimationMethod power step or SVD (GP only)
 * @param recenter         keep the |E|^4 centroid at the centre index (GP only)
 * @param stallAction      reaction to a stalled error
 * @param stallWindow      iterations without enough improvement that count as a stall
 * @param stallImprovement relative drop of the best error that resets the stall window
 * @param randomSeed       seed for initial guesses and ePIE ordering; {@code null} for a fresh one
 * @param orientation      camera image orientation fix-up
 * @param supportStride    ePIE uses every {@code supportStride}-th frequency row
 */
public record RetrievalConfig(int prepSize,
                              int maxIterations,
                              double tolerance,
                              SolverKind solver,
                              TraceDomain domain,
                              boolean antiAlias,
                              EstimationMethod estimationMethod,
                              boolean recenter,
                              StallAction stallAction,
                              int stallWindow,
                              double stallImprovement,
                              Long randomSeed,
                              Orientation orientation,
                              int supportStride) {

    public RetrievalConfig {
        if (prepSize < 4) {
            throw new InvalidConfigurationException("prepSize must be at least 4, got " + prepSize);
        }
        if (maxIterations < 0) {
            throw new InvalidConfigurationException("maxIterations must not be negative, got " + maxIterations);
        }
        if (!(tolerance >= 0.0) || !Double.isFinite(tolerance)) {
            throw new InvalidConfigurationException("tolerance must be a nonnegative number, got " + tolerance);
        }
        if (solver == null || domain == null || estimationMethod == null || stallAction == null || orientation == null) {
            throw new InvalidConfigurationException("solver, domain, estimationMethod, stallAction and orientation are required");
        }
        if (stallWindow < 1) {
            throw new InvalidConfigurationException("stallWindow must be positive, got " + stallWindow);
        }
        if (!(stallImprovement >= 0.0 && stallImprovement < 1.0)) {
            throw new InvalidConfigurationException("stallImprovement must lie in [0, 1), got " + stallImprovement);
        }
        if (supportStride < 1) {
            throw new InvalidConfigurationException("supportStride must be positive, got " + supportStride);
        }
    }

    public static RetrievalConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.prepSize = prepSize;
        b.maxIterations = maxIterations;
        b.tolerance = tolerance;
        b.solver = solver;
        b.domain = domain;
        b.antiAlias = antiAlias;
        b.estimationMethod = estimationMethod;
        b.recenter = recenter;
        b.stallAction = stallAction;
        b.stallWindow = stallWindow;
        b.stallImprovement = stallImprovement;
        b.randomSeed = randomSeed;
        b.orientation = orientation;
        b.supportStride = supportStride;
        return b;
    }

    public TransformOptions transformOptions() {
        return new TransformOptions(domain, antiAlias);
    }

    /**
     * Mutable counterpart used by callers and by {@link RetrievalConfigLoader};
     * field names and aliases double as the JSON keys.
     */
    public static final class Builder {

        @JsonProperty("prepSize")
        @JsonAlias({"prepFrogSize", "prep_size", "N"})
        private int prepSize = 128;

        @JsonProperty("maxIterations")
        @JsonAlias({"iterMAX", "max_iter"})
        private int maxIterations = 200;

        @JsonProperty("tolerance")
        @JsonAlias({"GTol", "gTol"})
        private double tolerance = 0.001;

        @JsonProperty("solver")
        private SolverKind solver = SolverKind.GENERALIZED_PROJECTIONS;

        @JsonProperty("domain")
        @JsonAlias("makeFROGdomain")
        private TraceDomain domain = TraceDomain.TIME;

        @JsonProperty("antiAlias")
        @JsonAlias("makeFROGantialias")
        private boolean antiAlias = false;

        @JsonProperty("estimationMethod")
        @JsonAlias("PowerOrSVD")
        private EstimationMethod estimationMethod = EstimationMethod.POWER;

        @JsonProperty("recenter")
        private boolean recenter = true;

        @JsonProperty("stallAction")
        private StallAction stallAction = StallAction.CONTINUE;

        @JsonProperty("stallWindow")
        private int stallWindow = 20;

        @JsonProperty("stallImprovement")
        private double stallImprovement = 0.01;

        @JsonProperty("randomSeed")
        private Long randomSeed;

        @JsonProperty("orientation")
        private Orientation orientation = Orientation.FLIP_VERTICAL;

        @JsonProperty("supportStride")
        private int supportStride = 1;

        Builder() {}

        public Builder prepSize(int value) { this.prepSize = value; return this; }

        public Builder maxIterations(int value) { this.maxIterations = value; return this; }

        public Builder tolerance(double value) { this.tolerance = value; return this; }

        public Builder solver(SolverKind value) { this.solver = value; return this; }

        public Builder domain(TraceDomain value) { this.domain = value; return this; }

        public Builder antiAlias(boolean value) { this.antiAlias = value; return this; }

        public Builder estimationMethod(EstimationMethod value) { this.estimationMethod = value; return this; }

        public Builder recenter(boolean value) { this.recenter = value; return this; }

        public Builder stallAction(StallAction value) { this.stallAction = value; return this; }

        public Builder stallWindow(int value) { this.stallWindow = value; return this; }

        public Builder stallImprovement(double value) { this.stallImprovement = value; return this; }

        public Builder randomSeed(Long value) { this.randomSeed = value; return this; }

        public Builder orientation(Orientation value) { this.orientation = value; return this; }

        public Builder supportStride(int value) { this.supportStride = value; return this; }

        public RetrievalConfig build() {
            return new RetrievalConfig(prepSize, maxIterations, tolerance, solver, domain, antiAlias,
                    estimationMethod, recenter, stallAction, stallWindow, stallImprovement, randomSeed,
                    orientation, supportStride);
        }
    }

    @Override
    public String toString() {
        return "RetrievalConfig[N=" + prepSize + ", maxIterations=" + maxIterations + ", tolerance=" + tolerance
                + ", solver=" + solver + ", domain=" + domain + ", antiAlias=" + antiAlias
                + ", method=" + estimationMethod + ", recenter=" + recenter + ", stall=" + stallAction
                + ", seed=" + Objects.toString(randomSeed, "random") + "]";
    }
}
