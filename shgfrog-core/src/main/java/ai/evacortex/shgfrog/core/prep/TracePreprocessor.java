/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.prep;

import ai.evacortex.shgfrog.core.PreparedTrace;
import ai.evacortex.shgfrog.core.RawTrace;
import ai.evacortex.shgfrog.core.exceptions.InvalidConfigurationException;
import ai.evacortex.shgfrog.core.exceptions.InvalidTraceException;
import ai.evacortex.shgfrog.core.math.Fourier;
import ai.evacortex.shgfrog.core.math.TraceMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns a camera image into an N x N trace sampled so that one row step times
 * one column step equals {@code 1/N}, as the discrete forward model requires.
 *
 * <p>Pipeline: orientation, spot geometry, low-pass filter, background
 * subtraction, nearest-bin rebinning, unit-peak normalization. An image that
 * is already N x N and already satisfies the sampling identity passes
 * through untouched.</p>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 */
public final class TracePreprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(TracePreprocessor.class);

    static final double FILTER_RADIUS_FRACTION = 0.3;
    static final int BACKGROUND_BLOCK = 8;
    private static final double IDENTITY_TOLERANCE = 1e-12;
    private static final double RESIDUAL_FRACTION = 1e-12;

    private final int size;
    private final Orientation orientation;

    public TracePreprocessor(int size, Orientation orientation) {
        if (size < 4) {
            throw new InvalidConfigurationException("prep size must be at least 4, got " + size);
        }
        this.size = size;
        this.orientation = Objects.requireNonNull(orientation, "orientation must not be null");
    }

    public PreparedTrace prepare(RawTrace raw) {
        Objects.requireNonNull(raw, "raw trace must not be null");
        double[][] image = orientation.apply(raw.intensity());
        double before = TraceMath.max(image);
        if (!(before > 0.0)) {
            throw new InvalidTraceException("image is all zero");
        }

        // after orientation rows are frequency, columns delay
        double dtdv = raw.delayStep() * raw.frequencyStep();
        if (isSampled(image, dtdv)) {
            LOG.debug("Trace already {}x{} with dt*dv*N = 1, passing through", size, size);
            return new PreparedTrace(image, raw.delayStep());
        }

        ResamplingGrid grid = ResamplingGrid.measure(image, size, dtdv);
        LOG.info("Vertical pixels per frequency sample: {}, horizontal pixels per delay sample: {}",
                String.format("%.3f", grid.verticalPitch()), String.format("%.3f", grid.horizontalPitch()));

        double[][] filtered = lowPass(image);
        double[][] cleaned = subtractBackground(filtered);
        if (!(TraceMath.max(cleaned) > RESIDUAL_FRACTION * before)) {
            throw new InvalidTraceException("nothing left above background");
        }

        double[][] binned = rebin(cleaned, grid);
        if (!(TraceMath.max(binned) > 0.0)) {
            throw new InvalidTraceException("no signal fell inside the " + size + "x" + size + " grid");
        }
        double timeStep = raw.delayStep() * grid.horizontalPitch();
        LOG.info("Prepared {}x{} trace, time step {}", size, size, timeStep);
        return new PreparedTrace(TraceMath.normalizeToPeak(binned), timeStep);
    }

    private boolean isSampled(double[][] image, double dtdv) {
        return image.length == size
                && image[0].length == size
                && Math.abs(dtdv * size - 1.0) < IDENTITY_TOLERANCE;
    }

    /**
     * Keeps Fourier components inside a centred disk of radius
     * {@code 0.3 * max(rows, cols)} and returns the magnitude of the result.
     * The disk is laid out in fftshift coordinates.
     */
    static double[][] lowPass(double[][] image) {
        int rows = image.length;
        int cols = image[0].length;
        double[][] re = TraceMath.copy(image);
        double[][] im = new double[rows][cols];
        Fourier.forward2d(re, im);

        double radius = Math.max(rows, cols) * FILTER_RADIUS_FRACTION;
        for (int k = 0; k < rows; k++) {
            int s = (k + rows / 2) % rows;
            double dy = (s + 1) - rows / 2.0;
            for (int l = 0; l < cols; l++) {
                int t = (l + cols / 2) % cols;
                double dx = (t + 1) - cols / 2.0;
                if (!(Math.sqrt(dy * dy + dx * dx) < radius)) {
                    re[k][l] = 0.0;
                    im[k][l] = 0.0;
                }
            }
        }

        Fourier.inverse2d(re, im);
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                out[i][j] = Math.hypot(re[i][j], im[i][j]);
            }
        }
        return out;
    }

    /**
     * Background is the lowest 8 x 8 cyclic block average; it is subtracted
     * and negatives are clipped to zero.
     */
    static double[][] subtractBackground(double[][] image) {
        int rows = image.length;
        int cols = image[0].length;
        double[][] blocks = new double[rows][cols];
        for (int di = 1; di <= BACKGROUND_BLOCK; di++) {
            for (int dj = 1; dj <= BACKGROUND_BLOCK; dj++) {
                for (int i = 0; i < rows; i++) {
                    double[] src = image[Math.floorMod(i - di, rows)];
                    for (int j = 0; j < cols; j++) {
                        blocks[i][j] += src[Math.floorMod(j - dj, cols)];
                    }
                }
            }
        }
        double min = Double.POSITIVE_INFINITY;
        for (double[] row : blocks) {
            for (double v : row) {
                if (v < min) min = v;
            }
        }
        double background = min / (BACKGROUND_BLOCK * BACKGROUND_BLOCK);

        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                out[i][j] = Math.max(0.0, image[i][j] - background);
            }
        }
        return out;
    }

    double[][] rebin(double[][] image, ResamplingGrid grid) {
        double[][] sum = new double[size][size];
        int[][] count = new int[size][size];
        for (int i = 0; i < image.length; i++) {
            int row = grid.targetRow(i, size);
            if (row < 0 || row >= size) continue;
            for (int j = 0; j < image[i].length; j++) {
                int col = grid.targetColumn(j, size);
                if (col < 0 || col >= size) continue;
                sum[row][col] += image[i][j];
                count[row][col]++;
            }
        }
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                if (count[i][j] > 0) {
                    sum[i][j] /= count[i][j];
                }
            }
        }
        return sum;
    }
}
