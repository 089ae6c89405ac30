/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.prep;

import ai.evacortex.shgfrog.core.exceptions.InvalidTraceException;

/**
 * Spot geometry of a camera image and the pixel pitch that maps it onto an
 * N x N grid. Centres are 1-based pixel coordinates.
 *
 * <p>The pitches satisfy {@code verticalPitch / horizontalPitch = aspectRatio}
 * and {@code (verticalPitch * dv) * (horizontalPitch * dt) = 1 / N}.</p>
 */
public record ResamplingGrid(double centerRow,
                             double centerColumn,
                             double aspectRatio,
                             double verticalPitch,
                             double horizontalPitch) {

    /**
     * Measures centroid and width of the spot along each axis and derives the
     * pitches for target size {@code n} and calibration product {@code dtdv}.
     */
    public static ResamplingGrid measure(double[][] image, int n, double dtdv) {
        int rows = image.length;
        int cols = image[0].length;
        double[] rowSums = new double[rows];
        double[] colSums = new double[cols];
        double total = 0.0;
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                rowSums[i] += image[i][j];
                colSums[j] += image[i][j];
                total += image[i][j];
            }
        }
        if (!(total > 0.0)) {
            throw new InvalidTraceException("image carries no signal");
        }

        double centerRow = weightedMean(rowSums, total);
        double centerCol = weightedMean(colSums, total);
        double height = 2.0 * weightedDeviation(rowSums, centerRow, total);
        double width = 2.0 * weightedDeviation(colSums, centerCol, total);
        if (!(height > 0.0) || !(width > 0.0)) {
            throw new InvalidTraceException("spot has zero extent (height " + height + ", width " + width + ")");
        }

        double aspect = height / width;
        double vPitch = Math.sqrt(aspect / (n * dtdv));
        double hPitch = Math.sqrt(1.0 / (aspect * n * dtdv));
        return new ResamplingGrid(centerRow, centerCol, aspect, vPitch, hPitch);
    }

    /**
     * 0-based target row of 0-based source row {@code i}; may fall outside the grid.
     */
    public int targetRow(int i, int n) {
        return (int) Math.rint(n / 2.0 + ((i + 1) - centerRow) / verticalPitch) - 1;
    }

    public int targetColumn(int j, int n) {
        return (int) Math.rint(n / 2.0 + ((j + 1) - centerColumn) / horizontalPitch) - 1;
    }

    private static double weightedMean(double[] sums, double total) {
        double acc = 0.0;
        for (int k = 0; k < sums.length; k++) {
            acc += (k + 1) * sums[k];
        }
        return acc / total;
    }

    private static double weightedDeviation(double[] sums, double center, double total) {
        double acc = 0.0;
        for (int k = 0; k < sums.length; k++) {
            acc += Math.abs((k + 1) - center) * sums[k];
        }
        return acc / total;
    }
}
