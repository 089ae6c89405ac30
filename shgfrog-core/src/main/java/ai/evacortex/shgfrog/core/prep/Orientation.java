/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.prep;

/**
 * Axis fix-up applied to a camera image before preparation. The transpose,
 * when present, comes before the vertical flip.
 */
public enum Orientation {
    AS_IS(false, false),
    TRANSPOSE(true, false),
    FLIP_VERTICAL(false, true),
    TRANSPOSE_AND_FLIP(true, true);

    private final boolean transpose;
    private final boolean flipVertical;

    Orientation(boolean transpose, boolean flipVertical) {
        this.transpose = transpose;
        this.flipVertical = flipVertical;
    }

    public double[][] apply(double[][] image) {
        double[][] out = image;
        if (transpose) {
            int rows = out.length;
            int cols = out[0].length;
            double[][] t = new double[cols][rows];
            for (int i = 0; i < rows; i++) {
                for (int j = 0; j < cols; j++) {
                    t[j][i] = out[i][j];
                }
            }
            out = t;
        }
        if (flipVertical) {
            double[][] f = new double[out.length][];
            for (int i = 0; i < out.length; i++) {
                f[i] = out[out.length - 1 - i].clone();
            }
            out = f;
        }
        return out == image ? copy(image) : out;
    }

    private static double[][] copy(double[][] image) {
        double[][] out = new double[image.length][];
        for (int i = 0; i < image.length; i++) {
            out[i] = image[i].clone();
        }
        return out;
    }
}
