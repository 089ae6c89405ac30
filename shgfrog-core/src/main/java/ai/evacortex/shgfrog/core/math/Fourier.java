/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.math;

import org.jtransforms.fft.DoubleFFT_1D;
import org.jtransforms.fft.DoubleFFT_2D;

/**
 * Discrete Fourier transforms on split real/imaginary arrays.
 *
 * <p>Sign and scaling follow the usual convention:</p>
 * <pre>
 *     X[k] = Σ x[n] · e^{-2πi·kn/N}          (forward, unscaled)
 *     x[n] = (1/N) · Σ X[k] · e^{+2πi·kn/N}  (inverse)
 * </pre>
 * All methods transform in place.
 */
public final class Fourier {

    private Fourier() {}

    public static void forward(double[] re, double[] im) {
        transform(re, im, false);
    }

    public static void inverse(double[] re, double[] im) {
        transform(re, im, true);
    }

    static void forwardColumns(double[][] re, double[][] im) {
        transformColumns(re, im, false);
    }

    static void inverseColumns(double[][] re, double[][] im) {
        transformColumns(re, im, true);
    }

    public static void forward2d(double[][] re, double[][] im) {
        transform2d(re, im, false);
    }

    public static void inverse2d(double[][] re, double[][] im) {
        transform2d(re, im, true);
    }

    private static void transform(double[] re, double[] im, boolean inverse) {
        int n = re.length;
        if (im.length != n) {
            throw new IllegalArgumentException("Mismatched lengths: " + n + " vs " + im.length);
        }
        double[] buf = new double[2 * n];
        for (int i = 0; i < n; i++) {
            buf[2 * i] = re[i];
            buf[2 * i + 1] = im[i];
        }
        DoubleFFT_1D fft = FftPlans.plan(n);
        if (inverse) {
            fft.complexInverse(buf, true);
        } else {
            fft.complexForward(buf);
        }
        for (int i = 0; i < n; i++) {
            re[i] = buf[2 * i];
            im[i] = buf[2 * i + 1];
        }
    }

    private static void transformColumns(double[][] re, double[][] im, boolean inverse) {
        int rows = re.length;
        int cols = re[0].length;
        DoubleFFT_1D fft = FftPlans.plan(rows);
        double[] buf = new double[2 * rows];
        for (int j = 0; j < cols; j++) {
            for (int i = 0; i < rows; i++) {
                buf[2 * i] = re[i][j];
                buf[2 * i + 1] = im[i][j];
            }
            if (inverse) {
                fft.complexInverse(buf, true);
            } else {
                fft.complexForward(buf);
            }
            for (int i = 0; i < rows; i++) {
                re[i][j] = buf[2 * i];
                im[i][j] = buf[2 * i + 1];
            }
        }
    }

    private static void transform2d(double[][] re, double[][] im, boolean inverse) {
        int rows = re.length;
        int cols = re[0].length;
        double[][] buf = new double[rows][2 * cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                buf[i][2 * j] = re[i][j];
                buf[i][2 * j + 1] = im[i][j];
            }
        }
        DoubleFFT_2D fft = FftPlans.plan(rows, cols);
        if (inverse) {
            fft.complexInverse(buf, true);
        } else {
            fft.complexForward(buf);
        }
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                re[i][j] = buf[i][2 * j];
                im[i][j] = buf[i][2 * j + 1];
            }
        }
    }
}
