/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.math;

import ai.evacortex.shgfrog.core.exceptions.ZeroSignalException;

import java.util.Objects;

public class TraceMath {

    private TraceMath() {}

    /**
     * Index that carries zero delay and zero frequency in every trace and axis:
     * {@code ceil(N/2) - 1}.
     */
    public static int centerIndex(int n) {
        return (n + 1) / 2 - 1;
    }

    /**
     * Axis of {@code length} samples spaced by {@code step}, zero at
     * {@link #centerIndex(int)}.
     */
    public static double[] axis(int length, double step) {
        double[] axis = new double[length];
        int c = centerIndex(length);
        for (int k = 0; k < length; k++) {
            axis[k] = (k - c) * step;
        }
        return axis;
    }

    /**
     * Root-mean-square difference of two equally shaped real arrays.
     */
    public static double rmsDiff(double[][] a, double[][] b) {
        checkSameShape(a, b);
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < a[i].length; j++) {
                double d = a[i][j] - b[i][j];
                sum += d * d;
                count++;
            }
        }
        return count == 0 ? 0.0 : Math.sqrt(sum / count);
    }

    /**
     * Least-squares scale {@code α = Σ(Fm·Fr) / Σ(Fr²)} minimising
     * {@code rmsDiff(Fm, α·Fr)}. Returns 0 when {@code Fr} is all zero.
     */
    public static double leastSquaresScale(double[][] measured, double[][] reconstructed) {
        checkSameShape(measured, reconstructed);
        double num = 0.0;
        double den = 0.0;
        for (int i = 0; i < measured.length; i++) {
            for (int j = 0; j < measured[i].length; j++) {
                num += measured[i][j] * reconstructed[i][j];
                den += reconstructed[i][j] * reconstructed[i][j];
            }
        }
        return den == 0.0 ? 0.0 : num / den;
    }

    public static double[][] scale(double[][] a, double factor) {
        double[][] out = new double[a.length][];
        for (int i = 0; i < a.length; i++) {
            out[i] = new double[a[i].length];
            for (int j = 0; j < a[i].length; j++) {
                out[i][j] = a[i][j] * factor;
            }
        }
        return out;
    }

    public static double max(double[][] a) {
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : a) {
            for (double v : row) {
                if (v > max) max = v;
            }
        }
        return max;
    }

    /**
     * Copy of a nonnegative array scaled so its maximum is 1.
     *
     * @throws ZeroSignalException if the array has no positive entry
     */
    public static double[][] normalizeToPeak(double[][] a) {
        Objects.requireNonNull(a, "array must not be null");
        double max = max(a);
        if (!(max > 0.0)) {
            throw new ZeroSignalException("trace");
        }
        return scale(a, 1.0 / max);
    }

    public static double[][] sqrt(double[][] a) {
        double[][] out = new double[a.length][];
        for (int i = 0; i < a.length; i++) {
            out[i] = new double[a[i].length];
            for (int j = 0; j < a[i].length; j++) {
                out[i][j] = Math.sqrt(a[i][j]);
            }
        }
        return out;
    }

    public static double[][] copy(double[][] a) {
        double[][] out = new double[a.length][];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i].clone();
        }
        return out;
    }

    private static void checkSameShape(double[][] a, double[][] b) {
        Objects.requireNonNull(a, "arrays must not be null");
        Objects.requireNonNull(b, "arrays must not be null");
        if (a.length != b.length) {
            throw new IllegalArgumentException("Mismatched rows: " + a.length + " vs " + b.length);
        }
        for (int i = 0; i < a.length; i++) {
            if (a[i].length != b[i].length) {
                throw new IllegalArgumentException("Mismatched columns in row " + i);
            }
        }
    }
}
