/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.math;

/**
 * Square complex matrix with the index operations used by the FROG forward
 * model and its inverse. Every operation returns a new matrix; instances are
 * never shared between retrieval runs.
 *
 * <p>Roll semantics: {@code roll(x, s)[i] = x[(i - s) mod N]}.</p>
 */
public final class ComplexMatrix {

    @FunctionalInterface
    public interface EntryPredicate {
        boolean test(int row, int col);
    }

    private final int n;
    private final double[][] re;
    private final double[][] im;

    private ComplexMatrix(double[][] re, double[][] im) {
        this.n = re.length;
        this.re = re;
        this.im = im;
    }

    public static ComplexMatrix zeros(int n) {
        return new ComplexMatrix(new double[n][n], new double[n][n]);
    }

    public static ComplexMatrix of(double[][] re, double[][] im) {
        int n = re.length;
        if (im.length != n) throw new IllegalArgumentException("Real/imaginary size mismatch");
        double[][] r = new double[n][];
        double[][] i = new double[n][];
        for (int k = 0; k < n; k++) {
            if (re[k].length != n || im[k].length != n) {
                throw new IllegalArgumentException("Matrix must be square " + n + "x" + n);
            }
            r[k] = re[k].clone();
            i[k] = im[k].clone();
        }
        return new ComplexMatrix(r, i);
    }

    /**
     * Outer product {@code z zᵀ} (no conjugation).
     */
    public static ComplexMatrix outer(double[] zr, double[] zi) {
        int n = zr.length;
        ComplexMatrix m = zeros(n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                m.re[i][j] = zr[i] * zr[j] - zi[i] * zi[j];
                m.im[i][j] = zr[i] * zi[j] + zi[i] * zr[j];
            }
        }
        return m;
    }

    public int size() {
        return n;
    }

    public double re(int row, int col) {
        return re[row][col];
    }

    public double im(int row, int col) {
        return im[row][col];
    }

    public ComplexMatrix copy() {
        return of(re, im);
    }

    /**
     * Elementwise {@code |z|²}.
     */
    public double[][] intensity() {
        double[][] out = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                out[i][j] = re[i][j] * re[i][j] + im[i][j] * im[i][j];
            }
        }
        return out;
    }

    public ComplexMatrix rollRows(int shift) {
        ComplexMatrix out = zeros(n);
        for (int i = 0; i < n; i++) {
            int src = Math.floorMod(i - shift, n);
            System.arraycopy(re[src], 0, out.re[i], 0, n);
            System.arraycopy(im[src], 0, out.im[i], 0, n);
        }
        return out;
    }

    public ComplexMatrix rollColumns(int shift) {
        ComplexMatrix out = zeros(n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                int src = Math.floorMod(j - shift, n);
                out.re[i][j] = re[i][src];
                out.im[i][j] = im[i][src];
            }
        }
        return out;
    }

    /**
     * Rolls row {@code i} by {@code direction * i}. Direction -1 turns the
     * outer-product form into lag-indexed storage, +1 undoes it.
     */
    public ComplexMatrix rotateRows(int direction) {
        ComplexMatrix out = zeros(n);
        for (int i = 0; i < n; i++) {
            int shift = direction * i;
            for (int j = 0; j < n; j++) {
                int src = Math.floorMod(j - shift, n);
                out.re[i][j] = re[i][src];
                out.im[i][j] = im[i][src];
            }
        }
        return out;
    }

    public ComplexMatrix flipLeftRight() {
        ComplexMatrix out = zeros(n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                out.re[i][j] = re[i][n - 1 - j];
                out.im[i][j] = im[i][n - 1 - j];
            }
        }
        return out;
    }

    public ComplexMatrix flipUpDown() {
        ComplexMatrix out = zeros(n);
        for (int i = 0; i < n; i++) {
            System.arraycopy(re[n - 1 - i], 0, out.re[i], 0, n);
            System.arraycopy(im[n - 1 - i], 0, out.im[i], 0, n);
        }
        return out;
    }

    public ComplexMatrix transpose() {
        ComplexMatrix out = zeros(n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                out.re[j][i] = re[i][j];
                out.im[j][i] = im[i][j];
            }
        }
        return out;
    }

    public ComplexMatrix fftColumns() {
        ComplexMatrix out = copy();
        Fourier.forwardColumns(out.re, out.im);
        return out;
    }

    public ComplexMatrix ifftColumns() {
        ComplexMatrix out = copy();
        Fourier.inverseColumns(out.re, out.im);
        return out;
    }

    public ComplexMatrix zeroWhere(EntryPredicate predicate) {
        ComplexMatrix out = copy();
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (predicate.test(i, j)) {
                    out.re[i][j] = 0.0;
                    out.im[i][j] = 0.0;
                }
            }
        }
        return out;
    }

    /**
     * Replaces every magnitude with {@code amplitude[i][j]} while keeping the
     * phase. Entries with zero magnitude have no phase and become zero.
     */
    public ComplexMatrix withAmplitude(double[][] amplitude) {
        if (amplitude.length != n || amplitude[0].length != n) {
            throw new IllegalArgumentException("Amplitude must be " + n + "x" + n);
        }
        ComplexMatrix out = zeros(n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double mag = Math.hypot(re[i][j], im[i][j]);
                if (mag == 0.0) continue;
                double s = amplitude[i][j] / mag;
                out.re[i][j] = re[i][j] * s;
                out.im[i][j] = im[i][j] * s;
            }
        }
        return out;
    }

    /**
     * {@code M · v}, written into new arrays {@code {re, im}}.
     */
    public double[][] multiply(double[] vr, double[] vi) {
        checkLength(vr, vi);
        double[] outR = new double[n];
        double[] outI = new double[n];
        for (int i = 0; i < n; i++) {
            double sr = 0.0;
            double si = 0.0;
            for (int j = 0; j < n; j++) {
                sr += re[i][j] * vr[j] - im[i][j] * vi[j];
                si += re[i][j] * vi[j] + im[i][j] * vr[j];
            }
            outR[i] = sr;
            outI[i] = si;
        }
        return new double[][]{outR, outI};
    }

    /**
     * {@code Mᴴ · v}, written into new arrays {@code {re, im}}.
     */
    public double[][] adjointMultiply(double[] vr, double[] vi) {
        checkLength(vr, vi);
        double[] outR = new double[n];
        double[] outI = new double[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                // conj(M[i][j]) * v[i] accumulates into column j
                outR[j] += re[i][j] * vr[i] + im[i][j] * vi[i];
                outI[j] += re[i][j] * vi[i] - im[i][j] * vr[i];
            }
        }
        return new double[][]{outR, outI};
    }

    private void checkLength(double[] vr, double[] vi) {
        if (vr.length != n || vi.length != n) {
            throw new IllegalArgumentException("Vector length " + vr.length + " does not match matrix size " + n);
        }
    }
}
