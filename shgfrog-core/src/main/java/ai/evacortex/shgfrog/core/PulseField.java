/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core;

import ai.evacortex.shgfrog.core.exceptions.ZeroSignalException;
import ai.evacortex.shgfrog.core.math.Fourier;
import ai.evacortex.shgfrog.core.math.TraceMath;

import java.util.Arrays;
import java.util.Objects;

/**
 * Complex time-domain field E(t) sampled on N points, stored as split real and
 * imaginary arrays. Instances are immutable: arrays are copied on the way in
 * and on the way out.
 */
public record PulseField(double[] real, double[] imag) {

    public PulseField {
        Objects.requireNonNull(real, "real must not be null");
        Objects.requireNonNull(imag, "imag must not be null");
        if (real.length != imag.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + real.length + " vs " + imag.length);
        }
        if (real.length == 0) {
            throw new IllegalArgumentException("Field must have at least one sample");
        }
        real = real.clone();
        imag = imag.clone();
    }

    public static PulseField polar(double[] amplitude, double[] phase) {
        if (amplitude.length != phase.length) {
            throw new IllegalArgumentException("Amplitude / phase length mismatch");
        }
        double[] re = new double[amplitude.length];
        double[] im = new double[amplitude.length];
        for (int i = 0; i < amplitude.length; i++) {
            re[i] = amplitude[i] * Math.cos(phase[i]);
            im[i] = amplitude[i] * Math.sin(phase[i]);
        }
        return new PulseField(re, im);
    }

    @Override
    public double[] real() {
        return real.clone();
    }

    @Override
    public double[] imag() {
        return imag.clone();
    }

    public int size() {
        return real.length;
    }

    public double norm() {
        double sum = 0.0;
        for (int i = 0; i < real.length; i++) {
            sum += real[i] * real[i] + imag[i] * imag[i];
        }
        return Math.sqrt(sum);
    }

    /**
     * Copy scaled to unit Euclidean norm.
     *
     * @throws ZeroSignalException if every sample is zero
     */
    public PulseField normalized() {
        double norm = norm();
        if (!(norm > 0.0) || !Double.isFinite(norm)) {
            throw new ZeroSignalException("pulse field");
        }
        double[] re = new double[real.length];
        double[] im = new double[real.length];
        for (int i = 0; i < real.length; i++) {
            re[i] = real[i] / norm;
            im[i] = imag[i] / norm;
        }
        return new PulseField(re, im);
    }

    public double[] intensity() {
        double[] out = new double[real.length];
        for (int i = 0; i < real.length; i++) {
            out[i] = real[i] * real[i] + imag[i] * imag[i];
        }
        return out;
    }

    public double[] phase() {
        double[] out = new double[real.length];
        for (int i = 0; i < real.length; i++) {
            out[i] = Math.atan2(imag[i], real[i]);
        }
        return out;
    }

    /**
     * Cyclic shift: {@code out[i] = this[(i - shift) mod N]}.
     */
    public PulseField shifted(int shift) {
        int n = real.length;
        double[] re = new double[n];
        double[] im = new double[n];
        for (int i = 0; i < n; i++) {
            int src = Math.floorMod(i - shift, n);
            re[i] = real[src];
            im[i] = imag[src];
        }
        return new PulseField(re, im);
    }

    /**
     * Spectrum with the time origin and zero frequency both at
     * {@link TraceMath#centerIndex(int)}.
     */
    public PulseField spectrum() {
        int c = TraceMath.centerIndex(size());
        PulseField origin = shifted(-c);
        double[] re = origin.real;
        double[] im = origin.imag;
        Fourier.forward(re, im);
        return new PulseField(re, im).shifted(c);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PulseField)) return false;
        PulseField other = (PulseField) obj;
        return Arrays.equals(real, other.real) && Arrays.equals(imag, other.imag);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(real) * 31 + Arrays.hashCode(imag);
    }

    @Override
    public String toString() {
        return "PulseField[n=" + real.length + ", norm=" + norm() + "]";
    }
}
