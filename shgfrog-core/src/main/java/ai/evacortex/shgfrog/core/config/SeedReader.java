/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.config;

import ai.evacortex.shgfrog.core.PulseField;
import ai.evacortex.shgfrog.core.exceptions.InvalidConfigurationException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads a seed field from a text file of "real imag" pairs, one sample per
 * line. Blank lines and lines starting with {@code #} are skipped.
 */
public final class SeedReader {

    private SeedReader() {}

    public static PulseField read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        List<double[]> samples = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                String[] parts = trimmed.split("[\\s,;]+");
                if (parts.length != 2) {
                    throw new InvalidConfigurationException("seed " + path + " line " + lineNo
                            + ": expected two columns, got " + parts.length);
                }
                samples.add(new double[]{parse(parts[0], path, lineNo), parse(parts[1], path, lineNo)});
            }
        } catch (IOException e) {
            throw new InvalidConfigurationException("cannot read seed " + path, e);
        }
        if (samples.isEmpty()) {
            throw new InvalidConfigurationException("seed " + path + " holds no samples");
        }

        double[] re = new double[samples.size()];
        double[] im = new double[samples.size()];
        for (int i = 0; i < re.length; i++) {
            re[i] = samples.get(i)[0];
            im[i] = samples.get(i)[1];
        }
        return new PulseField(re, im);
    }

    /**
     * Reads the seed and checks it has {@code expectedSize} samples.
     */
    public static PulseField read(Path path, int expectedSize) {
        PulseField seed = read(path);
        if (seed.size() != expectedSize) {
            throw new InvalidConfigurationException("seed " + path + " has " + seed.size()
                    + " samples, expected " + expectedSize);
        }
        return seed;
    }

    private static double parse(String token, Path path, int lineNo) {
        try {
            double v = Double.parseDouble(token);
            if (!Double.isFinite(v)) {
                throw new InvalidConfigurationException("seed " + path + " line " + lineNo + ": non-finite value " + token);
            }
            return v;
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("seed " + path + " line " + lineNo + ": not a number '" + token + "'", e);
        }
    }
}
