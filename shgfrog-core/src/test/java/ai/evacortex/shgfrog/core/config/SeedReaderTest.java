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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SeedReaderTest {

    @TempDir
    Path dir;

    private Path write(String text) throws Exception {
        Path file = dir.resolve("seed.txt");
        Files.writeString(file, text);
        return file;
    }

    @Test
    void readsPairsSkippingCommentsAndBlanks() throws Exception {
        PulseField seed = SeedReader.read(write("# re im\n1.0 0.5\n\n-2,3e-1\n0;0\n"));
        assertArrayEquals(new double[]{1.0, -2.0, 0.0}, seed.real(), 0.0);
        assertArrayEquals(new double[]{0.5, 0.3, 0.0}, seed.imag(), 0.0);
    }

    @Test
    void sizeIsChecked() throws Exception {
        Path file = write("1 0\n0 1\n");
        assertEquals(2, SeedReader.read(file, 2).size());
        assertThrows(InvalidConfigurationException.class, () -> SeedReader.read(file, 4));
    }

    @Test
    void malformedFilesAreRejected() throws Exception {
        assertThrows(InvalidConfigurationException.class, () -> SeedReader.read(write("1 2 3\n")));
        assertThrows(InvalidConfigurationException.class, () -> SeedReader.read(write("1 x\n")));
        assertThrows(InvalidConfigurationException.class, () -> SeedReader.read(write("1 NaN\n")));
        assertThrows(InvalidConfigurationException.class, () -> SeedReader.read(write("# nothing\n")));
        assertThrows(InvalidConfigurationException.class, () -> SeedReader.read(dir.resolve("missing.txt")));
    }
}
