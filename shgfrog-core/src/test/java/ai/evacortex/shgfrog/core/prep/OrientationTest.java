/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.prep;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OrientationTest {

    private static final double[][] IMAGE = {
            {1, 2, 3},
            {4, 5, 6}
    };

    @Test
    void asIs_returnsCopy() {
        double[][] out = Orientation.AS_IS.apply(IMAGE);
        assertNotSame(IMAGE, out);
        assertNotSame(IMAGE[0], out[0]);
        assertArrayEquals(IMAGE[1], out[1], 0.0);
    }

    @Test
    void flipVertical_reversesRows() {
        double[][] out = Orientation.FLIP_VERTICAL.apply(IMAGE);
        assertArrayEquals(new double[]{4, 5, 6}, out[0], 0.0);
        assertArrayEquals(new double[]{1, 2, 3}, out[1], 0.0);
    }

    @Test
    void transposeThenFlip() {
        double[][] out = Orientation.TRANSPOSE_AND_FLIP.apply(IMAGE);
        assertEquals(3, out.length);
        assertArrayEquals(new double[]{3, 6}, out[0], 0.0);
        assertArrayEquals(new double[]{1, 4}, out[2], 0.0);
    }
}
