/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.exceptions;

public class ZeroSignalException extends RuntimeException {
    public ZeroSignalException(String what) {
        super("Cannot normalize all-zero " + what);
    }
}
