/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.exceptions;

/**
 * Raised when a raw or prepared trace cannot be used: wrong shape, negative or
 * non-finite samples, or no signal left after background removal.
 */
public class InvalidTraceException extends RuntimeException {
    public InvalidTraceException(String message) {
        super("Invalid trace: " + message);
    }

    public InvalidTraceException(String message, Throwable cause) {
        super("Invalid trace: " + message, cause);
    }
}
