/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.exceptions;

public class EstimationFailedException extends RuntimeException {

    public EstimationFailedException(String message) {
        super("Field estimation failed: " + message);
    }

    public EstimationFailedException(String message, Throwable cause) {
        super("Field estimation failed: " + message, cause);
    }
}
