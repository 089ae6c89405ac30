/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.exceptions;

public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super("Invalid retrieval configuration: " + message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super("Invalid retrieval configuration: " + message, cause);
    }
}
