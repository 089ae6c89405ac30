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
 * Raised for selector combinations that no solver implements, e.g. SVD
 * estimation requested for the ptychographic solver.
 */
public class UnsupportedConfigurationException extends InvalidConfigurationException {
    public UnsupportedConfigurationException(String message) {
        super("unsupported combination, " + message);
    }
}
