/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.exceptions;

public class ZoneConfigurationException extends RuntimeException {
    public ZoneConfigurationException(String message) {
        super(message);
    }

    public ZoneConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
