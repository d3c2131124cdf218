/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.exceptions;

public class InvalidZoneException extends RuntimeException {
    public InvalidZoneException(String zoneKey, String message) {
        super("Invalid Zone '" + zoneKey + "': " + message);
    }
}
