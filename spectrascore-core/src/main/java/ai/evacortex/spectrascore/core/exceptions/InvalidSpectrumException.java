/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.exceptions;

public class InvalidSpectrumException extends RuntimeException {

    private final String spectrumId;

    public InvalidSpectrumException(String spectrumId, String message) {
        super("Invalid Spectrum '" + spectrumId + "': " + message);
        this.spectrumId = spectrumId;
    }

    public String getSpectrumId() {
        return spectrumId;
    }
}
