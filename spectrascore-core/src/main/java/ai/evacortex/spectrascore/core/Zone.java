/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core;

import ai.evacortex.spectrascore.core.exceptions.InvalidZoneException;

/**
 * A contiguous wavenumber interval with a relative importance weight, given in percent.
 * Bounds are inclusive on both ends.
 */
public record Zone(double minWavelength, double maxWavelength, double weightPercent, String label, String key) {

    public Zone {
        if (!Double.isFinite(minWavelength) || !Double.isFinite(maxWavelength)) {
            throw new InvalidZoneException(key, "bounds must be finite");
        }
        if (minWavelength >= maxWavelength) {
            throw new InvalidZoneException(key,
                    "minWavelength (" + minWavelength + ") must be below maxWavelength (" + maxWavelength + ")");
        }
        if (!Double.isFinite(weightPercent) || weightPercent < 0.0) {
            throw new InvalidZoneException(key, "weightPercent must be a finite non-negative number");
        }
        label = label == null ? "" : label;
        key = key == null ? "" : key;
    }

    public boolean contains(double wavelength) {
        return wavelength >= minWavelength && wavelength <= maxWavelength;
    }

    public double weightFactor() {
        return weightPercent / 100.0;
    }
}
