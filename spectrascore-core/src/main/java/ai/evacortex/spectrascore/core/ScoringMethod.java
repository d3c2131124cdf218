/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core;

import java.util.Locale;

/**
 * Scoring method selector.
 * - RMSE: weighted root-mean-square of the absorbance delta.
 * - PEARSON: weighted correlation of the raw absorbance curves.
 * - AREA: weighted trapezoidal integral of |delta| over wavenumber.
 * - HYBRID: RMSE score with a correlation penalty.
 */
public enum ScoringMethod {
    RMSE,
    PEARSON,
    AREA,
    HYBRID;

    public String selector() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScoringMethod fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Scoring method name must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scoring method: " + name, e);
        }
    }
}
