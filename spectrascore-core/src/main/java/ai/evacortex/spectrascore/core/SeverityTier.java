/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core;

/**
 * Coarse health classification derived from a score. Declared from least to most severe.
 * - GOOD: score of 90 and above.
 * - WARNING: score in [70, 90).
 * - CRITICAL: score below 70.
 */
public enum SeverityTier {
    GOOD,
    WARNING,
    CRITICAL;

    public boolean isMoreSevereThan(SeverityTier other) {
        return ordinal() > other.ordinal();
    }
}
