/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.engine;

/**
 * Map from a correlation coefficient r ∈ [-1, 1] to a 0..100 score.
 * - SHIFTED: (r + 1) / 2 · 100, so an uncorrelated sample sits at 50.
 * - CLIPPED: r · 100, so any non-positive correlation scores 0.
 */
public enum PearsonMapping {
    SHIFTED,
    CLIPPED;

    public double toScore(double r) {
        double raw = switch (this) {
            case SHIFTED -> (r + 1.0) / 2.0 * 100.0;
            case CLIPPED -> r * 100.0;
        };
        return Math.max(0.0, Math.min(100.0, raw));
    }
}
