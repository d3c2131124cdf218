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
 * Number of samples per severity tier.
 */
public record SeverityTally(int good, int warning, int critical) {

    public int total() {
        return good + warning + critical;
    }

    public int count(SeverityTier tier) {
        return switch (tier) {
            case GOOD -> good;
            case WARNING -> warning;
            case CRITICAL -> critical;
        };
    }
}
