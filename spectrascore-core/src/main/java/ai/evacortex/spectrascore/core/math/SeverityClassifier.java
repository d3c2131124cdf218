/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.math;

import ai.evacortex.spectrascore.core.SeverityTally;
import ai.evacortex.spectrascore.core.SeverityTier;

import java.util.Map;
import java.util.Objects;

/**
 * Classifies health scores into severity tiers. Both thresholds are inclusive on the better side:
 * 90 is {@link SeverityTier#GOOD}, 70 is {@link SeverityTier#WARNING}.
 */
public final class SeverityClassifier {

    public static final double GOOD_THRESHOLD = 90.0;
    public static final double WARNING_THRESHOLD = 70.0;

    private SeverityClassifier() {}

    public static SeverityTier classify(double score) {
        if (score >= GOOD_THRESHOLD) {
            return SeverityTier.GOOD;
        } else if (score >= WARNING_THRESHOLD) {
            return SeverityTier.WARNING;
        } else {
            return SeverityTier.CRITICAL;
        }
    }

    public static SeverityTally tally(Map<String, Double> scores) {
        Objects.requireNonNull(scores, "scores must not be null");
        int good = 0;
        int warning = 0;
        int critical = 0;
        for (double score : scores.values()) {
            switch (classify(score)) {
                case GOOD -> good++;
                case WARNING -> warning++;
                case CRITICAL -> critical++;
            }
        }
        return new SeverityTally(good, warning, critical);
    }
}
