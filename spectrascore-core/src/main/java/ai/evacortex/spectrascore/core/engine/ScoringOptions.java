/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.engine;

import ai.evacortex.spectrascore.core.math.SpectralAligner;

import java.util.Locale;
import java.util.Objects;

/**
 * Tunables of the scoring engine.
 */
public record ScoringOptions(
        double alignmentTolerance,      // max |Δwavenumber| for two points to count as the same wavelength
        double fallbackScore,           // neutral score for insufficient overlap or zero total weight
        PearsonMapping pearsonMapping,  // correlation → score mapping of the Pearson method
        boolean roundScores             // round batch scores to whole numbers
) {
    public static final double DEFAULT_FALLBACK_SCORE = 50.0;

    public ScoringOptions {
        if (!Double.isFinite(alignmentTolerance) || alignmentTolerance < 0.0) {
            throw new IllegalArgumentException("alignmentTolerance must be a finite non-negative number");
        }
        if (!(fallbackScore >= 0.0 && fallbackScore <= 100.0)) {
            throw new IllegalArgumentException("fallbackScore must be within [0, 100]");
        }
        Objects.requireNonNull(pearsonMapping, "pearsonMapping must not be null");
    }

    public static ScoringOptions defaultOptions() {
        return new ScoringOptions(SpectralAligner.DEFAULT_TOLERANCE, DEFAULT_FALLBACK_SCORE, PearsonMapping.SHIFTED, true);
    }

    public static ScoringOptions fromSystemProperties() {
        return new ScoringOptions(
                Double.parseDouble(System.getProperty("spectrascore.align.tolerance",
                        Double.toString(SpectralAligner.DEFAULT_TOLERANCE))),
                Double.parseDouble(System.getProperty("spectrascore.fallback.score",
                        Double.toString(DEFAULT_FALLBACK_SCORE))),
                PearsonMapping.valueOf(System.getProperty("spectrascore.pearson.mapping", "shifted")
                        .trim().toUpperCase(Locale.ROOT)),
                Boolean.parseBoolean(System.getProperty("spectrascore.round.scores", "true")));
    }

    public ScoringOptions withPearsonMapping(PearsonMapping mapping) {
        return new ScoringOptions(alignmentTolerance, fallbackScore, mapping, roundScores);
    }

    public ScoringOptions withRoundScores(boolean round) {
        return new ScoringOptions(alignmentTolerance, fallbackScore, pearsonMapping, round);
    }
}
