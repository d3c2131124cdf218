/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.engine;

import ai.evacortex.spectrascore.core.AlignedPoint;
import ai.evacortex.spectrascore.core.ScoringMethod;
import ai.evacortex.spectrascore.core.math.HealthMapping;
import ai.evacortex.spectrascore.core.math.SpectralAligner;
import ai.evacortex.spectrascore.core.math.WeightedStatistics;

import java.util.List;

/**
 * RMSE score minus a correlation penalty.
 *
 * <pre>
 *     r &lt; 0.90  → penalty = 15 · (0.90 − r) / 0.90
 *     r &lt; 0.95  → penalty = 7.5 · (0.95 − r) / 0.05
 *     otherwise → 0
 * </pre>
 */
public final class HybridScorer extends AlignedScorer {

    static final double STRONG_CORRELATION = 0.95;
    static final double WEAK_CORRELATION = 0.90;

    public HybridScorer(SpectralAligner aligner, double fallbackScore) {
        super(aligner, fallbackScore);
    }

    @Override
    public ScoringMethod method() {
        return ScoringMethod.HYBRID;
    }

    @Override
    protected double scoreAligned(List<AlignedPoint> aligned, double[] weights) {
        double baseScore = HealthMapping.RMSE.apply(WeightedStatistics.rmse(aligned, weights));
        double r = WeightedStatistics.pearson(aligned, weights);
        return baseScore - correlationPenalty(r);
    }

    static double correlationPenalty(double r) {
        if (r < WEAK_CORRELATION) {
            return 15.0 * (WEAK_CORRELATION - r) / WEAK_CORRELATION;
        } else if (r < STRONG_CORRELATION) {
            return 7.5 * (STRONG_CORRELATION - r) / 0.05;
        }
        return 0.0;
    }
}
