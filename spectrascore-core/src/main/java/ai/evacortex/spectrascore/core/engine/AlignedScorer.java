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
import ai.evacortex.spectrascore.core.Spectrum;
import ai.evacortex.spectrascore.core.Zone;
import ai.evacortex.spectrascore.core.math.SpectralAligner;
import ai.evacortex.spectrascore.core.math.WeightedStatistics;
import ai.evacortex.spectrascore.core.math.ZoneWeightMap;

import java.util.List;
import java.util.Objects;

/**
 * Shared skeleton: align, weight, guard degenerate input, score, clamp.
 */
abstract class AlignedScorer implements SpectrumScorer {

    static final int MIN_ALIGNED_POINTS = 2;

    private final SpectralAligner aligner;
    private final double fallbackScore;

    AlignedScorer(SpectralAligner aligner, double fallbackScore) {
        this.aligner = Objects.requireNonNull(aligner, "aligner must not be null");
        this.fallbackScore = fallbackScore;
    }

    @Override
    public final double score(Spectrum baseline, Spectrum sample, List<Zone> zones) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(zones, "zones must not be null");

        List<AlignedPoint> aligned = aligner.align(baseline, sample);
        if (aligned.size() < MIN_ALIGNED_POINTS) {
            return fallbackScore;
        }

        double[] weights = WeightedStatistics.weights(aligned, ZoneWeightMap.of(zones));
        if (!(WeightedStatistics.totalWeight(weights) > 0.0)) {
            return fallbackScore;
        }

        double score = scoreAligned(aligned, weights);
        if (!Double.isFinite(score)) {
            return fallbackScore;
        }
        return Math.max(0.0, Math.min(100.0, score));
    }

    /**
     * @param aligned at least two points
     * @param weights one per point, positive sum
     */
    protected abstract double scoreAligned(List<AlignedPoint> aligned, double[] weights);
}
