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
import ai.evacortex.spectrascore.core.math.SpectralAligner;
import ai.evacortex.spectrascore.core.math.WeightedStatistics;

import java.util.List;
import java.util.Objects;

/**
 * Weighted Pearson correlation of the raw absorbance curves, mapped by a {@link PearsonMapping}.
 */
public final class PearsonScorer extends AlignedScorer {

    private final PearsonMapping mapping;

    public PearsonScorer(SpectralAligner aligner, double fallbackScore, PearsonMapping mapping) {
        super(aligner, fallbackScore);
        this.mapping = Objects.requireNonNull(mapping, "mapping must not be null");
    }

    public PearsonMapping mapping() {
        return mapping;
    }

    @Override
    public ScoringMethod method() {
        return ScoringMethod.PEARSON;
    }

    @Override
    protected double scoreAligned(List<AlignedPoint> aligned, double[] weights) {
        return mapping.toScore(WeightedStatistics.pearson(aligned, weights));
    }
}
