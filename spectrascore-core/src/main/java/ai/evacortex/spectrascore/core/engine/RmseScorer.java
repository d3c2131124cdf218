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
 * Weighted RMSE of the absorbance delta, mapped through {@link HealthMapping#RMSE}.
 */
public final class RmseScorer extends AlignedScorer {

    public RmseScorer(SpectralAligner aligner, double fallbackScore) {
        super(aligner, fallbackScore);
    }

    @Override
    public ScoringMethod method() {
        return ScoringMethod.RMSE;
    }

    @Override
    protected double scoreAligned(List<AlignedPoint> aligned, double[] weights) {
        return HealthMapping.RMSE.apply(WeightedStatistics.rmse(aligned, weights));
    }
}
