/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.math;

import ai.evacortex.spectrascore.core.Spectrum;

/**
 * Side-by-side statistics of a baseline and a sample; every difference is sample minus baseline.
 */
public record SpectrumComparison(
        SpectrumStatistics baseline,
        SpectrumStatistics sample,
        double meanDifference,
        double stdDifference,
        double rangeDifference
) {

    public static SpectrumComparison of(Spectrum baseline, Spectrum sample) {
        SpectrumStatistics b = SpectrumStatistics.of(baseline);
        SpectrumStatistics s = SpectrumStatistics.of(sample);
        return new SpectrumComparison(
                b,
                s,
                s.meanAbsorbance() - b.meanAbsorbance(),
                s.stdAbsorbance() - b.stdAbsorbance(),
                s.absorbanceRange() - b.absorbanceRange());
    }
}
