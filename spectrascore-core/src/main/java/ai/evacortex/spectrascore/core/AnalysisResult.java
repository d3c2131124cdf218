/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores, tiers and the deviation profile of the selected sample for one analysis request.
 *
 * @param scores          sample id to score, in sample input order
 * @param tiers           sample id to severity tier, same keys as {@code scores}
 * @param deviationProfile profile of the selected sample, possibly empty
 * @param rejectedSamples sample id to validation message for samples excluded from scoring
 */
public record AnalysisResult(
        Map<String, Double> scores,
        Map<String, SeverityTier> tiers,
        DeviationProfile deviationProfile,
        Map<String, String> rejectedSamples
) {
    public AnalysisResult {
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        tiers = Collections.unmodifiableMap(new LinkedHashMap<>(tiers));
        rejectedSamples = Collections.unmodifiableMap(new LinkedHashMap<>(rejectedSamples));
    }

    /**
     * Scores as a list, in sample order.
     */
    public List<ScoreResult> results() {
        List<ScoreResult> out = new ArrayList<>(scores.size());
        scores.forEach((id, score) -> out.add(new ScoreResult(id, score)));
        return out;
    }
}
