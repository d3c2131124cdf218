/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.engine;

import ai.evacortex.spectrascore.core.ScoringMethod;
import ai.evacortex.spectrascore.core.Spectrum;
import ai.evacortex.spectrascore.core.Zone;
import ai.evacortex.spectrascore.core.math.SpectralAligner;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single entry point for per-sample scores: one {@link SpectrumScorer} per {@link ScoringMethod}.
 * Stateless after construction and safe to share between threads.
 */
public final class ScoreEngine {

    private final ScoringOptions options;
    private final SpectralAligner aligner;
    private final Map<ScoringMethod, SpectrumScorer> scorers;

    public ScoreEngine() {
        this(ScoringOptions.defaultOptions());
    }

    public ScoreEngine(ScoringOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.aligner = new SpectralAligner(options.alignmentTolerance());

        double fallback = options.fallbackScore();
        Map<ScoringMethod, SpectrumScorer> map = new EnumMap<>(ScoringMethod.class);
        map.put(ScoringMethod.RMSE, new RmseScorer(aligner, fallback));
        map.put(ScoringMethod.PEARSON, new PearsonScorer(aligner, fallback, options.pearsonMapping()));
        map.put(ScoringMethod.AREA, new AreaScorer(aligner, fallback));
        map.put(ScoringMethod.HYBRID, new HybridScorer(aligner, fallback));
        this.scorers = map;
    }

    public double score(Spectrum baseline, Spectrum sample, List<Zone> zones, ScoringMethod method) {
        return scorer(method).score(baseline, sample, zones);
    }

    public SpectrumScorer scorer(ScoringMethod method) {
        Objects.requireNonNull(method, "method must not be null");
        return scorers.get(method);
    }

    public SpectralAligner aligner() {
        return aligner;
    }

    public ScoringOptions options() {
        return options;
    }
}
