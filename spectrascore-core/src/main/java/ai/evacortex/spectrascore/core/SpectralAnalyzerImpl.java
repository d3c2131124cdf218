/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core;

import ai.evacortex.spectrascore.core.cache.ScoreCache;
import ai.evacortex.spectrascore.core.engine.DeviationProfileBuilder;
import ai.evacortex.spectrascore.core.engine.ScoreEngine;
import ai.evacortex.spectrascore.core.engine.ScoringOptions;
import ai.evacortex.spectrascore.core.exceptions.InvalidSpectrumException;
import ai.evacortex.spectrascore.core.math.SeverityClassifier;
import ai.evacortex.spectrascore.core.math.SpectrumComparison;
import ai.evacortex.spectrascore.core.math.SpectrumValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class SpectralAnalyzerImpl implements SpectralAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SpectralAnalyzerImpl.class);

    private final ScoreEngine engine;
    private final DeviationProfileBuilder profileBuilder;
    private final ScoreCache cache;

    public SpectralAnalyzerImpl() {
        this(ScoringOptions.fromSystemProperties(), null);
    }

    public SpectralAnalyzerImpl(ScoringOptions options) {
        this(options, null);
    }

    /**
     * @param cache optional score cache, {@code null} to always recompute
     */
    public SpectralAnalyzerImpl(ScoringOptions options, ScoreCache cache) {
        this.engine = new ScoreEngine(options);
        this.profileBuilder = new DeviationProfileBuilder(engine.aligner());
        this.cache = cache;
    }

    @Override
    public Map<String, Double> computeScores(Spectrum baseline,
                                             List<Spectrum> samples,
                                             List<Zone> zones,
                                             ScoringMethod method) {
        return scoreBatch(baseline, samples, zones, method, new LinkedHashMap<>());
    }

    @Override
    public DeviationProfile computeDeviationProfile(Spectrum baseline,
                                                    List<Spectrum> samples,
                                                    String selectedSampleId,
                                                    List<Zone> zones,
                                                    ScoringMethod method) {
        return profileBuilder.buildProfile(baseline, samples, selectedSampleId, zones, method);
    }

    @Override
    public SeverityTier classify(double score) {
        return SeverityClassifier.classify(score);
    }

    @Override
    public AnalysisResult analyze(Spectrum baseline,
                                  List<Spectrum> samples,
                                  String selectedSampleId,
                                  List<Zone> zones,
                                  ScoringMethod method) {
        Map<String, String> rejected = new LinkedHashMap<>();
        Map<String, Double> scores = scoreBatch(baseline, samples, zones, method, rejected);

        Map<String, SeverityTier> tiers = new LinkedHashMap<>();
        scores.forEach((id, score) -> tiers.put(id, classify(score)));

        DeviationProfile profile;
        if (selectedSampleId != null && rejected.containsKey(selectedSampleId)) {
            profile = DeviationProfile.empty();
        } else {
            try {
                profile = profileBuilder.buildProfile(baseline, samples, selectedSampleId, zones, method);
            } catch (InvalidSpectrumException e) {
                log.warn("Deviation profile unavailable: {}", e.getMessage());
                profile = DeviationProfile.empty();
            }
        }
        return new AnalysisResult(scores, tiers, profile, rejected);
    }

    @Override
    public SeverityTally tally(Map<String, Double> scores) {
        return SeverityClassifier.tally(scores);
    }

    @Override
    public SpectrumComparison summarize(Spectrum baseline, Spectrum sample) {
        return SpectrumComparison.of(baseline, sample);
    }

    private Map<String, Double> scoreBatch(Spectrum baseline,
                                           List<Spectrum> samples,
                                           List<Zone> zones,
                                           ScoringMethod method,
                                           Map<String, String> rejected) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(zones, "zones must not be null");
        Objects.requireNonNull(method, "method must not be null");

        SpectrumValidator.validate(baseline);

        Map<String, Double> scores = new LinkedHashMap<>();
        for (Spectrum sample : samples) {
            try {
                double raw = rawScore(baseline, sample, zones, method);
                double score = engine.options().roundScores() ? Math.round(raw) : raw;
                scores.put(sample.id(), score);
                log.debug("Scored sample '{}' with {}: {}", sample.id(), method.selector(), score);
            } catch (InvalidSpectrumException e) {
                log.warn("Skipping sample '{}': {}", e.getSpectrumId(), e.getMessage());
                rejected.put(sample.id(), e.getMessage());
            }
        }
        return scores;
    }

    private double rawScore(Spectrum baseline, Spectrum sample, List<Zone> zones, ScoringMethod method) {
        if (cache == null) {
            return engine.score(baseline, sample, zones, method);
        }
        return cache.get(baseline, sample, zones, method,
                () -> engine.score(baseline, sample, zones, method));
    }
}
