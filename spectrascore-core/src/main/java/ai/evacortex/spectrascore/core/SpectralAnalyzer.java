/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core;

import ai.evacortex.spectrascore.core.math.SpectrumComparison;

import java.util.List;
import java.util.Map;

/**
 * {@code SpectralAnalyzer} compares a baseline infrared spectrum with a set of sample spectra.
 *
 * <p>Callers supply already parsed spectra and an ordered zone configuration; the analyzer
 * performs no I/O. Every operation is a pure function of its arguments, so one instance can
 * serve concurrent callers.</p>
 *
 * <p>Error handling is split in two classes:</p>
 * <ul>
 *     <li>Malformed spectra (length mismatch, empty arrays, non-finite values) raise
 *     {@link ai.evacortex.spectrascore.core.exceptions.InvalidSpectrumException}. In batch operations
 *     only a malformed baseline aborts the call; a malformed sample is excluded and reported.</li>
 *     <li>Degenerate but valid input (no overlap, zero variance, zero weight) resolves to a neutral
 *     fallback score or an empty profile.</li>
 * </ul>
 */
public interface SpectralAnalyzer {

    /**
     * Scores every sample against the baseline.
     *
     * @param baseline reference spectrum
     * @param samples  samples to score
     * @param zones    ordered weighting zones, empty for uniform weight
     * @param method   scoring method
     * @return sample id → score in [0 ... 100], in sample order; malformed samples are omitted
     * @throws ai.evacortex.spectrascore.core.exceptions.InvalidSpectrumException if the baseline is malformed
     */
    Map<String, Double> computeScores(Spectrum baseline, List<Spectrum> samples, List<Zone> zones, ScoringMethod method);

    /**
     * Builds the heat-map profile of one sample.
     *
     * @param selectedSampleId sample to profile, {@code null} for the first sample
     * @return the profile; empty when no sample matches or nothing aligns
     */
    DeviationProfile computeDeviationProfile(Spectrum baseline,
                                             List<Spectrum> samples,
                                             String selectedSampleId,
                                             List<Zone> zones,
                                             ScoringMethod method);

    SeverityTier classify(double score);

    /**
     * Scores, tiers, rejected samples and the selected sample's profile in one call.
     */
    AnalysisResult analyze(Spectrum baseline,
                           List<Spectrum> samples,
                           String selectedSampleId,
                           List<Zone> zones,
                           ScoringMethod method);

    /**
     * Counts samples per tier, e.g. for status filters.
     */
    SeverityTally tally(Map<String, Double> scores);

    /**
     * Descriptive absorbance statistics of baseline and sample side by side.
     */
    SpectrumComparison summarize(Spectrum baseline, Spectrum sample);
}
