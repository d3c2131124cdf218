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
import ai.evacortex.spectrascore.core.DeviationProfile;
import ai.evacortex.spectrascore.core.ScoringMethod;
import ai.evacortex.spectrascore.core.Spectrum;
import ai.evacortex.spectrascore.core.Zone;
import ai.evacortex.spectrascore.core.exceptions.InvalidSpectrumException;
import ai.evacortex.spectrascore.core.math.SpectralAligner;
import ai.evacortex.spectrascore.core.math.SpectrumValidator;
import ai.evacortex.spectrascore.core.math.ZoneWeightMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the per-wavelength deviation profile of one selected sample.
 *
 * <p>The grid is the selected sample's aligned wavelengths. The deviation formula depends on the method:</p>
 * <ul>
 *     <li>RMSE, PEARSON, HYBRID: {@code |δᵢ(selected)| · wᵢ}</li>
 *     <li>AREA: {@code |δᵢ(selected) − avgδᵢ| · wᵢ}, where {@code avgδᵢ} is the mean delta of every
 *     sample with a point at that wavelength</li>
 * </ul>
 */
public final class DeviationProfileBuilder {

    private static final Logger log = LoggerFactory.getLogger(DeviationProfileBuilder.class);

    private final SpectralAligner aligner;

    public DeviationProfileBuilder(SpectralAligner aligner) {
        this.aligner = Objects.requireNonNull(aligner, "aligner must not be null");
    }

    /**
     * @param selectedSampleId id of the sample to profile; {@code null} or an unknown id selects the first sample
     * @return the profile, empty when there are no samples or nothing aligns
     * @throws InvalidSpectrumException if the baseline or the selected sample is malformed
     */
    public DeviationProfile buildProfile(Spectrum baseline,
                                         List<Spectrum> samples,
                                         String selectedSampleId,
                                         List<Zone> zones,
                                         ScoringMethod method) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(zones, "zones must not be null");
        Objects.requireNonNull(method, "method must not be null");

        SpectrumValidator.validate(baseline);
        if (samples.isEmpty()) {
            return DeviationProfile.empty();
        }

        Spectrum selected = select(samples, selectedSampleId);

        List<AlignedPoint> points = aligner.align(baseline, selected);
        if (points.isEmpty()) {
            log.debug("Sample '{}' shares no wavelength with baseline '{}'", selected.id(), baseline.id());
            return DeviationProfile.empty();
        }

        double[] average = method == ScoringMethod.AREA
                ? averageDeltas(baseline, samples, selected, points)
                : null;

        ZoneWeightMap weights = ZoneWeightMap.of(zones);
        double[] x = new double[points.size()];
        double[] deviation = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            AlignedPoint p = points.get(i);
            double base = average == null
                    ? Math.abs(p.delta())
                    : Math.abs(p.delta() - average[i]);
            x[i] = p.wavelength();
            deviation[i] = base * weights.weightFor(p.wavelength());
        }
        return DeviationProfile.of(x, deviation);
    }

    private static Spectrum select(List<Spectrum> samples, String selectedSampleId) {
        if (selectedSampleId == null) {
            return samples.get(0);
        }
        for (Spectrum s : samples) {
            if (selectedSampleId.equals(s.id())) {
                return s;
            }
        }
        log.warn("Selected sample '{}' is not part of the sample set; profiling '{}' instead",
                selectedSampleId, samples.get(0).id());
        return samples.get(0);
    }

    private double[] averageDeltas(Spectrum baseline,
                                   List<Spectrum> samples,
                                   Spectrum selected,
                                   List<AlignedPoint> grid) {
        List<SpectralAligner.PointLookup> others = new ArrayList<>(samples.size());
        for (Spectrum s : samples) {
            if (s == selected) continue;
            try {
                others.add(aligner.lookup(aligner.align(baseline, s)));
            } catch (InvalidSpectrumException e) {
                log.warn("Excluding sample '{}' from the cross-sample average: {}", s.id(), e.getMessage());
            }
        }

        double[] average = new double[grid.size()];
        for (int i = 0; i < grid.size(); i++) {
            AlignedPoint p = grid.get(i);
            double sum = p.delta();
            int count = 1;
            for (SpectralAligner.PointLookup other : others) {
                AlignedPoint match = other.at(p.wavelength());
                if (match != null) {
                    sum += match.delta();
                    count++;
                }
            }
            average[i] = sum / count;
        }
        return average;
    }
}
