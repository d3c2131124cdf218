/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.engine;

import ai.evacortex.spectrascore.core.DeviationProfile;
import ai.evacortex.spectrascore.core.ScoringMethod;
import ai.evacortex.spectrascore.core.Spectrum;
import ai.evacortex.spectrascore.core.SpectrumTestUtils;
import ai.evacortex.spectrascore.core.Zone;
import ai.evacortex.spectrascore.core.exceptions.InvalidSpectrumException;
import ai.evacortex.spectrascore.core.math.SpectralAligner;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeviationProfileBuilderTest {

    private static final double[] X = {1.0, 2.0, 3.0};

    private final DeviationProfileBuilder builder = new DeviationProfileBuilder(new SpectralAligner());
    private final Spectrum baseline = SpectrumTestUtils.spectrum("b", X, 0.0, 0.0, 0.0);
    private final Spectrum rising = SpectrumTestUtils.spectrum("rising", X, 1.0, 2.0, 3.0);
    private final Spectrum falling = SpectrumTestUtils.spectrum("falling", X, 3.0, 2.0, 1.0);
    private final List<Spectrum> samples = List.of(rising, falling);

    @ParameterizedTest
    @EnumSource(value = ScoringMethod.class, names = {"RMSE", "PEARSON", "HYBRID"})
    void deltaMethods_useMagnitudeOfOwnDelta(ScoringMethod method) {
        DeviationProfile p = builder.buildProfile(baseline, samples, "rising", List.of(), method);

        assertArrayEquals(X, p.wavelengths(), 0.0);
        assertArrayEquals(new double[]{1.0, 2.0, 3.0}, p.deviations(), 1e-12);
        assertEquals(3.0, p.maxDeviation(), 1e-12);
        assertEquals(2.0, p.avgDeviation(), 1e-12);
    }

    @Test
    void staleSelection_fallsBackToFirstSample() {
        DeviationProfile stale = builder.buildProfile(baseline, samples, "missing", List.of(), ScoringMethod.RMSE);
        DeviationProfile first = builder.buildProfile(baseline, samples, "rising", List.of(), ScoringMethod.RMSE);

        assertEquals(3, stale.size());
        assertArrayEquals(first.wavelengths(), stale.wavelengths(), 0.0);
        assertArrayEquals(first.deviations(), stale.deviations(), 0.0);
        assertEquals(first.maxDeviation(), stale.maxDeviation(), 0.0);
    }

    @Test
    void area_measuresDistanceFromCrossSampleMean() {
        DeviationProfile p = builder.buildProfile(baseline, samples, "rising", List.of(), ScoringMethod.AREA);

        // mean delta is 2.0 everywhere
        assertArrayEquals(new double[]{1.0, 0.0, 1.0}, p.deviations(), 1e-12);
        assertEquals(1.0, p.maxDeviation(), 1e-12);
        assertEquals(2.0 / 3.0, p.avgDeviation(), 1e-12);
    }

    @Test
    void area_averagesOnlySamplesPresentAtEachWavelength() {
        Spectrum partial = SpectrumTestUtils.spectrum("partial", new double[]{1.0, 2.0}, 3.0, 2.0);
        DeviationProfile p = builder.buildProfile(baseline, List.of(rising, partial), "rising", List.of(), ScoringMethod.AREA);

        assertArrayEquals(new double[]{1.0, 0.0, 0.0}, p.deviations(), 1e-12);
    }

    @Test
    void area_withSingleSample_isFlatZero() {
        DeviationProfile p = builder.buildProfile(baseline, List.of(rising), "rising", List.of(), ScoringMethod.AREA);
        assertArrayEquals(new double[]{0.0, 0.0, 0.0}, p.deviations(), 1e-12);
        assertEquals(0.0, p.maxDeviation(), 0.0);
    }

    @Test
    void zoneWeightsScaleDeviation() {
        List<Zone> zones = List.of(new Zone(2.0, 3.0, 50, "half", "h"));
        DeviationProfile p = builder.buildProfile(baseline, samples, "rising", zones, ScoringMethod.RMSE);
        assertArrayEquals(new double[]{1.0, 1.0, 1.5}, p.deviations(), 1e-12);
    }

    @Test
    void nullSelection_profilesFirstSample() {
        DeviationProfile p = builder.buildProfile(baseline, samples, null, List.of(), ScoringMethod.RMSE);
        assertArrayEquals(new double[]{1.0, 2.0, 3.0}, p.deviations(), 1e-12);
    }

    @Nested
    class EmptyProfiles {

        @Test
        void noSamples() {
            DeviationProfile p = builder.buildProfile(baseline, List.of(), "rising", List.of(), ScoringMethod.AREA);
            assertTrue(p.isEmpty());
            assertEquals(0.0, p.maxDeviation(), 0.0);
            assertEquals(0.0, p.avgDeviation(), 0.0);
        }

        @Test
        void selectedSampleWithoutOverlap() {
            Spectrum disjoint = SpectrumTestUtils.spectrum("disjoint", new double[]{10.0, 11.0}, 1.0, 1.0);
            DeviationProfile p = builder.buildProfile(baseline, List.of(rising, disjoint), "disjoint", List.of(), ScoringMethod.AREA);
            assertTrue(p.isEmpty());
            assertEquals(0, p.wavelengths().length);
        }
    }

    @Nested
    class Validation {

        @Test
        void malformedBaseline_throws() {
            Spectrum bad = SpectrumTestUtils.spectrum("bad", X, 0.0, 0.0);
            assertThrows(InvalidSpectrumException.class,
                    () -> builder.buildProfile(bad, samples, "rising", List.of(), ScoringMethod.RMSE));
        }

        @Test
        void malformedSelectedSample_throws() {
            Spectrum bad = SpectrumTestUtils.spectrum("bad", X, 0.0, Double.NaN, 0.0);
            assertThrows(InvalidSpectrumException.class,
                    () -> builder.buildProfile(baseline, List.of(bad, rising), "bad", List.of(), ScoringMethod.RMSE));
        }

        @Test
        void malformedOtherSample_isLeftOutOfTheAverage() {
            Spectrum bad = SpectrumTestUtils.spectrum("bad", X, 0.0, Double.NaN, 0.0);
            DeviationProfile p = builder.buildProfile(baseline, List.of(rising, bad), "rising", List.of(), ScoringMethod.AREA);
            assertArrayEquals(new double[]{0.0, 0.0, 0.0}, p.deviations(), 1e-12);
        }
    }
}
