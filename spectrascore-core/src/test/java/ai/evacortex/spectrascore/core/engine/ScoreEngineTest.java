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
import ai.evacortex.spectrascore.core.SpectrumTestUtils;
import ai.evacortex.spectrascore.core.Zone;
import ai.evacortex.spectrascore.core.math.HealthMapping;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScoreEngineTest {

    private final ScoreEngine engine = new ScoreEngine();
    private final Spectrum baseline = SpectrumTestUtils.fourPointBaseline();

    @ParameterizedTest
    @EnumSource(ScoringMethod.class)
    void fourPointIdenticalSample_scoresHundred(ScoringMethod method) {
        Spectrum sample = SpectrumTestUtils.spectrum("same", SpectrumTestUtils.FOUR_POINT_WAVELENGTHS, 0.1, 0.2, 0.3, 0.4);
        assertEquals(100.0, engine.score(baseline, sample, List.of(), method), 1e-9);
    }

    @ParameterizedTest
    @EnumSource(ScoringMethod.class)
    void everyMethodHasAScorer(ScoringMethod method) {
        assertEquals(method, engine.scorer(method).method());
    }

    @Nested
    class UniformOffsetOfOne {

        private final Spectrum sample = SpectrumTestUtils.shifted(baseline, "offset", 1.0);

        @Test
        void rmse_fallsInExponentialTail() {
            double s = engine.score(baseline, sample, List.of(), ScoringMethod.RMSE);
            assertEquals(40.0 * Math.exp(-(1.0 - 0.5) / 0.3), s, 1e-9);
            assertEquals(8L, Math.round(s));
        }

        @Test
        void pearson_ignoresOffset() {
            assertEquals(100.0, engine.score(baseline, sample, List.of(), ScoringMethod.PEARSON), 1e-9);
        }

        @Test
        void hybrid_hasNoPenaltyForPerfectCorrelation() {
            double s = engine.score(baseline, sample, List.of(), ScoringMethod.HYBRID);
            assertEquals(40.0 * Math.exp(-(1.0 - 0.5) / 0.3), s, 1e-9);
        }

        @Test
        void area_integratesOverWavenumber() {
            // three 1000 cm⁻¹ segments at |δ| = 1 → area 3000
            double s = engine.score(baseline, sample, List.of(), ScoringMethod.AREA);
            assertEquals(40.0 * Math.exp(-(3000.0 - 500.0) / 300.0), s, 1e-12);
        }
    }

    @Nested
    class PearsonMappings {

        private final Spectrum reversed = SpectrumTestUtils.spectrum("rev", SpectrumTestUtils.FOUR_POINT_WAVELENGTHS, 0.4, 0.3, 0.2, 0.1);
        private final Spectrum flat = SpectrumTestUtils.constant("flat", SpectrumTestUtils.FOUR_POINT_WAVELENGTHS, 0.25);

        @Test
        void shifted_placesUncorrelatedAtFifty() {
            assertEquals(50.0, engine.score(baseline, flat, List.of(), ScoringMethod.PEARSON), 1e-9);
            assertEquals(0.0, engine.score(baseline, reversed, List.of(), ScoringMethod.PEARSON), 1e-9);
        }

        @Test
        void clipped_floorsNonPositiveCorrelationAtZero() {
            ScoreEngine clipped = new ScoreEngine(ScoringOptions.defaultOptions().withPearsonMapping(PearsonMapping.CLIPPED));
            assertEquals(0.0, clipped.score(baseline, flat, List.of(), ScoringMethod.PEARSON), 1e-9);
            assertEquals(0.0, clipped.score(baseline, reversed, List.of(), ScoringMethod.PEARSON), 1e-9);
        }

        @Test
        void smallAbsorbanceScale_keepsPerfectCorrelation() {
            double[] x = {3000.0, 2000.0, 1000.0};
            Spectrum faint = SpectrumTestUtils.spectrum("faint", x, 1e-10, 2e-10, 3e-10);
            Spectrum scaled = SpectrumTestUtils.spectrum("scaled", x, 2e-10, 4e-10, 6e-10);
            assertEquals(100.0, engine.score(faint, scaled, List.of(), ScoringMethod.PEARSON), 1e-6);
        }

        @Test
        void optionsSelectTheMapping() {
            ScoreEngine clipped = new ScoreEngine(ScoringOptions.defaultOptions().withPearsonMapping(PearsonMapping.CLIPPED));
            assertEquals(PearsonMapping.SHIFTED, ((PearsonScorer) engine.scorer(ScoringMethod.PEARSON)).mapping());
            assertEquals(PearsonMapping.CLIPPED, ((PearsonScorer) clipped.scorer(ScoringMethod.PEARSON)).mapping());
        }

        @Test
        void mappingsAgreeOnPositiveEnds() {
            assertEquals(100.0, PearsonMapping.SHIFTED.toScore(1.0), 0.0);
            assertEquals(100.0, PearsonMapping.CLIPPED.toScore(1.0), 0.0);
            assertEquals(75.0, PearsonMapping.SHIFTED.toScore(0.5), 1e-12);
            assertEquals(50.0, PearsonMapping.CLIPPED.toScore(0.5), 1e-12);
        }
    }

    @Nested
    class Hybrid {

        @Test
        void penaltyBands() {
            assertEquals(0.0, HybridScorer.correlationPenalty(0.99), 0.0);
            assertEquals(0.0, HybridScorer.correlationPenalty(0.95), 0.0);
            assertEquals(4.5, HybridScorer.correlationPenalty(0.92), 1e-9);
            assertEquals(7.5, HybridScorer.correlationPenalty(0.45), 1e-9);
            assertEquals(15.0, HybridScorer.correlationPenalty(0.0), 1e-9);
            assertEquals(15.0 * 1.9 / 0.9, HybridScorer.correlationPenalty(-1.0), 1e-9);
        }

        @Test
        void uncorrelatedSample_losesFifteenPoints() {
            Spectrum flat = SpectrumTestUtils.constant("flat", SpectrumTestUtils.FOUR_POINT_WAVELENGTHS, 0.25);
            double rmse = Math.sqrt(0.0125);
            double base = 70.0 + 20.0 * (1.0 - (rmse - 0.10) / 0.15);
            assertEquals(base - 15.0, engine.score(baseline, flat, List.of(), ScoringMethod.HYBRID), 1e-9);
        }

        @Test
        void neverDropsBelowZero() {
            Spectrum reversed = SpectrumTestUtils.spectrum("rev", SpectrumTestUtils.FOUR_POINT_WAVELENGTHS, 5.0, 3.0, 2.0, 1.0);
            assertEquals(0.0, engine.score(baseline, reversed, List.of(), ScoringMethod.HYBRID), 1e-9);
        }
    }

    @Test
    void zonesChangeTheWeightedRmse() {
        Spectrum sample = SpectrumTestUtils.spectrum("s", SpectrumTestUtils.FOUR_POINT_WAVELENGTHS, 0.1, 0.2, 0.3, 0.6);
        // δ = 0.2 only at 1000 cm⁻¹; muting that zone leaves a perfect match
        List<Zone> mutedLowRange = List.of(new Zone(500, 1500, 0, "muted", "m"));
        List<Zone> boostedLowRange = List.of(new Zone(500, 1500, 300, "boost", "b"));

        double uniform = engine.score(baseline, sample, List.of(), ScoringMethod.RMSE);
        double muted = engine.score(baseline, sample, mutedLowRange, ScoringMethod.RMSE);
        double boosted = engine.score(baseline, sample, boostedLowRange, ScoringMethod.RMSE);

        assertEquals(100.0, muted, 1e-9);
        assertTrue(boosted < uniform, "Boosting the deviating region must lower the score");
        assertEquals(HealthMapping.RMSE.apply(Math.sqrt(0.04 / 4)), uniform, 1e-9);
        assertEquals(HealthMapping.RMSE.apply(Math.sqrt(3 * 0.04 / 6)), boosted, 1e-9);
    }

    @Test
    void customFallbackScore_isUsedForDegenerateInput() {
        ScoringOptions options = new ScoringOptions(1e-3, 0.0, PearsonMapping.SHIFTED, true);
        ScoreEngine strict = new ScoreEngine(options);
        Spectrum disjoint = SpectrumTestUtils.spectrum("d", new double[]{1, 2}, 0.1, 0.2);
        assertEquals(0.0, strict.score(baseline, disjoint, List.of(), ScoringMethod.RMSE), 0.0);
    }

    @Test
    void nullMethod_throwsNpe() {
        assertThrows(NullPointerException.class, () -> engine.score(baseline, baseline, List.of(), null));
    }
}
