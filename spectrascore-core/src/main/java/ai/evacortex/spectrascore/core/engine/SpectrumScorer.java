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

import java.util.List;

/**
 * {@code SpectrumScorer} computes a bounded health score for a sample spectrum measured against
 * a baseline spectrum.
 *
 * <p>Both spectra are aligned by wavenumber first; each aligned point carries an importance weight
 * resolved from the zone list. The result is always within [0 ... 100]:</p>
 * <ul>
 *     <li>100 means the sample is indistinguishable from the baseline</li>
 *     <li>0 means the sample has diverged beyond every threshold of the method</li>
 * </ul>
 *
 * <p>Implementations must be deterministic and free of side effects. Degenerate but valid input
 * (fewer than two aligned points, zero total weight, numeric breakdown) resolves to the configured
 * fallback score instead of NaN.</p>
 *
 * @see ScoringMethod
 * @see ScoreEngine
 */
public interface SpectrumScorer {

    ScoringMethod method();

    /**
     * Scores one sample against the baseline.
     *
     * @param baseline reference spectrum
     * @param sample   measured spectrum
     * @param zones    ordered weighting zones, possibly empty
     * @return score in [0.0 ... 100.0]
     * @throws ai.evacortex.spectrascore.core.exceptions.InvalidSpectrumException if either spectrum is malformed
     * @throws NullPointerException if any argument is {@code null}
     */
    double score(Spectrum baseline, Spectrum sample, List<Zone> zones);
}
