/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.cache;

import ai.evacortex.spectrascore.core.ScoringMethod;
import ai.evacortex.spectrascore.core.Spectrum;
import ai.evacortex.spectrascore.core.Zone;

import java.util.List;

/**
 * Identity of one (baseline, sample, zones, method) comparison. Ids plus content hashes, so replacing
 * a spectrum under the same id still produces a new key.
 */
public record ScoreKey(
        String baselineId,
        long baselineHash,
        String sampleId,
        long sampleHash,
        long zonesHash,
        ScoringMethod method
) {
    public static ScoreKey of(Spectrum baseline, Spectrum sample, List<Zone> zones, ScoringMethod method) {
        return new ScoreKey(
                baseline.id(),
                HashingUtil.contentHash(baseline),
                sample.id(),
                HashingUtil.contentHash(sample),
                HashingUtil.zonesHash(zones),
                method);
    }
}
