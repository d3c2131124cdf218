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
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.List;
import java.util.function.Supplier;

/**
 * Optional memoization of raw scores. Sits outside the engine: results are identical with or without it.
 */
public class ScoreCache {

    public static final long DEFAULT_MAX_ENTRIES =
            Long.parseLong(System.getProperty("spectrascore.cache.maxEntries", "10000"));

    private final Cache<ScoreKey, Double> cache;

    public ScoreCache() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public ScoreCache(long maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .build();
    }

    public double get(Spectrum baseline, Spectrum sample, List<Zone> zones, ScoringMethod method,
                      Supplier<Double> compute) {
        return cache.get(ScoreKey.of(baseline, sample, zones, method), key -> compute.get());
    }

    public Double getIfPresent(ScoreKey key) {
        return cache.getIfPresent(key);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
