/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core;

import java.util.Objects;

/**
 * Per-wavelength weighted deviation of one sample, used as a heat-map feed.
 */
public record DeviationProfile(double[] wavelengths, double[] deviations, double maxDeviation, double avgDeviation) {

    private static final DeviationProfile EMPTY = new DeviationProfile(new double[0], new double[0], 0.0, 0.0);

    public DeviationProfile {
        Objects.requireNonNull(wavelengths, "wavelengths must not be null");
        Objects.requireNonNull(deviations, "deviations must not be null");
        if (wavelengths.length != deviations.length) {
            throw new IllegalArgumentException("wavelengths and deviations must have equal length");
        }
        wavelengths = wavelengths.clone();
        deviations = deviations.clone();
    }

    public static DeviationProfile empty() {
        return EMPTY;
    }

    /**
     * Builds a profile and derives max/avg from the deviation values. Both are 0 for an empty array.
     */
    public static DeviationProfile of(double[] wavelengths, double[] deviations) {
        if (deviations.length == 0) {
            return EMPTY;
        }
        double max = 0.0;
        double sum = 0.0;
        for (double d : deviations) {
            max = Math.max(max, d);
            sum += d;
        }
        return new DeviationProfile(wavelengths, deviations, max, sum / deviations.length);
    }

    @Override
    public double[] wavelengths() {
        return wavelengths.clone();
    }

    @Override
    public double[] deviations() {
        return deviations.clone();
    }

    public int size() {
        return deviations.length;
    }

    public boolean isEmpty() {
        return deviations.length == 0;
    }
}
