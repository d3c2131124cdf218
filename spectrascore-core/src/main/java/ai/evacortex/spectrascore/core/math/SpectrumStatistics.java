/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.math;

import ai.evacortex.spectrascore.core.Spectrum;

/**
 * Descriptive statistics of one spectrum's absorbance values and wavenumber span.
 * {@code stdAbsorbance} is the sample standard deviation (n − 1), 0 for a single point.
 */
public record SpectrumStatistics(
        String spectrumId,
        int count,
        double meanAbsorbance,
        double stdAbsorbance,
        double minAbsorbance,
        double maxAbsorbance,
        double minWavelength,
        double maxWavelength
) {

    public static SpectrumStatistics of(Spectrum spectrum) {
        SpectrumValidator.validate(spectrum);
        int n = spectrum.size();

        double sum = 0.0;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            double y = spectrum.absorbanceAt(i);
            double x = spectrum.wavelengthAt(i);
            sum += y;
            minY = Math.min(minY, y);
            maxY = Math.max(maxY, y);
            minX = Math.min(minX, x);
            maxX = Math.max(maxX, x);
        }
        double mean = sum / n;

        double squares = 0.0;
        for (int i = 0; i < n; i++) {
            double d = spectrum.absorbanceAt(i) - mean;
            squares += d * d;
        }
        double std = n > 1 ? Math.sqrt(squares / (n - 1)) : 0.0;

        return new SpectrumStatistics(spectrum.id(), n, mean, std, minY, maxY, minX, maxX);
    }

    public double absorbanceRange() {
        return maxAbsorbance - minAbsorbance;
    }
}
