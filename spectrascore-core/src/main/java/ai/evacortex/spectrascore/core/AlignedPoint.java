/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core;

/**
 * One wavelength present in both baseline and sample, with both raw absorbances.
 */
public record AlignedPoint(double wavelength, double baselineAbsorbance, double sampleAbsorbance) {

    public double delta() {
        return sampleAbsorbance - baselineAbsorbance;
    }
}
