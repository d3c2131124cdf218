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
import ai.evacortex.spectrascore.core.exceptions.InvalidSpectrumException;

import java.util.Objects;

/**
 * Checks the numeric invariant of a {@link Spectrum}: equal array lengths, at least one point,
 * every value finite. Malformed input is rejected, never repaired.
 */
public final class SpectrumValidator {

    private SpectrumValidator() {}

    public static Spectrum validate(Spectrum spectrum) {
        Objects.requireNonNull(spectrum, "spectrum must not be null");
        String id = spectrum.id();
        int n = spectrum.size();
        int m = spectrum.absorbances().length;

        if (n != m) {
            throw new InvalidSpectrumException(id, "length mismatch (" + n + " wavelengths vs " + m + " absorbances)");
        }
        if (n == 0) {
            throw new InvalidSpectrumException(id, "empty");
        }
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(spectrum.wavelengthAt(i))) {
                throw new InvalidSpectrumException(id, "non-finite wavelength at index " + i);
            }
            if (!Double.isFinite(spectrum.absorbanceAt(i))) {
                throw new InvalidSpectrumException(id, "non-finite absorbance at index " + i);
            }
        }
        return spectrum;
    }
}
