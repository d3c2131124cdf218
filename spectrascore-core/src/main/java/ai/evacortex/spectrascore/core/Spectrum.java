/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * An infrared absorbance measurement: ordered (wavenumber, absorbance) pairs.
 *
 * <p>The arrays are copied on the way in and on the way out, so a {@code Spectrum} cannot be
 * changed after construction. The numeric invariant (equal lengths, at least one point, finite
 * values) is not enforced here; the engine checks it on entry through
 * {@link ai.evacortex.spectrascore.core.math.SpectrumValidator}.</p>
 */
public record Spectrum(String id, double[] wavelengths, double[] absorbances) {

    public Spectrum {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(wavelengths, "wavelengths must not be null");
        Objects.requireNonNull(absorbances, "absorbances must not be null");
        wavelengths = wavelengths.clone();
        absorbances = absorbances.clone();
    }

    @Override
    public double[] wavelengths() {
        return wavelengths.clone();
    }

    @Override
    public double[] absorbances() {
        return absorbances.clone();
    }

    public int size() {
        return wavelengths.length;
    }

    public double wavelengthAt(int index) {
        return wavelengths[index];
    }

    public double absorbanceAt(int index) {
        return absorbances[index];
    }

    /**
     * Returns a copy of this spectrum under another id. Used to compare a measurement against itself.
     */
    public Spectrum withId(String newId) {
        return new Spectrum(newId, wavelengths, absorbances);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Spectrum other)) return false;
        return id.equals(other.id)
                && Arrays.equals(wavelengths, other.wavelengths)
                && Arrays.equals(absorbances, other.absorbances);
    }

    @Override
    public int hashCode() {
        int result = id.hashCode();
        result = 31 * result + Arrays.hashCode(wavelengths);
        result = 31 * result + Arrays.hashCode(absorbances);
        return result;
    }

    @Override
    public String toString() {
        return "Spectrum{id='" + id + "', points=" + wavelengths.length + '}';
    }
}
