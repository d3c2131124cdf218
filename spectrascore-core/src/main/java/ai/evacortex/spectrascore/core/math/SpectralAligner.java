/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.math;

import ai.evacortex.spectrascore.core.AlignedPoint;
import ai.evacortex.spectrascore.core.Spectrum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pairs a sample with its baseline by wavelength.
 *
 * <p>For every sample point the nearest baseline wavelength within the tolerance is looked up;
 * sample points without a partner are dropped. The result keeps the sample's point order.
 * An empty result is a valid outcome (no overlap), not an error.</p>
 */
public final class SpectralAligner {

    public static final double DEFAULT_TOLERANCE = 1e-3;

    private final double tolerance;

    public SpectralAligner() {
        this(DEFAULT_TOLERANCE);
    }

    public SpectralAligner(double tolerance) {
        if (!Double.isFinite(tolerance) || tolerance < 0.0) {
            throw new IllegalArgumentException("tolerance must be a finite non-negative number");
        }
        this.tolerance = tolerance;
    }

    public double tolerance() {
        return tolerance;
    }

    /**
     * @throws ai.evacortex.spectrascore.core.exceptions.InvalidSpectrumException if either spectrum is malformed
     */
    public List<AlignedPoint> align(Spectrum baseline, Spectrum sample) {
        SpectrumValidator.validate(baseline);
        SpectrumValidator.validate(sample);

        WavelengthIndex index = new WavelengthIndex(baseline.wavelengths());
        List<AlignedPoint> aligned = new ArrayList<>(sample.size());
        for (int i = 0; i < sample.size(); i++) {
            double x = sample.wavelengthAt(i);
            int j = index.find(x, tolerance);
            if (j >= 0) {
                aligned.add(new AlignedPoint(x, baseline.absorbanceAt(j), sample.absorbanceAt(i)));
            }
        }
        return Collections.unmodifiableList(aligned);
    }

    /**
     * Lookup helper over already aligned points, used to match wavelengths across samples.
     */
    public PointLookup lookup(List<AlignedPoint> points) {
        double[] xs = new double[points.size()];
        for (int i = 0; i < xs.length; i++) {
            xs[i] = points.get(i).wavelength();
        }
        WavelengthIndex index = new WavelengthIndex(xs);
        return wavelength -> {
            int i = index.find(wavelength, tolerance);
            return i < 0 ? null : points.get(i);
        };
    }

    @FunctionalInterface
    public interface PointLookup {
        /**
         * @return the point within tolerance of {@code wavelength}, or {@code null}
         */
        AlignedPoint at(double wavelength);
    }
}
