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

import java.util.List;

/**
 * Weighted aggregates over aligned points. {@code weights[i]} belongs to {@code points.get(i)}.
 * Callers guarantee a positive total weight; every other degenerate case resolves to a finite value.
 */
public final class WeightedStatistics {

    // Variance at or below (1e-12 · |mean|)² is rounding residue of a constant curve.
    private static final double RELATIVE_VARIANCE_EPSILON = 1e-24;

    private WeightedStatistics() {}

    public static double[] weights(List<AlignedPoint> points, ZoneWeightMap weightMap) {
        double[] w = new double[points.size()];
        for (int i = 0; i < w.length; i++) {
            w[i] = weightMap.weightFor(points.get(i).wavelength());
        }
        return w;
    }

    public static double totalWeight(double[] weights) {
        double sum = 0.0;
        for (double w : weights) sum += w;
        return sum;
    }

    /**
     * sqrt(Σ wᵢ·δᵢ² / Σ wᵢ)
     */
    public static double rmse(List<AlignedPoint> points, double[] weights) {
        checkSizes(points, weights);
        double sumSquares = 0.0;
        double sumWeights = 0.0;
        for (int i = 0; i < weights.length; i++) {
            double d = points.get(i).delta();
            sumSquares += weights[i] * d * d;
            sumWeights += weights[i];
        }
        if (sumWeights <= 0.0) return 0.0;
        return Math.sqrt(Math.max(0.0, sumSquares / sumWeights));
    }

    /**
     * Weighted Pearson correlation of the raw baseline and sample absorbances, clamped to [-1, 1].
     * Identical curves correlate at 1; otherwise a curve without weighted variance gives 0.
     */
    public static double pearson(List<AlignedPoint> points, double[] weights) {
        checkSizes(points, weights);
        if (allDeltasZero(points)) return 1.0;

        double sumWeights = 0.0;
        double sumX = 0.0;
        double sumY = 0.0;
        for (int i = 0; i < weights.length; i++) {
            AlignedPoint p = points.get(i);
            sumWeights += weights[i];
            sumX += weights[i] * p.baselineAbsorbance();
            sumY += weights[i] * p.sampleAbsorbance();
        }
        if (sumWeights <= 0.0) return 0.0;

        double meanX = sumX / sumWeights;
        double meanY = sumY / sumWeights;

        double covariance = 0.0;
        double varianceX = 0.0;
        double varianceY = 0.0;
        for (int i = 0; i < weights.length; i++) {
            AlignedPoint p = points.get(i);
            double dx = p.baselineAbsorbance() - meanX;
            double dy = p.sampleAbsorbance() - meanY;
            covariance += weights[i] * dx * dy;
            varianceX += weights[i] * dx * dx;
            varianceY += weights[i] * dy * dy;
        }
        covariance /= sumWeights;
        varianceX = Math.max(0.0, varianceX / sumWeights);
        varianceY = Math.max(0.0, varianceY / sumWeights);

        if (isFlat(varianceX, meanX) || isFlat(varianceY, meanY)) return 0.0;

        double r = covariance / (Math.sqrt(varianceX) * Math.sqrt(varianceY));
        if (!Double.isFinite(r)) return 0.0;
        return Math.max(-1.0, Math.min(1.0, r));
    }

    private static boolean isFlat(double variance, double mean) {
        return variance <= RELATIVE_VARIANCE_EPSILON * mean * mean;
    }

    /**
     * Trapezoidal integral of |δ| over wavenumber, each segment weighted by the mean of its end weights.
     * Segments follow the order of {@code points}.
     */
    public static double area(List<AlignedPoint> points, double[] weights) {
        checkSizes(points, weights);
        double total = 0.0;
        for (int i = 0; i + 1 < weights.length; i++) {
            AlignedPoint a = points.get(i);
            AlignedPoint b = points.get(i + 1);
            double w = (weights[i] + weights[i + 1]) / 2.0;
            double dx = Math.abs(b.wavelength() - a.wavelength());
            double avgAbsDelta = (Math.abs(a.delta()) + Math.abs(b.delta())) / 2.0;
            total += w * dx * avgAbsDelta;
        }
        return total;
    }

    private static boolean allDeltasZero(List<AlignedPoint> points) {
        for (AlignedPoint p : points) {
            if (p.delta() != 0.0) return false;
        }
        return true;
    }

    private static void checkSizes(List<AlignedPoint> points, double[] weights) {
        if (points.size() != weights.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + points.size() + " points vs " + weights.length + " weights");
        }
    }
}
