/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.math;

/**
 * Piecewise map from an unbounded non-negative error metric to a 0..100 health score.
 *
 * <pre>
 *     x ≤ t1        → 90 + 10·(1 − x/t1)
 *     t1 &lt; x ≤ t2   → 70 + 20·(1 − (x−t1)/(t2−t1))
 *     t2 &lt; x ≤ t3   → 40 + 30·(1 − (x−t2)/(t3−t2))
 *     x &gt; t3        → 40·e^{−(x−t3)/k}
 * </pre>
 *
 * <p>Band edges line up with the severity tiers: an error at {@code t1} scores exactly 90 and
 * one at {@code t2} exactly 70.</p>
 */
public record HealthMapping(double t1, double t2, double t3, double decay) {

    public static final HealthMapping RMSE = new HealthMapping(0.10, 0.25, 0.50, 0.30);
    public static final HealthMapping AREA = new HealthMapping(50.0, 200.0, 500.0, 300.0);

    public HealthMapping {
        if (!(t1 > 0.0 && t2 > t1 && t3 > t2)) {
            throw new IllegalArgumentException("thresholds must satisfy 0 < t1 < t2 < t3");
        }
        if (!(decay > 0.0) || !Double.isFinite(decay)) {
            throw new IllegalArgumentException("decay must be positive and finite");
        }
    }

    /**
     * @return score in [0, 100], or NaN for a NaN input
     */
    public double apply(double x) {
        if (Double.isNaN(x)) return Double.NaN;
        double e = Math.max(0.0, x);

        if (e <= t1) {
            return 90.0 + 10.0 * (1.0 - e / t1);
        } else if (e <= t2) {
            return 70.0 + 20.0 * (1.0 - (e - t1) / (t2 - t1));
        } else if (e <= t3) {
            return 40.0 + 30.0 * (1.0 - (e - t2) / (t3 - t2));
        }
        return Math.max(0.0, Math.min(40.0, 40.0 * Math.exp(-(e - t3) / decay)));
    }
}
