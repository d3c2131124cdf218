/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.math;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Sorted view over a wavelength array for tolerance lookups. Input order may be ascending,
 * descending (the usual IR convention) or unordered.
 */
final class WavelengthIndex {

    private final double[] sorted;
    private final int[] positions;

    WavelengthIndex(double[] wavelengths) {
        Integer[] order = IntStream.range(0, wavelengths.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> wavelengths[i]));
        this.sorted = new double[wavelengths.length];
        this.positions = new int[wavelengths.length];
        for (int k = 0; k < order.length; k++) {
            positions[k] = order[k];
            sorted[k] = wavelengths[order[k]];
        }
    }

    /**
     * @return original index of the nearest wavelength within {@code tolerance}, or -1
     */
    int find(double wavelength, double tolerance) {
        if (sorted.length == 0) return -1;
        int k = Arrays.binarySearch(sorted, wavelength);
        if (k >= 0) return positions[k];

        int insertion = -k - 1;
        int best = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int c = insertion - 1; c <= insertion; c++) {
            if (c < 0 || c >= sorted.length) continue;
            double distance = Math.abs(sorted[c] - wavelength);
            if (distance <= tolerance && distance < bestDistance) {
                best = c;
                bestDistance = distance;
            }
        }
        return best < 0 ? -1 : positions[best];
    }
}
