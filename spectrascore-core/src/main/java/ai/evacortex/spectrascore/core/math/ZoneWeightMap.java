/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.math;

import ai.evacortex.spectrascore.core.Zone;

import java.util.List;
import java.util.Objects;

/**
 * Resolves the importance multiplier of a wavelength from an ordered zone list.
 *
 * <p>The first zone containing the wavelength wins, so overlapping zones depend on list order.
 * A wavelength outside every zone has full weight 1.0.</p>
 */
public final class ZoneWeightMap {

    public static final double UNCONFIGURED_WEIGHT = 1.0;

    private final List<Zone> zones;

    private ZoneWeightMap(List<Zone> zones) {
        this.zones = zones;
    }

    public static ZoneWeightMap of(List<Zone> zones) {
        Objects.requireNonNull(zones, "zones must not be null");
        return new ZoneWeightMap(List.copyOf(zones));
    }

    public static double weightFor(double wavelength, List<Zone> zones) {
        if (zones == null) return UNCONFIGURED_WEIGHT;
        for (Zone zone : zones) {
            if (zone.contains(wavelength)) {
                return zone.weightFactor();
            }
        }
        return UNCONFIGURED_WEIGHT;
    }

    public double weightFor(double wavelength) {
        return weightFor(wavelength, zones);
    }

    public List<Zone> zones() {
        return zones;
    }
}
