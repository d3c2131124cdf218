/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.config;

import ai.evacortex.spectrascore.core.Zone;

import java.util.List;

/**
 * Bundled zone configurations.
 */
public final class ZonePresets {

    public static final String GREASE_DEGRADATION_RESOURCE = "zones/grease-degradation.json";

    private ZonePresets() {}

    /**
     * Lubricating grease monitoring: oxidation region 550–1750 cm⁻¹ dominates (60%), evaporation
     * region 2000–2750 cm⁻¹ at 20%, the remaining regions at 10% each.
     */
    public static List<Zone> greaseDegradation() {
        return ZoneConfigLoader.loadResource(GREASE_DEGRADATION_RESOURCE);
    }

    /**
     * No zones: every wavelength at full weight.
     */
    public static List<Zone> uniform() {
        return List.of();
    }
}
