/*
 * SpectraScore — Spectral Health Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrascore.core.cache;

import ai.evacortex.spectrascore.core.Spectrum;
import ai.evacortex.spectrascore.core.SpectrumTestUtils;
import ai.evacortex.spectrascore.core.Zone;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashingUtilTest {

    @Test
    void contentHash_isDeterministicAndContentSensitive() {
        Spectrum a = SpectrumTestUtils.fourPointBaseline();
        Spectrum b = SpectrumTestUtils.fourPointBaseline();

        assertEquals(HashingUtil.contentHash(a), HashingUtil.contentHash(b),
                "Content hash must be deterministic for identical spectra");
        assertEquals(HashingUtil.contentHash(a), HashingUtil.contentHash(a.withId("renamed")),
                "Content hash covers data, not the id");
        assertNotEquals(HashingUtil.contentHash(a), HashingUtil.contentHash(SpectrumTestUtils.shifted(a, "s", 1e-9)),
                "Hashes must differ for different absorbances");
    }

    @Test
    void zonesHash_isOrderSensitive() {
        Zone first = new Zone(1000, 2000, 60, "A", "a");
        Zone second = new Zone(1500, 2500, 20, "B", "b");

        assertEquals(HashingUtil.zonesHash(List.of(first, second)), HashingUtil.zonesHash(List.of(first, second)));
        assertNotEquals(HashingUtil.zonesHash(List.of(first, second)), HashingUtil.zonesHash(List.of(second, first)));
        assertNotEquals(HashingUtil.zonesHash(List.of()), HashingUtil.zonesHash(List.of(first)));
    }
}
