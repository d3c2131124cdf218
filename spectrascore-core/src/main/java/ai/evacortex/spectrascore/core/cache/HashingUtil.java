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
import ai.evacortex.spectrascore.core.Zone;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * xxHash64 content digests used as cache identity for spectra and zone lists.
 */
public final class HashingUtil {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private HashingUtil() {}

    public static long contentHash(Spectrum spectrum) {
        double[] x = spectrum.wavelengths();
        double[] y = spectrum.absorbances();
        ByteBuffer buffer = ByteBuffer.allocate(8 + (x.length + y.length) * Double.BYTES);
        buffer.putInt(x.length).putInt(y.length);
        for (double v : x) buffer.putDouble(v);
        for (double v : y) buffer.putDouble(v);
        return hash64(buffer.array());
    }

    /**
     * Order-sensitive: the same zones in a different order hash differently, as they may weigh differently.
     */
    public static long zonesHash(List<Zone> zones) {
        ByteBuffer buffer = ByteBuffer.allocate(4 + zones.size() * 3 * Double.BYTES);
        buffer.putInt(zones.size());
        for (Zone zone : zones) {
            buffer.putDouble(zone.minWavelength());
            buffer.putDouble(zone.maxWavelength());
            buffer.putDouble(zone.weightPercent());
        }
        return hash64(buffer.array());
    }

    private static long hash64(byte[] bytes) {
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }
}
