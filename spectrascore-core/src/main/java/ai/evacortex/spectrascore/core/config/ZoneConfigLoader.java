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
import ai.evacortex.spectrascore.core.exceptions.InvalidZoneException;
import ai.evacortex.spectrascore.core.exceptions.ZoneConfigurationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes ordered zone lists as JSON:
 * <pre>
 * [ { "min": 550, "max": 1750, "weight": 60, "label": "Oxidation Zone", "key": "range_oxidation" } ]
 * </pre>
 * List order is preserved, since it decides which of two overlapping zones applies.
 */
public final class ZoneConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<ZoneEntry>> ENTRIES = new TypeReference<>() {};

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ZoneEntry(
            @JsonProperty("min") Double min,
            @JsonProperty("max") Double max,
            @JsonProperty("weight") Double weight,
            @JsonProperty("label") String label,
            @JsonProperty("key") String key
    ) {
        static ZoneEntry from(Zone zone) {
            return new ZoneEntry(zone.minWavelength(), zone.maxWavelength(), zone.weightPercent(), zone.label(), zone.key());
        }

        Zone toZone() {
            if (min == null || max == null || weight == null) {
                throw new InvalidZoneException(key, "min, max and weight are required");
            }
            return new Zone(min, max, weight, label, key);
        }
    }

    private ZoneConfigLoader() {}

    public static List<Zone> load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new ZoneConfigurationException("Failed to load zone configuration: " + path, e);
        }
    }

    public static List<Zone> loadResource(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        InputStream in = ZoneConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new ZoneConfigurationException("Zone configuration resource not found: " + resource);
        }
        try (in) {
            return read(in);
        } catch (IOException e) {
            throw new ZoneConfigurationException("Failed to load zone configuration: " + resource, e);
        }
    }

    public static List<Zone> read(InputStream in) throws IOException {
        List<ZoneEntry> entries = MAPPER.readValue(in, ENTRIES);
        if (entries == null) {
            return List.of();
        }
        List<Zone> zones = new ArrayList<>(entries.size());
        for (ZoneEntry entry : entries) {
            zones.add(entry.toZone());
        }
        return List.copyOf(zones);
    }

    public static void write(List<Zone> zones, OutputStream out) throws IOException {
        List<ZoneEntry> entries = new ArrayList<>(zones.size());
        for (Zone zone : zones) {
            entries.add(ZoneEntry.from(zone));
        }
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, entries);
    }
}
