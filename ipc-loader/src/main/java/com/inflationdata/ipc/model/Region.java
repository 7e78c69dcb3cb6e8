package com.inflationdata.ipc.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The closed set of regions INDEC publishes the IPC for.
 * One national aggregate plus the six statistical regions.
 */
public enum Region {

    NACIONAL("Nacional", List.of("nacional")),
    GBA("GBA", List.of("gba")),
    PAMPEANA("Pampeana", List.of("pampeana")),
    NOA("NOA", List.of("noa", "noroeste")),
    NEA("NEA", List.of("nea", "noreste")),
    CUYO("Cuyo", List.of("cuyo")),
    PATAGONIA("Patagonia", List.of("patagonia"));

    private final String displayName;
    private final List<String> tokens;

    Region(String displayName, List<String> tokens) {
        this.displayName = displayName;
        this.tokens = tokens;
    }

    /** Name stored in dim_region.region_name */
    public String displayName() {
        return displayName;
    }

    /**
     * Resolve a single lower-case column-name token, e.g. "noroeste" → NOA.
     */
    public static Optional<Region> fromToken(String token) {
        return Arrays.stream(values())
                .filter(r -> r.tokens.contains(token))
                .findFirst();
    }
}
