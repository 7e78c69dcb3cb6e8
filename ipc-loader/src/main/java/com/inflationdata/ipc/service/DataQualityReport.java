package com.inflationdata.ipc.service;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-run tally of recoverable anomalies. Every entry is logged at WARN
 * so skipped data never disappears silently.
 */
@Slf4j
public class DataQualityReport {

    public enum WarningType {
        UNPARSEABLE_COLUMN,
        NON_NUMERIC_CELL,
        UNKNOWN_CLASSIFICATION,
        CONFLICTING_SOURCES
    }

    private final Map<WarningType, Integer> counts = new EnumMap<>(WarningType.class);
    private int overlaps;
    private int skipped;

    public void warn(WarningType type, String detail) {
        counts.merge(type, 1, Integer::sum);
        log.warn("[{}] {}", type, detail);
    }

    /** Expected overlap between sources, resolved by priority. Not a warning. */
    public void overlap() {
        overlaps++;
    }

    /** A reconciled record dropped before the write */
    public void skip() {
        skipped++;
    }

    public int count(WarningType type) {
        return counts.getOrDefault(type, 0);
    }

    public int totalWarnings() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int overlaps() {
        return overlaps;
    }

    public int skipped() {
        return skipped;
    }

    public Map<WarningType, Integer> counts() {
        return Collections.unmodifiableMap(counts);
    }
}
