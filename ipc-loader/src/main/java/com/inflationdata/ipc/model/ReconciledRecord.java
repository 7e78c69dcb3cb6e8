package com.inflationdata.ipc.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;

/**
 * Canonical fact ready for the store: one per (period, region, category, classification).
 *
 * Schema notes:
 *  - incidence and momVariation are independent slots; either may be null
 *  - a null slot means "this run has nothing to say", never "erase the stored value"
 *  - nature is NONE for every category outside the division axis
 */
@Value
@Builder(toBuilder = true)
public class ReconciledRecord {

    public static final Comparator<ReconciledRecord> ORDER = Comparator
            .comparing(ReconciledRecord::getPeriod)
            .thenComparing(ReconciledRecord::seriesKey, SeriesKey.ORDER);

    // ── Key ─────────────────────────────────────────────────────────────────
    LocalDate period;
    String region;
    String categoryName;
    String classification;

    // ── Derived dimension attribute ─────────────────────────────────────────
    @With
    Nature nature;

    // ── Metric slots ────────────────────────────────────────────────────────
    /** Percentage-point contribution to the region's total change */
    BigDecimal incidence;

    /** Percentage change versus the previous month */
    BigDecimal momVariation;

    public SeriesKey seriesKey() {
        return new SeriesKey(region, categoryName, classification);
    }

    public boolean hasAnySlot() {
        return incidence != null || momVariation != null;
    }
}
