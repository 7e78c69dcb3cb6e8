package com.inflationdata.ipc.model;

import java.time.LocalDate;
import java.util.Optional;

/**
 * First period a run reprocesses. Open-ended: every later period published upstream is included.
 */
public record RevisionWindow(LocalDate start) {

    /** The latest loaded period and the one before it are always reprocessed */
    public static final int MIN_REVISION_MONTHS = 2;

    public RevisionWindow {
        start = start.withDayOfMonth(1);
    }

    /**
     * Window for an incremental run.
     *
     * @param latestLoaded   latest period already in the store, empty if the store has no facts
     * @param initialStart   where to start when the store is empty
     * @param revisionMonths how many already-loaded periods are always reprocessed (never fewer than {@link #MIN_REVISION_MONTHS})
     */
    public static RevisionWindow incremental(Optional<LocalDate> latestLoaded, LocalDate initialStart,
                                             int revisionMonths) {
        if (latestLoaded.isEmpty()) {
            return new RevisionWindow(initialStart);
        }
        int months = Math.max(revisionMonths, MIN_REVISION_MONTHS);
        return new RevisionWindow(latestLoaded.get().withDayOfMonth(1).minusMonths(months - 1L));
    }

    public static RevisionWindow from(LocalDate explicitStart) {
        return new RevisionWindow(explicitStart);
    }

    public boolean contains(LocalDate period) {
        return !period.isBefore(start);
    }
}
