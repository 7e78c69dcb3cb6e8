package com.inflationdata.ipc.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RevisionWindowTest {

    private static final LocalDate INITIAL = LocalDate.of(2023, 12, 1);

    @Test
    void incremental_shouldStartAtInitialDateWhenStoreIsEmpty() {
        RevisionWindow window = RevisionWindow.incremental(Optional.empty(), INITIAL, 2);

        assertEquals(INITIAL, window.start());
    }

    @Test
    void incremental_shouldReprocessLatestAndPreviousMonth() {
        RevisionWindow window = RevisionWindow.incremental(Optional.of(LocalDate.of(2024, 3, 1)), INITIAL, 2);

        assertEquals(LocalDate.of(2024, 2, 1), window.start());
    }

    @Test
    void incremental_shouldCrossYearBoundary() {
        RevisionWindow window = RevisionWindow.incremental(Optional.of(LocalDate.of(2024, 1, 1)), INITIAL, 3);

        assertEquals(LocalDate.of(2023, 11, 1), window.start());
    }

    @Test
    void incremental_shouldNeverReprocessFewerThanTwoMonths() {
        LocalDate latest = LocalDate.of(2024, 5, 1);

        for (int configured : new int[]{-1, 0, 1, 2}) {
            RevisionWindow window = RevisionWindow.incremental(Optional.of(latest), INITIAL, configured);

            assertEquals(LocalDate.of(2024, 4, 1), window.start(), "revisionMonths=" + configured);
            assertTrue(window.contains(LocalDate.of(2024, 4, 1)));
            assertTrue(window.contains(latest));
        }
    }

    @Test
    void from_shouldNormaliseToFirstOfMonthAndStayOpenEnded() {
        RevisionWindow window = RevisionWindow.from(LocalDate.of(2024, 4, 17));

        assertEquals(LocalDate.of(2024, 4, 1), window.start());
        assertFalse(window.contains(LocalDate.of(2024, 3, 1)));
        assertTrue(window.contains(LocalDate.of(2024, 4, 1)));
        assertTrue(window.contains(LocalDate.of(2030, 1, 1)));
    }
}
