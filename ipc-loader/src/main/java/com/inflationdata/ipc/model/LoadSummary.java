package com.inflationdata.ipc.model;

import java.time.LocalDate;

/**
 * What a caller gets back from a run. Used for operational visibility only.
 */
public record LoadSummary(
        String runId,
        String status,
        LocalDate periodFrom,
        LocalDate periodTo,
        int rowsInserted,
        int rowsUpdated,
        int rowsUnchanged,
        int rowsSkipped,
        int warnings,
        int overlaps,
        String errorMessage) {

    public static final String SUCCESS = "SUCCESS";
    public static final String FAILED = "FAILED";

    public boolean succeeded() {
        return SUCCESS.equals(status);
    }

    public int exitCode() {
        return succeeded() ? 0 : 1;
    }

    public static LoadSummary from(LoadRun run) {
        return new LoadSummary(run.getRunId(), run.getStatus(), run.getPeriodFrom(), run.getPeriodTo(),
                run.getRowsInserted(), run.getRowsUpdated(), run.getRowsUnchanged(), run.getRowsSkipped(),
                run.getWarnings(), run.getOverlaps(), run.getErrorMessage());
    }
}
