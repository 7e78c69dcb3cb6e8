package com.inflationdata.ipc.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Tracks each load run for observability.
 * Stored in the load_runs table.
 */
@Data
@Builder
public class LoadRun {

    private String runId;           // UUID
    private String trigger;         // INCREMENTAL | FROM_DATE
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED
    private LocalDate periodFrom;
    private LocalDate periodTo;
    private int rowsInserted;
    private int rowsUpdated;
    private int rowsUnchanged;
    private int rowsSkipped;        // dropped before the write, e.g. unknown division
    private int warnings;
    private int overlaps;
    private String errorMessage;    // null on success
}
