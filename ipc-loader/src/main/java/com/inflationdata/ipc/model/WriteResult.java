package com.inflationdata.ipc.model;

/**
 * Row counts reported by a sink after applying a batch.
 */
public record WriteResult(int inserted, int updated, int unchanged) {

    public static final WriteResult EMPTY = new WriteResult(0, 0, 0);
}
