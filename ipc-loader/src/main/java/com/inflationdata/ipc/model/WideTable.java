package com.inflationdata.ipc.model;

import java.util.List;

/**
 * A source table as published: one row per period, one column per series.
 * The first header cell names the date column.
 */
public record WideTable(String sourceName, List<String> header, List<String[]> rows) {

    public String dateColumn() {
        return header.get(0);
    }

    public int columnCount() {
        return header.size();
    }
}
