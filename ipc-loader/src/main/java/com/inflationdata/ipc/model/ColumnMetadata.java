package com.inflationdata.ipc.model;

/**
 * Result of decoding one wide-table column name.
 */
public sealed interface ColumnMetadata {

    /** A value column mapped to a series */
    record Parsed(SeriesKey series) implements ColumnMetadata {
    }

    /** A known non-series column such as the period column */
    record Metadata(String columnName) implements ColumnMetadata {
    }

    /** Anything the grammar does not recognise */
    record Unparseable(String columnName, String reason) implements ColumnMetadata {
    }
}
