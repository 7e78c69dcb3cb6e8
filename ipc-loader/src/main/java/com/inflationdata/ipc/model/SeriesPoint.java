package com.inflationdata.ipc.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One non-null cell of a wide table after reshaping.
 * The metric kind is decided by the caller, depending on the source.
 */
public record SeriesPoint(LocalDate period, SeriesKey series, BigDecimal value) {
}
