package com.inflationdata.ipc.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A single normalised value for one (period, series, metric) coming from one source.
 * Several observations may share a key and differ only by metric kind or source.
 */
@Value
@Builder
public class CanonicalObservation {

    /** Always the first day of the month */
    LocalDate period;

    String region;
    String categoryName;
    String classification;

    MetricKind metricKind;
    BigDecimal value;

    /** Higher wins during reconciliation */
    int sourcePriority;

    /** Configured source name, for logging only */
    String sourceName;

    public SeriesKey seriesKey() {
        return new SeriesKey(region, categoryName, classification);
    }

    public static CanonicalObservation of(SeriesPoint point, MetricKind kind, BigDecimal value,
                                          int priority, String sourceName) {
        return CanonicalObservation.builder()
                .period(point.period())
                .region(point.series().region())
                .categoryName(point.series().categoryName())
                .classification(point.series().classification())
                .metricKind(kind)
                .value(value)
                .sourcePriority(priority)
                .sourceName(sourceName)
                .build();
    }
}
