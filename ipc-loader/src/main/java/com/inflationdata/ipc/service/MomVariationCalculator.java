package com.inflationdata.ipc.service;

import com.inflationdata.ipc.model.CanonicalObservation;
import com.inflationdata.ipc.model.MetricKind;
import com.inflationdata.ipc.model.SeriesKey;
import com.inflationdata.ipc.model.SeriesPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Month-over-month percentage change of index series:
 * {@code (value[t] / value[t-1] - 1) * 100}.
 *
 * Must be fed the full history of each series. Filtering to the load window
 * happens afterwards, otherwise the first in-window month would lose its reference.
 */
@Component
@Slf4j
public class MomVariationCalculator {

    /** Matches the NUMERIC(18,4) fact columns */
    public static final int SCALE = 4;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public List<CanonicalObservation> compute(List<SeriesPoint> indexPoints, int priority, String sourceName) {
        Map<SeriesKey, TreeMap<LocalDate, SeriesPoint>> bySeries = new LinkedHashMap<>();
        for (SeriesPoint point : indexPoints) {
            bySeries.computeIfAbsent(point.series(), k -> new TreeMap<>())
                    .putIfAbsent(point.period(), point);
        }

        List<CanonicalObservation> variations = new ArrayList<>();
        int undefined = 0;

        for (TreeMap<LocalDate, SeriesPoint> series : bySeries.values()) {
            SeriesPoint previous = null;
            for (SeriesPoint current : series.values()) {
                BigDecimal variation = variation(previous, current);
                if (variation != null) {
                    variations.add(CanonicalObservation.of(current, MetricKind.MOM_VARIATION, variation,
                            priority, sourceName));
                } else if (previous != null) {
                    undefined++;
                }
                previous = current;
            }
        }

        log.info("{}: {} variations computed over {} series ({} undefined: gap or zero reference)",
                sourceName, variations.size(), bySeries.size(), undefined);

        return variations;
    }

    /**
     * Null when there is no usable reference: first point, a missing previous month, or a zero level.
     */
    BigDecimal variation(SeriesPoint previous, SeriesPoint current) {
        if (previous == null) return null;
        if (!previous.period().plusMonths(1).equals(current.period())) return null;
        if (previous.value().signum() == 0) return null;

        return current.value()
                .divide(previous.value(), MathContext.DECIMAL64)
                .subtract(BigDecimal.ONE)
                .multiply(HUNDRED)
                .setScale(SCALE, RoundingMode.HALF_UP);
    }
}
