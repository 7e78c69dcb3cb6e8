package com.inflationdata.ipc.service;

import com.inflationdata.ipc.exception.IpcLoadException;
import com.inflationdata.ipc.model.ColumnMetadata;
import com.inflationdata.ipc.model.SeriesKey;
import com.inflationdata.ipc.model.SeriesPoint;
import com.inflationdata.ipc.model.TaxonomyAxis;
import com.inflationdata.ipc.model.WideTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a wide source table into long format: one {@link SeriesPoint} per non-null cell.
 *
 * Column 0 is the period column. Every other column goes through the
 * {@link ColumnMetadataParser}; unparseable columns are skipped with a warning.
 * A period that cannot be parsed fails the whole table, since the row layout
 * can no longer be trusted.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WideTableReshaper {

    private static final Set<String> ABSENT_MARKERS = Set.of("", "na", "nan", "null", "-", "s/d");

    private final ColumnMetadataParser columnParser;

    public List<SeriesPoint> reshape(WideTable table, TaxonomyAxis axis, DataQualityReport quality) {
        Map<Integer, SeriesKey> seriesColumns = resolveColumns(table, axis, quality);

        List<SeriesPoint> points = new ArrayList<>();
        int absent = 0;

        for (String[] row : table.rows()) {
            LocalDate period = parsePeriod(safeGet(row, 0), table.sourceName());

            for (Map.Entry<Integer, SeriesKey> column : seriesColumns.entrySet()) {
                String raw = safeGet(row, column.getKey());
                if (ABSENT_MARKERS.contains(raw.toLowerCase())) {
                    absent++;
                    continue;
                }

                BigDecimal value = parseDecimal(raw);
                if (value == null) {
                    quality.warn(DataQualityReport.WarningType.NON_NUMERIC_CELL, String.format(
                            "%s: '%s' in column %s for %s",
                            table.sourceName(), raw, table.header().get(column.getKey()), period));
                    continue;
                }

                points.add(new SeriesPoint(period, column.getValue(), value));
            }
        }

        log.info("Reshaped {}: {} rows x {} series -> {} points ({} empty cells dropped)",
                table.sourceName(), table.rows().size(), seriesColumns.size(), points.size(), absent);

        return points;
    }

    private Map<Integer, SeriesKey> resolveColumns(WideTable table, TaxonomyAxis axis, DataQualityReport quality) {
        Map<Integer, SeriesKey> columns = new LinkedHashMap<>();

        for (int i = 1; i < table.columnCount(); i++) {
            ColumnMetadata parsed = columnParser.parse(table.header().get(i), axis);

            if (parsed instanceof ColumnMetadata.Parsed p) {
                columns.put(i, p.series());
            } else if (parsed instanceof ColumnMetadata.Unparseable u) {
                quality.warn(DataQualityReport.WarningType.UNPARSEABLE_COLUMN, String.format(
                        "%s: skipping column '%s' (%s)", table.sourceName(), u.columnName(), u.reason()));
            } else {
                log.debug("{}: ignoring metadata column {}", table.sourceName(), table.header().get(i));
            }
        }
        return columns;
    }

    // ── Cell parsing ──────────────────────────────────────────────────────────

    private LocalDate parsePeriod(String raw, String sourceName) {
        try {
            if (raw.length() == 7) {
                return YearMonth.parse(raw).atDay(1);
            }
            // Some exports append a time part: 2024-01-01T00:00:00
            String datePart = raw.length() > 10 ? raw.substring(0, 10) : raw;
            return LocalDate.parse(datePart).withDayOfMonth(1);
        } catch (DateTimeParseException e) {
            throw new IpcLoadException("Malformed period '" + raw + "' in source " + sourceName, e);
        }
    }

    private BigDecimal parseDecimal(String val) {
        try {
            return new BigDecimal(val.replace(',', '.'));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String safeGet(String[] cols, int idx) {
        if (idx >= cols.length || cols[idx] == null) return "";
        return cols[idx].replace("\"", "").trim();
    }
}
