package com.inflationdata.ipc.service;

import com.inflationdata.ipc.exception.IpcLoadException;
import com.inflationdata.ipc.model.SeriesPoint;
import com.inflationdata.ipc.model.TaxonomyAxis;
import com.inflationdata.ipc.model.WideTable;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WideTableReshaperTest {

    private final WideTableReshaper reshaper = new WideTableReshaper(new ColumnMetadataParser());

    private WideTable table(List<String> header, String[]... rows) {
        return new WideTable("test-source", header, List.of(rows));
    }

    @Test
    void reshape_shouldEmitOnePointPerRowAndParseableColumn() {
        WideTable table = table(List.of("indice_tiempo", "salud_gba", "transporte_gba"),
                new String[]{"2024-01-01", "0.31", "1.20"},
                new String[]{"2024-02-01", "0.28", "0.95"});
        DataQualityReport quality = new DataQualityReport();

        List<SeriesPoint> points = reshaper.reshape(table, TaxonomyAxis.DIVISION, quality);

        assertEquals(4, points.size());
        assertEquals(LocalDate.of(2024, 1, 1), points.get(0).period());
        assertEquals("Salud", points.get(0).series().classification());
        assertEquals(0, new BigDecimal("1.20").compareTo(points.get(1).value()));
        assertEquals(0, quality.totalWarnings());
    }

    @Test
    void reshape_shouldDropEmptyCellsWithoutWarning() {
        WideTable table = table(List.of("indice_tiempo", "salud_gba", "transporte_gba"),
                new String[]{"2024-01-01", "", "1.20"},
                new String[]{"2024-02-01", "0.28"});
        DataQualityReport quality = new DataQualityReport();

        List<SeriesPoint> points = reshaper.reshape(table, TaxonomyAxis.DIVISION, quality);

        assertEquals(2, points.size());
        assertEquals(0, quality.totalWarnings());
    }

    @Test
    void reshape_shouldSkipUnparseableColumnAndNonNumericCellWithWarnings() {
        WideTable table = table(List.of("indice_tiempo", "nucleo_gba", "sin_sentido"),
                new String[]{"2024-01-01", "abc", "2.0"},
                new String[]{"2024-02-01", "3.1", "2.0"});
        DataQualityReport quality = new DataQualityReport();

        List<SeriesPoint> points = reshaper.reshape(table, TaxonomyAxis.ANALYTICAL, quality);

        assertEquals(1, points.size());
        assertEquals(1, quality.count(DataQualityReport.WarningType.UNPARSEABLE_COLUMN));
        assertEquals(1, quality.count(DataQualityReport.WarningType.NON_NUMERIC_CELL));
    }

    @Test
    void reshape_shouldNormalisePeriodsToFirstOfMonth() {
        WideTable table = table(List.of("indice_tiempo", "salud_gba"),
                new String[]{"2024-03-15", "1"},
                new String[]{"2024-04", "1"},
                new String[]{"2024-05-01T00:00:00", "1"});

        List<SeriesPoint> points = reshaper.reshape(table, TaxonomyAxis.DIVISION, new DataQualityReport());

        assertEquals(LocalDate.of(2024, 3, 1), points.get(0).period());
        assertEquals(LocalDate.of(2024, 4, 1), points.get(1).period());
        assertEquals(LocalDate.of(2024, 5, 1), points.get(2).period());
    }

    @Test
    void reshape_shouldFailWholeTableOnMalformedPeriod() {
        WideTable table = table(List.of("indice_tiempo", "salud_gba"),
                new String[]{"2024-01-01", "1"},
                new String[]{"enero 2024", "1"});

        IpcLoadException e = assertThrows(IpcLoadException.class,
                () -> reshaper.reshape(table, TaxonomyAxis.DIVISION, new DataQualityReport()));
        assertTrue(e.getMessage().contains("enero 2024"));
    }
}
