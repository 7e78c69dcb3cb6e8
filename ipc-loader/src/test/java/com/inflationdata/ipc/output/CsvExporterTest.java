package com.inflationdata.ipc.output;

import com.inflationdata.ipc.config.IpcLoaderProperties;
import com.inflationdata.ipc.model.CategoryNames;
import com.inflationdata.ipc.model.Nature;
import com.inflationdata.ipc.model.ReconciledRecord;
import com.opencsv.CSVReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CsvExporterTest {

    @TempDir
    Path outputDir;

    private IpcLoaderProperties properties;
    private CsvExporter exporter;

    @BeforeEach
    void setUp() {
        properties = new IpcLoaderProperties();
        properties.getOutput().getCsv().setOutputDir(outputDir.toString());
        exporter = new CsvExporter(properties);
    }

    private ReconciledRecord record(LocalDate period, String classification, Nature nature,
                                    String incidence, String variation) {
        return ReconciledRecord.builder()
                .period(period)
                .region("GBA")
                .categoryName(CategoryNames.DIVISION)
                .classification(classification)
                .nature(nature)
                .incidence(incidence == null ? null : new BigDecimal(incidence))
                .momVariation(variation == null ? null : new BigDecimal(variation))
                .build();
    }

    private List<String[]> read(Path file) throws Exception {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            return reader.readAll();
        }
    }

    @Test
    void write_shouldNameFileAfterPeriodRangeAndSortRows() throws Exception {
        List<ReconciledRecord> records = List.of(
                record(LocalDate.of(2024, 3, 1), "Salud", Nature.MIXED, "0.3", null),
                record(LocalDate.of(2024, 2, 1), "Transporte", Nature.MIXED, "1.2", null),
                record(LocalDate.of(2024, 2, 1), "Educación", Nature.SERVICES, null, "4.5"));

        Path file = exporter.write(records);

        assertEquals(outputDir.resolve("ipc_indec_2024-02-01_2024-03-01.csv"), file);
        List<String[]> rows = read(file);
        assertEquals(4, rows.size());
        assertEquals("period", rows.get(0)[0]);
        assertEquals("Educación", rows.get(1)[3]);
        assertEquals("SERVICES", rows.get(1)[4]);
        assertEquals("", rows.get(1)[5]);
        assertEquals("4.5", rows.get(1)[6]);
        assertEquals("2024-03-01", rows.get(3)[0]);
    }

    @Test
    void write_shouldLeaveNatureBlankForAggregates() throws Exception {
        properties.getOutput().getCsv().setIncludeHeader(false);
        ReconciledRecord headline = ReconciledRecord.builder()
                .period(LocalDate.of(2024, 2, 1))
                .region("Nacional")
                .categoryName(CategoryNames.HEADLINE)
                .classification(CategoryNames.HEADLINE_CLASSIFICATION)
                .nature(Nature.NONE)
                .momVariation(new BigDecimal("13.2"))
                .build();

        List<String[]> rows = read(exporter.write(List.of(headline)));

        assertEquals(1, rows.size());
        assertEquals("", rows.get(0)[4]);
    }

    @Test
    void write_shouldSkipEmptyBatch() {
        assertNull(exporter.write(List.of()));
    }
}
