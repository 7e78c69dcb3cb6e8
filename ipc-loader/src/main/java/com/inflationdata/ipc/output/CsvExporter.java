package com.inflationdata.ipc.output;

import com.inflationdata.ipc.config.IpcLoaderProperties;
import com.inflationdata.ipc.exception.IpcLoadException;
import com.inflationdata.ipc.model.Nature;
import com.inflationdata.ipc.model.ReconciledRecord;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Writes reconciled records in long format to CSV.
 *
 * Output path pattern: {outputDir}/ipc_indec_{from}_{to}.csv
 * e.g. ./output/ipc_indec_2023-12-01_2024-06-01.csv
 *
 * Sorted by period, region, category name and classification, one row per record.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvExporter {

    private final IpcLoaderProperties properties;

    private static final String[] HEADERS = {
            "period", "region", "category_name", "classification", "nature",
            "incidence", "mom_variation"
    };

    public Path write(List<ReconciledRecord> records) {
        if (records.isEmpty()) return null;

        List<ReconciledRecord> sorted = records.stream().sorted(ReconciledRecord.ORDER).toList();

        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        String filename = String.format("ipc_indec_%s_%s.csv",
                sorted.get(0).getPeriod(), sorted.get(sorted.size() - 1).getPeriod());
        Path outputPath = outputDir.resolve(filename);

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (ReconciledRecord r : sorted) {
                writer.writeNext(toRow(r));
            }

            log.info("Written {} records to CSV: {}", sorted.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new IpcLoadException("CSV write failed: " + outputPath, e);
        }
    }

    private String[] toRow(ReconciledRecord r) {
        Nature nature = r.getNature() == null ? Nature.NONE : r.getNature();
        return new String[]{
                str(r.getPeriod()),
                str(r.getRegion()),
                str(r.getCategoryName()),
                str(r.getClassification()),
                str(nature.storedValue()),
                r.getIncidence() == null ? "" : r.getIncidence().toPlainString(),
                r.getMomVariation() == null ? "" : r.getMomVariation().toPlainString()
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IpcLoadException("Cannot create output directory: " + dir, e);
        }
    }
}
