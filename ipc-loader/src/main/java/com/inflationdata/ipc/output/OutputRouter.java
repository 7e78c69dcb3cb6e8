package com.inflationdata.ipc.output;

import com.inflationdata.ipc.config.IpcLoaderProperties;
import com.inflationdata.ipc.model.LoadRun;
import com.inflationdata.ipc.model.ReconciledRecord;
import com.inflationdata.ipc.model.WriteResult;
import com.inflationdata.ipc.service.IncrementalWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Routes output to the appropriate sink(s) based on configuration.
 * Supports DATABASE, CSV, or BOTH modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final IncrementalWriter incrementalWriter;
    private final ObservationStore store;
    private final CsvExporter csvExporter;
    private final IpcLoaderProperties properties;

    /**
     * Applies the batch to the store when the mode includes DATABASE.
     * The store commits here, before any CSV export is attempted.
     */
    public WriteResult writeStore(List<ReconciledRecord> records) {
        return usesDatabase() ? incrementalWriter.write(records) : WriteResult.EMPTY;
    }

    /**
     * Exports the batch when the mode includes CSV.
     *
     * @return true if a file was written
     */
    public boolean exportCsv(List<ReconciledRecord> records) {
        if (!usesCsv()) return false;
        csvExporter.write(records);
        return true;
    }

    public boolean usesDatabase() {
        return properties.getOutput().getMode() != IpcLoaderProperties.Output.OutputMode.CSV;
    }

    public boolean usesCsv() {
        return properties.getOutput().getMode() != IpcLoaderProperties.Output.OutputMode.DATABASE;
    }

    public Optional<LocalDate> latestLoadedPeriod() {
        return usesDatabase() ? store.findLatestPeriod() : Optional.empty();
    }

    public void ensureSchema() {
        if (usesDatabase()) {
            store.ensureSchema();
        }
    }

    public void writeLoadRun(LoadRun run) {
        try {
            if (usesDatabase()) {
                store.writeLoadRun(run);
            }
        } catch (Exception e) {
            log.warn("Failed to write load run metadata: {}", e.getMessage());
        }
    }
}
