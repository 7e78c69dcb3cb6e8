package com.inflationdata.ipc.service;

import com.inflationdata.ipc.config.IpcLoaderProperties;
import com.inflationdata.ipc.exception.IpcLoadException;
import com.inflationdata.ipc.exception.UnknownClassificationException;
import com.inflationdata.ipc.model.CanonicalObservation;
import com.inflationdata.ipc.model.LoadRun;
import com.inflationdata.ipc.model.LoadSummary;
import com.inflationdata.ipc.model.MetricKind;
import com.inflationdata.ipc.model.ReconciledRecord;
import com.inflationdata.ipc.model.RevisionWindow;
import com.inflationdata.ipc.model.SeriesPoint;
import com.inflationdata.ipc.model.WideTable;
import com.inflationdata.ipc.model.WriteResult;
import com.inflationdata.ipc.output.OutputRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Orchestrates one load run:
 *
 *   fetch every source → reshape → (index sources) compute variations over full history
 *   → keep the revision window → reconcile → derive nature → write
 *
 * Runs are strictly sequential. Structural failures end the run as FAILED with
 * nothing committed; recoverable anomalies only show up as warnings in the summary.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InflationLoadService {

    public static final String TRIGGER_INCREMENTAL = "INCREMENTAL";
    public static final String TRIGGER_FROM_DATE = "FROM_DATE";

    private final IpcSourceClient sourceClient;
    private final WideTableReshaper reshaper;
    private final MomVariationCalculator variationCalculator;
    private final ObservationReconciler reconciler;
    private final NatureDeriver natureDeriver;
    private final OutputRouter outputRouter;
    private final IpcLoaderProperties properties;

    private final AtomicReference<LoadSummary> lastSummary = new AtomicReference<>();

    /**
     * Reprocess from the revision window implied by the latest period already stored.
     */
    public LoadSummary runIncremental() {
        return run(TRIGGER_INCREMENTAL, () -> RevisionWindow.incremental(
                outputRouter.latestLoadedPeriod(),
                properties.getLoad().getInitialStartDate(),
                properties.getLoad().getRevisionMonths()));
    }

    /**
     * Reprocess every period from {@code start} onwards, whatever the store holds.
     */
    public LoadSummary runFrom(LocalDate start) {
        return run(TRIGGER_FROM_DATE, () -> RevisionWindow.from(start));
    }

    public Optional<LoadSummary> lastSummary() {
        return Optional.ofNullable(lastSummary.get());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private synchronized LoadSummary run(String trigger, Supplier<RevisionWindow> windowSupplier) {
        LoadRun run = LoadRun.builder()
                .runId(UUID.randomUUID().toString())
                .trigger(trigger)
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();

        DataQualityReport quality = new DataQualityReport();

        try {
            RevisionWindow window = windowSupplier.get();
            log.info("Load run {} ({}): reprocessing periods from {}", run.getRunId(), trigger, window.start());

            List<CanonicalObservation> observations = collect(window, quality);
            List<ReconciledRecord> records = withNature(
                    reconciler.reconcile(observations, properties.getLoad().getTieBreak(), quality), quality);

            run.setPeriodFrom(records.isEmpty() ? window.start() : records.get(0).getPeriod());
            run.setPeriodTo(records.isEmpty() ? null : records.get(records.size() - 1).getPeriod());

            if (records.isEmpty()) {
                log.info("No data published from {} onwards, nothing to write", window.start());
            } else {
                // The store has committed once writeStore returns: its counts are recorded before the export
                recordCounts(run, outputRouter.writeStore(records));
                if (outputRouter.exportCsv(records) && !outputRouter.usesDatabase()) {
                    recordCounts(run, new WriteResult(records.size(), 0, 0));
                }
            }

            run.setStatus(LoadSummary.SUCCESS);

        } catch (Exception e) {
            log.error("Load run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus(LoadSummary.FAILED);
            run.setErrorMessage(e.getMessage());
        } finally {
            run.setWarnings(quality.totalWarnings());
            run.setOverlaps(quality.overlaps());
            run.setRowsSkipped(quality.skipped());
            run.setCompletedAt(LocalDateTime.now());
            outputRouter.writeLoadRun(run);
        }

        LoadSummary summary = LoadSummary.from(run);
        lastSummary.set(summary);

        log.info("Load run {} {}: periods {} to {}, {} inserted, {} updated, {} unchanged, {} skipped, {} warnings {}",
                summary.runId(), summary.status(), summary.periodFrom(), summary.periodTo(),
                summary.rowsInserted(), summary.rowsUpdated(), summary.rowsUnchanged(),
                summary.rowsSkipped(), summary.warnings(), quality.counts());
        return summary;
    }

    private void recordCounts(LoadRun run, WriteResult result) {
        run.setRowsInserted(result.inserted());
        run.setRowsUpdated(result.updated());
        run.setRowsUnchanged(result.unchanged());
    }

    private List<CanonicalObservation> collect(RevisionWindow window, DataQualityReport quality) {
        List<IpcLoaderProperties.Source> sources = properties.enabledSources();
        if (sources.isEmpty()) {
            throw new IpcLoadException("No enabled sources configured under ipc-loader.sources");
        }

        List<CanonicalObservation> inWindow = new ArrayList<>();

        for (IpcLoaderProperties.Source source : sources) {
            WideTable table = sourceClient.fetch(source);
            List<SeriesPoint> points = reshaper.reshape(table, source.getAxis(), quality);

            List<CanonicalObservation> observations = switch (source.getMetric()) {
                case INCIDENCE -> direct(points, MetricKind.INCIDENCE, source);
                case MOM_VARIATION -> direct(points, MetricKind.MOM_VARIATION, source);
                // Full history in, window applied afterwards
                case INDEX -> variationCalculator.compute(points, source.getPriority(), source.getName());
            };

            int before = inWindow.size();
            observations.stream()
                    .filter(o -> window.contains(o.getPeriod()))
                    .forEach(inWindow::add);

            log.info("{}: {} observations, {} inside the window", source.getName(),
                    observations.size(), inWindow.size() - before);
        }

        return inWindow;
    }

    private List<CanonicalObservation> direct(List<SeriesPoint> points, MetricKind kind,
                                              IpcLoaderProperties.Source source) {
        return points.stream()
                .map(p -> CanonicalObservation.of(p, kind, p.value(), source.getPriority(), source.getName()))
                .toList();
    }

    /**
     * Attach the nature tag. Records whose division is missing from the nature table are
     * skipped: each one is counted, the warning is logged once per classification.
     */
    private List<ReconciledRecord> withNature(List<ReconciledRecord> records, DataQualityReport quality) {
        List<ReconciledRecord> classified = new ArrayList<>(records.size());
        Set<String> reported = new HashSet<>();

        for (ReconciledRecord record : records) {
            try {
                classified.add(record.withNature(
                        natureDeriver.derive(record.getCategoryName(), record.getClassification())));
            } catch (UnknownClassificationException e) {
                quality.skip();
                if (reported.add(e.getClassification())) {
                    quality.warn(DataQualityReport.WarningType.UNKNOWN_CLASSIFICATION,
                            e.getMessage() + ": records skipped until the nature table lists it");
                }
            }
        }
        return classified;
    }
}
