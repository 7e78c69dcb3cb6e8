package com.inflationdata.ipc.service;

import com.inflationdata.ipc.model.CanonicalObservation;
import com.inflationdata.ipc.model.MetricKind;
import com.inflationdata.ipc.model.ReconciledRecord;
import com.inflationdata.ipc.model.SeriesKey;
import com.inflationdata.ipc.model.TieBreakPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges observations from every source into one record per (period, series).
 *
 * Each metric slot is resolved on its own: the highest-priority source offering
 * that slot wins, regardless of who won the other slot. Losing an overlap is
 * expected and only counted.
 *
 * Slot rules: the headline never carries an incidence, divisions never carry
 * a month-over-month variation.
 */
@Component
@Slf4j
public class ObservationReconciler {

    private record ObservationKey(LocalDate period, SeriesKey series) {
    }

    private record Candidate(BigDecimal value, int priority, String sourceName, boolean rejected) {
    }

    public List<ReconciledRecord> reconcile(List<CanonicalObservation> observations, TieBreakPolicy tieBreak,
                                            DataQualityReport quality) {
        Map<ObservationKey, Map<MetricKind, Candidate>> slotsByKey = new LinkedHashMap<>();
        int ruledOut = 0;

        for (CanonicalObservation obs : observations) {
            if (!slotAllowed(obs.getMetricKind(), obs.seriesKey())) {
                ruledOut++;
                continue;
            }
            ObservationKey key = new ObservationKey(obs.getPeriod(), obs.seriesKey());
            Map<MetricKind, Candidate> slots = slotsByKey.computeIfAbsent(key, k -> new EnumMap<>(MetricKind.class));
            offer(slots, key, obs, tieBreak, quality);
        }

        List<ReconciledRecord> records = slotsByKey.entrySet().stream()
                .map(e -> toRecord(e.getKey(), e.getValue()))
                .filter(ReconciledRecord::hasAnySlot)
                .sorted(ReconciledRecord.ORDER)
                .toList();

        log.info("Reconciled {} observations into {} records ({} overlaps, {} outside slot rules)",
                observations.size(), records.size(), quality.overlaps(), ruledOut);

        return records;
    }

    static boolean slotAllowed(MetricKind kind, SeriesKey series) {
        return switch (kind) {
            case INCIDENCE -> !series.isHeadline();
            case MOM_VARIATION -> !series.isDivision();
        };
    }

    private void offer(Map<MetricKind, Candidate> slots, ObservationKey key, CanonicalObservation obs,
                       TieBreakPolicy tieBreak, DataQualityReport quality) {
        Candidate incoming = new Candidate(obs.getValue(), obs.getSourcePriority(), obs.getSourceName(), false);
        Candidate current = slots.get(obs.getMetricKind());

        if (current == null) {
            slots.put(obs.getMetricKind(), incoming);
            return;
        }

        quality.overlap();

        if (incoming.priority() > current.priority()) {
            slots.put(obs.getMetricKind(), incoming);
        } else if (incoming.priority() == current.priority()
                && !current.rejected()
                && incoming.value().compareTo(current.value()) != 0) {
            String detail = String.format("%s %s %s: %s=%s vs %s=%s (priority %d)",
                    key.period(), key.series(), obs.getMetricKind(),
                    current.sourceName(), current.value(), incoming.sourceName(), incoming.value(),
                    incoming.priority());

            if (tieBreak == TieBreakPolicy.REJECT) {
                slots.put(obs.getMetricKind(), new Candidate(null, current.priority(), current.sourceName(), true));
                quality.warn(DataQualityReport.WarningType.CONFLICTING_SOURCES, "rejected " + detail);
            } else {
                log.debug("Equal-priority conflict, keeping first: {}", detail);
            }
        }
    }

    private ReconciledRecord toRecord(ObservationKey key, Map<MetricKind, Candidate> slots) {
        return ReconciledRecord.builder()
                .period(key.period())
                .region(key.series().region())
                .categoryName(key.series().categoryName())
                .classification(key.series().classification())
                .incidence(valueOf(slots.get(MetricKind.INCIDENCE)))
                .momVariation(valueOf(slots.get(MetricKind.MOM_VARIATION)))
                .build();
    }

    private BigDecimal valueOf(Candidate candidate) {
        return candidate == null ? null : candidate.value();
    }
}
