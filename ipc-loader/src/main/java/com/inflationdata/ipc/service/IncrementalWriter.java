package com.inflationdata.ipc.service;

import com.inflationdata.ipc.exception.IpcLoadException;
import com.inflationdata.ipc.model.Nature;
import com.inflationdata.ipc.model.ReconciledRecord;
import com.inflationdata.ipc.model.StoredFact;
import com.inflationdata.ipc.model.WriteResult;
import com.inflationdata.ipc.output.ObservationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies reconciled records to the store as an idempotent, slot-wise upsert.
 *
 *  - absent key: insert
 *  - present key: each slot the record supplies overwrites the stored one,
 *    a null slot keeps what is stored
 *  - nothing actually changed: no write, counted as unchanged
 *
 * The whole batch, dimensions included, runs in one transaction. Any failure
 * rolls back everything and surfaces as {@link IpcLoadException}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IncrementalWriter {

    private final ObservationStore store;
    private final TransactionOperations transactions;

    private record CategoryKey(String categoryName, String classification) {
    }

    public WriteResult write(List<ReconciledRecord> records) {
        if (records.isEmpty()) return WriteResult.EMPTY;

        log.info("Upserting {} records", records.size());
        WriteResult result;
        try {
            result = transactions.execute(status -> writeAll(records));
        } catch (IpcLoadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IpcLoadException("Batch write failed and was rolled back: " + e.getMessage(), e);
        }

        log.info("Upsert complete: {} inserted, {} updated, {} unchanged",
                result.inserted(), result.updated(), result.unchanged());
        return result;
    }

    private WriteResult writeAll(List<ReconciledRecord> records) {
        Map<String, Integer> regionIds = new HashMap<>();
        Map<CategoryKey, Integer> categoryIds = new HashMap<>();
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;

        for (ReconciledRecord record : records) {
            if (!record.hasAnySlot()) continue;

            try {
                int regionId = regionIds.computeIfAbsent(record.getRegion(), store::getOrCreateRegion);
                int categoryId = categoryIds.computeIfAbsent(
                        new CategoryKey(record.getCategoryName(), record.getClassification()),
                        k -> store.getOrCreateCategory(k.categoryName(), k.classification(), natureOf(record)));

                BigDecimal incidence = scaled(record.getIncidence());
                BigDecimal momVariation = scaled(record.getMomVariation());

                Optional<StoredFact> existing = store.findFact(record.getPeriod(), regionId, categoryId);
                if (existing.isEmpty()) {
                    store.insertFact(record.getPeriod(), regionId, categoryId, incidence, momVariation);
                    inserted++;
                    continue;
                }

                StoredFact stored = existing.get();
                BigDecimal mergedIncidence = incidence != null ? incidence : stored.incidence();
                BigDecimal mergedVariation = momVariation != null ? momVariation : stored.momVariation();

                if (sameValue(mergedIncidence, stored.incidence()) && sameValue(mergedVariation, stored.momVariation())) {
                    unchanged++;
                } else {
                    store.updateFact(record.getPeriod(), regionId, categoryId, mergedIncidence, mergedVariation);
                    updated++;
                }
            } catch (DataAccessException e) {
                throw new IpcLoadException(String.format("Failed writing %s %s: %s",
                        record.getPeriod(), record.seriesKey(), e.getMessage()), e);
            }
        }

        return new WriteResult(inserted, updated, unchanged);
    }

    private Nature natureOf(ReconciledRecord record) {
        return record.getNature() == null ? Nature.NONE : record.getNature();
    }

    // Stored as NUMERIC(18,4): compare at that scale or re-runs would never settle
    private BigDecimal scaled(BigDecimal value) {
        return value == null ? null : value.setScale(MomVariationCalculator.SCALE, RoundingMode.HALF_UP);
    }

    private boolean sameValue(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) return a == b;
        return a.compareTo(b) == 0;
    }
}
