package com.inflationdata.ipc.output;

import com.inflationdata.ipc.model.LoadRun;
import com.inflationdata.ipc.model.Nature;
import com.inflationdata.ipc.model.StoredFact;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Persistence primitives the incremental writer builds its upsert on.
 * Transaction boundaries belong to the caller.
 */
public interface ObservationStore {

    void ensureSchema();

    /** Latest period with at least one fact row */
    Optional<LocalDate> findLatestPeriod();

    /** Id of the region row, created on first sight */
    int getOrCreateRegion(String regionName);

    /**
     * Id of the category row for (categoryName, classification), created on first sight.
     * An existing row only ever has its nature refreshed.
     */
    int getOrCreateCategory(String categoryName, String classification, Nature nature);

    Optional<StoredFact> findFact(LocalDate period, int regionId, int categoryId);

    int insertFact(LocalDate period, int regionId, int categoryId, BigDecimal incidence, BigDecimal momVariation);

    int updateFact(LocalDate period, int regionId, int categoryId, BigDecimal incidence, BigDecimal momVariation);

    void writeLoadRun(LoadRun run);
}
