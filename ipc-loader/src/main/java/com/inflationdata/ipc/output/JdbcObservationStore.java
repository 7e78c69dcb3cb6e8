package com.inflationdata.ipc.output;

import com.inflationdata.ipc.model.LoadRun;
import com.inflationdata.ipc.model.Nature;
import com.inflationdata.ipc.model.StoredFact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Star schema over JdbcTemplate: dim_region, dim_category, fact_inflation and load_runs.
 *
 * SQL sticks to what PostgreSQL and H2 (PostgreSQL mode) both accept.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcObservationStore implements ObservationStore {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void ensureSchema() {
        log.info("Ensuring inflation schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS dim_region
            (
                region_id       INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                region_name     VARCHAR(50) NOT NULL UNIQUE
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS dim_category
            (
                category_id     INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                category_name   VARCHAR(100) NOT NULL,
                classification  VARCHAR(100) NOT NULL,
                nature          VARCHAR(20),
                CONSTRAINT uq_category UNIQUE (category_name, classification)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS fact_inflation
            (
                period_date     DATE NOT NULL,
                region_id       INTEGER NOT NULL REFERENCES dim_region (region_id),
                category_id     INTEGER NOT NULL REFERENCES dim_category (category_id),
                incidence       NUMERIC(18, 4),
                mom_variation   NUMERIC(18, 4),
                PRIMARY KEY (period_date, region_id, category_id)
            )
        """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_fact_region ON fact_inflation (region_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_fact_category ON fact_inflation (category_id)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS load_runs
            (
                run_id          VARCHAR(36) PRIMARY KEY,
                run_trigger     VARCHAR(20) NOT NULL,
                started_at      TIMESTAMP NOT NULL,
                completed_at    TIMESTAMP,
                status          VARCHAR(20) NOT NULL,
                period_from     DATE,
                period_to       DATE,
                rows_inserted   INTEGER NOT NULL,
                rows_updated    INTEGER NOT NULL,
                rows_unchanged  INTEGER NOT NULL,
                rows_skipped    INTEGER NOT NULL DEFAULT 0,
                warnings        INTEGER NOT NULL,
                overlaps        INTEGER NOT NULL,
                error_message   VARCHAR(2000)
            )
        """);

        // load_runs created before the skipped counter existed
        jdbcTemplate.execute("ALTER TABLE load_runs ADD COLUMN IF NOT EXISTS rows_skipped INTEGER NOT NULL DEFAULT 0");

        log.info("Inflation schema ready.");
    }

    @Override
    public Optional<LocalDate> findLatestPeriod() {
        LocalDate latest = jdbcTemplate.queryForObject(
                "SELECT MAX(period_date) FROM fact_inflation", LocalDate.class);
        return Optional.ofNullable(latest);
    }

    // ── Dimensions ───────────────────────────────────────────────────────────

    @Override
    public int getOrCreateRegion(String regionName) {
        Optional<Integer> existing = findRegionId(regionName);
        if (existing.isPresent()) return existing.get();

        jdbcTemplate.update("INSERT INTO dim_region (region_name) VALUES (?)", regionName);
        log.info("Created region {}", regionName);
        return findRegionId(regionName)
                .orElseThrow(() -> new IllegalStateException("Region not visible after insert: " + regionName));
    }

    @Override
    public int getOrCreateCategory(String categoryName, String classification, Nature nature) {
        List<CategoryRow> rows = findCategory(categoryName, classification);

        if (rows.isEmpty()) {
            jdbcTemplate.update(
                    "INSERT INTO dim_category (category_name, classification, nature) VALUES (?, ?, ?)",
                    categoryName, classification, nature.storedValue());
            log.info("Created category {} / {} ({})", categoryName, classification, nature);
            return findCategory(categoryName, classification).stream()
                    .findFirst()
                    .map(CategoryRow::id)
                    .orElseThrow(() -> new IllegalStateException(
                            "Category not visible after insert: " + categoryName + " / " + classification));
        }

        CategoryRow row = rows.get(0);
        if (!Objects.equals(row.nature(), nature.storedValue())) {
            jdbcTemplate.update("UPDATE dim_category SET nature = ? WHERE category_id = ?",
                    nature.storedValue(), row.id());
            log.info("Refreshed nature of {} / {}: {} -> {}", categoryName, classification, row.nature(), nature);
        }
        return row.id();
    }

    private Optional<Integer> findRegionId(String regionName) {
        return jdbcTemplate.queryForList(
                "SELECT region_id FROM dim_region WHERE region_name = ?", Integer.class, regionName)
                .stream().findFirst();
    }

    private record CategoryRow(int id, String nature) {
    }

    private List<CategoryRow> findCategory(String categoryName, String classification) {
        return jdbcTemplate.query(
                "SELECT category_id, nature FROM dim_category WHERE category_name = ? AND classification = ?",
                (rs, i) -> new CategoryRow(rs.getInt("category_id"), rs.getString("nature")),
                categoryName, classification);
    }

    // ── Facts ────────────────────────────────────────────────────────────────

    @Override
    public Optional<StoredFact> findFact(LocalDate period, int regionId, int categoryId) {
        return jdbcTemplate.query("""
                SELECT incidence, mom_variation
                FROM fact_inflation
                WHERE period_date = ? AND region_id = ? AND category_id = ?
                """,
                (rs, i) -> new StoredFact(rs.getBigDecimal("incidence"), rs.getBigDecimal("mom_variation")),
                period, regionId, categoryId)
                .stream().findFirst();
    }

    @Override
    public int insertFact(LocalDate period, int regionId, int categoryId,
                          BigDecimal incidence, BigDecimal momVariation) {
        return jdbcTemplate.update("""
                INSERT INTO fact_inflation (period_date, region_id, category_id, incidence, mom_variation)
                VALUES (?, ?, ?, ?, ?)
                """, period, regionId, categoryId, incidence, momVariation);
    }

    @Override
    public int updateFact(LocalDate period, int regionId, int categoryId,
                          BigDecimal incidence, BigDecimal momVariation) {
        return jdbcTemplate.update("""
                UPDATE fact_inflation
                SET incidence = ?, mom_variation = ?
                WHERE period_date = ? AND region_id = ? AND category_id = ?
                """, incidence, momVariation, period, regionId, categoryId);
    }

    // ── Run tracking ─────────────────────────────────────────────────────────

    @Override
    public void writeLoadRun(LoadRun run) {
        jdbcTemplate.update("""
                INSERT INTO load_runs
                (run_id, run_trigger, started_at, completed_at, status, period_from, period_to,
                 rows_inserted, rows_updated, rows_unchanged, rows_skipped, warnings, overlaps, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                run.getRunId(),
                run.getTrigger(),
                timestamp(run.getStartedAt()),
                timestamp(run.getCompletedAt()),
                run.getStatus(),
                run.getPeriodFrom(),
                run.getPeriodTo(),
                run.getRowsInserted(),
                run.getRowsUpdated(),
                run.getRowsUnchanged(),
                run.getRowsSkipped(),
                run.getWarnings(),
                run.getOverlaps(),
                truncate(run.getErrorMessage()));
    }

    private Timestamp timestamp(LocalDateTime value) {
        return value == null ? null : Timestamp.valueOf(value);
    }

    private String truncate(String message) {
        if (message == null || message.length() <= 2000) return message;
        return message.substring(0, 2000);
    }
}
