package com.govchat.policyscanner.store;

import com.govchat.policyscanner.model.ScrapeRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

/**
 * One row per source ingest run, for observability.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeRunLog {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS scrape_runs
            (
                run_id              VARCHAR(36)   PRIMARY KEY,
                source_id           VARCHAR(100)  NOT NULL,
                plugin              VARCHAR(100)  NOT NULL,
                started_at          TIMESTAMP     NOT NULL,
                completed_at        TIMESTAMP,
                status              VARCHAR(20)   NOT NULL,
                documents_found     INTEGER       NOT NULL,
                documents_stored    INTEGER       NOT NULL,
                error_message       VARCHAR
            )
        """);
    }

    /** Never throws: a lost run record must not fail the run itself. */
    public void write(ScrapeRun run) {
        try {
            jdbcTemplate.update("""
                INSERT INTO scrape_runs
                (run_id, source_id, plugin, started_at, completed_at,
                 status, documents_found, documents_stored, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                    run.getRunId(),
                    run.getSourceId(),
                    run.getPlugin(),
                    Timestamp.valueOf(run.getStartedAt()),
                    run.getCompletedAt() != null ? Timestamp.valueOf(run.getCompletedAt()) : null,
                    run.getStatus(),
                    run.getDocumentsFound(),
                    run.getDocumentsStored(),
                    run.getErrorMessage());
        } catch (Exception e) {
            log.warn("Failed to write scrape run {}: {}", run.getRunId(), e.getMessage());
        }
    }

    public List<ScrapeRun> findRecent(int limit) {
        return jdbcTemplate.query("""
                SELECT run_id, source_id, plugin, started_at, completed_at, status,
                       documents_found, documents_stored, error_message
                  FROM scrape_runs
                 ORDER BY started_at DESC
                 LIMIT ?
                """,
                (rs, rowNum) -> ScrapeRun.builder()
                        .runId(rs.getString("run_id"))
                        .sourceId(rs.getString("source_id"))
                        .plugin(rs.getString("plugin"))
                        .startedAt(toLocalDateTime(rs.getTimestamp("started_at")))
                        .completedAt(toLocalDateTime(rs.getTimestamp("completed_at")))
                        .status(rs.getString("status"))
                        .documentsFound(rs.getInt("documents_found"))
                        .documentsStored(rs.getInt("documents_stored"))
                        .errorMessage(rs.getString("error_message"))
                        .build(),
                limit);
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }
}
