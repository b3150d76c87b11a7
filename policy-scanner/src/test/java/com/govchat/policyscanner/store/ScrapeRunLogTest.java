package com.govchat.policyscanner.store;

import com.govchat.policyscanner.model.ScrapeRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ScrapeRunLogTest {

    private ScrapeRunLog runLog;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:runs_" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        runLog = new ScrapeRunLog(new JdbcTemplate(dataSource));
    }

    @Test
    void write_ThenFindRecent_NewestFirst() {
        // Given
        runLog.ensureSchema();
        LocalDateTime start = LocalDateTime.of(2024, 1, 15, 3, 0);
        runLog.write(run("run-1", start, "SUCCESS", null));
        runLog.write(run("run-2", start.plusDays(1), "PARTIAL", "Download failed for x"));

        // When
        List<ScrapeRun> recent = runLog.findRecent(10);

        // Then
        assertEquals(2, recent.size());
        assertEquals("run-2", recent.get(0).getRunId());
        assertEquals("PARTIAL", recent.get(0).getStatus());
        assertEquals("Download failed for x", recent.get(0).getErrorMessage());
        assertEquals(5, recent.get(1).getDocumentsFound());
        assertEquals(start.plusMinutes(2), recent.get(1).getCompletedAt());
    }

    @Test
    void write_WithoutTable_DoesNotThrow() {
        assertDoesNotThrow(() -> runLog.write(run("run-1", LocalDateTime.now(), "FAILED", "boom")));
    }

    private static ScrapeRun run(String id, LocalDateTime startedAt, String status, String error) {
        return ScrapeRun.builder()
                .runId(id)
                .sourceId("gemeenteblad-utrecht")
                .plugin("gemeenteblad")
                .startedAt(startedAt)
                .completedAt(startedAt.plusMinutes(2))
                .status(status)
                .documentsFound(5)
                .documentsStored(4)
                .errorMessage(error)
                .build();
    }
}
