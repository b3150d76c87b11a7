package com.govchat.policyscanner.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govchat.policyscanner.model.DocumentStatus;
import com.govchat.policyscanner.model.DocumentType;
import com.govchat.policyscanner.model.PolicyDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcDocumentStore implements DocumentStore {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String COLUMNS = """
            id, source_id, external_id, title, description, content_hash, document_url,
            document_type, municipality, publication_date, effective_date, file_size,
            page_count, language, status, metadata, created_at, updated_at, indexed_at
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void ensureSchema() {
        log.info("Ensuring policy document schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS policy_documents
            (
                id                  VARCHAR(36)   PRIMARY KEY,
                source_id           VARCHAR(100)  NOT NULL,
                external_id         VARCHAR(500)  NOT NULL,
                title               VARCHAR(1000) NOT NULL,
                description         VARCHAR,
                content_hash        VARCHAR(64)   NOT NULL,
                document_url        VARCHAR(2048),
                document_type       VARCHAR(20)   NOT NULL,
                municipality        VARCHAR(255),
                publication_date    DATE,
                effective_date      DATE,
                file_size           BIGINT,
                page_count          INTEGER,
                language            VARCHAR(10)   DEFAULT 'nl' NOT NULL,
                status              VARCHAR(20)   DEFAULT 'pending' NOT NULL,
                metadata            VARCHAR,
                created_at          TIMESTAMP     NOT NULL,
                updated_at          TIMESTAMP     NOT NULL,
                indexed_at          TIMESTAMP,
                CONSTRAINT uq_policy_documents_content_hash UNIQUE (content_hash),
                CONSTRAINT uq_policy_documents_source_external UNIQUE (source_id, external_id)
            )
        """);
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_policy_documents_status ON policy_documents (status)");
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_policy_documents_source ON policy_documents (source_id)");

        log.info("Policy document schema ready.");
    }

    @Override
    public Optional<PolicyDocument> findById(String id) {
        return queryOne("SELECT " + COLUMNS + " FROM policy_documents WHERE id = ?", id);
    }

    @Override
    public List<PolicyDocument> findDocuments(String sourceId, Set<DocumentStatus> statuses, Integer limit) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM policy_documents WHERE 1 = 1");
        List<Object> args = new ArrayList<>();

        if (sourceId != null) {
            sql.append(" AND source_id = ?");
            args.add(sourceId);
        }
        if (statuses != null && !statuses.isEmpty()) {
            sql.append(" AND status IN (");
            sql.append(String.join(", ", statuses.stream().map(s -> "?").toList()));
            sql.append(")");
            statuses.forEach(s -> args.add(s.value()));
        }
        sql.append(" ORDER BY created_at, id");
        if (limit != null) {
            sql.append(" LIMIT ?");
            args.add(limit);
        }
        return jdbcTemplate.query(sql.toString(), rowMapper(), args.toArray());
    }

    @Override
    public Optional<PolicyDocument> findByContentHash(String contentHash) {
        return queryOne("SELECT " + COLUMNS + " FROM policy_documents WHERE content_hash = ?", contentHash);
    }

    @Override
    public Optional<PolicyDocument> findByExternalId(String sourceId, String externalId) {
        return queryOne("SELECT " + COLUMNS + " FROM policy_documents WHERE source_id = ? AND external_id = ?",
                sourceId, externalId);
    }

    @Override
    public PolicyDocument insert(PolicyDocument document) {
        LocalDateTime now = LocalDateTime.now();
        PolicyDocument toStore = document.toBuilder()
                .id(document.getId() != null ? document.getId() : UUID.randomUUID().toString())
                .status(document.getStatus() != null ? document.getStatus() : DocumentStatus.PENDING)
                .language(document.getLanguage() != null ? document.getLanguage() : "nl")
                .metadata(document.getMetadata() != null ? document.getMetadata() : new HashMap<>())
                .createdAt(document.getCreatedAt() != null ? document.getCreatedAt() : now)
                .updatedAt(now)
                .build();

        try {
            jdbcTemplate.update("INSERT INTO policy_documents (" + COLUMNS + ") "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    toStore.getId(),
                    toStore.getSourceId(),
                    toStore.getExternalId(),
                    toStore.getTitle(),
                    toStore.getDescription(),
                    toStore.getContentHash(),
                    toStore.getDocumentUrl(),
                    toStore.getDocumentType() != null ? toStore.getDocumentType().value() : DocumentType.UNKNOWN.value(),
                    toStore.getMunicipality(),
                    toStore.getPublicationDate(),
                    toStore.getEffectiveDate(),
                    toStore.getFileSize(),
                    toStore.getPageCount(),
                    toStore.getLanguage(),
                    toStore.getStatus().value(),
                    toJson(toStore.getMetadata()),
                    Timestamp.valueOf(toStore.getCreatedAt()),
                    Timestamp.valueOf(toStore.getUpdatedAt()),
                    toStore.getIndexedAt() != null ? Timestamp.valueOf(toStore.getIndexedAt()) : null);
        } catch (DuplicateKeyException e) {
            throw new DuplicateDocumentException("Document already stored: source=" + toStore.getSourceId()
                    + ", external_id=" + toStore.getExternalId() + ", hash=" + toStore.getContentHash(), e);
        }
        log.debug("Stored document {} ({})", toStore.getId(), toStore.getTitle());
        return toStore;
    }

    @Override
    public void updateStatus(String id, DocumentStatus status) {
        jdbcTemplate.update("UPDATE policy_documents SET status = ?, updated_at = ? WHERE id = ?",
                status.value(), Timestamp.valueOf(LocalDateTime.now()), id);
    }

    @Override
    public void markFailed(String id, String error) {
        Map<String, Object> metadata = currentMetadata(id);
        metadata.put(PolicyDocument.META_ERROR, error);
        jdbcTemplate.update("UPDATE policy_documents SET status = ?, metadata = ?, updated_at = ? WHERE id = ?",
                DocumentStatus.FAILED.value(), toJson(metadata), Timestamp.valueOf(LocalDateTime.now()), id);
    }

    @Override
    public void markIndexed(String id, LocalDateTime indexedAt, String contentHash, Integer pageCount) {
        Map<String, Object> metadata = currentMetadata(id);
        metadata.remove(PolicyDocument.META_ERROR);
        try {
            if (pageCount != null) {
                jdbcTemplate.update("UPDATE policy_documents SET page_count = ? WHERE id = ?", pageCount, id);
            }
            jdbcTemplate.update("""
                    UPDATE policy_documents
                       SET status = ?, indexed_at = ?, content_hash = ?, metadata = ?, updated_at = ?
                     WHERE id = ?
                    """,
                    DocumentStatus.INDEXED.value(), Timestamp.valueOf(indexedAt), contentHash,
                    toJson(metadata), Timestamp.valueOf(LocalDateTime.now()), id);
        } catch (DuplicateKeyException e) {
            throw new DuplicateDocumentException("Content hash " + contentHash + " already belongs to another document", e);
        }
    }

    @Override
    public void markArchivedDuplicate(String id, String duplicateOfId) {
        Map<String, Object> metadata = currentMetadata(id);
        metadata.put(PolicyDocument.META_DUPLICATE_OF, duplicateOfId);
        jdbcTemplate.update("UPDATE policy_documents SET status = ?, metadata = ?, updated_at = ? WHERE id = ?",
                DocumentStatus.ARCHIVED.value(), toJson(metadata), Timestamp.valueOf(LocalDateTime.now()), id);
    }

    @Override
    public Map<DocumentStatus, Long> countByStatus() {
        Map<DocumentStatus, Long> counts = new EnumMap<>(DocumentStatus.class);
        for (DocumentStatus status : DocumentStatus.values()) {
            counts.put(status, 0L);
        }
        jdbcTemplate.query("SELECT status, COUNT(*) AS cnt FROM policy_documents GROUP BY status", rs -> {
            counts.put(DocumentStatus.fromValue(rs.getString("status")), rs.getLong("cnt"));
        });
        return counts;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<PolicyDocument> queryOne(String sql, Object... args) {
        List<PolicyDocument> rows = jdbcTemplate.query(sql, rowMapper(), args);
        return rows.stream().findFirst();
    }

    private Map<String, Object> currentMetadata(String id) {
        return findById(id)
                .map(doc -> new HashMap<>(doc.getMetadata()))
                .orElseGet(HashMap::new);
    }

    private RowMapper<PolicyDocument> rowMapper() {
        return (rs, rowNum) -> PolicyDocument.builder()
                .id(rs.getString("id"))
                .sourceId(rs.getString("source_id"))
                .externalId(rs.getString("external_id"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .contentHash(rs.getString("content_hash"))
                .documentUrl(rs.getString("document_url"))
                .documentType(DocumentType.fromValue(rs.getString("document_type")))
                .municipality(rs.getString("municipality"))
                .publicationDate(rs.getObject("publication_date", LocalDate.class))
                .effectiveDate(rs.getObject("effective_date", LocalDate.class))
                .fileSize(nullableLong(rs, "file_size"))
                .pageCount(nullableInt(rs, "page_count"))
                .language(rs.getString("language"))
                .status(DocumentStatus.fromValue(rs.getString("status")))
                .metadata(fromJson(rs.getString("metadata")))
                .createdAt(toLocalDateTime(rs.getTimestamp("created_at")))
                .updatedAt(toLocalDateTime(rs.getTimestamp("updated_at")))
                .indexedAt(toLocalDateTime(rs.getTimestamp("indexed_at")))
                .build();
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise document metadata", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new HashMap<>();
        }
        try {
            return new HashMap<>(objectMapper.readValue(json, METADATA_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata JSON, ignoring: {}", e.getMessage());
            return new HashMap<>();
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }
}
