package com.delta.gapreview.collab;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.DocumentNotFoundException;
import com.delta.gapreview.error.DocumentSizeExceededException;
import com.delta.gapreview.error.InvalidRunInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Local document collaborator backed by the {@code documents} table. Edits prepend an improvements
 * block and bump the revision.
 */
@Component
public class JdbcDocumentStore implements DocumentSource, DocumentRewriter {
    private static final Logger log = LoggerFactory.getLogger(JdbcDocumentStore.class);
    static final String IMPROVEMENTS_HEADER = "Improvements:";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ReviewProperties properties;
    private final Clock clock;

    public JdbcDocumentStore(NamedParameterJdbcTemplate jdbcTemplate, ReviewProperties properties, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String fetchSourceText(String documentRef) {
        StoredDocument document = get(documentRef)
            .orElseThrow(() -> new DocumentNotFoundException("document not found: " + documentRef));
        String content = document.content() == null ? "" : document.content();
        int limit = properties.getIngestion().getMaxSourceChars();
        if (content.length() > limit) {
            throw new DocumentSizeExceededException(
                "document " + documentRef + " has " + content.length() + " chars, limit is " + limit
            );
        }
        if (content.isBlank()) {
            throw new DocumentNotFoundException("document is empty: " + documentRef);
        }
        return content;
    }

    @Override
    public DocumentEditResult applyEdits(String documentRef, List<String> insertions) {
        StoredDocument document = get(documentRef)
            .orElseThrow(() -> new DocumentNotFoundException("document not found: " + documentRef));
        List<String> lines = insertions == null
            ? List.of()
            : insertions.stream().filter(s -> s != null && !s.isBlank()).map(String::trim).toList();
        if (lines.isEmpty()) {
            return new DocumentEditResult(documentRef, document.revision(), 0, document.content());
        }
        String updated = formatImprovements(lines) + (document.content() == null ? "" : document.content());
        long revision = document.revision() + 1;
        jdbcTemplate.update(
            """
                UPDATE documents
                SET content = :content,
                    revision = :revision,
                    updated_at = :now
                WHERE document_ref = :ref
                """,
            new MapSqlParameterSource()
                .addValue("content", updated)
                .addValue("revision", revision)
                .addValue("now", Timestamp.from(clock.instant()))
                .addValue("ref", documentRef)
        );
        log.info("Applied {} insertions to document {} (revision {})", lines.size(), documentRef, revision);
        return new DocumentEditResult(documentRef, revision, lines.size(), updated);
    }

    public StoredDocument put(String documentRef, String content) {
        if (documentRef == null || documentRef.isBlank()) {
            throw new InvalidRunInputException("documentRef is required");
        }
        String safeContent = content == null ? "" : content;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ref", documentRef)
            .addValue("content", safeContent)
            .addValue("now", Timestamp.from(clock.instant()));
        String updateSql = """
            UPDATE documents
            SET content = :content,
                revision = revision + 1,
                updated_at = :now
            WHERE document_ref = :ref
            """;
        if (jdbcTemplate.update(updateSql, params) == 0) {
            try {
                jdbcTemplate.update(
                    """
                        INSERT INTO documents (document_ref, content, revision, updated_at)
                        VALUES (:ref, :content, 1, :now)
                        """,
                    params
                );
            } catch (DataIntegrityViolationException e) {
                jdbcTemplate.update(updateSql, params);
            }
        }
        return get(documentRef).orElseThrow(() -> new IllegalStateException("document vanished: " + documentRef));
    }

    public Optional<StoredDocument> get(String documentRef) {
        if (documentRef == null || documentRef.isBlank()) {
            return Optional.empty();
        }
        List<StoredDocument> rows = jdbcTemplate.query(
            "SELECT document_ref, content, revision, updated_at FROM documents WHERE document_ref = :ref",
            new MapSqlParameterSource("ref", documentRef),
            (rs, rowNum) -> new StoredDocument(
                rs.getString("document_ref"),
                rs.getString("content"),
                rs.getLong("revision"),
                rs.getTimestamp("updated_at").toInstant()
            )
        );
        return rows.stream().findFirst();
    }

    static String formatImprovements(List<String> lines) {
        StringBuilder block = new StringBuilder(IMPROVEMENTS_HEADER).append('\n');
        for (String line : lines) {
            block.append("- ").append(line).append('\n');
        }
        return block.append('\n').toString();
    }
}
