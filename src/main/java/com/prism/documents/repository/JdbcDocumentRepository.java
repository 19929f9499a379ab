package com.prism.documents.repository;

import com.prism.documents.model.Document;
import com.prism.documents.model.DocumentMetadata;
import com.prism.documents.model.ExtractionResult;
import com.prism.documents.model.ProcessingStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentRepository implements DocumentRepository {

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<Document> documentRowMapper = (rs, rowNum) -> new Document(
        rs.getObject("id", UUID.class),
        rs.getObject("user_id", UUID.class),
        rs.getString("original_name"),
        rs.getString("storage_path"),
        rs.getLong("file_size"),
        ProcessingStatus.valueOf(rs.getString("status")),
        ProcessingStatus.valueOf(rs.getString("embedding_status")),
        rs.getString("text_content"),
        rs.getInt("page_count"),
        rs.getInt("image_count"),
        rs.getString("module_tag"),
        textArray(rs, "tcodes"),
        textArray(rs, "error_codes"),
        rs.getString("reference_number"),
        rs.getString("processing_error"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    private static List<String> textArray(ResultSet rs, String column) throws SQLException {
        Array array = rs.getArray(column);
        return array == null ? List.of() : List.of((String[]) array.getArray());
    }

    @Override
    public Document save(Document document) {
        return jdbcClient.sql("""
                INSERT INTO documents (user_id, original_name, storage_path, file_size, status, embedding_status)
                VALUES (:userId, :originalName, :storagePath, :fileSize, :status, :embeddingStatus)
                RETURNING *
                """)
            .param("userId", document.userId())
            .param("originalName", document.originalName())
            .param("storagePath", document.storagePath())
            .param("fileSize", document.fileSize())
            .param("status", statusOrPending(document.status()))
            .param("embeddingStatus", statusOrPending(document.embeddingStatus()))
            .query(documentRowMapper)
            .single();
    }

    private static String statusOrPending(ProcessingStatus status) {
        return status != null ? status.name() : ProcessingStatus.PENDING.name();
    }

    @Override
    public Optional<Document> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public Optional<Document> findByIdAndUser(UUID id, UUID userId) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id AND user_id = :userId")
            .param("id", id)
            .param("userId", userId)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public List<Document> listByUser(UUID userId, int limit, int offset) {
        String sql = """
            SELECT * FROM documents
            WHERE user_id = :userId
            ORDER BY created_at DESC, id
            LIMIT :limit OFFSET :offset
            """;

        return jdbcClient.sql(sql)
            .param("userId", userId)
            .param("limit", limit)
            .param("offset", offset)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public long countByUser(UUID userId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM documents WHERE user_id = :userId")
            .param("userId", userId)
            .query(Long.class)
            .single();
    }

    @Override
    public boolean claimForProcessing(UUID id) {
        String sql = """
            UPDATE documents
            SET status = 'PROCESSING',
                processing_error = NULL,
                updated_at = NOW()
            WHERE id = :id
              AND status = 'PENDING'
            """;

        return jdbcClient.sql(sql)
            .param("id", id)
            .update() > 0;
    }

    @Override
    public boolean markFailed(UUID id, String error) {
        String sql = """
            UPDATE documents
            SET status = 'FAILED',
                processing_error = :error,
                updated_at = NOW()
            WHERE id = :id
            """;

        return jdbcClient.sql(sql)
            .param("error", error)
            .param("id", id)
            .update() > 0;
    }

    @Override
    public boolean markCompleted(UUID id, ExtractionResult extraction, int imageCount) {
        String sql = """
            UPDATE documents
            SET status = 'COMPLETED',
                text_content = ?,
                page_count = ?,
                image_count = ?,
                module_tag = ?,
                tcodes = ?,
                error_codes = ?,
                reference_number = ?,
                processing_error = NULL,
                updated_at = NOW()
            WHERE id = ?
            """;

        DocumentMetadata metadata = extraction.metadata();
        int rows = jdbcTemplate.update(sql, ps -> {
            ps.setString(1, extraction.text());
            ps.setInt(2, extraction.pageCount());
            ps.setInt(3, imageCount);
            ps.setString(4, metadata.moduleTag());
            ps.setArray(5, ps.getConnection().createArrayOf("text", metadata.tcodes().toArray()));
            ps.setArray(6, ps.getConnection().createArrayOf("text", metadata.errorCodes().toArray()));
            ps.setString(7, metadata.referenceNumber());
            ps.setObject(8, id);
        });
        return rows > 0;
    }

    @Override
    public boolean updateEmbeddingStatus(UUID id, ProcessingStatus status) {
        String sql = """
            UPDATE documents
            SET embedding_status = :status,
                updated_at = NOW()
            WHERE id = :id
            """;

        return jdbcClient.sql(sql)
            .param("status", status.name())
            .param("id", id)
            .update() > 0;
    }

    @Override
    public boolean resetForReprocess(UUID id, UUID userId) {
        String sql = """
            UPDATE documents
            SET status = 'PENDING',
                embedding_status = 'PENDING',
                processing_error = NULL,
                updated_at = NOW()
            WHERE id = :id
              AND user_id = :userId
              AND status <> 'PROCESSING'
              AND embedding_status <> 'PROCESSING'
            """;

        return jdbcClient.sql(sql)
            .param("id", id)
            .param("userId", userId)
            .update() > 0;
    }

    @Override
    public List<UUID> failStaleProcessing(int staleMinutes, String error) {
        String sql = """
            UPDATE documents
            SET status = 'FAILED',
                processing_error = :error,
                updated_at = NOW()
            WHERE status = 'PROCESSING'
              AND updated_at < NOW() - (INTERVAL '1 minute' * :staleMins)
            RETURNING id
            """;

        return jdbcClient.sql(sql)
            .param("error", error)
            .param("staleMins", staleMinutes)
            .query(UUID.class)
            .list();
    }

    @Override
    public List<UUID> failStaleEmbedding(int staleMinutes) {
        String sql = """
            UPDATE documents
            SET embedding_status = 'FAILED',
                updated_at = NOW()
            WHERE embedding_status = 'PROCESSING'
              AND updated_at < NOW() - (INTERVAL '1 minute' * :staleMins)
            RETURNING id
            """;

        return jdbcClient.sql(sql)
            .param("staleMins", staleMinutes)
            .query(UUID.class)
            .list();
    }

    @Override
    public boolean delete(UUID id, UUID userId) {
        return jdbcClient.sql("DELETE FROM documents WHERE id = :id AND user_id = :userId")
            .param("id", id)
            .param("userId", userId)
            .update() > 0;
    }
}
