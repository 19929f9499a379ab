package com.prism.documents.repository;

import com.pgvector.PGvector;
import com.prism.documents.model.ChunkCandidate;
import com.prism.documents.model.ChunkEmbedding;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Vectors are stored in a pgvector column but scored in Java, so reads pull
 * every candidate for the user (optionally one document) in a single scan.
 */
@Repository
@RequiredArgsConstructor
public class JdbcDocumentChunkRepository implements DocumentChunkRepository {

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;

    @Override
    public int deleteByDocumentId(UUID documentId) {
        return jdbcClient.sql("DELETE FROM document_chunks WHERE document_id = :docId")
            .param("docId", documentId)
            .update();
    }

    @Override
    @Transactional
    public void insertAll(List<ChunkEmbedding> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return;
        }

        String sql = """
            INSERT INTO document_chunks
            (document_id, user_id, chunk_index, page_number, content, embedding)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                ChunkEmbedding chunk = chunks.get(i);
                ps.setObject(1, chunk.documentId());
                ps.setObject(2, chunk.userId());
                ps.setInt(3, chunk.chunkIndex());
                ps.setInt(4, chunk.pageNumber());
                ps.setString(5, chunk.content());
                ps.setObject(6, new PGvector(chunk.vector()));
            }

            @Override
            public int getBatchSize() {
                return chunks.size();
            }
        });
    }

    @Override
    public List<ChunkCandidate> findCandidates(UUID userId, Optional<UUID> documentId) {
        String sql = """
            SELECT
                c.document_id,
                d.original_name,
                c.page_number,
                c.content,
                c.embedding::text AS embedding
            FROM document_chunks c
            JOIN documents d ON c.document_id = d.id
            WHERE c.user_id = :userId
            """ +
            documentId.map(x -> "  AND c.document_id = :docId\n").orElse("") +
            "ORDER BY c.document_id, c.chunk_index";

        var statement = jdbcClient.sql(sql)
            .param("userId", userId);

        documentId.ifPresent(id -> statement.param("docId", id));

        return statement.query((rs, rowNum) -> new ChunkCandidate(
            rs.getObject("document_id", UUID.class),
            rs.getString("original_name"),
            rs.getInt("page_number"),
            rs.getString("content"),
            parseVector(rs.getString("embedding"))
        )).list();
    }

    private static float[] parseVector(String value) throws SQLException {
        PGvector vector = new PGvector();
        vector.setValue(value);
        return vector.toArray();
    }

    @Override
    public int countByDocumentId(UUID documentId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM document_chunks WHERE document_id = :docId")
            .param("docId", documentId)
            .query(Integer.class)
            .single();
    }
}
