package com.prism.documents.repository;

import com.prism.documents.model.PageImage;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcPageImageRepository implements PageImageRepository {

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<PageImage> pageImageMapper = (rs, rowNum) -> new PageImage(
        rs.getObject("id", UUID.class),
        rs.getObject("document_id", UUID.class),
        rs.getInt("page_number"),
        rs.getInt("image_index"),
        rs.getString("storage_path"),
        rs.getInt("width"),
        rs.getInt("height"),
        rs.getString("format"),
        rs.getLong("file_size"),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    @Override
    @Transactional
    public void saveAll(UUID documentId, List<PageImage> images) {
        if (images == null || images.isEmpty()) {
            return;
        }

        String sql = """
            INSERT INTO document_images
            (document_id, page_number, image_index, storage_path, width, height, format, file_size)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                PageImage image = images.get(i);
                ps.setObject(1, documentId);
                ps.setInt(2, image.pageNumber());
                ps.setInt(3, image.imageIndex());
                ps.setString(4, image.storagePath());
                ps.setInt(5, image.width());
                ps.setInt(6, image.height());
                ps.setString(7, image.format());
                ps.setLong(8, image.fileSize());
            }

            @Override
            public int getBatchSize() {
                return images.size();
            }
        });
    }

    @Override
    public List<PageImage> findByDocumentId(UUID documentId) {
        return jdbcClient.sql("SELECT * FROM document_images WHERE document_id = :docId ORDER BY page_number, image_index")
            .param("docId", documentId)
            .query(pageImageMapper)
            .list();
    }

    @Override
    public int deleteByDocumentId(UUID documentId) {
        return jdbcClient.sql("DELETE FROM document_images WHERE document_id = :docId")
            .param("docId", documentId)
            .update();
    }
}
