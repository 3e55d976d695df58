package com.williamcallahan.trivia_image_curator.repository;

import com.williamcallahan.trivia_image_curator.types.ArtifactRecord;
import com.williamcallahan.trivia_image_curator.util.JdbcUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL-backed {@link ArtifactRecordStore} over the {@code artifact_records} table.
 */
@Repository
public class JdbcArtifactRecordStore implements ArtifactRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcArtifactRecordStore.class);

    private static final RowMapper<ArtifactRecord> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new ArtifactRecord(
            rs.getString("entity_id"),
            rs.getString("image_url"),
            rs.getString("storage_path"),
            rs.getString("content_type"),
            updatedAt != null ? updatedAt.toInstant() : null
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public JdbcArtifactRecordStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean updateImage(ArtifactRecord record) {
        boolean updated = JdbcUtils.executeUpdate(jdbcTemplate,
            "UPDATE artifact_records SET image_url = ?, storage_path = ?, content_type = ?, updated_at = NOW() " +
            "WHERE entity_id = ?",
            record.publicUrl(),
            record.storagePath(),
            record.contentType(),
            record.entityId()
        );
        if (!updated) {
            logger.debug("No artifact record exists for entity {}", record.entityId());
        }
        return updated;
    }

    @Override
    public void upsertImage(ArtifactRecord record) {
        jdbcTemplate.update(
            "INSERT INTO artifact_records (entity_id, image_url, storage_path, content_type, updated_at) " +
            "VALUES (?, ?, ?, ?, NOW()) " +
            "ON CONFLICT (entity_id) DO UPDATE SET image_url = EXCLUDED.image_url, " +
            "storage_path = EXCLUDED.storage_path, content_type = EXCLUDED.content_type, updated_at = NOW()",
            record.entityId(),
            record.publicUrl(),
            record.storagePath(),
            record.contentType()
        );
    }

    @Override
    public Optional<ArtifactRecord> findByEntityId(String entityId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            "SELECT entity_id, image_url, storage_path, content_type, updated_at FROM artifact_records WHERE entity_id = ?",
            ROW_MAPPER,
            entityId);
    }

    @Override
    public Set<String> findReferencedStoragePaths() {
        return new HashSet<>(jdbcTemplate.queryForList(
            "SELECT storage_path FROM artifact_records WHERE storage_path IS NOT NULL AND image_url <> ''",
            String.class));
    }
}
