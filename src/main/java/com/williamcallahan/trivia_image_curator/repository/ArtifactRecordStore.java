package com.williamcallahan.trivia_image_curator.repository;

import com.williamcallahan.trivia_image_curator.types.ArtifactRecord;

import java.util.Optional;
import java.util.Set;

/**
 * Metadata store holding, per entity, the URL of its current image.
 *
 * Implementations throw {@link org.springframework.dao.DataAccessException}
 * on store failures; a missing row is reported through return values.
 */
public interface ArtifactRecordStore {

    /**
     * Overwrite the image fields of an existing record.
     *
     * @return false when no record exists for {@code record.entityId()}
     */
    boolean updateImage(ArtifactRecord record);

    /**
     * Create the record if absent, otherwise overwrite its image fields.
     */
    void upsertImage(ArtifactRecord record);

    Optional<ArtifactRecord> findByEntityId(String entityId);

    /**
     * Storage paths currently referenced by any record.
     */
    Set<String> findReferencedStoragePaths();
}
