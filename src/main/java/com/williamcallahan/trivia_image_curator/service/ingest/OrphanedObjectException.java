package com.williamcallahan.trivia_image_curator.service.ingest;

import com.williamcallahan.trivia_image_curator.types.IngestionStage;

/**
 * The object was uploaded but the metadata record could not be updated, so
 * nothing references it. Carries everything needed to retry the record
 * update alone via {@link ImageIngestionService#reattach(OrphanedObjectException)}.
 */
public class OrphanedObjectException extends ImageIngestionException {

    private final String entityId;
    private final String storagePath;
    private final String publicUrl;
    private final String contentType;

    public OrphanedObjectException(String entityId, String storagePath, String publicUrl, String contentType,
                                   String message, Throwable cause) {
        super(IngestionStage.PERSIST, message, cause);
        this.entityId = entityId;
        this.storagePath = storagePath;
        this.publicUrl = publicUrl;
        this.contentType = contentType;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public String getPublicUrl() {
        return publicUrl;
    }

    public String getContentType() {
        return contentType;
    }
}
