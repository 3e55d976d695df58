package com.williamcallahan.trivia_image_curator.service.ingest;

import com.williamcallahan.trivia_image_curator.types.IngestionStage;

/**
 * Object upload failed; the metadata record was not touched.
 */
public class StorageWriteException extends ImageIngestionException {

    private final String storagePath;

    public StorageWriteException(String storagePath, String message, Throwable cause) {
        super(IngestionStage.UPLOAD, message, cause);
        this.storagePath = storagePath;
    }

    public String getStoragePath() {
        return storagePath;
    }
}
