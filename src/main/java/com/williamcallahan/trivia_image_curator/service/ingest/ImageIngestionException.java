package com.williamcallahan.trivia_image_curator.service.ingest;

import com.williamcallahan.trivia_image_curator.types.IngestionStage;

/**
 * Fatal failure of an ingest, tagged with the stage that failed.
 */
public class ImageIngestionException extends RuntimeException {

    private final IngestionStage stage;

    public ImageIngestionException(IngestionStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public ImageIngestionException(IngestionStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public IngestionStage getStage() {
        return stage;
    }
}
