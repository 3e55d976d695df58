package com.williamcallahan.trivia_image_curator.service.ingest;

import com.williamcallahan.trivia_image_curator.types.IngestionStage;

/**
 * Download of the chosen source URL failed. Nothing was written.
 */
public class IngestTransportException extends ImageIngestionException {

    private final String sourceUrl;
    private final Integer statusCode;

    public IngestTransportException(String sourceUrl, Integer statusCode, String message, Throwable cause) {
        super(IngestionStage.FETCH, message, cause);
        this.sourceUrl = sourceUrl;
        this.statusCode = statusCode;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    /**
     * Upstream HTTP status, or null when no response was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
