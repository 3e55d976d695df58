package com.williamcallahan.trivia_image_curator.types;

/**
 * Fatal stages of the ingestion pipeline. Watermarking is not listed because
 * it never fails the pipeline.
 */
public enum IngestionStage {
    DECODE,
    FETCH,
    UPLOAD,
    PERSIST
}
