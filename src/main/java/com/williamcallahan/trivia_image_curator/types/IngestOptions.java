package com.williamcallahan.trivia_image_curator.types;

/**
 * Per-call options for inline-payload ingestion. Every call site states
 * whether it wants a watermark; there is no default.
 *
 * @param addWatermark composite the configured watermark onto the image before upload
 */
public record IngestOptions(boolean addWatermark) {

    public static IngestOptions withWatermark() {
        return new IngestOptions(true);
    }

    public static IngestOptions withoutWatermark() {
        return new IngestOptions(false);
    }
}
