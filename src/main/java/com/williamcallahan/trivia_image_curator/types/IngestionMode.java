package com.williamcallahan.trivia_image_curator.types;

/**
 * How the artifact bytes reached the ingestor.
 */
public enum IngestionMode {
    URL,
    INLINE,
    REATTACH
}
