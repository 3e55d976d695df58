package com.williamcallahan.trivia_image_curator.types;

/**
 * A discovered image whose license has been resolved and accepted.
 *
 * @param pageUrl      Commons file description page
 * @param thumbnailUrl scaled thumbnail suitable for a picker grid
 * @param fullUrl      original-resolution file URL, the one passed to ingestion
 * @param license      license short name as published by Commons (e.g. "CC BY-SA 4.0")
 * @param title        Commons page title
 */
public record ImageCandidate(
    String pageUrl,
    String thumbnailUrl,
    String fullUrl,
    String license,
    String title
) {
}
