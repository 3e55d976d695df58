package com.williamcallahan.trivia_image_curator.types;

/**
 * A single file-namespace page returned by the Commons search endpoint.
 * Position in the returned list is the upstream relevance order.
 *
 * @param title page title, e.g. {@code File:Mona Lisa.jpg}
 */
public record SearchHit(String title) {
}
