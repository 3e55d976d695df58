package com.williamcallahan.trivia_image_curator.controller.dto;

/**
 * Request body for storing a discovered candidate.
 *
 * @param sourceUrl full-resolution URL of the chosen candidate
 */
public record UrlIngestRequest(String sourceUrl) {
}
