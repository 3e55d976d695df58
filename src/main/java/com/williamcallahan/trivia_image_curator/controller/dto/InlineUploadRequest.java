package com.williamcallahan.trivia_image_curator.controller.dto;

/**
 * Request body for storing an inline image.
 *
 * @param imageDataUri {@code data:<type>/<subtype>;base64,<data>}
 * @param addWatermark required; null is rejected rather than defaulted
 */
public record InlineUploadRequest(String imageDataUri, Boolean addWatermark) {
}
