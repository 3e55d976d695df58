package com.williamcallahan.trivia_image_curator.types;

/**
 * Decoded {@code data:<type>/<subtype>;base64,...} payload.
 *
 * @param mimeType  declared MIME type, e.g. {@code image/png}
 * @param extension file extension derived from the MIME subtype
 * @param bytes     decoded binary content
 */
public record InlinePayload(String mimeType, String extension, byte[] bytes) {
}
