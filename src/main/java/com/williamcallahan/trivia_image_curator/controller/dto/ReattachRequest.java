package com.williamcallahan.trivia_image_curator.controller.dto;

/**
 * Request body for pointing a record at an already-uploaded object,
 * typically copied from an orphaned-object error response.
 */
public record ReattachRequest(String storagePath, String publicUrl, String contentType) {
}
