package com.williamcallahan.trivia_image_curator.controller.support;

import com.williamcallahan.trivia_image_curator.service.ingest.OrphanedObjectException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small helper for producing consistent error payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, Object> errorBody(String message) {
        return errorBody(message, null);
    }

    public static Map<String, Object> errorBody(String message, String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }

    /**
     * Error body for an uploaded-but-unreferenced object, carrying the fields a reattach call needs.
     */
    public static Map<String, Object> orphanedObjectBody(OrphanedObjectException e) {
        Map<String, Object> body = errorBody("Image stored but metadata record not updated", e.getMessage());
        body.put("entityId", e.getEntityId());
        body.put("storagePath", e.getStoragePath());
        body.put("publicUrl", e.getPublicUrl());
        body.put("contentType", e.getContentType());
        return body;
    }
}
