package com.williamcallahan.trivia_image_curator.util;

import java.util.Locale;

/**
 * Object-key helpers so URL and inline ingestion name their objects the same
 * way and the orphan cleanup scans the same prefix.
 */
public final class ArtifactPaths {

    public static final String DEFAULT_PREFIX = "trivia_images";
    public static final String DEFAULT_URL_EXTENSION = "jpg";
    public static final String DEFAULT_INLINE_EXTENSION = "png";

    private ArtifactPaths() {
        // Utility class
    }

    /**
     * Key for an image ingested from a URL: {@code <prefix>/<entityId>.<ext>}.
     * Re-ingesting the same entity overwrites the same key.
     */
    public static String urlObjectKey(String prefix, String entityId, String extension) {
        return ensureTrailingSlash(prefix) + entityId + "." + extension;
    }

    /**
     * Key for an inline upload: {@code <prefix>/<entityId>_upload_<timestamp>.<ext>}.
     */
    public static String inlineObjectKey(String prefix, String entityId, long timestampMillis, String extension) {
        return ensureTrailingSlash(prefix) + entityId + "_upload_" + timestampMillis + "." + extension;
    }

    /**
     * Extension of the last path segment of a URL, query string and fragment removed.
     * Falls back to {@value #DEFAULT_URL_EXTENSION} when the segment has none.
     */
    public static String extensionFromUrl(String url) {
        if (url == null || url.isBlank()) {
            return DEFAULT_URL_EXTENSION;
        }
        String path = url;
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        int schemeEnd = path.indexOf("://");
        if (schemeEnd >= 0) {
            int pathStart = path.indexOf('/', schemeEnd + 3);
            path = pathStart >= 0 ? path.substring(pathStart) : "";
        }
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        int dot = lastSegment.lastIndexOf('.');
        if (dot < 0 || dot == lastSegment.length() - 1) {
            return DEFAULT_URL_EXTENSION;
        }
        return lastSegment.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Subtype portion of a MIME type ({@code image/png -> png}), falling back to
     * {@value #DEFAULT_INLINE_EXTENSION}.
     */
    public static String extensionFromMimeType(String mimeType) {
        if (mimeType == null) {
            return DEFAULT_INLINE_EXTENSION;
        }
        int slash = mimeType.indexOf('/');
        if (slash < 0 || slash == mimeType.length() - 1) {
            return DEFAULT_INLINE_EXTENSION;
        }
        return mimeType.substring(slash + 1);
    }

    /**
     * Ensure a prefix ends with a single trailing slash so callers can safely
     * concatenate object keys afterwards.
     */
    public static String ensureTrailingSlash(String prefix) {
        String base = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix.trim();
        return base.endsWith("/") ? base : base + "/";
    }

    private static int indexOfAny(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }
}
