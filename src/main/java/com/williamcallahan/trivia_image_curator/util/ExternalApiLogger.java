package com.williamcallahan.trivia_image_curator.util;

import org.slf4j.Logger;

/**
 * Centralized logging for external calls made while curating images:
 * - Wikimedia Commons search and imageinfo lookups
 * - Downloads of the chosen source image
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query) {
        log.info("{} [{}] ATTEMPT: {} for query='{}'", PREFIX, apiName, operation, query);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info("{} [{}] SUCCESS: {} returned {} result(s) for query='{}'",
            PREFIX, apiName, operation, resultCount, query);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for query='{}' - {}", PREFIX, apiName, operation, query, reason);
    }

    /**
     * Log the fan-out summary of a discovery call
     */
    public static void logFanOutComplete(Logger log, String query, int hits, int resolved, int selected) {
        log.info("{} [DISCOVERY] COMPLETE: query='{}', hits={}, resolved={}, selected={}",
            PREFIX, query, hits, resolved, selected);
    }

    /**
     * Log HTTP request details
     */
    public static void logHttpRequest(Logger log, String method, String url) {
        log.debug("{} [HTTP] {} request to: {}", PREFIX, method, url);
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, int statusCode, String url, int bodySize) {
        log.debug("{} [HTTP] Response: status={}, url={}, bodySize={} bytes", PREFIX, statusCode, url, bodySize);
    }
}
