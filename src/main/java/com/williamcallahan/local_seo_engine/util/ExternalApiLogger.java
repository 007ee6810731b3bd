package com.williamcallahan.local_seo_engine.util;

import org.slf4j.Logger;

/**
 * Centralized logging for DataForSEO calls so every request/outcome shares one greppable format.
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";
    private static final String API_NAME = "DataForSEO";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String operation, String target) {
        log.info("{} [{}] ATTEMPT: {} for '{}'", PREFIX, API_NAME, operation, target);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String operation, String target, Integer statusCode, String statusMessage) {
        log.info("{} [{}] SUCCESS: {} for '{}' returned status {} ({})",
            PREFIX, API_NAME, operation, target, statusCode, statusMessage);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String operation, String target, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for '{}' - {}", PREFIX, API_NAME, operation, target, reason);
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, int statusCode, String url, int bodySize) {
        log.debug("{} [HTTP] Response: status={}, url={}, bodySize={} bytes", PREFIX, statusCode, url, bodySize);
    }
}
