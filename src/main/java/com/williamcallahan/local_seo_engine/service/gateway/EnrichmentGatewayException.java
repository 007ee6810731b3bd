package com.williamcallahan.local_seo_engine.service.gateway;

/**
 * HTTP-level failure talking to the enrichment provider. Provider status codes inside a
 * successful HTTP response are not exceptions.
 */
public class EnrichmentGatewayException extends RuntimeException {

    private final boolean transientFailure;

    public EnrichmentGatewayException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * @return true for network errors, timeouts and 5xx responses that may succeed on the next pass
     */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
