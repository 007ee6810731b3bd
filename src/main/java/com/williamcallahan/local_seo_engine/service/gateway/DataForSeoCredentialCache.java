package com.williamcallahan.local_seo_engine.service.gateway;

import com.williamcallahan.local_seo_engine.config.DataForSeoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;

/**
 * Holds the encoded Basic credential for DataForSEO and rebuilds it from configuration once expired
 * or after the provider rejects it.
 */
@Component
public class DataForSeoCredentialCache {

    private static final Logger logger = LoggerFactory.getLogger(DataForSeoCredentialCache.class);

    private final DataForSeoProperties properties;
    private final Clock clock;

    private String headerValue;
    private Instant expiresAt;

    public DataForSeoCredentialCache(DataForSeoProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isConfigured() {
        return properties.hasCredentials();
    }

    /**
     * @return the Authorization header value
     * @throws IllegalStateException when credentials are not configured
     */
    public synchronized String getOrRefresh() {
        Instant now = clock.instant();
        if (headerValue != null && expiresAt != null && now.isBefore(expiresAt)) {
            return headerValue;
        }
        if (!properties.hasCredentials()) {
            throw new IllegalStateException("DataForSEO credentials are not configured");
        }
        String raw = properties.getLogin().trim() + ":" + properties.getPassword().trim();
        headerValue = "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
        expiresAt = now.plus(properties.getCredentialTtl());
        logger.debug("Refreshed DataForSEO credential; valid until {}", expiresAt);
        return headerValue;
    }

    public synchronized void invalidate() {
        headerValue = null;
        expiresAt = null;
    }
}
