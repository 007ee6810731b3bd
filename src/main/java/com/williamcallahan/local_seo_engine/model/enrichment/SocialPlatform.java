package com.williamcallahan.local_seo_engine.model.enrichment;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Social networks recognized by hostname when scanning enrichment payloads
 */
public enum SocialPlatform {
    FACEBOOK("facebook", List.of("facebook.com", "fb.com")),
    INSTAGRAM("instagram", List.of("instagram.com")),
    LINKEDIN("linkedin", List.of("linkedin.com")),
    X("x", List.of("x.com", "twitter.com")),
    YOUTUBE("youtube", List.of("youtube.com", "youtu.be")),
    TIKTOK("tiktok", List.of("tiktok.com")),
    PINTEREST("pinterest", List.of("pinterest.com"));

    private final String code;
    private final List<String> hosts;

    SocialPlatform(String code, List<String> hosts) {
        this.code = code;
        this.hosts = hosts;
    }

    public String getCode() {
        return code;
    }

    /**
     * Matches a host such as {@code www.facebook.com} or {@code m.facebook.com}
     */
    public static Optional<SocialPlatform> fromHost(String host) {
        if (host == null || host.isBlank()) {
            return Optional.empty();
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        for (SocialPlatform platform : values()) {
            for (String candidate : platform.hosts) {
                if (normalized.equals(candidate) || normalized.endsWith("." + candidate)) {
                    return Optional.of(platform);
                }
            }
        }
        return Optional.empty();
    }
}
