package com.williamcallahan.local_seo_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.local_seo_engine.model.enrichment.SocialPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Walks an arbitrary result tree collecting social profile URLs.
 * The first URL seen for a platform wins; bare domain links without a profile path are ignored.
 */
@Component
public class SocialProfileExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SocialProfileExtractor.class);
    private static final int MAX_DEPTH = 32;

    public Map<SocialPlatform, String> extract(JsonNode root) {
        Map<SocialPlatform, String> found = new LinkedHashMap<>();
        walk(root, found, 0);
        return found;
    }

    private void walk(JsonNode node, Map<SocialPlatform, String> found, int depth) {
        if (node == null || depth > MAX_DEPTH || found.size() == SocialPlatform.values().length) {
            return;
        }
        if (node.isTextual()) {
            classify(node.asText()).ifPresent(match -> found.putIfAbsent(match.platform(), match.url()));
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                walk(child, found, depth + 1);
            }
        } else if (node.isObject()) {
            Iterator<JsonNode> children = node.elements();
            while (children.hasNext()) {
                walk(children.next(), found, depth + 1);
            }
        }
    }

    Optional<Match> classify(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String candidate = raw.trim();
        String lower = candidate.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(candidate);
            String path = uri.getPath();
            if (path == null || path.isBlank() || "/".equals(path)) {
                return Optional.empty();
            }
            return SocialPlatform.fromHost(uri.getHost()).map(platform -> new Match(platform, candidate));
        } catch (URISyntaxException e) {
            logger.debug("Ignoring unparseable URL candidate '{}': {}", candidate, e.getMessage());
            return Optional.empty();
        }
    }

    record Match(SocialPlatform platform, String url) {
    }
}
