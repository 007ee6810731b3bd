package com.williamcallahan.local_seo_engine.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Deterministic identities for result items the provider does not give a stable id.
 * Parts are only trimmed before hashing; text that differs in case or inner spacing is a different item.
 */
public final class NaturalKeyUtils {

    private static final char SEPARATOR = '\u001f';

    private NaturalKeyUtils() {
    }

    /**
     * @param parts ordered identity fields; null and blank are treated the same
     * @return lowercase hex SHA-256 of the trimmed parts
     */
    public static String hashKey(Object... parts) {
        StringBuilder canonical = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                canonical.append(SEPARATOR);
            }
            canonical.append(normalize(parts[i]));
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String normalize(Object part) {
        if (part == null) {
            return "";
        }
        if (part instanceof Instant instant) {
            return instant.toString();
        }
        return part.toString().trim();
    }
}
