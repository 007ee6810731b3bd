/**
 * Utility class for locally cached place assets (logos and main photos)
 *
 * @author William Callahan
 */

package com.williamcallahan.local_seo_engine.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Locale;

public final class AssetCacheUtils {

    private static final int MAX_HASH_LENGTH = 32;

    private AssetCacheUtils() {
    }

    /**
     * Extracts an image file extension from a URL string
     *
     * @param url The URL string
     * @return File extension (e.g., .jpg, .png), defaulting to .jpg
     */
    public static String getFileExtensionFromUrl(String url) {
        String extension = ".jpg";
        if (url != null && url.contains(".")) {
            int queryParamIndex = url.indexOf("?");
            String urlWithoutParams = queryParamIndex > 0 ? url.substring(0, queryParamIndex) : url;
            int lastSlash = urlWithoutParams.lastIndexOf('/');
            int lastDotIndex = urlWithoutParams.lastIndexOf(".");
            if (lastDotIndex > lastSlash && lastDotIndex < urlWithoutParams.length() - 1) {
                String ext = urlWithoutParams.substring(lastDotIndex).toLowerCase(Locale.ROOT);
                if (ext.matches("\\.(jpg|jpeg|png|gif|webp|svg|bmp)")) {
                    extension = ext;
                }
            }
        }
        return extension;
    }

    /**
     * Generates a stable filename from a source URL: URL-safe Base64 of its SHA-256, truncated,
     * plus the original image extension
     *
     * @param url The source URL
     * @return Generated filename string
     */
    public static String generateFilenameFromUrl(String url) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(url.getBytes(StandardCharsets.UTF_8));
            String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
            return encoded.substring(0, Math.min(encoded.length(), MAX_HASH_LENGTH)) + getFileExtensionFromUrl(url);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static boolean isRemoteUrl(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
