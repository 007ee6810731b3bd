/**
 * Local disk cache for place logos and main photos
 *
 * @author William Callahan
 *
 * Features:
 * - Stores remote assets under a filename derived from the SHA-256 of the source URL
 * - Skips the download when the hashed file already exists
 * - Last-good-wins: a failed or empty download keeps the previously stored path
 * - Protocol-relative URLs are fetched over https; other non-http(s) sources keep the stored path
 */

package com.williamcallahan.local_seo_engine.service.image;

import com.williamcallahan.local_seo_engine.config.EnrichmentProperties;
import com.williamcallahan.local_seo_engine.util.AssetCacheUtils;
import com.williamcallahan.local_seo_engine.util.ErrorHandlingUtils;
import com.williamcallahan.local_seo_engine.util.ValidationUtils;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

@Service
public class PlaceAssetCacheService {

    private static final Logger logger = LoggerFactory.getLogger(PlaceAssetCacheService.class);

    private final WebClient webClient;
    private final EnrichmentProperties enrichmentProperties;
    private Path cacheDir;

    public PlaceAssetCacheService(WebClient.Builder webClientBuilder, EnrichmentProperties enrichmentProperties) {
        this.webClient = webClientBuilder.build();
        this.enrichmentProperties = enrichmentProperties;
    }

    @PostConstruct
    public void init() {
        cacheDir = Paths.get(enrichmentProperties.getAssetCacheDir());
        try {
            Files.createDirectories(cacheDir);
            logger.info("Place asset cache directory ready at {}", cacheDir.toAbsolutePath());
        } catch (IOException e) {
            logger.error("Could not create place asset cache directory {}: {}", cacheDir, e.getMessage());
        }
    }

    /**
     * Resolves an asset URL to a local path.
     *
     * @param sourceUrl         URL from the latest payload, may be null
     * @param existingLocalPath path already stored for this asset, may be null
     * @return the new local path, or {@code existingLocalPath} when nothing better is available
     */
    public String resolve(String sourceUrl, String existingLocalPath) {
        if (!ValidationUtils.hasText(sourceUrl)) {
            return existingLocalPath;
        }
        String url = sourceUrl.trim();
        if (url.startsWith("//")) {
            url = "https:" + url;
        }
        if (!AssetCacheUtils.isRemoteUrl(url)) {
            logger.debug("Asset source {} is not downloadable; keeping {}", url, existingLocalPath);
            return existingLocalPath;
        }
        if (cacheDir == null) {
            init();
        }
        Path destination = cacheDir.resolve(AssetCacheUtils.generateFilenameFromUrl(url));
        if (Files.exists(destination)) {
            return destination.toString();
        }
        try {
            byte[] bytes = webClient.get()
                .uri(URI.create(url))
                .retrieve()
                .bodyToMono(byte[].class)
                .block(enrichmentProperties.getAssetDownloadTimeout());
            if (bytes == null || bytes.length == 0) {
                logger.warn("Empty asset body from {}; keeping {}", url, existingLocalPath);
                return existingLocalPath;
            }
            Path temp = Files.createTempFile(cacheDir, "asset-", ".part");
            Files.write(temp, bytes);
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.debug("Cached asset {} ({} bytes) at {}", url, bytes.length, destination);
            return destination.toString();
        } catch (IOException e) {
            logger.warn("Failed to write asset for {}: {}; keeping {}", url, e.getMessage(), existingLocalPath);
            return existingLocalPath;
        } catch (RuntimeException e) {
            ErrorHandlingUtils.rethrowIfCancelled(e);
            logger.warn("Failed to download asset {}: {}; keeping {}", url, e.getMessage(), existingLocalPath);
            return existingLocalPath;
        }
    }
}
