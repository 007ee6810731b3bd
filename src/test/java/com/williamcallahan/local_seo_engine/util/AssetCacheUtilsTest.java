package com.williamcallahan.local_seo_engine.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AssetCacheUtilsTest {

    @Test
    void getFileExtensionFromUrl_stripsQueryAndDefaultsToJpg() {
        assertThat(AssetCacheUtils.getFileExtensionFromUrl("https://cdn.example.com/logo.PNG?w=200")).isEqualTo(".png");
        assertThat(AssetCacheUtils.getFileExtensionFromUrl("https://lh3.googleusercontent.com/p/AF1Qip")).isEqualTo(".jpg");
        assertThat(AssetCacheUtils.getFileExtensionFromUrl("https://example.com/file.exe")).isEqualTo(".jpg");
    }

    @Test
    void generateFilenameFromUrl_isStableAndFilesystemSafe() {
        String first = AssetCacheUtils.generateFilenameFromUrl("https://cdn.example.com/logo.png");
        String second = AssetCacheUtils.generateFilenameFromUrl("https://cdn.example.com/logo.png");
        String other = AssetCacheUtils.generateFilenameFromUrl("https://cdn.example.com/other.png");

        assertThat(first).isEqualTo(second).isNotEqualTo(other).endsWith(".png").hasSize(36);
        assertThat(first).matches("[A-Za-z0-9_-]+\\.png");
    }

    @Test
    void isRemoteUrl_onlyForHttp() {
        assertThat(AssetCacheUtils.isRemoteUrl(" https://example.com/a.jpg")).isTrue();
        assertThat(AssetCacheUtils.isRemoteUrl("/var/cache/a.jpg")).isFalse();
        assertThat(AssetCacheUtils.isRemoteUrl(null)).isFalse();
    }
}
