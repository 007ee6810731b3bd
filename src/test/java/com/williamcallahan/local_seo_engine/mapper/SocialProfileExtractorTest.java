package com.williamcallahan.local_seo_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.local_seo_engine.model.enrichment.SocialPlatform;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SocialProfileExtractorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SocialProfileExtractor extractor = new SocialProfileExtractor();

    @Test
    void extract_walksNestedTreeAndKeepsFirstPerPlatform() throws Exception {
        JsonNode result = objectMapper.readTree("""
            [{"items": [{
              "url": "https://bakery.example.com",
              "contacts": [
                {"type": "social", "value": "https://www.facebook.com/bakery"},
                {"type": "social", "value": "https://facebook.com/bakery-old"}
              ],
              "attributes": {"links": {"ig": "https://instagram.com/bakery", "tw": "https://twitter.com/bakery"}},
              "misc": ["https://www.youtube.com/", "not a url", "https://www.tiktok.com/@bakery"]
            }]}]
            """);

        Map<SocialPlatform, String> profiles = extractor.extract(result);

        assertThat(profiles).containsEntry(SocialPlatform.FACEBOOK, "https://www.facebook.com/bakery")
            .containsEntry(SocialPlatform.INSTAGRAM, "https://instagram.com/bakery")
            .containsEntry(SocialPlatform.X, "https://twitter.com/bakery")
            .containsEntry(SocialPlatform.TIKTOK, "https://www.tiktok.com/@bakery")
            .doesNotContainKey(SocialPlatform.YOUTUBE)
            .hasSize(4);
    }

    @Test
    void classify_rejectsLookalikeHosts() {
        assertThat(extractor.classify("https://notfacebook.com/page")).isEmpty();
        assertThat(extractor.classify("https://m.facebook.com/page")).isPresent();
        assertThat(extractor.classify("https://x.com/handle").map(SocialProfileExtractor.Match::platform))
            .contains(SocialPlatform.X);
    }
}
