package com.williamcallahan.local_seo_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.local_seo_engine.model.enrichment.BusinessUpdateItem;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BusinessUpdateResultMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final BusinessUpdateResultMapper mapper = new BusinessUpdateResultMapper();

    @Test
    void map_readsPostsWithImagesAndLinks() throws Exception {
        JsonNode task = objectMapper.readTree("""
            {"result": [{"items": [{
              "post_text": "Spring menu is here",
              "post_date": "2024-04-01 09:30:00 +00:00",
              "url": "https://maps.google.com/post/1",
              "images_url": ["https://img.example.com/1.jpg"],
              "links": [{"type": "button", "title": "Order", "url": "https://order.example.com"}, {"title": "no url"}]
            }]}]}
            """);

        List<BusinessUpdateItem> updates = mapper.map(task);

        assertThat(updates).hasSize(1);
        BusinessUpdateItem update = updates.get(0);
        assertThat(update.postText()).isEqualTo("Spring menu is here");
        assertThat(update.postDate()).isEqualTo(Instant.parse("2024-04-01T09:30:00Z"));
        assertThat(update.imageUrls()).containsExactly("https://img.example.com/1.jpg");
        assertThat(update.links()).hasSize(1);
        assertThat(update.links().get(0).title()).isEqualTo("Order");
        assertThat(update.updateKey()).hasSize(64);
    }

    @Test
    void map_keyIgnoresProviderMetadata() throws Exception {
        JsonNode first = objectMapper.readTree("""
            {"result": [{"items": [{"post_text": "Closed Monday", "post_date": "2024-04-01 09:30:00 +00:00",
              "url": "https://maps.google.com/post/2", "rank_absolute": 1, "xpath": "/a/b"}]}]}
            """);
        JsonNode second = objectMapper.readTree("""
            {"result": [{"items": [{"snippet": "Closed Monday", "timestamp": "2024-04-01T09:30:00Z",
              "post_url": "https://maps.google.com/post/2", "rank_absolute": 7, "post_id": "abc"}]}]}
            """);

        assertThat(mapper.map(first).get(0).updateKey()).isEqualTo(mapper.map(second).get(0).updateKey());
    }

    @Test
    void map_skipsEmptyItems() throws Exception {
        JsonNode task = objectMapper.readTree("{\"result\": [{\"items\": [{\"type\": \"google_business_post\"}]}]}");

        assertThat(mapper.map(task)).isEmpty();
    }
}
