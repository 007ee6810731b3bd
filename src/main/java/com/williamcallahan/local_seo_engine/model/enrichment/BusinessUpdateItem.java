package com.williamcallahan.local_seo_engine.model.enrichment;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Google Business Profile post. {@code updateKey} is a hash of text, date and url.
 */
@Builder(toBuilder = true)
public record BusinessUpdateItem(
        String updateKey,
        String postText,
        String url,
        List<String> imageUrls,
        List<UpdateLink> links,
        Instant postDate,
        String rawJson
) {
    public BusinessUpdateItem {
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
        links = links == null ? List.of() : List.copyOf(links);
    }
}
