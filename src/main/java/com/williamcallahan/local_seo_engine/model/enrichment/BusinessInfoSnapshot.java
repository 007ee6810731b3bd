package com.williamcallahan.local_seo_engine.model.enrichment;

import lombok.Builder;

import java.util.List;

/**
 * Business profile fields captured from a my_business_info task. Any field may be null
 * and null fields never overwrite stored values.
 */
@Builder(toBuilder = true)
public record BusinessInfoSnapshot(
        String description,
        Integer photoCount,
        String primaryCategory,
        List<String> additionalCategories,
        List<String> placeTopics,
        String logoUrl,
        String mainPhotoUrl
) {
    public BusinessInfoSnapshot {
        additionalCategories = additionalCategories == null ? List.of() : List.copyOf(additionalCategories);
        placeTopics = placeTopics == null ? List.of() : List.copyOf(placeTopics);
    }

    public boolean isEmpty() {
        return description == null
                && photoCount == null
                && primaryCategory == null
                && additionalCategories.isEmpty()
                && placeTopics.isEmpty()
                && logoUrl == null
                && mainPhotoUrl == null;
    }
}
