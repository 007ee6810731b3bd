package com.williamcallahan.local_seo_engine.model.enrichment;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single Google review as returned by the reviews task. Identity is the provider review id.
 */
@Builder(toBuilder = true)
public record ReviewItem(
        String reviewId,
        String reviewUrl,
        String profileName,
        String profileUrl,
        String profileImageUrl,
        String reviewText,
        String originalReviewText,
        String originalLanguage,
        BigDecimal rating,
        Integer reviewsCount,
        Integer photosCount,
        Boolean localGuide,
        String timeAgo,
        Instant reviewTimestamp,
        String ownerAnswer,
        String originalOwnerAnswer,
        String ownerTimeAgo,
        Instant ownerTimestamp,
        String rawJson
) {
}
