package com.williamcallahan.local_seo_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.local_seo_engine.model.enrichment.ReviewItem;
import com.williamcallahan.local_seo_engine.util.JsonNodeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a reviews task_get result to {@link ReviewItem}s, de-duplicated by review id.
 * Items without a review id are skipped. Malformed items are skipped individually.
 */
@Component
public class ReviewResultMapper extends AbstractResultMapper {

    private static final Logger logger = LoggerFactory.getLogger(ReviewResultMapper.class);

    public List<ReviewItem> map(JsonNode task) {
        Map<String, ReviewItem> byId = new LinkedHashMap<>();
        for (JsonNode node : resultItems(task, "items", "reviews")) {
            try {
                ReviewItem review = toReview(node);
                if (review != null) {
                    byId.putIfAbsent(review.reviewId(), review);
                }
            } catch (RuntimeException e) {
                logger.warn("Skipping malformed review item: {}", e.getMessage());
            }
        }
        return new ArrayList<>(byId.values());
    }

    private ReviewItem toReview(JsonNode node) {
        String reviewId = JsonNodeUtils.text(node, "review_id");
        if (reviewId == null) {
            return null;
        }
        JsonNode rating = node.path("rating");
        return ReviewItem.builder()
            .reviewId(reviewId)
            .reviewUrl(JsonNodeUtils.text(node, "review_url"))
            .profileName(JsonNodeUtils.text(node, "profile_name"))
            .profileUrl(JsonNodeUtils.text(node, "profile_url"))
            .profileImageUrl(JsonNodeUtils.text(node, "profile_image_url"))
            .reviewText(JsonNodeUtils.text(node, "review_text"))
            .originalReviewText(JsonNodeUtils.text(node, "original_review_text"))
            .originalLanguage(JsonNodeUtils.text(node, "original_language"))
            .rating(rating.isObject() ? JsonNodeUtils.decimal(rating.path("value")) : JsonNodeUtils.decimal(rating))
            .reviewsCount(JsonNodeUtils.integer(node, "reviews_count"))
            .photosCount(JsonNodeUtils.integer(node, "photos_count"))
            .localGuide(JsonNodeUtils.bool(node, "local_guide"))
            .timeAgo(JsonNodeUtils.text(node, "time_ago"))
            .reviewTimestamp(JsonNodeUtils.instant(node, "timestamp"))
            .ownerAnswer(JsonNodeUtils.text(node, "owner_answer"))
            .originalOwnerAnswer(JsonNodeUtils.text(node, "original_owner_answer"))
            .ownerTimeAgo(JsonNodeUtils.text(node, "owner_time_ago"))
            .ownerTimestamp(JsonNodeUtils.instant(node, "owner_timestamp"))
            .rawJson(node.toString())
            .build();
    }
}
