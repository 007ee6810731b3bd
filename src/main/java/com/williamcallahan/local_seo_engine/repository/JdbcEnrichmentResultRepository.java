/**
 * Postgres persistence for materialized enrichment results
 *
 * @author William Callahan
 *
 * Features:
 * - ON CONFLICT upserts keyed by (place_id, natural key) for reviews, updates and Q&A
 * - COALESCE updates on the place profile slice so thin responses never blank stored values
 * - Insert-only social profile merge that keeps the first URL seen per platform
 */

package com.williamcallahan.local_seo_engine.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.local_seo_engine.model.enrichment.BusinessInfoSnapshot;
import com.williamcallahan.local_seo_engine.model.enrichment.BusinessUpdateItem;
import com.williamcallahan.local_seo_engine.model.enrichment.QuestionAnswerItem;
import com.williamcallahan.local_seo_engine.model.enrichment.ReviewItem;
import com.williamcallahan.local_seo_engine.model.enrichment.SocialPlatform;
import com.williamcallahan.local_seo_engine.util.JdbcUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;

@Repository
public class JdbcEnrichmentResultRepository implements EnrichmentResultRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEnrichmentResultRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcEnrichmentResultRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public int upsertReviews(String placeId, String sourceTaskId, Collection<ReviewItem> reviews) {
        if (placeId == null || reviews == null || reviews.isEmpty()) {
            return 0;
        }
        int written = 0;
        for (ReviewItem review : reviews) {
            written += jdbcTemplate.update("""
                INSERT INTO place_review (place_id, review_id, review_url, profile_name, profile_url, profile_image_url,
                                          review_text, original_review_text, original_language, rating, reviews_count,
                                          photos_count, local_guide, time_ago, review_timestamp, owner_answer,
                                          original_owner_answer, owner_time_ago, owner_timestamp, raw_json,
                                          source_task_id, first_seen_at, last_seen_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, NOW(), NOW())
                ON CONFLICT (place_id, review_id) DO UPDATE SET
                    review_url = EXCLUDED.review_url,
                    profile_name = EXCLUDED.profile_name,
                    profile_url = EXCLUDED.profile_url,
                    profile_image_url = EXCLUDED.profile_image_url,
                    review_text = EXCLUDED.review_text,
                    original_review_text = EXCLUDED.original_review_text,
                    original_language = EXCLUDED.original_language,
                    rating = EXCLUDED.rating,
                    reviews_count = EXCLUDED.reviews_count,
                    photos_count = EXCLUDED.photos_count,
                    local_guide = EXCLUDED.local_guide,
                    time_ago = EXCLUDED.time_ago,
                    review_timestamp = EXCLUDED.review_timestamp,
                    owner_answer = EXCLUDED.owner_answer,
                    original_owner_answer = EXCLUDED.original_owner_answer,
                    owner_time_ago = EXCLUDED.owner_time_ago,
                    owner_timestamp = EXCLUDED.owner_timestamp,
                    raw_json = EXCLUDED.raw_json,
                    source_task_id = EXCLUDED.source_task_id,
                    last_seen_at = NOW()
                """,
                placeId,
                review.reviewId(),
                review.reviewUrl(),
                review.profileName(),
                review.profileUrl(),
                review.profileImageUrl(),
                review.reviewText(),
                review.originalReviewText(),
                review.originalLanguage(),
                review.rating(),
                review.reviewsCount(),
                review.photosCount(),
                review.localGuide(),
                review.timeAgo(),
                JdbcUtils.toTimestamp(review.reviewTimestamp()),
                review.ownerAnswer(),
                review.originalOwnerAnswer(),
                review.ownerTimeAgo(),
                JdbcUtils.toTimestamp(review.ownerTimestamp()),
                review.rawJson(),
                sourceTaskId);
        }
        return written;
    }

    @Override
    public int upsertUpdates(String placeId, String sourceTaskId, Collection<BusinessUpdateItem> updates) {
        if (placeId == null || updates == null || updates.isEmpty()) {
            return 0;
        }
        int written = 0;
        for (BusinessUpdateItem update : updates) {
            written += jdbcTemplate.update("""
                INSERT INTO place_update (place_id, update_key, post_text, url, image_urls_json, links_json, post_date,
                                          raw_json, source_task_id, first_seen_at, last_seen_at)
                VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?::jsonb, ?, NOW(), NOW())
                ON CONFLICT (place_id, update_key) DO UPDATE SET
                    image_urls_json = EXCLUDED.image_urls_json,
                    links_json = EXCLUDED.links_json,
                    raw_json = EXCLUDED.raw_json,
                    source_task_id = EXCLUDED.source_task_id,
                    last_seen_at = NOW()
                """,
                placeId,
                update.updateKey(),
                update.postText(),
                update.url(),
                toJson(update.imageUrls()),
                toJson(update.links()),
                JdbcUtils.toTimestamp(update.postDate()),
                update.rawJson(),
                sourceTaskId);
        }
        return written;
    }

    @Override
    public int upsertQuestionAnswers(String placeId, String sourceTaskId, Collection<QuestionAnswerItem> pairs) {
        if (placeId == null || pairs == null || pairs.isEmpty()) {
            return 0;
        }
        int written = 0;
        for (QuestionAnswerItem pair : pairs) {
            written += jdbcTemplate.update("""
                INSERT INTO place_question_answer (place_id, qa_key, question_text, question_timestamp,
                                                   question_profile_name, answer_text, answer_timestamp,
                                                   answer_profile_name, raw_json, source_task_id,
                                                   first_seen_at, last_seen_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, NOW(), NOW())
                ON CONFLICT (place_id, qa_key) DO UPDATE SET
                    raw_json = EXCLUDED.raw_json,
                    source_task_id = EXCLUDED.source_task_id,
                    last_seen_at = NOW()
                """,
                placeId,
                pair.qaKey(),
                pair.questionText(),
                JdbcUtils.toTimestamp(pair.questionTimestamp()),
                pair.questionProfileName(),
                pair.answerText(),
                JdbcUtils.toTimestamp(pair.answerTimestamp()),
                pair.answerProfileName(),
                pair.rawJson(),
                sourceTaskId);
        }
        return written;
    }

    @Override
    public int upsertBusinessInfo(String placeId, BusinessInfoSnapshot snapshot, String logoLocalPath, String mainPhotoLocalPath) {
        if (placeId == null || snapshot == null) {
            return 0;
        }
        return jdbcTemplate.update("""
            UPDATE place
            SET description = COALESCE(?, description),
                photo_count = COALESCE(?, photo_count),
                primary_category = COALESCE(?, primary_category),
                other_categories_json = COALESCE(?::jsonb, other_categories_json),
                place_topics_json = COALESCE(?::jsonb, place_topics_json),
                logo_url = COALESCE(?, logo_url),
                logo_local_path = COALESCE(?, logo_local_path),
                main_photo_url = COALESCE(?, main_photo_url),
                main_photo_local_path = COALESCE(?, main_photo_local_path),
                updated_at = NOW()
            WHERE place_id = ?
            """,
            snapshot.description(),
            snapshot.photoCount(),
            snapshot.primaryCategory(),
            snapshot.additionalCategories().isEmpty() ? null : toJson(snapshot.additionalCategories()),
            snapshot.placeTopics().isEmpty() ? null : toJson(snapshot.placeTopics()),
            snapshot.logoUrl(),
            logoLocalPath,
            snapshot.mainPhotoUrl(),
            mainPhotoLocalPath,
            placeId);
    }

    @Override
    public int mergeSocialProfiles(String placeId, String sourceTaskId, Map<SocialPlatform, String> profiles) {
        if (placeId == null || profiles == null || profiles.isEmpty()) {
            return 0;
        }
        int inserted = 0;
        for (Map.Entry<SocialPlatform, String> entry : profiles.entrySet()) {
            boolean added = JdbcUtils.executeUpdate(jdbcTemplate, """
                INSERT INTO place_social_profile (place_id, platform, url, source_task_id, first_seen_at, last_seen_at)
                VALUES (?, ?, ?, ?, NOW(), NOW())
                ON CONFLICT (place_id, platform) DO NOTHING
                """,
                placeId, entry.getKey().getCode(), entry.getValue(), sourceTaskId);
            if (added) {
                inserted++;
            } else {
                jdbcTemplate.update("UPDATE place_social_profile SET last_seen_at = NOW() WHERE place_id = ? AND platform = ?",
                    placeId, entry.getKey().getCode());
            }
        }
        return inserted;
    }

    private String toJson(List<?> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} values to JSON: {}", values == null ? 0 : values.size(), e.getMessage());
            throw new IllegalStateException("Unable to serialize enrichment values", e);
        }
    }
}
