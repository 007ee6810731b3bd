package com.williamcallahan.local_seo_engine.repository;

import com.williamcallahan.local_seo_engine.model.enrichment.BusinessInfoSnapshot;
import com.williamcallahan.local_seo_engine.model.enrichment.BusinessUpdateItem;
import com.williamcallahan.local_seo_engine.model.enrichment.QuestionAnswerItem;
import com.williamcallahan.local_seo_engine.model.enrichment.ReviewItem;
import com.williamcallahan.local_seo_engine.model.enrichment.SocialPlatform;

import java.util.Collection;
import java.util.Map;

/**
 * Idempotent writes of materialized enrichment results, keyed by (placeId, natural item key).
 * Re-seen items refresh {@code last_seen_at} and keep {@code first_seen_at}.
 */
public interface EnrichmentResultRepository {

    int upsertReviews(String placeId, String sourceTaskId, Collection<ReviewItem> reviews);

    int upsertUpdates(String placeId, String sourceTaskId, Collection<BusinessUpdateItem> updates);

    int upsertQuestionAnswers(String placeId, String sourceTaskId, Collection<QuestionAnswerItem> pairs);

    /**
     * Overwrites only the non-null fields of the place's profile slice.
     *
     * @param logoLocalPath      resolved local logo path, or null to keep the stored one
     * @param mainPhotoLocalPath resolved local photo path, or null to keep the stored one
     */
    int upsertBusinessInfo(String placeId, BusinessInfoSnapshot snapshot, String logoLocalPath, String mainPhotoLocalPath);

    /**
     * Adds newly discovered platforms. Known platforms keep their URL.
     *
     * @return number of platforms inserted
     */
    int mergeSocialProfiles(String placeId, String sourceTaskId, Map<SocialPlatform, String> profiles);
}
