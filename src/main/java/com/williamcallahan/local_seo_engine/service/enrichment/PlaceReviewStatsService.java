package com.williamcallahan.local_seo_engine.service.enrichment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Recomputes per-place review velocity figures after new reviews land.
 */
@Service
public class PlaceReviewStatsService {

    private static final Logger logger = LoggerFactory.getLogger(PlaceReviewStatsService.class);

    private final JdbcTemplate jdbcTemplate;

    public PlaceReviewStatsService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Recomputes stats for one place. Failures are logged and reported as false; they never
     * affect the task that triggered them.
     */
    public boolean recompute(String placeId) {
        if (placeId == null || placeId.isBlank()) {
            return false;
        }
        try {
            jdbcTemplate.update("""
                INSERT INTO place_review_stats (place_id, total_reviews, average_rating, reviews_last_90_days,
                                                reviews_last_365_days, latest_review_at, owner_response_rate, computed_at)
                SELECT ?,
                       COUNT(*),
                       ROUND(AVG(rating), 2),
                       COUNT(*) FILTER (WHERE review_timestamp >= NOW() - INTERVAL '90 days'),
                       COUNT(*) FILTER (WHERE review_timestamp >= NOW() - INTERVAL '365 days'),
                       MAX(review_timestamp),
                       CASE WHEN COUNT(*) = 0 THEN NULL
                            ELSE ROUND(COUNT(*) FILTER (WHERE owner_answer IS NOT NULL)::numeric / COUNT(*), 4) END,
                       NOW()
                FROM place_review
                WHERE place_id = ?
                ON CONFLICT (place_id) DO UPDATE SET
                    total_reviews = EXCLUDED.total_reviews,
                    average_rating = EXCLUDED.average_rating,
                    reviews_last_90_days = EXCLUDED.reviews_last_90_days,
                    reviews_last_365_days = EXCLUDED.reviews_last_365_days,
                    latest_review_at = EXCLUDED.latest_review_at,
                    owner_response_rate = EXCLUDED.owner_response_rate,
                    computed_at = EXCLUDED.computed_at
                """, placeId, placeId);
            return true;
        } catch (DataAccessException e) {
            logger.warn("Review stats recompute failed for place {}: {}", placeId, e.getMessage());
            return false;
        }
    }
}
