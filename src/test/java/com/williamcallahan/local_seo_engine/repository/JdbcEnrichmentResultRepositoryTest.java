package com.williamcallahan.local_seo_engine.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.local_seo_engine.model.enrichment.BusinessInfoSnapshot;
import com.williamcallahan.local_seo_engine.model.enrichment.ReviewItem;
import com.williamcallahan.local_seo_engine.model.enrichment.SocialPlatform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class JdbcEnrichmentResultRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcEnrichmentResultRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcEnrichmentResultRepository(jdbcTemplate, new ObjectMapper());
    }

    @Test
    void upsertReviews_conflictUpdatesLastSeenButNotFirstSeen() {
        ReviewItem review = ReviewItem.builder().reviewId("r1").reviewText("Great").rating(BigDecimal.valueOf(5)).rawJson("{}").build();
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);

        repository.upsertReviews("P1", "t-1", List.of(review, review.toBuilder().reviewId("r2").build()));

        verify(jdbcTemplate, times(2)).update(sql.capture(), any(Object[].class));
        String conflictClause = sql.getValue().substring(sql.getValue().indexOf("ON CONFLICT"));
        assertThat(conflictClause)
            .startsWith("ON CONFLICT (place_id, review_id) DO UPDATE SET")
            .contains("last_seen_at = NOW()")
            .doesNotContain("first_seen_at");
    }

    @Test
    void upsertReviews_ignoresEmptyInput() {
        assertThat(repository.upsertReviews("P1", "t-1", List.of())).isZero();
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void upsertBusinessInfo_coalescesEveryColumn() {
        BusinessInfoSnapshot snapshot = BusinessInfoSnapshot.builder()
            .description("Bakery")
            .primaryCategory("Bakery")
            .additionalCategories(List.of("Cafe"))
            .build();
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);

        repository.upsertBusinessInfo("P1", snapshot, "/cache/logo.png", null);

        verify(jdbcTemplate).update(sql.capture(), eq("Bakery"), isNull(), eq("Bakery"), eq("[\"Cafe\"]"), isNull(),
            isNull(), eq("/cache/logo.png"), isNull(), isNull(), eq("P1"));
        assertThat(sql.getValue())
            .contains("description = COALESCE(?, description)")
            .contains("logo_local_path = COALESCE(?, logo_local_path)")
            .contains("main_photo_local_path = COALESCE(?, main_photo_local_path)");
    }

    @Test
    void mergeSocialProfiles_insertsNewPlatformsAndTouchesKnownOnes() {
        Map<SocialPlatform, String> profiles = new LinkedHashMap<>();
        profiles.put(SocialPlatform.FACEBOOK, "https://facebook.com/bakery");
        profiles.put(SocialPlatform.INSTAGRAM, "https://instagram.com/bakery");
        // lenient: the UPDATE for a known platform hits the same method with other arguments
        lenient().when(jdbcTemplate.update(startsWith("INSERT INTO place_social_profile"), eq("P1"), eq("facebook"),
            eq("https://facebook.com/bakery"), eq("t-1"))).thenReturn(0);
        lenient().when(jdbcTemplate.update(startsWith("INSERT INTO place_social_profile"), eq("P1"), eq("instagram"),
            eq("https://instagram.com/bakery"), eq("t-1"))).thenReturn(1);

        int inserted = repository.mergeSocialProfiles("P1", "t-1", profiles);

        assertThat(inserted).isEqualTo(1);
        verify(jdbcTemplate).update(startsWith("UPDATE place_social_profile SET last_seen_at"), eq("P1"), eq("facebook"));
        verify(jdbcTemplate, never()).update(startsWith("UPDATE place_social_profile SET last_seen_at"), eq("P1"), eq("instagram"));
    }
}
