package com.williamcallahan.local_seo_engine.service.enrichment;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlaceReviewStatsServiceTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private PlaceReviewStatsService service;

    @BeforeEach
    void setUp() {
        service = new PlaceReviewStatsService(jdbcTemplate);
    }

    @Test
    void recompute_upsertsStatsRow() {
        when(jdbcTemplate.update(anyString(), eq("P1"), eq("P1"))).thenReturn(1);

        assertThat(service.recompute("P1")).isTrue();
        verify(jdbcTemplate).update(startsWith("INSERT INTO place_review_stats"), eq("P1"), eq("P1"));
    }

    @Test
    void recompute_failureIsReportedNotThrown() {
        when(jdbcTemplate.update(anyString(), eq("P1"), eq("P1")))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThat(service.recompute("P1")).isFalse();
    }

    @Test
    void recompute_blankPlaceIsIgnored() {
        assertThat(service.recompute(" ")).isFalse();
        verifyNoInteractions(jdbcTemplate);
    }
}
