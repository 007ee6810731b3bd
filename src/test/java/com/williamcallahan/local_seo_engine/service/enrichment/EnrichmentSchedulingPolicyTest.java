package com.williamcallahan.local_seo_engine.service.enrichment;

import com.williamcallahan.local_seo_engine.config.EnrichmentProperties;
import com.williamcallahan.local_seo_engine.model.EnrichmentTask;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.model.TaskStatus;
import com.williamcallahan.local_seo_engine.testutil.InMemoryEnrichmentTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.williamcallahan.local_seo_engine.testutil.DataForSeoFixtures.task;
import static org.assertj.core.api.Assertions.assertThat;

class EnrichmentSchedulingPolicyTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private InMemoryEnrichmentTaskRepository taskRepository;
    private EnrichmentProperties properties;
    private EnrichmentSchedulingPolicy policy;

    @BeforeEach
    void setUp() {
        taskRepository = new InMemoryEnrichmentTaskRepository(Clock.fixed(NOW, ZoneOffset.UTC));
        properties = new EnrichmentProperties();
        policy = new EnrichmentSchedulingPolicy(taskRepository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void seed(String taskId, TaskKind kind, TaskStatus status, Duration age) {
        EnrichmentTask row = task(taskId, kind, "P1", status);
        row.setCreatedAt(NOW.minus(age));
        taskRepository.seed(row);
    }

    @Test
    void dueKinds_skipsKindSubmittedInsideThreshold() {
        seed("b-1", TaskKind.BUSINESS_INFO, TaskStatus.PENDING, Duration.ofHours(2));

        List<TaskKind> due = policy.dueKinds("P1", List.of(TaskKind.REVIEWS, TaskKind.BUSINESS_INFO));

        assertThat(due).containsExactly(TaskKind.REVIEWS);
        assertThat(taskRepository.findById("b-1").orElseThrow().getStatus()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void evaluate_reportsRemainingCooldown() {
        seed("b-1", TaskKind.BUSINESS_INFO, TaskStatus.PENDING, Duration.ofHours(2));

        EnrichmentSchedulingPolicy.Decision decision = policy.evaluate("P1", List.of(TaskKind.BUSINESS_INFO)).get(0);

        assertThat(decision.due()).isFalse();
        assertThat(decision.remaining()).isEqualTo(Duration.ofHours(22));
    }

    @Test
    void dueKinds_staleKindBecomesDueAgain() {
        seed("r-1", TaskKind.REVIEWS, TaskStatus.POPULATED, Duration.ofHours(25));

        assertThat(policy.dueKinds("P1", List.of(TaskKind.REVIEWS))).containsExactly(TaskKind.REVIEWS);
    }

    @Test
    void dueKinds_errorRowsStillCountTowardCooldown() {
        seed("r-err", TaskKind.REVIEWS, TaskStatus.ERROR, Duration.ofMinutes(30));

        assertThat(policy.dueKinds("P1", List.of(TaskKind.REVIEWS))).isEmpty();
    }

    @Test
    void dueKinds_zeroThresholdIsAlwaysDue() {
        properties.getRefreshHours().setUpdates(0);
        seed("u-1", TaskKind.UPDATES, TaskStatus.CREATED, Duration.ofMinutes(1));

        assertThat(policy.dueKinds("P1", List.of(TaskKind.UPDATES))).containsExactly(TaskKind.UPDATES);
    }

    @Test
    void dueKinds_keepsRequestOrder() {
        List<TaskKind> requested = List.of(TaskKind.SOCIAL_PROFILES, TaskKind.UPDATES, TaskKind.REVIEWS);

        assertThat(policy.dueKinds("P1", requested)).containsExactlyElementsOf(requested);
    }
}
