package com.williamcallahan.local_seo_engine.service.enrichment;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.local_seo_engine.mapper.TaskEnvelopeMapper;
import com.williamcallahan.local_seo_engine.model.EnrichmentTask;
import com.williamcallahan.local_seo_engine.model.Place;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.model.TaskStatus;
import com.williamcallahan.local_seo_engine.repository.EnrichmentResultRepository;
import com.williamcallahan.local_seo_engine.service.gateway.EnrichmentGateway;
import com.williamcallahan.local_seo_engine.service.gateway.EnrichmentGatewayException;
import com.williamcallahan.local_seo_engine.service.image.PlaceAssetCacheService;
import com.williamcallahan.local_seo_engine.testutil.DataForSeoFixtures;
import com.williamcallahan.local_seo_engine.testutil.InMemoryEnrichmentResultRepository;
import com.williamcallahan.local_seo_engine.testutil.InMemoryEnrichmentTaskRepository;
import com.williamcallahan.local_seo_engine.testutil.InMemoryPlaceRepository;
import com.williamcallahan.local_seo_engine.testutil.TestMaterializers;
import com.williamcallahan.local_seo_engine.types.SubmitPayloadShape;
import com.williamcallahan.local_seo_engine.types.SubmitRequest;
import com.williamcallahan.local_seo_engine.types.TaskSubmission;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskSubmissionServiceTest {

    @Mock
    private EnrichmentGateway gateway;

    @Mock
    private PlaceAssetCacheService assetCacheService;

    @Mock
    private PlaceReviewStatsService reviewStatsService;

    private InMemoryEnrichmentTaskRepository taskRepository;
    private InMemoryEnrichmentResultRepository resultRepository;
    private TaskSubmissionService service;
    private Place place;

    @BeforeEach
    void setUp() {
        taskRepository = new InMemoryEnrichmentTaskRepository();
        resultRepository = new InMemoryEnrichmentResultRepository();
        InMemoryPlaceRepository placeRepository = new InMemoryPlaceRepository();
        place = placeRepository.add("P1", "Austin,Texas,United States");
        TaskResultMaterializer materializer = TestMaterializers.create(taskRepository, resultRepository, placeRepository,
            gateway, assetCacheService, reviewStatsService);
        service = new TaskSubmissionService(gateway, taskRepository, materializer);
        lenient().when(gateway.isConfigured()).thenReturn(true);
        lenient().when(gateway.taskGetPath(any(), anyString())).thenAnswer(inv ->
            "/v3/business_data/google/" + inv.<TaskKind>getArgument(0).getApiSection() + "/task_get/" + inv.getArgument(1));
    }

    @Test
    void submit_acceptedTaskIsRecordedAsCreated() {
        when(gateway.submit(eq(TaskKind.REVIEWS), any())).thenReturn(new TaskSubmission("t-1", 20100, "Task Created."));

        EnrichmentTask task = service.submit(place, TaskKind.REVIEWS);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.CREATED);
        EnrichmentTask stored = taskRepository.findById("t-1").orElseThrow();
        assertThat(stored.getStatusCode()).isEqualTo(20100);
        assertThat(stored.getLocationName()).isEqualTo("Austin,Texas,United States");
        assertThat(stored.getEndpoint()).isEqualTo("/v3/business_data/google/reviews/task_get/t-1");
    }

    @Test
    void submit_businessInfoWalksFallbackShapes() {
        when(gateway.submit(eq(TaskKind.BUSINESS_INFO), any())).thenReturn(
            new TaskSubmission("t-a", 40501, "Invalid Field: 'keyword'."),
            new TaskSubmission("t-b", 40501, "Invalid Field: 'location_name'."),
            new TaskSubmission("t-7", 20100, "Task Created."));

        EnrichmentTask task = service.submit(place, TaskKind.BUSINESS_INFO);

        ArgumentCaptor<SubmitRequest> requests = ArgumentCaptor.forClass(SubmitRequest.class);
        verify(gateway, times(3)).submit(eq(TaskKind.BUSINESS_INFO), requests.capture());
        assertThat(requests.getAllValues()).extracting(SubmitRequest::shape).containsExactly(
            SubmitPayloadShape.PLACE_ID, SubmitPayloadShape.KEYWORD, SubmitPayloadShape.KEYWORD_WITH_LOCATION);
        assertThat(task.getTaskId()).isEqualTo("t-7");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.CREATED);
        assertThat(taskRepository.size()).isEqualTo(1);
    }

    @Test
    void submit_businessInfoExhaustedFallbacksRecordLastMessage() {
        Place noLocation = Place.builder().placeId("P2").build();
        when(gateway.submit(eq(TaskKind.BUSINESS_INFO), any())).thenReturn(
            new TaskSubmission("t-a", 40501, "Invalid Field: 'keyword'."),
            new TaskSubmission("t-8", 40501, "Invalid Field: 'location_name'."));

        EnrichmentTask task = service.submit(noLocation, TaskKind.BUSINESS_INFO);

        verify(gateway, times(2)).submit(eq(TaskKind.BUSINESS_INFO), any());
        assertThat(task.getTaskId()).isEqualTo("t-8");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.ERROR);
        assertThat(taskRepository.findById("t-8").orElseThrow().getLastError()).isEqualTo("Invalid Field: 'location_name'.");
    }

    @Test
    void submit_rejectionWithoutTaskIdGetsSyntheticId() {
        when(gateway.submit(eq(TaskKind.REVIEWS), any())).thenReturn(new TaskSubmission(null, 40200, "Payment Required."));

        EnrichmentTask task = service.submit(place, TaskKind.REVIEWS);

        assertThat(task.getTaskId()).startsWith("reviews-err-");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.ERROR);
        assertThat(task.getStatusCode()).isEqualTo(40200);
        assertThat(taskRepository.findById(task.getTaskId())).isPresent();
    }

    @Test
    void submit_transportFailureRecordsSyntheticError() {
        when(gateway.submit(eq(TaskKind.UPDATES), any()))
            .thenThrow(new EnrichmentGatewayException("POST failed: connection reset", true, null));

        EnrichmentTask task = service.submit(place, TaskKind.UPDATES);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.ERROR);
        assertThat(task.getStatusCode()).isZero();
        assertThat(task.getLastError()).contains("connection reset");
        assertThat(taskRepository.size()).isEqualTo(1);
    }

    @Test
    void submit_missingCredentialsRecordsErrorWithoutCallingProvider() {
        when(gateway.isConfigured()).thenReturn(false);

        EnrichmentTask task = service.submit(place, TaskKind.QUESTIONS_AND_ANSWERS);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.ERROR);
        assertThat(task.getStatusCode()).isZero();
        assertThat(task.getLastError()).isEqualTo(TaskSubmissionService.MISSING_CREDENTIALS);
        verify(gateway, never()).submit(any(), any());
    }

    @Test
    void submit_socialProfilesMaterializesLiveResult() {
        ObjectNode item = DataForSeoFixtures.mapper().createObjectNode();
        item.putArray("contacts").addObject().put("type", "social").put("value", "https://instagram.com/bakery");
        TaskEnvelopeMapper envelopeMapper = new TaskEnvelopeMapper(DataForSeoFixtures.mapper());
        when(gateway.fetchLive(eq(TaskKind.SOCIAL_PROFILES), any()))
            .thenReturn(envelopeMapper.toFetchResult(DataForSeoFixtures.taskGetBody("s-1", "P1", 20000, "Ok.", item)));

        EnrichmentTask task = service.submit(place, TaskKind.SOCIAL_PROFILES);

        assertThat(task.getTaskId()).isEqualTo("s-1");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.POPULATED);
        assertThat(task.getLastPopulateCount()).isEqualTo(1);
        assertThat(resultRepository.socialProfiles).containsValue("https://instagram.com/bakery");
        verify(gateway, never()).submit(any(), any());
    }

    @Test
    void submit_socialProfilesWithoutResultEndsTerminal() {
        TaskEnvelopeMapper envelopeMapper = new TaskEnvelopeMapper(DataForSeoFixtures.mapper());
        when(gateway.fetchLive(eq(TaskKind.SOCIAL_PROFILES), any()))
            .thenReturn(envelopeMapper.toFetchResult(DataForSeoFixtures.pendingTaskGetBody("live-1", "P1")));

        EnrichmentTask task = service.submit(place, TaskKind.SOCIAL_PROFILES);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.TERMINAL_NO_DATA);
        assertThat(taskRepository.findMostRecentActiveForPlace("P1")).isEmpty();
        assertThat(resultRepository.socialProfiles).isEmpty();
    }

    @Test
    void submit_socialProfilesStoreFailureEndsInError() {
        EnrichmentResultRepository failingResults = mock(EnrichmentResultRepository.class);
        when(failingResults.mergeSocialProfiles(eq("P1"), eq("s-2"), anyMap()))
            .thenThrow(new IllegalStateException("place_social_profile unavailable"));
        TaskResultMaterializer failing = TestMaterializers.create(taskRepository, failingResults,
            new InMemoryPlaceRepository(), gateway, assetCacheService, reviewStatsService);
        TaskSubmissionService failingService = new TaskSubmissionService(gateway, taskRepository, failing);
        ObjectNode item = DataForSeoFixtures.mapper().createObjectNode();
        item.putArray("contacts").addObject().put("type", "social").put("value", "https://instagram.com/bakery");
        TaskEnvelopeMapper envelopeMapper = new TaskEnvelopeMapper(DataForSeoFixtures.mapper());
        when(gateway.fetchLive(eq(TaskKind.SOCIAL_PROFILES), any()))
            .thenReturn(envelopeMapper.toFetchResult(DataForSeoFixtures.taskGetBody("s-2", "P1", 20000, "Ok.", item)));

        EnrichmentTask task = failingService.submit(place, TaskKind.SOCIAL_PROFILES);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.ERROR);
        assertThat(task.getLastError()).contains("place_social_profile unavailable");
        assertThat(taskRepository.findMostRecentActiveForPlace("P1")).isEmpty();
    }

    @Test
    void submit_cancellationPropagatesWithoutLedgerRow() {
        when(gateway.submit(eq(TaskKind.REVIEWS), any())).thenThrow(new CancellationException("shutting down"));

        assertThatThrownBy(() -> service.submit(place, TaskKind.REVIEWS)).isInstanceOf(CancellationException.class);
        assertThat(taskRepository.size()).isZero();
    }
}
