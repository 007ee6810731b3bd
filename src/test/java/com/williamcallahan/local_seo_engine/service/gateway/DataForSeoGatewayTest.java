package com.williamcallahan.local_seo_engine.service.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.williamcallahan.local_seo_engine.config.DataForSeoProperties;
import com.williamcallahan.local_seo_engine.mapper.TaskEnvelopeMapper;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.testutil.DataForSeoFixtures;
import com.williamcallahan.local_seo_engine.types.ReadyTask;
import com.williamcallahan.local_seo_engine.types.SubmitPayloadShape;
import com.williamcallahan.local_seo_engine.types.SubmitRequest;
import com.williamcallahan.local_seo_engine.types.TaskSubmission;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Drives the gateway through a stubbed exchange function that replays canned responses in order.
 */
class DataForSeoGatewayTest {

    private final ObjectMapper objectMapper = DataForSeoFixtures.mapper();
    private final List<ClientRequest> requests = new ArrayList<>();
    private final Deque<ClientResponse> responses = new ArrayDeque<>();

    private DataForSeoProperties properties;
    private DataForSeoGateway gateway;

    @BeforeEach
    void setUp() {
        properties = new DataForSeoProperties();
        properties.setBaseUrl("https://api.test");
        properties.setLogin("login");
        properties.setPassword("secret");
        properties.setPostbackUrl("https://seo.example.com/api/dataforseo/postback");
        properties.setRequestTimeout(Duration.ofSeconds(5));
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            ClientResponse next = responses.poll();
            return Mono.just(next != null ? next : json(HttpStatus.OK, "{}"));
        });
        DataForSeoCredentialCache credentialCache = new DataForSeoCredentialCache(properties, Clock.systemUTC());
        gateway = new DataForSeoGateway(builder, properties, credentialCache, new TaskEnvelopeMapper(objectMapper), objectMapper);
    }

    @Test
    void submit_postsToTaskPostWithBasicAuth() {
        responses.add(json(HttpStatus.OK, DataForSeoFixtures.taskPostBody("t-1", 20100, "Task Created.")));

        TaskSubmission submission = gateway.submit(TaskKind.REVIEWS, new SubmitRequest("P1", "Austin,Texas,United States", 40, SubmitPayloadShape.KEYWORD));

        assertThat(submission.taskId()).isEqualTo("t-1");
        assertThat(submission.statusCode()).isEqualTo(20100);
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo("https://api.test/v3/business_data/google/reviews/task_post");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Basic bG9naW46c2VjcmV0");
    }

    @Test
    void submit_isNotRetriedOnServerError() {
        responses.add(json(HttpStatus.SERVICE_UNAVAILABLE, "{}"));

        assertThatThrownBy(() -> gateway.submit(TaskKind.UPDATES, new SubmitRequest("P1", null, null, SubmitPayloadShape.KEYWORD)))
            .isInstanceOf(EnrichmentGatewayException.class)
            .satisfies(e -> assertThat(((EnrichmentGatewayException) e).isTransientFailure()).isTrue());
        assertThat(requests).hasSize(1);
    }

    @Test
    void listReady_retriesTransientFailure() {
        responses.add(json(HttpStatus.BAD_GATEWAY, "bad gateway"));
        responses.add(json(HttpStatus.OK, DataForSeoFixtures.tasksReadyBody("reviews", new String[]{"t-1", "P1"})));

        List<ReadyTask> ready = gateway.listReady(TaskKind.REVIEWS);

        assertThat(ready).extracting(ReadyTask::taskId).containsExactly("t-1");
        assertThat(requests).hasSize(2);
        assertThat(requests.get(1).url().getPath()).isEqualTo("/v3/business_data/google/reviews/tasks_ready");
    }

    @Test
    void fetch_clientErrorIsTerminalAndNotRetried() {
        responses.add(json(HttpStatus.NOT_FOUND, "{}"));

        assertThatThrownBy(() -> gateway.fetch("/v3/business_data/google/reviews/task_get/t-1"))
            .isInstanceOf(EnrichmentGatewayException.class)
            .satisfies(e -> assertThat(((EnrichmentGatewayException) e).isTransientFailure()).isFalse());
        assertThat(requests).hasSize(1);
    }

    @Test
    void unauthorizedResponseDropsCachedCredential() {
        responses.add(json(HttpStatus.UNAUTHORIZED, "{}"));
        responses.add(json(HttpStatus.OK, DataForSeoFixtures.pendingTaskGetBody("t-1", "P1")));

        assertThatThrownBy(() -> gateway.fetch("/v3/business_data/google/reviews/task_get/t-1"))
            .isInstanceOf(EnrichmentGatewayException.class);
        properties.setPassword("rotated");
        gateway.fetch("/v3/business_data/google/reviews/task_get/t-1");

        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION))
            .isNotEqualTo(requests.get(1).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void fetchAsync_emitsParsedResult() {
        responses.add(json(HttpStatus.OK, DataForSeoFixtures.taskGetBody("t-1", "P1", 20000, "Ok.",
            DataForSeoFixtures.review("r1", "Great", 5))));

        StepVerifier.create(gateway.fetchAsync("/v3/business_data/google/reviews/task_get/t-1"))
            .assertNext(result -> {
                assertThat(result.taskId()).isEqualTo("t-1");
                assertThat(result.completed()).isTrue();
                assertThat(result.resultCount()).isEqualTo(1);
            })
            .verifyComplete();
    }

    @Test
    void buildSubmitBody_businessInfoShapes() {
        SubmitRequest request = new SubmitRequest("P1", "Austin,Texas,United States", null, SubmitPayloadShape.PLACE_ID);

        JsonNode placeIdShape = gateway.buildSubmitBody(TaskKind.BUSINESS_INFO, request).get(0);
        JsonNode keywordShape = gateway.buildSubmitBody(TaskKind.BUSINESS_INFO, request.withShape(SubmitPayloadShape.KEYWORD)).get(0);
        JsonNode withLocation = gateway.buildSubmitBody(TaskKind.BUSINESS_INFO,
            request.withShape(SubmitPayloadShape.KEYWORD_WITH_LOCATION)).get(0);

        assertThat(placeIdShape.path("place_id").asText()).isEqualTo("P1");
        assertThat(placeIdShape.has("keyword")).isFalse();
        assertThat(placeIdShape.path("priority").asInt()).isEqualTo(2);
        assertThat(keywordShape.path("keyword").asText()).isEqualTo("place_id:P1");
        assertThat(keywordShape.has("location_name")).isFalse();
        assertThat(withLocation.path("location_name").asText()).isEqualTo("Austin,Texas,United States");
        assertThat(placeIdShape.path("tag").asText()).isEqualTo("P1");
        assertThat(placeIdShape.path("postback_url").asText())
            .isEqualTo("https://seo.example.com/api/dataforseo/postback?id=$id&tag=$tag");
    }

    @Test
    void buildSubmitBody_reviewsUseDepthAndLiveKindsSkipPostback() {
        ArrayNode reviews = gateway.buildSubmitBody(TaskKind.REVIEWS, new SubmitRequest("P1", null, 0, SubmitPayloadShape.KEYWORD));
        ArrayNode social = gateway.buildSubmitBody(TaskKind.SOCIAL_PROFILES, new SubmitRequest("P1", null, null, SubmitPayloadShape.KEYWORD));

        assertThat(reviews.get(0).path("depth").asInt()).isEqualTo(1);
        assertThat(reviews.get(0).path("keyword").asText()).isEqualTo("place_id:P1");
        assertThat(social.get(0).has("postback_url")).isFalse();
        assertThat(social.get(0).has("tag")).isFalse();
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }
}
