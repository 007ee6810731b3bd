/**
 * WebClient-based client for the DataForSEO business data API
 *
 * @author William Callahan
 *
 * Features:
 * - task_post, tasks_ready and task_get per enrichment kind, plus the live lookup for social profiles
 * - Basic auth from {@link DataForSeoCredentialCache}, invalidated on 401
 * - Retries idempotent GETs on transient failures; submissions are never retried
 * - Bodies are parsed by {@link TaskEnvelopeMapper} so callbacks and fetches share one format
 */

package com.williamcallahan.local_seo_engine.service.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.local_seo_engine.config.DataForSeoProperties;
import com.williamcallahan.local_seo_engine.mapper.TaskEnvelopeMapper;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.types.ReadyTask;
import com.williamcallahan.local_seo_engine.types.SubmitPayloadShape;
import com.williamcallahan.local_seo_engine.types.SubmitRequest;
import com.williamcallahan.local_seo_engine.types.TaskFetchResult;
import com.williamcallahan.local_seo_engine.types.TaskSubmission;
import com.williamcallahan.local_seo_engine.util.ErrorHandlingUtils;
import com.williamcallahan.local_seo_engine.util.ExternalApiLogger;
import com.williamcallahan.local_seo_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

@Service
public class DataForSeoGateway implements EnrichmentGateway {

    private static final Logger logger = LoggerFactory.getLogger(DataForSeoGateway.class);
    private static final String BUSINESS_DATA_ROOT = "/v3/business_data/google/";

    private final WebClient webClient;
    private final DataForSeoProperties properties;
    private final DataForSeoCredentialCache credentialCache;
    private final TaskEnvelopeMapper envelopeMapper;
    private final ObjectMapper objectMapper;

    public DataForSeoGateway(WebClient.Builder webClientBuilder,
                             DataForSeoProperties properties,
                             DataForSeoCredentialCache credentialCache,
                             TaskEnvelopeMapper envelopeMapper,
                             ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.clone().baseUrl(properties.getBaseUrl()).build();
        this.properties = properties;
        this.credentialCache = credentialCache;
        this.envelopeMapper = envelopeMapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isConfigured() {
        return credentialCache.isConfigured();
    }

    @Override
    public TaskSubmission submit(TaskKind kind, SubmitRequest request) {
        String path = BUSINESS_DATA_ROOT + kind.getApiSection() + "/task_post";
        ArrayNode body = buildSubmitBody(kind, request);
        String operation = "task_post " + kind.getCode();
        ExternalApiLogger.logApiCallAttempt(logger, operation, request.placeId());
        String response = block(post(path, body), operation, request.placeId());
        TaskSubmission submission = envelopeMapper.toSubmission(response);
        ExternalApiLogger.logApiCallSuccess(logger, operation, request.placeId(),
            submission.statusCode(), submission.statusMessage());
        return submission;
    }

    @Override
    public List<ReadyTask> listReady(TaskKind kind) {
        String operation = "tasks_ready " + kind.getCode();
        String path = BUSINESS_DATA_ROOT + kind.getApiSection() + "/tasks_ready";
        ExternalApiLogger.logApiCallAttempt(logger, operation, path);
        String response = block(get(path, operation), operation, path);
        List<ReadyTask> ready = envelopeMapper.toReadyTasks(kind, response);
        logger.info("tasks_ready for {} returned {} entries.", kind.getCode(), ready.size());
        return ready;
    }

    @Override
    public TaskFetchResult fetch(String endpoint) {
        return block(fetchAsync(endpoint), "task_get", endpoint);
    }

    /**
     * Non-blocking fetch of a task result
     */
    public Mono<TaskFetchResult> fetchAsync(String endpoint) {
        String operation = "task_get";
        ExternalApiLogger.logApiCallAttempt(logger, operation, endpoint);
        return get(endpoint, operation)
            .map(envelopeMapper::toFetchResult)
            .doOnNext(result -> ExternalApiLogger.logApiCallSuccess(logger, operation, endpoint,
                result.statusCode(), result.statusMessage()));
    }

    @Override
    public TaskFetchResult fetchLive(TaskKind kind, SubmitRequest request) {
        String operation = "live " + kind.getCode();
        ArrayNode body = buildSubmitBody(kind, request);
        ExternalApiLogger.logApiCallAttempt(logger, operation, request.placeId());
        String response = block(post(properties.getSocialProfilesLivePath(), body), operation, request.placeId());
        TaskFetchResult result = envelopeMapper.toFetchResult(response);
        ExternalApiLogger.logApiCallSuccess(logger, operation, request.placeId(), result.statusCode(), result.statusMessage());
        return result;
    }

    @Override
    public String taskGetPath(TaskKind kind, String taskId) {
        return BUSINESS_DATA_ROOT + kind.getApiSection() + "/task_get/" + taskId;
    }

    /**
     * Builds the one-element task array for a submission
     */
    ArrayNode buildSubmitBody(TaskKind kind, SubmitRequest request) {
        ObjectNode task = objectMapper.createObjectNode();
        String keyword = "place_id:" + request.placeId();
        SubmitPayloadShape shape = request.shape() == null ? SubmitPayloadShape.KEYWORD : request.shape();

        if (kind == TaskKind.BUSINESS_INFO) {
            if (shape == SubmitPayloadShape.PLACE_ID) {
                task.put("place_id", request.placeId());
            } else {
                task.put("keyword", keyword);
            }
            task.put("language_code", properties.getLanguageCode());
            if (shape == SubmitPayloadShape.KEYWORD_WITH_LOCATION && request.hasLocation()) {
                task.put("location_name", request.locationName());
            }
            task.put("priority", properties.getPriority());
        } else {
            task.put("keyword", keyword);
            task.put("language_code", properties.getLanguageCode());
            if (request.hasLocation()) {
                task.put("location_name", request.locationName());
            }
            if (kind == TaskKind.REVIEWS) {
                int depth = request.reviewDepth() != null ? request.reviewDepth() : properties.getReviewDepth();
                task.put("depth", Math.max(1, depth));
            }
        }

        if (kind.isPolled()) {
            task.put("tag", request.placeId());
            String postbackUrl = postbackUrl();
            if (postbackUrl != null) {
                task.put("postback_url", postbackUrl);
            }
        }
        ArrayNode body = objectMapper.createArrayNode();
        body.add(task);
        return body;
    }

    private String postbackUrl() {
        String base = ValidationUtils.nullIfBlank(properties.getPostbackUrl());
        if (base == null) {
            return null;
        }
        if (base.contains("$id")) {
            return base;
        }
        return base + (base.contains("?") ? "&" : "?") + "id=$id&tag=$tag";
    }

    private Mono<String> get(String pathOrUrl, String operation) {
        return webClient.get()
            .uri(pathOrUrl)
            .header(HttpHeaders.AUTHORIZATION, credentialCache.getOrRefresh())
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(properties.getRequestTimeout())
            .retryWhen(ErrorHandlingUtils.createWebClientRetry(logger, operation))
            .defaultIfEmpty("");
    }

    private Mono<String> post(String path, ArrayNode body) {
        return webClient.post()
            .uri(path)
            .header(HttpHeaders.AUTHORIZATION, credentialCache.getOrRefresh())
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(body.toString())
            .retrieve()
            .bodyToMono(String.class)
            .timeout(properties.getRequestTimeout())
            .defaultIfEmpty("");
    }

    private <T> T block(Mono<T> call, String operation, String target) {
        try {
            return call.block(blockTimeout());
        } catch (RuntimeException e) {
            ErrorHandlingUtils.rethrowIfCancelled(e);
            if (e instanceof WebClientResponseException wcre && wcre.getStatusCode().value() == 401) {
                credentialCache.invalidate();
            }
            boolean transientFailure = ErrorHandlingUtils.isTransient(e);
            ExternalApiLogger.logApiCallFailure(logger, operation, target, e.getMessage());
            throw new EnrichmentGatewayException(operation + " failed: " + e.getMessage(), transientFailure, e);
        }
    }

    private Duration blockTimeout() {
        // room for the GET retries
        return properties.getRequestTimeout().multipliedBy(4);
    }
}
