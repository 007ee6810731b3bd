package com.williamcallahan.local_seo_engine.service.enrichment;

import com.williamcallahan.local_seo_engine.model.EnrichmentTask;
import com.williamcallahan.local_seo_engine.model.Place;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.model.TaskStatus;
import com.williamcallahan.local_seo_engine.service.gateway.EnrichmentGateway;
import com.williamcallahan.local_seo_engine.repository.EnrichmentTaskRepository;
import com.williamcallahan.local_seo_engine.types.PopulateResult;
import com.williamcallahan.local_seo_engine.types.SubmitPayloadShape;
import com.williamcallahan.local_seo_engine.types.SubmitRequest;
import com.williamcallahan.local_seo_engine.types.TaskFetchResult;
import com.williamcallahan.local_seo_engine.types.TaskSubmission;
import com.williamcallahan.local_seo_engine.util.ErrorHandlingUtils;
import com.williamcallahan.local_seo_engine.util.ProviderStatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.UUID;

/**
 * Submits one enrichment job and records the outcome in the ledger.
 *
 * <p>Every call leaves exactly one ledger row behind: Created on acceptance, Error with the
 * provider message on rejection, or a synthetic {@code "{kind}-err-{uuid}"} Error row when no
 * provider task id came back. Business info walks a fallback chain of payload shapes on 40501.
 */
@Service
public class TaskSubmissionService {

    private static final Logger logger = LoggerFactory.getLogger(TaskSubmissionService.class);
    static final String MISSING_CREDENTIALS = "DataForSEO credentials are not configured";

    private final EnrichmentGateway gateway;
    private final EnrichmentTaskRepository taskRepository;
    private final TaskResultMaterializer materializer;

    public TaskSubmissionService(EnrichmentGateway gateway,
                                 EnrichmentTaskRepository taskRepository,
                                 TaskResultMaterializer materializer) {
        this.gateway = gateway;
        this.taskRepository = taskRepository;
        this.materializer = materializer;
    }

    /**
     * @return the ledger row written for this submission
     */
    public EnrichmentTask submit(Place place, TaskKind kind) {
        if (!gateway.isConfigured()) {
            return recordSyntheticError(place, kind, 0, MISSING_CREDENTIALS);
        }
        SubmitRequest request = new SubmitRequest(place.getPlaceId(), place.getSearchLocationName(),
            place.getReviewCount(), SubmitPayloadShape.KEYWORD);
        try {
            if (!kind.isPolled()) {
                return submitLive(place, kind, request);
            }
            TaskSubmission submission = kind == TaskKind.BUSINESS_INFO
                ? submitBusinessInfo(request)
                : gateway.submit(kind, request);
            ErrorHandlingUtils.throwIfCancelled();
            return recordSubmission(place, kind, submission);
        } catch (RuntimeException e) {
            ErrorHandlingUtils.rethrowIfCancelled(e);
            logger.warn("Submission of {} for place {} failed: {}", kind.getCode(), place.getPlaceId(), e.getMessage());
            return recordSyntheticError(place, kind, 0, ErrorHandlingUtils.describe(e));
        }
    }

    /**
     * place_id payload first; on 40501 retries with keyword, then keyword plus location.
     */
    TaskSubmission submitBusinessInfo(SubmitRequest request) {
        TaskSubmission submission = gateway.submit(TaskKind.BUSINESS_INFO, request.withShape(SubmitPayloadShape.PLACE_ID));
        if (rejectedField(submission, "keyword")) {
            logger.info("Business info for {} rejected ({}); retrying with keyword payload.",
                request.placeId(), submission.statusMessage());
            ErrorHandlingUtils.throwIfCancelled();
            submission = gateway.submit(TaskKind.BUSINESS_INFO, request.withShape(SubmitPayloadShape.KEYWORD));
        }
        if (rejectedField(submission, "location_name") && request.hasLocation()) {
            logger.info("Business info for {} rejected ({}); retrying with keyword and location.",
                request.placeId(), submission.statusMessage());
            ErrorHandlingUtils.throwIfCancelled();
            submission = gateway.submit(TaskKind.BUSINESS_INFO, request.withShape(SubmitPayloadShape.KEYWORD_WITH_LOCATION));
        }
        return submission;
    }

    private static boolean rejectedField(TaskSubmission submission, String field) {
        return submission.statusCode() != null
            && submission.statusCode() == ProviderStatusCodes.INVALID_FIELD
            && submission.statusMessage() != null
            && submission.statusMessage().toLowerCase(Locale.ROOT).contains(field);
    }

    private EnrichmentTask recordSubmission(Place place, TaskKind kind, TaskSubmission submission) {
        if (!submission.hasTaskId()) {
            String message = submission.statusMessage() == null ? "No task id returned" : submission.statusMessage();
            return recordSyntheticError(place, kind, submission.statusCode(), message);
        }
        boolean accepted = ProviderStatusCodes.isSuccess(submission.statusCode());
        EnrichmentTask task = EnrichmentTask.builder()
            .taskId(submission.taskId())
            .kind(kind)
            .placeId(place.getPlaceId())
            .locationName(place.getSearchLocationName())
            .status(accepted ? TaskStatus.CREATED : TaskStatus.ERROR)
            .statusCode(submission.statusCode())
            .statusMessage(submission.statusMessage())
            .endpoint(gateway.taskGetPath(kind, submission.taskId()))
            .lastError(accepted ? null : submission.statusMessage())
            .build();
        taskRepository.upsert(task);
        if (accepted) {
            logger.info("Submitted {} task {} for place {}.", kind.getCode(), task.getTaskId(), place.getPlaceId());
        } else {
            logger.warn("{} task {} for place {} rejected: {} {}", kind.getCode(), task.getTaskId(),
                place.getPlaceId(), submission.statusCode(), submission.statusMessage());
        }
        return task;
    }

    /**
     * Live kinds are fetched in the same call and materialized immediately. The row always
     * ends terminal since neither reconciliation nor callbacks ever revisit it.
     */
    private EnrichmentTask submitLive(Place place, TaskKind kind, SubmitRequest request) {
        TaskFetchResult result = gateway.fetchLive(kind, request);
        ErrorHandlingUtils.throwIfCancelled();
        if (!ProviderStatusCodes.isSuccess(result.statusCode())) {
            String message = result.statusMessage() == null ? "Live lookup failed" : result.statusMessage();
            if (result.taskId() == null) {
                return recordSyntheticError(place, kind, result.statusCode(), message);
            }
            EnrichmentTask failed = baseTask(place, kind, result.taskId(), TaskStatus.ERROR, result);
            failed.setLastError(message);
            taskRepository.upsert(failed);
            return failed;
        }
        String taskId = result.taskId() != null ? result.taskId() : kind.getCode() + "-live-" + UUID.randomUUID();
        EnrichmentTask task = baseTask(place, kind, taskId, TaskStatus.CREATED, result);
        taskRepository.upsert(task);
        if (!result.completed()) {
            // live rows are never polled again
            taskRepository.markTerminalNoData(taskId, result.statusCode(), result.statusMessage());
            logger.info("Live {} lookup {} for place {} returned no result.", kind.getCode(), taskId, place.getPlaceId());
            return taskRepository.findById(taskId).orElse(task);
        }
        PopulateResult populated = materializer.materialize(task, result);
        if (!populated.success()) {
            taskRepository.markError(taskId, result.statusCode(), populated.message());
            logger.warn("Live {} lookup {} for place {} could not be stored: {}",
                kind.getCode(), taskId, place.getPlaceId(), populated.message());
        }
        return taskRepository.findById(taskId).orElse(task);
    }

    private EnrichmentTask baseTask(Place place, TaskKind kind, String taskId, TaskStatus status, TaskFetchResult result) {
        return EnrichmentTask.builder()
            .taskId(taskId)
            .kind(kind)
            .placeId(place.getPlaceId())
            .locationName(place.getSearchLocationName())
            .status(status)
            .statusCode(result.statusCode())
            .statusMessage(result.statusMessage())
            .build();
    }

    private EnrichmentTask recordSyntheticError(Place place, TaskKind kind, Integer statusCode, String message) {
        EnrichmentTask task = EnrichmentTask.builder()
            .taskId(EnrichmentTask.syntheticErrorId(kind))
            .kind(kind)
            .placeId(place.getPlaceId())
            .locationName(place.getSearchLocationName())
            .status(TaskStatus.ERROR)
            .statusCode(statusCode == null ? 0 : statusCode)
            .statusMessage(message)
            .lastError(message)
            .build();
        taskRepository.upsert(task);
        logger.warn("Recorded failed {} submission for place {} as {}: {}",
            kind.getCode(), place.getPlaceId(), task.getTaskId(), message);
        return task;
    }
}
