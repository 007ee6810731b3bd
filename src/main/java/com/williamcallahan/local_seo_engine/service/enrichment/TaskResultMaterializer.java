/**
 * Turns finished DataForSEO tasks into stored enrichment data
 *
 * @author William Callahan
 *
 * Features:
 * - Fetches task results at the ledger's cached endpoint
 * - Per-kind parsing into reviews, profile snapshot, updates, Q&A pairs or social links
 * - Items and the final task status are written in one transaction, status last
 * - Zero items: TerminalNoData when the job completed, Pending while it is still running
 * - Provider failure codes move the task to Error; transport failures only record last_error
 */

package com.williamcallahan.local_seo_engine.service.enrichment;

import com.williamcallahan.local_seo_engine.config.DataForSeoProperties;
import com.williamcallahan.local_seo_engine.mapper.BusinessInfoResultMapper;
import com.williamcallahan.local_seo_engine.mapper.BusinessUpdateResultMapper;
import com.williamcallahan.local_seo_engine.mapper.QuestionAnswerResultMapper;
import com.williamcallahan.local_seo_engine.mapper.ReviewResultMapper;
import com.williamcallahan.local_seo_engine.mapper.SocialProfileExtractor;
import com.williamcallahan.local_seo_engine.model.EnrichmentTask;
import com.williamcallahan.local_seo_engine.model.Place;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.model.TaskStatus;
import com.williamcallahan.local_seo_engine.model.enrichment.BusinessInfoSnapshot;
import com.williamcallahan.local_seo_engine.model.enrichment.BusinessUpdateItem;
import com.williamcallahan.local_seo_engine.model.enrichment.QuestionAnswerItem;
import com.williamcallahan.local_seo_engine.model.enrichment.ReviewItem;
import com.williamcallahan.local_seo_engine.model.enrichment.SocialPlatform;
import com.williamcallahan.local_seo_engine.repository.EnrichmentResultRepository;
import com.williamcallahan.local_seo_engine.repository.EnrichmentTaskRepository;
import com.williamcallahan.local_seo_engine.repository.PlaceRepository;
import com.williamcallahan.local_seo_engine.service.gateway.EnrichmentGateway;
import com.williamcallahan.local_seo_engine.service.gateway.EnrichmentGatewayException;
import com.williamcallahan.local_seo_engine.service.image.PlaceAssetCacheService;
import com.williamcallahan.local_seo_engine.types.BulkPopulateSummary;
import com.williamcallahan.local_seo_engine.types.PopulateResult;
import com.williamcallahan.local_seo_engine.types.TaskFetchResult;
import com.williamcallahan.local_seo_engine.util.ErrorHandlingUtils;
import com.williamcallahan.local_seo_engine.util.ProviderStatusCodes;
import com.williamcallahan.local_seo_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntSupplier;

@Service
public class TaskResultMaterializer {

    private static final Logger logger = LoggerFactory.getLogger(TaskResultMaterializer.class);

    private final EnrichmentTaskRepository taskRepository;
    private final EnrichmentResultRepository resultRepository;
    private final PlaceRepository placeRepository;
    private final EnrichmentGateway gateway;
    private final ReviewResultMapper reviewMapper;
    private final BusinessInfoResultMapper businessInfoMapper;
    private final BusinessUpdateResultMapper updateMapper;
    private final QuestionAnswerResultMapper questionAnswerMapper;
    private final SocialProfileExtractor socialProfileExtractor;
    private final PlaceAssetCacheService assetCacheService;
    private final PlaceReviewStatsService reviewStatsService;
    private final TransactionOperations transactionOperations;
    private final DataForSeoProperties dataForSeoProperties;

    public TaskResultMaterializer(EnrichmentTaskRepository taskRepository,
                                  EnrichmentResultRepository resultRepository,
                                  PlaceRepository placeRepository,
                                  EnrichmentGateway gateway,
                                  ReviewResultMapper reviewMapper,
                                  BusinessInfoResultMapper businessInfoMapper,
                                  BusinessUpdateResultMapper updateMapper,
                                  QuestionAnswerResultMapper questionAnswerMapper,
                                  SocialProfileExtractor socialProfileExtractor,
                                  PlaceAssetCacheService assetCacheService,
                                  PlaceReviewStatsService reviewStatsService,
                                  TransactionOperations transactionOperations,
                                  DataForSeoProperties dataForSeoProperties) {
        this.taskRepository = taskRepository;
        this.resultRepository = resultRepository;
        this.placeRepository = placeRepository;
        this.gateway = gateway;
        this.reviewMapper = reviewMapper;
        this.businessInfoMapper = businessInfoMapper;
        this.updateMapper = updateMapper;
        this.questionAnswerMapper = questionAnswerMapper;
        this.socialProfileExtractor = socialProfileExtractor;
        this.assetCacheService = assetCacheService;
        this.reviewStatsService = reviewStatsService;
        this.transactionOperations = transactionOperations;
        this.dataForSeoProperties = dataForSeoProperties;
    }

    /**
     * Fetches and materializes one task by id
     */
    public PopulateResult populate(String taskId) {
        Optional<EnrichmentTask> task = taskRepository.findById(taskId);
        if (task.isEmpty()) {
            return PopulateResult.failed("Task " + taskId + " not found.");
        }
        return populate(task.get());
    }

    /**
     * Fetches the task result from the provider and materializes it.
     * Only cancellation escapes; every other failure is recorded and reported in the result.
     */
    public PopulateResult populate(EnrichmentTask task) {
        if (task.getStatus() == TaskStatus.ERROR) {
            return PopulateResult.failed("Task " + task.getTaskId() + " is in Error state: " + task.getLastError());
        }
        if (!task.getKind().isPolled()) {
            return PopulateResult.failed("Task " + task.getTaskId() + " (" + task.getKind().getCode()
                + ") is fetched at submission time and cannot be re-populated.");
        }
        ErrorHandlingUtils.throwIfCancelled();
        String endpoint = ValidationUtils.hasText(task.getEndpoint())
            ? task.getEndpoint()
            : gateway.taskGetPath(task.getKind(), task.getTaskId());
        TaskFetchResult fetched;
        try {
            fetched = gateway.fetch(endpoint);
        } catch (EnrichmentGatewayException e) {
            ErrorHandlingUtils.rethrowIfCancelled(e);
            taskRepository.recordPopulateFailure(task.getTaskId(), e.getMessage());
            String kindOfFailure = e.isTransientFailure() ? "Transient fetch failure" : "Fetch failure";
            logger.warn("{} for task {}: {}", kindOfFailure, task.getTaskId(), e.getMessage());
            return PopulateResult.failed(kindOfFailure + " for task " + task.getTaskId() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            ErrorHandlingUtils.rethrowIfCancelled(e);
            taskRepository.recordPopulateFailure(task.getTaskId(), ErrorHandlingUtils.describe(e));
            logger.warn("Unexpected fetch failure for task {}: {}", task.getTaskId(), e.getMessage(), e);
            return PopulateResult.failed("Fetch failed for task " + task.getTaskId() + ": " + e.getMessage());
        }
        return materialize(task, fetched);
    }

    /**
     * Materializes an already fetched result, such as a callback payload or a live lookup
     */
    public PopulateResult materialize(EnrichmentTask task, TaskFetchResult fetched) {
        String taskId = task.getTaskId();
        try {
            if (ProviderStatusCodes.isTerminalFailure(fetched.statusCode(), dataForSeoProperties.getInProgressStatusCodes())) {
                return recordTerminalFailure(task, fetched);
            }
            switch (task.getKind()) {
                case REVIEWS:
                    return materializeReviews(task, fetched);
                case BUSINESS_INFO:
                    return materializeBusinessInfo(task, fetched);
                case UPDATES:
                    return materializeUpdates(task, fetched);
                case QUESTIONS_AND_ANSWERS:
                    return materializeQuestionAnswers(task, fetched);
                case SOCIAL_PROFILES:
                    return materializeSocialProfiles(task, fetched);
                default:
                    return PopulateResult.failed("Unsupported task kind " + task.getKind());
            }
        } catch (RuntimeException e) {
            ErrorHandlingUtils.rethrowIfCancelled(e);
            logger.error("Populate failed for task {} ({}): {}", taskId, task.getKind().getCode(), e.getMessage(), e);
            taskRepository.recordPopulateFailure(taskId, ErrorHandlingUtils.describe(e));
            return PopulateResult.failed("Populate failed for task " + taskId + ": " + e.getMessage());
        }
    }

    /**
     * Populates every Ready task, optionally for a single kind. Per-task failures are counted, not thrown.
     */
    public BulkPopulateSummary populateReady(TaskKind kindFilter) {
        Instant start = Instant.now();
        List<EnrichmentTask> ready = taskRepository.findByStatus(TaskStatus.READY, kindFilter);
        int succeeded = 0;
        int failed = 0;
        int items = 0;
        for (EnrichmentTask task : ready) {
            ErrorHandlingUtils.throwIfCancelled();
            PopulateResult result;
            try {
                result = populate(task);
            } catch (RuntimeException e) {
                ErrorHandlingUtils.rethrowIfCancelled(e);
                logger.error("Populate crashed for task {}: {}", task.getTaskId(), e.getMessage(), e);
                result = PopulateResult.failed(e.getMessage());
            }
            if (result.success()) {
                succeeded++;
                items += result.itemCount();
            } else {
                failed++;
            }
        }
        BulkPopulateSummary summary = new BulkPopulateSummary(ready.size(), succeeded, failed, items);
        logger.info("Populate-ready finished in {}ms (kind={}, attempted={}, succeeded={}, failed={}, items={}).",
            Duration.between(start, Instant.now()).toMillis(),
            kindFilter == null ? "all" : kindFilter.getCode(),
            summary.attempted(), summary.succeeded(), summary.failed(), summary.itemCount());
        return summary;
    }

    private PopulateResult materializeReviews(EnrichmentTask task, TaskFetchResult fetched) {
        List<ReviewItem> reviews = reviewMapper.map(fetched.task());
        if (reviews.isEmpty()) {
            return recordNoItems(task, fetched, "reviews");
        }
        commit(task, fetched, reviews.size(),
            () -> resultRepository.upsertReviews(task.getPlaceId(), task.getTaskId(), reviews));
        reviewStatsService.recompute(task.getPlaceId());
        return PopulateResult.ok("Upserted " + reviews.size() + " reviews.", reviews.size());
    }

    private PopulateResult materializeBusinessInfo(EnrichmentTask task, TaskFetchResult fetched) {
        Optional<BusinessInfoSnapshot> parsed = businessInfoMapper.map(fetched.task());
        if (parsed.isEmpty()) {
            return recordNoItems(task, fetched, "business info");
        }
        BusinessInfoSnapshot snapshot = parsed.get();
        Place place = placeRepository.findById(task.getPlaceId()).orElse(null);
        String logoPath = assetCacheService.resolve(snapshot.logoUrl(), place == null ? null : place.getLogoLocalPath());
        String photoPath = assetCacheService.resolve(snapshot.mainPhotoUrl(), place == null ? null : place.getMainPhotoLocalPath());
        commit(task, fetched, 1,
            () -> resultRepository.upsertBusinessInfo(task.getPlaceId(), snapshot, logoPath, photoPath));
        return PopulateResult.ok("Business info updated.", 1);
    }

    private PopulateResult materializeUpdates(EnrichmentTask task, TaskFetchResult fetched) {
        List<BusinessUpdateItem> updates = updateMapper.map(fetched.task());
        if (updates.isEmpty()) {
            return recordNoItems(task, fetched, "updates");
        }
        commit(task, fetched, updates.size(),
            () -> resultRepository.upsertUpdates(task.getPlaceId(), task.getTaskId(), updates));
        return PopulateResult.ok("Upserted " + updates.size() + " updates.", updates.size());
    }

    private PopulateResult materializeQuestionAnswers(EnrichmentTask task, TaskFetchResult fetched) {
        List<QuestionAnswerItem> pairs = questionAnswerMapper.map(fetched.task());
        if (pairs.isEmpty()) {
            return recordNoItems(task, fetched, "questions");
        }
        commit(task, fetched, pairs.size(),
            () -> resultRepository.upsertQuestionAnswers(task.getPlaceId(), task.getTaskId(), pairs));
        return PopulateResult.ok("Upserted " + pairs.size() + " question/answer pairs.", pairs.size());
    }

    private PopulateResult materializeSocialProfiles(EnrichmentTask task, TaskFetchResult fetched) {
        Map<SocialPlatform, String> profiles = socialProfileExtractor.extract(fetched.task().path("result"));
        if (profiles.isEmpty()) {
            return recordNoItems(task, fetched, "social profiles");
        }
        commit(task, fetched, profiles.size(),
            () -> resultRepository.mergeSocialProfiles(task.getPlaceId(), task.getTaskId(), profiles));
        return PopulateResult.ok("Found " + profiles.size() + " social profiles.", profiles.size());
    }

    /**
     * Writes items then the Populated status in one transaction
     */
    private void commit(EnrichmentTask task, TaskFetchResult fetched, int itemCount, IntSupplier writeItems) {
        ErrorHandlingUtils.throwIfCancelled();
        transactionOperations.executeWithoutResult(status -> {
            int written = writeItems.getAsInt();
            taskRepository.markPopulated(task.getTaskId(), fetched.statusCode(), fetched.statusMessage(), itemCount);
            logger.debug("Task {} wrote {} rows for {} items.", task.getTaskId(), written, itemCount);
        });
        logger.info("Task {} ({}) populated with {} items for place {}.",
            task.getTaskId(), task.getKind().getCode(), itemCount, task.getPlaceId());
    }

    private PopulateResult recordNoItems(EnrichmentTask task, TaskFetchResult fetched, String label) {
        ErrorHandlingUtils.throwIfCancelled();
        if (fetched.completed()) {
            taskRepository.markTerminalNoData(task.getTaskId(), fetched.statusCode(), fetched.statusMessage());
            logger.info("Task {} completed with no {}.", task.getTaskId(), label);
            return PopulateResult.ok("Task completed with no " + label + ".", 0);
        }
        if (task.getStatus().isTerminal()) {
            taskRepository.recordPopulateFailure(task.getTaskId(), "Re-populate returned no " + label + " before completion.");
            return PopulateResult.failed("Task " + task.getTaskId() + " returned no " + label + " yet.");
        }
        taskRepository.markPopulateDeferred(task.getTaskId(), fetched.statusCode(), fetched.statusMessage());
        logger.info("Task {} still processing ({} {}); left Pending.",
            task.getTaskId(), fetched.statusCode(), fetched.statusMessage());
        return PopulateResult.failed("Task " + task.getTaskId() + " is still processing.");
    }

    private PopulateResult recordTerminalFailure(EnrichmentTask task, TaskFetchResult fetched) {
        ErrorHandlingUtils.throwIfCancelled();
        String message = fetched.statusMessage() == null ? "Provider reported failure" : fetched.statusMessage();
        if (task.getStatus().isTerminal()) {
            taskRepository.recordPopulateFailure(task.getTaskId(), message);
        } else {
            taskRepository.markError(task.getTaskId(), fetched.statusCode(), message);
        }
        logger.warn("Task {} failed at provider: {} {}", task.getTaskId(), fetched.statusCode(), message);
        return PopulateResult.failed("Task " + task.getTaskId() + " failed: " + fetched.statusCode() + " " + message);
    }
}
