/**
 * Entry point used by the ingestion pipeline and the admin API
 *
 * @author William Callahan
 *
 * Features:
 * - Fans out submissions across requested kinds for a batch of places, gated by the scheduling policy
 * - Runs one reconciliation pass after every batch
 * - Runs batches on the enrichment executor with cooperative cancellation
 * - Exposes ledger listing, error purge and populate operations
 */

package com.williamcallahan.local_seo_engine.service.enrichment;

import com.williamcallahan.local_seo_engine.config.EnrichmentProperties;
import com.williamcallahan.local_seo_engine.model.EnrichmentTask;
import com.williamcallahan.local_seo_engine.model.Place;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.model.TaskStatus;
import com.williamcallahan.local_seo_engine.repository.EnrichmentTaskRepository;
import com.williamcallahan.local_seo_engine.repository.PlaceRepository;
import com.williamcallahan.local_seo_engine.service.gateway.EnrichmentGateway;
import com.williamcallahan.local_seo_engine.types.BulkPopulateSummary;
import com.williamcallahan.local_seo_engine.types.CallbackResult;
import com.williamcallahan.local_seo_engine.types.PopulateResult;
import com.williamcallahan.local_seo_engine.util.ErrorHandlingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Future;

@Service
public class EnrichmentOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentOrchestrator.class);

    private final EnrichmentGateway gateway;
    private final EnrichmentTaskRepository taskRepository;
    private final PlaceRepository placeRepository;
    private final EnrichmentSchedulingPolicy schedulingPolicy;
    private final TaskSubmissionService submissionService;
    private final TaskReconciliationService reconciliationService;
    private final TaskResultMaterializer materializer;
    private final DataForSeoCallbackService callbackService;
    private final EnrichmentProperties enrichmentProperties;
    private final AsyncTaskExecutor enrichmentTaskExecutor;

    public EnrichmentOrchestrator(EnrichmentGateway gateway,
                                  EnrichmentTaskRepository taskRepository,
                                  PlaceRepository placeRepository,
                                  EnrichmentSchedulingPolicy schedulingPolicy,
                                  TaskSubmissionService submissionService,
                                  TaskReconciliationService reconciliationService,
                                  TaskResultMaterializer materializer,
                                  DataForSeoCallbackService callbackService,
                                  EnrichmentProperties enrichmentProperties,
                                  @Qualifier("enrichmentTaskExecutor") AsyncTaskExecutor enrichmentTaskExecutor) {
        this.gateway = gateway;
        this.taskRepository = taskRepository;
        this.placeRepository = placeRepository;
        this.schedulingPolicy = schedulingPolicy;
        this.submissionService = submissionService;
        this.reconciliationService = reconciliationService;
        this.materializer = materializer;
        this.callbackService = callbackService;
        this.enrichmentProperties = enrichmentProperties;
        this.enrichmentTaskExecutor = enrichmentTaskExecutor;
    }

    /**
     * Submits every requested and due kind for each place, in request order, then reconciles once.
     * Failures are logged per place; only cancellation propagates.
     *
     * @param places places to enrich
     * @param requestedKinds kinds to submit; empty or null means all kinds
     * @return number of ledger rows written
     */
    public int enrichPlaces(Collection<Place> places, Collection<TaskKind> requestedKinds) {
        if (places == null || places.isEmpty()) {
            return 0;
        }
        long start = System.currentTimeMillis();
        Set<TaskKind> kinds = normalizeKinds(requestedKinds);
        boolean configured = gateway.isConfigured();
        if (!configured) {
            logger.warn("DataForSEO credentials missing; recording error rows instead of submitting.");
        }

        int written = 0;
        int failedPlaces = 0;
        for (Place place : places) {
            ErrorHandlingUtils.throwIfCancelled();
            if (place == null || place.getPlaceId() == null) {
                continue;
            }
            try {
                // without credentials every requested kind gets an error row, regardless of staleness
                List<TaskKind> due = configured
                    ? schedulingPolicy.dueKinds(place.getPlaceId(), kinds)
                    : new ArrayList<>(kinds);
                for (TaskKind kind : due) {
                    ErrorHandlingUtils.throwIfCancelled();
                    EnrichmentTask task = submissionService.submit(place, kind);
                    written++;
                    logger.debug("Submitted {} for place {}: {} ({})", kind.getCode(), place.getPlaceId(),
                        task.getTaskId(), task.getStatus().getDbValue());
                }
            } catch (RuntimeException e) {
                ErrorHandlingUtils.rethrowIfCancelled(e);
                failedPlaces++;
                logger.error("Enrichment failed for place {}: {}", place.getPlaceId(), e.getMessage(), e);
            }
        }

        if (configured) {
            ErrorHandlingUtils.throwIfCancelled();
            try {
                reconciliationService.refreshTaskStatuses();
            } catch (RuntimeException e) {
                ErrorHandlingUtils.rethrowIfCancelled(e);
                logger.error("Post-submission reconciliation failed: {}", e.getMessage(), e);
            }
        }

        logger.info("Enrichment batch finished: places={}, rowsWritten={}, failedPlaces={}, elapsedMs={}",
            places.size(), written, failedPlaces, System.currentTimeMillis() - start);
        return written;
    }

    /**
     * Resolves the place ids and runs {@link #enrichPlaces} on the enrichment executor.
     * Cancelling the returned future interrupts the batch at its next checkpoint.
     */
    public Future<Integer> enrichPlacesInBackground(List<String> placeIds, Collection<TaskKind> requestedKinds) {
        List<String> ids = placeIds == null ? List.of() : List.copyOf(placeIds);
        Set<TaskKind> kinds = normalizeKinds(requestedKinds);
        return enrichmentTaskExecutor.submit(() -> {
            List<Place> places = new ArrayList<>();
            for (String placeId : ids) {
                Optional<Place> place = placeRepository.findById(placeId);
                if (place.isPresent()) {
                    places.add(place.get());
                } else {
                    logger.warn("Skipping unknown place {}", placeId);
                }
            }
            return enrichPlaces(places, kinds);
        });
    }

    public List<EnrichmentTask> getLatestTasks(int limit, TaskKind kindFilter, TaskStatus statusFilter) {
        int max = Math.max(1, enrichmentProperties.getLatestTasksMax());
        int clamped = Math.min(Math.max(limit, 1), max);
        return taskRepository.findLatest(clamped, kindFilter, statusFilter);
    }

    public Optional<EnrichmentTask> findTask(String taskId) {
        return taskRepository.findById(taskId);
    }

    public int deleteErrorTasks(TaskKind kindFilter) {
        int deleted = taskRepository.deleteErrors(kindFilter);
        logger.info("Deleted {} error task(s){}", deleted, kindFilter == null ? "" : " of kind " + kindFilter.getCode());
        return deleted;
    }

    public PopulateResult populateTask(String taskId) {
        return materializer.populate(taskId);
    }

    public BulkPopulateSummary populateReadyTasks(TaskKind kindFilter) {
        return materializer.populateReady(kindFilter);
    }

    public int refreshTaskStatuses() {
        return reconciliationService.refreshTaskStatuses();
    }

    public CallbackResult handleCallback(String taskIdHint, String tagHint, String payload) {
        return callbackService.handle(taskIdHint, tagHint, payload);
    }

    private static Set<TaskKind> normalizeKinds(Collection<TaskKind> requestedKinds) {
        Set<TaskKind> kinds = new LinkedHashSet<>();
        if (requestedKinds != null) {
            requestedKinds.stream().filter(kind -> kind != null).forEach(kinds::add);
        }
        if (kinds.isEmpty()) {
            kinds.addAll(Arrays.asList(TaskKind.values()));
        }
        return kinds;
    }
}
