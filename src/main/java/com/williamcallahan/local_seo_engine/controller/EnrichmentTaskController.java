/**
 * REST Controller for enrichment task administration
 *
 * @author William Callahan
 *
 * Features:
 * - Lists the latest ledger rows with kind and status filters
 * - Purges Error rows
 * - Populates a single task or every Ready task
 * - Triggers a reconciliation pass on demand
 * - Starts background enrichment batches for a list of places
 */

package com.williamcallahan.local_seo_engine.controller;

import com.williamcallahan.local_seo_engine.controller.support.ErrorResponseUtils;
import com.williamcallahan.local_seo_engine.dto.EnrichPlacesRequest;
import com.williamcallahan.local_seo_engine.model.EnrichmentTask;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.model.TaskStatus;
import com.williamcallahan.local_seo_engine.service.enrichment.EnrichmentOrchestrator;
import com.williamcallahan.local_seo_engine.types.BulkPopulateSummary;
import com.williamcallahan.local_seo_engine.types.PopulateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/admin/enrichment")
public class EnrichmentTaskController {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentTaskController.class);
    private static final int DEFAULT_LIMIT = 200;

    private final EnrichmentOrchestrator orchestrator;

    public EnrichmentTaskController(EnrichmentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Latest ledger rows, business info first
     *
     * @param limit maximum rows, clamped to the configured maximum
     * @param kind optional kind code or alias
     * @param status optional status name
     * @return 200 with the rows, or 400 for an unknown kind or status
     */
    @GetMapping("/tasks")
    public ResponseEntity<?> latestTasks(@RequestParam(name = "limit", required = false) Integer limit,
                                         @RequestParam(name = "kind", required = false) String kind,
                                         @RequestParam(name = "status", required = false) String status) {
        Optional<TaskKind> kindFilter = TaskKind.normalize(kind);
        if (isFilterGiven(kind) && kindFilter.isEmpty()) {
            return unknownKind(kind);
        }
        Optional<TaskStatus> statusFilter = TaskStatus.normalize(status);
        if (isFilterGiven(status) && statusFilter.isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorResponseUtils.errorBody("Unknown task status", status));
        }
        List<EnrichmentTask> tasks = orchestrator.getLatestTasks(limit == null ? DEFAULT_LIMIT : limit,
            kindFilter.orElse(null), statusFilter.orElse(null));
        return ResponseEntity.ok(tasks);
    }

    @DeleteMapping("/tasks/errors")
    public ResponseEntity<?> deleteErrorTasks(@RequestParam(name = "kind", required = false) String kind) {
        Optional<TaskKind> kindFilter = TaskKind.normalize(kind);
        if (isFilterGiven(kind) && kindFilter.isEmpty()) {
            return unknownKind(kind);
        }
        int deleted = orchestrator.deleteErrorTasks(kindFilter.orElse(null));
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }

    @PostMapping("/tasks/{taskId}/populate")
    public ResponseEntity<?> populateTask(@PathVariable("taskId") String taskId) {
        if (orchestrator.findTask(taskId).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponseUtils.errorBody("Task " + taskId + " not found."));
        }
        PopulateResult result = orchestrator.populateTask(taskId);
        logger.info("Admin populate of task {}: {} ({} items)", taskId, result.message(), result.itemCount());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/tasks/populate-ready")
    public ResponseEntity<?> populateReady(@RequestParam(name = "kind", required = false) String kind) {
        Optional<TaskKind> kindFilter = TaskKind.normalize(kind);
        if (isFilterGiven(kind) && kindFilter.isEmpty()) {
            return unknownKind(kind);
        }
        BulkPopulateSummary summary = orchestrator.populateReadyTasks(kindFilter.orElse(null));
        return ResponseEntity.ok(summary);
    }

    @PostMapping("/tasks/refresh")
    public ResponseEntity<?> refreshTaskStatuses() {
        int touched = orchestrator.refreshTaskStatuses();
        return ResponseEntity.ok(Map.of("touched", touched));
    }

    /**
     * Starts a background enrichment batch
     *
     * @return 202 once the batch is queued, 400 for bad input, 503 when the executor is saturated
     */
    @PostMapping("/places/enrich")
    public ResponseEntity<?> enrichPlaces(@RequestBody EnrichPlacesRequest request) {
        if (request == null || request.placeIds() == null || request.placeIds().isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorResponseUtils.errorBody("placeIds must not be empty"));
        }
        List<TaskKind> kinds = new ArrayList<>();
        if (request.kinds() != null) {
            for (String raw : request.kinds()) {
                if (!isFilterGiven(raw)) {
                    continue;
                }
                Optional<TaskKind> kind = TaskKind.normalize(raw);
                if (kind.isEmpty()) {
                    return unknownKind(raw);
                }
                kinds.add(kind.get());
            }
        }
        try {
            orchestrator.enrichPlacesInBackground(request.placeIds(), kinds);
        } catch (TaskRejectedException e) {
            logger.warn("Enrichment batch rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponseUtils.errorBody("Enrichment executor is busy", e.getMessage()));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("queuedPlaces", request.placeIds().size());
        body.put("kinds", kinds.isEmpty() ? "all" : kinds.stream().map(TaskKind::getCode).toList());
        return ResponseEntity.accepted().body(body);
    }

    /**
     * Blank and "all" mean no filter
     */
    private static boolean isFilterGiven(String raw) {
        return raw != null && !raw.isBlank() && !"all".equalsIgnoreCase(raw.trim());
    }

    private static ResponseEntity<Map<String, String>> unknownKind(String kind) {
        return ResponseEntity.badRequest().body(ErrorResponseUtils.errorBody("Unknown task kind", kind));
    }
}
