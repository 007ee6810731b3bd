/**
 * Reconciles the task ledger against provider ready-lists
 *
 * @author William Callahan
 *
 * Features:
 * - Fetches each polled kind's ready-list independently; one failing kind never blocks the others
 * - Advances active tasks to Ready (ready_at stamped once) or from Created to Pending
 * - Adopts ready jobs the ledger never recorded, using the tag as place id
 */

package com.williamcallahan.local_seo_engine.service.enrichment;

import com.williamcallahan.local_seo_engine.model.EnrichmentTask;
import com.williamcallahan.local_seo_engine.model.Place;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.model.TaskStatus;
import com.williamcallahan.local_seo_engine.repository.EnrichmentTaskRepository;
import com.williamcallahan.local_seo_engine.repository.PlaceRepository;
import com.williamcallahan.local_seo_engine.service.gateway.EnrichmentGateway;
import com.williamcallahan.local_seo_engine.types.ReadyTask;
import com.williamcallahan.local_seo_engine.util.ErrorHandlingUtils;
import com.williamcallahan.local_seo_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Service
public class TaskReconciliationService {

    private static final Logger logger = LoggerFactory.getLogger(TaskReconciliationService.class);

    private final EnrichmentGateway gateway;
    private final EnrichmentTaskRepository taskRepository;
    private final PlaceRepository placeRepository;

    public TaskReconciliationService(EnrichmentGateway gateway,
                                     EnrichmentTaskRepository taskRepository,
                                     PlaceRepository placeRepository) {
        this.gateway = gateway;
        this.taskRepository = taskRepository;
        this.placeRepository = placeRepository;
    }

    /**
     * Runs one reconciliation pass.
     *
     * @return number of ledger rows touched
     */
    public int refreshTaskStatuses() {
        if (!gateway.isConfigured()) {
            logger.warn("Skipping task reconciliation: DataForSEO credentials are not configured.");
            return 0;
        }
        Instant start = Instant.now();
        List<TaskKind> polledKinds = Arrays.stream(TaskKind.values()).filter(TaskKind::isPolled).toList();

        Map<TaskKind, Map<String, ReadyTask>> readyByKind = new EnumMap<>(TaskKind.class);
        for (TaskKind kind : polledKinds) {
            ErrorHandlingUtils.throwIfCancelled();
            readyByKind.put(kind, fetchReady(kind));
        }

        List<EnrichmentTask> active = taskRepository.findActive(polledKinds);
        Set<String> knownIds = new HashSet<>();
        int touched = 0;
        int readied = 0;
        for (EnrichmentTask task : active) {
            ErrorHandlingUtils.throwIfCancelled();
            knownIds.add(task.getTaskId());
            ReadyTask ready = readyByKind.getOrDefault(task.getKind(), Collections.emptyMap()).get(task.getTaskId());
            if (ready != null) {
                String endpoint = ValidationUtils.firstNonBlank(ready.endpoint(), task.getEndpoint(),
                    gateway.taskGetPath(task.getKind(), task.getTaskId()));
                int updated = taskRepository.markReady(task.getTaskId(), endpoint, ready.statusCode(), ready.statusMessage());
                touched += updated;
                readied += updated;
            } else if (task.getStatus() == TaskStatus.CREATED || task.getStatus() == TaskStatus.PENDING) {
                touched += taskRepository.markPending(task.getTaskId());
            }
        }

        int adopted = 0;
        for (Map<String, ReadyTask> ready : readyByKind.values()) {
            for (ReadyTask entry : ready.values()) {
                ErrorHandlingUtils.throwIfCancelled();
                if (!knownIds.contains(entry.taskId()) && adopt(entry)) {
                    adopted++;
                }
            }
        }
        touched += adopted;

        logger.info("Task reconciliation finished in {}ms (active={}, ready={}, adopted={}, touched={}).",
            Duration.between(start, Instant.now()).toMillis(), active.size(), readied, adopted, touched);
        return touched;
    }

    private Map<String, ReadyTask> fetchReady(TaskKind kind) {
        try {
            Map<String, ReadyTask> byId = new LinkedHashMap<>();
            for (ReadyTask entry : gateway.listReady(kind)) {
                byId.putIfAbsent(entry.taskId(), entry);
            }
            return byId;
        } catch (RuntimeException e) {
            ErrorHandlingUtils.rethrowIfCancelled(e);
            logger.warn("tasks_ready fetch failed for {}; continuing with other kinds: {}", kind.getCode(), e.getMessage());
            return Collections.emptyMap();
        }
    }

    /**
     * Inserts a Ready row for a job the ledger has never seen. Requires a tag naming a known place.
     */
    private boolean adopt(ReadyTask entry) {
        if (!ValidationUtils.hasText(entry.tag())) {
            logger.debug("Ready task {} has no tag; cannot adopt.", entry.taskId());
            return false;
        }
        if (taskRepository.findById(entry.taskId()).isPresent()) {
            return false;
        }
        Optional<Place> place = placeRepository.findById(entry.tag());
        if (place.isEmpty()) {
            logger.debug("Ready task {} tagged with unknown place {}; not adopting.", entry.taskId(), entry.tag());
            return false;
        }
        EnrichmentTask adoptedTask = EnrichmentTask.builder()
            .taskId(entry.taskId())
            .kind(entry.kind())
            .placeId(place.get().getPlaceId())
            .locationName(place.get().getSearchLocationName())
            .status(TaskStatus.READY)
            .statusCode(entry.statusCode())
            .statusMessage(entry.statusMessage())
            .endpoint(ValidationUtils.firstNonBlank(entry.endpoint(), gateway.taskGetPath(entry.kind(), entry.taskId())))
            .build();
        boolean inserted = taskRepository.insertIfAbsent(adoptedTask);
        if (inserted) {
            logger.info("Adopted untracked ready task {} ({}) for place {}.",
                entry.taskId(), entry.kind().getCode(), entry.tag());
        }
        return inserted;
    }
}
