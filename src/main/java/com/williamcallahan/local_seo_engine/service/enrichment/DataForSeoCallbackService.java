/**
 * Handles DataForSEO postbacks
 *
 * @author William Callahan
 *
 * Features:
 * - Resolves the task by payload id, then the id query parameter, then the newest active polled task for the tag
 * - Applies the payload status to the ledger (success Ready, failure Error, otherwise Pending)
 * - Materializes Ready payloads immediately instead of waiting for the next reconciliation
 * - Orphaned callbacks are rejected so the provider redelivers
 */

package com.williamcallahan.local_seo_engine.service.enrichment;

import com.williamcallahan.local_seo_engine.config.DataForSeoProperties;
import com.williamcallahan.local_seo_engine.mapper.TaskEnvelopeMapper;
import com.williamcallahan.local_seo_engine.model.EnrichmentTask;
import com.williamcallahan.local_seo_engine.model.TaskStatus;
import com.williamcallahan.local_seo_engine.repository.EnrichmentTaskRepository;
import com.williamcallahan.local_seo_engine.types.CallbackResult;
import com.williamcallahan.local_seo_engine.types.PopulateResult;
import com.williamcallahan.local_seo_engine.types.TaskFetchResult;
import com.williamcallahan.local_seo_engine.util.ErrorHandlingUtils;
import com.williamcallahan.local_seo_engine.util.ProviderStatusCodes;
import com.williamcallahan.local_seo_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class DataForSeoCallbackService {

    private static final Logger logger = LoggerFactory.getLogger(DataForSeoCallbackService.class);

    private final EnrichmentTaskRepository taskRepository;
    private final TaskResultMaterializer materializer;
    private final TaskEnvelopeMapper envelopeMapper;
    private final DataForSeoProperties dataForSeoProperties;

    public DataForSeoCallbackService(EnrichmentTaskRepository taskRepository,
                                     TaskResultMaterializer materializer,
                                     TaskEnvelopeMapper envelopeMapper,
                                     DataForSeoProperties dataForSeoProperties) {
        this.taskRepository = taskRepository;
        this.materializer = materializer;
        this.envelopeMapper = envelopeMapper;
        this.dataForSeoProperties = dataForSeoProperties;
    }

    public CallbackResult handle(String taskIdHint, String tagHint, String payload) {
        if (!ValidationUtils.hasText(payload)) {
            return CallbackResult.rejected("Empty payload.");
        }
        TaskFetchResult fetched = envelopeMapper.toFetchResult(payload);

        Optional<EnrichmentTask> resolved = findById(fetched.taskId()).or(() -> findById(taskIdHint));
        String tag = ValidationUtils.firstNonBlank(tagHint, fetched.tag());
        if (resolved.isEmpty() && tag != null) {
            resolved = taskRepository.findMostRecentActiveForPlace(tag);
        }
        if (resolved.isEmpty()) {
            logger.warn("Orphaned callback rejected (payloadId={}, id={}, tag={}).", fetched.taskId(), taskIdHint, tag);
            return CallbackResult.rejected("No task found for callback (id=" + ValidationUtils.firstNonBlank(fetched.taskId(), taskIdHint)
                + ", tag=" + tag + ").");
        }

        EnrichmentTask task = resolved.get();
        String callbackTaskId = ValidationUtils.firstNonBlank(fetched.taskId(), taskIdHint, task.getTaskId());
        TaskStatus reported = ProviderStatusCodes.toTaskStatus(fetched.statusCode(), dataForSeoProperties.getInProgressStatusCodes());

        int updated = taskRepository.recordCallback(task.getTaskId(), callbackTaskId, reported,
            fetched.statusCode(), fetched.statusMessage(), fetched.endpoint());
        if (updated == 0) {
            return CallbackResult.rejected("Task " + task.getTaskId() + " not found.");
        }
        if (task.getStatus().isTerminal()) {
            logger.info("Callback for task {} ignored: already {}.", task.getTaskId(), task.getStatus().getDbValue());
            return CallbackResult.accepted("Task " + task.getTaskId() + " already " + task.getStatus().getDbValue() + "; callback recorded.");
        }

        switch (reported) {
            case READY: {
                EnrichmentTask readyTask = task.toBuilder()
                    .status(TaskStatus.READY)
                    .endpoint(ValidationUtils.firstNonBlank(fetched.endpoint(), task.getEndpoint()))
                    .build();
                PopulateResult populated = populateFromCallback(readyTask, fetched);
                return CallbackResult.accepted("Task " + task.getTaskId() + " callback received. " + populated.message());
            }
            case ERROR:
                return CallbackResult.accepted("Task " + task.getTaskId() + " marked Error: " + fetched.statusMessage());
            default:
                return CallbackResult.accepted("Task " + task.getTaskId() + " callback received; still processing.");
        }
    }

    /**
     * Uses the pushed payload when it carries the result, otherwise fetches it.
     */
    private PopulateResult populateFromCallback(EnrichmentTask task, TaskFetchResult fetched) {
        try {
            return fetched.completed() ? materializer.materialize(task, fetched) : materializer.populate(task);
        } catch (RuntimeException e) {
            ErrorHandlingUtils.rethrowIfCancelled(e);
            logger.error("Callback populate failed for task {}: {}", task.getTaskId(), e.getMessage(), e);
            return PopulateResult.failed("Populate failed: " + e.getMessage());
        }
    }

    private Optional<EnrichmentTask> findById(String taskId) {
        return ValidationUtils.hasText(taskId) ? taskRepository.findById(taskId.trim()) : Optional.empty();
    }
}
