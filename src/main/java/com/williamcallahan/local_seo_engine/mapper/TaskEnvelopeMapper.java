/**
 * Parser for DataForSEO response envelopes
 *
 * @author William Callahan
 *
 * Features:
 * - Reads task_post replies into {@link TaskSubmission}
 * - Reads tasks_ready replies into {@link ReadyTask} entries, status copied from the parent task
 * - Reads task_get replies and postback bodies into {@link TaskFetchResult}
 * - Unreadable bodies become "not completed" results instead of exceptions
 */

package com.williamcallahan.local_seo_engine.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.types.ReadyTask;
import com.williamcallahan.local_seo_engine.types.TaskFetchResult;
import com.williamcallahan.local_seo_engine.types.TaskSubmission;
import com.williamcallahan.local_seo_engine.util.JsonNodeUtils;
import com.williamcallahan.local_seo_engine.util.ProviderStatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class TaskEnvelopeMapper {

    private static final Logger logger = LoggerFactory.getLogger(TaskEnvelopeMapper.class);

    private final ObjectMapper objectMapper;

    public TaskEnvelopeMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.warn("Unreadable DataForSEO payload ({} chars): {}", body.length(), e.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }

    /**
     * Parses a task_post reply. Task-level status wins over the envelope status.
     */
    public TaskSubmission toSubmission(String body) {
        JsonNode root = readTree(body);
        JsonNode task = firstTask(root);
        Integer code = JsonNodeUtils.integer(task, "status_code");
        String message = JsonNodeUtils.text(task, "status_message");
        if (code == null) {
            code = JsonNodeUtils.integer(root, "status_code");
            message = JsonNodeUtils.text(root, "status_message");
        }
        return new TaskSubmission(JsonNodeUtils.text(task, "id"), code, message);
    }

    /**
     * Parses a tasks_ready reply. The list is only trusted when the envelope status is exactly 20000.
     */
    public List<ReadyTask> toReadyTasks(TaskKind kind, String body) {
        JsonNode root = readTree(body);
        Integer rootCode = JsonNodeUtils.integer(root, "status_code");
        List<ReadyTask> ready = new ArrayList<>();
        if (rootCode == null || rootCode != ProviderStatusCodes.OK) {
            logger.warn("tasks_ready for {} returned status {} ({}); ignoring list.",
                kind.getCode(), rootCode, JsonNodeUtils.text(root, "status_message"));
            return ready;
        }
        for (JsonNode task : JsonNodeUtils.elements(root, "tasks")) {
            Integer code = JsonNodeUtils.integer(task, "status_code");
            String message = JsonNodeUtils.text(task, "status_message");
            for (JsonNode item : JsonNodeUtils.elements(task, "result")) {
                String id = JsonNodeUtils.text(item, "id");
                if (id == null) {
                    continue;
                }
                ready.add(new ReadyTask(
                    id,
                    kind,
                    JsonNodeUtils.text(item, "endpoint", "endpoint_advanced", "endpoint_regular"),
                    code,
                    message,
                    JsonNodeUtils.text(item, "tag")));
            }
        }
        return ready;
    }

    /**
     * Parses a task_get reply or postback body.
     * Completion requires a success status and a result array; a successful task whose
     * result is still null is reported as not completed.
     */
    public TaskFetchResult toFetchResult(String body) {
        JsonNode root = readTree(body);
        JsonNode task = firstTask(root);
        Integer code = JsonNodeUtils.integer(task, "status_code");
        String message = JsonNodeUtils.text(task, "status_message");
        if (code == null) {
            code = JsonNodeUtils.integer(root, "status_code");
            message = JsonNodeUtils.text(root, "status_message");
        }
        JsonNode result = task.path("result");
        boolean completed = ProviderStatusCodes.isSuccess(code) && result.isArray();
        Integer resultCount = JsonNodeUtils.integer(task, "result_count");
        if (resultCount == null && result.isArray()) {
            resultCount = result.size();
        }
        String taskId = JsonNodeUtils.text(task, "id");
        if (taskId == null) {
            taskId = JsonNodeUtils.text(root.path("result").path(0), "id");
        }
        String tag = JsonNodeUtils.text(task.path("data"), "tag");
        String endpoint = JsonNodeUtils.text(result.path(0), "endpoint", "endpoint_advanced", "endpoint_regular");
        return new TaskFetchResult(taskId, tag, code, message, resultCount, endpoint, completed, task, body);
    }

    private JsonNode firstTask(JsonNode root) {
        JsonNode tasks = root.path("tasks");
        if (tasks.isArray() && tasks.size() > 0) {
            return tasks.get(0);
        }
        return MissingNode.getInstance();
    }
}
