package com.williamcallahan.local_seo_engine.types;

/**
 * Provider reply to a task_post call
 */
public record TaskSubmission(String taskId, Integer statusCode, String statusMessage) {

    public boolean hasTaskId() {
        return taskId != null && !taskId.isBlank();
    }
}
