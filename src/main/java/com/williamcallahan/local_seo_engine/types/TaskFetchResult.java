package com.williamcallahan.local_seo_engine.types;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Parsed task_get (or callback) envelope.
 *
 * @param taskId        provider id of the first task element, when present
 * @param tag           submitter tag (place id) of the first task element, when present
 * @param statusCode    task-level status code, falling back to the envelope code
 * @param statusMessage task-level status message
 * @param resultCount   provider reported result count
 * @param endpoint      task_get endpoint reported in the first result item, when present
 * @param completed     true only when the status is a success and the result array is present
 * @param task          the first task element, or a missing node
 * @param rawBody       body exactly as received
 */
public record TaskFetchResult(String taskId,
                              String tag,
                              Integer statusCode,
                              String statusMessage,
                              Integer resultCount,
                              String endpoint,
                              boolean completed,
                              JsonNode task,
                              String rawBody) {
}
