package com.williamcallahan.local_seo_engine.types;

import com.williamcallahan.local_seo_engine.model.TaskKind;

/**
 * Entry of a provider ready-list: a finished job available for fetch. {@code tag} carries the place id.
 */
public record ReadyTask(String taskId,
                        TaskKind kind,
                        String endpoint,
                        Integer statusCode,
                        String statusMessage,
                        String tag) {
}
