package com.williamcallahan.local_seo_engine.service.gateway;

import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.types.ReadyTask;
import com.williamcallahan.local_seo_engine.types.SubmitRequest;
import com.williamcallahan.local_seo_engine.types.TaskFetchResult;
import com.williamcallahan.local_seo_engine.types.TaskSubmission;

import java.util.List;

/**
 * Contract for the remote enrichment API: submit, list ready, fetch.
 * Implementations throw {@link EnrichmentGatewayException} for transport failures and
 * report provider-level failures through status codes.
 */
public interface EnrichmentGateway {

    boolean isConfigured();

    TaskSubmission submit(TaskKind kind, SubmitRequest request);

    List<ReadyTask> listReady(TaskKind kind);

    TaskFetchResult fetch(String endpoint);

    /**
     * Submits and fetches a non-polled kind in one call.
     */
    TaskFetchResult fetchLive(TaskKind kind, SubmitRequest request);

    /**
     * Default fetch path for a task when the provider did not supply one.
     */
    String taskGetPath(TaskKind kind, String taskId);
}
