package com.williamcallahan.local_seo_engine.repository;

import com.williamcallahan.local_seo_engine.model.EnrichmentTask;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.model.TaskStatus;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable ledger of every submitted enrichment task, keyed by provider task id.
 *
 * <p>Every mutation stamps {@code lastCheckedAt}. Status-changing mutations never move a task
 * out of a terminal status: Error is final, and Populated/TerminalNoData only move between
 * each other on re-population.
 */
public interface EnrichmentTaskRepository {

    /**
     * Inserts the task, or updates the mutable fields of an existing row with the same id.
     */
    void upsert(EnrichmentTask task);

    /**
     * Inserts the task only when no row with its id exists.
     *
     * @return true when a row was inserted
     */
    boolean insertIfAbsent(EnrichmentTask task);

    Optional<EnrichmentTask> findById(String taskId);

    /**
     * Tasks not in a terminal status, oldest first.
     */
    List<EnrichmentTask> findActive(Collection<TaskKind> kinds);

    List<EnrichmentTask> findByStatus(TaskStatus status, TaskKind kindFilter);

    /**
     * Latest tasks, business info first and then newest first.
     */
    List<EnrichmentTask> findLatest(int limit, TaskKind kindFilter, TaskStatus statusFilter);

    /**
     * Most recently created task per kind for a place.
     */
    Map<TaskKind, EnrichmentTask> findLatestByKind(String placeId);

    /**
     * Newest active task of a polled kind for a place. Live kinds never receive callbacks.
     */
    Optional<EnrichmentTask> findMostRecentActiveForPlace(String placeId);

    int markReady(String taskId, String endpoint, Integer statusCode, String statusMessage);

    int markPending(String taskId);

    /**
     * Records a populate attempt that found the job still running.
     */
    int markPopulateDeferred(String taskId, Integer statusCode, String statusMessage);

    int markPopulated(String taskId, Integer statusCode, String statusMessage, int itemCount);

    int markTerminalNoData(String taskId, Integer statusCode, String statusMessage);

    int markError(String taskId, Integer statusCode, String statusMessage);

    /**
     * Stores a failure message from a populate attempt without changing status.
     */
    int recordPopulateFailure(String taskId, String error);

    /**
     * Applies a provider callback. Terminal rows only get the callback columns and a reported endpoint stamped.
     */
    int recordCallback(String taskId, String callbackTaskId, TaskStatus status, Integer statusCode, String statusMessage,
                       String endpoint);

    int deleteErrors(TaskKind kindFilter);
}
