/**
 * Ledger row for a single DataForSEO job
 *
 * @author William Callahan
 *
 * Features:
 * - Identity is the provider task id, or a synthetic "{kind}-err-{uuid}" for local submission failures
 * - Retains raw provider status code and message for diagnostics
 * - Caches the resolved fetch endpoint so later polls never recompute it
 * - Tracks every lifecycle timestamp (ready, populated, callback, last check)
 */

package com.williamcallahan.local_seo_engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class EnrichmentTask {

    private String taskId;
    private TaskKind kind;
    private String placeId;
    private String locationName;
    private TaskStatus status;
    private Integer statusCode;
    private String statusMessage;
    private String endpoint;
    private Instant createdAt;
    private Instant lastCheckedAt;
    private Instant readyAt;
    private Instant populatedAt;
    private Instant lastAttemptedPopulateAt;
    private Integer lastPopulateCount;
    private Instant callbackReceivedAt;
    private String callbackTaskId;
    private String lastError;

    /**
     * Builds the synthetic id used for rows that never received a provider task id
     */
    public static String syntheticErrorId(TaskKind kind) {
        return kind.getCode() + "-err-" + UUID.randomUUID();
    }
}
