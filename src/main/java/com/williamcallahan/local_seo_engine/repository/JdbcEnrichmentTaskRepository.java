/**
 * Postgres implementation of the enrichment task ledger
 *
 * @author William Callahan
 *
 * Features:
 * - Single-row, auto-committing upserts keyed by provider task id
 * - Terminal-status guards expressed in SQL so concurrent writers cannot regress a task
 * - ready_at stamped once via COALESCE
 */

package com.williamcallahan.local_seo_engine.repository;

import com.williamcallahan.local_seo_engine.model.EnrichmentTask;
import com.williamcallahan.local_seo_engine.model.TaskKind;
import com.williamcallahan.local_seo_engine.model.TaskStatus;
import com.williamcallahan.local_seo_engine.util.JdbcUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class JdbcEnrichmentTaskRepository implements EnrichmentTaskRepository {

    static final String TERMINAL_STATUSES = "('Populated', 'CompletedNoData', 'Error')";
    static final String ACTIVE_STATUSES = "('Created', 'Pending', 'Ready')";
    static final String POLLED_KINDS = Arrays.stream(TaskKind.values())
        .filter(TaskKind::isPolled)
        .map(kind -> "'" + kind.getCode() + "'")
        .collect(Collectors.joining(", ", "(", ")"));

    private static final String SELECT_COLUMNS = """
        SELECT task_id, task_kind, place_id, location_name, status, status_code, status_message, endpoint,
               created_at, last_checked_at, ready_at, populated_at, last_attempted_populate_at,
               last_populate_count, callback_received_at, callback_task_id, last_error
        FROM enrichment_task
        """;

    private static final RowMapper<EnrichmentTask> ROW_MAPPER = (rs, rowNum) -> EnrichmentTask.builder()
        .taskId(rs.getString("task_id"))
        .kind(TaskKind.fromCode(rs.getString("task_kind")))
        .placeId(rs.getString("place_id"))
        .locationName(rs.getString("location_name"))
        .status(TaskStatus.fromDbValue(rs.getString("status")))
        .statusCode(JdbcUtils.getInteger(rs, "status_code"))
        .statusMessage(rs.getString("status_message"))
        .endpoint(rs.getString("endpoint"))
        .createdAt(JdbcUtils.getInstant(rs, "created_at"))
        .lastCheckedAt(JdbcUtils.getInstant(rs, "last_checked_at"))
        .readyAt(JdbcUtils.getInstant(rs, "ready_at"))
        .populatedAt(JdbcUtils.getInstant(rs, "populated_at"))
        .lastAttemptedPopulateAt(JdbcUtils.getInstant(rs, "last_attempted_populate_at"))
        .lastPopulateCount(JdbcUtils.getInteger(rs, "last_populate_count"))
        .callbackReceivedAt(JdbcUtils.getInstant(rs, "callback_received_at"))
        .callbackTaskId(rs.getString("callback_task_id"))
        .lastError(rs.getString("last_error"))
        .build();

    private final JdbcTemplate jdbcTemplate;

    public JdbcEnrichmentTaskRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void upsert(EnrichmentTask task) {
        jdbcTemplate.update("""
            INSERT INTO enrichment_task (task_id, task_kind, place_id, location_name, status, status_code,
                                         status_message, endpoint, last_error, created_at, last_checked_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, NOW(), NOW())
            ON CONFLICT (task_id) DO UPDATE SET
                task_kind = EXCLUDED.task_kind,
                place_id = EXCLUDED.place_id,
                location_name = COALESCE(EXCLUDED.location_name, enrichment_task.location_name),
                status = CASE WHEN enrichment_task.status IN %s THEN enrichment_task.status ELSE EXCLUDED.status END,
                status_code = EXCLUDED.status_code,
                status_message = EXCLUDED.status_message,
                endpoint = COALESCE(EXCLUDED.endpoint, enrichment_task.endpoint),
                last_error = EXCLUDED.last_error,
                last_checked_at = NOW()
            """.formatted(TERMINAL_STATUSES),
            task.getTaskId(),
            task.getKind().getCode(),
            task.getPlaceId(),
            task.getLocationName(),
            task.getStatus().getDbValue(),
            task.getStatusCode(),
            task.getStatusMessage(),
            task.getEndpoint(),
            task.getLastError());
    }

    @Override
    public boolean insertIfAbsent(EnrichmentTask task) {
        return JdbcUtils.executeUpdate(jdbcTemplate, """
            INSERT INTO enrichment_task (task_id, task_kind, place_id, location_name, status, status_code,
                                         status_message, endpoint, created_at, last_checked_at, ready_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, NOW(), NOW(), CASE WHEN ? = 'Ready' THEN NOW() END)
            ON CONFLICT (task_id) DO NOTHING
            """,
            task.getTaskId(),
            task.getKind().getCode(),
            task.getPlaceId(),
            task.getLocationName(),
            task.getStatus().getDbValue(),
            task.getStatusCode(),
            task.getStatusMessage(),
            task.getEndpoint(),
            task.getStatus().getDbValue());
    }

    @Override
    public Optional<EnrichmentTask> findById(String taskId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate, SELECT_COLUMNS + " WHERE task_id = ?", ROW_MAPPER, taskId);
    }

    @Override
    public List<EnrichmentTask> findActive(Collection<TaskKind> kinds) {
        if (kinds == null || kinds.isEmpty()) {
            return Collections.emptyList();
        }
        String placeholders = kinds.stream().map(k -> "?").collect(Collectors.joining(", "));
        Object[] args = kinds.stream().map(TaskKind::getCode).toArray();
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE status IN " + ACTIVE_STATUSES + " AND task_kind IN (" + placeholders + ") ORDER BY created_at",
            ROW_MAPPER, args);
    }

    @Override
    public List<EnrichmentTask> findByStatus(TaskStatus status, TaskKind kindFilter) {
        if (kindFilter == null) {
            return jdbcTemplate.query(SELECT_COLUMNS + " WHERE status = ? ORDER BY created_at",
                ROW_MAPPER, status.getDbValue());
        }
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE status = ? AND task_kind = ? ORDER BY created_at",
            ROW_MAPPER, status.getDbValue(), kindFilter.getCode());
    }

    @Override
    public List<EnrichmentTask> findLatest(int limit, TaskKind kindFilter, TaskStatus statusFilter) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append(" WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (kindFilter != null) {
            sql.append(" AND task_kind = ?");
            args.add(kindFilter.getCode());
        }
        if (statusFilter != null) {
            sql.append(" AND status = ?");
            args.add(statusFilter.getDbValue());
        }
        sql.append(" ORDER BY CASE WHEN task_kind = '").append(TaskKind.BUSINESS_INFO.getCode())
            .append("' THEN 0 ELSE 1 END, created_at DESC LIMIT ?");
        args.add(limit);
        return jdbcTemplate.query(sql.toString(), ROW_MAPPER, args.toArray());
    }

    @Override
    public Map<TaskKind, EnrichmentTask> findLatestByKind(String placeId) {
        List<EnrichmentTask> rows = jdbcTemplate.query(
            SELECT_COLUMNS.replace("SELECT ", "SELECT DISTINCT ON (task_kind) ")
                + " WHERE place_id = ? ORDER BY task_kind, created_at DESC",
            ROW_MAPPER, placeId);
        Map<TaskKind, EnrichmentTask> latest = new EnumMap<>(TaskKind.class);
        for (EnrichmentTask row : rows) {
            latest.put(row.getKind(), row);
        }
        return latest;
    }

    @Override
    public Optional<EnrichmentTask> findMostRecentActiveForPlace(String placeId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            SELECT_COLUMNS + " WHERE place_id = ? AND status IN " + ACTIVE_STATUSES
                + " AND task_kind IN " + POLLED_KINDS + " ORDER BY created_at DESC LIMIT 1",
            ROW_MAPPER, placeId);
    }

    @Override
    public int markReady(String taskId, String endpoint, Integer statusCode, String statusMessage) {
        return jdbcTemplate.update("""
            UPDATE enrichment_task
            SET status = 'Ready',
                endpoint = COALESCE(?, endpoint),
                status_code = COALESCE(?, status_code),
                status_message = COALESCE(?, status_message),
                ready_at = COALESCE(ready_at, NOW()),
                last_error = NULL,
                last_checked_at = NOW()
            WHERE task_id = ? AND status NOT IN %s
            """.formatted(TERMINAL_STATUSES),
            endpoint, statusCode, statusMessage, taskId);
    }

    @Override
    public int markPending(String taskId) {
        return jdbcTemplate.update(
            "UPDATE enrichment_task SET status = 'Pending', last_checked_at = NOW() WHERE task_id = ? AND status NOT IN "
                + TERMINAL_STATUSES,
            taskId);
    }

    @Override
    public int markPopulateDeferred(String taskId, Integer statusCode, String statusMessage) {
        return jdbcTemplate.update("""
            UPDATE enrichment_task
            SET status = 'Pending',
                status_code = COALESCE(?, status_code),
                status_message = COALESCE(?, status_message),
                last_populate_count = 0,
                last_attempted_populate_at = NOW(),
                last_checked_at = NOW()
            WHERE task_id = ? AND status NOT IN %s
            """.formatted(TERMINAL_STATUSES),
            statusCode, statusMessage, taskId);
    }

    @Override
    public int markPopulated(String taskId, Integer statusCode, String statusMessage, int itemCount) {
        return markCompleted(taskId, TaskStatus.POPULATED, statusCode, statusMessage, itemCount);
    }

    @Override
    public int markTerminalNoData(String taskId, Integer statusCode, String statusMessage) {
        return markCompleted(taskId, TaskStatus.TERMINAL_NO_DATA, statusCode, statusMessage, 0);
    }

    private int markCompleted(String taskId, TaskStatus status, Integer statusCode, String statusMessage, int itemCount) {
        return jdbcTemplate.update("""
            UPDATE enrichment_task
            SET status = ?,
                status_code = COALESCE(?, status_code),
                status_message = COALESCE(?, status_message),
                last_populate_count = ?,
                populated_at = NOW(),
                last_attempted_populate_at = NOW(),
                last_error = NULL,
                last_checked_at = NOW()
            WHERE task_id = ? AND status <> 'Error'
            """,
            status.getDbValue(), statusCode, statusMessage, itemCount, taskId);
    }

    @Override
    public int markError(String taskId, Integer statusCode, String statusMessage) {
        return jdbcTemplate.update("""
            UPDATE enrichment_task
            SET status = 'Error',
                status_code = COALESCE(?, status_code),
                status_message = COALESCE(?, status_message),
                last_error = ?,
                last_checked_at = NOW()
            WHERE task_id = ? AND status NOT IN %s
            """.formatted(TERMINAL_STATUSES),
            statusCode, statusMessage, statusMessage, taskId);
    }

    @Override
    public int recordPopulateFailure(String taskId, String error) {
        return jdbcTemplate.update(
            "UPDATE enrichment_task SET last_error = ?, last_attempted_populate_at = NOW(), last_checked_at = NOW() WHERE task_id = ?",
            error, taskId);
    }

    @Override
    public int recordCallback(String taskId, String callbackTaskId, TaskStatus status, Integer statusCode, String statusMessage,
                              String endpoint) {
        String terminal = TERMINAL_STATUSES;
        return jdbcTemplate.update("""
            UPDATE enrichment_task
            SET callback_received_at = NOW(),
                callback_task_id = ?,
                endpoint = COALESCE(?, endpoint),
                last_checked_at = NOW(),
                status = CASE WHEN status IN %1$s THEN status ELSE ? END,
                status_code = CASE WHEN status IN %1$s THEN status_code ELSE COALESCE(?, status_code) END,
                status_message = CASE WHEN status IN %1$s THEN status_message ELSE COALESCE(?, status_message) END,
                ready_at = CASE WHEN status NOT IN %1$s AND ? = 'Ready' THEN COALESCE(ready_at, NOW()) ELSE ready_at END,
                last_error = CASE WHEN status NOT IN %1$s AND ? = 'Error' THEN ? ELSE last_error END
            WHERE task_id = ?
            """.formatted(terminal),
            callbackTaskId,
            endpoint,
            status.getDbValue(),
            statusCode,
            statusMessage,
            status.getDbValue(),
            status.getDbValue(),
            statusMessage,
            taskId);
    }

    @Override
    public int deleteErrors(TaskKind kindFilter) {
        if (kindFilter == null) {
            return jdbcTemplate.update("DELETE FROM enrichment_task WHERE status = 'Error'");
        }
        return jdbcTemplate.update("DELETE FROM enrichment_task WHERE status = 'Error' AND task_kind = ?", kindFilter.getCode());
    }
}
