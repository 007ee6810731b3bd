package com.williamcallahan.local_seo_engine.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle status of an enrichment task.
 *
 * <pre>
 * Created -> Pending -> Ready -> Populated
 * Created -> Pending -> Ready -> TerminalNoData
 * Created | Pending | Ready -> Error
 * </pre>
 * Populated, TerminalNoData and Error are terminal. A terminal success may be
 * re-populated into the other terminal success, never back to an active status.
 */
public enum TaskStatus {
    CREATED("Created"),
    PENDING("Pending"),
    READY("Ready"),
    POPULATED("Populated"),
    TERMINAL_NO_DATA("CompletedNoData"),
    ERROR("Error");

    private static final Set<TaskStatus> TERMINAL = EnumSet.of(POPULATED, TERMINAL_NO_DATA, ERROR);

    private final String dbValue;

    TaskStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isTerminalSuccess() {
        return this == POPULATED || this == TERMINAL_NO_DATA;
    }

    public boolean canTransitionTo(TaskStatus next) {
        if (next == null) {
            return false;
        }
        if (next == this || !isTerminal()) {
            return true;
        }
        return isTerminalSuccess() && next.isTerminalSuccess();
    }

    public static Set<TaskStatus> terminalStatuses() {
        return EnumSet.copyOf(TERMINAL);
    }

    /**
     * Normalizes a status name, accepting both enum names and stored values
     * (including the legacy "CompletedNoReviews").
     */
    public static Optional<TaskStatus> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String compact = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
        switch (compact) {
            case "created":
                return Optional.of(CREATED);
            case "pending":
                return Optional.of(PENDING);
            case "ready":
                return Optional.of(READY);
            case "populated":
                return Optional.of(POPULATED);
            case "completednodata":
            case "completednoreviews":
            case "terminalnodata":
            case "nodata":
                return Optional.of(TERMINAL_NO_DATA);
            case "error":
                return Optional.of(ERROR);
            default:
                return Optional.empty();
        }
    }

    public static TaskStatus fromDbValue(String value) {
        return normalize(value).orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + value));
    }
}
