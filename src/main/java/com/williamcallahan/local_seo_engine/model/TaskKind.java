/**
 * Closed set of enrichment job kinds submitted to DataForSEO
 *
 * @author William Callahan
 *
 * Features:
 * - Stable storage code persisted in the ledger and used for synthetic error ids
 * - API section used to build task_post/tasks_ready/task_get paths
 * - Distinguishes polled kinds from synchronous (live) kinds
 * - Single normalization point for free-form kind strings from HTTP parameters
 */

package com.williamcallahan.local_seo_engine.model;

import java.util.Locale;
import java.util.Optional;

public enum TaskKind {
    REVIEWS("reviews", "reviews", true),
    BUSINESS_INFO("my_business_info", "my_business_info", true),
    UPDATES("my_business_updates", "my_business_updates", true),
    QUESTIONS_AND_ANSWERS("questions_and_answers", "questions_and_answers", true),
    SOCIAL_PROFILES("social_profiles", "my_business_info", false);

    private final String code;
    private final String apiSection;
    private final boolean polled;

    TaskKind(String code, String apiSection, boolean polled) {
        this.code = code;
        this.apiSection = apiSection;
        this.polled = polled;
    }

    /**
     * Storage code written to {@code enrichment_task.task_kind}
     */
    public String getCode() {
        return code;
    }

    /**
     * Path segment under {@code /v3/business_data/google/}
     */
    public String getApiSection() {
        return apiSection;
    }

    /**
     * Whether the kind completes asynchronously and shows up in a ready-list.
     * Non-polled kinds are submitted and fetched in the same call.
     */
    public boolean isPolled() {
        return polled;
    }

    /**
     * Normalizes a loosely formatted kind name ("Reviews", "my_business_info", "qa", "social-profiles").
     *
     * @param raw user or database supplied value
     * @return the matching kind, or empty for blank input, {@code "all"} or unknown values
     */
    public static Optional<TaskKind> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String compact = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        switch (compact) {
            case "reviews":
            case "review":
            case "googlereviews":
                return Optional.of(REVIEWS);
            case "mybusinessinfo":
            case "businessinfo":
            case "enhancedgoogledata":
                return Optional.of(BUSINESS_INFO);
            case "mybusinessupdates":
            case "updates":
            case "googleupdates":
                return Optional.of(UPDATES);
            case "questionsandanswers":
            case "qa":
            case "qanda":
            case "googlequestionsandanswers":
                return Optional.of(QUESTIONS_AND_ANSWERS);
            case "socialprofiles":
            case "social":
            case "googlesocialprofiles":
                return Optional.of(SOCIAL_PROFILES);
            default:
                return Optional.empty();
        }
    }

    /**
     * Strict lookup by storage code, used when reading ledger rows.
     *
     * @throws IllegalArgumentException when the stored code is unknown
     */
    public static TaskKind fromCode(String code) {
        return normalize(code).orElseThrow(() -> new IllegalArgumentException("Unknown task kind: " + code));
    }
}
