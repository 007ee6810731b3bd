package com.williamcallahan.local_seo_engine.util;

import com.williamcallahan.local_seo_engine.model.TaskStatus;

import java.util.Set;

/**
 * DataForSEO status code convention: [20000, 30000) success, &gt;= 40000 terminal failure,
 * anything else still processing. Codes listed as in-progress are treated as still processing
 * even though they sit in the failure range.
 */
public final class ProviderStatusCodes {

    public static final int OK = 20000;

    /** Invalid field in a task_post body. */
    public static final int INVALID_FIELD = 40501;

    private ProviderStatusCodes() {
    }

    public static boolean isSuccess(Integer code) {
        return code != null && code >= 20000 && code < 30000;
    }

    public static boolean isTerminalFailure(Integer code, Set<Integer> inProgressCodes) {
        return code != null && code >= 40000 && (inProgressCodes == null || !inProgressCodes.contains(code));
    }

    /**
     * Maps a status code reported by a callback or fetch to the ledger status it implies
     */
    public static TaskStatus toTaskStatus(Integer code, Set<Integer> inProgressCodes) {
        if (isSuccess(code)) {
            return TaskStatus.READY;
        }
        if (isTerminalFailure(code, inProgressCodes)) {
            return TaskStatus.ERROR;
        }
        return TaskStatus.PENDING;
    }
}
