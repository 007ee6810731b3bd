package com.williamcallahan.local_seo_engine.types;

/**
 * Outcome of materializing a single task
 */
public record PopulateResult(boolean success, String message, int itemCount) {

    public static PopulateResult ok(String message, int itemCount) {
        return new PopulateResult(true, message, itemCount);
    }

    public static PopulateResult failed(String message) {
        return new PopulateResult(false, message, 0);
    }
}
