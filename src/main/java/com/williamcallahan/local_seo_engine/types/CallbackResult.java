package com.williamcallahan.local_seo_engine.types;

/**
 * Reply to a provider postback
 */
public record CallbackResult(boolean accepted, String message) {

    public static CallbackResult accepted(String message) {
        return new CallbackResult(true, message);
    }

    public static CallbackResult rejected(String message) {
        return new CallbackResult(false, message);
    }
}
