package com.williamcallahan.local_seo_engine.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error payloads shared by the admin and postback controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, String> errorBody(String message) {
        return errorBody(message, null);
    }

    public static Map<String, String> errorBody(String message, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }

    /**
     * Body returned to the provider's postback: {@code {ok, message}}.
     */
    public static Map<String, Object> callbackBody(boolean ok, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", ok);
        body.put("message", message);
        return body;
    }
}
