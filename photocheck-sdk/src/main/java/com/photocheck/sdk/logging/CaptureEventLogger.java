package com.photocheck.sdk.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single-line JSON session events: capture_session_start, capture_state_changed,
 * capture_persisted and friends. Null context values are dropped.
 */
public final class CaptureEventLogger {

    private static final String TAG = "CaptureEvent";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CaptureEventLogger() {}

    public static void event(String event, Map<String, Object> context) {
        SafeLogger.i(TAG, toJson(event, context));
    }

    static String toJson(String event, Map<String, Object> context) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("event", event);
        if (context != null) {
            for (Map.Entry<String, Object> e : context.entrySet()) {
                if (e.getValue() != null) map.put(e.getKey(), e.getValue());
            }
        }
        try {
            return MAPPER.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            // context holds only strings, numbers and enums; fall back to a plain rendering
            return map.toString();
        }
    }
}
