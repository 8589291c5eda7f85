package com.photocheck.sdk.logging;

import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class SafeLoggerTest {

    @Test
    public void landmarkArrays_areMasked() {
        String out = SafeLogger.sanitize("points=[12.5, 30.25, -4.0] ok");
        assertEquals("points=[LANDMARKS_MASKED] ok", out);
    }

    @Test
    public void plainMessages_areUntouched() {
        assertEquals("frame ts=100 passed=true", SafeLogger.sanitize("frame ts=100 passed=true"));
        assertEquals("[1, 2]", SafeLogger.sanitize("[1, 2]"));
        assertEquals("(null)", SafeLogger.sanitize(null));
    }

    @Test
    public void eventJson_dropsNullValues() {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("sessionId", "booth-1");
        ctx.put("attempt", 2);
        ctx.put("cause", null);

        assertEquals("{\"event\":\"capture_state_changed\",\"sessionId\":\"booth-1\",\"attempt\":2}",
                CaptureEventLogger.toJson("capture_state_changed", ctx));
        assertEquals("{\"event\":\"capture_session_start\"}",
                CaptureEventLogger.toJson("capture_session_start", null));
    }
}
